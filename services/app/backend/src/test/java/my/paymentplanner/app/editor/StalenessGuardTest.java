package my.paymentplanner.app.editor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class StalenessGuardTest {
	private static final Executor DIRECT = Runnable::run;

	private final StalenessGuard guard = new StalenessGuard("calculation");
	private final List<String> applied = new ArrayList<>();
	private final List<Throwable> errors = new ArrayList<>();

	@Test
	void olderResultArrivingLateIsDiscarded() {
		CompletableFuture<String> first = new CompletableFuture<>();
		CompletableFuture<String> second = new CompletableFuture<>();

		CompletableFuture<Boolean> firstOutcome = guard.track(() -> first, DIRECT, applied::add, errors::add);
		CompletableFuture<Boolean> secondOutcome = guard.track(() -> second, DIRECT, applied::add, errors::add);
		second.complete("second");
		first.complete("first");

		assertThat(applied).containsExactly("second");
		assertThat(firstOutcome.join()).isFalse();
		assertThat(secondOutcome.join()).isTrue();
	}

	@Test
	void olderFailureArrivingLateIsDiscarded() {
		CompletableFuture<String> first = new CompletableFuture<>();
		CompletableFuture<String> second = new CompletableFuture<>();

		guard.track(() -> first, DIRECT, applied::add, errors::add);
		guard.track(() -> second, DIRECT, applied::add, errors::add);
		first.completeExceptionally(new IllegalStateException("timeout"));
		second.complete("second");

		assertThat(errors).isEmpty();
		assertThat(applied).containsExactly("second");
	}

	@Test
	void currentFailureIsReportedUnwrapped() {
		IllegalStateException cause = new IllegalStateException("down");

		boolean applied = guard.track(() -> CompletableFuture.<String>failedFuture(new CompletionException(cause)),
				DIRECT, this.applied::add, errors::add).join();

		assertThat(applied).isTrue();
		assertThat(errors).containsExactly(cause);
	}

	@Test
	void callThatThrowsIsReportedAsFailure() {
		guard.<String>track(() -> {
			throw new IllegalArgumentException("bad request");
		}, DIRECT, applied::add, errors::add);

		assertThat(errors).singleElement().extracting(Throwable::getMessage).isEqualTo("bad request");
	}

	@Test
	void invalidateMakesPendingCallStale() {
		CompletableFuture<String> pending = new CompletableFuture<>();
		guard.track(() -> pending, DIRECT, applied::add, errors::add);

		guard.invalidate();
		pending.complete("late");

		assertThat(applied).isEmpty();
		assertThat(guard.isCurrent(1)).isFalse();
		assertThat(guard.current()).isEqualTo(2);
	}
}

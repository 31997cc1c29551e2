package my.paymentplanner.app.editor;

import my.paymentplanner.app.error.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Hands out a ticket before every asynchronous call and applies the outcome only if no newer
 * ticket was issued meanwhile. Outcomes of older calls are dropped, failures included.
 */
public class StalenessGuard {
	private static final Logger logger = LoggerFactory.getLogger(StalenessGuard.class);

	private final String channel;
	private final AtomicLong counter = new AtomicLong();

	public StalenessGuard(String channel) {
		this.channel = channel;
	}

	public long issue() {
		return counter.incrementAndGet();
	}

	/**
	 * Makes every outstanding ticket stale without starting a new call.
	 */
	public void invalidate() {
		counter.incrementAndGet();
	}

	public boolean isCurrent(long ticket) {
		return counter.get() == ticket;
	}

	public long current() {
		return counter.get();
	}

	/**
	 * Issues a ticket, starts the call and routes its outcome through {@code applyOn}. The returned
	 * future completes with {@code true} when the outcome was applied and {@code false} when it was
	 * discarded as stale.
	 */
	public <T> CompletableFuture<Boolean> track(Supplier<CompletableFuture<T>> call,
	                                            Executor applyOn,
	                                            Consumer<T> onResult,
	                                            Consumer<Throwable> onError) {
		long ticket = issue();
		CompletableFuture<T> future;
		try {
			future = call.get();
		} catch (RuntimeException ex) {
			future = CompletableFuture.failedFuture(ex);
		}
		return future.handleAsync((value, error) -> {
			if (!isCurrent(ticket)) {
				logger.debug("Discarding stale {} outcome #{} (current #{})", channel, ticket, counter.get());
				return false;
			}
			if (error != null) {
				onError.accept(ErrorMessages.unwrap(error));
			} else {
				onResult.accept(value);
			}
			return true;
		}, applyOn);
	}
}

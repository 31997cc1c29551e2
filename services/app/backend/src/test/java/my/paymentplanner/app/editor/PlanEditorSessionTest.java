package my.paymentplanner.app.editor;

import my.paymentplanner.app.domain.CalculationMode;
import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.ProgramType;
import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.domain.SyncStatus;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.ScheduleItemDto;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.error.ErrorKind;
import my.paymentplanner.app.error.InvalidTransitionException;
import my.paymentplanner.app.error.PlanEngineException;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.service.EditabilityPolicy;
import my.paymentplanner.app.support.ManualScheduler;
import my.paymentplanner.app.support.PlanFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static my.paymentplanner.app.support.PlanFixtures.money;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanEditorSessionTest {
	private static final String CASE_ID = "CASE-1";

	private PlanEditorGateway gateway;
	private ManualScheduler scheduler;
	private RecordingListener listener;
	private PlanEditorSession session;

	@BeforeEach
	void setUp() {
		gateway = mock(PlanEditorGateway.class);
		scheduler = new ManualScheduler();
		listener = new RecordingListener();
		session = new PlanEditorSession(CASE_ID, gateway, new InteractiveGridController(new EditabilityPolicy(true)),
				scheduler, Duration.ofMillis(250), Runnable::run, listener,
				Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
	}

	private static VersionSummaryDto summary(long id, int number, boolean primary) {
		return new VersionSummaryDto(id, CASE_ID, number, PlanVersionStatus.DRAFT, primary, SyncStatus.IN_SYNC, null,
				null, "tester", 1, List.of());
	}

	private static PlanVersionDto version(long id, int number) {
		ScheduleItemDto item = new ScheduleItemDto(id * 10, 1, 1, PlanFixtures.FIRST_DATE, money("206.19"),
				money("0.00"), money("85.60"), money("35.00"), money("0.00"), money("0.00"), money("85.59"),
				money("13128.81"), ScheduleItemStatus.SCHEDULED, false, true, false);
		return new PlanVersionDto(id, CASE_ID, number, PlanVersionStatus.DRAFT, false, SyncStatus.IN_SYNC, null,
				money("14000.00"), money("300.00"), PlanFixtures.standard().build(), null, "tester", List.of(),
				List.of(item));
	}

	private static PlanRequest request() {
		return new PlanRequest(ProgramType.STANDARD_SPLIT, null, CalculationMode.DESIRED_AMOUNT, null, money("171.19"),
				null, null, null, null, null, null, null, money("14000.00"), money("300.00"));
	}

	private static ScheduleTotalsDto totals(String draftAmount) {
		return new ScheduleTotalsDto(1, money(draftAmount), null, null, null, null, null, null, null, null, null,
				null, null, null, null, null, null);
	}

	@Test
	void startOpensPrimaryVersion() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(
				List.of(summary(2L, 2, false), summary(1L, 1, true))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));

		session.start().join();

		assertThat(session.versions()).hasSize(2);
		assertThat(session.state().versionId()).isEqualTo(1L);
		assertThat(session.state().visibleRows()).hasSize(1);
	}

	@Test
	void parameterChangesAreDebouncedIntoOneCalculation() {
		PlanRequest request = request();
		ScheduleResult result = new ScheduleResult(List.of(), null);
		when(gateway.calculate(request)).thenReturn(CompletableFuture.completedFuture(result));

		session.parametersChanged(request);
		session.parametersChanged(request);
		session.parametersChanged(request);
		scheduler.runPending();

		verify(gateway, times(1)).calculate(request);
		assertThat(listener.calculations).containsExactly(result);
	}

	@Test
	void lateCalculationIsDiscarded() {
		PlanRequest request = request();
		CompletableFuture<ScheduleResult> first = new CompletableFuture<>();
		CompletableFuture<ScheduleResult> second = new CompletableFuture<>();
		when(gateway.calculate(request)).thenReturn(first, second);
		ScheduleResult stale = new ScheduleResult(List.of(), null);
		ScheduleResult fresh = new ScheduleResult(new ArrayList<>(), null);

		session.parametersChanged(request);
		session.calculateNow();
		session.calculateNow();
		second.complete(fresh);
		first.complete(stale);

		assertThat(listener.calculations).hasSize(1);
		assertThat(listener.calculations.get(0)).isSameAs(fresh);
	}

	@Test
	void selectingAnotherVersionDiscardsOutstandingTotals() {
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		when(gateway.loadVersion(2L)).thenReturn(CompletableFuture.completedFuture(version(2L, 2)));
		CompletableFuture<ScheduleTotalsDto> pendingTotals = new CompletableFuture<>();
		when(gateway.previewTotals(anyList())).thenReturn(pendingTotals);

		session.selectVersion(1L);
		session.editCell(0, GridField.PAYMENT_AMOUNT, "250");
		scheduler.runPending();
		session.selectVersion(2L);
		pendingTotals.complete(totals("250.00"));

		assertThat(listener.totals).isEmpty();
		assertThat(session.state().versionId()).isEqualTo(2L);
		assertThat(session.state().hasChanges()).isFalse();
	}

	@Test
	void selectingAnotherVersionCancelsPendingTotals() {
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		when(gateway.loadVersion(2L)).thenReturn(CompletableFuture.completedFuture(version(2L, 2)));

		session.selectVersion(1L);
		session.editCell(0, GridField.PAYMENT_AMOUNT, "250");
		session.selectVersion(2L);
		scheduler.runPending();

		verify(gateway, never()).previewTotals(anyList());
	}

	@Test
	void failedPrimaryChangeRestoresVersionList() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(
				List.of(summary(2L, 2, false), summary(1L, 1, true))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		CompletableFuture<VersionSummaryDto> refused = new CompletableFuture<>();
		when(gateway.setPrimary(2L)).thenReturn(refused);
		session.start().join();

		session.makePrimary(2L);
		assertThat(session.versions()).filteredOn(VersionSummaryDto::primary)
				.extracting(VersionSummaryDto::id).containsExactly(2L);

		refused.completeExceptionally(new InvalidTransitionException(2L, "set primary", "DRAFT (out of sync)"));

		assertThat(session.versions()).filteredOn(VersionSummaryDto::primary)
				.extracting(VersionSummaryDto::id).containsExactly(1L);
		assertThat(listener.errors).singleElement().extracting(PlanEngineException::getKind)
				.isEqualTo(ErrorKind.INVALID_TRANSITION);
	}

	@Test
	void overlappingRefusedPrimaryChangesRestoreConfirmedPrimary() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(
				List.of(summary(1L, 1, true), summary(2L, 2, false), summary(3L, 3, false))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		CompletableFuture<VersionSummaryDto> refusedSecond = new CompletableFuture<>();
		CompletableFuture<VersionSummaryDto> refusedThird = new CompletableFuture<>();
		when(gateway.setPrimary(2L)).thenReturn(refusedSecond);
		when(gateway.setPrimary(3L)).thenReturn(refusedThird);
		session.start().join();

		session.makePrimary(2L);
		session.makePrimary(3L);
		refusedThird.completeExceptionally(new InvalidTransitionException(3L, "set primary", "DRAFT (out of sync)"));
		refusedSecond.completeExceptionally(new InvalidTransitionException(2L, "set primary", "DRAFT (out of sync)"));

		assertThat(session.versions()).filteredOn(VersionSummaryDto::primary)
				.extracting(VersionSummaryDto::id).containsExactly(1L);
		assertThat(listener.errors).singleElement().extracting(PlanEngineException::getKind)
				.isEqualTo(ErrorKind.INVALID_TRANSITION);
		verify(gateway, times(2)).loadVersions(CASE_ID);
	}

	@Test
	void confirmedPrimaryChangeRefreshesVersions() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(
				List.of(summary(2L, 2, false), summary(1L, 1, true))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		when(gateway.setPrimary(2L)).thenReturn(CompletableFuture.completedFuture(summary(2L, 2, true)));
		session.start().join();

		session.makePrimary(2L).join();

		verify(gateway, times(2)).loadVersions(CASE_ID);
		assertThat(listener.errors).isEmpty();
	}

	@Test
	void unexpectedFailureIsReportedAsCalculationServiceError() {
		when(gateway.loadVersion(9L)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("gone")));

		session.selectVersion(9L).join();

		assertThat(listener.errors).singleElement().satisfies(error -> {
			assertThat(error.getKind()).isEqualTo(ErrorKind.CALCULATION_SERVICE);
			assertThat(error.getMessage()).isEqualTo("gone");
		});
	}

	@Test
	void invalidationKeepsUnsavedEdits() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(List.of(summary(1L, 1, true))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		session.start().join();
		session.editCell(0, GridField.SETUP_FEE, "10");

		session.onInvalidation(CASE_ID);

		verify(gateway, times(1)).loadVersion(1L);
		assertThat(session.state().hasChanges()).isTrue();
		assertThat(session.state().message()).startsWith("Plan versions changed");
	}

	@Test
	void invalidationReloadsCleanVersion() {
		when(gateway.loadVersions(CASE_ID)).thenReturn(CompletableFuture.completedFuture(List.of(summary(1L, 1, true))));
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		session.start().join();

		session.onInvalidation("OTHER-CASE");
		session.onInvalidation(CASE_ID);

		verify(gateway, times(2)).loadVersion(1L);
	}

	@Test
	void addRowUsesConfiguredFees() {
		when(gateway.loadVersion(1L)).thenReturn(CompletableFuture.completedFuture(version(1L, 1)));
		session.selectVersion(1L);

		session.addRow();

		GridRow added = session.state().visibleRows().get(1);
		assertThat(added.newRow()).isTrue();
		assertThat(added.bankingFee()).isEqualByComparingTo("35.00");
		assertThat(added.paymentDate()).isEqualTo(PlanFixtures.FIRST_DATE.plusWeeks(1));
	}

	@Test
	void closedSessionIgnoresOutcomes() {
		CompletableFuture<PlanVersionDto> pending = new CompletableFuture<>();
		when(gateway.loadVersion(1L)).thenReturn(pending);

		session.selectVersion(1L);
		session.close();
		pending.complete(version(1L, 1));

		assertThat(session.state().versionId()).isNull();
		verify(gateway, never()).saveEdits(any(), any());
	}

	private static final class RecordingListener implements EditorListener {
		private final List<ScheduleResult> calculations = new ArrayList<>();
		private final List<ScheduleTotalsDto> totals = new ArrayList<>();
		private final List<PlanEngineException> errors = new ArrayList<>();

		@Override
		public void onCalculation(ScheduleResult result) {
			calculations.add(result);
		}

		@Override
		public void onTotals(ScheduleTotalsDto value) {
			totals.add(value);
		}

		@Override
		public void onError(PlanEngineException error) {
			errors.add(error);
		}
	}
}

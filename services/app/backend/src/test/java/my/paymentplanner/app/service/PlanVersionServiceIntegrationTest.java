package my.paymentplanner.app.service;

import my.paymentplanner.app.AppApplication;
import my.paymentplanner.app.domain.CalculationMode;
import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.ProgramType;
import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.domain.SyncStatus;
import my.paymentplanner.app.dto.CreateVersionRequest;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.RecalculateRequest;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.ScheduleItemDto;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.dto.WireFeeDto;
import my.paymentplanner.app.dto.WireFeeRequest;
import my.paymentplanner.app.error.InvalidTransitionException;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static my.paymentplanner.app.support.PlanFixtures.money;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class PlanVersionServiceIntegrationTest {
	private static final String CASE_ID = "CASE-100";

	@Autowired
	private PlanVersionService planVersionService;

	@Autowired
	private WireFeeService wireFeeService;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	private PlanVersionDto createVersion() {
		PlanRequest plan = new PlanRequest(ProgramType.STANDARD_SPLIT, PaymentFrequency.WEEKLY,
				CalculationMode.DESIRED_AMOUNT, null, money("171.19"), null, null, null, LocalDate.of(2026, 1, 5),
				null, null, null, money("14000.00"), money("300.00"));
		return planVersionService.create(CASE_ID, new CreateVersionRequest(plan, "tester"));
	}

	private static ScheduleRowEdit edit(ScheduleItemDto item, ScheduleItemStatus status) {
		return new ScheduleRowEdit(item.id(), item.paymentDate(), item.paymentAmount(), item.setupFeePortion(),
				item.programFeePortion(), item.bankingFeePortion(), item.secondaryBankingFeePortion(),
				item.additionalProductsPortion(), status);
	}

	/**
	 * Saves {@code version} with its first {@code count} rows marked cleared.
	 */
	private PlanVersionDto clearFirst(PlanVersionDto version, int count) {
		List<ScheduleRowEdit> rows = new ArrayList<>();
		for (int i = 0; i < version.items().size(); i++) {
			ScheduleItemDto item = version.items().get(i);
			rows.add(edit(item, i < count ? ScheduleItemStatus.CLEARED : item.status()));
		}
		return planVersionService.saveEdits(version.id(), new SaveEditsRequest(rows, "tester"));
	}

	private VersionSummaryDto summary(Long versionId) {
		return planVersionService.listVersions(CASE_ID).stream()
				.filter(version -> version.id().equals(versionId))
				.findFirst()
				.orElseThrow();
	}

	@Test
	void firstVersionOfCaseIsPrimaryDraft() {
		PlanVersionDto first = createVersion();
		PlanVersionDto second = createVersion();

		assertThat(first.status()).isEqualTo(PlanVersionStatus.DRAFT);
		assertThat(first.primary()).isTrue();
		assertThat(first.versionNumber()).isEqualTo(1);
		assertThat(first.items()).hasSize(78);
		assertThat(first.items().get(77).runningBalance()).isEqualByComparingTo("0.00");
		assertThat(second.primary()).isFalse();
		assertThat(second.versionNumber()).isEqualTo(2);
		assertThat(planVersionService.getVersion(first.id()).configuration().targetAmount())
				.isEqualByComparingTo("171.19");
	}

	@Test
	void savedEditsSupersedeTheDraft() {
		PlanVersionDto first = createVersion();

		PlanVersionDto saved = clearFirst(first, 3);

		assertThat(saved.versionNumber()).isEqualTo(2);
		assertThat(saved.supersedesId()).isEqualTo(first.id());
		assertThat(saved.primary()).isTrue();
		assertThat(saved.items()).extracting(ScheduleItemDto::status).startsWith(ScheduleItemStatus.CLEARED,
				ScheduleItemStatus.CLEARED, ScheduleItemStatus.CLEARED, ScheduleItemStatus.SCHEDULED);
		assertThat(saved.items().get(2).runningBalance()).isEqualByComparingTo("12786.43");
		assertThat(saved.items().get(0).changedFromPrevious()).isTrue();
		assertThat(saved.items().get(3).changedFromPrevious()).isFalse();
		assertThat(summary(first.id()).status()).isEqualTo(PlanVersionStatus.ARCHIVED);
		assertThat(summary(first.id()).primary()).isFalse();
	}

	@Test
	void rowsLeftOutOfEditsAreDropped() {
		PlanVersionDto first = createVersion();
		List<ScheduleRowEdit> rows = new ArrayList<>();
		for (ScheduleItemDto item : first.items().subList(0, 77)) {
			rows.add(edit(item, item.status()));
		}

		PlanVersionDto saved = planVersionService.saveEdits(first.id(), new SaveEditsRequest(rows, null));

		assertThat(saved.items()).hasSize(77);
		assertThat(saved.items().get(76).sequenceNumber()).isEqualTo(77);
		assertThat(saved.createdBy()).isEqualTo("system");
	}

	@Test
	void editsCannotSubmitForeignItems() {
		PlanVersionDto first = createVersion();
		ScheduleItemDto item = first.items().get(0);
		ScheduleRowEdit foreign = new ScheduleRowEdit(item.id() + 10_000, item.paymentDate(), item.paymentAmount(),
				null, null, null, null, null, ScheduleItemStatus.SCHEDULED);

		assertThatThrownBy(() -> planVersionService.saveEdits(first.id(), new SaveEditsRequest(List.of(foreign), null)))
				.isInstanceOf(PlanValidationException.class);
	}

	@Test
	void settledRowStatusCannotBeChangedByEdits() {
		PlanVersionDto cleared = clearFirst(createVersion(), 2);
		List<ScheduleRowEdit> rows = new ArrayList<>();
		for (int i = 0; i < cleared.items().size(); i++) {
			ScheduleItemDto item = cleared.items().get(i);
			rows.add(edit(item, i == 1 ? ScheduleItemStatus.NSF : item.status()));
		}

		assertThatThrownBy(() -> planVersionService.saveEdits(cleared.id(), new SaveEditsRequest(rows, "tester")))
				.isInstanceOf(PlanValidationException.class)
				.hasMessageContaining("is CLEARED and its status cannot be changed");
		assertThat(summary(cleared.id()).status()).isEqualTo(PlanVersionStatus.DRAFT);
	}

	@Test
	void recalculateKeepsFrozenRowsVerbatim() {
		PlanVersionDto edited = clearFirst(createVersion(), 3);

		PlanVersionDto recalculated = planVersionService.recalculate(edited.id(), new RecalculateRequest(null, null, "tester"));

		assertThat(recalculated.items()).hasSize(78);
		for (int i = 0; i < 3; i++) {
			ScheduleItemDto before = edited.items().get(i);
			ScheduleItemDto after = recalculated.items().get(i);
			assertThat(after.status()).isEqualTo(ScheduleItemStatus.CLEARED);
			assertThat(after.paymentDate()).isEqualTo(before.paymentDate());
			assertThat(after.paymentAmount()).isEqualByComparingTo(before.paymentAmount());
			assertThat(after.escrowAmount()).isEqualByComparingTo(before.escrowAmount());
			assertThat(after.runningBalance()).isEqualByComparingTo(before.runningBalance());
		}
		assertThat(recalculated.items().get(3).paymentDate()).isEqualTo(LocalDate.of(2026, 1, 26));
		assertThat(recalculated.items().get(77).runningBalance()).isEqualByComparingTo("0.00");
		assertThat(summary(edited.id()).status()).isEqualTo(PlanVersionStatus.ARCHIVED);
	}

	@Test
	void recalculateUsesRefreshedDebt() {
		PlanVersionDto first = createVersion();

		PlanVersionDto recalculated = planVersionService.recalculate(first.id(),
				new RecalculateRequest(money("7000.00"), null, null));

		assertThat(recalculated.totalDebt()).isEqualByComparingTo("7000.00");
		assertThat(recalculated.items()).hasSize(39);
	}

	@Test
	void suspendCancelsScheduledRowsOnly() {
		PlanVersionDto edited = clearFirst(createVersion(), 3);
		planVersionService.activate(edited.id());

		PlanVersionDto suspended = planVersionService.suspend(edited.id(), "tester");

		assertThat(suspended.status()).isEqualTo(PlanVersionStatus.SUSPENDED);
		assertThat(suspended.primary()).isTrue();
		assertThat(suspended.items()).hasSize(78);
		assertThat(suspended.items()).filteredOn(item -> item.status() == ScheduleItemStatus.CLEARED).hasSize(3);
		assertThat(suspended.items()).filteredOn(item -> item.status() == ScheduleItemStatus.CANCELLED).hasSize(75);
		assertThat(suspended.items()).noneMatch(ScheduleItemDto::editable);
		assertThat(summary(edited.id()).status()).isEqualTo(PlanVersionStatus.ARCHIVED);
		assertThatThrownBy(() -> planVersionService.suspend(suspended.id(), null))
				.isInstanceOf(InvalidTransitionException.class);
	}

	@Test
	void activationArchivesPreviousActiveVersion() {
		PlanVersionDto first = createVersion();
		PlanVersionDto second = createVersion();
		planVersionService.activate(first.id());

		VersionSummaryDto activated = planVersionService.activate(second.id());

		assertThat(activated.status()).isEqualTo(PlanVersionStatus.ACTIVE);
		assertThat(activated.primary()).isTrue();
		assertThat(summary(first.id()).status()).isEqualTo(PlanVersionStatus.ARCHIVED);
		assertThat(planVersionService.listVersions(CASE_ID)).filteredOn(VersionSummaryDto::primary).hasSize(1);
	}

	@Test
	void setPrimaryKeepsExactlyOnePrimary() {
		PlanVersionDto first = createVersion();
		PlanVersionDto second = createVersion();

		planVersionService.setPrimary(second.id());

		assertThat(planVersionService.listVersions(CASE_ID)).filteredOn(VersionSummaryDto::primary)
				.extracting(VersionSummaryDto::id)
				.containsExactly(second.id());
		assertThat(summary(first.id()).primary()).isFalse();
	}

	@Test
	void deleteRules() {
		PlanVersionDto first = createVersion();
		PlanVersionDto second = createVersion();

		assertThatThrownBy(() -> planVersionService.delete(first.id()))
				.isInstanceOf(InvalidTransitionException.class);

		planVersionService.delete(second.id());
		assertThat(planVersionService.listVersions(CASE_ID)).hasSize(1);

		assertThatThrownBy(() -> planVersionService.delete(second.id()))
				.isInstanceOfSatisfying(InvalidTransitionException.class,
						ex -> assertThat(ex.getActual()).isEqualTo(InvalidTransitionException.MISSING));
	}

	@Test
	void activeVersionCannotBeDeleted() {
		PlanVersionDto first = createVersion();
		PlanVersionDto second = createVersion();
		planVersionService.activate(second.id());

		assertThatThrownBy(() -> planVersionService.delete(second.id()))
				.isInstanceOf(InvalidTransitionException.class);
		planVersionService.delete(first.id());
	}

	@Test
	void invalidatedDraftMustBeRecalculated() {
		createVersion();
		PlanVersionDto second = createVersion();

		assertThat(planVersionService.invalidate(CASE_ID)).isEqualTo(2);
		assertThat(planVersionService.invalidate(CASE_ID)).isZero();

		assertThatThrownBy(() -> planVersionService.setPrimary(second.id()))
				.isInstanceOf(InvalidTransitionException.class);
		assertThatThrownBy(() -> planVersionService.activate(second.id()))
				.isInstanceOf(InvalidTransitionException.class);

		PlanVersionDto recalculated = planVersionService.recalculate(second.id(), null);
		assertThat(recalculated.syncStatus()).isEqualTo(SyncStatus.IN_SYNC);
		assertThat(summary(second.id()).status()).isEqualTo(PlanVersionStatus.ARCHIVED);
	}

	@Test
	void wireFeesFollowCarriedRows() {
		PlanVersionDto edited = clearFirst(createVersion(), 1);
		Long clearedItem = edited.items().get(0).id();
		wireFeeService.add(clearedItem, new WireFeeRequest("Wire Received Fee", money("15.00")));

		PlanVersionDto recalculated = planVersionService.recalculate(edited.id(), null);

		Long carriedItem = recalculated.items().get(0).id();
		Map<Long, List<WireFeeDto>> fees = wireFeeService.listByVersion(recalculated.id());
		assertThat(fees).containsOnlyKeys(carriedItem);
		assertThat(fees.get(carriedItem)).extracting(WireFeeDto::feeType).containsExactly("Wire Received Fee");
		assertThat(planVersionService.totals(recalculated.id()).totalWiresReceived()).isEqualByComparingTo("15.00");
		assertThat(wireFeeService.listByVersion(edited.id())).containsOnlyKeys(clearedItem);
	}

	@Test
	void rebalanceSpreadsRemainingBalance() {
		PlanVersionDto edited = clearFirst(createVersion(), 2);

		PlanVersionDto rebalanced = planVersionService.recalculateRemainingBalance(edited.id(), "tester");

		assertThat(rebalanced.items()).hasSize(78);
		assertThat(rebalanced.items().get(2).escrowAmount().add(rebalanced.items().get(2).programFeePortion()))
				.isEqualByComparingTo(new BigDecimal("170.50"));
		assertThat(rebalanced.items().get(77).runningBalance()).isEqualByComparingTo("0.00");
	}
}

package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.Adjustment;
import my.paymentplanner.app.model.AmountEstimate;
import my.paymentplanner.app.model.DurationEstimate;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.PlanTotals;
import my.paymentplanner.app.model.ProgramCost;
import my.paymentplanner.app.model.ScheduleLine;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.service.util.Money;
import my.paymentplanner.app.support.PlanFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static my.paymentplanner.app.support.PlanFixtures.money;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScheduleCalculatorTest {
	private static final PlanTotals TOTALS = new PlanTotals(money("14000.00"), money("300.00"));

	private final FeeDecomposer feeDecomposer = new FeeDecomposer();
	private final ScheduleCalculator calculator = new ScheduleCalculator(new BoundsEnforcer(), feeDecomposer);

	@Test
	void programCostMatchesReferenceScenario() {
		ProgramCost cost = calculator.programCost(PlanFixtures.standard().build(), TOTALS);

		assertThat(cost.settlementAmount()).isEqualByComparingTo("8400.00");
		assertThat(cost.programFee()).isEqualByComparingTo("4900.00");
		assertThat(cost.totalProgramCost()).isEqualByComparingTo("13300.00");
	}

	@Test
	void forwardDirectionMatchesReferenceScenario() {
		DurationEstimate estimate = calculator.durationFromAmount(PlanFixtures.standard().build(), TOTALS, money("206.19"));

		assertThat(estimate.netPerPeriod()).isEqualByComparingTo("171.19");
		assertThat(estimate.numberOfPeriods()).isEqualTo(78);
		assertThat(estimate.clamped()).isFalse();
	}

	@Test
	void forwardDirectionUsesPlainCeiling() {
		DurationEstimate estimate = calculator.durationFromAmount(PlanFixtures.standard().build(), TOTALS, money("205.51"));

		assertThat(estimate.netPerPeriod()).isEqualByComparingTo("170.51");
		assertThat(estimate.numberOfPeriods()).isEqualTo(79);
	}

	@Test
	void inverseOfForwardKeepsTheDuration() {
		PlanConfiguration configuration = PlanFixtures.standard().build();
		for (int cents = 15000; cents <= 40000; cents += 137) {
			BigDecimal payment = BigDecimal.valueOf(cents, 2);
			DurationEstimate forward = calculator.durationFromAmount(configuration, TOTALS, payment);
			AmountEstimate inverse = calculator.amountFromDuration(configuration, TOTALS, forward.numberOfPeriods());
			DurationEstimate again = calculator.durationFromAmount(configuration, TOTALS, inverse.periodPayment());

			assertThat(again.numberOfPeriods()).as("payment %s", payment).isEqualTo(forward.numberOfPeriods());
			assertThat(inverse.periodPayment()).as("payment %s", payment).isLessThanOrEqualTo(payment);
		}
	}

	@Test
	void amountSurvivesRoundTripThroughDuration() {
		PlanConfiguration configuration = PlanFixtures.standard().build();
		for (int periods = 40; periods <= 204; periods++) {
			BigDecimal payment = calculator.amountFromDuration(configuration, TOTALS, periods).periodPayment();

			DurationEstimate forward = calculator.durationFromAmount(configuration, TOTALS, payment);
			AmountEstimate inverse = calculator.amountFromDuration(configuration, TOTALS, forward.numberOfPeriods());

			assertThat(forward.numberOfPeriods()).as("periods %s", periods).isEqualTo(periods);
			assertThat(inverse.periodPayment()).as("payment %s", payment).isCloseTo(payment, within(Money.CENT));
		}
	}

	@Test
	void inverseDirectionRoundsUpToTheCent() {
		AmountEstimate estimate = calculator.amountFromDuration(PlanFixtures.standard().build(), TOTALS, 78);

		assertThat(estimate.netPerPeriod()).isEqualByComparingTo("170.52");
		assertThat(estimate.periodPayment()).isEqualByComparingTo("205.52");
	}

	@Test
	void inverseRejectsDurationOutsideProgramWeeks() {
		PlanConfiguration configuration = PlanFixtures.standard().weeks(10, 100).build();

		assertThatThrownBy(() -> calculator.amountFromDuration(configuration, TOTALS, 120))
				.isInstanceOfSatisfying(PlanValidationException.class, ex -> {
					assertThat(ex.getField()).isEqualTo("targetPeriods");
					assertThat(ex.getBound()).isEqualByComparingTo("100");
				});
	}

	@Test
	void forwardRejectsPaymentNotCoveringRecurringFees() {
		assertThatThrownBy(() -> calculator.durationFromAmount(PlanFixtures.standard().build(), TOTALS, money("30.00")))
				.isInstanceOf(PlanValidationException.class);
	}

	@Test
	void generatedRowsAddUpAndBalanceReachesZero() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().setupFee("100.00", 3)
				.secondaryBankingFee("2.50").productsTotal("5.00").build(), TOTALS);

		List<ScheduleLine> schedule = result.schedule();
		assertThat(schedule).hasSize(78);
		BigDecimal previousBalance = result.summary().totalProgramCost();
		for (ScheduleLine line : schedule) {
			assertThat(Money.withinCent(line.portionsTotal(), line.paymentAmount())).isTrue();
			assertThat(line.runningBalance()).isLessThanOrEqualTo(previousBalance);
			previousBalance = line.runningBalance();
		}
		assertThat(schedule.get(schedule.size() - 1).runningBalance()).isEqualByComparingTo("0.00");
	}

	@Test
	void splitsContributionByRatio() {
		ScheduleLine first = calculator.calculate(PlanFixtures.standard().build(), TOTALS).schedule().get(0);

		assertThat(first.sequenceNumber()).isEqualTo(1);
		assertThat(first.paymentDate()).isEqualTo(PlanFixtures.FIRST_DATE);
		assertThat(first.paymentAmount()).isEqualByComparingTo("206.19");
		assertThat(first.bankingFeePortion()).isEqualByComparingTo("35.00");
		assertThat(first.programFeePortion()).isEqualByComparingTo("85.60");
		assertThat(first.escrowAmount()).isEqualByComparingTo("85.59");
		assertThat(first.status()).isEqualTo(ScheduleItemStatus.SCHEDULED);
	}

	@Test
	void setupFeeIsSpreadOverFirstPayments() {
		List<ScheduleLine> schedule = calculator.calculate(PlanFixtures.standard().setupFee("100.00", 3).build(), TOTALS)
				.schedule();

		assertThat(schedule.get(0).setupFeePortion()).isEqualByComparingTo("33.33");
		assertThat(schedule.get(1).setupFeePortion()).isEqualByComparingTo("33.33");
		assertThat(schedule.get(2).setupFeePortion()).isEqualByComparingTo("33.34");
		assertThat(schedule.get(3).setupFeePortion()).isEqualByComparingTo("0.00");
		assertThat(schedule.get(0).paymentAmount()).isEqualByComparingTo("239.52");
	}

	@Test
	void desiredDurationUsesInverseDirection() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().periods(52).build(), TOTALS);

		assertThat(result.schedule()).hasSize(52);
		assertThat(result.summary().netPerPeriod()).isEqualByComparingTo("255.77");
		assertThat(result.schedule().get(51).programFeePortion().add(result.schedule().get(51).escrowAmount()))
				.isEqualByComparingTo("255.73");
	}

	@Test
	void clampedDurationIsReportedAsAdjustment() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().weeks(1, 52).build(), TOTALS);

		assertThat(result.schedule()).hasSize(52);
		assertThat(result.summary().adjustments())
				.extracting(Adjustment::field)
				.contains("numberOfPeriods", "netPerPeriod");
		Adjustment periods = result.summary().adjustments().stream()
				.filter(adjustment -> adjustment.field().equals("numberOfPeriods"))
				.findFirst()
				.orElseThrow();
		assertThat(periods.requested()).isEqualByComparingTo("78");
		assertThat(periods.applied()).isEqualByComparingTo("52");
		assertThat(result.schedule().get(51).runningBalance()).isEqualByComparingTo("0.00");
	}

	@Test
	void percentBelowMinimumIsClampedAndReported() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().percent("30").build(), TOTALS);

		assertThat(result.summary().netPerPeriod()).isEqualByComparingTo("120.00");
		assertThat(result.summary().adjustments())
				.anySatisfy(adjustment -> {
					assertThat(adjustment.field()).isEqualTo("targetPercent");
					assertThat(adjustment.applied()).isEqualByComparingTo("40");
					assertThat(adjustment.delta()).isEqualByComparingTo("10");
				});
	}

	@Test
	void desiredAmountOutsideBoundsIsRejected() {
		PlanConfiguration configuration = PlanFixtures.standard().amount("100.00").build();

		assertThatThrownBy(() -> calculator.calculate(configuration, TOTALS))
				.isInstanceOf(PlanValidationException.class)
				.hasMessageContaining("at least");
	}

	@Test
	void monthlyScheduleStepsByMonth() {
		PlanConfiguration configuration = PlanFixtures.standard().monthly().amount("741.25").build();

		ScheduleResult result = calculator.calculate(configuration, TOTALS);

		assertThat(result.schedule()).hasSize(18);
		assertThat(result.schedule().get(1).paymentDate()).isEqualTo(LocalDate.of(2026, 2, 5));
		assertThat(result.summary().weeklyPayment()).isEqualByComparingTo("179.27");
		assertThat(calculator.maxPeriods(configuration)).isEqualTo(47);
	}

	@Test
	void snapsDatesToPreferredWeekday() {
		List<ScheduleLine> schedule = calculator.calculate(PlanFixtures.standard().weekday(DayOfWeek.FRIDAY).build(), TOTALS)
				.schedule();

		assertThat(schedule.get(0).paymentDate()).isEqualTo(LocalDate.of(2026, 1, 9));
		assertThat(schedule.get(1).paymentDate()).isEqualTo(LocalDate.of(2026, 1, 16));
	}

	@Test
	void noFeeProgramSizesWithBaselineButChargesNothing() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().noFee().build(), TOTALS);

		assertThat(result.summary().programFee()).isEqualByComparingTo("0.00");
		assertThat(result.summary().baselineProgramFee()).isEqualByComparingTo("4900.00");
		assertThat(result.schedule()).hasSize(78);
		assertThat(result.schedule()).allSatisfy(line -> assertThat(line.programFeePortion()).isEqualByComparingTo("0.00"));
	}

	@Test
	void summaryReportsSavingsAgainstCurrentPayment() {
		ScheduleResult result = calculator.calculate(PlanFixtures.standard().build(), TOTALS);

		assertThat(result.summary().periodPayment()).isEqualByComparingTo("206.19");
		assertThat(result.summary().weeklySavings()).isEqualByComparingTo("93.81");
		assertThat(result.summary().savingsPercent()).isEqualByComparingTo("31.27");
	}

	@Test
	void regenerationLeavesFrozenRowsUntouched() {
		PlanConfiguration configuration = PlanFixtures.standard().build();
		List<ScheduleLine> original = calculator.calculate(configuration, TOTALS).schedule();
		List<ScheduleLine> frozen = new ArrayList<>();
		frozen.add(original.get(0).withStatus(ScheduleItemStatus.CLEARED));
		frozen.add(original.get(1).withStatus(ScheduleItemStatus.CLEARED));
		frozen.add(original.get(2).withStatus(ScheduleItemStatus.CLEARED));
		frozen.add(original.get(3).withStatus(ScheduleItemStatus.NSF));

		ScheduleResult result = calculator.regenerate(configuration, new PlanTotals(money("14000.00"), money("280.00")), frozen);

		assertThat(result.schedule().subList(0, 4)).containsExactlyElementsOf(frozen);
		ScheduleLine firstNew = result.schedule().get(4);
		assertThat(firstNew.sequenceNumber()).isEqualTo(5);
		assertThat(firstNew.paymentDate()).isEqualTo(frozen.get(3).paymentDate().plusWeeks(1));
		BigDecimal funded = result.schedule().stream()
				.filter(line -> line.status() != ScheduleItemStatus.NSF)
				.map(ScheduleLine::contribution)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		assertThat(funded).isEqualByComparingTo("13300.00");
	}

	@Test
	void rebalanceSpreadsRemainingOverScheduledRows() {
		PlanConfiguration configuration = PlanFixtures.standard().build();
		List<ScheduleLine> rows = new ArrayList<>(calculator.calculate(configuration, TOTALS).schedule());
		rows.set(0, rows.get(0).withStatus(ScheduleItemStatus.CLEARED));
		rows.set(1, rows.get(1).withStatus(ScheduleItemStatus.CLEARED));

		List<ScheduleLine> rebalanced = calculator.rebalanceRemaining(configuration, TOTALS, rows);

		assertThat(rebalanced.get(0)).isEqualTo(rows.get(0));
		assertThat(rebalanced.get(1)).isEqualTo(rows.get(1));
		assertThat(rebalanced.get(2).contribution()).isEqualByComparingTo("170.50");
		assertThat(rebalanced.get(2).paymentDate()).isEqualTo(rows.get(2).paymentDate());
		assertThat(rebalanced.get(rebalanced.size() - 1).runningBalance()).isEqualByComparingTo("0.00");
	}
}

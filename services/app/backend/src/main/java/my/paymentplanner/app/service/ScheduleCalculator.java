package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.Adjustment;
import my.paymentplanner.app.model.AmountEstimate;
import my.paymentplanner.app.model.BoundedAmount;
import my.paymentplanner.app.model.DurationEstimate;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.PlanTotals;
import my.paymentplanner.app.model.ProgramCost;
import my.paymentplanner.app.model.ScheduleLine;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.model.ScheduleSummary;
import my.paymentplanner.app.service.util.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a resolved {@link PlanConfiguration} and the case totals into a dated schedule.
 * <p>
 * Periods follow the payment frequency. The forward direction sizes the schedule from a payment;
 * the inverse derives the payment from a number of periods. The forward ceiling allows half a cent
 * per period so that a payment produced by the inverse maps back to the same duration.
 * <p>
 * Pure and stateless.
 */
@Component
public class ScheduleCalculator {
	private final BoundsEnforcer boundsEnforcer;
	private final FeeDecomposer feeDecomposer;

	public ScheduleCalculator(BoundsEnforcer boundsEnforcer, FeeDecomposer feeDecomposer) {
		this.boundsEnforcer = boundsEnforcer;
		this.feeDecomposer = feeDecomposer;
	}

	public ProgramCost programCost(PlanConfiguration configuration, PlanTotals totals) {
		if (!Money.isPositive(totals.totalDebt())) {
			throw new PlanValidationException("totalDebt", "Total debt must be positive");
		}
		BigDecimal settlement = Money.percentOf(totals.totalDebt(), configuration.settlementPercent());
		BigDecimal baselineFee = Money.percentOf(totals.totalDebt(), configuration.programFeePercent());
		BigDecimal chargedFee = configuration.noFeeProgram() ? Money.ZERO : baselineFee;
		return new ProgramCost(settlement, chargedFee, baselineFee, settlement.add(baselineFee));
	}

	/**
	 * Forward direction: the per-period draft payment (banking and product fees included) gives the
	 * number of periods needed to fund the program cost.
	 */
	public DurationEstimate durationFromAmount(PlanConfiguration configuration, PlanTotals totals,
											   BigDecimal periodPayment) {
		ProgramCost cost = programCost(configuration, totals);
		BigDecimal payment = Money.round(periodPayment);
		BigDecimal net = payment.subtract(Money.round(configuration.recurringFees()));
		if (net.signum() <= 0) {
			throw new PlanValidationException("periodPayment", payment, Money.round(configuration.recurringFees()),
					"Payment must exceed the recurring fees of " + Money.round(configuration.recurringFees()));
		}
		int unclamped = periodsFor(cost.totalProgramCost(), net);
		int clamped = clampPeriods(unclamped, configuration);
		return new DurationEstimate(payment, net, clamped, unclamped, cost);
	}

	/**
	 * Inverse direction: the program cost divided over the requested periods and rounded up to the
	 * cent, with the recurring fees added on top. Rounding up keeps the forward direction at the same
	 * number of periods and leaves the last row no larger than the others.
	 */
	public AmountEstimate amountFromDuration(PlanConfiguration configuration, PlanTotals totals, int periods) {
		int min = minPeriods(configuration);
		int max = maxPeriods(configuration);
		if (periods < min || periods > max) {
			BigDecimal bound = BigDecimal.valueOf(periods < min ? min : max);
			throw new PlanValidationException("targetPeriods", BigDecimal.valueOf(periods), bound,
					"Number of payments must be between " + min + " and " + max);
		}
		ProgramCost cost = programCost(configuration, totals);
		BigDecimal net = Money.divideUp(cost.totalProgramCost(), BigDecimal.valueOf(periods));
		BigDecimal payment = net.add(Money.round(configuration.recurringFees()));
		return new AmountEstimate(periods, net, payment, cost);
	}

	public ScheduleResult calculate(PlanConfiguration configuration, PlanTotals totals) {
		return regenerate(configuration, totals, List.of());
	}

	/**
	 * Builds the scheduled rows around rows that are already frozen. Frozen rows are returned
	 * untouched; cleared ones count toward the program cost and the setup fee, and new rows start
	 * one period after the last frozen date and after the last frozen sequence number.
	 */
	public ScheduleResult regenerate(PlanConfiguration configuration, PlanTotals totals, List<ScheduleLine> frozen) {
		ProgramCost cost = programCost(configuration, totals);
		List<Adjustment> adjustments = new ArrayList<>();
		BigDecimal net = targetNetPerPeriod(configuration, totals, adjustments);

		BigDecimal cleared = Money.ZERO;
		BigDecimal clearedSetup = Money.ZERO;
		int setupRowsUsed = 0;
		int lastSequence = 0;
		LocalDate lastDate = null;
		for (ScheduleLine line : frozen) {
			if (line.status() == ScheduleItemStatus.CLEARED) {
				cleared = cleared.add(line.contribution());
				clearedSetup = clearedSetup.add(line.setupFeePortion());
				if (line.setupFeePortion().signum() > 0) {
					setupRowsUsed++;
				}
			}
			lastSequence = Math.max(lastSequence, line.sequenceNumber());
			if (lastDate == null || line.paymentDate().isAfter(lastDate)) {
				lastDate = line.paymentDate();
			}
		}
		BigDecimal remaining = Money.round(cost.totalProgramCost().subtract(cleared));

		List<ScheduleLine> lines = new ArrayList<>(frozen);
		if (remaining.signum() > 0) {
			int unclamped = periodsFor(remaining, net);
			int periods = clampPeriods(unclamped, configuration);
			if (periods != unclamped) {
				BigDecimal adjustedNet = Money.divideUp(remaining, BigDecimal.valueOf(periods));
				adjustments.add(new Adjustment("numberOfPeriods", BigDecimal.valueOf(unclamped),
						BigDecimal.valueOf(periods), BigDecimal.valueOf((long) periods - unclamped)));
				adjustments.add(new Adjustment("netPerPeriod", net, adjustedNet, adjustedNet.subtract(net)));
				net = adjustedNet;
			}
			PlanConfiguration dated = configuration.withFirstPaymentDate(firstOpenDate(configuration, lastDate));
			BigDecimal setupLeft = configuration.setupFee() == null
					? Money.ZERO
					: Money.round(configuration.setupFee().total()).subtract(clearedSetup).max(Money.ZERO);
			int setupRows = configuration.setupFee() == null
					? 0
					: Math.max(configuration.setupFee().numberOfPayments() - setupRowsUsed, 1);
			lines.addAll(feeDecomposer.decomposeAll(
					paymentDates(dated, periods),
					contributions(remaining, net, periods),
					setupFeePortions(setupLeft, setupRows, periods),
					remaining,
					lastSequence + 1,
					configuration));
		}
		return new ScheduleResult(List.copyOf(lines), summarize(configuration, totals, cost, net, lines, adjustments));
	}

	/**
	 * Spreads the remaining balance evenly over the rows that are still scheduled, keeping their
	 * dates and fee portions. Frozen rows are returned untouched.
	 */
	public List<ScheduleLine> rebalanceRemaining(PlanConfiguration configuration, PlanTotals totals, List<ScheduleLine> rows) {
		ProgramCost cost = programCost(configuration, totals);
		BigDecimal cleared = rows.stream()
				.filter(line -> line.status() == ScheduleItemStatus.CLEARED)
				.map(ScheduleLine::contribution)
				.reduce(Money.ZERO, BigDecimal::add);
		List<ScheduleLine> open = rows.stream().filter(line -> !line.isLocked()).toList();
		if (open.isEmpty()) {
			throw new PlanValidationException("schedule", "No scheduled payments left to rebalance");
		}
		BigDecimal remaining = Money.round(cost.totalProgramCost().subtract(cleared)).max(Money.ZERO);
		BigDecimal net = Money.divide(remaining, BigDecimal.valueOf(open.size()));
		List<BigDecimal> contributions = contributions(remaining, net, open.size());

		List<ScheduleLine> result = new ArrayList<>(rows.size());
		BigDecimal balance = remaining;
		int openIndex = 0;
		for (ScheduleLine row : rows) {
			if (row.isLocked()) {
				result.add(row);
				continue;
			}
			ScheduleLine rebalanced = feeDecomposer.rebalance(row, contributions.get(openIndex++), balance, configuration);
			balance = rebalanced.runningBalance();
			result.add(rebalanced);
		}
		return result;
	}

	/**
	 * Contribution per row: {@code net} for every row but the last, which takes whatever is left so
	 * the running balance ends at zero.
	 */
	public List<BigDecimal> contributions(BigDecimal totalProgramCost, BigDecimal net, int periods) {
		List<BigDecimal> values = new ArrayList<>(Collections.nCopies(periods, net));
		BigDecimal allocated = net.multiply(BigDecimal.valueOf(periods - 1L));
		BigDecimal last = Money.round(totalProgramCost.subtract(allocated));
		values.set(periods - 1, last.max(Money.ZERO));
		return values;
	}

	public List<LocalDate> paymentDates(PlanConfiguration configuration, int periods) {
		LocalDate first = configuration.firstPaymentDate();
		if (first == null) {
			throw new PlanValidationException("firstPaymentDate", "First payment date is required");
		}
		DayOfWeek weekday = configuration.preferredWeekday();
		List<LocalDate> dates = new ArrayList<>(periods);
		for (int i = 0; i < periods; i++) {
			LocalDate date = configuration.paymentFrequency() == PaymentFrequency.MONTHLY
					? first.plusMonths(i)
					: first.plusWeeks(i);
			if (weekday != null) {
				date = date.with(TemporalAdjusters.nextOrSame(weekday));
			}
			dates.add(date);
		}
		return dates;
	}

	/**
	 * Setup fee spread over the first {@code numberOfPayments} rows, or over every row when the
	 * schedule is shorter than that.
	 */
	public List<BigDecimal> setupFeePortions(PlanConfiguration configuration, int periods) {
		if (configuration.setupFee() == null) {
			return setupFeePortions(Money.ZERO, 0, periods);
		}
		return setupFeePortions(configuration.setupFee().total(), configuration.setupFee().numberOfPayments(), periods);
	}

	List<BigDecimal> setupFeePortions(BigDecimal total, int numberOfPayments, int periods) {
		List<BigDecimal> portions = new ArrayList<>(Collections.nCopies(periods, Money.ZERO));
		if (!Money.isPositive(total) || periods == 0) {
			return portions;
		}
		int spreadOver = Math.min(Math.max(numberOfPayments, 1), periods);
		List<BigDecimal> parts = feeDecomposer.spread(total, spreadOver);
		for (int i = 0; i < parts.size(); i++) {
			portions.set(i, parts.get(i));
		}
		return portions;
	}

	private LocalDate firstOpenDate(PlanConfiguration configuration, LocalDate lastFrozenDate) {
		LocalDate first = configuration.firstPaymentDate();
		if (lastFrozenDate == null) {
			return first;
		}
		LocalDate next = configuration.paymentFrequency() == PaymentFrequency.MONTHLY
				? lastFrozenDate.plusMonths(1)
				: lastFrozenDate.plusWeeks(1);
		if (first == null || next.isAfter(first)) {
			return next;
		}
		return first;
	}

	int periodsFor(BigDecimal totalProgramCost, BigDecimal net) {
		return totalProgramCost.divide(net, 0, RoundingMode.CEILING).max(BigDecimal.ONE).intValueExact();
	}

	int clampPeriods(int periods, PlanConfiguration configuration) {
		return Math.max(minPeriods(configuration), Math.min(maxPeriods(configuration), periods));
	}

	int minPeriods(PlanConfiguration configuration) {
		return toPeriods(configuration.minProgramWeeks(), configuration, RoundingMode.CEILING);
	}

	int maxPeriods(PlanConfiguration configuration) {
		return toPeriods(configuration.maxProgramWeeks(), configuration, RoundingMode.FLOOR);
	}

	private int toPeriods(int weeks, PlanConfiguration configuration, RoundingMode mode) {
		if (configuration.paymentFrequency() != PaymentFrequency.MONTHLY) {
			return weeks;
		}
		return Math.max(1, BigDecimal.valueOf(weeks)
				.divide(configuration.weeklyToMonthlyFactor(), 0, mode)
				.intValueExact());
	}

	private BigDecimal targetNetPerPeriod(PlanConfiguration configuration, PlanTotals totals, List<Adjustment> adjustments) {
		PaymentFrequency frequency = configuration.paymentFrequency();
		BigDecimal factor = configuration.weeklyToMonthlyFactor();
		switch (configuration.calculationMode()) {
			case PERCENT_OF_CURRENT -> {
				BoundedAmount percent = boundsEnforcer.clampPercent(configuration.targetPercent(), configuration.bounds());
				if (percent.clamped()) {
					adjustments.add(Adjustment.of("targetPercent", percent));
				}
				BoundedAmount weekly = boundsEnforcer.weeklyTargetFromPercent(configuration.targetPercent(),
						totals.currentPayment(), configuration.bounds());
				if (weekly.clamped()) {
					adjustments.add(Adjustment.of("weeklyTarget", weekly));
				}
				return boundsEnforcer.toDisplay(weekly.applied(), frequency, factor);
			}
			case DESIRED_AMOUNT -> {
				if (configuration.targetAmount() == null) {
					throw new PlanValidationException("targetAmount", "Enter a valid payment amount");
				}
				BigDecimal weekly = boundsEnforcer.toWeekly(configuration.targetAmount(), frequency, factor);
				boundsEnforcer.validateDesiredWeekly(weekly, configuration.bounds(), totals.currentPayment());
				return Money.round(configuration.targetAmount());
			}
			case DESIRED_DURATION -> {
				if (configuration.targetPeriods() == null) {
					throw new PlanValidationException("targetPeriods", "Enter the desired number of payments");
				}
				return amountFromDuration(configuration, totals, configuration.targetPeriods()).netPerPeriod();
			}
			default -> throw new IllegalStateException("Unsupported calculation mode: " + configuration.calculationMode());
		}
	}

	private ScheduleSummary summarize(PlanConfiguration configuration,
									  PlanTotals totals,
									  ProgramCost cost,
									  BigDecimal net,
									  List<ScheduleLine> lines,
									  List<Adjustment> adjustments) {
		BigDecimal periodPayment = net.add(Money.round(configuration.recurringFees()));
		BigDecimal factor = configuration.weeklyToMonthlyFactor();
		BigDecimal weeklyPayment = boundsEnforcer.toWeekly(periodPayment, configuration.paymentFrequency(), factor);
		BigDecimal monthlyPayment = boundsEnforcer.toDisplay(weeklyPayment, PaymentFrequency.MONTHLY, factor);
		BigDecimal setupTotal = Money.ZERO;
		BigDecimal bankingTotal = Money.ZERO;
		BigDecimal paymentsTotal = Money.ZERO;
		for (ScheduleLine line : lines) {
			setupTotal = setupTotal.add(line.setupFeePortion());
			bankingTotal = bankingTotal.add(line.bankingFeePortion()).add(line.secondaryBankingFeePortion());
			paymentsTotal = paymentsTotal.add(line.paymentAmount());
		}
		BigDecimal weeklySavings = null;
		BigDecimal savingsPercent = null;
		if (totals.hasCurrentPayment()) {
			weeklySavings = Money.round(totals.currentPayment().subtract(weeklyPayment));
			savingsPercent = Money.asPercent(weeklySavings, totals.currentPayment());
		}
		return new ScheduleSummary(configuration.paymentFrequency(), lines.size(), net, periodPayment,
				weeklyPayment, monthlyPayment, cost.settlementAmount(), cost.programFee(), cost.baselineProgramFee(),
				cost.totalProgramCost(), setupTotal, bankingTotal, paymentsTotal, totals.currentPayment(),
				weeklySavings, savingsPercent, List.copyOf(adjustments));
	}
}

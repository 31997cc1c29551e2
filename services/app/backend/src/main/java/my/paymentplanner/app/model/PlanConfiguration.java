package my.paymentplanner.app.model;

import my.paymentplanner.app.domain.CalculationMode;
import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.domain.ProgramType;
import my.paymentplanner.app.error.PlanValidationException;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything one calculation needs, already resolved against the program policy. Instances are
 * immutable and stored verbatim with every plan version so a version can be regenerated later.
 * <p>
 * {@code programFeePercent} is the baseline percent used to size the schedule; a no-fee program
 * still carries it but is charged nothing.
 */
public record PlanConfiguration(
		ProgramType programType,
		PaymentFrequency paymentFrequency,
		CalculationMode calculationMode,
		BigDecimal targetPercent,
		BigDecimal targetAmount,
		Integer targetPeriods,
		SetupFee setupFee,
		BigDecimal bankingFee,
		BigDecimal secondaryBankingFee,
		BigDecimal programSplitRatio,
		BigDecimal escrowSplitRatio,
		LocalDate firstPaymentDate,
		DayOfWeek preferredWeekday,
		boolean noFeeProgram,
		List<String> additionalProducts,
		BigDecimal additionalWeeklyProductsTotal,
		PaymentBounds bounds,
		BigDecimal settlementPercent,
		BigDecimal programFeePercent,
		BigDecimal weeklyToMonthlyFactor,
		int minProgramWeeks,
		int maxProgramWeeks
) {
	public PlanConfiguration {
		additionalProducts = additionalProducts == null ? List.of() : List.copyOf(additionalProducts);
		if (programSplitRatio == null || escrowSplitRatio == null) {
			throw new PlanValidationException("programSplitRatio", "Split ratios are required");
		}
		if (noFeeProgram) {
			if (programSplitRatio.signum() != 0 || escrowSplitRatio.compareTo(BigDecimal.ONE) != 0) {
				throw new PlanValidationException("programSplitRatio",
						"A no-fee program must route the whole contribution to escrow");
			}
		} else if (programSplitRatio.add(escrowSplitRatio).compareTo(BigDecimal.ONE) != 0) {
			throw new PlanValidationException("programSplitRatio",
					"programSplitRatio and escrowSplitRatio must add up to 1");
		}
		if (minProgramWeeks < 1 || maxProgramWeeks < minProgramWeeks) {
			throw new PlanValidationException("minProgramWeeks", "Program week range is invalid");
		}
	}

	/**
	 * Recurring per-draft surcharge added on top of the contribution toward the program cost.
	 */
	public BigDecimal recurringFees() {
		return nullSafe(bankingFee).add(nullSafe(secondaryBankingFee)).add(nullSafe(additionalWeeklyProductsTotal));
	}

	public PlanConfiguration withFirstPaymentDate(LocalDate date) {
		return new PlanConfiguration(programType, paymentFrequency, calculationMode, targetPercent, targetAmount,
				targetPeriods, setupFee, bankingFee, secondaryBankingFee, programSplitRatio, escrowSplitRatio,
				date, preferredWeekday, noFeeProgram, additionalProducts, additionalWeeklyProductsTotal,
				bounds, settlementPercent, programFeePercent, weeklyToMonthlyFactor, minProgramWeeks, maxProgramWeeks);
	}

	private static BigDecimal nullSafe(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}

package my.paymentplanner.app.model;

import my.paymentplanner.app.domain.PaymentFrequency;

import java.math.BigDecimal;
import java.util.List;

public record ScheduleSummary(
		PaymentFrequency paymentFrequency,
		int numberOfPeriods,
		BigDecimal netPerPeriod,
		BigDecimal periodPayment,
		BigDecimal weeklyPayment,
		BigDecimal monthlyPayment,
		BigDecimal settlementAmount,
		BigDecimal programFee,
		BigDecimal baselineProgramFee,
		BigDecimal totalProgramCost,
		BigDecimal setupFeeTotal,
		BigDecimal bankingFeeTotal,
		BigDecimal totalOfPayments,
		BigDecimal currentPayment,
		BigDecimal weeklySavings,
		BigDecimal savingsPercent,
		List<Adjustment> adjustments
) {
}

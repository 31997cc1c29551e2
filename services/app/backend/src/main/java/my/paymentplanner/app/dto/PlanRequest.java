package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import my.paymentplanner.app.domain.CalculationMode;
import my.paymentplanner.app.domain.PaymentFrequency;
import my.paymentplanner.app.domain.ProgramType;
import my.paymentplanner.app.model.PlanTotals;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

public record PlanRequest(
		@NotNull ProgramType programType,
		PaymentFrequency paymentFrequency,
		@NotNull CalculationMode calculationMode,
		@Schema(description = "Target as percent of the current payment (PERCENT_OF_CURRENT).")
		BigDecimal targetPercent,
		@Schema(description = "Target net payment in the display frequency (DESIRED_AMOUNT).")
		BigDecimal targetAmount,
		@Schema(description = "Desired number of payments (DESIRED_DURATION).")
		Integer targetPeriods,
		@PositiveOrZero BigDecimal setupFeeTotal,
		Integer setupFeeNumberOfPayments,
		LocalDate firstPaymentDate,
		DayOfWeek preferredWeekday,
		Boolean noFeeProgram,
		List<String> additionalProducts,
		@NotNull @Positive BigDecimal totalDebt,
		@PositiveOrZero BigDecimal currentPayment
) {
	public PlanTotals totals() {
		return new PlanTotals(totalDebt, currentPayment);
	}
}

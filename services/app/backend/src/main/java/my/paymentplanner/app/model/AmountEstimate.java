package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record AmountEstimate(
		int numberOfPeriods,
		BigDecimal netPerPeriod,
		BigDecimal periodPayment,
		ProgramCost cost
) {
}

package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record DurationEstimate(
		BigDecimal periodPayment,
		BigDecimal netPerPeriod,
		int numberOfPeriods,
		int unclampedPeriods,
		ProgramCost cost
) {
	public boolean clamped() {
		return numberOfPeriods != unclampedPeriods;
	}
}

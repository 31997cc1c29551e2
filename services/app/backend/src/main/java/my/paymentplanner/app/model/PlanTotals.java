package my.paymentplanner.app.model;

import java.math.BigDecimal;

/**
 * Case figures the schedule is sized against. {@code currentPayment} may be null when the
 * client's current payment is unknown.
 */
public record PlanTotals(
		BigDecimal totalDebt,
		BigDecimal currentPayment
) {
	public boolean hasCurrentPayment() {
		return currentPayment != null && currentPayment.signum() > 0;
	}
}

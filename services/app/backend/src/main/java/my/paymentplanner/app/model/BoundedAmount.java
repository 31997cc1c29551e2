package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record BoundedAmount(
		BigDecimal requested,
		BigDecimal applied
) {
	public boolean clamped() {
		if (requested == null) {
			return applied != null;
		}
		return requested.compareTo(applied) != 0;
	}

	public BigDecimal delta() {
		if (requested == null) {
			return applied;
		}
		return applied.subtract(requested);
	}
}

package my.paymentplanner.app.model;

import java.math.BigDecimal;

/**
 * Reports a value the engine moved into range instead of using it as requested.
 */
public record Adjustment(
		String field,
		BigDecimal requested,
		BigDecimal applied,
		BigDecimal delta
) {
	public static Adjustment of(String field, BoundedAmount bounded) {
		return new Adjustment(field, bounded.requested(), bounded.applied(), bounded.delta());
	}
}

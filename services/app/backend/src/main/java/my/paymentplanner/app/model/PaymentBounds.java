package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record PaymentBounds(
		BigDecimal minWeeklyTarget,
		BigDecimal minPercent,
		BigDecimal maxPercent
) {
}

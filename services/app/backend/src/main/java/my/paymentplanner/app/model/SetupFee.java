package my.paymentplanner.app.model;

import java.math.BigDecimal;

public record SetupFee(
		BigDecimal total,
		int numberOfPayments
) {
}

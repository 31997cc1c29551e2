package my.paymentplanner.app.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record WireFeeRequest(
		String feeType,
		@PositiveOrZero BigDecimal amount
) {
}

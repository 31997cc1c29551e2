package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record RecalculateRequest(
		@Schema(description = "Refreshed total debt; the version's value is kept when omitted.")
		@Positive BigDecimal totalDebt,
		@Schema(description = "Refreshed current payment; the version's value is kept when omitted.")
		@PositiveOrZero BigDecimal currentPayment,
		String createdBy
) {
}

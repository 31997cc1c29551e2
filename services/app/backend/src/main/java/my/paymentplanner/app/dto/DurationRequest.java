package my.paymentplanner.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record DurationRequest(
		@NotNull @Valid PlanRequest plan,
		@Schema(description = "Per-period draft payment including banking and product fees.")
		@NotNull @Positive BigDecimal periodPayment
) {
}

package my.paymentplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AmountRequest(
		@NotNull @Valid PlanRequest plan,
		@NotNull @Positive Integer numberOfPeriods
) {
}

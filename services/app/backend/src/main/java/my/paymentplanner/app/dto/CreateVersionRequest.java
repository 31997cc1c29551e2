package my.paymentplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CreateVersionRequest(
		@NotNull @Valid PlanRequest plan,
		String createdBy
) {
}

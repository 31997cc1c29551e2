package my.paymentplanner.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SaveEditsRequest(
		@NotNull List<@Valid ScheduleRowEdit> rows,
		String createdBy
) {
}

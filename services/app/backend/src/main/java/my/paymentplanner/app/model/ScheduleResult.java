package my.paymentplanner.app.model;

import java.util.List;

public record ScheduleResult(
		List<ScheduleLine> schedule,
		ScheduleSummary summary
) {
}

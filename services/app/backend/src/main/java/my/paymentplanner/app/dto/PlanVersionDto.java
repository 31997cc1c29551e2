package my.paymentplanner.app.dto;

import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.SyncStatus;
import my.paymentplanner.app.model.PlanConfiguration;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record PlanVersionDto(
		Long id,
		String caseId,
		int versionNumber,
		PlanVersionStatus status,
		boolean primary,
		SyncStatus syncStatus,
		Long supersedesId,
		BigDecimal totalDebt,
		BigDecimal currentPayment,
		PlanConfiguration configuration,
		LocalDateTime createdAt,
		String createdBy,
		List<String> actions,
		List<ScheduleItemDto> items
) {
}

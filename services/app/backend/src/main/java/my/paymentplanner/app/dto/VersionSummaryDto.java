package my.paymentplanner.app.dto;

import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.SyncStatus;

import java.time.LocalDateTime;
import java.util.List;

public record VersionSummaryDto(
		Long id,
		String caseId,
		int versionNumber,
		PlanVersionStatus status,
		boolean primary,
		SyncStatus syncStatus,
		Long supersedesId,
		LocalDateTime createdAt,
		String createdBy,
		int itemCount,
		List<String> actions
) {
}

package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.ScheduleItemStatus;

/**
 * Single answer to "may this row be edited". A row is editable only while its persisted status is
 * {@link ScheduleItemStatus#SCHEDULED} and its version still accepts edits. Whether an active
 * version accepts edits is a configuration decision.
 */
public class EditabilityPolicy {
	private final boolean activeScheduledRowsEditable;

	public EditabilityPolicy(boolean activeScheduledRowsEditable) {
		this.activeScheduledRowsEditable = activeScheduledRowsEditable;
	}

	public boolean isVersionEditable(PlanVersionStatus versionStatus) {
		if (versionStatus == PlanVersionStatus.DRAFT) {
			return true;
		}
		return versionStatus == PlanVersionStatus.ACTIVE && activeScheduledRowsEditable;
	}

	public boolean isEditable(ScheduleItemStatus persistedRowStatus, PlanVersionStatus versionStatus) {
		return persistedRowStatus == ScheduleItemStatus.SCHEDULED && isVersionEditable(versionStatus);
	}

	/**
	 * Status changes (marking a draft cleared or NSF) stay possible on active versions.
	 */
	public boolean canChangeStatus(PlanVersionStatus versionStatus) {
		return versionStatus == PlanVersionStatus.DRAFT || versionStatus == PlanVersionStatus.ACTIVE;
	}
}

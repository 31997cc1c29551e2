package my.paymentplanner.app.domain;

public enum ScheduleItemStatus {
	SCHEDULED,
	CLEARED,
	NSF,
	CANCELLED;

	/**
	 * Frozen rows are excluded from regeneration and cell edits.
	 */
	public boolean isFrozen() {
		return this != SCHEDULED;
	}

	/**
	 * NSF and cancelled drafts never count as a numbered draft.
	 */
	public boolean countsAsDraft() {
		return this == SCHEDULED || this == CLEARED;
	}
}

package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PlanVersion;
import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.SyncStatus;
import my.paymentplanner.app.error.InvalidTransitionException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Permitted lifecycle operations per version state. Every operation on a version is checked here
 * before anything is written.
 */
public enum VersionAction {
	RECALCULATE("recalculate", EnumSet.of(PlanVersionStatus.DRAFT, PlanVersionStatus.ACTIVE), false, false),
	RECALCULATE_REMAINING("recalculate remaining balance of",
			EnumSet.of(PlanVersionStatus.DRAFT, PlanVersionStatus.ACTIVE), true, false),
	SAVE_EDITS("save edits to", EnumSet.of(PlanVersionStatus.DRAFT, PlanVersionStatus.ACTIVE), true, false),
	SET_PRIMARY("set primary", EnumSet.of(PlanVersionStatus.DRAFT, PlanVersionStatus.ACTIVE), true, false),
	ACTIVATE("activate", EnumSet.of(PlanVersionStatus.DRAFT), true, false),
	SUSPEND("suspend", EnumSet.of(PlanVersionStatus.ACTIVE), false, false),
	DELETE("delete", EnumSet.of(PlanVersionStatus.DRAFT, PlanVersionStatus.ARCHIVED), false, true);

	private final String verb;
	private final Set<PlanVersionStatus> allowedStatuses;
	private final boolean requiresInSync;
	private final boolean forbidsPrimary;

	VersionAction(String verb, Set<PlanVersionStatus> allowedStatuses, boolean requiresInSync, boolean forbidsPrimary) {
		this.verb = verb;
		this.allowedStatuses = allowedStatuses;
		this.requiresInSync = requiresInSync;
		this.forbidsPrimary = forbidsPrimary;
	}

	public boolean permits(PlanVersion version) {
		if (version == null || !allowedStatuses.contains(version.getStatus())) {
			return false;
		}
		if (requiresInSync && version.getSyncStatus() == SyncStatus.OUT_OF_SYNC) {
			return false;
		}
		return !(forbidsPrimary && version.isPrimary());
	}

	public void require(PlanVersion version) {
		if (!permits(version)) {
			throw new InvalidTransitionException(version.getId(), verb, describe(version));
		}
	}

	public String verb() {
		return verb;
	}

	public static List<String> availableFor(PlanVersion version) {
		return Arrays.stream(values())
				.filter(action -> action.permits(version))
				.map(Enum::name)
				.toList();
	}

	static String describe(PlanVersion version) {
		StringBuilder state = new StringBuilder(version.getStatus().name());
		if (version.isPrimary()) {
			state.append(" (primary)");
		}
		if (version.getSyncStatus() == SyncStatus.OUT_OF_SYNC) {
			state.append(" (out of sync)");
		}
		return state.toString();
	}
}

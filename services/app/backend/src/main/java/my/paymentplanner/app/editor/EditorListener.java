package my.paymentplanner.app.editor;

import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.error.PlanEngineException;
import my.paymentplanner.app.model.ScheduleResult;

import java.util.List;

/**
 * Receives what a {@link PlanEditorSession} applied. Callbacks run on the session's event loop.
 */
public interface EditorListener {

	default void onStateChanged(EditorState state) {
	}

	default void onCalculation(ScheduleResult result) {
	}

	default void onVersionsChanged(List<VersionSummaryDto> versions) {
	}

	default void onTotals(ScheduleTotalsDto totals) {
	}

	default void onError(PlanEngineException error) {
	}
}

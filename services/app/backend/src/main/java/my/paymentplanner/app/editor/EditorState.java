package my.paymentplanner.app.editor;

import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.ScheduleItemDto;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything the schedule grid shows for one loaded version. Values are replaced, never mutated;
 * {@link InteractiveGridController} produces the next state from the current one.
 */
public record EditorState(
		Long versionId,
		PlanVersionStatus versionStatus,
		List<GridRow> rows,
		CellAddress selection,
		FillDrag fillDrag,
		int nextNewRowNumber,
		String message
) {
	public EditorState {
		rows = rows == null ? List.of() : List.copyOf(rows);
	}

	public static EditorState empty() {
		return new EditorState(null, null, List.of(), null, null, 1, null);
	}

	public static EditorState of(PlanVersionDto version) {
		List<GridRow> rows = new ArrayList<>();
		if (version.items() != null) {
			for (ScheduleItemDto item : version.items()) {
				rows.add(GridRow.fromItem(item));
			}
		}
		return new EditorState(version.id(), version.status(), rows, null, null, 1, null);
	}

	/**
	 * Rows not marked deleted. Row indexes used by the controller refer to this list.
	 */
	public List<GridRow> visibleRows() {
		return rows.stream().filter(row -> !row.deleted()).toList();
	}

	public Optional<GridRow> visibleRow(int rowIndex) {
		List<GridRow> visible = visibleRows();
		if (rowIndex < 0 || rowIndex >= visible.size()) {
			return Optional.empty();
		}
		return Optional.of(visible.get(rowIndex));
	}

	public boolean hasChanges() {
		return rows.stream().anyMatch(row -> row.modified() || row.deleted());
	}

	EditorState withRows(List<GridRow> value) {
		return new EditorState(versionId, versionStatus, value, selection, fillDrag, nextNewRowNumber, message);
	}

	EditorState withSelection(CellAddress value) {
		return new EditorState(versionId, versionStatus, rows, value, fillDrag, nextNewRowNumber, message);
	}

	EditorState withFillDrag(FillDrag value) {
		return new EditorState(versionId, versionStatus, rows, selection, value, nextNewRowNumber, message);
	}

	EditorState withNextNewRowNumber(int value) {
		return new EditorState(versionId, versionStatus, rows, selection, fillDrag, value, message);
	}

	public EditorState withMessage(String value) {
		return new EditorState(versionId, versionStatus, rows, selection, fillDrag, nextNewRowNumber, value);
	}
}

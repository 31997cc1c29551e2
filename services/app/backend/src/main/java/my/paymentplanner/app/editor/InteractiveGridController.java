package my.paymentplanner.app.editor;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.service.EditabilityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Transitions of the schedule grid. Every operation takes the current {@link EditorState} and
 * returns the next one; operations that are not allowed for the addressed row return the state
 * unchanged. Row indexes address {@link EditorState#visibleRows()}.
 */
public class InteractiveGridController {
	private static final Logger logger = LoggerFactory.getLogger(InteractiveGridController.class);

	private final EditabilityPolicy editabilityPolicy;

	public InteractiveGridController(EditabilityPolicy editabilityPolicy) {
		this.editabilityPolicy = editabilityPolicy;
	}

	public boolean isEditable(EditorState state, GridRow row) {
		return editabilityPolicy.isEditable(row.persistedStatus(), state.versionStatus());
	}

	public boolean isEditable(EditorState state, int rowIndex) {
		return state.visibleRow(rowIndex).map(row -> isEditable(state, row)).orElse(false);
	}

	public EditorState selectCell(EditorState state, int rowIndex, GridField field) {
		if (!canEdit(state, rowIndex, field)) {
			return state;
		}
		return state.withSelection(new CellAddress(rowIndex, field)).withMessage(null);
	}

	public EditorState clearSelection(EditorState state) {
		return state.withSelection(null);
	}

	public EditorState beginFillDrag(EditorState state, CellAddress source) {
		if (source == null || !canEdit(state, source.rowIndex(), source.field())) {
			return state;
		}
		return state.withSelection(source).withFillDrag(new FillDrag(source, source.rowIndex()));
	}

	public EditorState updateFillDrag(EditorState state, int pointerRow) {
		FillDrag drag = state.fillDrag();
		if (drag == null) {
			return state;
		}
		int last = state.visibleRows().size() - 1;
		int clamped = Math.max(0, Math.min(pointerRow, last));
		return state.withFillDrag(drag.withPointerRow(clamped));
	}

	/**
	 * Rows the current drag would fill. Locked rows inside the range are left out.
	 */
	public List<Integer> highlightedRows(EditorState state) {
		FillDrag drag = state.fillDrag();
		if (drag == null) {
			return List.of();
		}
		List<Integer> rows = new ArrayList<>();
		for (Integer index : drag.range()) {
			if (isEditable(state, index)) {
				rows.add(index);
			}
		}
		return rows;
	}

	public EditorState endFillDrag(EditorState state) {
		FillDrag drag = state.fillDrag();
		if (drag == null) {
			return state;
		}
		GridField field = drag.source().field();
		Optional<GridRow> source = state.visibleRow(drag.source().rowIndex());
		if (source.isEmpty()) {
			return state.withFillDrag(null);
		}
		Object value = currentValue(source.get(), field);
		List<Integer> targets = highlightedRows(state);
		List<GridRow> visible = state.visibleRows();
		EditorState next = state;
		for (Integer index : targets) {
			GridRow target = visible.get(index).withoutBuffer(field).withValue(field, value);
			next = replace(next, target);
		}
		logger.debug("Filled {} from row {} into {} rows", field, drag.source().rowIndex(), targets.size());
		return next.withFillDrag(null).withMessage("Filled " + targets.size() + " cells");
	}

	public EditorState cancelFillDrag(EditorState state) {
		return state.withFillDrag(null);
	}

	/**
	 * Records a keystroke. Amounts that already parse are applied right away so escrow follows
	 * the typing; the raw text stays in the edit buffer until {@link #commitCell}.
	 */
	public EditorState editCell(EditorState state, int rowIndex, GridField field, String rawValue) {
		if (!canEdit(state, rowIndex, field)) {
			return state;
		}
		GridRow row = state.visibleRow(rowIndex).orElseThrow().withBuffer(field, rawValue);
		if (field.isMonetary()) {
			Optional<BigDecimal> parsed = MoneyText.tryParse(rawValue);
			if (parsed.isPresent()) {
				row = row.withMoney(field, parsed.get());
			}
		}
		return replace(state, row);
	}

	public EditorState commitCell(EditorState state, int rowIndex, GridField field) {
		Optional<GridRow> current = state.visibleRow(rowIndex);
		if (current.isEmpty() || current.get().buffer(field).isEmpty()) {
			return state;
		}
		GridRow row = current.get();
		String raw = row.buffer(field).orElseThrow();
		if (field.isMonetary()) {
			return replace(state, row.withMoney(field, MoneyText.normalize(raw)).withoutBuffer(field));
		}
		Optional<LocalDate> date = parseDate(raw);
		if (date.isEmpty()) {
			return replace(state, row.withoutBuffer(field)).withMessage("Enter a valid payment date");
		}
		return replace(state, row.withDate(date.get()).withoutBuffer(field));
	}

	public EditorState commitAll(EditorState state) {
		EditorState next = state;
		List<GridRow> visible = state.visibleRows();
		for (int index = 0; index < visible.size(); index++) {
			for (GridField field : visible.get(index).editBuffers().keySet()) {
				next = commitCell(next, index, field);
			}
		}
		return next;
	}

	/**
	 * Status stays changeable on rows whose amounts are locked by the version, for instance to mark
	 * a payment cleared on an active plan. Rows already settled when the version was loaded keep
	 * their status.
	 */
	public EditorState changeStatus(EditorState state, int rowIndex, ScheduleItemStatus status) {
		Optional<GridRow> row = state.visibleRow(rowIndex);
		if (row.isEmpty() || status == null || row.get().status() == status) {
			return state;
		}
		if (!editabilityPolicy.canChangeStatus(state.versionStatus())) {
			return state.withMessage("Row status cannot be changed on a " + state.versionStatus() + " version");
		}
		if (row.get().isLocked()) {
			return state.withMessage("Payment " + row.get().sequenceNumber() + " is " + row.get().status()
					+ " and its status cannot be changed");
		}
		return replace(state, row.get().withStatus(status));
	}

	public EditorState addRow(EditorState state, RowDefaults defaults, LocalDate today) {
		if (!editabilityPolicy.isVersionEditable(state.versionStatus())) {
			return state.withMessage("Rows cannot be added to a " + state.versionStatus() + " version");
		}
		List<GridRow> visible = state.visibleRows();
		LocalDate date = visible.stream()
				.map(GridRow::paymentDate)
				.max(Comparator.naturalOrder())
				.map(last -> last.plusWeeks(1))
				.orElse(today);
		int sequence = state.rows().stream().mapToInt(GridRow::sequenceNumber).max().orElse(0) + 1;
		GridRow added = GridRow.added("new-" + state.nextNewRowNumber(), sequence, date, defaults);
		List<GridRow> rows = new ArrayList<>(state.rows());
		rows.add(added);
		return state.withRows(rows).withNextNewRowNumber(state.nextNewRowNumber() + 1);
	}

	/**
	 * Rows never saved disappear; saved rows are only marked and drop out of the submission.
	 */
	public EditorState deleteRow(EditorState state, int rowIndex) {
		Optional<GridRow> row = state.visibleRow(rowIndex);
		if (row.isEmpty() || !isEditable(state, row.get())) {
			return state;
		}
		List<GridRow> rows = new ArrayList<>();
		for (GridRow candidate : state.rows()) {
			if (!candidate.rowKey().equals(row.get().rowKey())) {
				rows.add(candidate);
			} else if (!candidate.newRow()) {
				rows.add(candidate.markedDeleted());
			}
		}
		return state.withRows(rows).withSelection(null).withFillDrag(null);
	}

	/**
	 * Rows to save. Pending edit buffers are committed first.
	 */
	public List<ScheduleRowEdit> toSubmission(EditorState state) {
		return commitAll(state).visibleRows().stream().map(GridRow::toEdit).toList();
	}

	private boolean canEdit(EditorState state, int rowIndex, GridField field) {
		return field != null && field.isEditable() && isEditable(state, rowIndex);
	}

	private Object currentValue(GridRow row, GridField field) {
		Optional<String> buffered = row.buffer(field);
		if (buffered.isEmpty()) {
			return row.value(field);
		}
		if (field.isMonetary()) {
			return MoneyText.normalize(buffered.get());
		}
		return parseDate(buffered.get()).orElse(row.paymentDate());
	}

	private Optional<LocalDate> parseDate(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		try {
			return Optional.of(LocalDate.parse(raw.trim()));
		} catch (DateTimeParseException ex) {
			return Optional.empty();
		}
	}

	private EditorState replace(EditorState state, GridRow row) {
		List<GridRow> rows = new ArrayList<>(state.rows().size());
		for (GridRow candidate : state.rows()) {
			rows.add(candidate.rowKey().equals(row.rowKey()) ? row : candidate);
		}
		return state.withRows(rows);
	}
}

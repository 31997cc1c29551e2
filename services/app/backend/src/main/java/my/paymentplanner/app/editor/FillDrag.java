package my.paymentplanner.app.editor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fill-handle drag in progress. The range runs from the source row toward the pointer row and
 * never includes the source row itself.
 */
public record FillDrag(CellAddress source, int pointerRow) {

	public List<Integer> range() {
		List<Integer> rows = new ArrayList<>();
		int sourceRow = source.rowIndex();
		if (pointerRow > sourceRow) {
			for (int row = sourceRow + 1; row <= pointerRow; row++) {
				rows.add(row);
			}
		} else if (pointerRow < sourceRow) {
			for (int row = pointerRow; row < sourceRow; row++) {
				rows.add(row);
			}
		}
		return rows;
	}

	public FillDrag withPointerRow(int row) {
		return new FillDrag(source, row);
	}
}

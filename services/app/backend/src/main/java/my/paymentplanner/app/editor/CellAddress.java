package my.paymentplanner.app.editor;

/**
 * A cell by visible row index and column.
 */
public record CellAddress(int rowIndex, GridField field) {
}

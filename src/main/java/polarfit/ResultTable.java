/**
 * Polar Fit
 * ResultTable.java
 *
 */

package polarfit;

import java.util.Arrays;

/**
 * Rectangular grid of {@link TableCell}s ready for flat-table export. New
 * tables are filled with blanks.
 */
public class ResultTable {

	private final TableCell[][] cells;

	public ResultTable(final int rows, final int columns) {
		cells = new TableCell[rows][columns];
		for (final TableCell[] row : cells) {
			Arrays.fill(row, TableCell.BLANK);
		}
	}

	public int getRowCount() {
		return cells.length;
	}

	public int getColumnCount() {
		return cells.length == 0 ? 0 : cells[0].length;
	}

	public TableCell get(final int row, final int column) {
		return cells[row][column];
	}

	void set(final int row, final int column, final TableCell cell) {
		cells[row][column] = cell;
	}

	void set(final int row, final int column, final double number) {
		set(row, column, TableCell.of(number));
	}

	void set(final int row, final int column, final String text) {
		set(row, column, TableCell.of(text));
	}

	/**
	 * Copies {@code block} with its top left corner at ({@code row},
	 * {@code column}).
	 */
	void put(final int row, final int column, final ResultTable block) {
		for (int r = 0; r < block.getRowCount(); r++) {
			for (int c = 0; c < block.getColumnCount(); c++) {
				cells[row + r][column + c] = block.get(r, c);
			}
		}
	}

	public TableCell[] getRow(final int row) {
		return cells[row].clone();
	}
}

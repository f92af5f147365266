/**
 * Polar Fit
 * Preprocessor.java
 *
 */

package polarfit;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Row windowing, baseline removal and series alignment of a
 * {@link SpectrumTable}. Separating X from Y and the interleaved
 * positive/negative columns is done here on request of the caller; the
 * truncation itself never filters columns.
 */
final class Preprocessor {

	private Preprocessor() {}

	/**
	 * Keeps rows {@code start} (inclusive) to {@code end} (exclusive).
	 *
	 * @throws InputShapeException if the range falls outside the table or is
	 *           empty
	 */
	static SpectrumTable truncate(final SpectrumTable table, final int start,
		final int end)
	{
		final int rows = table.getRowCount();
		if (start < 0 || end > rows) {
			throw new InputShapeException(AnalysisException.Stage.PREPROCESS, String
				.format("%s: row range %d-%d lies outside the %d data rows",
					table.getName(), start + 1, end, rows));
		}
		if (start >= end) {
			throw new InputShapeException(AnalysisException.Stage.PREPROCESS, String
				.format("%s: row range %d-%d is empty", table.getName(), start + 1,
					end));
		}
		final RealMatrix y = table.getY().getSubMatrix(start, end - 1, 0, table
			.getSeriesCount() - 1);
		return new SpectrumTable(table.getName(), table.getX().getSubVector(start,
			end - start), y, table.getHeaders(), table.getHeaderValues());
	}

	/**
	 * @return a copy of {@code table} with {@code baseline} subtracted from
	 *         every Y value; X is left untouched
	 */
	static SpectrumTable subtractBaseline(final SpectrumTable table,
		final double baseline)
	{
		return new SpectrumTable(table.getName(), table.getX(), table.getY()
			.scalarAdd(-baseline), table.getHeaders(), table.getHeaderValues());
	}

	/**
	 * Truncation followed by baseline removal.
	 */
	static SpectrumTable prepare(final SpectrumTable table, final int start,
		final int end, final double baseline)
	{
		return subtractBaseline(truncate(table, start, end), baseline);
	}

	/**
	 * @return number of positive-channel columns (0, 2, 4, ...) among
	 *         {@code yColumns} interleaved Y columns
	 */
	static int positiveCount(final int yColumns) {
		return (yColumns + 1) / 2;
	}

	/**
	 * @return number of negative-channel columns (1, 3, 5, ...)
	 */
	static int negativeCount(final int yColumns) {
		return yColumns / 2;
	}

	/**
	 * @return the first {@code count} positive-channel columns of an
	 *         interleaved Y matrix
	 */
	static RealMatrix positiveColumns(final RealMatrix y, final int count) {
		return everyOther(y, 0, count);
	}

	/**
	 * @return the first {@code count} negative-channel columns of an
	 *         interleaved Y matrix
	 */
	static RealMatrix negativeColumns(final RealMatrix y, final int count) {
		return everyOther(y, 1, count);
	}

	private static RealMatrix everyOther(final RealMatrix y, final int offset,
		final int count)
	{
		final int[] columns = new int[count];
		for (int i = 0; i < count; i++) {
			columns[i] = offset + 2 * i;
		}
		final int[] rows = new int[y.getRowDimension()];
		for (int r = 0; r < rows.length; r++) {
			rows[r] = r;
		}
		return y.getSubMatrix(rows, columns);
	}

	/**
	 * @return the smallest of {@code counts}
	 * @throws InputShapeException if that is zero
	 */
	static int seriesCount(final String tableName, final int... counts) {
		final int n = Arrays.stream(counts).min().orElse(0);
		if (n <= 0) {
			throw new InputShapeException(AnalysisException.Stage.PREPROCESS,
				tableName + ": no usable data columns (series candidates " + Arrays
					.toString(counts) + "); check the file layout and the row range");
		}
		return n;
	}

	/**
	 * @return the first {@code count} columns of {@code y}
	 */
	static RealMatrix firstColumns(final RealMatrix y, final int count) {
		return y.getSubMatrix(0, y.getRowDimension() - 1, 0, count - 1);
	}

	/**
	 * Drops NaN and repeated values, keeping the first occurrence of each value
	 * in its original position.
	 */
	static double[] uniqueStable(final double[] values) {
		final Set<Double> seen = new LinkedHashSet<>();
		for (final double v : values) {
			if (!Double.isNaN(v)) seen.add(v == 0 ? 0.0 : v); // -0.0 equals 0.0
		}
		final double[] out = new double[seen.size()];
		int i = 0;
		for (final double v : seen) {
			out[i++] = v;
		}
		return out;
	}
}

/**
 * Polar Fit
 * PreprocessorTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

class PreprocessorTest {

	/** rows x columns table, X = 1..rows, Y = 1000 * column + row */
	static SpectrumTable table(final int rows, final int columns,
		final double... headerValues)
	{
		final double[] x = new double[rows];
		final RealMatrix y = new Array2DRowRealMatrix(rows, columns);
		for (int r = 0; r < rows; r++) {
			x[r] = r + 1;
			for (int c = 0; c < columns; c++) {
				y.setEntry(r, c, 1000 * c + r);
			}
		}
		final String[] headers = new String[columns];
		for (int c = 0; c < columns; c++) {
			headers[c] = String.valueOf(headerValues[c]);
		}
		return new SpectrumTable("t", new ArrayRealVector(x), y, headers,
			headerValues);
	}

	@Test
	void windowAndBaselineOnALargeTable() {
		final SpectrumTable t = table(2000, 4, 1, 2, 3, 4);
		final AnalysisSettings s = AnalysisSettings.defaults();
		final SpectrumTable p = Preprocessor.prepare(t, s.getRowStart(), s
			.getRowEnd(), s.getBaseline());
		assertEquals(601, p.getRowCount());
		assertEquals(4, p.getSeriesCount());
		assertEquals(600, p.getX().getEntry(0), 0);
		assertEquals(1200, p.getX().getEntry(600), 0);
		assertEquals(599 - 486, p.getY().getEntry(0, 0), 0);
		assertEquals(3000 + 1199 - 486, p.getY().getEntry(600, 3), 0);
		assertEquals(4, Preprocessor.seriesCount("t", p.getSeriesCount(), p
			.getConditionValues().length));
	}

	@Test
	void baselineLeavesXAlone() {
		final SpectrumTable t = table(3, 1, 0);
		final SpectrumTable b = Preprocessor.subtractBaseline(t, 10);
		assertArrayEquals(t.getX().toArray(), b.getX().toArray(), 0);
		assertArrayEquals(new double[] { -10, -9, -8 }, b.getY().getColumn(0), 0);
		assertArrayEquals(new double[] { 0, 1, 2 }, t.getY().getColumn(0), 0);
	}

	@Test
	void rowRangeOutsideTheTableFails() {
		final SpectrumTable t = table(10, 2, 1, 2);
		final InputShapeException e = assertThrows(InputShapeException.class,
			() -> Preprocessor.truncate(t, 5, 11));
		assertEquals(AnalysisException.Stage.PREPROCESS, e.getStage());
		assertThrows(InputShapeException.class, () -> Preprocessor.truncate(t, -1,
			5));
		assertThrows(InputShapeException.class, () -> Preprocessor.truncate(t, 5,
			5));
	}

	@Test
	void splitsInterleavedChannels() {
		final SpectrumTable t = table(2, 5, 0, 0, 1, 1, 2);
		assertEquals(3, Preprocessor.positiveCount(5));
		assertEquals(2, Preprocessor.negativeCount(5));
		final RealMatrix pos = Preprocessor.positiveColumns(t.getY(), 2);
		final RealMatrix neg = Preprocessor.negativeColumns(t.getY(), 2);
		assertArrayEquals(new double[] { 0, 2000 }, pos.getRow(0), 0);
		assertArrayEquals(new double[] { 1000, 3000 }, neg.getRow(0), 0);
	}

	@Test
	void duplicateConditionValuesKeepTheFirstColumns() {
		final SpectrumTable t = table(4, 3, 1, 2, 2);
		final double[] conditions = t.getConditionValues();
		assertArrayEquals(new double[] { 1, 2 }, conditions, 0);
		final int n = Preprocessor.seriesCount("t", t.getSeriesCount(),
			conditions.length);
		assertEquals(2, n);
		final RealMatrix kept = Preprocessor.firstColumns(t.getY(), n);
		assertEquals(2, kept.getColumnDimension());
		assertArrayEquals(t.getY().getColumn(1), kept.getColumn(1), 0);
	}

	@Test
	void uniqueStableDropsNaNAndKeepsOrder() {
		assertArrayEquals(new double[] { 3, 1, 2 }, Preprocessor.uniqueStable(
			new double[] { 3, Double.NaN, 1, 3, 2, 1 }), 0);
		assertArrayEquals(new double[] { 0 }, Preprocessor.uniqueStable(
			new double[] { -0.0, 0.0 }), 0);
	}

	@Test
	void zeroUsableSeriesFails() {
		final InputShapeException e = assertThrows(InputShapeException.class,
			() -> Preprocessor.seriesCount("t", 3, 0, 2));
		assertEquals(AnalysisException.Stage.PREPROCESS, e.getStage());
	}
}

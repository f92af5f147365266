/**
 * Polar Fit
 * SmootherTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

class SmootherTest {

	private static final double eps = 1e-9;

	private static RealVector polynomial(final int n, final double... c) {
		final RealVector y = new ArrayRealVector(n);
		for (int i = 0; i < n; i++) {
			double v = 0;
			double p = 1;
			for (final double ci : c) {
				v += ci * p;
				p *= i;
			}
			y.setEntry(i, v);
		}
		return y;
	}

	@Test
	void movingMeanOfWindowOneIsIdentity() {
		final RealVector y = new ArrayRealVector(new double[] { 3, -1, 4, 1, 5, 9,
			2, 6 });
		final RealVector out = new Smoother(SmoothingParameters.movmean(1)).smooth(
			y);
		assertArrayEquals(y.toArray(), out.toArray(), 0);
	}

	@Test
	void movingMeanTruncatesAtTheEnds() {
		final RealVector y = new ArrayRealVector(new double[] { 1, 2, 3, 4, 5 });
		assertArrayEquals(new double[] { 1.5, 2, 3, 4, 4.5 }, Smoother.movingMean(
			y, 3).toArray(), eps);
	}

	@Test
	void evenMovingMeanWindowLeansBackward() {
		final RealVector y = new ArrayRealVector(new double[] { 1, 2, 3, 4, 5 });
		assertArrayEquals(new double[] { 1, 1.5, 2.5, 3.5, 4.5 }, Smoother
			.movingMean(y, 2).toArray(), eps);
	}

	@Test
	void movingMeanLeavesOutNaN() {
		final RealVector y = new ArrayRealVector(new double[] { 1, Double.NaN,
			3 });
		assertArrayEquals(new double[] { 1, 2, 3 }, Smoother.movingMean(y, 3)
			.toArray(), eps);
	}

	@Test
	void loessReproducesAQuadratic() {
		final RealVector y = polynomial(40, 2, -0.5, 0.03);
		final RealVector out = new Smoother(SmoothingParameters.loess(0.25))
			.smooth(y);
		assertArrayEquals(y.toArray(), out.toArray(), 1e-7);
	}

	@Test
	void lowessReproducesALine() {
		final RealVector y = polynomial(30, 1, 0.7);
		final RealVector out = new Smoother(SmoothingParameters.lowess(0.2))
			.smooth(y);
		assertArrayEquals(y.toArray(), out.toArray(), 1e-7);
	}

	@Test
	void loessFlattensNoise() {
		final RealVector y = new ArrayRealVector(60);
		for (int i = 0; i < 60; i++) {
			y.setEntry(i, 10 + (i % 2 == 0 ? 1 : -1));
		}
		final RealVector out = new Smoother(SmoothingParameters.loess(0.3)).smooth(
			y);
		for (int i = 5; i < 55; i++) {
			assertEquals(10, out.getEntry(i), 0.2);
		}
	}

	@Test
	void tinySpanKeepsTheData() {
		final RealVector y = new ArrayRealVector(new double[] { 5, 1, 4, 2, 3 });
		assertArrayEquals(y.toArray(), Smoother.localRegression(y, 0.1, 2)
			.toArray(), 0);
	}

	@Test
	void savitzkyGolayReproducesItsPolynomialDegree() {
		final RealVector y = polynomial(25, 1, -2, 0.5, 0.01);
		final RealVector out = new Smoother(SmoothingParameters.sgolay(3, 7))
			.smooth(y);
		assertArrayEquals(y.toArray(), out.toArray(), 1e-7);
	}

	@Test
	void savitzkyGolayAveragesNoiseInTheInterior() {
		final RealVector y = new ArrayRealVector(new double[] { 0, 3, 0, 3, 0, 3,
			0, 3, 0 });
		final RealVector out = Smoother.savitzkyGolay(y, 0, 3);
		assertEquals(1, out.getEntry(1), eps);
		assertEquals(2, out.getEntry(2), eps);
		assertEquals(1, out.getEntry(0), eps); // first frame mean
		assertEquals(1, out.getEntry(8), eps); // last frame mean
	}

	@Test
	void savitzkyGolayFrameLongerThanSeriesFails() {
		final Smoother smoother = new Smoother(SmoothingParameters.sgolay(2, 9));
		final ConfigurationException e = assertThrows(
			ConfigurationException.class, () -> smoother.smooth(
				new ArrayRealVector(5)));
		assertEquals(AnalysisException.Stage.SMOOTH, e.getStage());
		assertEquals(AnalysisSettings.SMOOTH_PARAM, e.getParameter());
	}

	@Test
	void columnsAreSmoothedIndependently() {
		final RealMatrix m = new Array2DRowRealMatrix(new double[][] { { 1, 10 },
			{ 2, 20 }, { 3, 30 }, { 4, 40 } });
		final RealMatrix out = new Smoother(SmoothingParameters.movmean(3)).smooth(
			m);
		assertEquals(4, out.getRowDimension());
		assertEquals(2, out.getColumnDimension());
		assertArrayEquals(new double[] { 1.5, 2, 3, 3.5 }, out.getColumn(0), eps);
		assertArrayEquals(new double[] { 15, 20, 30, 35 }, out.getColumn(1), eps);
		assertEquals(1, m.getEntry(0, 0), 0); // input untouched
	}
}

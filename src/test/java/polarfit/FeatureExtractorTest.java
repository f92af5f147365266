/**
 * Polar Fit
 * FeatureExtractorTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

class FeatureExtractorTest {

	private final FeatureExtractor full = new FeatureExtractor(AreaMode.FULL);

	private static RealVector vector(final double... v) {
		return new ArrayRealVector(v);
	}

	@Test
	void constantColumnSpansTheWholeRange() {
		final SpectralFeatures f = full.extract(vector(1, 2, 3, 4, 5), vector(3, 3,
			3, 3, 3));
		assertEquals(1, f.getPeakX(), 0);
		assertEquals(3, f.getPeakY(), 0);
		assertEquals(4, f.getFWHM(), 0);
		assertEquals(12, f.getArea(), 1e-12);
	}

	@Test
	void allZeroColumn() {
		final SpectralFeatures f = full.extract(vector(1.5, 1.6, 1.7), vector(0, 0,
			0));
		assertEquals(1.5, f.getPeakX(), 0);
		assertEquals(0, f.getPeakY(), 0);
		assertTrue(Double.isNaN(f.getFWHM()));
		assertEquals(0, f.getArea(), 0);
	}

	@Test
	void peakIsTheFirstMaximumIgnoringNaN() {
		final SpectralFeatures f = full.extract(vector(0, 1, 2, 3, 4), vector(
			Double.NaN, 5, 1, 5, 0));
		assertEquals(1, f.getPeakX(), 0);
		assertEquals(5, f.getPeakY(), 0);
		assertEquals(2, f.getFWHM(), 0);
		assertEquals(1, f.getHalfMaxStart(), 0);
		assertEquals(3, f.getHalfMaxEnd(), 0);
	}

	@Test
	void descendingXGivesTheSameAreaAndFWHM() {
		final double[] x = new double[101];
		final double[] y = new double[101];
		for (int i = 0; i < x.length; i++) {
			x[i] = 1.5 + 0.002 * i;
			y[i] = 100 * Math.exp(-Math.pow((x[i] - 1.6) / 0.02, 2) / 2);
		}
		final double[] xr = new double[x.length];
		final double[] yr = new double[y.length];
		for (int i = 0; i < x.length; i++) {
			xr[i] = x[x.length - 1 - i];
			yr[i] = y[y.length - 1 - i];
		}
		final SpectralFeatures up = full.extract(vector(x), vector(y));
		final SpectralFeatures down = full.extract(vector(xr), vector(yr));
		assertEquals(up.getArea(), down.getArea(), 1e-12);
		assertEquals(up.getFWHM(), down.getFWHM(), 1e-12);
		assertEquals(1.6, up.getPeakX(), 1e-12);
		// Gaussian: FWHM = 2.3548 sigma, within one sample spacing on each side
		assertEquals(2.3548 * 0.02, up.getFWHM(), 2 * 0.002);
		assertEquals(100 * 0.02 * Math.sqrt(2 * Math.PI), up.getArea(), 1e-3);
	}

	@Test
	void positiveOnlyAreaSkipsNegativeSamples() {
		final RealVector x = vector(0, 1, 2, 3);
		final RealVector y = vector(-1, 2, 2, -1);
		assertEquals(3, full.extract(x, y).getArea(), 1e-12);
		assertEquals(2, new FeatureExtractor(AreaMode.POSITIVE_ONLY).extract(x, y)
			.getArea(), 1e-12);
	}

	@Test
	void areaIsAlwaysAMagnitude() {
		assertEquals(1, FeatureExtractor.trapezoidArea(new double[] { 0, 1 },
			new double[] { -1, -1 }), 0);
	}

	@Test
	void summarizesEverySeries() {
		final RealVector x = vector(0, 1, 2);
		final RealMatrix raw = new Array2DRowRealMatrix(new double[][] { { 1, 0 },
			{ 4, 2 }, { 1, 8 } });
		final RealMatrix smoothed = raw.scalarMultiply(0.5);
		final Channel c = full.summarize(Channel.POSITIVE, x, raw, smoothed,
			new double[] { 0.5, 1.0 });
		assertEquals(2, c.getSeriesCount());
		assertEquals(1, c.getRawFeatures(0).getPeakX(), 0);
		assertEquals(2, c.getRawFeatures(1).getPeakX(), 0);
		assertEquals(4, c.getSmoothedFeatures(1).getPeakY(), 0);
		assertEquals(1.0, c.getCondition(1), 0);
	}
}

/**
 * Polar Fit
 * GFactorFitterTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Test;

class GFactorFitterTest {

	private final GFactorFitter fitter = new GFactorFitter();

	@Test
	void recoversAnExactSlope() {
		final RealVector b = new ArrayRealVector(new double[] { -2, -1, 0, 1, 2,
			3 });
		final GFactorFit fit = fitter.fit(b, b.mapMultiply(2.5));
		assertTrue(fit.isValid());
		assertEquals(2.5, fit.getG(), 1e-6);
		assertEquals(2.5 * GFactorFitter.alpha, fit.getSlope(), 1e-5);
		assertEquals(7.5, fit.getFitted().getEntry(5), 1e-6);
		assertEquals(0, fit.getRMS(), 1e-9);
	}

	@Test
	void leastSquaresThroughTheOrigin() {
		// g = sum(b * s) / sum(b * b)
		final RealVector b = new ArrayRealVector(new double[] { 1, 2, 3 });
		final RealVector s = new ArrayRealVector(new double[] { 1, 3, 2 });
		assertEquals(13.0 / 14.0, fitter.fit(b, s).getG(), 1e-9);
	}

	@Test
	void skipsPairsWithNaN() {
		final RealVector b = new ArrayRealVector(new double[] { 1, Double.NaN, 2,
			3 });
		final RealVector s = new ArrayRealVector(new double[] { -1.5, 4, -3,
			Double.NaN });
		final GFactorFit fit = fitter.fit(b, s);
		assertEquals(-1.5, fit.getG(), 1e-6);
		assertEquals(4, fit.getFitted().getDimension());
	}

	@Test
	void noUsableFieldGivesNaN() {
		final GFactorFit zeros = fitter.fit(new ArrayRealVector(3),
			new ArrayRealVector(new double[] { 1, 2, 3 }));
		assertFalse(zeros.isValid());
		assertTrue(Double.isNaN(zeros.getG()));
		assertTrue(Double.isNaN(zeros.getSlope()));

		final GFactorFit none = fitter.fit(new ArrayRealVector(new double[] {
			Double.NaN }), new ArrayRealVector(new double[] { 1 }));
		assertFalse(none.isValid());
		assertTrue(Double.isNaN(none.getFitted().getEntry(0)));
	}
}

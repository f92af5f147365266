/**
 * Polar Fit
 * GFactorFitter.java
 *
 */

package polarfit;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Least-squares fit of the Zeeman model {@code shift = g * B}, a line through
 * the origin. The optimizer starts from the free-electron value.
 */
class GFactorFitter {

	/** Ratio between the fitted meV/T splitting rate and the g-factor. */
	public static final double alpha = 17.2759858;
	public static final double freeElectronG = 2;

	private static final int maxIter = 1000;

	/**
	 * @param field condition values B
	 * @param shift Zeeman splitting per series, meV
	 * @return the fit; g and slope are NaN when no pair with a finite value and
	 *         a non-zero field is available or the optimizer fails
	 */
	public GFactorFit fit(final RealVector field, final RealVector shift) {
		if (field.getDimension() != shift.getDimension()) {
			throw new DimensionMismatchException(shift.getDimension(), field
				.getDimension());
		}
		RealVector b = new ArrayRealVector();
		RealVector s = new ArrayRealVector();
		boolean nonZero = false;
		for (int i = 0; i < field.getDimension(); i++) {
			final double bi = field.getEntry(i);
			final double si = shift.getEntry(i);
			if (Double.isNaN(bi) || Double.isNaN(si)) continue;
			b = b.append(bi);
			s = s.append(si);
			if (bi != 0) nonZero = true;
		}
		if (b.getDimension() == 0) {
			return GFactorFit.failed(field, "no usable (B, shift) pairs");
		}
		if (!nonZero) {
			return GFactorFit.failed(field, "every field value is zero");
		}

		final RealVector fb = b;
		final MultivariateJacobianFunction model = point -> {
			final RealVector value = fb.mapMultiply(point.getEntry(0));
			final RealMatrix jacobian = new Array2DRowRealMatrix(fb.getDimension(),
				1);
			jacobian.setColumnVector(0, fb);
			return new Pair<>(value, jacobian);
		};
		final LeastSquaresProblem problem = new LeastSquaresBuilder().start(
			new double[] { freeElectronG }).model(model).target(s).lazyEvaluation(
				false).maxEvaluations(maxIter).maxIterations(maxIter).build();

		final LeastSquaresOptimizer.Optimum optimum;
		try {
			optimum = new LevenbergMarquardtOptimizer().optimize(problem);
		}
		catch (final MathIllegalStateException e) {
			return GFactorFit.failed(field, "optimizer failed: " + e.getMessage());
		}
		final double g = optimum.getPoint().getEntry(0);
		return new GFactorFit(g, field.mapMultiply(g), optimum.getRMS(), null);
	}
}

/**
 * Result of {@link GFactorFitter#fit}: g, the derived slope g * alpha and the
 * fitted shift at every field value.
 */
class GFactorFit {

	private final double g;
	private final RealVector fitted;
	private final double rms;
	private final String failure;

	GFactorFit(final double g, final RealVector fitted, final double rms,
		final String failure)
	{
		this.g = g;
		this.fitted = fitted;
		this.rms = rms;
		this.failure = failure;
	}

	static GFactorFit failed(final RealVector field, final String reason) {
		final RealVector nan = new ArrayRealVector(field.getDimension(),
			Double.NaN);
		return new GFactorFit(Double.NaN, nan, Double.NaN, reason);
	}

	public double getG() {
		return g;
	}

	public double getSlope() {
		return g * GFactorFitter.alpha;
	}

	/**
	 * @return g * B for every field value given to the fitter, meV
	 */
	public RealVector getFitted() {
		return fitted.copy();
	}

	public double getRMS() {
		return rms;
	}

	public boolean isValid() {
		return failure == null;
	}

	/**
	 * @return why the fit produced no value, null for a valid fit
	 */
	public String getFailure() {
		return failure;
	}
}

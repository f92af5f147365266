/**
 * Polar Fit
 * Smoother.java
 *
 */

package polarfit;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Smooths spectrum columns. Every column is processed on its own and the
 * output always has the length of the input; the sample index is used as
 * abscissa.
 */
class Smoother {

	private final SmoothingParameters parameters;

	public Smoother(final SmoothingParameters parameters) {
		this.parameters = parameters;
	}

	/**
	 * Smooths each column of {@code matrix} independently.
	 *
	 * @return a new matrix of the same dimensions
	 */
	public RealMatrix smooth(final RealMatrix matrix) {
		final RealMatrix out = matrix.copy();
		for (int c = 0; c < matrix.getColumnDimension(); c++) {
			out.setColumnVector(c, smooth(matrix.getColumnVector(c)));
		}
		return out;
	}

	public RealVector smooth(final RealVector y) {
		if (y.getDimension() == 0) return y.copy();
		switch (parameters.getMethod()) {
			case LOESS:
			case LOWESS:
				return localRegression(y, parameters.getSpan(), parameters.getOrder());
			case MOVMEAN:
				return movingMean(y, parameters.getWindow());
			case SGOLAY:
				return savitzkyGolay(y, parameters.getOrder(), parameters.getFrame());
			default:
				throw new ConfigurationException(AnalysisException.Stage.SMOOTH,
					AnalysisSettings.SMOOTH_TYPE, "unsupported method " + parameters
						.getMethod());
		}
	}

	/**
	 * Locally weighted polynomial regression. For each sample the
	 * ceil(span * n) nearest samples are fitted with tricube weights; the window
	 * is shifted inward at both ends.
	 */
	static RealVector localRegression(final RealVector y, final double span,
		final int degree)
	{
		final int n = y.getDimension();
		final int k = FastMath.max(1, FastMath.min(n, (int) FastMath.ceil(span *
			n - 1e-9)));
		if (k == 1) return y.copy();

		final RealVector out = new ArrayRealVector(n);
		for (int i = 0; i < n; i++) {
			final int lo = FastMath.max(0, FastMath.min(i - (k - 1) / 2, n - k));
			final int hi = lo + k - 1;
			final double dmax = FastMath.max(i - lo, hi - i);

			// rows with a positive weight and a finite value take part in the fit
			final double[] t = new double[k];
			final double[] sw = new double[k];
			final double[] v = new double[k];
			int m = 0;
			for (int j = lo; j <= hi; j++) {
				final double yj = y.getEntry(j);
				if (Double.isNaN(yj)) continue;
				final double u = FastMath.abs(j - i) / dmax;
				final double w = FastMath.pow(1 - u * u * u, 3);
				if (w <= 0) continue;
				t[m] = j - i;
				sw[m] = FastMath.sqrt(w);
				v[m] = yj;
				m++;
			}
			if (m == 0) {
				out.setEntry(i, Double.NaN);
				continue;
			}
			final int deg = FastMath.min(degree, m - 1);
			final RealMatrix design = new Array2DRowRealMatrix(m, deg + 1);
			final RealVector rhs = new ArrayRealVector(m);
			for (int r = 0; r < m; r++) {
				double p = 1;
				for (int c = 0; c <= deg; c++) {
					design.setEntry(r, c, sw[r] * p);
					p *= t[r];
				}
				rhs.setEntry(r, sw[r] * v[r]);
			}
			// abscissa is centered on sample i: the intercept is the smoothed value
			final RealVector beta = new QRDecomposition(design).getSolver().solve(
				rhs);
			out.setEntry(i, beta.getEntry(0));
		}
		return out;
	}

	/**
	 * Centered moving average. An even window holds one more sample before the
	 * center than after it; windows are truncated at the ends and NaN samples
	 * are left out of the mean.
	 */
	static RealVector movingMean(final RealVector y, final int window) {
		final int n = y.getDimension();
		final int before = window / 2;
		final int after = (window - 1) / 2;
		final RealVector out = new ArrayRealVector(n);
		for (int i = 0; i < n; i++) {
			final int lo = FastMath.max(0, i - before);
			final int hi = FastMath.min(n - 1, i + after);
			double sum = 0;
			int count = 0;
			for (int j = lo; j <= hi; j++) {
				final double v = y.getEntry(j);
				if (Double.isNaN(v)) continue;
				sum += v;
				count++;
			}
			out.setEntry(i, count == 0 ? Double.NaN : sum / count);
		}
		return out;
	}

	/**
	 * Savitzky-Golay filter. Interior samples use the central row of the
	 * projection matrix; the first and last half frame are evaluated from the
	 * polynomial fitted to the first and last full frame.
	 */
	static RealVector savitzkyGolay(final RealVector y, final int order,
		final int frame)
	{
		final int n = y.getDimension();
		if (frame > n) {
			throw new ConfigurationException(AnalysisException.Stage.SMOOTH,
				AnalysisSettings.SMOOTH_PARAM, "Savitzky-Golay frame length " + frame +
					" exceeds the " + n + " samples of the series");
		}
		final int half = (frame - 1) / 2;
		final RealMatrix projection = projectionMatrix(order, frame);
		final RealVector out = new ArrayRealVector(n);

		for (int i = half; i < n - half; i++) {
			out.setEntry(i, projection.getRowVector(half).dotProduct(y.getSubVector(
				i - half, frame)));
		}
		final RealVector first = y.getSubVector(0, frame);
		final RealVector last = y.getSubVector(n - frame, frame);
		for (int r = 0; r < half; r++) {
			out.setEntry(r, projection.getRowVector(r).dotProduct(first));
			final int e = frame - half + r;
			out.setEntry(n - frame + e, projection.getRowVector(e).dotProduct(last));
		}
		return out;
	}

	/**
	 * @return the frame x frame hat matrix A (A'A)^-1 A' of a polynomial fit
	 *         over offsets -half..half
	 */
	private static RealMatrix projectionMatrix(final int order,
		final int frame)
	{
		final int half = (frame - 1) / 2;
		final RealMatrix design = new Array2DRowRealMatrix(frame, order + 1);
		for (int r = 0; r < frame; r++) {
			double p = 1;
			for (int c = 0; c <= order; c++) {
				design.setEntry(r, c, p);
				p *= r - half;
			}
		}
		final DecompositionSolver solver = new QRDecomposition(design)
			.getSolver();
		return design.multiply(solver.getInverse());
	}
}

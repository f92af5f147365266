/**
 * Polar Fit
 * FeatureExtractor.java
 *
 */

package polarfit;

import java.util.stream.IntStream;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Extracts peak position, peak intensity, FWHM and integrated area from a
 * single spectrum column.
 */
class FeatureExtractor {

	private final AreaMode areaMode;

	public FeatureExtractor(final AreaMode areaMode) {
		this.areaMode = areaMode;
	}

	/**
	 * @param x shared X axis
	 * @param y one intensity column, same length as {@code x}
	 */
	public SpectralFeatures extract(final RealVector x, final RealVector y) {
		if (x.getDimension() != y.getDimension()) {
			throw new DimensionMismatchException(y.getDimension(), x.getDimension());
		}
		final double[] xv = x.toArray();
		final double[] yv = y.toArray();

		// first maximum, NaN samples ignored
		int k = -1;
		for (int i = 0; i < yv.length; i++) {
			if (Double.isNaN(yv[i])) continue;
			if (k < 0 || yv[i] > yv[k]) k = i;
		}
		if (k < 0) {
			return new SpectralFeatures(Double.NaN, Double.NaN, Double.NaN,
				Double.NaN, Double.NaN, integrate(xv, yv));
		}
		final double peakX = xv[k];
		final double peakY = yv[k];

		// half maximum of a column without a positive maximum is undefined
		double fwhm = Double.NaN;
		double left = Double.NaN;
		double right = Double.NaN;
		if (peakY > 0) {
			final double halfMax = peakY / 2;
			int first = -1;
			int last = -1;
			for (int i = 0; i < yv.length; i++) {
				if (yv[i] >= halfMax) {
					if (first < 0) first = i;
					last = i;
				}
			}
			left = xv[first];
			right = xv[last];
			fwhm = FastMath.abs(right - left);
		}
		return new SpectralFeatures(peakX, peakY, fwhm, left, right, integrate(xv,
			yv));
	}

	/**
	 * Extracts the features of every series of a channel, raw and smoothed.
	 * Series are independent and processed in parallel.
	 */
	public Channel summarize(final String name, final RealVector x,
		final RealMatrix raw, final RealMatrix smoothed, final double[] conditions)
	{
		final int n = raw.getColumnDimension();
		if (smoothed.getColumnDimension() != n) {
			throw new DimensionMismatchException(smoothed.getColumnDimension(), n);
		}
		if (conditions.length != n) {
			throw new DimensionMismatchException(conditions.length, n);
		}
		final SpectralFeatures[] rawFeatures = new SpectralFeatures[n];
		final SpectralFeatures[] smoothedFeatures = new SpectralFeatures[n];
		IntStream.range(0, n).parallel().forEach(i -> {
			rawFeatures[i] = extract(x, raw.getColumnVector(i));
			smoothedFeatures[i] = extract(x, smoothed.getColumnVector(i));
		});
		return new Channel(name, x, raw, smoothed, conditions, rawFeatures,
			smoothedFeatures);
	}

	private double integrate(final double[] x, final double[] y) {
		if (areaMode == AreaMode.FULL) return trapezoidArea(x, y);
		int m = 0;
		for (final double v : y) {
			if (v > 0) m++;
		}
		final double[] xs = new double[m];
		final double[] ys = new double[m];
		m = 0;
		for (int i = 0; i < y.length; i++) {
			if (y[i] > 0) {
				xs[m] = x[i];
				ys[m] = y[i];
				m++;
			}
		}
		return trapezoidArea(xs, ys);
	}

	/**
	 * Magnitude of the trapezoidal integral of {@code y} over {@code x}. A
	 * descending X axis is integrated in reverse so the direction does not
	 * change the result.
	 */
	static double trapezoidArea(final double[] x, final double[] y) {
		if (x.length < 2) return 0;
		final boolean descending = x[0] > x[x.length - 1];
		double sum = 0;
		for (int i = 1; i < x.length; i++) {
			final int a = descending ? x.length - i : i - 1;
			final int b = descending ? x.length - i - 1 : i;
			sum += (x[b] - x[a]) * (y[a] + y[b]) / 2;
		}
		return FastMath.abs(sum);
	}
}

/**
 * Features of one spectrum column. FWHM is NaN when no sample reaches half of
 * a positive maximum; the area is never negative.
 */
class SpectralFeatures {

	private final double peakX;
	private final double peakY;
	private final double fwhm;
	private final double halfMaxStart; // X of the first sample at half maximum
	private final double halfMaxEnd; // X of the last one
	private final double area;

	public SpectralFeatures(final double peakX, final double peakY,
		final double fwhm, final double halfMaxStart, final double halfMaxEnd,
		final double area)
	{
		this.peakX = peakX;
		this.peakY = peakY;
		this.fwhm = fwhm;
		this.halfMaxStart = halfMaxStart;
		this.halfMaxEnd = halfMaxEnd;
		this.area = area;
	}

	public double getPeakX() {
		return peakX;
	}

	public double getPeakY() {
		return peakY;
	}

	public double getFWHM() {
		return fwhm;
	}

	public double getHalfMaxStart() {
		return halfMaxStart;
	}

	public double getHalfMaxEnd() {
		return halfMaxEnd;
	}

	public double getArea() {
		return area;
	}

	@Override
	public String toString() {
		return String.format("peak (%1$.4f, %2$.2f), FWHM %3$.4f, area %4$.4f",
			peakX, peakY, fwhm, area);
	}
}

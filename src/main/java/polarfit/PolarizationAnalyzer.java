/**
 * Polar Fit
 * PolarizationAnalyzer.java
 *
 */

package polarfit;

import java.util.Arrays;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Combines the positive and negative channel features of a circular
 * polarization measurement into DOCP and Zeeman splitting series. The
 * channels are read, never modified.
 */
class PolarizationAnalyzer {

	/** eV to meV */
	static final double energyScale = 1e3;

	public PolarizationResult analyze(final Channel positive,
		final Channel negative)
	{
		final int n = positive.getSeriesCount();
		if (negative.getSeriesCount() != n) {
			throw new InputShapeException(AnalysisException.Stage.ANALYZE,
				"positive channel has " + n + " series, negative channel has " +
					negative.getSeriesCount());
		}
		final RealVector docpRaw = new ArrayRealVector(n);
		final RealVector docpSmoothed = new ArrayRealVector(n);
		final RealVector zeemanRaw = new ArrayRealVector(n);
		final RealVector zeemanSmoothed = new ArrayRealVector(n);

		for (int i = 0; i < n; i++) {
			final SpectralFeatures pr = positive.getRawFeatures(i);
			final SpectralFeatures nr = negative.getRawFeatures(i);
			final SpectralFeatures ps = positive.getSmoothedFeatures(i);
			final SpectralFeatures ns = negative.getSmoothedFeatures(i);

			docpRaw.setEntry(i, docp(pr.getPeakY(), nr.getPeakY()));
			docpSmoothed.setEntry(i, docp(ps.getPeakY(), ns.getPeakY()));
			zeemanRaw.setEntry(i, (pr.getPeakX() - nr.getPeakX()) * energyScale);
			zeemanSmoothed.setEntry(i, (ps.getPeakX() - ns.getPeakX()) *
				energyScale);
		}
		return new PolarizationResult(new ArrayRealVector(positive
			.getConditions()), docpRaw, docpSmoothed, zeemanRaw, zeemanSmoothed);
	}

	/**
	 * Degree of circular polarization, (I+ - I-) / (I+ + I-). NaN when the
	 * total intensity is zero.
	 */
	static double docp(final double positive, final double negative) {
		final double total = positive + negative;
		if (total == 0) return Double.NaN;
		return (positive - negative) / total;
	}
}

/**
 * DOCP and Zeeman splitting per series. Zeeman values are in meV.
 */
class PolarizationResult {

	private final RealVector field;
	private final RealVector docpRaw;
	private final RealVector docpSmoothed;
	private final RealVector zeemanRaw;
	private final RealVector zeemanSmoothed;

	PolarizationResult(final RealVector field, final RealVector docpRaw,
		final RealVector docpSmoothed, final RealVector zeemanRaw,
		final RealVector zeemanSmoothed)
	{
		this.field = field;
		this.docpRaw = docpRaw;
		this.docpSmoothed = docpSmoothed;
		this.zeemanRaw = zeemanRaw;
		this.zeemanSmoothed = zeemanSmoothed;
	}

	public int getSeriesCount() {
		return field.getDimension();
	}

	/**
	 * @return condition value (magnetic field) of each series
	 */
	public RealVector getField() {
		return field.copy();
	}

	public RealVector getDocpRaw() {
		return docpRaw.copy();
	}

	public RealVector getDocpSmoothed() {
		return docpSmoothed.copy();
	}

	public RealVector getZeemanRaw() {
		return zeemanRaw.copy();
	}

	public RealVector getZeemanSmoothed() {
		return zeemanSmoothed.copy();
	}

	public double getMeanDocpRaw() {
		return meanOmitNaN(docpRaw);
	}

	public double getMeanDocpSmoothed() {
		return meanOmitNaN(docpSmoothed);
	}

	/**
	 * @return mean of the non-NaN entries, NaN if there is none
	 */
	static double meanOmitNaN(final RealVector v) {
		return StatUtils.mean(Arrays.stream(v.toArray()).filter(d -> !Double
			.isNaN(d)).toArray());
	}
}

/**
 * Polar Fit
 * Channel.java
 *
 */

package polarfit;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * One acquisition channel after smoothing and feature extraction: the raw
 * and smoothed series on a shared X axis, the condition value of each series
 * and its raw and smoothed {@link SpectralFeatures}, indexed by series
 * position.
 */
class Channel {

	static final String POSITIVE = "Positive";
	static final String NEGATIVE = "Negative";

	private final String name;
	private final RealVector x;
	private final RealMatrix raw;
	private final RealMatrix smoothed;
	private final double[] conditions;
	private final SpectralFeatures[] rawFeatures;
	private final SpectralFeatures[] smoothedFeatures;

	Channel(final String name, final RealVector x, final RealMatrix raw,
		final RealMatrix smoothed, final double[] conditions,
		final SpectralFeatures[] rawFeatures,
		final SpectralFeatures[] smoothedFeatures)
	{
		this.name = name;
		this.x = x;
		this.raw = raw;
		this.smoothed = smoothed;
		this.conditions = conditions.clone();
		this.rawFeatures = rawFeatures.clone();
		this.smoothedFeatures = smoothedFeatures.clone();
	}

	public String getName() {
		return name;
	}

	public int getSeriesCount() {
		return conditions.length;
	}

	public RealVector getX() {
		return x;
	}

	public RealMatrix getRaw() {
		return raw;
	}

	public RealMatrix getSmoothed() {
		return smoothed;
	}

	public double getCondition(final int series) {
		return conditions[series];
	}

	public double[] getConditions() {
		return conditions.clone();
	}

	public SpectralFeatures getRawFeatures(final int series) {
		return rawFeatures[series];
	}

	public SpectralFeatures getSmoothedFeatures(final int series) {
		return smoothedFeatures[series];
	}
}

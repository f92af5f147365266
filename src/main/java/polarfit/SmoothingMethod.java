/**
 * Polar Fit
 * SmoothingMethod.java
 *
 */

package polarfit;

import java.util.Locale;

/**
 * Curve smoothing methods available to the {@link Smoother}.
 */
public enum SmoothingMethod {

	/** Local quadratic regression with tricube weights. */
	LOESS("loess"),
	/** Local linear regression with tricube weights. */
	LOWESS("lowess"),
	/** Centered moving average. */
	MOVMEAN("movmean"),
	/** Savitzky-Golay polynomial filter. */
	SGOLAY("sgolay");

	private final String key;

	SmoothingMethod(final String key) {
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	/**
	 * @param name method name as written in the settings, case insensitive
	 * @throws ConfigurationException if no method has that name
	 */
	public static SmoothingMethod fromName(final String name) {
		if (name != null) {
			final String k = name.trim().toLowerCase(Locale.ROOT);
			for (final SmoothingMethod m : values()) {
				if (m.key.equals(k)) return m;
			}
		}
		throw new ConfigurationException(AnalysisSettings.SMOOTH_TYPE,
			"unknown smoothing method '" + name +
				"' (expected loess, lowess, movmean or sgolay)");
	}

	@Override
	public String toString() {
		return key;
	}
}

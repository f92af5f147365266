/**
 * Polar Fit
 * AreaMode.java
 *
 */

package polarfit;

import java.util.Locale;

/**
 * Which samples enter the integrated peak area.
 */
public enum AreaMode {
	/** Trapezoidal integral over the whole column. */
	FULL,
	/** Trapezoidal integral over the samples above zero only. */
	POSITIVE_ONLY;

	static AreaMode fromName(final String name) {
		final String k = name == null ? "" : name.trim().toLowerCase(Locale.ROOT)
			.replace('-', '_');
		if (k.equals("full")) return FULL;
		if (k.equals("positive") || k.equals("positive_only")) return POSITIVE_ONLY;
		throw new ConfigurationException(AnalysisSettings.AREA_MODE,
			"expected 'full' or 'positive', got '" + name + "'");
	}
}

/**
 * Polar Fit
 * SmoothingParameters.java
 *
 */

package polarfit;

/**
 * A smoothing method together with its numeric parameters. Instances are
 * validated on creation.
 */
public final class SmoothingParameters {

	static final int defaultSgolayOrder = 2;

	private final SmoothingMethod method;
	private final double span; // loess, lowess: fraction of all points
	private final int window; // movmean: width in samples
	private final int order; // sgolay
	private final int frame; // sgolay

	private SmoothingParameters(final SmoothingMethod method, final double span,
		final int window, final int order, final int frame)
	{
		this.method = method;
		this.span = span;
		this.window = window;
		this.order = order;
		this.frame = frame;
	}

	public static SmoothingParameters loess(final double span) {
		checkSpan(span);
		return new SmoothingParameters(SmoothingMethod.LOESS, span, 0, 2, 0);
	}

	public static SmoothingParameters lowess(final double span) {
		checkSpan(span);
		return new SmoothingParameters(SmoothingMethod.LOWESS, span, 0, 1, 0);
	}

	public static SmoothingParameters movmean(final int window) {
		if (window < 1) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"moving average window must be at least 1 sample, got " + window);
		}
		return new SmoothingParameters(SmoothingMethod.MOVMEAN, 0, window, 0, 0);
	}

	public static SmoothingParameters sgolay(final int order, final int frame) {
		if (order < 0) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"Savitzky-Golay order must not be negative, got " + order);
		}
		if (frame % 2 == 0) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"Savitzky-Golay frame length must be odd, got " + frame);
		}
		if (frame <= order) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"Savitzky-Golay frame length " + frame +
					" must be larger than the order " + order);
		}
		return new SmoothingParameters(SmoothingMethod.SGOLAY, 0, 0, order, frame);
	}

	/**
	 * Builds the parameters from their textual settings form: a span for
	 * loess/lowess, a window for movmean, "order,frame" (or a lone frame with
	 * order 2) for sgolay.
	 */
	public static SmoothingParameters parse(final SmoothingMethod method,
		final String param)
	{
		final String p = param == null ? "" : param.trim();
		try {
			switch (method) {
				case LOESS:
					return loess(Double.parseDouble(p));
				case LOWESS:
					return lowess(Double.parseDouble(p));
				case MOVMEAN:
					return movmean(toWholeNumber(p));
				case SGOLAY:
					final String[] parts = p.split("[,;\\s]+");
					if (parts.length == 1) return sgolay(defaultSgolayOrder,
						toWholeNumber(parts[0]));
					if (parts.length == 2) return sgolay(toWholeNumber(parts[0]),
						toWholeNumber(parts[1]));
					throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
						"expected 'order,frame' for sgolay, got '" + p + "'");
				default:
					throw new ConfigurationException(AnalysisSettings.SMOOTH_TYPE,
						"unsupported method " + method);
			}
		}
		catch (final NumberFormatException e) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"'" + p + "' is not a valid parameter for " + method, e);
		}
	}

	private static int toWholeNumber(final String s) {
		final double d = Double.parseDouble(s.trim());
		if (d != Math.rint(d)) throw new NumberFormatException(s);
		return (int) d;
	}

	private static void checkSpan(final double span) {
		if (!(span > 0 && span <= 1)) {
			throw new ConfigurationException(AnalysisSettings.SMOOTH_PARAM,
				"span must lie in (0, 1], got " + span);
		}
	}

	public SmoothingMethod getMethod() {
		return method;
	}

	public double getSpan() {
		return span;
	}

	public int getWindow() {
		return window;
	}

	/**
	 * @return polynomial degree: 2 for loess, 1 for lowess, the filter order
	 *         for sgolay
	 */
	public int getOrder() {
		return order;
	}

	public int getFrame() {
		return frame;
	}

	/**
	 * @return the parameter as written in the run log, e.g. "span = 0.2"
	 */
	public String describe() {
		switch (method) {
			case LOESS:
			case LOWESS:
				return String.format("span = %s", format(span));
			case MOVMEAN:
				return String.format("window = %d", window);
			default:
				return String.format("order = %d, frame = %d", order, frame);
		}
	}

	private static String format(final double d) {
		return d == Math.rint(d) ? String.format("%.0f", d) : Double.toString(d);
	}

	@Override
	public String toString() {
		return method + " (" + describe() + ")";
	}
}

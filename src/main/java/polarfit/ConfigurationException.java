/**
 * Polar Fit
 * ConfigurationException.java
 *
 */

package polarfit;

/**
 * A recognized option has an unusable value, e.g. an unknown smoothing method
 * or a Savitzky-Golay frame that is even or not larger than the order.
 */
public class ConfigurationException extends AnalysisException {

	private static final long serialVersionUID = 1L;

	private final String parameter;

	public ConfigurationException(final String parameter, final String message) {
		this(Stage.CONFIGURE, parameter, message);
	}

	public ConfigurationException(final Stage stage, final String parameter,
		final String message)
	{
		super(stage, parameter + ": " + message);
		this.parameter = parameter;
	}

	public ConfigurationException(final String parameter, final String message,
		final Throwable cause)
	{
		super(Stage.CONFIGURE, parameter + ": " + message, cause);
		this.parameter = parameter;
	}

	public String getParameter() {
		return parameter;
	}
}

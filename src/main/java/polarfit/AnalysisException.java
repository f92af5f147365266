/**
 * Polar Fit
 * AnalysisException.java
 *
 */

package polarfit;

import java.util.Locale;

/**
 * Failure of one pipeline stage. The run for the current input file is
 * aborted; the message names the offending input or parameter.
 */
public class AnalysisException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Stage {
		CONFIGURE, INGEST, PREPROCESS, SMOOTH, EXTRACT, ANALYZE, FIT, ASSEMBLE, EXPORT
	}

	private final Stage stage;

	public AnalysisException(final Stage stage, final String message) {
		super(message);
		this.stage = stage;
	}

	public AnalysisException(final Stage stage, final String message,
		final Throwable cause)
	{
		super(message, cause);
		this.stage = stage;
	}

	public Stage getStage() {
		return stage;
	}

	/**
	 * @return the one-line diagnostic shown to the user,
	 *         "&lt;stage&gt; failed for &lt;source&gt;: &lt;message&gt;"
	 */
	public String getDiagnostic(final String source) {
		return stage.name().toLowerCase(Locale.ROOT) + " failed for " + source +
			": " + getMessage();
	}
}

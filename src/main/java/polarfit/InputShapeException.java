/**
 * Polar Fit
 * InputShapeException.java
 *
 */

package polarfit;

/**
 * The input table cannot be analyzed as given: column count mismatch, row
 * range out of bounds, or no usable series left after alignment.
 */
public class InputShapeException extends AnalysisException {

	private static final long serialVersionUID = 1L;

	public InputShapeException(final Stage stage, final String message) {
		super(stage, message);
	}
}

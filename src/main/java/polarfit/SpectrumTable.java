/**
 * Polar Fit
 * SpectrumTable.java
 *
 */

package polarfit;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Rectangular numeric table as delivered by {@link SpectrumTableReader}: one
 * shared X column and a matrix of Y series (rows = samples, columns =
 * series), with the header cell of each Y column.
 */
public class SpectrumTable {

	private final String name;
	private final RealVector x;
	private final RealMatrix y;
	private final String[] headers; // header cell of every Y column
	private final double[] headerValues; // number parsed from each header, or NaN

	public SpectrumTable(final String name, final RealVector x,
		final RealMatrix y, final String[] headers, final double[] headerValues)
	{
		if (x.getDimension() != y.getRowDimension()) {
			throw new DimensionMismatchException(x.getDimension(), y
				.getRowDimension());
		}
		if (headers.length != y.getColumnDimension()) {
			throw new DimensionMismatchException(headers.length, y
				.getColumnDimension());
		}
		if (headerValues.length != headers.length) {
			throw new DimensionMismatchException(headerValues.length,
				headers.length);
		}
		this.name = name;
		this.x = x;
		this.y = y;
		this.headers = headers.clone();
		this.headerValues = headerValues.clone();
	}

	public String getName() {
		return name;
	}

	public RealVector getX() {
		return x;
	}

	public RealMatrix getY() {
		return y;
	}

	public int getRowCount() {
		return x.getDimension();
	}

	public int getSeriesCount() {
		return y.getColumnDimension();
	}

	public String[] getHeaders() {
		return headers.clone();
	}

	/**
	 * @return the condition value encoded in each Y header, NaN where the
	 *         header carries no number
	 */
	public double[] getHeaderValues() {
		return headerValues.clone();
	}

	/**
	 * @return the distinct numeric header values in order of first appearance
	 */
	public double[] getConditionValues() {
		return Preprocessor.uniqueStable(headerValues);
	}
}

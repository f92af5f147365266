/**
 * Polar Fit
 * ResultAssembler.java
 *
 */

package polarfit;

import java.util.Locale;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Lays computed results out as flat tables: spectra with condition-labeled
 * columns, per-channel summaries and the combined polarization summary.
 * Nothing here computes new values.
 */
final class ResultAssembler {

	static final String energyHeader = "Energy (eV)";
	static final String[] summaryHeaders = { "E_raw", "I_raw", "FWHM_raw",
		"E_filt", "I_filt", "FWHM_filt", "Area_raw", "Area_filt" };
	static final String[] docpHeaders = { "DOCP_raw", "DOCP_filt" };
	static final String[] zeemanHeaders = { "ΔE_raw (meV)",
		"ΔE_smooth (meV)", "ΔE_fit (meV)" };

	/** Width of a channel summary block: condition plus eight features. */
	static final int summaryWidth = summaryHeaders.length + 1;

	private ResultAssembler() {}

	/**
	 * @return column label of a magnetic field value, e.g. "B=1.50T"
	 */
	static String fieldLabel(final double field) {
		return String.format(Locale.ROOT, "B=%.2fT", field);
	}

	static String[] fieldLabels(final double[] fields) {
		final String[] labels = new String[fields.length];
		for (int i = 0; i < fields.length; i++) {
			labels[i] = fieldLabel(fields[i]);
		}
		return labels;
	}

	/**
	 * Header row ({@code xHeader}, labels...) followed by one row per sample.
	 */
	static ResultTable spectrumTable(final String xHeader, final RealVector x,
		final RealMatrix y, final String[] labels)
	{
		if (labels.length != y.getColumnDimension()) {
			throw new DimensionMismatchException(labels.length, y
				.getColumnDimension());
		}
		final ResultTable table = new ResultTable(x.getDimension() + 1, labels
			.length + 1);
		table.set(0, 0, xHeader);
		for (int c = 0; c < labels.length; c++) {
			table.set(0, c + 1, labels[c]);
		}
		for (int r = 0; r < x.getDimension(); r++) {
			table.set(r + 1, 0, x.getEntry(r));
			for (int c = 0; c < labels.length; c++) {
				table.set(r + 1, c + 1, y.getEntry(r, c));
			}
		}
		return table;
	}

	/**
	 * One row per series: condition, raw peak X, raw peak Y, raw FWHM, smoothed
	 * peak X, smoothed peak Y, smoothed FWHM, raw area, smoothed area.
	 */
	static ResultTable summaryTable(final Channel channel,
		final String conditionHeader)
	{
		final int n = channel.getSeriesCount();
		final ResultTable table = new ResultTable(n + 1, summaryWidth);
		table.set(0, 0, conditionHeader);
		for (int c = 0; c < summaryHeaders.length; c++) {
			table.set(0, c + 1, summaryHeaders[c]);
		}
		for (int i = 0; i < n; i++) {
			final SpectralFeatures raw = channel.getRawFeatures(i);
			final SpectralFeatures smoothed = channel.getSmoothedFeatures(i);
			final double[] values = { channel.getCondition(i), raw.getPeakX(), raw
				.getPeakY(), raw.getFWHM(), smoothed.getPeakX(), smoothed.getPeakY(),
				smoothed.getFWHM(), raw.getArea(), smoothed.getArea() };
			for (int c = 0; c < values.length; c++) {
				table.set(i + 1, c, values[c]);
			}
		}
		return table;
	}

	/**
	 * Header row followed by the given columns, which must share one length.
	 */
	static ResultTable block(final String[] headers,
		final RealVector... columns)
	{
		if (headers.length != columns.length) {
			throw new DimensionMismatchException(columns.length, headers.length);
		}
		final int n = columns.length == 0 ? 0 : columns[0].getDimension();
		final ResultTable table = new ResultTable(n + 1, headers.length);
		for (int c = 0; c < headers.length; c++) {
			if (columns[c].getDimension() != n) {
				throw new DimensionMismatchException(columns[c].getDimension(), n);
			}
			table.set(0, c, headers[c]);
			for (int r = 0; r < n; r++) {
				table.set(r + 1, c, columns[c].getEntry(r));
			}
		}
		return table;
	}

	/**
	 * Places the blocks side by side with one blank column between
	 * neighbors. Shorter blocks are padded downward with blanks to the height
	 * of the tallest; no populated row moves.
	 */
	static ResultTable joinColumns(final ResultTable... blocks) {
		int rows = 0;
		int columns = 0;
		for (final ResultTable b : blocks) {
			rows = Math.max(rows, b.getRowCount());
			columns += b.getColumnCount();
		}
		columns += Math.max(0, blocks.length - 1);
		final ResultTable table = new ResultTable(rows, columns);
		int column = 0;
		for (final ResultTable b : blocks) {
			table.put(0, column, b);
			column += b.getColumnCount() + 1;
		}
		return table;
	}

	/**
	 * Positive summary, negative summary, DOCP block and Zeeman block joined
	 * by blank columns, under a placeholder row that carries
	 * {@code placeholder[0]} above the positive block and
	 * {@code placeholder[1]} above the negative block.
	 */
	static ResultTable combinedSummary(final ResultTable positive,
		final ResultTable negative, final PolarizationResult polarization,
		final GFactorFit fit, final double[] placeholder)
	{
		if (placeholder.length != 2) {
			throw new DimensionMismatchException(placeholder.length, 2);
		}
		final ResultTable docp = block(docpHeaders, polarization.getDocpRaw(),
			polarization.getDocpSmoothed());
		final ResultTable zeeman = block(zeemanHeaders, polarization
			.getZeemanRaw(), polarization.getZeemanSmoothed(), fit.getFitted());
		final ResultTable body = joinColumns(positive, negative, docp, zeeman);

		final ResultTable table = new ResultTable(body.getRowCount() + 1, body
			.getColumnCount());
		table.set(0, 0, placeholder[0]);
		table.set(0, positive.getColumnCount() + 1, placeholder[1]);
		table.put(1, 0, body);
		return table;
	}
}

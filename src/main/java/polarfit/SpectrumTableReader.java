/**
 * Polar Fit
 * SpectrumTableReader.java
 *
 */

package polarfit;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;

/**
 * Reads spectrum exports: delimited text (.csv, .tsv, .txt) or the first
 * sheet of a workbook (.xls, .xlsx). Row 1 holds the header of every column,
 * column 1 the X axis. A second, non-numeric row of labels is skipped. The
 * delimiter (tab, comma or semicolon, else runs of spaces) is taken from the
 * first line.
 */
public class SpectrumTableReader {

	static final String[] workbookExtensions = { "xls", "xlsx" };

	private static final Pattern number = Pattern.compile(
		"[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

	public SpectrumTable read(final File file) {
		if (FilenameUtils.isExtension(file.getName().toLowerCase(Locale.ROOT),
			workbookExtensions))
		{
			return table(FilenameUtils.getBaseName(file.getName()), readWorkbook(
				file));
		}
		final String text;
		try {
			text = new String(Files.readAllBytes(file.toPath()),
				StandardCharsets.UTF_8);
		}
		catch (final IOException e) {
			throw new AnalysisException(AnalysisException.Stage.INGEST,
				"cannot read " + file.getPath(), e);
		}
		return read(FilenameUtils.getBaseName(file.getName()), text);
	}

	public SpectrumTable read(final String name, final String text) {
		final String content = text.startsWith("\uFEFF") ? text.substring(1)
			: text;
		final char delimiter = detectDelimiter(content);
		if (delimiter == ' ') {
			return table(name, splitWhitespace(content));
		}
		return table(name, parse(new StringReader(content), delimiter));
	}

	private SpectrumTable table(final String name,
		final List<List<String>> rows)
	{
		if (rows.isEmpty()) {
			throw new InputShapeException(AnalysisException.Stage.INGEST, name +
				" is empty");
		}

		final List<String> header = rows.get(0);
		trimTrailingEmpty(header, 1);
		final int width = header.size();
		if (width < 2) {
			throw new InputShapeException(AnalysisException.Stage.INGEST, name +
				": expected an X column and at least one Y column, found " + width +
				" column(s)");
		}

		int first = 1;
		if (rows.size() > 1 && !isNumber(rows.get(1).get(0))) first = 2;
		final int nRows = rows.size() - first;
		if (nRows < 1) {
			throw new InputShapeException(AnalysisException.Stage.INGEST, name +
				" has no data rows");
		}

		final double[] x = new double[nRows];
		final RealMatrix y = new Array2DRowRealMatrix(nRows, width - 1);
		for (int r = 0; r < nRows; r++) {
			final List<String> row = rows.get(first + r);
			trimTrailingEmpty(row, width);
			if (row.size() != width) {
				throw new InputShapeException(AnalysisException.Stage.INGEST, String
					.format("%s: row %d has %d columns but the header has %d", name,
						first + r + 1, row.size(), width));
			}
			x[r] = parseCell(name, row.get(0), first + r, 0);
			for (int c = 1; c < width; c++) {
				y.setEntry(r, c - 1, parseCell(name, row.get(c), first + r, c));
			}
		}

		final String[] headers = new String[width - 1];
		final double[] values = new double[width - 1];
		for (int c = 1; c < width; c++) {
			headers[c - 1] = header.get(c);
			values[c - 1] = headerValue(header.get(c));
		}
		return new SpectrumTable(name, new ArrayRealVector(x, false), y, headers,
			values);
	}

	/**
	 * @return the number written in a header cell such as "1.5", "1.5T" or
	 *         "B = -2 T"; NaN when the cell holds none
	 */
	static double headerValue(final String cell) {
		if (cell == null) return Double.NaN;
		final Matcher m = number.matcher(cell);
		if (!m.find()) return Double.NaN;
		return Double.parseDouble(m.group());
	}

	static char detectDelimiter(final String text) {
		String firstLine = "";
		try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (!line.trim().isEmpty()) {
					firstLine = line;
					break;
				}
			}
		}
		catch (final IOException e) {
			throw new AnalysisException(AnalysisException.Stage.INGEST,
				"cannot scan the first line", e);
		}
		final char[] candidates = { '\t', ',', ';' };
		char best = '\t';
		int bestCount = 0;
		for (final char c : candidates) {
			final int count = firstLine.length() - firstLine.replace(String.valueOf(
				c), "").length();
			if (count > bestCount) {
				best = c;
				bestCount = count;
			}
		}
		// space separated export
		if (bestCount == 0 && StringUtils.containsWhitespace(firstLine.trim())) {
			return ' ';
		}
		return best;
	}

	private static List<List<String>> parse(final Reader in,
		final char delimiter)
	{
		final CSVFormat format = CSVFormat.newFormat(delimiter).withQuote('"')
			.withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);
		final List<List<String>> rows = new ArrayList<>();
		try (CSVParser parser = new CSVParser(in, format)) {
			for (final CSVRecord record : parser) {
				final List<String> cells = new ArrayList<>();
				for (final String cell : record) {
					cells.add(cell);
				}
				if (cells.stream().allMatch(String::isEmpty)) continue;
				rows.add(cells);
			}
		}
		catch (final IOException | IllegalStateException e) {
			throw new AnalysisException(AnalysisException.Stage.INGEST,
				"malformed delimited text: " + e.getMessage(), e);
		}
		return rows;
	}

	/**
	 * Rows of a text whose cells are separated by runs of spaces.
	 */
	private static List<List<String>> splitWhitespace(final String content) {
		final List<List<String>> rows = new ArrayList<>();
		for (final String line : content.split("\\R")) {
			final String[] cells = StringUtils.split(line);
			if (cells.length == 0) continue;
			rows.add(new ArrayList<>(Arrays.asList(cells)));
		}
		return rows;
	}

	/**
	 * Rows of the first sheet of an .xls or .xlsx workbook. Numeric cells are
	 * converted to text at full precision; formula cells give their cached
	 * value.
	 */
	static List<List<String>> readWorkbook(final File file) {
		final List<List<String>> rows = new ArrayList<>();
		try (Workbook workbook = WorkbookFactory.create(file, null, true)) {
			final Sheet sheet = workbook.getSheetAt(0);
			for (final Row row : sheet) {
				final List<String> cells = new ArrayList<>();
				for (int c = 0; c < row.getLastCellNum(); c++) {
					cells.add(cellText(row.getCell(c)));
				}
				if (cells.stream().allMatch(String::isEmpty)) continue;
				// cells missing at the end of a row read as empty
				if (!rows.isEmpty()) {
					while (cells.size() < rows.get(0).size()) {
						cells.add("");
					}
				}
				rows.add(cells);
			}
		}
		catch (final IOException | RuntimeException e) {
			throw new AnalysisException(AnalysisException.Stage.INGEST,
				"cannot read workbook " + file.getPath() + ": " + e.getMessage(), e);
		}
		return rows;
	}

	private static String cellText(final Cell cell) {
		if (cell == null) return "";
		CellType type = cell.getCellType();
		if (type == CellType.FORMULA) type = cell.getCachedFormulaResultType();
		switch (type) {
			case NUMERIC:
				return NumberToTextConverter.toText(cell.getNumericCellValue());
			case STRING:
				return cell.getStringCellValue().trim();
			case BOOLEAN:
				return Boolean.toString(cell.getBooleanCellValue());
			default:
				return "";
		}
	}

	/**
	 * Drops empty cells left by trailing delimiters, keeping at least
	 * {@code keep} cells.
	 */
	private static void trimTrailingEmpty(final List<String> cells,
		final int keep)
	{
		while (cells.size() > keep && cells.get(cells.size() - 1).isEmpty()) {
			cells.remove(cells.size() - 1);
		}
	}

	private static boolean isNumber(final String cell) {
		try {
			Double.parseDouble(cell.trim());
			return true;
		}
		catch (final NumberFormatException e) {
			return false;
		}
	}

	private static double parseCell(final String name, final String cell,
		final int row, final int column)
	{
		final String s = cell.trim();
		if (s.isEmpty() || s.equalsIgnoreCase("nan")) return Double.NaN;
		try {
			return Double.parseDouble(s);
		}
		catch (final NumberFormatException e) {
			throw new InputShapeException(AnalysisException.Stage.INGEST, String
				.format("%s: cell (%d, %d) is not a number: '%s'", name, row + 1,
					column + 1, cell));
		}
	}
}

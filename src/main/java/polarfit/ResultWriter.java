/**
 * Polar Fit
 * ResultWriter.java
 *
 */

package polarfit;

import com.itextpdf.awt.PdfGraphics2D;
import com.itextpdf.text.Document;
import com.itextpdf.text.DocumentException;
import com.itextpdf.text.Rectangle;
import com.itextpdf.text.pdf.PdfContentByte;
import com.itextpdf.text.pdf.PdfTemplate;
import com.itextpdf.text.pdf.PdfWriter;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.batik.dom.GenericDOMImplementation;
import org.apache.batik.svggen.SVGGraphics2D;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.function.IOConsumer;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.jfree.chart.ChartUtils;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.w3c.dom.DOMImplementation;

import polarfit.AnalysisSettings.ImageFormat;
import polarfit.AnalysisSettings.TableFormat;

/**
 * Writes the artifacts of a run. Every file is first written to a temporary
 * file in the target directory and then moved into place, so a failed write
 * leaves no partial artifact behind. I/O and rendering failures surface as
 * {@link AnalysisException} with stage EXPORT.
 */
class ResultWriter {

	static final String sheetName = "Sheet1";

	@Parameter
	private LogService log;

	private final TableFormat tableFormat;
	private final List<ImageFormat> imageFormats;
	private final CSVFormat csvFormat;

	public ResultWriter(final Context context, final TableFormat tableFormat,
		final List<ImageFormat> imageFormats)
	{
		context.inject(this);
		this.tableFormat = tableFormat;
		this.imageFormats = imageFormats;
		csvFormat = tableFormat.isDelimited() ? CSVFormat.newFormat(tableFormat
			.getDelimiter()).withQuote('"').withRecordSeparator('\n') : null;
	}

	/**
	 * Creates {@code dir}, deleting it first if it already exists.
	 */
	public File prepareDirectory(final File dir) {
		try {
			if (dir.exists()) {
				log.info("Replacing " + dir);
				FileUtils.deleteDirectory(dir);
			}
			FileUtils.forceMkdir(dir);
		}
		catch (final IOException e) {
			throw new AnalysisException(AnalysisException.Stage.EXPORT,
				"cannot create " + dir + ": " + e.getMessage(), e);
		}
		return dir;
	}

	/**
	 * @return the written file, {@code name} plus the table format extension
	 */
	public File writeTable(final File dir, final String name,
		final ResultTable table)
	{
		final File target = new File(dir, name + "." + tableFormat
			.getExtension());
		if (tableFormat.isDelimited()) {
			write(target, path -> writeDelimited(path, table));
		}
		else {
			write(target, path -> writeWorkbook(path, table));
		}
		return target;
	}

	/**
	 * Renders {@code figure} once per configured image format.
	 *
	 * @return the written files, empty when no image format is configured
	 */
	public List<File> writeFigure(final File dir, final String name,
		final Figure figure)
	{
		final List<File> files = new ArrayList<>();
		for (final ImageFormat format : imageFormats) {
			final File target = new File(dir, name + "." + format.getExtension());
			switch (format) {
				case PNG:
					write(target, path -> writePNG(path, figure));
					break;
				case PDF:
					write(target, path -> writePDF(path, figure));
					break;
				case SVG:
					write(target, path -> writeSVG(path, figure));
					break;
				default:
					throw new IllegalStateException("unhandled format " + format);
			}
			files.add(target);
		}
		return files;
	}

	public File writeText(final File dir, final String name, final String text) {
		final File target = new File(dir, name + ".txt");
		write(target, path -> Files.write(path, text.getBytes(
			StandardCharsets.UTF_8)));
		return target;
	}

	private void write(final File target, final IOConsumer<Path> content) {
		Path temp = null;
		try {
			temp = Files.createTempFile(target.getParentFile().toPath(), ".polarfit",
				".tmp");
			content.accept(temp);
			try {
				Files.move(temp, target.toPath(), StandardCopyOption.ATOMIC_MOVE,
					StandardCopyOption.REPLACE_EXISTING);
			}
			catch (final AtomicMoveNotSupportedException e) {
				Files.move(temp, target.toPath(), StandardCopyOption.REPLACE_EXISTING);
			}
			log.debug("Saved " + target);
		}
		catch (final IOException | RuntimeException e) {
			if (temp != null) FileUtils.deleteQuietly(temp.toFile());
			throw new AnalysisException(AnalysisException.Stage.EXPORT,
				"cannot write " + target.getName() + ": " + e.getMessage(), e);
		}
	}

	private void writeDelimited(final Path path, final ResultTable table)
		throws IOException
	{
		try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
				CSVPrinter printer = new CSVPrinter(out, csvFormat))
		{
			for (int r = 0; r < table.getRowCount(); r++) {
				final List<String> record = new ArrayList<>();
				for (final TableCell cell : table.getRow(r)) {
					record.add(cell.format());
				}
				printer.printRecord(record);
			}
		}
	}

	/**
	 * One sheet; numbers as numeric cells, NaN and infinities as their text,
	 * blanks left without a cell.
	 */
	private static void writeWorkbook(final Path path, final ResultTable table)
		throws IOException
	{
		try (Workbook workbook = new XSSFWorkbook();
				OutputStream out = Files.newOutputStream(path))
		{
			final Sheet sheet = workbook.createSheet(sheetName);
			for (int r = 0; r < table.getRowCount(); r++) {
				final Row row = sheet.createRow(r);
				final TableCell[] cells = table.getRow(r);
				for (int c = 0; c < cells.length; c++) {
					final TableCell cell = cells[c];
					if (cell.isBlank()) continue;
					if (cell.isNumber() && Double.isFinite(cell.getNumber())) {
						row.createCell(c).setCellValue(cell.getNumber());
					}
					else {
						row.createCell(c).setCellValue(cell.format());
					}
				}
			}
			workbook.write(out);
		}
	}

	private static void writePNG(final Path path, final Figure figure)
		throws IOException
	{
		final BufferedImage image = new BufferedImage(figure.getWidth(), figure
			.getHeight(), BufferedImage.TYPE_INT_RGB);
		final Graphics2D g = image.createGraphics();
		try {
			figure.draw(g, new Rectangle2D.Double(0, 0, figure.getWidth(), figure
				.getHeight()));
		}
		finally {
			g.dispose();
		}
		try (OutputStream out = Files.newOutputStream(path)) {
			ChartUtils.writeBufferedImageAsPNG(out, image);
		}
	}

	private static void writePDF(final Path path, final Figure figure)
		throws IOException
	{
		final float w = figure.getWidth();
		final float h = figure.getHeight();
		final Document doc = new Document(new Rectangle(w, h), 0, 0, 0, 0);
		try (OutputStream out = Files.newOutputStream(path)) {
			final PdfWriter writer = PdfWriter.getInstance(doc, out);
			doc.open();
			final PdfContentByte cb = writer.getDirectContent();
			final PdfTemplate t = cb.createTemplate(w, h);
			final Graphics2D g = new PdfGraphics2D(t, w, h);
			figure.draw(g, new Rectangle2D.Double(0, 0, w, h));
			g.dispose();
			cb.addTemplate(t, 0, 0);
			doc.close();
		}
		catch (final DocumentException e) {
			throw new IOException("PDF rendering failed: " + e.getMessage(), e);
		}
	}

	private static void writeSVG(final Path path, final Figure figure)
		throws IOException
	{
		final DOMImplementation domImpl = GenericDOMImplementation
			.getDOMImplementation();
		final org.w3c.dom.Document document = domImpl.createDocument(null, "svg",
			null);
		final SVGGraphics2D svgGen = new SVGGraphics2D(document);
		figure.draw(svgGen, new Rectangle2D.Double(0, 0, figure.getWidth(), figure
			.getHeight()));
		try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			svgGen.stream(out, true /* use css */);
		}
	}
}

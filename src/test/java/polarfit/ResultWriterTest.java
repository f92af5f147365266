/**
 * Polar Fit
 * ResultWriterTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;

import polarfit.AnalysisSettings.ImageFormat;
import polarfit.AnalysisSettings.TableFormat;

class ResultWriterTest {

	@TempDir
	Path dir;

	private Context context;

	@BeforeEach
	void createContext() {
		context = new Context(LogService.class, StatusService.class);
	}

	@AfterEach
	void disposeContext() {
		context.dispose();
	}

	private static ResultTable sample() {
		final ResultTable t = new ResultTable(3, 3);
		t.set(0, 0, "Energy (eV)");
		t.set(0, 1, "B=0.00T");
		t.set(1, 0, 1.5);
		t.set(1, 1, Double.NaN);
		t.set(1, 2, -2.25);
		t.set(2, 0, 2);
		return t;
	}

	@Test
	void writesTabSeparatedTables() throws IOException {
		final ResultWriter writer = new ResultWriter(context, TableFormat.TSV,
			Collections.<ImageFormat> emptyList());
		final File f = writer.writeTable(dir.toFile(), "table", sample());
		assertEquals("table.tsv", f.getName());
		final List<String> lines = Files.readAllLines(f.toPath(),
			StandardCharsets.UTF_8);
		assertArrayEquals(new String[] { "Energy (eV)\tB=0.00T\t",
			"1.5\tNaN\t-2.25", "2\t\t" }, lines.toArray(new String[0]));
	}

	@Test
	void writesCommaSeparatedTables() throws IOException {
		final ResultWriter writer = new ResultWriter(context, TableFormat.CSV,
			Collections.<ImageFormat> emptyList());
		final File f = writer.writeTable(dir.toFile(), "table", sample());
		assertEquals("table.csv", f.getName());
		assertEquals("1.5,NaN,-2.25", Files.readAllLines(f.toPath(),
			StandardCharsets.UTF_8).get(1));
	}

	@Test
	void writesWorkbookTables() throws IOException {
		final ResultWriter writer = new ResultWriter(context, TableFormat.XLSX,
			Collections.<ImageFormat> emptyList());
		final File f = writer.writeTable(dir.toFile(), "table", sample());
		assertEquals("table.xlsx", f.getName());
		assertArrayEquals(new String[] { "table.xlsx" }, dir.toFile().list());
		try (Workbook wb = WorkbookFactory.create(f, null, true)) {
			final Sheet sheet = wb.getSheet(ResultWriter.sheetName);
			assertEquals("B=0.00T", sheet.getRow(0).getCell(1)
				.getStringCellValue());
			assertNull(sheet.getRow(0).getCell(2));
			assertEquals(1.5, sheet.getRow(1).getCell(0).getNumericCellValue(), 0);
			assertEquals("NaN", sheet.getRow(1).getCell(1).getStringCellValue());
			assertEquals(-2.25, sheet.getRow(1).getCell(2).getNumericCellValue(),
				0);
		}
	}

	@Test
	void renderingFailureIsAnExportError() {
		final ResultWriter writer = new ResultWriter(context, TableFormat.TSV,
			Arrays.asList(ImageFormat.PNG));
		final Figure broken = new Figure("broken", Collections.emptyList()) {

			@Override
			public void draw(final Graphics2D g, final Rectangle2D area) {
				throw new IllegalStateException("chart cannot be drawn");
			}
		};
		final AnalysisException e = assertThrows(AnalysisException.class,
			() -> writer.writeFigure(dir.toFile(), "fig", broken));
		assertEquals(AnalysisException.Stage.EXPORT, e.getStage());
		assertTrue(e.getMessage().contains("chart cannot be drawn"));
		assertEquals(0, dir.toFile().list().length);
	}

	@Test
	void leavesNoTemporaryFiles() throws IOException {
		final ResultWriter writer = new ResultWriter(context, TableFormat.TSV,
			Collections.<ImageFormat> emptyList());
		writer.writeTable(dir.toFile(), "a", sample());
		writer.writeText(dir.toFile(), "log", "line\n");
		assertTrue(writer.writeFigure(dir.toFile(), "fig", new Figure("empty",
			Collections.emptyList())).isEmpty());
		final String[] names = dir.toFile().list();
		Arrays.sort(names);
		assertArrayEquals(new String[] { "a.tsv", "log.txt" }, names);
		assertEquals("line\n", new String(Files.readAllBytes(dir.resolve(
			"log.txt")), StandardCharsets.UTF_8));
	}

	@Test
	void replacesAnExistingDirectory() throws IOException {
		final File out = dir.resolve("out").toFile();
		assertTrue(out.mkdir());
		Files.write(out.toPath().resolve("stale.txt"), new byte[] { 1 });
		final ResultWriter writer = new ResultWriter(context, TableFormat.TSV,
			Collections.<ImageFormat> emptyList());
		writer.prepareDirectory(out);
		assertTrue(out.isDirectory());
		assertEquals(0, out.list().length);
	}

	@Test
	void writeFailureIsAnExportError() {
		final ResultWriter writer = new ResultWriter(context, TableFormat.TSV,
			Collections.<ImageFormat> emptyList());
		final File missing = dir.resolve("missing").toFile();
		final AnalysisException e = assertThrows(AnalysisException.class,
			() -> writer.writeText(missing, "log", "text"));
		assertEquals(AnalysisException.Stage.EXPORT, e.getStage());
		assertFalse(missing.exists());
	}
}

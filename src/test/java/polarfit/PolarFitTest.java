/**
 * Polar Fit
 * PolarFitTest.java
 *
 */

package polarfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;

class PolarFitTest {

	@TempDir
	Path dir;

	private Context context;
	private Preferences prefs;

	@BeforeEach
	void setUp() {
		context = new Context(LogService.class, StatusService.class);
		prefs = Preferences.userRoot().node("polarfit-test-" + UUID.randomUUID());
	}

	@AfterEach
	void tearDown() throws BackingStoreException {
		prefs.removeNode();
		context.dispose();
	}

	private String[] runArgs(final String... inputs) {
		final String[] options = { "startRow=1", "endRow=" +
			PolarizationAnalysisTest.rows, "baselineValue=0", "imageFormats=none",
			"outputDir=" + dir.resolve("out") };
		final String[] args = Arrays.copyOf(options, options.length +
			inputs.length);
		System.arraycopy(inputs, 0, args, options.length, inputs.length);
		return args;
	}

	@Test
	void parsesOptionsAndInputs() {
		final PolarFit.Arguments a = PolarFit.parse("--settings", "my.properties",
			"smoothType=movmean", "smoothParam = 5", "a.csv", "--remember",
			"b.csv");
		assertEquals(new File("my.properties"), a.settingsFile);
		assertTrue(a.remember);
		assertEquals("movmean", a.overrides.getProperty("smoothType"));
		assertEquals(" 5", a.overrides.getProperty("smoothParam"));
		assertEquals(Arrays.asList(new File("a.csv"), new File("b.csv")), a
			.getInputs());
	}

	@Test
	void rejectsUnknownFlags() {
		final ConfigurationException e = assertThrows(
			ConfigurationException.class, () -> PolarFit.parse("--verbose"));
		assertEquals("--verbose", e.getParameter());
		final ConfigurationException missing = assertThrows(
			ConfigurationException.class, () -> PolarFit.parse("--settings"));
		assertEquals("--settings", missing.getParameter());
	}

	@Test
	void helpListsEveryOption() {
		final String usage = PolarFit.usage();
		assertTrue(usage.contains("--settings <file>"), usage);
		assertTrue(usage.contains("--remember"), usage);
		assertTrue(usage.contains(AnalysisSettings.PLACEHOLDER), usage);
		assertTrue(PolarFit.parse("-h").help);
		assertEquals(0, PolarFit.launch(context, prefs, "--help"));
	}

	@Test
	void versionIsAlwaysReported() {
		assertFalse(PolarFit.version().isEmpty());
	}

	@Test
	void overridesWinOverTheSettingsFile() throws IOException {
		final File file = dir.resolve("s.properties").toFile();
		Files.write(file.toPath(), ("smoothType=movmean\nsmoothParam=7\n" +
			"mode=single\n").getBytes(StandardCharsets.UTF_8));
		final AnalysisSettings s = PolarFit.parse("--settings", file.getPath(),
			"smoothParam=9").apply(AnalysisSettings.defaults());
		assertEquals(SmoothingMethod.MOVMEAN, s.getSmoothing().getMethod());
		assertEquals(9, s.getSmoothing().getWindow());
		assertEquals(AnalysisSettings.Mode.SINGLE_CHANNEL, s.getMode());
	}

	@Test
	void launchWithoutInputsFails() {
		assertEquals(1, PolarFit.launch(context, prefs));
		assertEquals(1, PolarFit.launch(context, prefs, "smoothType=loess"));
	}

	@Test
	void invalidOptionFailsTheLaunch() {
		assertEquals(1, PolarFit.launch(context, prefs, "smoothType=spline",
			"a.csv"));
		assertEquals(1, PolarFit.launch(context, prefs, "colour=red", "a.csv"));
	}

	@Test
	void analyzesEveryInputAndCountsFailures() throws IOException {
		final File good = PolarizationAnalysisTest.writeInput(dir, "good.csv");
		final File missing = dir.resolve("missing.csv").toFile();
		final AnalysisSettings settings = PolarFit.parse(runArgs()).apply(
			AnalysisSettings.defaults());
		final PolarFit app = new PolarFit(context, settings, Arrays.asList(
			missing, good));
		app.run();
		assertEquals(1, app.getFailures());
		final File[] results = dir.resolve("out").toFile().listFiles();
		assertEquals(1, results.length);
		assertTrue(results[0].getName().startsWith("good_"));
	}

	@Test
	void launchReturnsZeroWhenEveryFileSucceeds() throws IOException {
		final File good = PolarizationAnalysisTest.writeInput(dir, "good.csv");
		assertEquals(0, PolarFit.launch(context, prefs, runArgs(good.getPath())));
		assertEquals(1, PolarFit.launch(context, prefs, runArgs(good.getPath(),
			dir.resolve("missing.csv").toString())));
	}

	@Test
	void rememberStoresTheOptions() throws IOException {
		final File good = PolarizationAnalysisTest.writeInput(dir, "good.csv");
		assertNull(prefs.get(AnalysisSettings.SMOOTH_TYPE, null));
		final String[] args = runArgs("--remember", "smoothType=movmean",
			"smoothParam=5", good.getPath());
		assertEquals(0, PolarFit.launch(context, prefs, args));
		assertEquals("movmean", prefs.get(AnalysisSettings.SMOOTH_TYPE, null));
		assertEquals(SmoothingMethod.MOVMEAN, AnalysisSettings.fromPreferences(
			prefs).getSmoothing().getMethod());
	}
}

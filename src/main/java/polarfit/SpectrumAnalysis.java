/**
 * Polar Fit
 * SpectrumAnalysis.java
 *
 */

package polarfit;

import java.io.File;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * Common run of one input file: read, compute every result, then write every
 * artifact into a fresh {@code <basename>_<yyyyMMdd>} directory. Nothing is
 * written before all results exist.
 *
 * @param <R> computed results of one run
 */
abstract class SpectrumAnalysis<R> {

	static final DateTimeFormatter folderDate = DateTimeFormatter.BASIC_ISO_DATE;
	static final DateTimeFormatter logDate = DateTimeFormatter.ofPattern(
		"yyyy-MM-dd HH:mm:ss");

	@Parameter
	protected LogService log;

	protected final Context context;
	protected final AnalysisSettings settings;
	private final SpectrumTableReader reader = new SpectrumTableReader();

	SpectrumAnalysis(final Context context, final AnalysisSettings settings) {
		context.inject(this);
		this.context = context;
		this.settings = settings;
	}

	/**
	 * Analyzes {@code input} and writes its result directory.
	 *
	 * @return the result directory
	 * @throws AnalysisException naming the stage that failed
	 */
	public File run(final File input) {
		final StopWatch sw = StopWatch.createStarted();
		log.info("Analyzing " + input.getName() + " [" + settings.getMode() +
			", rows " + settings.getStartRow() + "-" + settings.getEndRow() +
			", " + settings.getSmoothing() + "]");
		final SpectrumTable table = reader.read(input);
		final R result = analyze(table);

		final String basename = FilenameUtils.getBaseName(input.getName());
		final File parent = settings.getOutputDir() != null ? settings
			.getOutputDir() : input.getAbsoluteFile().getParentFile();
		final File dir = new File(parent, basename + "_" + LocalDate.now().format(
			folderDate));
		final ResultWriter writer = new ResultWriter(context, settings
			.getTableFormat(), settings.getImageFormats());
		log.info("Saving to " + dir + " ...");
		writer.prepareDirectory(dir);
		stage(AnalysisException.Stage.EXPORT, () -> {
			export(input, result, writer, dir, basename, sw);
			return dir;
		});
		sw.stop();
		log.info(String.format(Locale.ROOT, "%s done in %.2f s", input.getName(),
			sw.getTime() / 1000.0));
		return dir;
	}

	/**
	 * Computes every result of a run from the ingested table.
	 */
	abstract R analyze(SpectrumTable table);

	/**
	 * Writes the artifacts of a computed run.
	 */
	abstract void export(File input, R result, ResultWriter writer, File dir,
		String basename, StopWatch sw);

	/**
	 * Window and baseline of the settings applied to {@code table}.
	 */
	SpectrumTable prepare(final SpectrumTable table) {
		final SpectrumTable prepared = stage(AnalysisException.Stage.PREPROCESS,
			() -> Preprocessor.prepare(table, settings.getRowStart(), settings
				.getRowEnd(), settings.getBaseline()));
		log.debug(String.format(Locale.ROOT, "%s: %d rows, %d data columns",
			table.getName(), prepared.getRowCount(), prepared.getSeriesCount()));
		return prepared;
	}

	/**
	 * Runs one step, attributing unexpected runtime failures to {@code stage}.
	 */
	static <T> T stage(final AnalysisException.Stage stage,
		final Supplier<T> step)
	{
		try {
			return step.get();
		}
		catch (final AnalysisException e) {
			throw e;
		}
		catch (final RuntimeException e) {
			throw new AnalysisException(stage, e.getMessage() == null ? e.getClass()
				.getSimpleName() : e.getMessage(), e);
		}
	}

	/**
	 * Run-log header lines shared by both analyses.
	 */
	StringBuilder logHeader(final File input, final SpectrumTable prepared) {
		final StringBuilder sb = new StringBuilder();
		final int rows = prepared.getRowCount();
		line(sb, "Date", LocalDateTime.now().format(logDate));
		line(sb, "Program", PolarFit.title + " " + PolarFit.version());
		line(sb, "File", input.getName());
		line(sb, "Rows", settings.getStartRow() + " - " + settings.getEndRow());
		line(sb, "X-axis range", "Start_X = " + number(prepared.getX().getEntry(
			0)) + ", End_X = " + number(prepared.getX().getEntry(rows - 1)));
		line(sb, "Baseline", number(settings.getBaseline()));
		line(sb, "Smooth", settings.getSmoothing().toString());
		return sb;
	}

	static void line(final StringBuilder sb, final String label,
		final String value)
	{
		sb.append(String.format(Locale.ROOT, "%-26s : %s%n", label, value));
	}

	/**
	 * Six significant digits without trailing zeros.
	 */
	static String number(final double d) {
		if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
		return new BigDecimal(String.format(Locale.ROOT, "%.6g", d))
			.stripTrailingZeros().toPlainString();
	}

	static String numbers(final double[] values) {
		return Arrays.stream(values).mapToObj(SpectrumAnalysis::number).collect(
			Collectors.joining(" ", "[", "]"));
	}
}

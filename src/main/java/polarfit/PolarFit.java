/**
 * Polar Fit
 * PolarFit.java
 *
 * Feature: peak, FWHM, area, degree of circular polarization and Zeeman
 * g-factor analysis of photoluminescence spectra series.
 * Polar Fit reads spectra tables (one X column, one Y column per field,
 * power or temperature value), smooths and features every series and writes
 * tables, figures and a run log per input file.
 *
 * The fitting and linear algebra are implemented with the Apache Commons
 * Math library
 *
 */

package polarfit;

import java.io.File;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.prefs.Preferences;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.MissingArgumentException;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.UnrecognizedOptionException;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

/**
 * Command-line runner: analyzes each input file in turn, reporting a failed
 * file as one diagnostic and carrying on with the next.
 */
public class PolarFit implements Command {

	static final String title = "Polar Fit";
	static final String syntax =
		"polar-fit [options] [key=value ...] <input file> ...";
	static final String helpMessage = "Analyzes photoluminescence spectra " +
		"tables. A key=value argument overrides one analysis option: " + String
			.join(", ", AnalysisSettings.keys);

	private static final HelpFormatter helpFormatter = new HelpFormatter();
	static {
		helpFormatter.setWidth(100);
	}

	@Parameter
	private LogService log;
	@Parameter
	private StatusService statusServ;

	private final Context context;
	private final AnalysisSettings settings;
	private final List<File> inputs;
	private int failures = 0;

	public PolarFit(final Context context, final AnalysisSettings settings,
		final List<File> inputs)
	{
		context.inject(this);
		this.context = context;
		this.settings = settings;
		this.inputs = new ArrayList<>(inputs);
	}

	@Override
	public void run() {
		about();
		final int n = inputs.size();
		for (int i = 0; i < n; i++) {
			final File input = inputs.get(i);
			statusServ.showStatus(i, n, "Analyzing " + input.getName());
			try {
				final File dir = analysis().run(input);
				log.info("Results of " + input.getName() + " in " + dir);
			}
			catch (final AnalysisException e) {
				failures++;
				log.error(e.getDiagnostic(input.getName()));
				log.debug(input.getName(), e);
			}
		}
		statusServ.showStatus(n, n, failures == 0 ? "Done" : failures +
			" of " + n + " files failed");
	}

	/**
	 * @return number of input files whose analysis failed
	 */
	public int getFailures() {
		return failures;
	}

	private SpectrumAnalysis<?> analysis() {
		switch (settings.getMode()) {
			case SINGLE_CHANNEL:
				return new SpectralDependenceAnalysis(context, settings);
			default:
				return new PolarizationAnalysis(context, settings);
		}
	}

	/**
	 * Logs the name and version of the running program.
	 */
	public void about() {
		log.info(title + " " + version());
	}

	/**
	 * @return the Implementation-Version of the jar manifest, or "development
	 *         build" when running from classes
	 */
	static String version() {
		final String v = PolarFit.class.getPackage().getImplementationVersion();
		return v == null ? "development build" : v;
	}

	/**
	 * Parsed command line.
	 */
	static class Arguments {

		final Properties overrides = new Properties();
		final List<File> inputs = new ArrayList<>();
		File settingsFile;
		boolean remember;
		boolean help;

		/**
		 * {@code base}, then the settings file, then the key=value overrides.
		 */
		AnalysisSettings apply(final AnalysisSettings base) {
			AnalysisSettings s = base;
			if (settingsFile != null) {
				s = s.withAll(AnalysisSettings.readProperties(settingsFile));
			}
			return s.withAll(overrides);
		}

		List<File> getInputs() {
			return Collections.unmodifiableList(inputs);
		}
	}

	static Options options() {
		final Options opts = new Options();
		opts.addOption(Option.builder().longOpt("settings").hasArg().argName(
			"file").desc("properties file with analysis options").build());
		opts.addOption(Option.builder().longOpt("remember").desc(
			"store the effective options as the defaults of the next run").build());
		opts.addOption(Option.builder("h").longOpt("help").desc(
			"print this help message").build());
		return opts;
	}

	/**
	 * @return the help text listing every option
	 */
	static String usage() {
		final StringWriter sw = new StringWriter();
		try (PrintWriter pw = new PrintWriter(sw)) {
			helpFormatter.printHelp(pw, helpFormatter.getWidth(), syntax,
				helpMessage, options(), helpFormatter.getLeftPadding(), helpFormatter
					.getDescPadding(), null, false);
		}
		return sw.toString();
	}

	/**
	 * Options are read with commons-cli; the remaining arguments are
	 * {@code key=value} overrides or input files.
	 *
	 * @throws ConfigurationException on a malformed argument
	 */
	static Arguments parse(final String... args) {
		final CommandLine cl;
		try {
			cl = new DefaultParser().parse(options(), args);
		}
		catch (final UnrecognizedOptionException e) {
			throw new ConfigurationException(e.getOption(), "unknown flag", e);
		}
		catch (final MissingArgumentException e) {
			throw new ConfigurationException("--" + e.getOption().getLongOpt(),
				"expects a properties file", e);
		}
		catch (final ParseException e) {
			throw new ConfigurationException("command line", e.getMessage(), e);
		}

		final Arguments a = new Arguments();
		if (cl.hasOption("settings")) {
			a.settingsFile = new File(cl.getOptionValue("settings"));
		}
		a.remember = cl.hasOption("remember");
		a.help = cl.hasOption("help");
		for (final String arg : cl.getArgList()) {
			final int eq = arg.indexOf('=');
			if (eq > 0) {
				a.overrides.setProperty(arg.substring(0, eq).trim(), arg.substring(eq +
					1));
			}
			else {
				a.inputs.add(new File(arg));
			}
		}
		return a;
	}

	/**
	 * Runs the command line in {@code context}.
	 *
	 * @return process exit status, 0 when every file was analyzed
	 */
	static int launch(final Context context, final Preferences prefs,
		final String... args)
	{
		final LogService log = context.getService(LogService.class);
		try {
			final Arguments a = parse(args);
			if (a.help) {
				log.info(usage());
				return 0;
			}
			if (a.inputs.isEmpty()) {
				log.error("no input file\n" + usage());
				return 1;
			}
			final AnalysisSettings settings = a.apply(AnalysisSettings
				.fromPreferences(prefs));
			if (a.remember) settings.save(prefs);
			final PolarFit app = new PolarFit(context, settings, a.getInputs());
			app.run();
			return app.getFailures() == 0 ? 0 : 1;
		}
		catch (final ConfigurationException e) {
			log.error(e.getDiagnostic("the command line"));
			return 1;
		}
	}

	public static void main(final String... args) {
		final Context context = new Context(LogService.class, StatusService.class);
		final int status;
		try {
			status = launch(context, Preferences.userRoot().node(PolarFit.class
				.getName()), args);
		}
		finally {
			context.dispose();
		}
		System.exit(status);
	}
}

/**
 * Polar Fit
 * AnalysisSettings.java
 *
 */

package polarfit;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.prefs.Preferences;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable set of analysis options. Every option has a default in the
 * bundled {@code polarfit.properties}; values are validated once, when the
 * settings are created.
 */
public class AnalysisSettings {

	// Option keys, shared by properties files, preferences and the command line
	public static final String MODE = "mode";
	public static final String START_ROW = "startRow";
	public static final String END_ROW = "endRow";
	public static final String BASELINE = "baselineValue";
	public static final String SMOOTH_TYPE = "smoothType";
	public static final String SMOOTH_PARAM = "smoothParam";
	public static final String PLACEHOLDER = "posNegPlaceholder";
	public static final String AREA_MODE = "areaMode";
	public static final String CONDITION_HEADER = "conditionHeader";
	public static final String IMAGE_FORMATS = "imageFormats";
	public static final String TABLE_FORMAT = "tableFormat";
	public static final String OUTPUT_DIR = "outputDir";

	static final String[] keys = { MODE, START_ROW, END_ROW, BASELINE,
		SMOOTH_TYPE, SMOOTH_PARAM, PLACEHOLDER, AREA_MODE, CONDITION_HEADER,
		IMAGE_FORMATS, TABLE_FORMAT, OUTPUT_DIR };

	private static final String defaultsResource = "/polarfit.properties";

	public enum Mode {
			POLARIZATION("polarization", "B (T)"), SINGLE_CHANNEL("single",
				"Power/Temper");

		private final String key;
		private final String conditionHeader;

		Mode(final String key, final String conditionHeader) {
			this.key = key;
			this.conditionHeader = conditionHeader;
		}

		static Mode fromName(final String name) {
			for (final Mode m : values()) {
				if (m.key.equalsIgnoreCase(name.trim())) return m;
			}
			throw new ConfigurationException(MODE, "unknown mode '" + name +
				"', expected polarization or single");
		}

		@Override
		public String toString() {
			return key;
		}
	}

	public enum ImageFormat {
			PNG, PDF, SVG;

		public String getExtension() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	public enum TableFormat {
			TSV('\t'), CSV(','), XLSX;

		private final Character delimiter;

		TableFormat() {
			this.delimiter = null;
		}

		TableFormat(final char delimiter) {
			this.delimiter = delimiter;
		}

		/** @return whether tables are delimited text rather than a workbook */
		public boolean isDelimited() {
			return delimiter != null;
		}

		/**
		 * @throws IllegalStateException for a workbook format
		 */
		public char getDelimiter() {
			if (delimiter == null) {
				throw new IllegalStateException(this + " has no delimiter");
			}
			return delimiter;
		}

		public String getExtension() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final Properties values;

	private final Mode mode;
	private final int startRow;
	private final int endRow;
	private final double baseline;
	private final SmoothingParameters smoothing;
	private final double[] placeholder;
	private final AreaMode areaMode;
	private final String conditionHeader;
	private final List<ImageFormat> imageFormats;
	private final TableFormat tableFormat;
	private final File outputDir;

	/**
	 * @param values option values; missing keys take their defaults
	 * @throws ConfigurationException naming the first invalid option
	 */
	AnalysisSettings(final Properties values) {
		this.values = new Properties();
		this.values.putAll(loadDefaults());
		for (final String key : values.stringPropertyNames()) {
			checkKey(key);
			this.values.setProperty(key, values.getProperty(key));
		}

		mode = Mode.fromName(get(MODE));
		startRow = parseInt(START_ROW);
		endRow = parseInt(END_ROW);
		if (startRow < 1) {
			throw new ConfigurationException(START_ROW,
				"must be 1 or more (first data row), got " + startRow);
		}
		if (endRow < startRow) {
			throw new ConfigurationException(END_ROW, "must not be smaller than " +
				START_ROW + " (" + startRow + "), got " + endRow);
		}
		baseline = parseDouble(BASELINE);
		smoothing = SmoothingParameters.parse(SmoothingMethod.fromName(get(
			SMOOTH_TYPE)), get(SMOOTH_PARAM));
		placeholder = parsePlaceholder(get(PLACEHOLDER));
		areaMode = AreaMode.fromName(get(AREA_MODE));
		conditionHeader = StringUtils.isBlank(get(CONDITION_HEADER))
			? mode.conditionHeader : get(CONDITION_HEADER).trim();
		imageFormats = parseImageFormats(get(IMAGE_FORMATS));
		tableFormat = parseTableFormat(get(TABLE_FORMAT));
		outputDir = StringUtils.isBlank(get(OUTPUT_DIR)) ? null : new File(get(
			OUTPUT_DIR).trim());
	}

	/**
	 * @return the bundled defaults
	 */
	public static AnalysisSettings defaults() {
		return new AnalysisSettings(new Properties());
	}

	/**
	 * Defaults overridden by the keys of a properties file.
	 */
	public static AnalysisSettings load(final File file) {
		return defaults().withAll(readProperties(file));
	}

	/**
	 * @return the keys of a UTF-8 properties file
	 * @throws ConfigurationException if the file cannot be read
	 */
	public static Properties readProperties(final File file) {
		final Properties p = new Properties();
		try (Reader in = Files.newBufferedReader(file.toPath(),
			StandardCharsets.UTF_8))
		{
			p.load(in);
		}
		catch (final IOException e) {
			throw new ConfigurationException("settings", "cannot read " + file +
				": " + e.getMessage(), e);
		}
		return p;
	}

	/**
	 * Defaults overridden by the values stored in {@code prefs}.
	 */
	public static AnalysisSettings fromPreferences(final Preferences prefs) {
		final Properties defaults = loadDefaults();
		final Properties p = new Properties();
		for (final String key : keys) {
			p.setProperty(key, prefs.get(key, defaults.getProperty(key)));
		}
		return new AnalysisSettings(p);
	}

	/**
	 * Stores every option in {@code prefs}.
	 */
	public void save(final Preferences prefs) {
		for (final String key : keys) {
			prefs.put(key, get(key));
		}
	}

	/**
	 * @return a copy with one option replaced
	 */
	public AnalysisSettings with(final String key, final String value) {
		checkKey(key);
		final Properties p = toProperties();
		p.setProperty(key, value);
		return new AnalysisSettings(p);
	}

	/**
	 * @return a copy with every option in {@code overrides} replaced
	 */
	public AnalysisSettings withAll(final Properties overrides) {
		final Properties p = toProperties();
		for (final String key : overrides.stringPropertyNames()) {
			checkKey(key);
			p.setProperty(key, overrides.getProperty(key));
		}
		return new AnalysisSettings(p);
	}

	public Properties toProperties() {
		final Properties p = new Properties();
		p.putAll(values);
		return p;
	}

	public String get(final String key) {
		return values.getProperty(key, "");
	}

	public Mode getMode() {
		return mode;
	}

	/** @return first data row, 1-based */
	public int getStartRow() {
		return startRow;
	}

	/** @return last data row, 1-based and inclusive */
	public int getEndRow() {
		return endRow;
	}

	/** @return first row of the window as a 0-based index */
	public int getRowStart() {
		return startRow - 1;
	}

	/** @return end of the window as an exclusive 0-based index */
	public int getRowEnd() {
		return endRow;
	}

	public double getBaseline() {
		return baseline;
	}

	public SmoothingParameters getSmoothing() {
		return smoothing;
	}

	public double[] getPlaceholder() {
		return placeholder.clone();
	}

	public AreaMode getAreaMode() {
		return areaMode;
	}

	public String getConditionHeader() {
		return conditionHeader;
	}

	public List<ImageFormat> getImageFormats() {
		return imageFormats;
	}

	public TableFormat getTableFormat() {
		return tableFormat;
	}

	/**
	 * @return directory that receives the result folders, {@code null} for the
	 *         folder of each input file
	 */
	public File getOutputDir() {
		return outputDir;
	}

	private static Properties loadDefaults() {
		final Properties p = new Properties();
		try (InputStream in = AnalysisSettings.class.getResourceAsStream(
			defaultsResource))
		{
			if (in == null) {
				throw new IllegalStateException(defaultsResource + " not found");
			}
			p.load(in);
		}
		catch (final IOException e) {
			throw new IllegalStateException("cannot read " + defaultsResource, e);
		}
		return p;
	}

	private static void checkKey(final String key) {
		for (final String k : keys) {
			if (k.equals(key)) return;
		}
		throw new ConfigurationException(key, "unknown option");
	}

	private int parseInt(final String key) {
		try {
			return Integer.parseInt(get(key).trim());
		}
		catch (final NumberFormatException e) {
			throw new ConfigurationException(key, "not a whole number: '" + get(
				key) + "'", e);
		}
	}

	private double parseDouble(final String key) {
		try {
			final double d = Double.parseDouble(get(key).trim());
			if (!Double.isFinite(d)) {
				throw new ConfigurationException(key, "must be finite");
			}
			return d;
		}
		catch (final NumberFormatException e) {
			throw new ConfigurationException(key, "not a number: '" + get(key) +
				"'", e);
		}
	}

	private static double[] parsePlaceholder(final String value) {
		final String[] parts = StringUtils.split(value, ",; ");
		if (parts == null || parts.length != 2) {
			throw new ConfigurationException(PLACEHOLDER,
				"expected two numbers (positive,negative), got '" + value + "'");
		}
		final double[] tags = new double[2];
		for (int i = 0; i < 2; i++) {
			try {
				tags[i] = Double.parseDouble(parts[i]);
			}
			catch (final NumberFormatException e) {
				throw new ConfigurationException(PLACEHOLDER, "not a number: '" +
					parts[i] + "'", e);
			}
		}
		return tags;
	}

	private static List<ImageFormat> parseImageFormats(final String value) {
		final List<ImageFormat> formats = new ArrayList<>();
		final String[] parts = StringUtils.split(value, ", ");
		if (parts == null) return Collections.emptyList();
		for (final String part : parts) {
			if (part.equalsIgnoreCase("none")) continue;
			try {
				final ImageFormat f = ImageFormat.valueOf(part.toUpperCase(
					Locale.ROOT));
				if (!formats.contains(f)) formats.add(f);
			}
			catch (final IllegalArgumentException e) {
				throw new ConfigurationException(IMAGE_FORMATS, "unknown format '" +
					part + "', expected png, pdf or svg", e);
			}
		}
		return Collections.unmodifiableList(formats);
	}

	private static TableFormat parseTableFormat(final String value) {
		try {
			return TableFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (final IllegalArgumentException e) {
			throw new ConfigurationException(TABLE_FORMAT, "unknown format '" +
				value + "', expected tsv, csv or xlsx", e);
		}
	}
}

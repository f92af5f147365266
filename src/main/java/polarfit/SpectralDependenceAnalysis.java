/**
 * Polar Fit
 * SpectralDependenceAnalysis.java
 *
 */

package polarfit;

import java.io.File;
import java.util.Arrays;
import java.util.Locale;

import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.linear.RealMatrix;
import org.scijava.Context;

import polarfit.AnalysisException.Stage;

/**
 * Single-channel run over a power or temperature series: every Y column is
 * one series, featured raw and smoothed, with trends of the smoothed
 * features against the condition value.
 */
class SpectralDependenceAnalysis extends
	SpectrumAnalysis<SpectralDependenceAnalysis.Run>
{

	static final String channelName = "Spectrum";

	/** Results of one input file. */
	static class Run {

		final SpectrumTable table;
		final SpectrumTable prepared;
		final Channel channel;

		Run(final SpectrumTable table, final SpectrumTable prepared,
			final Channel channel)
		{
			this.table = table;
			this.prepared = prepared;
			this.channel = channel;
		}
	}

	SpectralDependenceAnalysis(final Context context,
		final AnalysisSettings settings)
	{
		super(context, settings);
	}

	@Override
	Run analyze(final SpectrumTable table) {
		final SpectrumTable prepared = prepare(table);
		final double[] conditions = prepared.getConditionValues();
		final int n = Preprocessor.seriesCount(table.getName(), prepared
			.getSeriesCount(), conditions.length);
		if (n < prepared.getSeriesCount()) {
			log.warn(String.format(Locale.ROOT,
				"%s: using %d of %d columns (%d distinct condition values)", table
					.getName(), n, prepared.getSeriesCount(), conditions.length));
		}
		final RealMatrix raw = Preprocessor.firstColumns(prepared.getY(), n);
		final Smoother smoother = new Smoother(settings.getSmoothing());
		final RealMatrix smoothed = stage(Stage.SMOOTH, () -> smoother.smooth(raw));
		final FeatureExtractor extractor = new FeatureExtractor(settings
			.getAreaMode());
		final Channel channel = stage(Stage.EXTRACT, () -> extractor.summarize(
			channelName, prepared.getX(), raw, smoothed, Arrays.copyOf(conditions,
				n)));
		return new Run(table, prepared, channel);
	}

	@Override
	void export(final File input, final Run run, final ResultWriter writer,
		final File dir, final String basename, final StopWatch sw)
	{
		final String header = settings.getConditionHeader();
		final String[] labels = conditionLabels(run.channel);
		final ResultTable raw = stage(Stage.ASSEMBLE, () -> ResultAssembler
			.spectrumTable(ResultAssembler.energyHeader, run.table.getX(), run.table
				.getY(), run.table.getHeaders()));
		final ResultTable filtered = stage(Stage.ASSEMBLE, () -> ResultAssembler
			.spectrumTable(ResultAssembler.energyHeader, run.channel.getX(),
				run.channel.getSmoothed(), labels));
		final ResultTable summary = stage(Stage.ASSEMBLE, () -> ResultAssembler
			.summaryTable(run.channel, header));

		if (!settings.getImageFormats().isEmpty()) {
			final Plotter plotter = new Plotter();
			writer.writeFigure(dir, "1_Plots_" + basename, new Figure(
				"Spectral dependence", plotter.spectrumCharts(run.channel, labels)));
			writer.writeFigure(dir, "2_Summary_" + basename, new Figure("Summary",
				plotter.trendCharts(run.channel, header)));
		}
		writer.writeTable(dir, "3_Raw_" + basename, raw);
		writer.writeTable(dir, "4_Filtered_" + basename, filtered);
		writer.writeTable(dir, "5_Result_" + basename, summary);
		writer.writeText(dir, "0_Parameters_" + basename, runLog(input, run, sw));
	}

	String runLog(final File input, final Run run, final StopWatch sw) {
		final StringBuilder sb = logHeader(input, run.prepared);
		line(sb, "Area", settings.getAreaMode().toString().toLowerCase(
			Locale.ROOT));
		line(sb, settings.getConditionHeader(), numbers(run.channel
			.getConditions()));
		line(sb, "Runtime (s)", String.format(Locale.ROOT, "%.2f", sw.getTime() /
			1000.0));
		return sb.toString();
	}

	private static String[] conditionLabels(final Channel channel) {
		final String[] labels = new String[channel.getSeriesCount()];
		for (int i = 0; i < labels.length; i++) {
			labels[i] = number(channel.getCondition(i));
		}
		return labels;
	}
}

/**
 * Polar Fit
 * PolarizationAnalysis.java
 *
 */

package polarfit;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.linear.RealMatrix;
import org.jfree.chart.JFreeChart;
import org.scijava.Context;

import polarfit.AnalysisException.Stage;

/**
 * Circular polarization run: interleaved positive/negative columns are
 * smoothed and featured per channel, then combined into DOCP, Zeeman
 * splitting and a g-factor fit.
 */
class PolarizationAnalysis extends SpectrumAnalysis<PolarizationAnalysis.Run> {

	/** Results of one input file. */
	static class Run {

		final SpectrumTable prepared;
		final Channel positive;
		final Channel negative;
		final PolarizationResult polarization;
		final GFactorFit fit;

		Run(final SpectrumTable prepared, final Channel positive,
			final Channel negative, final PolarizationResult polarization,
			final GFactorFit fit)
		{
			this.prepared = prepared;
			this.positive = positive;
			this.negative = negative;
			this.polarization = polarization;
			this.fit = fit;
		}
	}

	PolarizationAnalysis(final Context context,
		final AnalysisSettings settings)
	{
		super(context, settings);
	}

	@Override
	Run analyze(final SpectrumTable table) {
		final SpectrumTable prepared = prepare(table);
		final int yColumns = prepared.getSeriesCount();
		final double[] conditions = prepared.getConditionValues();
		final int n = Preprocessor.seriesCount(table.getName(), Preprocessor
			.positiveCount(yColumns), Preprocessor.negativeCount(yColumns),
			conditions.length);
		if (n < Preprocessor.positiveCount(yColumns) || n < conditions.length) {
			log.warn(String.format(Locale.ROOT,
				"%s: using %d series (%d positive, %d negative columns, %d field values)",
				table.getName(), n, Preprocessor.positiveCount(yColumns), Preprocessor
					.negativeCount(yColumns), conditions.length));
		}
		final double[] field = Arrays.copyOf(conditions, n);
		final RealMatrix posRaw = Preprocessor.positiveColumns(prepared.getY(), n);
		final RealMatrix negRaw = Preprocessor.negativeColumns(prepared.getY(), n);

		final Smoother smoother = new Smoother(settings.getSmoothing());
		final RealMatrix posSmoothed = stage(Stage.SMOOTH, () -> smoother.smooth(
			posRaw));
		final RealMatrix negSmoothed = stage(Stage.SMOOTH, () -> smoother.smooth(
			negRaw));

		final FeatureExtractor extractor = new FeatureExtractor(settings
			.getAreaMode());
		final Channel positive = stage(Stage.EXTRACT, () -> extractor.summarize(
			Channel.POSITIVE, prepared.getX(), posRaw, posSmoothed, field));
		final Channel negative = stage(Stage.EXTRACT, () -> extractor.summarize(
			Channel.NEGATIVE, prepared.getX(), negRaw, negSmoothed, field));

		final PolarizationResult polarization = stage(Stage.ANALYZE,
			() -> new PolarizationAnalyzer().analyze(positive, negative));
		final GFactorFit fit = stage(Stage.FIT, () -> new GFactorFitter().fit(
			polarization.getField(), polarization.getZeemanRaw()));
		if (fit.isValid()) {
			log.info(String.format(Locale.ROOT,
				"%s: g = %.4f, slope = %.4f meV/T, RMS = %.4g", table.getName(), fit
					.getG(), fit.getSlope(), fit.getRMS()));
		}
		else {
			log.warn(table.getName() + ": no g-factor, " + fit.getFailure());
		}
		return new Run(prepared, positive, negative, polarization, fit);
	}

	@Override
	void export(final File input, final Run run, final ResultWriter writer,
		final File dir, final String basename, final StopWatch sw)
	{
		final String header = settings.getConditionHeader();
		final String[] labels = ResultAssembler.fieldLabels(run.positive
			.getConditions());
		final List<ResultTable> tables = stage(Stage.ASSEMBLE, () -> {
			final List<ResultTable> t = new ArrayList<>();
			t.add(ResultAssembler.spectrumTable(ResultAssembler.energyHeader,
				run.positive.getX(), run.positive.getRaw(), labels));
			t.add(ResultAssembler.spectrumTable(ResultAssembler.energyHeader,
				run.positive.getX(), run.positive.getSmoothed(), labels));
			t.add(ResultAssembler.summaryTable(run.positive, header));
			t.add(ResultAssembler.spectrumTable(ResultAssembler.energyHeader,
				run.negative.getX(), run.negative.getRaw(), labels));
			t.add(ResultAssembler.spectrumTable(ResultAssembler.energyHeader,
				run.negative.getX(), run.negative.getSmoothed(), labels));
			t.add(ResultAssembler.summaryTable(run.negative, header));
			t.add(ResultAssembler.combinedSummary(t.get(2), t.get(5),
				run.polarization, run.fit, settings.getPlaceholder()));
			return t;
		});
		final String[] tableNames = { "1_Pos_raw_", "2_Pos_filt_",
			"3_Pos_summary_", "4_Neg_raw_", "5_Neg_filt_", "6_Neg_summary_",
			"7_Summary_Combined_" };

		if (!settings.getImageFormats().isEmpty()) {
			final Plotter plotter = new Plotter();
			writer.writeFigure(dir, "0_Plots_Pos_" + basename, new Figure(
				"Positive channel", plotter.spectrumCharts(run.positive, labels)));
			writer.writeFigure(dir, "0_Plots_Neg_" + basename, new Figure(
				"Negative channel", plotter.spectrumCharts(run.negative, labels)));
			writer.writeFigure(dir, "0_Plots_PosNeg_" + basename, new Figure(
				"Positive / Negative", plotter.overlayCharts(run.positive,
					run.negative)));
			final List<JFreeChart> docp = new ArrayList<>();
			docp.add(plotter.docpChart(run.polarization));
			docp.add(plotter.zeemanChart(run.polarization, run.fit));
			writer.writeFigure(dir, "0_Plots_DOCP_" + basename, new Figure(
				"DOCP & g-factor", docp));
		}
		for (int i = 0; i < tables.size(); i++) {
			writer.writeTable(dir, tableNames[i] + basename, tables.get(i));
		}
		writer.writeText(dir, "Parameters_" + basename, runLog(input, run, sw));
	}

	String runLog(final File input, final Run run, final StopWatch sw) {
		final StringBuilder sb = logHeader(input, run.prepared);
		final double[] tags = settings.getPlaceholder();
		line(sb, "Pos_Neg tag", "[" + number(tags[0]) + ", " + number(tags[1]) +
			"]");
		line(sb, "Magnetic-Field", numbers(run.positive.getConditions()) +
			" (T)");
		sb.append(String.format("%n"));
		sb.append(String.format("Global g-factor fit%n"));
		line(sb, "    g (dimensionless)", String.format(Locale.ROOT, "%.6f", run.fit
			.getG()));
		line(sb, "    g·μB/ħ (= Slope, meV/T)", String.format(Locale.ROOT, "%.6f",
			run.fit.getSlope()));
		if (!run.fit.isValid()) line(sb, "    Fit", run.fit.getFailure());
		sb.append(String.format("%n"));
		sb.append(String.format("Statistics%n"));
		line(sb, "    Mean DOCP (raw / filt)", String.format(Locale.ROOT,
			"%.5f  /  %.5f", run.polarization.getMeanDocpRaw(), run.polarization
				.getMeanDocpSmoothed()));
		line(sb, "    Runtime (s)", String.format(Locale.ROOT, "%.2f", sw.getTime() /
			1000.0));
		return sb.toString();
	}
}

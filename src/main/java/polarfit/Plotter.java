/**
 * Polar Fit
 * Plotter.java
 *
 */

package polarfit;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Shape;
import java.awt.Stroke;
import java.awt.geom.Ellipse2D;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.annotations.XYLineAnnotation;
import org.jfree.chart.annotations.XYTextAnnotation;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleEdge;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.chart.ui.TextAnchor;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Builds the charts of an analysis run. Charts are plain {@link JFreeChart}
 * objects; {@link Figure} arranges them and {@link ResultWriter} renders them.
 */
class Plotter {

	static final String energyLabel = "Energy (eV)";
	static final String intensityLabel = "Intensity (a.u.)";

	// Colors are listed here for consistent, easy modification
	static final Color rawColor = new Color(127, 127, 127);
	static final Color smoothedColor = Color.RED;
	static final Color positiveColor = Color.RED;
	static final Color negativeColor = Color.BLUE;
	static final Color fitColor = new Color(255, 153, 0);
	private static final Color halfMaxColor = new Color(0, 185, 19);
	private static final Color gridColor = Color.DARK_GRAY;
	private static final Stroke dataStroke = new BasicStroke(2.0f);
	private static final Stroke thinStroke = new BasicStroke(1.0f);
	private static final Stroke halfMaxStroke = new BasicStroke(1.25f,
		BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10.0f, new float[] { 15.0f,
			5.0f, 5.0f, 5.0f }, 0.0f);
	private static final Shape dot = new Ellipse2D.Double(-3, -3, 6, 6);
	private static final Font labelFont = new Font("SansSerif", Font.PLAIN, 11);

	/**
	 * One chart per series: raw and smoothed spectrum, smoothed peak marker
	 * and the half-maximum segment.
	 *
	 * @param titles chart title of each series
	 */
	List<JFreeChart> spectrumCharts(final Channel channel,
		final String[] titles)
	{
		if (titles.length != channel.getSeriesCount()) {
			throw new DimensionMismatchException(titles.length, channel
				.getSeriesCount());
		}
		final List<JFreeChart> charts = new ArrayList<>();
		for (int i = 0; i < channel.getSeriesCount(); i++) {
			final String title = titles[i];
			final DataSeries raw = new DataSeries("Raw", DataSeries.RAW, channel
				.getX(), channel.getRaw().getColumnVector(i), rawColor);
			final DataSeries smoothed = new DataSeries("Smoothed", DataSeries.SMOOTHED,
				channel.getX(), channel.getSmoothed().getColumnVector(i),
				smoothedColor);
			final JFreeChart chart = lineChart(title, energyLabel, intensityLabel,
				raw, smoothed);
			markFeatures(chart.getXYPlot(), channel.getSmoothedFeatures(i));
			charts.add(chart);
		}
		return charts;
	}

	/**
	 * One chart per series with the smoothed positive and negative spectra.
	 */
	List<JFreeChart> overlayCharts(final Channel positive,
		final Channel negative)
	{
		final int n = Math.min(positive.getSeriesCount(), negative
			.getSeriesCount());
		final List<JFreeChart> charts = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			final DataSeries pos = new DataSeries(positive.getName(),
				DataSeries.SMOOTHED, positive.getX(), positive.getSmoothed()
					.getColumnVector(i), positiveColor);
			final DataSeries neg = new DataSeries(negative.getName(),
				DataSeries.SMOOTHED, negative.getX(), negative.getSmoothed()
					.getColumnVector(i), negativeColor);
			charts.add(lineChart(ResultAssembler.fieldLabel(positive.getCondition(
				i)), energyLabel, intensityLabel, pos, neg));
		}
		return charts;
	}

	/**
	 * DOCP against field: raw values as points, smoothed values as a line.
	 */
	JFreeChart docpChart(final PolarizationResult result) {
		final DataSeries raw = new DataSeries("DOCP raw", DataSeries.POINTS, result
			.getField(), result.getDocpRaw(), rawColor);
		final DataSeries smoothed = new DataSeries("DOCP smoothed",
			DataSeries.SMOOTHED, result.getField(), result.getDocpSmoothed(),
			smoothedColor);
		return lineChart("DOCP", "B (T)", "DOCP", raw, smoothed);
	}

	/**
	 * Zeeman splitting against field with the fitted line and its g-factor.
	 */
	JFreeChart zeemanChart(final PolarizationResult result,
		final GFactorFit fit)
	{
		final DataSeries measured = new DataSeries("ΔE raw",
			DataSeries.POINTS, result.getField(), result.getZeemanRaw(), rawColor);
		final DataSeries smoothed = new DataSeries("ΔE smoothed",
			DataSeries.POINTS, result.getField(), result.getZeemanSmoothed(),
			smoothedColor);
		final JFreeChart chart;
		if (fit.isValid()) {
			final DataSeries fitted = new DataSeries("Fit", DataSeries.FIT, result
				.getField(), fit.getFitted(), fitColor);
			chart = lineChart("Zeeman splitting", "B (T)", "ΔE (meV)",
				measured, smoothed, fitted);
		}
		else {
			chart = lineChart("Zeeman splitting", "B (T)", "ΔE (meV)",
				measured, smoothed);
		}
		final XYPlot plot = chart.getXYPlot();
		final String text = fit.isValid() ? String.format(Locale.ROOT,
			"g = %.2f", fit.getSlope()) : "g = NaN";
		final XYTextAnnotation label = new XYTextAnnotation(text, plot
			.getDomainAxis().getLowerBound(), plot.getRangeAxis().getUpperBound());
		label.setFont(labelFont);
		label.setTextAnchor(TextAnchor.TOP_LEFT);
		label.setPaint(fitColor);
		plot.addAnnotation(label);
		return chart;
	}

	/**
	 * Smoothed peak energy, peak intensity and area against the condition
	 * value of each series.
	 */
	List<JFreeChart> trendCharts(final Channel channel,
		final String conditionLabel)
	{
		final int n = channel.getSeriesCount();
		final RealVector conditions = new ArrayRealVector(channel
			.getConditions());
		final RealVector energy = new ArrayRealVector(n);
		final RealVector intensity = new ArrayRealVector(n);
		final RealVector area = new ArrayRealVector(n);
		for (int i = 0; i < n; i++) {
			final SpectralFeatures f = channel.getSmoothedFeatures(i);
			energy.setEntry(i, f.getPeakX());
			intensity.setEntry(i, f.getPeakY());
			area.setEntry(i, f.getArea());
		}
		final List<JFreeChart> charts = new ArrayList<>();
		charts.add(lineChart("Peak energy", conditionLabel, energyLabel,
			new DataSeries("Peak energy", DataSeries.TREND, conditions, energy,
				smoothedColor)));
		charts.add(lineChart("Peak intensity", conditionLabel, intensityLabel,
			new DataSeries("Peak intensity", DataSeries.TREND, conditions,
				intensity, smoothedColor)));
		charts.add(lineChart("Integrated area", conditionLabel, "Area (a.u.)",
			new DataSeries("Area", DataSeries.TREND, conditions, area,
				smoothedColor)));
		return charts;
	}

	private static JFreeChart lineChart(final String title,
		final String xLabel, final String yLabel, final DataSeries... series)
	{
		final XYSeriesCollection dataset = new XYSeriesCollection();
		for (final DataSeries s : series) {
			dataset.addSeries(s);
		}
		final JFreeChart chart = ChartFactory.createXYLineChart(title, xLabel,
			yLabel, dataset, PlotOrientation.VERTICAL, true, false, false);
		chart.getTitle().setMargin(new RectangleInsets(5, 5, 5, 5));
		chart.getTitle().setPaint(Color.BLACK);
		chart.setBackgroundPaint(Color.WHITE);
		chart.getLegend().setPosition(RectangleEdge.BOTTOM);

		final XYPlot plot = chart.getXYPlot();
		plot.setBackgroundPaint(Color.WHITE);
		plot.setDomainGridlinePaint(gridColor);
		plot.setRangeGridlinePaint(gridColor);
		plot.getDomainAxis().setLowerMargin(0);
		plot.getDomainAxis().setUpperMargin(0);

		final XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
		for (int i = 0; i < series.length; i++) {
			final DataSeries s = series[i];
			renderer.setSeriesPaint(i, s.getColor());
			switch (s.getType()) {
				case DataSeries.POINTS:
					renderer.setSeriesLinesVisible(i, false);
					renderer.setSeriesShapesVisible(i, true);
					renderer.setSeriesShape(i, dot);
					break;
				case DataSeries.TREND:
					renderer.setSeriesLinesVisible(i, true);
					renderer.setSeriesShapesVisible(i, true);
					renderer.setSeriesShape(i, dot);
					renderer.setSeriesStroke(i, thinStroke);
					break;
				case DataSeries.RAW:
					renderer.setSeriesLinesVisible(i, true);
					renderer.setSeriesShapesVisible(i, false);
					renderer.setSeriesStroke(i, thinStroke);
					break;
				default:
					renderer.setSeriesLinesVisible(i, true);
					renderer.setSeriesShapesVisible(i, false);
					renderer.setSeriesStroke(i, dataStroke);
			}
		}
		plot.setRenderer(renderer);
		return chart;
	}

	private static void markFeatures(final XYPlot plot,
		final SpectralFeatures f)
	{
		if (Double.isNaN(f.getPeakY())) return;
		final XYTextAnnotation peak = new XYTextAnnotation(String.format(
			Locale.ROOT, "(%.2f, %.2f)", f.getPeakX(), f.getPeakY()), f.getPeakX(), f
				.getPeakY());
		peak.setFont(labelFont);
		peak.setTextAnchor(TextAnchor.BOTTOM_CENTER);
		plot.addAnnotation(peak);
		if (!Double.isNaN(f.getFWHM())) {
			final double h = f.getPeakY() / 2;
			plot.addAnnotation(new XYLineAnnotation(f.getHalfMaxStart(), h, f
				.getHalfMaxEnd(), h, halfMaxStroke, halfMaxColor));
		}
	}
}

/**
 * XY series with a legend name, a rendering type and a color.
 */
class DataSeries extends XYSeries {

	private static final long serialVersionUID = 1L;

	// Possible Types
	static final int RAW = 0;
	static final int SMOOTHED = 1;
	static final int POINTS = 2;
	static final int FIT = 3;
	static final int TREND = 4;

	private final int type;
	private final Color color;

	DataSeries(final String name, final int type, final RealVector x,
		final RealVector y, final Color color)
	{
		super(name, false, true);
		this.type = type;
		this.color = color;
		if (x.getDimension() != y.getDimension()) {
			throw new DimensionMismatchException(x.getDimension(), y
				.getDimension());
		}
		for (int r = 0; r < x.getDimension(); r++) {
			add(x.getEntry(r), y.getEntry(r));
		}
	}

	public int getType() {
		return type;
	}

	public Color getColor() {
		return color;
	}
}

/**
 * Polar Fit
 * Figure.java
 *
 */

package polarfit;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jfree.chart.JFreeChart;

/**
 * A titled set of charts drawn as one image, laid out on a grid of
 * {@code ceil(sqrt(n))} rows and {@code ceil(n / rows)} columns.
 */
class Figure {

	static final int panelWidth = 480;
	static final int panelHeight = 360;
	private static final int titleHeight = 36;
	private static final Font titleFont = new Font("SansSerif", Font.BOLD, 18);

	private final String title;
	private final List<JFreeChart> charts;
	private final int rows;
	private final int columns;

	Figure(final String title, final List<JFreeChart> charts) {
		this.title = title;
		this.charts = Collections.unmodifiableList(new ArrayList<>(charts));
		final int n = Math.max(1, charts.size());
		rows = (int) Math.ceil(Math.sqrt(n));
		columns = (int) Math.ceil((double) n / rows);
	}

	public String getTitle() {
		return title;
	}

	public List<JFreeChart> getCharts() {
		return charts;
	}

	public int getRows() {
		return rows;
	}

	public int getColumns() {
		return columns;
	}

	public int getWidth() {
		return columns * panelWidth;
	}

	public int getHeight() {
		return titleHeight + rows * panelHeight;
	}

	/**
	 * Draws the title and every chart into {@code area}, row by row.
	 */
	public void draw(final Graphics2D g, final Rectangle2D area) {
		g.setPaint(Color.WHITE);
		g.fill(area);
		final double scale = area.getHeight() / getHeight();
		final double top = titleHeight * scale;

		g.setPaint(Color.BLACK);
		g.setFont(titleFont.deriveFont((float) (titleFont.getSize() * scale)));
		final int textWidth = g.getFontMetrics().stringWidth(title);
		g.drawString(title, (float) (area.getX() + (area.getWidth() - textWidth) /
			2), (float) (area.getY() + top * 0.7));

		final double w = area.getWidth() / columns;
		final double h = (area.getHeight() - top) / rows;
		for (int i = 0; i < charts.size(); i++) {
			final int r = i / columns;
			final int c = i % columns;
			charts.get(i).draw(g, new Rectangle2D.Double(area.getX() + c * w, area
				.getY() + top + r * h, w, h));
		}
	}
}

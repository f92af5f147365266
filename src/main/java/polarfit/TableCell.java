/**
 * Polar Fit
 * TableCell.java
 *
 */

package polarfit;

import java.util.Objects;

/**
 * Cell of a {@link ResultTable}: a number, a text, or {@link #BLANK}. Blank
 * padding is neither zero nor NaN so later readers cannot take it for data.
 */
public final class TableCell {

	enum Kind {
		NUMBER, TEXT, BLANK
	}

	public static final TableCell BLANK = new TableCell(Kind.BLANK, Double.NaN,
		null);

	private final Kind kind;
	private final double number;
	private final String text;

	private TableCell(final Kind kind, final double number, final String text) {
		this.kind = kind;
		this.number = number;
		this.text = text;
	}

	public static TableCell of(final double number) {
		return new TableCell(Kind.NUMBER, number, null);
	}

	public static TableCell of(final String text) {
		return new TableCell(Kind.TEXT, Double.NaN, Objects.requireNonNull(text));
	}

	Kind getKind() {
		return kind;
	}

	public boolean isBlank() {
		return kind == Kind.BLANK;
	}

	public boolean isNumber() {
		return kind == Kind.NUMBER;
	}

	public boolean isText() {
		return kind == Kind.TEXT;
	}

	public double getNumber() {
		if (kind != Kind.NUMBER) throw new IllegalStateException(kind +
			" cell has no number");
		return number;
	}

	public String getText() {
		if (kind != Kind.TEXT) throw new IllegalStateException(kind +
			" cell has no text");
		return text;
	}

	/**
	 * @return the cell as written to a delimited file: empty for blanks,
	 *         whole numbers without a fraction, NaN as "NaN"
	 */
	public String format() {
		switch (kind) {
			case TEXT:
				return text;
			case NUMBER:
				if (Double.isNaN(number) || Double.isInfinite(number)) return Double
					.toString(number);
				if (number == Math.rint(number) && Math.abs(number) < 1e15) return Long
					.toString((long) number);
				return Double.toString(number);
			default:
				return "";
		}
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof TableCell)) return false;
		final TableCell c = (TableCell) o;
		return kind == c.kind && Double.compare(number, c.number) == 0 && Objects
			.equals(text, c.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, number, text);
	}

	@Override
	public String toString() {
		return kind == Kind.BLANK ? "<blank>" : format();
	}
}

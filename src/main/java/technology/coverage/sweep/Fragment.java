package technology.coverage.sweep;

import java.util.Locale;

import technology.coverage.Rectangle;

/**
 * 扫描过程中的矩形碎片，直接保存四条边的坐标。
 *
 * <p>
 * 切分只改变 minX/maxX，四条边都是从输入矩形或事件列原样复制的值，
 * 因此碎片的右边缘与事件列可以用 == 精确比较，不会因 x + width 的舍入而漂移。
 * </p>
 */
public final class Fragment {

	private final double minX;
	private final double maxX;
	private final double minY;
	private final double maxY;

	Fragment(double minX, double maxX, double minY, double maxY) {
		this.minX = minX;
		this.maxX = maxX;
		this.minY = minY;
		this.maxY = maxY;
	}

	static Fragment of(Rectangle r) {
		return new Fragment(r.getMinX(), r.getMaxX(), r.getMinY(), r.getMaxY());
	}

	public double getMinX() {
		return minX;
	}

	public double getMaxX() {
		return maxX;
	}

	public double getMinY() {
		return minY;
	}

	public double getMaxY() {
		return maxY;
	}

	/**
	 * column 严格落在 (minX, maxX) 内时需要切分。
	 */
	boolean straddles(double column) {
		return column > minX && column < maxX;
	}

	Fragment leftOf(double column) {
		return new Fragment(minX, column, minY, maxY);
	}

	Fragment rightOf(double column) {
		return new Fragment(column, maxX, minY, maxY);
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "Fragment[x=%s..%s,y=%s..%s]", minX, maxX, minY, maxY);
	}

}

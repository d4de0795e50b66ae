package technology.coverage;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;

/**
 * 平面上的轴对齐矩形（不可变）。
 *
 * <p>
 * 矩形由左下角 (x, y) 与宽高描述，占据区域 [x, x+width] × [y, y+height]。
 * 两种边界约定在整个库中共用：
 * </p>
 * <ul>
 * <li>重叠判定使用开区域 (x, x+width) × (y, y+height)：仅共享边界的两个矩形不算重叠</li>
 * <li>点包含判定使用闭区域：落在边界上的点算作被覆盖</li>
 * </ul>
 */
public final class Rectangle {

	/**
	 * 先按 minX 再按 minY 升序排列（扫描线处理顺序）。
	 */
	public static final Comparator<Rectangle> SWEEP_ORDER = Comparator.comparingDouble(Rectangle::getMinX)
			.thenComparingDouble(Rectangle::getMinY);

	private final double x;
	private final double y;
	private final double width;
	private final double height;

	/**
	 * 使用左下角坐标与宽高构造矩形。
	 *
	 * @param x      左侧 X 坐标
	 * @param y      底部 Y 坐标
	 * @param width  宽度（必须为正）
	 * @param height 高度（必须为正）
	 * @throws InvalidRectangleException 坐标非有限数，宽高不为正，或右/上边缘在浮点运算后没有超过左/下边缘
	 */
	public Rectangle(double x, double y, double width, double height) {
		if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(width) || !Double.isFinite(height)) {
			throw new InvalidRectangleException(
					String.format(Locale.US, "non-finite rectangle [x=%s,y=%s,w=%s,h=%s]", x, y, width, height));
		}
		if (width <= 0 || height <= 0) {
			throw new InvalidRectangleException(
					String.format(Locale.US, "non-positive extent [x=%s,y=%s,w=%s,h=%s]", x, y, width, height));
		}
		// x + width may round back to x (or overflow) for a tiny extent at a large coordinate
		double maxX = x + width;
		double maxY = y + height;
		if (!(maxX > x) || !(maxY > y) || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
			throw new InvalidRectangleException(
					String.format(Locale.US, "extent lost to rounding [x=%s,y=%s,w=%s,h=%s]", x, y, width, height));
		}
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}

	/**
	 * 由两个对角坐标构造矩形。
	 */
	public static Rectangle fromBounds(double minX, double minY, double maxX, double maxY) {
		return new Rectangle(minX, minY, maxX - minX, maxY - minY);
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getWidth() {
		return width;
	}

	public double getHeight() {
		return height;
	}

	public double getMinX() {
		return x;
	}

	public double getMaxX() {
		return x + width;
	}

	public double getMinY() {
		return y;
	}

	public double getMaxY() {
		return y + height;
	}

	/**
	 * 计算并返回矩形的面积（宽 * 高）。
	 */
	public double getArea() {
		return width * height;
	}

	/**
	 * 判断两个矩形的内部（开区域）是否相交。
	 *
	 * <p>
	 * 四个比较都是严格不等式，只共享一条边或一个角的矩形不算重叠。
	 * </p>
	 *
	 * @param other 另一个矩形
	 * @return 内部相交返回 true
	 */
	public boolean overlaps(Rectangle other) {
		return this.getMaxX() > other.getMinX()
				&& this.getMinX() < other.getMaxX()
				&& this.getMaxY() > other.getMinY()
				&& this.getMinY() < other.getMaxY();
	}

	/**
	 * 判断点是否落在矩形的闭区域内（边界上的点也算）。
	 *
	 * @param px 点的 X 坐标
	 * @param py 点的 Y 坐标
	 * @return 被覆盖返回 true
	 */
	public boolean covers(double px, double py) {
		return px >= this.getMinX() && px <= this.getMaxX() && py >= this.getMinY() && py <= this.getMaxY();
	}

	/**
	 * 返回两个矩形的交集矩形。
	 *
	 * <p>
	 * 交集为 x = max(x1, x2)，y = max(y1, y2)，宽高取两边右/上边缘的较小者减去起点。
	 * 调用方需先用 {@link #overlaps(Rectangle)} 确认相交，结果的宽高才严格为正。
	 * </p>
	 *
	 * @param other 另一个矩形
	 * @return 交集矩形
	 * @throws InvalidRectangleException 两个矩形内部不相交
	 */
	public Rectangle intersection(Rectangle other) {
		double ix = Math.max(this.x, other.x);
		double iy = Math.max(this.y, other.y);
		return new Rectangle(ix, iy, Math.min(this.getMaxX(), other.getMaxX()) - ix,
				Math.min(this.getMaxY(), other.getMaxY()) - iy);
	}

	/**
	 * 计算并返回一组矩形的最小外接矩形（bounding box）。
	 *
	 * @param rectangles 要包围的矩形集合
	 * @return 包含所有矩形的最小矩形
	 * @throws IllegalArgumentException 集合为空
	 */
	public static Rectangle boundingBoxOf(Collection<Rectangle> rectangles) {
		if (rectangles.isEmpty()) {
			throw new IllegalArgumentException("cannot bound an empty set of rectangles");
		}
		double minx = Double.POSITIVE_INFINITY;
		double miny = Double.POSITIVE_INFINITY;
		double maxx = Double.NEGATIVE_INFINITY;
		double maxy = Double.NEGATIVE_INFINITY;

		for (Rectangle r : rectangles) {
			minx = Math.min(r.getMinX(), minx);
			miny = Math.min(r.getMinY(), miny);
			maxx = Math.max(r.getMaxX(), maxx);
			maxy = Math.max(r.getMaxY(), maxy);
		}
		return fromBounds(minx, miny, maxx, maxy);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Rectangle)) {
			return false;
		}
		Rectangle other = (Rectangle) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
				&& Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(x);
		result = 31 * result + Double.hashCode(y);
		result = 31 * result + Double.hashCode(width);
		result = 31 * result + Double.hashCode(height);
		return result;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "Rectangle[x=%s,y=%s,width=%s,height=%s]", x, y, width, height);
	}

}

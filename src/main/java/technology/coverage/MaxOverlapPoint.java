package technology.coverage;

import java.util.Locale;

/**
 * 重叠次数最多的一个见证点，以及覆盖该点的矩形个数。
 */
public final class MaxOverlapPoint {

	/**
	 * 没有任何矩形时的结果：原点，count 为 0。
	 */
	public static final MaxOverlapPoint NONE = new MaxOverlapPoint(0, 0, 0);

	private final double x;
	private final double y;
	private final int count;

	public MaxOverlapPoint(double x, double y, int count) {
		this.x = x;
		this.y = y;
		this.count = count;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public int getCount() {
		return count;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MaxOverlapPoint)) {
			return false;
		}
		MaxOverlapPoint other = (MaxOverlapPoint) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0 && count == other.count;
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(x);
		result = 31 * result + Double.hashCode(y);
		return 31 * result + count;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "MaxOverlapPoint[x=%s,y=%s,count=%d]", x, y, count);
	}

}

package technology.coverage.sweep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 条带内合并后的一段 y 区间，与同一条带内的其他 band 两两不相交。
 */
public final class VerticalBand {

	private final double minY;
	private final double maxY;

	VerticalBand(double minY, double maxY) {
		this.minY = minY;
		this.maxY = maxY;
	}

	public double getMinY() {
		return minY;
	}

	public double getMaxY() {
		return maxY;
	}

	public double getHeight() {
		return maxY - minY;
	}

	/**
	 * 把按 minY 升序排列的碎片合并为最少的不相交 band。
	 *
	 * <ul>
	 * <li>碎片的上边缘不超过当前 band 的上边缘：被完全包含，丢弃</li>
	 * <li>碎片的下边缘低于当前 band 的上边缘：相交，把 band 延伸到碎片的上边缘</li>
	 * <li>否则不相交：输出当前 band，从该碎片开始新的 band</li>
	 * </ul>
	 *
	 * @param sortedFragments 同一条带内、按 minY 升序的碎片
	 * @return 合并后的 band，按 y 升序
	 */
	static List<VerticalBand> merge(List<Fragment> sortedFragments) {
		if (sortedFragments.isEmpty()) {
			return Collections.emptyList();
		}
		List<VerticalBand> bands = new ArrayList<>();
		double bandMin = sortedFragments.get(0).getMinY();
		double bandMax = sortedFragments.get(0).getMaxY();
		for (int i = 1; i < sortedFragments.size(); i++) {
			Fragment f = sortedFragments.get(i);
			if (f.getMaxY() <= bandMax) {
				continue;
			} else if (f.getMinY() < bandMax) {
				bandMax = f.getMaxY();
			} else {
				bands.add(new VerticalBand(bandMin, bandMax));
				bandMin = f.getMinY();
				bandMax = f.getMaxY();
			}
		}
		bands.add(new VerticalBand(bandMin, bandMax));
		return bands;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "VerticalBand[%s..%s]", minY, maxY);
	}

}

package technology.coverage.extractors;

import java.util.ArrayList;
import java.util.List;

import technology.coverage.OverlapPair;
import technology.coverage.OverlapRegion;
import technology.coverage.Rectangle;

/**
 * 为每个已确认重叠的矩形对计算交集矩形。
 *
 * <p>
 * 输出顺序与输入的矩形对顺序一致。因为每一对都已经通过开区域相交检测，交集的宽高一定严格为正。
 * </p>
 */
public class OverlapRegionExtractor {

	public List<OverlapRegion> extract(List<Rectangle> rectangles, List<OverlapPair> pairs) {
		List<OverlapRegion> regions = new ArrayList<>(pairs.size());
		for (OverlapPair pair : pairs) {
			Rectangle a = rectangles.get(pair.getFirst());
			Rectangle b = rectangles.get(pair.getSecond());
			regions.add(new OverlapRegion(pair, a.intersection(b)));
		}
		return regions;
	}

	/**
	 * 所有交集区域的面积之和；没有区域时为 0。
	 */
	public static double totalArea(List<OverlapRegion> regions) {
		double area = 0;
		for (OverlapRegion region : regions) {
			area += region.getRegion().getArea();
		}
		return area;
	}

}

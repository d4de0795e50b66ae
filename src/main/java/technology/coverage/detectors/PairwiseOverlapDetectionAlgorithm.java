package technology.coverage.detectors;

import java.util.ArrayList;
import java.util.List;

import technology.coverage.OverlapPair;
import technology.coverage.Rectangle;

/**
 * 逐对比较的重叠检测：遍历 n×n 下标网格的上三角，共 n(n-1)/2 次比较，不做剪枝。
 *
 * 由于外层按 i、内层按 j 升序遍历，结果天然按字典序排列，不需要额外排序。
 */
public class PairwiseOverlapDetectionAlgorithm implements OverlapDetectionAlgorithm {

	@Override
	public List<OverlapPair> detect(List<Rectangle> rectangles) {
		List<OverlapPair> pairs = new ArrayList<>();
		for (int i = 0; i < rectangles.size(); i++) {
			Rectangle a = rectangles.get(i);
			for (int j = i + 1; j < rectangles.size(); j++) {
				if (a.overlaps(rectangles.get(j))) {
					pairs.add(new OverlapPair(i, j));
				}
			}
		}
		return pairs;
	}

	@Override
	public String toString() {
		return "pairwise";
	}

}

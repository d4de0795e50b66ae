package technology.coverage;

import java.util.Locale;

/**
 * 覆盖统计报告，每次调用 {@link RectangleAnalyzer#getStats()} 重新计算。
 *
 * <ul>
 * <li>totalRectangles：矩形个数</li>
 * <li>overlappingPairs：重叠矩形对的个数</li>
 * <li>totalArea：并集面积（重叠部分只计一次）</li>
 * <li>overlapArea：所有两两交集面积之和（被 3 个以上矩形覆盖的区域按对重复计算）</li>
 * <li>coverageEfficiency：totalArea / 各矩形面积之和</li>
 * </ul>
 */
public final class CoverageStats {

	private final int totalRectangles;
	private final int overlappingPairs;
	private final double totalArea;
	private final double overlapArea;
	private final double coverageEfficiency;

	public CoverageStats(int totalRectangles, int overlappingPairs, double totalArea, double overlapArea,
			double coverageEfficiency) {
		this.totalRectangles = totalRectangles;
		this.overlappingPairs = overlappingPairs;
		this.totalArea = totalArea;
		this.overlapArea = overlapArea;
		this.coverageEfficiency = coverageEfficiency;
	}

	public int getTotalRectangles() {
		return totalRectangles;
	}

	public int getOverlappingPairs() {
		return overlappingPairs;
	}

	public double getTotalArea() {
		return totalArea;
	}

	public double getOverlapArea() {
		return overlapArea;
	}

	public double getCoverageEfficiency() {
		return coverageEfficiency;
	}

	@Override
	public String toString() {
		return String.format(Locale.US,
				"CoverageStats[totalRectangles=%d,overlappingPairs=%d,totalArea=%s,overlapArea=%s,coverageEfficiency=%s]",
				totalRectangles, overlappingPairs, totalArea, overlapArea, coverageEfficiency);
	}

}

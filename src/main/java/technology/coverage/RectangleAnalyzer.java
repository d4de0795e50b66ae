package technology.coverage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.coverage.detectors.OverlapDetectionAlgorithm;
import technology.coverage.detectors.PairwiseOverlapDetectionAlgorithm;
import technology.coverage.extractors.OverlapRegionExtractor;
import technology.coverage.sweep.MaxOverlapReducer;
import technology.coverage.sweep.PlaneSweep;
import technology.coverage.sweep.UnionAreaReducer;

/**
 * 对一组固定的轴对齐矩形做重叠与覆盖分析。
 *
 * <p>
 * 构造时复制一次矩形列表，之后不再修改；矩形在输入序列中的下标（从 0 开始）即其在所有结果中的标识。
 * 每个查询方法都独立地从头计算，调用之间不共享中间状态，因此多个线程可以同时读取同一个实例。
 * </p>
 */
public class RectangleAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(RectangleAnalyzer.class);

	private final List<Rectangle> rectangles;
	private final OverlapDetectionAlgorithm detectionAlgorithm;
	private final OverlapRegionExtractor regionExtractor = new OverlapRegionExtractor();

	public RectangleAnalyzer(List<Rectangle> rectangles) {
		this(rectangles, new PairwiseOverlapDetectionAlgorithm());
	}

	/**
	 * @param rectangles         要分析的矩形，元素不能为 null
	 * @param detectionAlgorithm 用于查找重叠对的算法
	 */
	public RectangleAnalyzer(List<Rectangle> rectangles, OverlapDetectionAlgorithm detectionAlgorithm) {
		List<Rectangle> copy = new ArrayList<>(rectangles.size());
		for (Rectangle r : rectangles) {
			copy.add(Objects.requireNonNull(r, "rectangle"));
		}
		this.rectangles = Collections.unmodifiableList(copy);
		this.detectionAlgorithm = Objects.requireNonNull(detectionAlgorithm, "detectionAlgorithm");
	}

	public List<Rectangle> getRectangles() {
		return rectangles;
	}

	/**
	 * 所有内部相交的矩形对 (i, j)，i &lt; j，按字典序升序。
	 */
	public List<OverlapPair> findOverlaps() {
		List<OverlapPair> pairs = detectionAlgorithm.detect(rectangles);
		logger.debug("{} found {} overlapping pairs among {} rectangles", detectionAlgorithm, pairs.size(),
				rectangles.size());
		return pairs;
	}

	/**
	 * 并集面积，重叠部分只计算一次。没有矩形时为 0。
	 */
	public double calculateCoverageArea() {
		return new PlaneSweep(rectangles).sweep(new UnionAreaReducer());
	}

	/**
	 * 每个重叠对的交集矩形，顺序与 {@link #findOverlaps()} 一致。
	 */
	public List<OverlapRegion> getOverlapRegions() {
		return regionExtractor.extract(rectangles, findOverlaps());
	}

	/**
	 * 判断点是否落在至少一个矩形的闭区域内，找到第一个即返回。
	 */
	public boolean isPointCovered(double x, double y) {
		for (Rectangle r : rectangles) {
			if (r.covers(x, y)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * 被最多矩形覆盖的一个点。并列时的选择规则见 {@link MaxOverlapReducer}；
	 * 没有矩形时返回 {@link MaxOverlapPoint#NONE}。
	 */
	public MaxOverlapPoint findMaxOverlapPoint() {
		MaxOverlapPoint point = new PlaneSweep(rectangles).sweep(new MaxOverlapReducer());
		logger.debug("Max overlap point: {}", point);
		return point;
	}

	/**
	 * 所有矩形的最小外接矩形。
	 *
	 * @throws IllegalArgumentException 没有矩形
	 */
	public Rectangle getBounds() {
		return Rectangle.boundingBoxOf(rectangles);
	}

	/**
	 * 各矩形面积之和（重叠部分重复计算）。
	 */
	public double getIndividualArea() {
		double area = 0;
		for (Rectangle r : rectangles) {
			area += r.getArea();
		}
		return area;
	}

	/**
	 * 所有两两交集区域面积之和，没有重叠时为 0。
	 */
	public double getOverlapArea() {
		return OverlapRegionExtractor.totalArea(getOverlapRegions());
	}

	/**
	 * 汇总统计。
	 *
	 * @throws ZeroAreaException 各矩形面积之和为 0（即没有矩形）
	 */
	public CoverageStats getStats() {
		double individualArea = getIndividualArea();
		if (individualArea == 0) {
			throw new ZeroAreaException("coverage efficiency is undefined: sum of individual areas is zero");
		}
		List<OverlapRegion> regions = getOverlapRegions();
		double totalArea = calculateCoverageArea();
		return new CoverageStats(rectangles.size(), regions.size(), totalArea,
				OverlapRegionExtractor.totalArea(regions), totalArea / individualArea);
	}

}

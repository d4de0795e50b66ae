package technology.coverage.sweep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.coverage.Rectangle;

/**
 * 基于坐标压缩的竖直扫描，并集面积与最大重叠点共用这一遍历。
 *
 * <p>
 * 主要流程：
 * </p>
 * <ol>
 * <li>收集所有矩形的左右边缘 x 坐标，去重并升序排列，得到事件列 x0 &lt; x1 &lt; ... &lt; xk</li>
 * <li>按 x 升序依次处理事件列：事件列严格落在某个碎片内部时，在该列处切分，左半部分完成；
 * 碎片右边缘恰好等于事件列时，该碎片完成。完成的碎片都只占据一个条带 [xi, xi+1]</li>
 * <li>按左边缘把完成的碎片分组，每组按 y 升序排序，组成 {@link Strip}，按 x 升序交给 {@link StripReducer}</li>
 * </ol>
 *
 * <p>
 * 实例只保存输入矩形和事件列，每次 {@link #sweep(StripReducer)} 都从头切分。
 * </p>
 */
public class PlaneSweep {

	private static final Logger logger = LoggerFactory.getLogger(PlaneSweep.class);

	private final List<Rectangle> rectangles;
	private final double[] columns;

	public PlaneSweep(List<Rectangle> rectangles) {
		this.rectangles = new ArrayList<>(rectangles);

		TreeSet<Double> xs = new TreeSet<>();
		for (Rectangle r : this.rectangles) {
			xs.add(r.getMinX());
			xs.add(r.getMaxX());
		}
		this.columns = new double[xs.size()];
		int i = 0;
		for (Double x : xs) {
			columns[i++] = x;
		}
	}

	/**
	 * 事件列（去重、升序）的副本。
	 */
	public double[] getColumns() {
		return columns.clone();
	}

	/**
	 * 对每个条带依次调用 reducer，返回其归约结果。没有矩形时不会调用 accept。
	 */
	public <R> R sweep(StripReducer<R> reducer) {
		for (Strip strip : strips()) {
			reducer.accept(strip);
		}
		return reducer.result();
	}

	/**
	 * 切分并分组后的条带，按 left 升序。不包含任何碎片的条带（矩形之间的空隙）不会出现。
	 */
	public List<Strip> strips() {
		List<Fragment> fragments = splitAtColumns();

		TreeMap<Double, List<Fragment>> byLeft = new TreeMap<>();
		for (Fragment f : fragments) {
			byLeft.computeIfAbsent(f.getMinX(), k -> new ArrayList<>()).add(f);
		}

		List<Strip> strips = new ArrayList<>(byLeft.size());
		for (Map.Entry<Double, List<Fragment>> entry : byLeft.entrySet()) {
			List<Fragment> group = entry.getValue();
			group.sort((a, b) -> Double.compare(a.getMinY(), b.getMinY()));
			// every fragment in a group ends on the same column
			strips.add(new Strip(entry.getKey(), group.get(0).getMaxX(), group));
		}

		logger.debug("Split {} rectangles at {} event columns into {} fragments across {} strips",
				rectangles.size(), columns.length, fragments.size(), strips.size());
		return strips;
	}

	/**
	 * 第一阶段：按事件列切分，返回每个都只占据一个条带的碎片。
	 *
	 * <p>
	 * pending 是待处理碎片的工作队列。处理某一列时只遍历进入该列之前已在队列中的碎片，
	 * 本列切出的右半部分排到队尾，等下一列再处理。
	 * </p>
	 */
	List<Fragment> splitAtColumns() {
		List<Rectangle> ordered = new ArrayList<>(rectangles);
		ordered.sort(Rectangle.SWEEP_ORDER);

		Deque<Fragment> pending = new ArrayDeque<>(ordered.size());
		for (Rectangle r : ordered) {
			pending.addLast(Fragment.of(r));
		}

		List<Fragment> finished = new ArrayList<>();
		for (double column : columns) {
			int n = pending.size();
			for (int i = 0; i < n; i++) {
				Fragment f = pending.pollFirst();
				if (f.straddles(column)) {
					finished.add(f.leftOf(column));
					pending.addLast(f.rightOf(column));
				} else if (f.getMaxX() == column) {
					finished.add(f);
				} else {
					pending.addLast(f);
				}
			}
		}
		return finished;
	}

}

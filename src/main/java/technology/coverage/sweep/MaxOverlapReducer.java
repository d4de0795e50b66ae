package technology.coverage.sweep;

import java.util.PriorityQueue;

import technology.coverage.MaxOverlapPoint;

/**
 * 寻找被最多矩形覆盖的点。
 *
 * <p>
 * 在每个条带内按 minY 升序处理碎片，用一个按 maxY 排序的小顶堆保存仍然"打开"的碎片：
 * 处理新碎片前先弹出 maxY &lt;= 新碎片 minY 的碎片，剩余个数加 1 即为点 (条带左边缘, 碎片 minY)
 * 处的重叠次数。除每个条带的第一个碎片外，每个碎片都产生一个候选点（计数可能为 1）。
 * </p>
 *
 * <p>
 * 候选点按扫描顺序产生（条带 x 升序，条带内 y 升序），只有严格更大的计数才会替换当前结果，
 * 所以并列时返回最先产生的点。若没有产生任何候选点（所有条带都只有一个碎片），则返回最后处理的碎片的左下角，count 为 1；
 * 没有任何条带时返回 {@link MaxOverlapPoint#NONE}。
 * </p>
 */
public class MaxOverlapReducer implements StripReducer<MaxOverlapPoint> {

	private MaxOverlapPoint best = null;
	private Fragment last = null;

	@Override
	public void accept(Strip strip) {
		PriorityQueue<Double> open = new PriorityQueue<>();
		boolean first = true;
		for (Fragment f : strip.getFragments()) {
			while (!open.isEmpty() && open.peek() <= f.getMinY()) {
				open.poll();
			}
			if (!first) {
				int count = open.size() + 1;
				if (best == null || count > best.getCount()) {
					best = new MaxOverlapPoint(strip.getLeft(), f.getMinY(), count);
				}
			}
			open.add(f.getMaxY());
			first = false;
			last = f;
		}
	}

	@Override
	public MaxOverlapPoint result() {
		if (best != null) {
			return best;
		}
		if (last != null) {
			return new MaxOverlapPoint(last.getMinX(), last.getMinY(), 1);
		}
		return MaxOverlapPoint.NONE;
	}

}

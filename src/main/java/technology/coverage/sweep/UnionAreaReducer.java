package technology.coverage.sweep;

/**
 * 并集面积：每个条带贡献 条带宽度 × 合并后 band 高度之和。
 *
 * 同一条带内的 band 两两不相交，并且恰好覆盖并集在该条带内的部分，因此各条带贡献之和即为精确的并集面积。
 */
public class UnionAreaReducer implements StripReducer<Double> {

	private double area = 0;

	@Override
	public void accept(Strip strip) {
		double heights = 0;
		for (VerticalBand band : strip.mergedBands()) {
			heights += band.getHeight();
		}
		area += strip.getWidth() * heights;
	}

	@Override
	public Double result() {
		return area;
	}

}

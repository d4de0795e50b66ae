package technology.coverage.sweep;

import java.util.Collections;
import java.util.List;

/**
 * 相邻两条事件列之间的竖直条带，以及完全落在其中的碎片（按 minY 升序）。
 */
public final class Strip {

	private final double left;
	private final double right;
	private final List<Fragment> fragments;

	Strip(double left, double right, List<Fragment> fragments) {
		this.left = left;
		this.right = right;
		this.fragments = Collections.unmodifiableList(fragments);
	}

	public double getLeft() {
		return left;
	}

	public double getRight() {
		return right;
	}

	public double getWidth() {
		return right - left;
	}

	public List<Fragment> getFragments() {
		return fragments;
	}

	/**
	 * 条带内碎片合并后的不相交 band，每次调用重新计算。
	 */
	public List<VerticalBand> mergedBands() {
		return VerticalBand.merge(fragments);
	}

	@Override
	public String toString() {
		return "Strip[" + left + ".." + right + ", fragments=" + fragments.size() + "]";
	}

}

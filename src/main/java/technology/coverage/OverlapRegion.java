package technology.coverage;

/**
 * 一对重叠矩形及其交集区域。
 */
public final class OverlapRegion {

	private final OverlapPair rectIndices;
	private final Rectangle region;

	public OverlapRegion(OverlapPair rectIndices, Rectangle region) {
		this.rectIndices = rectIndices;
		this.region = region;
	}

	public OverlapPair getRectIndices() {
		return rectIndices;
	}

	public Rectangle getRegion() {
		return region;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof OverlapRegion)) {
			return false;
		}
		OverlapRegion other = (OverlapRegion) o;
		return rectIndices.equals(other.rectIndices) && region.equals(other.region);
	}

	@Override
	public int hashCode() {
		return 31 * rectIndices.hashCode() + region.hashCode();
	}

	@Override
	public String toString() {
		return "OverlapRegion[rectIndices=" + rectIndices + ",region=" + region + "]";
	}

}

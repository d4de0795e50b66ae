package technology.coverage;

import java.util.Comparator;

/**
 * 一对内部相交的矩形，以它们在输入序列中的下标表示，始终满足 first &lt; second。
 */
public final class OverlapPair implements Comparable<OverlapPair> {

	private static final Comparator<OverlapPair> LEXICOGRAPHIC = Comparator.comparingInt(OverlapPair::getFirst)
			.thenComparingInt(OverlapPair::getSecond);

	private final int first;
	private final int second;

	public OverlapPair(int first, int second) {
		if (first < 0 || first >= second) {
			throw new IllegalArgumentException("expected 0 <= first < second, got (" + first + ", " + second + ")");
		}
		this.first = first;
		this.second = second;
	}

	public int getFirst() {
		return first;
	}

	public int getSecond() {
		return second;
	}

	@Override
	public int compareTo(OverlapPair other) {
		return LEXICOGRAPHIC.compare(this, other);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof OverlapPair)) {
			return false;
		}
		OverlapPair other = (OverlapPair) o;
		return first == other.first && second == other.second;
	}

	@Override
	public int hashCode() {
		return 31 * first + second;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}

}

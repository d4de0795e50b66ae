package technology.coverage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RectangleAnalyzerTest {

	private static final List<Rectangle> LAYOUT = Arrays.asList(
			new Rectangle(1, 1, 3, 2),
			new Rectangle(3, 6, 1, 1),
			new Rectangle(3, 2, 3, 3),
			new Rectangle(8, 1, 2, 4),
			new Rectangle(7, 1, 5, 6),
			new Rectangle(7, 4, 4, 2));

	private RectangleAnalyzer analyzer;

	@BeforeEach
	public void setUp() {
		analyzer = new RectangleAnalyzer(LAYOUT);
	}

	@Test
	public void testFindOverlaps() {
		assertThat(analyzer.findOverlaps()).containsExactly(
				new OverlapPair(0, 2),
				new OverlapPair(3, 4),
				new OverlapPair(3, 5),
				new OverlapPair(4, 5));
	}

	@Test
	public void testCoverageArea() {
		assertThat(analyzer.calculateCoverageArea()).isEqualTo(45.0);
	}

	@Test
	public void testOverlapRegions() {
		assertThat(analyzer.getOverlapRegions()).containsExactly(
				new OverlapRegion(new OverlapPair(0, 2), new Rectangle(3, 2, 1, 1)),
				new OverlapRegion(new OverlapPair(3, 4), new Rectangle(8, 1, 2, 4)),
				new OverlapRegion(new OverlapPair(3, 5), new Rectangle(8, 4, 2, 1)),
				new OverlapRegion(new OverlapPair(4, 5), new Rectangle(7, 4, 4, 2)));
	}

	@Test
	public void testPointCovered() {
		assertThat(analyzer.isPointCovered(6, 6)).isFalse();
		assertThat(analyzer.isPointCovered(7, 7)).isTrue();
		// corners and edges are covered
		assertThat(analyzer.isPointCovered(1, 1)).isTrue();
		assertThat(analyzer.isPointCovered(12, 4)).isTrue();
		// just outside the rightmost edge
		assertThat(analyzer.isPointCovered(12.001, 4)).isFalse();
	}

	@Test
	public void testMaxOverlapPoint() {
		assertThat(analyzer.findMaxOverlapPoint()).isEqualTo(new MaxOverlapPoint(8, 4, 3));
	}

	@Test
	public void testStats() {
		CoverageStats stats = analyzer.getStats();
		assertThat(stats.getTotalRectangles()).isEqualTo(6);
		assertThat(stats.getOverlappingPairs()).isEqualTo(4);
		assertThat(stats.getTotalArea()).isEqualTo(45.0);
		assertThat(stats.getOverlapArea()).isEqualTo(19.0);
		assertThat(stats.getCoverageEfficiency()).isCloseTo(45.0 / 62.0, within(1e-12));
	}

	@Test
	public void testSupplementaryAggregates() {
		assertThat(analyzer.getIndividualArea()).isEqualTo(62.0);
		assertThat(analyzer.getOverlapArea()).isEqualTo(19.0);
		assertThat(analyzer.getBounds()).isEqualTo(new Rectangle(1, 1, 11, 6));
	}

	@Test
	public void testRectangleListIsImmutable() {
		List<Rectangle> input = new ArrayList<>(LAYOUT);
		RectangleAnalyzer a = new RectangleAnalyzer(input);
		input.clear();
		assertThat(a.getRectangles()).hasSize(6);
		assertThatThrownBy(() -> a.getRectangles().add(new Rectangle(0, 0, 1, 1)))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	public void testNullRectangleRejected() {
		assertThatThrownBy(() -> new RectangleAnalyzer(Arrays.asList(new Rectangle(0, 0, 1, 1), null)))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	public void testEmptyInput() {
		RectangleAnalyzer empty = new RectangleAnalyzer(Collections.emptyList());
		assertThat(empty.findOverlaps()).isEmpty();
		assertThat(empty.getOverlapRegions()).isEmpty();
		assertThat(empty.calculateCoverageArea()).isEqualTo(0.0);
		assertThat(empty.isPointCovered(0, 0)).isFalse();
		assertThat(empty.findMaxOverlapPoint()).isEqualTo(MaxOverlapPoint.NONE);
		assertThat(empty.getOverlapArea()).isEqualTo(0.0);
		assertThatThrownBy(empty::getStats).isInstanceOf(ZeroAreaException.class)
				.isInstanceOf(ArithmeticException.class);
		assertThatThrownBy(empty::getBounds).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void testDisjointRectangles() {
		RectangleAnalyzer disjoint = new RectangleAnalyzer(Arrays.asList(
				new Rectangle(0, 0, 2, 2),
				new Rectangle(2, 0, 2, 2),
				new Rectangle(0, 3, 2, 2)));
		assertThat(disjoint.findOverlaps()).isEmpty();
		assertThat(disjoint.calculateCoverageArea()).isEqualTo(disjoint.getIndividualArea());

		CoverageStats stats = disjoint.getStats();
		assertThat(stats.getOverlappingPairs()).isZero();
		assertThat(stats.getOverlapArea()).isZero();
		assertThat(stats.getCoverageEfficiency()).isEqualTo(1.0);
		assertThat(disjoint.findMaxOverlapPoint().getCount()).isEqualTo(1);
	}

	@Test
	public void testOverlapAreaCountsEachPair() {
		Rectangle r = new Rectangle(0, 0, 10, 10);
		RectangleAnalyzer stacked = new RectangleAnalyzer(Arrays.asList(r, r, r));
		CoverageStats stats = stacked.getStats();
		assertThat(stats.getOverlappingPairs()).isEqualTo(3);
		assertThat(stats.getTotalArea()).isEqualTo(100.0);
		assertThat(stats.getOverlapArea()).isEqualTo(300.0);
		assertThat(stats.getCoverageEfficiency()).isCloseTo(1.0 / 3.0, within(1e-12));
		assertThat(stacked.findMaxOverlapPoint()).isEqualTo(new MaxOverlapPoint(0, 0, 3));
	}

	@Test
	public void testCustomDetectionAlgorithm() {
		RectangleAnalyzer a = new RectangleAnalyzer(LAYOUT, rectangles -> Collections.singletonList(new OverlapPair(0, 2)));
		assertThat(a.getOverlapRegions()).containsExactly(
				new OverlapRegion(new OverlapPair(0, 2), new Rectangle(3, 2, 1, 1)));
		assertThat(a.getStats().getOverlappingPairs()).isEqualTo(1);
	}

}

package technology.coverage.detectors;

import java.util.List;

import technology.coverage.OverlapPair;
import technology.coverage.Rectangle;

/**
 * 查找一组矩形中所有内部相交的矩形对。
 */
public interface OverlapDetectionAlgorithm {

	/**
	 * @param rectangles 输入矩形，下标即矩形标识
	 * @return 所有重叠对 (i, j)，i &lt; j，按 (i, j) 字典序升序
	 */
	List<OverlapPair> detect(List<Rectangle> rectangles);

}

package technology.coverage;

/**
 * 矩形的坐标或尺寸不合法（非有限数、宽高不为正，或边缘坐标因舍入无法与起点区分）。
 */
@SuppressWarnings("serial")
public class InvalidRectangleException extends IllegalArgumentException {

	public InvalidRectangleException(String message) {
		super(message);
	}

}

package technology.coverage;

/**
 * 需要以矩形面积之和作除数、而该和为 0 时抛出。每个矩形的面积都为正，所以只会发生在输入为空时。
 */
@SuppressWarnings("serial")
public class ZeroAreaException extends ArithmeticException {

	public ZeroAreaException(String message) {
		super(message);
	}

}

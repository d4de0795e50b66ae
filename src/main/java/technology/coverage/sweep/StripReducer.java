package technology.coverage.sweep;

/**
 * 扫描时对每个条带执行的归约。{@link PlaneSweep} 按 left 升序依次调用 {@link #accept(Strip)}，
 * 全部条带处理完后调用 {@link #result()}。
 *
 * 实现是有状态的，一个实例只用于一次扫描。
 *
 * @param <R> 归约结果类型
 */
public interface StripReducer<R> {

	void accept(Strip strip);

	R result();

}

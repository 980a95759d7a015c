package xyz.firestige.accumulator.api;

import java.util.List;

/**
 * 分发失败处理器接口
 *
 * <p>批次消费失败时决定后续动作。
 *
 * <h3>预置实现</h3>
 * <ul>
 *   <li>{@code LogAndContinueFailureHandler} - 记录日志并继续（默认）</li>
 *   <li>{@code SkipKeyFailureHandler} - 跳过该 Key 剩余批次</li>
 *   <li>{@code AbortFailureHandler} - 中止本轮分发</li>
 * </ul>
 *
 * @param <T> 元素类型
 * @author T-018
 * @since 1.0.0
 */
@FunctionalInterface
public interface DispatchFailureHandler<T> extends Named {

    /**
     * 处理批次消费失败
     *
     * @param key        分区 Key
     * @param batchIndex 批次在该 Key 下的序号，从 0 开始
     * @param batch      失败的批次
     * @param error      异常信息
     * @return 后续动作
     */
    Action handle(String key, int batchIndex, List<T> batch, Throwable error);

    enum Action {
        CONTINUE,  // 继续下一个批次
        SKIP_KEY,  // 跳过当前 Key 的剩余批次
        ABORT      // 中止本轮分发
    }
}

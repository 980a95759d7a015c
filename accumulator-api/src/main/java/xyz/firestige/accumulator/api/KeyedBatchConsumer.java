package xyz.firestige.accumulator.api;

import java.util.List;

/**
 * 批次消费者
 *
 * <p>接收一个 Key 下的单个批次并执行批量操作（批量发布、批量写入等）。
 * 抛出的异常交由 {@link DispatchFailureHandler} 处理。
 *
 * @param <T> 元素类型
 */
@FunctionalInterface
public interface KeyedBatchConsumer<T> {

    void consume(String key, List<T> batch) throws Exception;
}

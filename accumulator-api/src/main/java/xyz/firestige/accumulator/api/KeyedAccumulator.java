package xyz.firestige.accumulator.api;

import java.util.List;
import java.util.Map;

/**
 * 按 Key 分批累积器接口
 *
 * <p>将元素按 Key 分区，并在每个 Key 下按到达顺序累积为定长批次。
 * 适用于按 Key 延迟批量处理的场景，例如按 topic 批量发布消息、按租户批量写库。
 *
 * <h3>禁止窥视</h3>
 * <p>接口不暴露任何进行中的批次，只提供计数类查询。批次内容只有在
 * {@link #extractAccumulatedBatches()} 把所有权转移给调用方之后才可见，
 * 避免外部向已满批次追加元素。
 *
 * <h3>使用示例</h3>
 * <pre>{@code
 * KeyedAccumulator<Event> accumulator = new KeyedBatchedAccumulator<>(100);
 * accumulator.push(event, "threat-events");
 * // ... 定时任务中
 * if (accumulator.getTotalAccumulatedItemsCount() >= threshold) {
 *     Map<String, List<List<Event>>> batches = accumulator.extractAccumulatedBatches();
 *     batches.forEach((topic, topicBatches) -> topicBatches.forEach(b -> publisher.publish(topic, b)));
 * }
 * }</pre>
 *
 * <p>实现不是线程安全的，多线程访问需由调用方同步。
 *
 * @param <T> 元素类型
 * @author T-018
 * @since 1.0.0
 * @see BatchAccumulator
 */
public interface KeyedAccumulator<T> {

    /**
     * 将元素追加到指定 Key 的批次中
     *
     * @param item 待累积的元素
     * @param key  分区 Key，必须为非空字符串
     * @throws IllegalArgumentException 如果 Key 为 null 或空字符串，此时状态不变
     */
    void push(T item, String key);

    /**
     * 指定 Key 是否至少累积了一个元素，O(1)
     *
     * @param key 分区 Key
     * @return {@code true} 表示活跃
     */
    boolean isActiveKey(String key);

    /**
     * 获取指定 Key 已累积的元素数
     *
     * @param key 分区 Key
     * @return 元素数，Key 不活跃时返回 0
     */
    int getAccumulatedItemsCount(String key);

    /**
     * 获取活跃 Key 数量，O(1)
     */
    int getActiveKeysCount();

    /**
     * 获取活跃 Key 快照，O(活跃 Key 数)
     *
     * @return 新的 Key 列表，修改它不会影响累积器
     */
    List<String> getActiveKeys();

    /**
     * 获取所有 Key 累积的元素总数，O(1)
     */
    int getTotalAccumulatedItemsCount();

    /**
     * 是否没有任何活跃 Key
     */
    boolean isEmpty();

    /**
     * 提取全部 Key 的批次并重置累积器
     *
     * <p>返回的映射及其中所有批次归调用方所有。调用后
     * {@link #isEmpty()} 为 {@code true}，计数全部归零。
     *
     * @return Key 到批次列表的新映射，为空时返回新的空映射，不会返回 {@code null}
     */
    Map<String, List<List<T>>> extractAccumulatedBatches();
}

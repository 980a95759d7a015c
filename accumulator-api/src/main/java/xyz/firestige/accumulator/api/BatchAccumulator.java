package xyz.firestige.accumulator.api;

import java.util.List;

/**
 * 单 Key 批次累积器接口
 *
 * <p>将到达的元素直接写入定长批次，无需事后对平铺列表再做切分。
 * 除最后一个批次外，每个批次恰好包含 {@code batchSize} 个元素；
 * 批次内与批次间均保持元素到达顺序。
 *
 * @param <T> 元素类型
 * @author T-018
 * @since 1.0.0
 */
public interface BatchAccumulator<T> {

    /**
     * 追加元素
     *
     * <p>如果还没有批次，或最后一个批次已满，先新建批次再追加。
     *
     * @param item 待累积的元素
     */
    void push(T item);

    /**
     * 获取已累积的元素总数
     *
     * @return 元素总数
     */
    int getAccumulatedItemsCount();

    /**
     * 获取当前批次数（包含未满的最后一个批次）
     *
     * @return 批次数
     */
    int getBatchesCount();

    /**
     * 是否没有累积任何元素
     *
     * @return {@code true} 表示为空
     */
    boolean isEmpty();

    /**
     * 提取全部批次
     *
     * <p>调用后批次所有权转移给调用方，累积器重置为空，不再持有返回批次的引用。
     *
     * @return 按顺序排列的批次列表，为空时返回新的空列表
     */
    List<List<T>> extractAccumulatedBatches();
}

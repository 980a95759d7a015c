package xyz.firestige.accumulator.core;

import xyz.firestige.accumulator.api.BatchAccumulator;

import java.util.ArrayList;
import java.util.List;

/**
 * 固定批次大小累积器（默认实现）
 * <p>元素到达时直接写入当前批次，当前批次满后新建批次
 *
 * @param <T> 元素类型
 */
public class FixedSizeBatchAccumulator<T> implements BatchAccumulator<T> {
    private final int batchSize;
    private List<List<T>> batches = new ArrayList<>();
    private List<T> currentBatch;
    private int accumulatedItemsCount;

    public FixedSizeBatchAccumulator(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.batchSize = batchSize;
    }

    @Override
    public void push(T item) {
        if (currentBatch == null || currentBatch.size() == batchSize) {
            currentBatch = new ArrayList<>(batchSize);
            batches.add(currentBatch);
        }
        currentBatch.add(item);
        accumulatedItemsCount++;
    }

    @Override
    public int getAccumulatedItemsCount() {
        return accumulatedItemsCount;
    }

    @Override
    public int getBatchesCount() {
        return batches.size();
    }

    @Override
    public boolean isEmpty() {
        return accumulatedItemsCount == 0;
    }

    @Override
    public List<List<T>> extractAccumulatedBatches() {
        List<List<T>> extracted = batches;
        // 交出引用后重新开始，不再持有已提取的批次
        batches = new ArrayList<>();
        currentBatch = null;
        accumulatedItemsCount = 0;
        return extracted;
    }

    public int getBatchSize() {
        return batchSize;
    }
}

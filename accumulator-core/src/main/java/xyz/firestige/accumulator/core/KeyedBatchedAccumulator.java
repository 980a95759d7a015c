package xyz.firestige.accumulator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.api.KeyedAccumulator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 按 Key 分批累积器实现
 *
 * <p>每个 Key 对应一个 {@link FixedSizeBatchAccumulator}，在首次 push 时创建，
 * 在 {@link #extractAccumulatedBatches()} 时整体移除。全局元素数在每次 push 时递增维护，
 * 保证查询为 O(1)。
 *
 * <p>非线程安全。
 *
 * @param <T> 元素类型
 */
public class KeyedBatchedAccumulator<T> implements KeyedAccumulator<T> {
    private static final Logger log = LoggerFactory.getLogger(KeyedBatchedAccumulator.class);

    private final int batchSize;
    private final AccumulatorMetricsRecorder metricsRecorder;
    private final Map<String, FixedSizeBatchAccumulator<T>> keyToAccumulator = new LinkedHashMap<>();
    private int totalAccumulatedItemsCount;

    public KeyedBatchedAccumulator(int batchSize) {
        this(batchSize, AccumulatorMetricsRecorder.noop());
    }

    public KeyedBatchedAccumulator(int batchSize, AccumulatorMetricsRecorder metricsRecorder) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a natural number, got " + batchSize);
        }
        this.batchSize = batchSize;
        this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder");
        log.debug("创建按 Key 累积器: batchSize={}, metrics={}", batchSize, metricsRecorder.getName());
    }

    @Override
    public void push(T item, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must be a non-empty string");
        }
        keyToAccumulator
                .computeIfAbsent(key, k -> new FixedSizeBatchAccumulator<>(batchSize))
                .push(item);
        totalAccumulatedItemsCount++;
    }

    @Override
    public boolean isActiveKey(String key) {
        return key != null && keyToAccumulator.containsKey(key);
    }

    @Override
    public int getAccumulatedItemsCount(String key) {
        if (key == null) {
            return 0;
        }
        FixedSizeBatchAccumulator<T> accumulator = keyToAccumulator.get(key);
        return accumulator == null ? 0 : accumulator.getAccumulatedItemsCount();
    }

    @Override
    public int getActiveKeysCount() {
        return keyToAccumulator.size();
    }

    @Override
    public List<String> getActiveKeys() {
        return new ArrayList<>(keyToAccumulator.keySet());
    }

    @Override
    public int getTotalAccumulatedItemsCount() {
        return totalAccumulatedItemsCount;
    }

    @Override
    public boolean isEmpty() {
        return keyToAccumulator.isEmpty();
    }

    @Override
    public Map<String, List<List<T>>> extractAccumulatedBatches() {
        Map<String, List<List<T>>> keyToBatches = new LinkedHashMap<>();
        if (keyToAccumulator.isEmpty()) {
            return keyToBatches;
        }

        int batchesCount = 0;
        for (Map.Entry<String, FixedSizeBatchAccumulator<T>> entry : keyToAccumulator.entrySet()) {
            List<List<T>> batches = entry.getValue().extractAccumulatedBatches();
            batchesCount += batches.size();
            keyToBatches.put(entry.getKey(), batches);
        }

        int itemsCount = totalAccumulatedItemsCount;
        keyToAccumulator.clear();
        totalAccumulatedItemsCount = 0;

        log.debug("提取累积批次: keys={}, batches={}, items={}", keyToBatches.size(), batchesCount, itemsCount);
        metricsRecorder.recordExtraction(keyToBatches.size(), batchesCount, itemsCount);
        return keyToBatches;
    }

    public int getBatchSize() {
        return batchSize;
    }
}

package xyz.firestige.accumulator.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分发结果
 *
 * <p>记录一轮分发的统计，以及未送达的批次。未送达批次归调用方所有，可重新 push 或转存。
 *
 * @param <T> 元素类型
 * @author T-018
 * @since 1.0.0
 */
public class DispatchResult<T> {

    private final int dispatchedBatches;
    private final int dispatchedItems;
    private final int failedBatches;
    private final boolean aborted;
    private final long durationMillis;
    private final Map<String, List<List<T>>> undelivered;

    DispatchResult(int dispatchedBatches, int dispatchedItems, int failedBatches,
                   boolean aborted, long durationMillis, Map<String, List<List<T>>> undelivered) {
        this.dispatchedBatches = dispatchedBatches;
        this.dispatchedItems = dispatchedItems;
        this.failedBatches = failedBatches;
        this.aborted = aborted;
        this.durationMillis = durationMillis;
        this.undelivered = Collections.unmodifiableMap(undelivered);
    }

    /**
     * 创建空结果（没有可分发的批次）
     */
    static <T> DispatchResult<T> empty() {
        return new DispatchResult<>(0, 0, 0, false, 0, new LinkedHashMap<>());
    }

    // Getters

    public int getDispatchedBatches() {
        return dispatchedBatches;
    }

    public int getDispatchedItems() {
        return dispatchedItems;
    }

    public int getFailedBatches() {
        return failedBatches;
    }

    public boolean isAborted() {
        return aborted;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /**
     * 未送达的批次：失败的批次，以及因跳过或中止而未尝试的批次
     */
    public Map<String, List<List<T>>> getUndelivered() {
        return undelivered;
    }

    public int getUndeliveredItemsCount() {
        int count = 0;
        for (List<List<T>> batches : undelivered.values()) {
            for (List<T> batch : batches) {
                count += batch.size();
            }
        }
        return count;
    }

    public boolean isSuccess() {
        return failedBatches == 0 && !aborted;
    }

    @Override
    public String toString() {
        return "DispatchResult{" +
                "dispatchedBatches=" + dispatchedBatches +
                ", dispatchedItems=" + dispatchedItems +
                ", failedBatches=" + failedBatches +
                ", aborted=" + aborted +
                ", durationMillis=" + durationMillis +
                ", undeliveredKeys=" + undelivered.keySet() +
                '}';
    }
}

package xyz.firestige.accumulator.api;

import java.time.Duration;

/**
 * 累积器指标记录器接口
 */
public interface AccumulatorMetricsRecorder extends Named {

    /**
     * 记录一次提取
     *
     * @param keys    提取的 Key 数
     * @param batches 提取的批次数
     * @param items   提取的元素数
     */
    void recordExtraction(int keys, int batches, int items);

    /**
     * 记录一个批次的分发结果
     *
     * @param key     分区 Key
     * @param items   批次元素数
     * @param success 是否成功
     * @param elapsed 耗时
     */
    void recordDispatch(String key, int items, boolean success, Duration elapsed);

    static AccumulatorMetricsRecorder noop() {
        return new AccumulatorMetricsRecorder() {
            @Override
            public void recordExtraction(int keys, int batches, int items) {
            }

            @Override
            public void recordDispatch(String key, int items, boolean success, Duration elapsed) {
            }

            @Override
            public String getName() {
                return "Noop";
            }
        };
    }
}

package xyz.firestige.accumulator.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;

import java.time.Duration;

/**
 * 基于 Micrometer 的累积器指标记录器
 * <p>
 * 记录以下指标：
 * - keyed_accumulator_extractions: 提取次数
 * - keyed_accumulator_extracted_keys: 每次提取的 Key 数分布
 * - keyed_accumulator_extracted_batches: 提取的批次总数
 * - keyed_accumulator_extracted_items: 提取的元素总数
 * - keyed_accumulator_dispatched_batches{key, outcome}: 分发的批次数
 * - keyed_accumulator_dispatched_items{key, outcome}: 分发的元素数
 * - keyed_accumulator_dispatch_duration{outcome}: 单批次分发耗时分布
 * <p>
 * 分发指标带 {@code key} 标签，Key 应是有限集合（topic、租户等）。
 */
public class MicrometerAccumulatorMetricsRecorder implements AccumulatorMetricsRecorder {

    private static final String SUCCESS = "success";
    private static final String FAILURE = "failure";

    private final MeterRegistry registry;
    private final Counter extractions;
    private final DistributionSummary extractedKeys;
    private final Counter extractedBatches;
    private final Counter extractedItems;
    private final Timer successTimer;
    private final Timer failureTimer;

    public MicrometerAccumulatorMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
        this.extractions = Counter.builder("keyed_accumulator_extractions")
            .description("Total batch extractions")
            .register(registry);
        this.extractedKeys = DistributionSummary.builder("keyed_accumulator_extracted_keys")
            .description("Active keys handed over per extraction")
            .register(registry);
        this.extractedBatches = Counter.builder("keyed_accumulator_extracted_batches")
            .description("Batches handed over by extractions")
            .register(registry);
        this.extractedItems = Counter.builder("keyed_accumulator_extracted_items")
            .description("Items handed over by extractions")
            .register(registry);
        this.successTimer = dispatchTimer(registry, SUCCESS);
        this.failureTimer = dispatchTimer(registry, FAILURE);
    }

    private static Timer dispatchTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("keyed_accumulator_dispatch_duration")
            .description("Per batch dispatch duration")
            .tag("outcome", outcome)
            .publishPercentileHistogram()
            .register(registry);
    }

    @Override
    public void recordExtraction(int keys, int batches, int items) {
        extractions.increment();
        extractedKeys.record(keys);
        extractedBatches.increment(batches);
        extractedItems.increment(items);
    }

    @Override
    public void recordDispatch(String key, int items, boolean success, Duration elapsed) {
        String outcome = success ? SUCCESS : FAILURE;
        // Micrometer 按名称和标签缓存 Meter，重复 register 返回同一实例
        Counter.builder("keyed_accumulator_dispatched_batches")
            .description("Batches handed to the consumer")
            .tag("key", key)
            .tag("outcome", outcome)
            .register(registry)
            .increment();
        Counter.builder("keyed_accumulator_dispatched_items")
            .description("Items handed to the consumer")
            .tag("key", key)
            .tag("outcome", outcome)
            .register(registry)
            .increment(items);
        (success ? successTimer : failureTimer).record(elapsed);
    }

    @Override
    public String getName() {
        return "Micrometer";
    }
}

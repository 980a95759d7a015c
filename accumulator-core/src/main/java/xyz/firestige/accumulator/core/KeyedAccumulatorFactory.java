package xyz.firestige.accumulator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.api.DispatchFailureHandler;
import xyz.firestige.accumulator.api.KeyedBatchConsumer;
import xyz.firestige.accumulator.core.handler.FailurePolicy;

import java.util.Objects;

/**
 * 累积器工厂
 * <p>按统一的批次大小、指标记录器和失败策略创建累积器与分发器
 */
public class KeyedAccumulatorFactory {
    private static final Logger log = LoggerFactory.getLogger(KeyedAccumulatorFactory.class);

    private final int defaultBatchSize;
    private final AccumulatorMetricsRecorder metricsRecorder;
    private final FailurePolicy failurePolicy;

    public KeyedAccumulatorFactory(int defaultBatchSize) {
        this(defaultBatchSize, AccumulatorMetricsRecorder.noop(), FailurePolicy.LOG_AND_CONTINUE);
    }

    public KeyedAccumulatorFactory(int defaultBatchSize,
                                   AccumulatorMetricsRecorder metricsRecorder,
                                   FailurePolicy failurePolicy) {
        if (defaultBatchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + defaultBatchSize);
        }
        this.defaultBatchSize = defaultBatchSize;
        this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        log.info("累积器工厂已创建: batchSize={}, failurePolicy={}, metrics={}",
                defaultBatchSize, failurePolicy, metricsRecorder.getName());
    }

    public <T> KeyedBatchedAccumulator<T> newAccumulator() {
        return newAccumulator(defaultBatchSize);
    }

    public <T> KeyedBatchedAccumulator<T> newAccumulator(int batchSize) {
        return new KeyedBatchedAccumulator<>(batchSize, metricsRecorder);
    }

    public <T> BatchDispatcher<T> newDispatcher(KeyedBatchConsumer<T> consumer) {
        DispatchFailureHandler<T> failureHandler = failurePolicy.newHandler();
        return newDispatcher(consumer, failureHandler);
    }

    public <T> BatchDispatcher<T> newDispatcher(KeyedBatchConsumer<T> consumer,
                                                DispatchFailureHandler<T> failureHandler) {
        return new BatchDispatcher<>(consumer, failureHandler, metricsRecorder);
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
}

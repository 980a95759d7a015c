package xyz.firestige.accumulator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.api.DispatchFailureHandler;
import xyz.firestige.accumulator.api.KeyedAccumulator;
import xyz.firestige.accumulator.api.KeyedBatchConsumer;
import xyz.firestige.accumulator.core.handler.LogAndContinueFailureHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 批次分发器
 *
 * <p>一次性提取累积器中的全部批次，并逐个交给 {@link KeyedBatchConsumer}，
 * 同一 Key 下按批次顺序分发。分发器本身不做调度，由外部定时任务调用 {@link #dispatch(KeyedAccumulator)}。
 *
 * <pre>{@code
 * BatchDispatcher<Event> dispatcher = new BatchDispatcher<>((topic, batch) -> producer.sendAll(topic, batch));
 * scheduler.scheduleAtFixedRate(() -> dispatcher.dispatch(accumulator), 1, 1, TimeUnit.SECONDS);
 * }</pre>
 *
 * @param <T> 元素类型
 */
public class BatchDispatcher<T> {
    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final KeyedBatchConsumer<T> consumer;
    private final DispatchFailureHandler<T> failureHandler;
    private final AccumulatorMetricsRecorder metricsRecorder;

    public BatchDispatcher(KeyedBatchConsumer<T> consumer) {
        this(consumer, new LogAndContinueFailureHandler<>(), AccumulatorMetricsRecorder.noop());
    }

    public BatchDispatcher(KeyedBatchConsumer<T> consumer,
                           DispatchFailureHandler<T> failureHandler,
                           AccumulatorMetricsRecorder metricsRecorder) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder");
    }

    /**
     * 提取并分发累积器中的全部批次
     *
     * <p>消费者抛出的 {@link Exception} 交给失败处理器。其他异常（{@link Error}、
     * 指标记录器抛出的异常等）会中断分发：未送达的元素先按原顺序放回累积器，再向上抛出。
     *
     * @param accumulator 数据来源，调用后被重置为空
     * @return 分发结果
     */
    public DispatchResult<T> dispatch(KeyedAccumulator<T> accumulator) {
        Objects.requireNonNull(accumulator, "accumulator");
        long start = System.nanoTime();
        Map<String, List<List<T>>> keyToBatches = accumulator.extractAccumulatedBatches();
        if (keyToBatches.isEmpty()) {
            log.debug("没有待分发的批次");
            return DispatchResult.empty();
        }

        Map<String, List<List<T>>> undelivered = new LinkedHashMap<>();
        int dispatchedBatches = 0;
        int dispatchedItems = 0;
        int failedBatches = 0;
        boolean aborted = false;

        List<String> keys = new ArrayList<>(keyToBatches.keySet());
        int keyIndex = 0;
        // 当前 Key 下第一个尚未送达也未计入 undelivered 的批次
        int nextBatch = 0;
        try {
            for (; keyIndex < keys.size(); keyIndex++) {
                String key = keys.get(keyIndex);
                List<List<T>> batches = keyToBatches.get(key);
                nextBatch = 0;
                if (aborted) {
                    undelivered.put(key, batches);
                    nextBatch = batches.size();
                    continue;
                }

                while (nextBatch < batches.size()) {
                    int i = nextBatch;
                    List<T> batch = batches.get(i);
                    long batchStart = System.nanoTime();
                    try {
                        consumer.consume(key, batch);
                    } catch (Exception e) {
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt();
                        }
                        List<List<T>> keyUndelivered = undelivered.computeIfAbsent(key, k -> new ArrayList<>());
                        keyUndelivered.add(batch);
                        nextBatch = i + 1;
                        failedBatches++;
                        metricsRecorder.recordDispatch(key, batch.size(), false, elapsedSince(batchStart));

                        DispatchFailureHandler.Action action = handleFailure(key, i, batch, e);
                        if (action == DispatchFailureHandler.Action.CONTINUE) {
                            continue;
                        }
                        keyUndelivered.addAll(batches.subList(i + 1, batches.size()));
                        nextBatch = batches.size();
                        if (action == DispatchFailureHandler.Action.ABORT) {
                            aborted = true;
                        }
                        break;
                    }
                    nextBatch = i + 1;
                    dispatchedBatches++;
                    dispatchedItems += batch.size();
                    metricsRecorder.recordDispatch(key, batch.size(), true, elapsedSince(batchStart));
                }
            }
        } catch (RuntimeException | Error e) {
            int restored = restore(accumulator, keyToBatches, keys, keyIndex, nextBatch, undelivered);
            log.error("批次分发异常中断，未送达元素已放回累积器: restoredItems={}, error={}",
                    restored, e.toString(), e);
            throw e;
        }

        long durationMillis = elapsedSince(start).toMillis();
        DispatchResult<T> result = new DispatchResult<>(
                dispatchedBatches, dispatchedItems, failedBatches, aborted, durationMillis, undelivered);
        if (result.isSuccess()) {
            log.info("批次分发完成: keys={}, batches={}, items={}, elapsed={}ms",
                    keyToBatches.size(), dispatchedBatches, dispatchedItems, durationMillis);
        } else {
            log.warn("批次分发部分失败: keys={}, dispatched={}, failed={}, aborted={}, undeliveredItems={}",
                    keyToBatches.size(), dispatchedBatches, failedBatches, aborted, result.getUndeliveredItemsCount());
        }
        return result;
    }

    /**
     * 失败处理器自身抛出异常时按 ABORT 处理，返回 null 按 CONTINUE 处理
     */
    private DispatchFailureHandler.Action handleFailure(String key, int batchIndex, List<T> batch, Exception error) {
        try {
            DispatchFailureHandler.Action action = failureHandler.handle(key, batchIndex, batch, error);
            return action == null ? DispatchFailureHandler.Action.CONTINUE : action;
        } catch (RuntimeException handlerError) {
            log.error("失败处理器异常，中止本轮分发 [handler={}, key={}, batchIndex={}]",
                    failureHandler.getName(), key, batchIndex, handlerError);
            return DispatchFailureHandler.Action.ABORT;
        }
    }

    /**
     * 把 undelivered 中的批次以及尚未尝试的批次按原顺序重新 push 回累积器
     *
     * @return 放回的元素数
     */
    private int restore(KeyedAccumulator<T> accumulator, Map<String, List<List<T>>> keyToBatches,
                        List<String> keys, int keyIndex, int nextBatch,
                        Map<String, List<List<T>>> undelivered) {
        Map<String, List<List<T>>> pending = new LinkedHashMap<>();
        undelivered.forEach((key, batches) -> pending.put(key, new ArrayList<>(batches)));
        for (int k = keyIndex; k < keys.size(); k++) {
            String key = keys.get(k);
            List<List<T>> batches = keyToBatches.get(key);
            int from = k == keyIndex ? nextBatch : 0;
            if (from < batches.size()) {
                pending.computeIfAbsent(key, x -> new ArrayList<>()).addAll(batches.subList(from, batches.size()));
            }
        }

        int restored = 0;
        for (Map.Entry<String, List<List<T>>> entry : pending.entrySet()) {
            for (List<T> batch : entry.getValue()) {
                for (T item : batch) {
                    accumulator.push(item, entry.getKey());
                    restored++;
                }
            }
        }
        return restored;
    }

    public DispatchFailureHandler<T> getFailureHandler() {
        return failureHandler;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}

/**
 * 按 Key 分批累积器核心 API
 * <p>
 * 提供按 Key 分区、定长分批累积的接口定义。
 * 核心接口：
 * <ul>
 *   <li>{@link xyz.firestige.accumulator.api.KeyedAccumulator} - 按 Key 累积入口</li>
 *   <li>{@link xyz.firestige.accumulator.api.BatchAccumulator} - 单 Key 批次累积</li>
 *   <li>{@link xyz.firestige.accumulator.api.KeyedBatchConsumer} - 批次消费者</li>
 *   <li>{@link xyz.firestige.accumulator.api.DispatchFailureHandler} - 分发失败处理</li>
 * </ul>
 */
package xyz.firestige.accumulator.api;

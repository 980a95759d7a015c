/**
 * 按 Key 累积器 Spring Boot 自动配置
 * <p>
 * 配置前缀 {@code keyed.accumulator}，装配 {@link xyz.firestige.accumulator.core.KeyedAccumulatorFactory}。
 */
package xyz.firestige.accumulator.spring.autoconfigure;

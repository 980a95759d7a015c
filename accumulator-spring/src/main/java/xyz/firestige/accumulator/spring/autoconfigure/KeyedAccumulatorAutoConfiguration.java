package xyz.firestige.accumulator.spring.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.core.KeyedAccumulatorFactory;
import xyz.firestige.accumulator.spring.metrics.MicrometerAccumulatorMetricsRecorder;

/**
 * 按 Key 累积器自动配置
 */
@AutoConfiguration
@ConditionalOnClass(KeyedAccumulatorFactory.class)
@ConditionalOnProperty(prefix = "keyed.accumulator", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(KeyedAccumulatorProperties.class)
public class KeyedAccumulatorAutoConfiguration {

    /**
     * 累积器工厂，未提供指标记录器时使用 noop
     */
    @Bean
    @ConditionalOnMissingBean
    public KeyedAccumulatorFactory keyedAccumulatorFactory(
            KeyedAccumulatorProperties properties,
            ObjectProvider<AccumulatorMetricsRecorder> metricsRecorder) {
        return new KeyedAccumulatorFactory(
            properties.getBatchSize(),
            metricsRecorder.getIfAvailable(AccumulatorMetricsRecorder::noop),
            properties.getFailurePolicy()
        );
    }

    /**
     * Micrometer 指标
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(AccumulatorMetricsRecorder.class)
        @ConditionalOnBean(MeterRegistry.class)
        public MicrometerAccumulatorMetricsRecorder accumulatorMetricsRecorder(MeterRegistry registry) {
            return new MicrometerAccumulatorMetricsRecorder(registry);
        }
    }
}

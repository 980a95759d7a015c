package xyz.firestige.accumulator.spring.autoconfigure;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.core.KeyedAccumulatorFactory;
import xyz.firestige.accumulator.core.KeyedBatchedAccumulator;
import xyz.firestige.accumulator.core.handler.FailurePolicy;
import xyz.firestige.accumulator.spring.metrics.MicrometerAccumulatorMetricsRecorder;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedAccumulatorAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KeyedAccumulatorAutoConfiguration.class));

    @Test
    void autoConfiguration_defaults_createsFactory() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(KeyedAccumulatorFactory.class);
            assertThat(context).doesNotHaveBean(AccumulatorMetricsRecorder.class);

            KeyedAccumulatorFactory factory = context.getBean(KeyedAccumulatorFactory.class);
            assertThat(factory.getDefaultBatchSize()).isEqualTo(100);
            assertThat(factory.getFailurePolicy()).isEqualTo(FailurePolicy.LOG_AND_CONTINUE);
        });
    }

    @Test
    void autoConfiguration_whenDisabled_doesNotCreateBeans() {
        contextRunner
            .withPropertyValues("keyed.accumulator.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(KeyedAccumulatorFactory.class));
    }

    @Test
    void autoConfiguration_customProperties_appliedCorrectly() {
        contextRunner
            .withPropertyValues(
                "keyed.accumulator.batch-size=3",
                "keyed.accumulator.failure-policy=skip-key"
            )
            .run(context -> {
                KeyedAccumulatorProperties properties = context.getBean(KeyedAccumulatorProperties.class);
                assertThat(properties.getBatchSize()).isEqualTo(3);
                assertThat(properties.getFailurePolicy()).isEqualTo(FailurePolicy.SKIP_KEY);

                KeyedBatchedAccumulator<String> accumulator =
                    context.getBean(KeyedAccumulatorFactory.class).newAccumulator();
                for (String item : new String[]{"a", "b", "c", "d"}) {
                    accumulator.push(item, "topic");
                }
                assertThat(accumulator.extractAccumulatedBatches().get("topic")).hasSize(2);
            });
    }

    @Test
    void autoConfiguration_invalidBatchSize_failsStartup() {
        contextRunner
            .withPropertyValues("keyed.accumulator.batch-size=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void autoConfiguration_withMeterRegistry_createsMicrometerRecorder() {
        contextRunner
            .withUserConfiguration(MetricsConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(AccumulatorMetricsRecorder.class);
                assertThat(context.getBean(AccumulatorMetricsRecorder.class))
                    .isInstanceOf(MicrometerAccumulatorMetricsRecorder.class);

                // 工厂创建的累积器应上报到同一个 MeterRegistry
                KeyedBatchedAccumulator<String> accumulator =
                    context.getBean(KeyedAccumulatorFactory.class).newAccumulator();
                accumulator.push("event", "topic");
                accumulator.extractAccumulatedBatches();

                SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                assertThat(registry.get("keyed_accumulator_extractions").counter().count()).isEqualTo(1.0);
                assertThat(registry.get("keyed_accumulator_extracted_items").counter().count()).isEqualTo(1.0);
            });
    }

    @Test
    void autoConfiguration_userFactory_backsOff() {
        contextRunner
            .withBean(KeyedAccumulatorFactory.class, () -> new KeyedAccumulatorFactory(7))
            .run(context -> {
                assertThat(context).hasSingleBean(KeyedAccumulatorFactory.class);
                assertThat(context.getBean(KeyedAccumulatorFactory.class).getDefaultBatchSize()).isEqualTo(7);
            });
    }

    @Configuration(proxyBeanMethods = false)
    static class MetricsConfig {
        @Bean
        SimpleMeterRegistry meterRegistry() { return new SimpleMeterRegistry(); }
    }
}

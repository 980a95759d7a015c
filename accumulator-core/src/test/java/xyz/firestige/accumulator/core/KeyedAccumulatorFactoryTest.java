package xyz.firestige.accumulator.core;

import org.junit.jupiter.api.Test;
import xyz.firestige.accumulator.api.AccumulatorMetricsRecorder;
import xyz.firestige.accumulator.core.handler.FailurePolicy;
import xyz.firestige.accumulator.core.handler.SkipKeyFailureHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedAccumulatorFactoryTest {

    @Test
    void newAccumulator_usesDefaultBatchSize() {
        KeyedAccumulatorFactory factory = new KeyedAccumulatorFactory(25);

        KeyedBatchedAccumulator<String> accumulator = factory.newAccumulator();

        assertThat(accumulator.getBatchSize()).isEqualTo(25);
        assertThat(factory.<String>newAccumulator(7).getBatchSize()).isEqualTo(7);
    }

    @Test
    void newAccumulator_returnsIndependentInstances() {
        KeyedAccumulatorFactory factory = new KeyedAccumulatorFactory(2);
        KeyedBatchedAccumulator<String> first = factory.newAccumulator();
        KeyedBatchedAccumulator<String> second = factory.newAccumulator();

        first.push("a", "k");

        assertThat(first.isActiveKey("k")).isTrue();
        assertThat(second.isEmpty()).isTrue();
    }

    @Test
    void newDispatcher_usesConfiguredFailurePolicy() {
        KeyedAccumulatorFactory factory =
                new KeyedAccumulatorFactory(10, AccumulatorMetricsRecorder.noop(), FailurePolicy.SKIP_KEY);

        BatchDispatcher<String> dispatcher = factory.newDispatcher((key, batch) -> { });

        assertThat(dispatcher.getFailureHandler()).isInstanceOf(SkipKeyFailureHandler.class);
        assertThat(factory.getFailurePolicy()).isEqualTo(FailurePolicy.SKIP_KEY);
    }

    @Test
    void constructor_invalidArguments_throw() {
        assertThatThrownBy(() -> new KeyedAccumulatorFactory(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new KeyedAccumulatorFactory(5, null, FailurePolicy.ABORT))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new KeyedAccumulatorFactory(5, AccumulatorMetricsRecorder.noop(), null))
                .isInstanceOf(NullPointerException.class);
    }
}

package xyz.firestige.accumulator.spring.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import xyz.firestige.accumulator.core.handler.FailurePolicy;

/**
 * 按 Key 累积器配置属性
 *
 * <pre>
 * keyed:
 *   accumulator:
 *     enabled: true
 *     batch-size: 100
 *     failure-policy: skip-key
 * </pre>
 */
@ConfigurationProperties(prefix = "keyed.accumulator")
public class KeyedAccumulatorProperties {

    /**
     * 是否启用累积器自动配置
     */
    private boolean enabled = true;

    /**
     * 默认批次大小，必须为正整数
     */
    private int batchSize = 100;

    /**
     * 批次消费失败时的处理策略
     */
    private FailurePolicy failurePolicy = FailurePolicy.LOG_AND_CONTINUE;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(FailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }
}

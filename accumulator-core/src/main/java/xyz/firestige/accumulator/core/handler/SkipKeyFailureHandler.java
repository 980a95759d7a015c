package xyz.firestige.accumulator.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.DispatchFailureHandler;

import java.util.List;

/**
 * 跳过 Key 失败处理器
 * <p>某个批次失败后放弃该 Key 的剩余批次，保证同一 Key 下不会越过失败批次继续投递
 */
public class SkipKeyFailureHandler<T> implements DispatchFailureHandler<T> {
    private static final Logger log = LoggerFactory.getLogger(SkipKeyFailureHandler.class);

    @Override
    public Action handle(String key, int batchIndex, List<T> batch, Throwable error) {
        log.warn("批次分发失败，跳过 Key 剩余批次 [key={}, batchIndex={}, error={}]",
                key, batchIndex, error.getMessage(), error);
        return Action.SKIP_KEY;
    }

    @Override
    public String getName() {
        return "SkipKey";
    }
}

package xyz.firestige.accumulator.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.DispatchFailureHandler;

import java.util.List;

/**
 * 中止失败处理器
 * <p>首个失败即中止本轮分发，剩余批次全部计入未送达
 */
public class AbortFailureHandler<T> implements DispatchFailureHandler<T> {
    private static final Logger log = LoggerFactory.getLogger(AbortFailureHandler.class);

    @Override
    public Action handle(String key, int batchIndex, List<T> batch, Throwable error) {
        log.error("批次分发失败，中止本轮分发 [key={}, batchIndex={}, error={}]",
                key, batchIndex, error.getMessage(), error);
        return Action.ABORT;
    }

    @Override
    public String getName() {
        return "Abort";
    }
}

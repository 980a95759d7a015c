package xyz.firestige.accumulator.core.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.accumulator.api.DispatchFailureHandler;

import java.util.List;

/**
 * 日志记录失败处理器（默认实现）
 * <p>记录错误日志后继续分发下一个批次
 */
public class LogAndContinueFailureHandler<T> implements DispatchFailureHandler<T> {
    private static final Logger log = LoggerFactory.getLogger(LogAndContinueFailureHandler.class);

    @Override
    public Action handle(String key, int batchIndex, List<T> batch, Throwable error) {
        log.error("批次分发失败 [key={}, batchIndex={}, items={}, error={}]",
                key, batchIndex, batch.size(), error.getMessage(), error);
        return Action.CONTINUE;
    }

    @Override
    public String getName() {
        return "LogAndContinue";
    }
}

package xyz.firestige.accumulator.core.handler;

import xyz.firestige.accumulator.api.DispatchFailureHandler;

/**
 * 预置失败处理策略
 */
public enum FailurePolicy {
    LOG_AND_CONTINUE,
    SKIP_KEY,
    ABORT;

    public <T> DispatchFailureHandler<T> newHandler() {
        switch (this) {
            case SKIP_KEY:
                return new SkipKeyFailureHandler<>();
            case ABORT:
                return new AbortFailureHandler<>();
            case LOG_AND_CONTINUE:
            default:
                return new LogAndContinueFailureHandler<>();
        }
    }
}

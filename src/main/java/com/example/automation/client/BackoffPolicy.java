package com.example.automation.client;

import java.time.Duration;

/**
 * 重连退避策略，延迟随尝试次数单调不减，并以最大延迟封顶
 */
public enum BackoffPolicy {

    /**
     * base × attempt
     */
    LINEAR {
        @Override
        Duration uncapped(int attempt, Duration base) {
            return base.multipliedBy(attempt);
        }
    },

    /**
     * base × 2^(attempt-1)
     */
    EXPONENTIAL {
        @Override
        Duration uncapped(int attempt, Duration base) {
            return base.multipliedBy(1L << Math.min(attempt - 1, 30));
        }
    };

    abstract Duration uncapped(int attempt, Duration base);

    /**
     * 计算第 attempt 次重连（从1开始）之前的等待时间
     */
    public Duration delayFor(int attempt, Duration base, Duration max) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        Duration delay = uncapped(attempt, base);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}

package com.example.automation.config;

/**
 * Redis键常量定义
 *
 * <p>Redis只保存运行中任务的实时状态缓存，任务结束后即删除。
 * </p>
 */
public final class RedisKeyConstants {

    private RedisKeyConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 任务实时状态键名前缀，完整格式：automation:job:live:status:{jobId}
     */
    public static final String JOB_LIVE_STATUS_PREFIX = "automation:job:live:status:";

    public static String buildLiveStatusKey(Long jobId) {
        return JOB_LIVE_STATUS_PREFIX + jobId;
    }
}

package com.example.automation.protocol;

/**
 * 状态事件的类型标签
 *
 * <p>每个出站帧都携带 {@code type} 字段，取值为 {@link #tag()}。
 * 消费方必须依据标签分派，不能根据字段是否存在推断事件形状。
 * </p>
 */
public enum EventType {

    JOB_STARTED("job_started"),

    STEP("step"),

    /**
     * 终态事件，每个任务最多一次有意义
     */
    JOB_COMPLETED("job_completed"),

    /**
     * 通道级别的非致命错误，不属于任何任务
     */
    ERROR("error");

    private final String tag;

    EventType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

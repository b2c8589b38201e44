package com.example.automation.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 实时通道上传输的状态事件
 *
 * <p>封闭的标签联合：只有以下四种形状，序列化时由Jackson写入 {@code type} 标签：
 * <ul>
 *   <li>{@link JobStartedEvent} - {@code job_started}</li>
 *   <li>{@link StepEvent} - {@code step}</li>
 *   <li>{@link JobCompletedEvent} - {@code job_completed}（终态）</li>
 *   <li>{@link ErrorEvent} - {@code error}</li>
 * </ul>
 * 事件是瞬时的，不具有独立标识；持久状态以任务记录为准。
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JobStartedEvent.class, name = "job_started"),
        @JsonSubTypes.Type(value = StepEvent.class, name = "step"),
        @JsonSubTypes.Type(value = JobCompletedEvent.class, name = "job_completed"),
        @JsonSubTypes.Type(value = ErrorEvent.class, name = "error")
})
public interface StatusEvent {

    /**
     * 事件的类型标签，由具体记录类型固定
     */
    EventType type();
}

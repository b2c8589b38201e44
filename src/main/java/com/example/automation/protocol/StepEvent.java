package com.example.automation.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 任务中的一个步骤发生了变化
 *
 * <p>步骤之间没有序号，顺序即投递顺序，因此协议无法检测缺失的步骤。
 * </p>
 *
 * @param jobId 任务ID
 * @param step 步骤内容
 */
@JsonTypeName("step")
public record StepEvent(@JsonProperty(value = "jobId", required = true) long jobId,
                        @JsonProperty(value = "step", required = true) AutomationStep step) implements StatusEvent {

    @Override
    public EventType type() {
        return EventType.STEP;
    }
}

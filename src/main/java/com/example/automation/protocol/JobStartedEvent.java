package com.example.automation.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 任务开始执行
 *
 * @param jobId 任务ID
 */
@JsonTypeName("job_started")
public record JobStartedEvent(@JsonProperty(value = "jobId", required = true) long jobId) implements StatusEvent {

    @Override
    public EventType type() {
        return EventType.JOB_STARTED;
    }
}

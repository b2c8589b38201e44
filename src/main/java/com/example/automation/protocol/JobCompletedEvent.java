package com.example.automation.protocol;

import com.example.automation.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * 任务结束（终态事件）
 *
 * @param jobId 任务ID
 * @param success 是否成功
 * @param result 成功时的结果（可选）
 * @param error 失败时的错误信息（可选）
 */
@JsonTypeName("job_completed")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobCompletedEvent(@JsonProperty(value = "jobId", required = true) long jobId,
                                @JsonProperty(value = "success", required = true) boolean success,
                                String result,
                                String error)
        implements StatusEvent {

    public static JobCompletedEvent succeeded(long jobId, String result) {
        return new JobCompletedEvent(jobId, true, result, null);
    }

    public static JobCompletedEvent failed(long jobId, String error) {
        return new JobCompletedEvent(jobId, false, null, error);
    }

    @Override
    public EventType type() {
        return EventType.JOB_COMPLETED;
    }

    /**
     * 该事件对应的任务终态
     */
    public JobStatus terminalStatus() {
        return success ? JobStatus.COMPLETED : JobStatus.FAILED;
    }
}

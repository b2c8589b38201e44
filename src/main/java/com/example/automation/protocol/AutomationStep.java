package com.example.automation.protocol;

import com.example.automation.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 自动化步骤的描述
 *
 * @param description 步骤描述，例如 "Navigate to https://example.com"
 * @param detail 补充信息（可选）
 * @param status 步骤状态
 * @param durationMs 步骤耗时（毫秒，可选）
 * @param timestamp 步骤发生时间（epoch毫秒，可选）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutomationStep(
        String description,
        String detail,
        JobStatus status,
        Long durationMs,
        Long timestamp
) {

    public static AutomationStep running(String description) {
        return new AutomationStep(description, null, JobStatus.RUNNING, null, System.currentTimeMillis());
    }

    public AutomationStep finish(JobStatus finalStatus, String detail, long durationMs) {
        return new AutomationStep(description, detail, finalStatus, durationMs, System.currentTimeMillis());
    }
}

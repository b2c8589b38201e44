package com.example.automation.dto;

import com.example.automation.model.JobStatus;

/**
 * 步骤日志中的一条记录
 */
public record AutomationStepResponse(
        String description,
        String detail,
        JobStatus status,
        Long durationMs,
        Long timestamp
) {
}

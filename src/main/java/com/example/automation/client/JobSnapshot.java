package com.example.automation.client;

import com.example.automation.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 轮询接口返回的任务状态快照
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobSnapshot(Long id, JobStatus status, String liveMessage, Long durationMs,
                          String result, String error) {
}

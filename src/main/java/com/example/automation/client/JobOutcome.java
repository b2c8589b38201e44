package com.example.automation.client;

import com.example.automation.model.JobStatus;

/**
 * 观察到的任务终态
 *
 * @param jobId 任务ID
 * @param status COMPLETED 或 FAILED
 * @param result 成功时的结果
 * @param error 失败时的错误信息
 * @param durationMs 耗时，推送的终态事件不带耗时，此时为null
 */
public record JobOutcome(long jobId, JobStatus status, String result, String error, Long durationMs) {
}

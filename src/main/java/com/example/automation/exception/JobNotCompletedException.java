package com.example.automation.exception;

import com.example.automation.model.JobStatus;

/**
 * 任务未完成异常
 *
 * <p>当尝试获取任务结果，但任务状态不是COMPLETED时抛出此异常。
 * </p>
 */
public class JobNotCompletedException extends RuntimeException {

    public JobNotCompletedException(Long jobId, JobStatus currentStatus) {
        super(String.format("Automation [%d] has no result. Current status: %s", jobId, currentStatus.value()));
    }
}

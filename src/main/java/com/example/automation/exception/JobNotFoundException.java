package com.example.automation.exception;

/**
 * 任务未找到异常
 *
 * <p>当查询的任务ID在数据库中不存在时抛出此异常，对应HTTP 404。
 * 对轮询方而言404表示"尚未找到"，不是终态。
 * </p>
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Automation not found with id: " + jobId);
    }
}

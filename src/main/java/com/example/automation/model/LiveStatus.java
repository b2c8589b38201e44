package com.example.automation.model;

/**
 * 执行器写入Redis的实时状态
 *
 * @param status 当前状态
 * @param message 最近一次上报的消息
 * @param stepsCompleted 已结束的步骤数
 */
public record LiveStatus(JobStatus status, String message, int stepsCompleted) {
}

package com.example.automation.client;

import com.example.automation.model.JobStatus;
import com.example.automation.protocol.AutomationStep;

/**
 * 合并后的任务视图回调
 */
public interface ReconciliationListener {

    /**
     * 非终态状态前进（PENDING → RUNNING）
     */
    default void onStatus(JobStatus status, StatusSource source) {
    }

    default void onStep(AutomationStep step) {
    }

    /**
     * 任务进入终态，每个任务只回调一次
     */
    default void onTerminal(JobOutcome outcome, StatusSource source) {
    }

    /**
     * 一次轮询失败，任务状态暂时未知
     */
    default void onStatusUnknown(long jobId, RuntimeException cause) {
    }

    /**
     * 推送通道报告了错误事件
     */
    default void onChannelError(String message) {
    }
}

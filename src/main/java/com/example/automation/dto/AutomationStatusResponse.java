package com.example.automation.dto;

import com.example.automation.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * 任务状态快照
 *
 * <p>合并了Redis（运行中的实时状态）和数据库（持久化状态），
 * 观察者的轮询兜底读取的就是这个结构。
 * </p>
 *
 * @param id 任务ID
 * @param status 当前状态
 * @param liveMessage 执行器上报的实时消息（仅运行中）
 * @param durationMs 执行时长（仅终态）
 * @param result 结果（仅成功）
 * @param error 错误信息（仅失败）
 * @param sessionId 会话ID
 * @param createdAt 创建时间
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutomationStatusResponse(
        Long id,
        JobStatus status,
        String liveMessage,
        Long durationMs,
        String result,
        String error,
        String sessionId,
        LocalDateTime createdAt
) {
}

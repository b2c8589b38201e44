package com.example.automation.dto;

/**
 * 提交自动化任务的响应DTO
 *
 * @param jobId 任务ID
 * @param sessionId 订阅实时进度使用的会话ID
 */
public record AutomationSubmitResponse(Long jobId, String sessionId) {
}

package com.example.automation.model;

import java.util.List;

/**
 * Kafka中的任务消息
 *
 * @param jobId 任务ID
 * @param sessionId 推送进度的会话ID
 * @param prompt 自动化目标描述
 * @param urls 依次访问的页面
 * @param selector 提取内容的CSS选择器
 */
public record AutomationTask(
        Long jobId,
        String sessionId,
        String prompt,
        List<String> urls,
        String selector
) {
}

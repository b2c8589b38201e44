package com.example.automation.protocol;

/**
 * 客户端发送的订阅控制帧：{@code {"type":"subscribe","sessionId":"..."}}
 *
 * @param sessionId 要订阅的会话ID
 */
public record SubscribeFrame(String sessionId) {
}

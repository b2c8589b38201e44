package com.example.automation.client;

/**
 * 状态的来源：实时推送或轮询
 */
public enum StatusSource {
    PUSH,
    POLL
}

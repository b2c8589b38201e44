package com.example.automation.config;

import com.example.automation.client.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 观察者客户端配置（重连与轮询）
 */
@Configuration
@ConfigurationProperties(prefix = "automation.observer")
public class ObserverClientProperties {

    /**
     * 推送端点地址
     */
    private String wsUrl = "ws://localhost:8080/ws";

    /**
     * 任务状态查询接口的根地址
     */
    private String statusBaseUrl = "http://localhost:8080";

    /**
     * 最大连续重连次数，超过后进入GIVEN_UP
     */
    private int maxReconnectAttempts = 5;

    private long reconnectBaseDelayMs = 1000;

    private long reconnectMaxDelayMs = 30000;

    private BackoffPolicy backoffPolicy = BackoffPolicy.LINEAR;

    /**
     * 轮询间隔（毫秒）
     */
    private long pollIntervalMs = 1000;

    /**
     * 轮询请求的连接和响应超时（毫秒）
     */
    private int pollTimeoutMs = 5000;

    public String getWsUrl() {
        return wsUrl;
    }

    public void setWsUrl(String wsUrl) {
        this.wsUrl = wsUrl;
    }

    public String getStatusBaseUrl() {
        return statusBaseUrl;
    }

    public void setStatusBaseUrl(String statusBaseUrl) {
        this.statusBaseUrl = statusBaseUrl;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getReconnectBaseDelayMs() {
        return reconnectBaseDelayMs;
    }

    public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
        this.reconnectBaseDelayMs = reconnectBaseDelayMs;
    }

    public long getReconnectMaxDelayMs() {
        return reconnectMaxDelayMs;
    }

    public void setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
        this.reconnectMaxDelayMs = reconnectMaxDelayMs;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public void setBackoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(int pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }
}

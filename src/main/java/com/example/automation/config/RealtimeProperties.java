package com.example.automation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 实时通道配置
 */
@Configuration
@ConfigurationProperties(prefix = "automation.realtime")
public class RealtimeProperties {

    /**
     * WebSocket端点路径
     */
    private String path = "/ws";

    /**
     * 允许的Origin模式
     */
    private String[] allowedOrigins = {"*"};

    /**
     * 单次发送的最长阻塞时间（毫秒），超过则断开该连接
     */
    private int sendTimeLimitMs = 5000;

    /**
     * 每个连接的发送缓冲上限（字节），超过则断开该连接
     */
    private int sendBufferSizeLimit = 512 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String[] getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }
}

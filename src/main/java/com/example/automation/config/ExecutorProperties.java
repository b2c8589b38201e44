package com.example.automation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 自动化执行器配置
 */
@Configuration
@ConfigurationProperties(prefix = "automation.executor")
public class ExecutorProperties {

    /**
     * 建立连接超时（毫秒）
     */
    private int connectTimeoutMs = 10000;

    /**
     * 响应超时（毫秒）
     */
    private int responseTimeoutMs = 30000;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    /**
     * 每个步骤提取内容的最大长度
     */
    private int maxExtractLength = 2000;

    /**
     * 实时状态在Redis中的保留时间（分钟），防止执行器崩溃导致状态残留
     */
    private int liveStatusTtlMinutes = 60;

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public void setResponseTimeoutMs(int responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getMaxExtractLength() {
        return maxExtractLength;
    }

    public void setMaxExtractLength(int maxExtractLength) {
        this.maxExtractLength = maxExtractLength;
    }

    public int getLiveStatusTtlMinutes() {
        return liveStatusTtlMinutes;
    }

    public void setLiveStatusTtlMinutes(int liveStatusTtlMinutes) {
        this.liveStatusTtlMinutes = liveStatusTtlMinutes;
    }
}

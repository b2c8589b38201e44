package com.example.automation.client;

/**
 * 任务状态暂时无法获取（网络错误、服务端5xx、响应无法解析）
 *
 * <p>与"任务不存在"不同，调用方应视为状态未知并继续轮询。
 * </p>
 */
public class StatusUnavailableException extends RuntimeException {

    public StatusUnavailableException(String message) {
        super(message);
    }

    public StatusUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

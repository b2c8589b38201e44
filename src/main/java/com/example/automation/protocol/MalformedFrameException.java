package com.example.automation.protocol;

/**
 * 帧格式错误异常
 *
 * <p>当收到的帧不是合法JSON、缺少或带有未知的 {@code type} 标签时抛出。
 * 调用方丢弃该帧并记录日志，连接保持打开。
 * </p>
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}

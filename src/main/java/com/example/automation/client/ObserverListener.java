package com.example.automation.client;

import com.example.automation.protocol.MalformedFrameException;
import com.example.automation.protocol.StatusEvent;

/**
 * 观察者客户端的事件处理器
 *
 * <p>所有回调都在客户端内部锁中执行，不能阻塞；在回调中调用客户端自身的方法是安全的。
 * </p>
 */
public interface ObserverListener {

    /**
     * 收到一个合法的状态事件
     */
    void onEvent(StatusEvent event);

    /**
     * 连接状态变化，可用于展示"重连中"等降级提示
     */
    default void onStateChange(ConnectionState previous, ConnectionState current) {
    }

    /**
     * 收到无法解析的帧，帧已被丢弃，连接保持打开
     */
    default void onProtocolError(MalformedFrameException error) {
    }
}

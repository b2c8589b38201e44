package com.example.automation.realtime;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * 基于Spring WebSocket会话的观察者连接
 *
 * <p>使用 {@link ConcurrentWebSocketSessionDecorator} 串行化并发发送；
 * 发送超时或缓冲溢出时装饰器会关闭会话并抛出异常，注册表随即移除该连接。
 * </p>
 */
public class WebSocketObserverConnection implements ObserverConnection {

    private final WebSocketSession session;

    public WebSocketObserverConnection(WebSocketSession session, int sendTimeLimitMs, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public String toString() {
        return "WebSocketObserverConnection[" + session.getId() + "]";
    }
}

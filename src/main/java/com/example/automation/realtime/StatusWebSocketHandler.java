package com.example.automation.realtime;

import com.example.automation.config.RealtimeProperties;
import com.example.automation.protocol.ErrorEvent;
import com.example.automation.protocol.MalformedFrameException;
import com.example.automation.protocol.MessageCodec;
import com.example.automation.protocol.SubscribeFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 状态推送端点的WebSocket处理器
 *
 * <p>入站只接受 {@code {"type":"subscribe","sessionId":"..."}}；
 * 出站事件由 {@link BroadcastDispatcher} 经注册表写出。
 * 格式错误的帧被丢弃并记录日志，同时回送一个 {@code error} 事件，连接保持订阅状态。
 * 连接关闭或传输出错时从注册表移除。
 * </p>
 */
@Component
public class StatusWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(StatusWebSocketHandler.class);

    private final SessionRegistry sessionRegistry;
    private final MessageCodec messageCodec;
    private final RealtimeProperties realtimeProperties;

    private final Map<String, ObserverConnection> connections = new ConcurrentHashMap<>();

    public StatusWebSocketHandler(SessionRegistry sessionRegistry,
                                  MessageCodec messageCodec,
                                  RealtimeProperties realtimeProperties) {
        this.sessionRegistry = sessionRegistry;
        this.messageCodec = messageCodec;
        this.realtimeProperties = realtimeProperties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.put(session.getId(), newConnection(session));
        logger.info("WebSocket client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ObserverConnection connection = connections.computeIfAbsent(session.getId(), id -> newConnection(session));
        String payload = message.getPayload();

        SubscribeFrame frame;
        try {
            frame = messageCodec.decodeControl(payload);
        } catch (MalformedFrameException e) {
            logger.warn("Dropping malformed frame from {}: {}", session.getId(), e.getMessage());
            reply(connection, new ErrorEvent(e.getMessage()));
            return;
        }

        sessionRegistry.subscribe(frame.sessionId(), connection);
        logger.info("Client {} subscribed to session: {}", session.getId(), frame.sessionId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
        logger.info("WebSocket client disconnected: {} ({})", session.getId(), status);
    }

    /**
     * 当前打开的连接数
     */
    public int connectionCount() {
        return connections.size();
    }

    private void release(WebSocketSession session) {
        ObserverConnection connection = connections.remove(session.getId());
        if (connection != null) {
            sessionRegistry.unsubscribe(connection);
        }
    }

    private void reply(ObserverConnection connection, ErrorEvent event) {
        try {
            connection.send(messageCodec.encode(event));
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to send error frame to {}: {}", connection.getId(), e.getMessage());
        }
    }

    private ObserverConnection newConnection(WebSocketSession session) {
        return new WebSocketObserverConnection(session,
                realtimeProperties.getSendTimeLimitMs(),
                realtimeProperties.getSendBufferSizeLimit());
    }
}

package com.example.automation.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * 基于Spring WebSocket客户端的传输实现
 */
public class WebSocketObserverTransport implements ObserverTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketObserverTransport.class);

    private final WebSocketClient webSocketClient;
    private final URI uri;

    public WebSocketObserverTransport(WebSocketClient webSocketClient, URI uri) {
        this.webSocketClient = webSocketClient;
        this.uri = uri;
    }

    @Override
    public CompletableFuture<TransportChannel> open(TransportListener listener) {
        logger.debug("Opening WebSocket to {}", uri);
        return webSocketClient.execute(new ForwardingHandler(listener), new WebSocketHttpHeaders(), uri)
                .thenApply(WebSocketChannel::new);
    }

    private static class ForwardingHandler extends TextWebSocketHandler {

        private final TransportListener listener;

        ForwardingHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onFrame(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClosed(status.toString());
        }
    }

    private static class WebSocketChannel implements TransportChannel {

        private final WebSocketSession session;

        WebSocketChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String frame) throws IOException {
            session.sendMessage(new TextMessage(frame));
        }

        @Override
        public void close() {
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}

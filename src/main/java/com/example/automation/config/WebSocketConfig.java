package com.example.automation.config;

import com.example.automation.realtime.StatusWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket配置类
 *
 * <p>在 {@code automation.realtime.path}（默认 /ws）注册状态推送端点。
 * </p>
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final StatusWebSocketHandler statusWebSocketHandler;
    private final RealtimeProperties realtimeProperties;

    public WebSocketConfig(StatusWebSocketHandler statusWebSocketHandler,
                           RealtimeProperties realtimeProperties) {
        this.statusWebSocketHandler = statusWebSocketHandler;
        this.realtimeProperties = realtimeProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(statusWebSocketHandler, realtimeProperties.getPath())
                .setAllowedOriginPatterns(realtimeProperties.getAllowedOrigins());
    }
}

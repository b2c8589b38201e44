package com.example.automation.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期输出实时通道的连接和会话数量
 */
@Component
public class RealtimeStatsReporter {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeStatsReporter.class);

    private final SessionRegistry sessionRegistry;
    private final StatusWebSocketHandler webSocketHandler;

    public RealtimeStatsReporter(SessionRegistry sessionRegistry, StatusWebSocketHandler webSocketHandler) {
        this.sessionRegistry = sessionRegistry;
        this.webSocketHandler = webSocketHandler;
    }

    /**
     * 每5分钟执行一次
     */
    @Scheduled(fixedRate = 300000)
    public void report() {
        logger.info("Realtime channel: connections={}, sessions={}",
                webSocketHandler.connectionCount(), sessionRegistry.sessionCount());
    }
}

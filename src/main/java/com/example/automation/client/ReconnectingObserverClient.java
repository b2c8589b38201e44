package com.example.automation.client;

import com.example.automation.config.ObserverClientProperties;
import com.example.automation.protocol.MalformedFrameException;
import com.example.automation.protocol.MessageCodec;
import com.example.automation.protocol.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * 自动重连的观察者客户端
 *
 * <p>连接建立后立即发送订阅帧；连接断开时按 {@link BackoffPolicy} 计算延迟后重连，
 * 连续失败超过上限进入 {@link ConnectionState#GIVEN_UP}。成功建立连接会清零重试计数。
 * 重新订阅只依赖本地保存的会话ID，服务端不保留任何订阅状态。
 * </p>
 *
 * <p>每次连接尝试都有一个代号（generation），断开、重试、disconnect() 都会递增代号，
 * 旧连接迟到的回调因代号不符被忽略。
 * </p>
 */
public class ReconnectingObserverClient {

    private static final Logger logger = LoggerFactory.getLogger(ReconnectingObserverClient.class);

    private final ObserverTransport transport;
    private final MessageCodec messageCodec;
    private final TaskScheduler scheduler;
    private final ObserverListener listener;

    private final int maxReconnectAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final BackoffPolicy backoffPolicy;

    private final Object lock = new Object();

    private ConnectionState state = ConnectionState.IDLE;
    private String sessionId;
    private int reconnectAttempts;
    private long generation;
    private TransportChannel channel;
    private ScheduledFuture<?> pendingRetry;

    public ReconnectingObserverClient(ObserverTransport transport,
                                      MessageCodec messageCodec,
                                      TaskScheduler scheduler,
                                      ObserverClientProperties properties,
                                      String sessionId,
                                      ObserverListener listener) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        this.transport = transport;
        this.messageCodec = messageCodec;
        this.scheduler = scheduler;
        this.listener = listener;
        this.sessionId = sessionId;
        this.maxReconnectAttempts = properties.getMaxReconnectAttempts();
        this.baseDelay = Duration.ofMillis(properties.getReconnectBaseDelayMs());
        this.maxDelay = Duration.ofMillis(properties.getReconnectMaxDelayMs());
        this.backoffPolicy = properties.getBackoffPolicy();
    }

    /**
     * 开始连接；已处于CONNECTING或OPEN时不做任何事。
     * 从GIVEN_UP或RETRY_WAIT调用会清零重试计数并立即连接
     */
    public void connect() {
        synchronized (lock) {
            if (state == ConnectionState.OPEN || state == ConnectionState.CONNECTING) {
                logger.debug("connect() ignored in state {}", state);
                return;
            }
            cancelPendingRetry();
            reconnectAttempts = 0;
            openTransport();
        }
    }

    /**
     * 主动断开；返回后不会再有重连尝试，也不会再分发事件
     */
    public void disconnect() {
        synchronized (lock) {
            generation++;
            cancelPendingRetry();
            closeChannel();
            reconnectAttempts = 0;
            transition(ConnectionState.IDLE);
        }
    }

    /**
     * 切换订阅的会话。连接打开时立即发送订阅帧；
     * 等待重连时跳过剩余延迟立即重连
     */
    public void subscribe(String newSessionId) {
        if (newSessionId == null || newSessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        synchronized (lock) {
            this.sessionId = newSessionId;
            if (state == ConnectionState.OPEN) {
                sendSubscribe();
            } else if (state == ConnectionState.RETRY_WAIT) {
                cancelPendingRetry();
                openTransport();
            }
        }
    }

    public ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public String getSessionId() {
        synchronized (lock) {
            return sessionId;
        }
    }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    private void openTransport() {
        long attempt = ++generation;
        transition(ConnectionState.CONNECTING);
        logger.debug("Opening observer connection for session {} (generation {})", sessionId, attempt);

        CompletableFuture<TransportChannel> future;
        try {
            future = transport.open(new ChannelListener(attempt));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((opened, error) -> {
            if (error != null) {
                connectFailed(attempt, error);
            } else {
                connected(attempt, opened);
            }
        });
    }

    private void connected(long attempt, TransportChannel opened) {
        synchronized (lock) {
            if (attempt != generation || state != ConnectionState.CONNECTING) {
                logger.debug("Discarding stale connection (generation {})", attempt);
                opened.close();
                return;
            }
            channel = opened;
            reconnectAttempts = 0;
            transition(ConnectionState.OPEN);
            logger.info("Observer connected, subscribing to session {}", sessionId);
            sendSubscribe();
        }
    }

    private void connectFailed(long attempt, Throwable error) {
        synchronized (lock) {
            if (attempt != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            logger.warn("Observer connection attempt failed: {}", error.getMessage());
            scheduleRetry();
        }
    }

    private void connectionLost(long attempt, String reason) {
        synchronized (lock) {
            if (attempt != generation
                    || (state != ConnectionState.OPEN && state != ConnectionState.CONNECTING)) {
                return;
            }
            logger.warn("Observer connection lost for session {}: {}", sessionId, reason);
            closeChannel();
            scheduleRetry();
        }
    }

    private void scheduleRetry() {
        long retryGeneration = ++generation;
        if (reconnectAttempts >= maxReconnectAttempts) {
            logger.warn("Giving up on session {} after {} reconnect attempts", sessionId, reconnectAttempts);
            transition(ConnectionState.GIVEN_UP);
            return;
        }
        reconnectAttempts++;
        Duration delay = backoffPolicy.delayFor(reconnectAttempts, baseDelay, maxDelay);
        transition(ConnectionState.RETRY_WAIT);
        logger.info("Reconnecting in {} ms (attempt {}/{})",
                delay.toMillis(), reconnectAttempts, maxReconnectAttempts);
        pendingRetry = scheduler.schedule(() -> retry(retryGeneration),
                scheduler.getClock().instant().plus(delay));
    }

    private void retry(long retryGeneration) {
        synchronized (lock) {
            if (retryGeneration != generation || state != ConnectionState.RETRY_WAIT) {
                return;
            }
            pendingRetry = null;
            openTransport();
        }
    }

    private void sendSubscribe() {
        try {
            channel.send(messageCodec.encodeSubscribe(sessionId));
        } catch (IOException e) {
            connectionLost(generation, "subscribe failed: " + e.getMessage());
        }
    }

    private void deliver(long attempt, String frame) {
        synchronized (lock) {
            if (attempt != generation || state != ConnectionState.OPEN) {
                return;
            }
            StatusEvent event;
            try {
                event = messageCodec.decodeEvent(frame);
            } catch (MalformedFrameException e) {
                logger.warn("Dropping malformed frame: {}", e.getMessage());
                notifyProtocolError(e);
                return;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Observer listener failed on {} event", event.type().tag(), e);
            }
        }
    }

    private void notifyProtocolError(MalformedFrameException error) {
        try {
            listener.onProtocolError(error);
        } catch (RuntimeException e) {
            logger.warn("Observer protocol error listener failed", e);
        }
    }

    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.cancel(false);
            pendingRetry = null;
        }
    }

    private void closeChannel() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        logger.debug("Observer state {} -> {}", previous, next);
        try {
            listener.onStateChange(previous, next);
        } catch (RuntimeException e) {
            logger.warn("Observer state listener failed on {} -> {}", previous, next, e);
        }
    }

    private class ChannelListener implements TransportListener {

        private final long attempt;

        ChannelListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onFrame(String frame) {
            deliver(attempt, frame);
        }

        @Override
        public void onClosed(String reason) {
            connectionLost(attempt, reason);
        }

        @Override
        public void onError(Throwable error) {
            connectionLost(attempt, error.getMessage());
        }
    }
}

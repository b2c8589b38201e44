package com.example.automation.client;

import com.example.automation.config.ObserverClientProperties;
import com.example.automation.model.JobStatus;
import com.example.automation.protocol.MalformedFrameException;
import com.example.automation.protocol.MessageCodec;
import com.example.automation.protocol.StatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 观察一个任务：推送通道 + 轮询兜底
 *
 * <p>推送连接不可用时（非OPEN）视为降级模式，此时任务状态只来自轮询。
 * 任务到达终态后推送连接保持打开，直到 {@link #close()}。
 * </p>
 */
public class JobObserver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobObserver.class);

    private final long jobId;
    private final JobStatusReconciler reconciler;
    private final ReconnectingObserverClient client;

    private volatile ConnectionState connectionState = ConnectionState.IDLE;

    public JobObserver(long jobId,
                       String sessionId,
                       ObserverTransport transport,
                       MessageCodec messageCodec,
                       TaskScheduler scheduler,
                       JobStatusSource statusSource,
                       ObserverClientProperties properties,
                       ReconciliationListener listener) {
        this.jobId = jobId;
        this.reconciler = new JobStatusReconciler(jobId, statusSource, scheduler,
                Duration.ofMillis(properties.getPollIntervalMs()), listener);
        this.client = new ReconnectingObserverClient(transport, messageCodec, scheduler, properties,
                sessionId, new ObserverListener() {
                    @Override
                    public void onEvent(StatusEvent event) {
                        reconciler.onEvent(event);
                    }

                    @Override
                    public void onStateChange(ConnectionState previous, ConnectionState current) {
                        connectionState = current;
                        if (current == ConnectionState.GIVEN_UP) {
                            logger.warn("Push channel for automation {} gave up, relying on polling", jobId);
                        }
                    }

                    @Override
                    public void onProtocolError(MalformedFrameException error) {
                        logger.warn("Malformed frame on automation {} channel: {}", jobId, error.getMessage());
                    }
                });
    }

    public void start() {
        logger.info("Observing automation {} on session {}", jobId, client.getSessionId());
        reconciler.start();
        client.connect();
    }

    /**
     * 推送通道不可用且任务尚未结束
     */
    public boolean isDegraded() {
        return !reconciler.isTerminal() && connectionState != ConnectionState.OPEN;
    }

    public JobStatus getStatus() {
        return reconciler.getStatus();
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public CompletableFuture<JobOutcome> completion() {
        return reconciler.completion();
    }

    @Override
    public void close() {
        reconciler.stop();
        client.disconnect();
        logger.debug("Stopped observing automation {}", jobId);
    }
}

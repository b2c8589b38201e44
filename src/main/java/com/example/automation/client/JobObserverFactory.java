package com.example.automation.client;

import com.example.automation.config.ObserverClientProperties;
import com.example.automation.protocol.MessageCodec;
import org.springframework.scheduling.TaskScheduler;

/**
 * 创建并启动 {@link JobObserver}
 */
public class JobObserverFactory {

    private final ObserverTransport transport;
    private final MessageCodec messageCodec;
    private final TaskScheduler scheduler;
    private final JobStatusSource statusSource;
    private final ObserverClientProperties properties;

    public JobObserverFactory(ObserverTransport transport,
                              MessageCodec messageCodec,
                              TaskScheduler scheduler,
                              JobStatusSource statusSource,
                              ObserverClientProperties properties) {
        this.transport = transport;
        this.messageCodec = messageCodec;
        this.scheduler = scheduler;
        this.statusSource = statusSource;
        this.properties = properties;
    }

    /**
     * 观察任务，sessionId为空时使用任务ID
     */
    public JobObserver observe(long jobId, String sessionId, ReconciliationListener listener) {
        String session = sessionId == null || sessionId.isBlank() ? String.valueOf(jobId) : sessionId;
        JobObserver observer = new JobObserver(jobId, session, transport, messageCodec, scheduler,
                statusSource, properties, listener);
        observer.start();
        return observer;
    }
}

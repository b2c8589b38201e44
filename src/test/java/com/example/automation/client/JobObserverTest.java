package com.example.automation.client;

import com.example.automation.config.ObserverClientProperties;
import com.example.automation.model.JobStatus;
import com.example.automation.protocol.MessageCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JobObserver Tests")
class JobObserverTest {

    private static final long JOB_ID = 5L;

    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final FakeTransport transport = new FakeTransport();
    private final JobStatusReconcilerTest.ScriptedSource source = new JobStatusReconcilerTest.ScriptedSource();
    private final JobStatusReconcilerTest.RecordingListener listener = new JobStatusReconcilerTest.RecordingListener();

    private JobObserver observer;

    @BeforeEach
    void setUp() {
        ObserverClientProperties properties = new ObserverClientProperties();
        properties.setMaxReconnectAttempts(5);
        properties.setReconnectBaseDelayMs(1000);
        properties.setReconnectMaxDelayMs(30000);
        properties.setPollIntervalMs(1000);

        JobObserverFactory factory = new JobObserverFactory(transport, new MessageCodec(new ObjectMapper()),
                scheduler, source, properties);
        source.respond(Optional.of(new JobSnapshot(JOB_ID, JobStatus.RUNNING, "Navigate", null, null, null)));
        observer = factory.observe(JOB_ID, null, listener);
    }

    @Test
    @DisplayName("Should default the session to the job id")
    void testDefaultSession() {
        FakeTransport.FakeChannel channel = transport.acceptLast();
        assertEquals("{\"type\":\"subscribe\",\"sessionId\":\"5\"}", channel.sent.get(0));
        assertFalse(observer.isDegraded());
    }

    @Test
    @DisplayName("Should finish through polling while the push channel is down, then reconnect without a second terminal")
    void testPollingCoversPushOutage() {
        FakeTransport.FakeChannel channel = transport.acceptLast();
        scheduler.runDue();
        assertEquals(JobStatus.RUNNING, observer.getStatus());

        channel.drop();
        assertTrue(observer.isDegraded());
        assertEquals(ConnectionState.RETRY_WAIT, observer.getConnectionState());

        source.respond(Optional.of(new JobSnapshot(JOB_ID, JobStatus.FAILED, null, 3000L, null, "Step failed")));
        scheduler.advance(Duration.ofMillis(1000));
        assertTrue(observer.completion().isDone());
        assertEquals(JobStatus.FAILED, observer.getStatus());

        FakeTransport.FakeChannel reconnected = transport.acceptLast();
        assertEquals(ConnectionState.OPEN, observer.getConnectionState());
        assertEquals("{\"type\":\"subscribe\",\"sessionId\":\"5\"}", reconnected.sent.get(0));

        reconnected.receive("{\"type\":\"job_completed\",\"jobId\":5,\"success\":false,\"error\":\"Step failed\"}");

        assertEquals(1, listener.outcomes.size());
        assertEquals(StatusSource.POLL, listener.terminalSources.get(0));
        assertEquals(JobStatus.FAILED, observer.getStatus());
        assertFalse(observer.isDegraded());
    }

    @Test
    @DisplayName("Should stop polling and disconnect on close")
    void testClose() {
        transport.acceptLast();
        scheduler.runDue();

        observer.close();
        int calls = source.calls;
        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(calls, source.calls);
        assertEquals(ConnectionState.IDLE, observer.getConnectionState());
    }
}

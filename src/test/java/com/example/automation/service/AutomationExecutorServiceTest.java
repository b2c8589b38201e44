package com.example.automation.service;

import com.example.automation.exception.JobNotFoundException;
import com.example.automation.model.AutomationTask;
import com.example.automation.model.JobStatus;
import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.realtime.BroadcastDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AutomationExecutorService Tests")
class AutomationExecutorServiceTest {

    @Mock
    private AutomationService automationService;

    @Mock
    private BroadcastDispatcher dispatcher;

    @Mock
    private BrowserStepRunner stepRunner;

    @Mock
    private Acknowledgment acknowledgment;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AutomationExecutorService executorService;

    @BeforeEach
    void setUp() {
        executorService = new AutomationExecutorService(automationService, dispatcher, stepRunner, objectMapper);
    }

    @Test
    @DisplayName("Should write every state change to the store before pushing it")
    void testExecute_WriteBeforePush() throws IOException {
        when(automationService.markRunning(1L)).thenReturn(true);
        when(stepRunner.navigateAndExtract("https://example.com", null)).thenReturn("Example Domain");

        executorService.execute(new AutomationTask(1L, "s1", "title", List.of("https://example.com"), null));

        InOrder order = inOrder(automationService, dispatcher);
        order.verify(automationService).markRunning(1L);
        order.verify(dispatcher).jobStarted("s1", 1L);
        order.verify(automationService).recordStep(eq(1L), any(AutomationStep.class), eq(0));
        order.verify(dispatcher).step(eq("s1"), eq(1L), any(AutomationStep.class));
        order.verify(automationService).recordStep(eq(1L), any(AutomationStep.class), eq(1));
        order.verify(dispatcher).step(eq("s1"), eq(1L), any(AutomationStep.class));
        order.verify(automationService).markFinished(eq(1L), any(JobCompletedEvent.class), anyLong());
        order.verify(dispatcher).jobCompleted(eq("s1"), any(JobCompletedEvent.class));

        ArgumentCaptor<JobCompletedEvent> captor = ArgumentCaptor.forClass(JobCompletedEvent.class);
        verify(dispatcher).jobCompleted(eq("s1"), captor.capture());
        assertTrue(captor.getValue().success());
        assertEquals("Example Domain", captor.getValue().result());
    }

    @Test
    @DisplayName("Should stop at the first failed step and finish as failed")
    void testExecute_StepFailure() throws IOException {
        when(automationService.markRunning(2L)).thenReturn(true);
        when(stepRunner.navigateAndExtract("https://a.example", null)).thenThrow(new IOException("HTTP 500"));

        executorService.execute(new AutomationTask(2L, "s2", "p",
                List.of("https://a.example", "https://b.example"), null));

        verify(stepRunner, never()).navigateAndExtract(eq("https://b.example"), any());

        ArgumentCaptor<AutomationStep> steps = ArgumentCaptor.forClass(AutomationStep.class);
        verify(automationService, times(2)).recordStep(eq(2L), steps.capture(), anyInt());
        assertEquals(JobStatus.RUNNING, steps.getAllValues().get(0).status());
        assertEquals(JobStatus.FAILED, steps.getAllValues().get(1).status());

        ArgumentCaptor<JobCompletedEvent> outcome = ArgumentCaptor.forClass(JobCompletedEvent.class);
        verify(dispatcher).jobCompleted(eq("s2"), outcome.capture());
        assertFalse(outcome.getValue().success());
        assertTrue(outcome.getValue().error().contains("HTTP 500"));
    }

    @Test
    @DisplayName("Should push an error event instead of a terminal event when the final write fails")
    void testExecute_PersistFailure() throws IOException {
        when(automationService.markRunning(3L)).thenReturn(true);
        when(stepRunner.navigateAndExtract(anyString(), isNull())).thenReturn("ok");
        doThrow(new IllegalStateException("db down"))
                .when(automationService).markFinished(eq(3L), any(JobCompletedEvent.class), anyLong());

        executorService.execute(new AutomationTask(3L, "s3", "p", List.of("https://example.com"), null));

        verify(dispatcher, never()).jobCompleted(anyString(), any(JobCompletedEvent.class));
        verify(dispatcher).error(eq("s3"), anyString());
    }

    @Test
    @DisplayName("Should fall back to the job id as session when none is given")
    void testExecute_DefaultSession() throws IOException {
        when(automationService.markRunning(4L)).thenReturn(true);
        when(stepRunner.navigateAndExtract(anyString(), isNull())).thenReturn("ok");

        executorService.execute(new AutomationTask(4L, null, "p", List.of("https://example.com"), null));

        verify(dispatcher).jobStarted("4", 4L);
    }

    @Test
    @DisplayName("Should skip a task whose record does not exist")
    void testExecute_MissingRecord() {
        doThrow(new JobNotFoundException(5L)).when(automationService).markRunning(5L);

        executorService.execute(new AutomationTask(5L, "s5", "p", List.of("https://example.com"), null));

        verifyNoInteractions(dispatcher, stepRunner);
    }

    @Test
    @DisplayName("Should skip a redelivered task whose job already finished")
    void testExecute_RedeliveredAfterFinish() {
        when(automationService.markRunning(8L)).thenReturn(false);

        executorService.execute(new AutomationTask(8L, "s8", "p", List.of("https://example.com"), null));

        verifyNoInteractions(dispatcher, stepRunner);
        verify(automationService, never()).recordStep(anyLong(), any(AutomationStep.class), anyInt());
        verify(automationService, never()).markFinished(anyLong(), any(JobCompletedEvent.class), anyLong());
    }

    @Test
    @DisplayName("Should acknowledge a redelivered message without running the job again")
    void testConsume_RedeliveredMessage() {
        when(automationService.markRunning(9L)).thenReturn(false);

        executorService.consume("{\"jobId\":9,\"sessionId\":\"s9\",\"prompt\":\"p\",\"urls\":[\"https://example.com\"]}",
                acknowledgment, 0, 13L);

        verify(acknowledgment).acknowledge();
        verifyNoInteractions(dispatcher, stepRunner);
    }

    @Test
    @DisplayName("Should acknowledge and drop messages that cannot be parsed")
    void testConsume_InvalidMessage() {
        executorService.consume("{not json", acknowledgment, 0, 10L);
        executorService.consume("{\"jobId\":6,\"urls\":[]}", acknowledgment, 0, 11L);

        verify(acknowledgment, times(2)).acknowledge();
        verifyNoInteractions(automationService, dispatcher);
    }

    @Test
    @DisplayName("Should execute and acknowledge a valid message")
    void testConsume_ValidMessage() throws IOException {
        when(automationService.markRunning(7L)).thenReturn(true);
        when(stepRunner.navigateAndExtract(anyString(), isNull())).thenReturn("ok");

        executorService.consume("{\"jobId\":7,\"sessionId\":\"s7\",\"prompt\":\"p\",\"urls\":[\"https://example.com\"]}",
                acknowledgment, 1, 12L);

        verify(automationService).markRunning(7L);
        verify(acknowledgment).acknowledge();
    }
}

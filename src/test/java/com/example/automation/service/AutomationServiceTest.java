package com.example.automation.service;

import com.example.automation.config.KafkaConstants;
import com.example.automation.dto.AutomationStatusResponse;
import com.example.automation.dto.AutomationSubmitRequest;
import com.example.automation.dto.AutomationSubmitResponse;
import com.example.automation.entity.AutomationEntity;
import com.example.automation.entity.AutomationStepEntity;
import com.example.automation.exception.JobNotCompletedException;
import com.example.automation.exception.JobNotFoundException;
import com.example.automation.model.JobStatus;
import com.example.automation.model.LiveStatus;
import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.repository.AutomationRepository;
import com.example.automation.repository.AutomationStepRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AutomationService Tests")
class AutomationServiceTest {

    @Mock
    private AutomationRepository automationRepository;

    @Mock
    private AutomationStepRepository stepRepository;

    @Mock
    private LiveStatusCache liveStatusCache;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private AutomationService automationService;

    @BeforeEach
    void setUp() {
        automationService = new AutomationService(automationRepository, stepRepository, liveStatusCache,
                kafkaTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Should save a pending record, default the session to the job id and enqueue the task")
    void testSubmit() {
        when(automationRepository.save(any(AutomationEntity.class))).thenAnswer(invocation -> {
            AutomationEntity entity = invocation.getArgument(0);
            entity.setId(11L);
            return entity;
        });
        CompletableFuture<SendResult<String, String>> pending = new CompletableFuture<>();
        when(kafkaTemplate.send(eq(KafkaConstants.JOB_TOPIC), eq("11"), any(String.class))).thenReturn(pending);

        AutomationSubmitResponse response = automationService.submit(
                new AutomationSubmitRequest("Read titles", List.of("https://example.com"), null, null));

        assertEquals(Long.valueOf(11L), response.jobId());
        assertEquals("11", response.sessionId());

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(KafkaConstants.JOB_TOPIC), eq("11"), message.capture());
        assertTrue(message.getValue().contains("\"sessionId\":\"11\""));
        assertTrue(message.getValue().contains("https://example.com"));
    }

    @Test
    @DisplayName("Should keep a caller supplied session id")
    void testSubmit_CustomSession() {
        when(automationRepository.save(any(AutomationEntity.class))).thenAnswer(invocation -> {
            AutomationEntity entity = invocation.getArgument(0);
            entity.setId(12L);
            return entity;
        });
        when(kafkaTemplate.send(any(String.class), any(String.class), any(String.class)))
                .thenReturn(new CompletableFuture<>());

        AutomationSubmitResponse response = automationService.submit(
                new AutomationSubmitRequest("p", List.of("https://example.com"), "h1", "tab-7"));

        assertEquals("tab-7", response.sessionId());
    }

    @Test
    @DisplayName("Should overlay the live status while the job is running")
    void testGetStatus_LiveOverlay() {
        when(automationRepository.findById(1L)).thenReturn(Optional.of(entity(1L, JobStatus.PENDING)));
        when(liveStatusCache.find(1L)).thenReturn(Optional.of(new LiveStatus(JobStatus.RUNNING, "Navigate to x", 1)));

        AutomationStatusResponse status = automationService.getStatus(1L);

        assertEquals(JobStatus.RUNNING, status.status());
        assertEquals("Navigate to x", status.liveMessage());
    }

    @Test
    @DisplayName("Should trust the stored terminal status over any live status")
    void testGetStatus_TerminalWins() {
        AutomationEntity done = entity(2L, JobStatus.COMPLETED);
        done.setResult("Example Domain");
        when(automationRepository.findById(2L)).thenReturn(Optional.of(done));

        AutomationStatusResponse status = automationService.getStatus(2L);

        assertEquals(JobStatus.COMPLETED, status.status());
        assertEquals("Example Domain", status.result());
        assertNull(status.liveMessage());
        verify(liveStatusCache, never()).find(anyLong());
    }

    @Test
    @DisplayName("Should report a missing job")
    void testGetStatus_NotFound() {
        when(automationRepository.findById(3L)).thenReturn(Optional.empty());
        assertThrows(JobNotFoundException.class, () -> automationService.getStatus(3L));
    }

    @Test
    @DisplayName("Should refuse the result of a job that did not complete")
    void testGetResult_NotCompleted() {
        when(automationRepository.findById(4L)).thenReturn(Optional.of(entity(4L, JobStatus.FAILED)));
        assertThrows(JobNotCompletedException.class, () -> automationService.getResult(4L));
    }

    @Test
    @DisplayName("Should store a step log entry and refresh the live status")
    void testRecordStep() {
        AutomationStep step = AutomationStep.running("Navigate to https://example.com");

        automationService.recordStep(5L, step, 0);

        ArgumentCaptor<AutomationStepEntity> saved = ArgumentCaptor.forClass(AutomationStepEntity.class);
        verify(stepRepository).save(saved.capture());
        assertEquals(Long.valueOf(5L), saved.getValue().getAutomationId());
        assertEquals(JobStatus.RUNNING, saved.getValue().getStatus());
        verify(liveStatusCache).put(eq(5L), any(LiveStatus.class));
    }

    @Test
    @DisplayName("Should move a pending job to running")
    void testMarkRunning() {
        AutomationEntity pending = entity(7L, JobStatus.PENDING);
        when(automationRepository.findById(7L)).thenReturn(Optional.of(pending));

        assertTrue(automationService.markRunning(7L));

        assertEquals(JobStatus.RUNNING, pending.getStatus());
        verify(automationRepository).save(pending);
        verify(liveStatusCache).put(eq(7L), any(LiveStatus.class));
    }

    @Test
    @DisplayName("Should leave a finished job untouched when its task is delivered again")
    void testMarkRunning_AlreadyFinished() {
        AutomationEntity done = entity(8L, JobStatus.COMPLETED);
        when(automationRepository.findById(8L)).thenReturn(Optional.of(done));

        assertFalse(automationService.markRunning(8L));

        assertEquals(JobStatus.COMPLETED, done.getStatus());
        verify(automationRepository, never()).save(any(AutomationEntity.class));
        verify(liveStatusCache, never()).put(anyLong(), any(LiveStatus.class));
    }

    @Test
    @DisplayName("Should persist the terminal status and drop the live status")
    void testMarkFinished() {
        AutomationEntity running = entity(6L, JobStatus.RUNNING);
        when(automationRepository.findById(6L)).thenReturn(Optional.of(running));

        automationService.markFinished(6L, JobCompletedEvent.failed(6L, "Step failed"), 1200L);

        assertEquals(JobStatus.FAILED, running.getStatus());
        assertEquals("Step failed", running.getError());
        assertEquals(Long.valueOf(1200L), running.getDurationMs());
        verify(automationRepository).save(running);
        verify(liveStatusCache).evict(6L);
    }

    private static AutomationEntity entity(Long id, JobStatus status) {
        AutomationEntity entity = new AutomationEntity("prompt", status);
        entity.setId(id);
        return entity;
    }
}

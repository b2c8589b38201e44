package com.example.automation.service;

import com.example.automation.config.KafkaConstants;
import com.example.automation.exception.JobNotFoundException;
import com.example.automation.model.AutomationTask;
import com.example.automation.model.JobStatus;
import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.realtime.BroadcastDispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 自动化任务执行器
 *
 * <p>从Kafka消费任务并逐个执行步骤。每次状态变化都遵循同一顺序：
 * <ol>
 *   <li>先写任务存储（数据库 + Redis实时状态）</li>
 *   <li>再通过 {@link BroadcastDispatcher} 推送给订阅该会话的观察者</li>
 * </ol>
 * 推送尽力而为，错过推送的观察者依靠轮询任务存储补齐状态。
 * 任一步骤失败即结束任务（FAILED）。
 * </p>
 */
@Service
public class AutomationExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(AutomationExecutorService.class);

    private final AutomationService automationService;
    private final BroadcastDispatcher broadcastDispatcher;
    private final BrowserStepRunner stepRunner;
    private final ObjectMapper objectMapper;

    public AutomationExecutorService(AutomationService automationService,
                                     BroadcastDispatcher broadcastDispatcher,
                                     BrowserStepRunner stepRunner,
                                     ObjectMapper objectMapper) {
        this.automationService = automationService;
        this.broadcastDispatcher = broadcastDispatcher;
        this.stepRunner = stepRunner;
        this.objectMapper = objectMapper;
    }

    /**
     * Kafka消费者：消费自动化任务消息
     *
     * <p>格式错误的消息直接提交offset丢弃，避免反复消费。
     * </p>
     */
    @KafkaListener(topics = KafkaConstants.JOB_TOPIC,
                   groupId = "${spring.kafka.consumer.group-id}")
    public void consume(@Payload String message,
                        Acknowledgment acknowledgment,
                        @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                        @Header(KafkaHeaders.OFFSET) long offset) {
        logger.info("Received automation message from partition {} offset {}", partition, offset);

        AutomationTask task;
        try {
            task = objectMapper.readValue(message, AutomationTask.class);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse task message: {}", message, e);
            acknowledgment.acknowledge();
            return;
        }

        if (task.jobId() == null || task.urls() == null || task.urls().isEmpty()) {
            logger.error("Invalid task message format: {}", message);
            acknowledgment.acknowledge();
            return;
        }

        execute(task);
        acknowledgment.acknowledge();
    }

    /**
     * 执行一个自动化任务
     */
    public void execute(AutomationTask task) {
        Long jobId = task.jobId();
        String sessionId = task.sessionId() != null ? task.sessionId() : String.valueOf(jobId);
        long startTime = System.currentTimeMillis();

        try {
            run(task, sessionId, startTime);
        } catch (JobNotFoundException e) {
            logger.error("Automation record missing, skipping task: {}", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error executing automation: jobId={}", jobId, e);
            finish(sessionId, JobCompletedEvent.failed(jobId, "Automation aborted: " + e.getMessage()), startTime);
        }
    }

    private void run(AutomationTask task, String sessionId, long startTime) {
        Long jobId = task.jobId();
        logger.info("Executing automation: jobId={}, sessionId={}, steps={}", jobId, sessionId, task.urls().size());

        if (!automationService.markRunning(jobId)) {
            logger.warn("Automation {} already finished, skipping redelivered task", jobId);
            return;
        }
        broadcastDispatcher.jobStarted(sessionId, jobId);

        List<String> extracted = new ArrayList<>();
        String failure = null;
        int finishedSteps = 0;

        for (String url : task.urls()) {
            AutomationStep step = AutomationStep.running("Navigate to " + url);
            publishStep(jobId, sessionId, step, finishedSteps);

            long stepStart = System.currentTimeMillis();
            try {
                String text = stepRunner.navigateAndExtract(url, task.selector());
                extracted.add(text);
                finishedSteps++;
                publishStep(jobId, sessionId,
                        step.finish(JobStatus.COMPLETED, text, System.currentTimeMillis() - stepStart), finishedSteps);
            } catch (Exception e) {
                finishedSteps++;
                failure = "Step failed on " + url + ": " + e.getMessage();
                logger.warn("Automation step failed: jobId={}, url={}: {}", jobId, url, e.getMessage());
                publishStep(jobId, sessionId,
                        step.finish(JobStatus.FAILED, e.getMessage(), System.currentTimeMillis() - stepStart), finishedSteps);
                break;
            }
        }

        JobCompletedEvent outcome = failure == null
                ? JobCompletedEvent.succeeded(jobId, String.join("\n", extracted))
                : JobCompletedEvent.failed(jobId, failure);
        finish(sessionId, outcome, startTime);
    }

    private void publishStep(Long jobId, String sessionId, AutomationStep step, int finishedSteps) {
        automationService.recordStep(jobId, step, finishedSteps);
        broadcastDispatcher.step(sessionId, jobId, step);
    }

    /**
     * 写入终态后推送 {@code job_completed}；写入失败时不推送终态，
     * 只推送一个 {@code error} 事件，避免观察者看到存储中不存在的终态
     */
    private void finish(String sessionId, JobCompletedEvent outcome, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        try {
            automationService.markFinished(outcome.jobId(), outcome, duration);
        } catch (RuntimeException e) {
            logger.error("Failed to persist final status for jobId: {}", outcome.jobId(), e);
            broadcastDispatcher.error(sessionId, "Failed to record final status of automation " + outcome.jobId());
            return;
        }
        broadcastDispatcher.jobCompleted(sessionId, outcome);
    }
}

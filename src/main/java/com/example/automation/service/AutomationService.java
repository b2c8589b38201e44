package com.example.automation.service;

import com.example.automation.config.KafkaConstants;
import com.example.automation.dto.AutomationStatusResponse;
import com.example.automation.dto.AutomationStepResponse;
import com.example.automation.dto.AutomationSubmitRequest;
import com.example.automation.dto.AutomationSubmitResponse;
import com.example.automation.entity.AutomationEntity;
import com.example.automation.entity.AutomationStepEntity;
import com.example.automation.exception.JobNotCompletedException;
import com.example.automation.exception.JobNotFoundException;
import com.example.automation.model.AutomationTask;
import com.example.automation.model.JobStatus;
import com.example.automation.model.LiveStatus;
import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.repository.AutomationRepository;
import com.example.automation.repository.AutomationStepRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 自动化任务服务层（任务状态存储）
 *
 * <p>负责：
 * <ul>
 *   <li>提交任务：写库（PENDING）后发送到Kafka队列</li>
 *   <li>查询状态：合并Redis实时状态和数据库持久化状态</li>
 *   <li>记录执行过程：状态迁移、步骤日志、终态结果</li>
 * </ul>
 * 实时推送通道只读不写，这里是任务状态的唯一可信来源。
 * </p>
 */
@Service
public class AutomationService {

    private static final Logger logger = LoggerFactory.getLogger(AutomationService.class);

    private final AutomationRepository automationRepository;
    private final AutomationStepRepository stepRepository;
    private final LiveStatusCache liveStatusCache;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public AutomationService(AutomationRepository automationRepository,
                             AutomationStepRepository stepRepository,
                             LiveStatusCache liveStatusCache,
                             KafkaTemplate<String, String> kafkaTemplate,
                             ObjectMapper objectMapper) {
        this.automationRepository = automationRepository;
        this.stepRepository = stepRepository;
        this.liveStatusCache = liveStatusCache;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * 提交自动化任务
     *
     * <p>执行流程：
     * <ol>
     *   <li>保存任务（状态为PENDING）</li>
     *   <li>未指定会话ID时使用任务ID作为会话ID</li>
     *   <li>将任务消息发送到Kafka主题</li>
     *   <li>立即返回任务ID和会话ID，客户端随后订阅实时进度</li>
     * </ol>
     * </p>
     */
    @Transactional
    public AutomationSubmitResponse submit(AutomationSubmitRequest request) {
        logger.info("Submitting new automation with {} URLs", request.urls().size());

        AutomationEntity entity = automationRepository.save(new AutomationEntity(request.prompt(), JobStatus.PENDING));
        Long jobId = entity.getId();

        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? String.valueOf(jobId)
                : request.sessionId();
        entity.setSessionId(sessionId);
        automationRepository.save(entity);
        logger.info("Automation saved to database: jobId={}, sessionId={}", jobId, sessionId);

        AutomationTask task = new AutomationTask(jobId, sessionId, request.prompt(), request.urls(), request.selector());
        String message;
        try {
            message = objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task message for jobId " + jobId, e);
        }

        kafkaTemplate.send(KafkaConstants.JOB_TOPIC, String.valueOf(jobId), message)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        logger.error("Failed to send task message to Kafka: jobId={}", jobId, ex);
                    } else {
                        logger.info("Task message sent to Kafka: jobId={}, offset={}",
                                jobId, result.getRecordMetadata().offset());
                    }
                });

        return new AutomationSubmitResponse(jobId, sessionId);
    }

    /**
     * 获取任务状态快照
     *
     * <p>数据库中的终态优先；任务未结束时，如果Redis中有实时状态，
     * 使用实时状态和实时消息。
     * </p>
     *
     * @throws JobNotFoundException 如果任务不存在
     */
    public AutomationStatusResponse getStatus(Long jobId) {
        AutomationEntity entity = findEntity(jobId);

        JobStatus status = entity.getStatus();
        String liveMessage = null;
        if (!status.isTerminal()) {
            Optional<LiveStatus> live = liveStatusCache.find(jobId);
            if (live.isPresent()) {
                logger.debug("Found live status in Redis for jobId: {}", jobId);
                status = live.get().status();
                liveMessage = live.get().message();
            }
        }

        return new AutomationStatusResponse(
                entity.getId(),
                status,
                liveMessage,
                entity.getDurationMs(),
                entity.getResult(),
                entity.getError(),
                entity.getSessionId(),
                entity.getCreatedAt()
        );
    }

    public List<AutomationStatusResponse> listRecent() {
        return automationRepository.findTop50ByOrderByCreatedAtDesc().stream()
                .map(entity -> new AutomationStatusResponse(
                        entity.getId(),
                        entity.getStatus(),
                        null,
                        entity.getDurationMs(),
                        entity.getResult(),
                        entity.getError(),
                        entity.getSessionId(),
                        entity.getCreatedAt()))
                .collect(Collectors.toList());
    }

    public List<AutomationStepResponse> getSteps(Long jobId) {
        findEntity(jobId);
        return stepRepository.findByAutomationIdOrderByIdAsc(jobId).stream()
                .map(step -> new AutomationStepResponse(
                        step.getDescription(),
                        step.getDetail(),
                        step.getStatus(),
                        step.getDurationMs(),
                        step.getTimestampMs()))
                .collect(Collectors.toList());
    }

    /**
     * 获取任务结果，只有COMPLETED的任务才有结果
     *
     * @throws JobNotCompletedException 如果任务未成功完成
     */
    public String getResult(Long jobId) {
        AutomationEntity entity = findEntity(jobId);
        if (entity.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotCompletedException(jobId, entity.getStatus());
        }
        return entity.getResult() != null ? entity.getResult() : "";
    }

    /**
     * 标记任务开始执行
     *
     * @return 任务已处于终态（例如Kafka重复投递）时返回false，记录保持不变
     */
    @Transactional
    public boolean markRunning(Long jobId) {
        AutomationEntity entity = findEntity(jobId);
        if (entity.getStatus().isTerminal()) {
            return false;
        }
        entity.setStatus(JobStatus.RUNNING);
        entity.setStartedAt(LocalDateTime.now());
        automationRepository.save(entity);
        liveStatusCache.put(jobId, new LiveStatus(JobStatus.RUNNING, "Starting automation...", 0));
        return true;
    }

    /**
     * 追加一条步骤日志并刷新实时状态
     */
    @Transactional
    public void recordStep(Long jobId, AutomationStep step, int stepsCompleted) {
        AutomationStepEntity entity = new AutomationStepEntity();
        entity.setAutomationId(jobId);
        entity.setDescription(step.description());
        entity.setDetail(step.detail());
        entity.setStatus(step.status());
        entity.setDurationMs(step.durationMs());
        entity.setTimestampMs(step.timestamp());
        stepRepository.save(entity);

        liveStatusCache.put(jobId, new LiveStatus(JobStatus.RUNNING, step.description(), stepsCompleted));
    }

    /**
     * 写入任务终态并清理实时状态
     */
    @Transactional
    public void markFinished(Long jobId, JobCompletedEvent outcome, long durationMs) {
        AutomationEntity entity = findEntity(jobId);
        entity.setStatus(outcome.terminalStatus());
        entity.setResult(outcome.result());
        entity.setError(outcome.error());
        entity.setDurationMs(durationMs);
        entity.setCompletedAt(LocalDateTime.now());
        automationRepository.save(entity);
        logger.info("Automation finished: jobId={}, status={}, duration={}ms",
                jobId, outcome.terminalStatus().value(), durationMs);

        liveStatusCache.evict(jobId);
    }

    private AutomationEntity findEntity(Long jobId) {
        return automationRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }
}

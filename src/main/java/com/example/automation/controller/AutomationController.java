package com.example.automation.controller;

import com.example.automation.dto.AutomationStatusResponse;
import com.example.automation.dto.AutomationStepResponse;
import com.example.automation.dto.AutomationSubmitRequest;
import com.example.automation.dto.AutomationSubmitResponse;
import com.example.automation.service.AutomationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 自动化任务API控制器
 *
 * <p>提供RESTful API：
 * <ul>
 *   <li>POST /api/v1/automations - 提交自动化任务</li>
 *   <li>GET /api/v1/automations - 最近的任务列表</li>
 *   <li>GET /api/v1/automations/{id} - 查询任务状态快照（观察者轮询使用）</li>
 *   <li>GET /api/v1/automations/{id}/steps - 任务步骤日志</li>
 *   <li>GET /api/v1/automations/{id}/result - 获取任务结果</li>
 * </ul>
 * 实时进度通过WebSocket端点 /ws 推送。
 * </p>
 */
@RestController
@RequestMapping("/api/v1/automations")
public class AutomationController {

    private static final Logger logger = LoggerFactory.getLogger(AutomationController.class);

    private final AutomationService automationService;

    public AutomationController(AutomationService automationService) {
        this.automationService = automationService;
    }

    @PostMapping
    public ResponseEntity<AutomationSubmitResponse> submit(@Valid @RequestBody AutomationSubmitRequest request) {
        logger.info("Received automation submission with {} URLs", request.urls().size());

        AutomationSubmitResponse response = automationService.submit(request);

        logger.info("Automation submitted: jobId={}, sessionId={}", response.jobId(), response.sessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<AutomationStatusResponse>> list() {
        return ResponseEntity.ok(automationService.listRecent());
    }

    /**
     * 查询任务状态
     *
     * <p>任务不存在时返回404，轮询方将其视为"尚未找到"。
     * </p>
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<AutomationStatusResponse> getStatus(@PathVariable Long jobId) {
        logger.debug("Received status query for jobId: {}", jobId);
        return ResponseEntity.ok(automationService.getStatus(jobId));
    }

    @GetMapping("/{jobId}/steps")
    public ResponseEntity<List<AutomationStepResponse>> getSteps(@PathVariable Long jobId) {
        return ResponseEntity.ok(automationService.getSteps(jobId));
    }

    @GetMapping("/{jobId}/result")
    public ResponseEntity<String> getResult(@PathVariable Long jobId) {
        logger.debug("Received result query for jobId: {}", jobId);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(automationService.getResult(jobId));
    }
}

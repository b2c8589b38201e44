package com.example.automation.entity;

import com.example.automation.model.JobStatus;
import jakarta.persistence.*;

/**
 * 任务步骤日志
 *
 * <p>每个推送出去的 {@code step} 事件对应一行，按主键顺序即为步骤顺序。
 * </p>
 */
@Entity
@Table(name = "automation_step", indexes = @Index(name = "idx_step_automation", columnList = "automationId"))
public class AutomationStepEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long automationId;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(length = 2000)
    private String detail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column
    private Long durationMs;

    /**
     * 步骤发生时间（epoch毫秒）
     */
    @Column
    private Long timestampMs;

    public AutomationStepEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getAutomationId() {
        return automationId;
    }

    public void setAutomationId(Long automationId) {
        this.automationId = automationId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public Long getTimestampMs() {
        return timestampMs;
    }

    public void setTimestampMs(Long timestampMs) {
        this.timestampMs = timestampMs;
    }
}

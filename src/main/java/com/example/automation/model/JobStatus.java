package com.example.automation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 自动化任务状态枚举
 *
 * <p>定义任务（以及任务中每个步骤）的所有可能状态：
 * <ul>
 *   <li>PENDING - 任务已提交，等待执行器处理</li>
 *   <li>RUNNING - 执行器正在处理任务</li>
 *   <li>COMPLETED - 任务成功完成（终态）</li>
 *   <li>FAILED - 任务执行失败（终态）</li>
 * </ul>
 * 在JSON中以小写形式传输，例如 {@code "running"}。
 * </p>
 */
public enum JobStatus {
    /**
     * 待处理状态：任务已提交到队列，等待执行器处理
     */
    PENDING,

    /**
     * 运行中状态：执行器正在处理任务
     */
    RUNNING,

    /**
     * 成功状态：任务已成功完成
     */
    COMPLETED,

    /**
     * 失败状态：任务执行失败
     */
    FAILED;

    /**
     * 是否为终态（COMPLETED或FAILED），到达终态后不再有状态变化
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

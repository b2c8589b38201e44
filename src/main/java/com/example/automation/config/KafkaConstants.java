package com.example.automation.config;

/**
 * Kafka主题常量定义
 */
public final class KafkaConstants {

    private KafkaConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 自动化任务队列主题名称
     *
     * <p>提交接口把任务消息发送到此主题，执行器从此主题消费任务。
     * 消息key为任务ID，保证同一任务的消息有序。
     * </p>
     */
    public static final String JOB_TOPIC = "automation-job-topic";
}

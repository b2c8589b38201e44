package com.example.automation.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka配置类
 *
 * <p>配置自动化任务主题，确保主题在应用启动时自动创建。
 * </p>
 */
@Configuration
public class KafkaConfig {

    /**
     * 分区数3，副本数1（单机环境，生产环境建议3）
     */
    @Bean
    public NewTopic automationJobTopic() {
        return TopicBuilder.name(KafkaConstants.JOB_TOPIC)
                .partitions(3)
                .replicas(1)
                .build();
    }
}

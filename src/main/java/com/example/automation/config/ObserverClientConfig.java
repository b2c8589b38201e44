package com.example.automation.config;

import com.example.automation.client.HttpJobStatusClient;
import com.example.automation.client.JobObserverFactory;
import com.example.automation.client.ObserverTransport;
import com.example.automation.client.WebSocketObserverTransport;
import com.example.automation.protocol.MessageCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;

/**
 * 观察者客户端配置
 */
@Configuration
public class ObserverClientConfig {

    /**
     * 重连延迟和轮询共用的调度器
     */
    @Bean
    public TaskScheduler observerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("observer-");
        return scheduler;
    }

    @Bean
    public ObserverTransport observerTransport(ObserverClientProperties properties) {
        return new WebSocketObserverTransport(new StandardWebSocketClient(), URI.create(properties.getWsUrl()));
    }

    @Bean(destroyMethod = "close")
    public HttpJobStatusClient jobStatusSource(ObserverClientProperties properties, ObjectMapper objectMapper) {
        return new HttpJobStatusClient(properties.getStatusBaseUrl(), properties.getPollTimeoutMs(), objectMapper);
    }

    @Bean
    public JobObserverFactory jobObserverFactory(ObserverTransport observerTransport,
                                                 MessageCodec messageCodec,
                                                 @Qualifier("observerTaskScheduler") TaskScheduler scheduler,
                                                 HttpJobStatusClient jobStatusSource,
                                                 ObserverClientProperties properties) {
        return new JobObserverFactory(observerTransport, messageCodec, scheduler,
                jobStatusSource, properties);
    }
}

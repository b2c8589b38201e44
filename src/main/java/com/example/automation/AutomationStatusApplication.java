package com.example.automation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 自动化任务实时状态服务主应用类
 *
 * <p>@EnableScheduling启用定时任务，观察者客户端的重连和轮询都基于TaskScheduler调度。
 * </p>
 */
@SpringBootApplication
@EnableScheduling
public class AutomationStatusApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomationStatusApplication.class, args);
    }
}

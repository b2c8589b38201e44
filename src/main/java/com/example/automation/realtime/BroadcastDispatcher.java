package com.example.automation.realtime;

import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.ErrorEvent;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.protocol.JobStartedEvent;
import com.example.automation.protocol.StatusEvent;
import com.example.automation.protocol.StepEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 广播分发器
 *
 * <p>执行器产生的状态事件经由这里推送到会话注册表。
 * 不缓冲、不重试，尽力而为且最多投递一次；持久化由任务存储负责，
 * 错过推送的观察者通过轮询补齐终态。
 * </p>
 */
@Component
public class BroadcastDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final SessionRegistry sessionRegistry;

    public BroadcastDispatcher(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    /**
     * 推送事件到会话
     *
     * @return 成功投递的连接数
     */
    public int dispatch(String sessionId, StatusEvent event) {
        int delivered = sessionRegistry.broadcast(sessionId, event);
        logger.debug("Dispatched {} to session {} ({} observers)", event.type().tag(), sessionId, delivered);
        return delivered;
    }

    public int jobStarted(String sessionId, long jobId) {
        return dispatch(sessionId, new JobStartedEvent(jobId));
    }

    public int step(String sessionId, long jobId, AutomationStep step) {
        return dispatch(sessionId, new StepEvent(jobId, step));
    }

    public int jobCompleted(String sessionId, JobCompletedEvent event) {
        return dispatch(sessionId, event);
    }

    public int error(String sessionId, String message) {
        return dispatch(sessionId, new ErrorEvent(message));
    }
}

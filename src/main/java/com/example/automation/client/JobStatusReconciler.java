package com.example.automation.client;

import com.example.automation.model.JobStatus;
import com.example.automation.protocol.AutomationStep;
import com.example.automation.protocol.ErrorEvent;
import com.example.automation.protocol.JobCompletedEvent;
import com.example.automation.protocol.JobStartedEvent;
import com.example.automation.protocol.StatusEvent;
import com.example.automation.protocol.StepEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 合并推送和轮询两路状态，得到一个任务的单一视图
 *
 * <p>规则：
 * <ul>
 *   <li>推送尽力而为，轮询按固定间隔执行，直到观察到终态</li>
 *   <li>非终态只前进不后退（PENDING → RUNNING）</li>
 *   <li>第一个到达的终态生效，之后来自任一路的终态都被忽略</li>
 *   <li>轮询失败只表示状态未知，不会被当作任务失败</li>
 *   <li>状态变更和回调在同一把锁内完成，onTerminal之后不会再有onStatus或onStep</li>
 * </ul>
 * </p>
 */
public class JobStatusReconciler {

    private static final Logger logger = LoggerFactory.getLogger(JobStatusReconciler.class);

    private final long jobId;
    private final JobStatusSource statusSource;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final ReconciliationListener listener;

    private final AtomicBoolean terminal = new AtomicBoolean(false);
    private final AtomicReference<JobStatus> currentStatus = new AtomicReference<>(JobStatus.PENDING);
    private final List<AutomationStep> steps = new CopyOnWriteArrayList<>();
    private final CompletableFuture<JobOutcome> completion = new CompletableFuture<>();
    private final Object transitionLock = new Object();

    private volatile ScheduledFuture<?> pollFuture;

    public JobStatusReconciler(long jobId,
                               JobStatusSource statusSource,
                               TaskScheduler scheduler,
                               Duration pollInterval,
                               ReconciliationListener listener) {
        this.jobId = jobId;
        this.statusSource = statusSource;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
        this.listener = listener;
    }

    /**
     * 开始轮询，第一次轮询立即执行
     */
    public synchronized void start() {
        if (terminal.get() || pollFuture != null) {
            return;
        }
        pollFuture = scheduler.scheduleWithFixedDelay(this::pollOnce, pollInterval);
        if (terminal.get()) {
            cancelPolling();
        }
        logger.debug("Polling automation {} every {} ms", jobId, pollInterval.toMillis());
    }

    public void stop() {
        cancelPolling();
    }

    /**
     * 推送通道收到的事件
     */
    public void onEvent(StatusEvent event) {
        switch (event.type()) {
            case JOB_STARTED:
                if (isOwn(((JobStartedEvent) event).jobId())) {
                    advance(JobStatus.RUNNING, StatusSource.PUSH);
                }
                break;
            case STEP:
                StepEvent stepEvent = (StepEvent) event;
                if (isOwn(stepEvent.jobId())) {
                    recordStep(stepEvent.step());
                }
                break;
            case JOB_COMPLETED:
                JobCompletedEvent completed = (JobCompletedEvent) event;
                if (isOwn(completed.jobId())) {
                    complete(new JobOutcome(jobId, completed.terminalStatus(),
                            completed.result(), completed.error(), null), StatusSource.PUSH);
                }
                break;
            case ERROR:
                String message = ((ErrorEvent) event).message();
                logger.warn("Channel reported error for automation {}: {}", jobId, message);
                listener.onChannelError(message);
                break;
            default:
                logger.warn("Unhandled event type {}", event.type());
        }
    }

    /**
     * 执行一次轮询
     */
    public void pollOnce() {
        if (terminal.get()) {
            cancelPolling();
            return;
        }

        Optional<JobSnapshot> snapshot;
        try {
            snapshot = statusSource.fetch(jobId);
        } catch (RuntimeException e) {
            logger.warn("Status of automation {} unknown: {}", jobId, e.getMessage());
            listener.onStatusUnknown(jobId, e);
            return;
        }

        if (snapshot.isEmpty() || snapshot.get().status() == null) {
            logger.debug("No status for automation {} yet", jobId);
            return;
        }

        JobSnapshot current = snapshot.get();
        if (current.status().isTerminal()) {
            complete(new JobOutcome(jobId, current.status(), current.result(),
                    current.error(), current.durationMs()), StatusSource.POLL);
        } else {
            advance(current.status(), StatusSource.POLL);
        }
    }

    public JobStatus getStatus() {
        return currentStatus.get();
    }

    public boolean isTerminal() {
        return terminal.get();
    }

    /**
     * 终态到达时完成的Future
     */
    public CompletableFuture<JobOutcome> completion() {
        return completion;
    }

    public List<AutomationStep> getSteps() {
        return new ArrayList<>(steps);
    }

    private boolean isOwn(long eventJobId) {
        if (eventJobId != jobId) {
            logger.debug("Ignoring event for automation {} while observing {}", eventJobId, jobId);
            return false;
        }
        return true;
    }

    private void recordStep(AutomationStep step) {
        synchronized (transitionLock) {
            if (terminal.get()) {
                return;
            }
            steps.add(step);
            advanceLocked(JobStatus.RUNNING, StatusSource.PUSH);
            listener.onStep(step);
        }
    }

    private void advance(JobStatus status, StatusSource source) {
        synchronized (transitionLock) {
            advanceLocked(status, source);
        }
    }

    private void advanceLocked(JobStatus status, StatusSource source) {
        if (terminal.get()) {
            return;
        }
        JobStatus previous = currentStatus.get();
        if (status.ordinal() > previous.ordinal()) {
            currentStatus.set(status);
            logger.debug("Automation {} status {} -> {} via {}", jobId, previous, status, source);
            listener.onStatus(status, source);
        }
    }

    private void complete(JobOutcome outcome, StatusSource source) {
        synchronized (transitionLock) {
            if (!terminal.compareAndSet(false, true)) {
                logger.debug("Ignoring terminal status {} for automation {} from {}, already terminal",
                        outcome.status(), jobId, source);
                return;
            }
            currentStatus.set(outcome.status());
            cancelPolling();
            logger.info("Automation {} reached {} via {}", jobId, outcome.status(), source);
            completion.complete(outcome);
            listener.onTerminal(outcome, source);
        }
    }

    private void cancelPolling() {
        ScheduledFuture<?> future = pollFuture;
        if (future != null) {
            future.cancel(false);
        }
    }
}

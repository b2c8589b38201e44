package com.example.automation.client;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 手动推进时间的调度器，任务只在 {@link #advance(Duration)} 时于调用线程执行
 */
class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<ManualFuture> tasks = new ArrayList<>();

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        return add(task, startTime, null);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        return add(task, startTime, period);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return add(task, clock.instant(), period);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        return add(task, startTime, delay);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        return add(task, clock.instant(), delay);
    }

    /**
     * 推进时间并按到期顺序执行任务
     */
    void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            ManualFuture next = nextDue(target);
            if (next == null) {
                break;
            }
            clock.set(next.dueAt);
            if (next.period == null) {
                synchronized (this) {
                    tasks.remove(next);
                }
                next.done = true;
                next.task.run();
            } else {
                next.dueAt = next.dueAt.plus(next.period);
                next.task.run();
            }
        }
        clock.set(target);
    }

    /**
     * 执行已经到期的任务，不推进时间
     */
    void runDue() {
        advance(Duration.ZERO);
    }

    synchronized int pendingCount() {
        int count = 0;
        for (ManualFuture future : tasks) {
            if (!future.cancelled) {
                count++;
            }
        }
        return count;
    }

    private synchronized ManualFuture nextDue(Instant target) {
        tasks.removeIf(future -> future.cancelled);
        return tasks.stream()
                .filter(future -> !future.dueAt.isAfter(target))
                .min((a, b) -> a.dueAt.compareTo(b.dueAt))
                .orElse(null);
    }

    private synchronized ManualFuture add(Runnable task, Instant startTime, Duration period) {
        ManualFuture future = new ManualFuture(task, startTime, period);
        tasks.add(future);
        return future;
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Duration period;
        private Instant dueAt;
        private volatile boolean cancelled;
        private volatile boolean done;

        ManualFuture(Runnable task, Instant dueAt, Duration period) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), dueAt).toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant instant) {
            this.now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

package com.intteq.payment.messaging.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link DelayScheduler} backed by a single daemon {@link ScheduledExecutorService}.
 */
@Slf4j
public class ExecutorDelayScheduler implements DelayScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorDelayScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        try {
            executor.schedule(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Scheduled messaging task failed", e);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler is shut down, task dropped (delay={}ms)", delay.toMillis());
        }
    }

    @Override
    public void close() {
        List<Runnable> pending = executor.shutdownNow();
        if (!pending.isEmpty()) {
            log.warn("Messaging scheduler stopped with {} pending task(s) dropped", pending.size());
        }
    }
}

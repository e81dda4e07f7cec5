package com.intteq.payment.messaging.retry;

import java.time.Duration;

/**
 * Runs a task once after a delay.
 *
 * <p>Both the reconnect loop and delayed retry republishing go through this seam so that
 * their timing can be driven by a manual scheduler in tests.
 */
public interface DelayScheduler extends AutoCloseable {

    /**
     * Schedule {@code task} to run once after {@code delay}.
     */
    void schedule(Runnable task, Duration delay);

    /**
     * Stop accepting tasks and drop pending ones.
     */
    @Override
    void close();
}

package com.products.scraper.render.playwright;

import com.products.scraper.exception.ScrapeTimeoutException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialises calls into one Playwright instance.
 * <p>
 * Playwright objects are not thread safe, so a session and all of its pages
 * share one fair lock. A caller never waits for the lock longer than what is
 * left of its own step budget: when the deadline passes first, the step
 * fails with {@link ScrapeTimeoutException}.
 * </p>
 */
final class ApiLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * @param timeout step budget starting now
     * @return the {@link System#nanoTime()} deadline of the step
     */
    static long deadline(final Duration timeout) {
        return System.nanoTime() + timeout.toNanos();
    }

    /**
     * @param deadline       step deadline from {@link #deadline(Duration)}
     * @param timeoutMessage message of the exception thrown once the deadline has passed
     * @return whole milliseconds left before {@code deadline}, at least 1
     */
    static long remainingMillis(final long deadline, final String timeoutMessage) {
        long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remaining <= 0) {
            throw new ScrapeTimeoutException(timeoutMessage);
        }
        return remaining;
    }

    /**
     * Runs {@code call} holding the lock, waiting for it no later than {@code deadline}.
     */
    <T> T call(final long deadline, final String timeoutMessage, final Supplier<T> call) {
        acquire(deadline, timeoutMessage);
        try {
            return call.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code task} holding the lock, however long that takes. Only for cleanup.
     */
    void runExclusive(final Runnable task) {
        lock.lock();
        try {
            task.run();
        } finally {
            lock.unlock();
        }
    }

    private void acquire(final long deadline, final String timeoutMessage) {
        long remaining = deadline - System.nanoTime();
        boolean acquired;
        try {
            acquired = remaining > 0 && lock.tryLock(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ScrapeTimeoutException(timeoutMessage + " (interrupted)", ex);
        }
        if (!acquired) {
            throw new ScrapeTimeoutException(timeoutMessage);
        }
    }
}

package com.blocksub.head;

import com.blocksub.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Serialises push (re)connection. The first caller becomes the leader and connects; callers arriving while
 * the leader is in flight wait for it to finish and return without connecting themselves.
 */
@Slf4j
public class ReconnectGuard {

    /** One physical connect; closes any previous connection first. */
    @FunctionalInterface
    public interface Connector {
        void connect();
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition finished = lock.newCondition();
    private final Connector connector;
    private final RetryPolicy retryPolicy;
    private final BooleanSupplier active;
    private final BlockSubMetrics metrics;

    private boolean connecting;
    private long generation;

    public ReconnectGuard(Connector connector, RetryPolicy retryPolicy, BooleanSupplier active, BlockSubMetrics metrics) {
        this.connector = connector;
        this.retryPolicy = retryPolicy;
        this.active = active;
        this.metrics = metrics;
    }

    /**
     * Connects, or waits for the connect already in progress.
     *
     * @param retryForever retry with backoff until connected or no longer active; otherwise the first failure
     *                     is thrown to the caller
     * @return true if this caller performed the attempt, false if it waited for another caller's attempt
     */
    public boolean attempt(boolean retryForever) throws InterruptedException {
        lock.lock();
        try {
            if (connecting) {
                long awaited = generation;
                while (generation == awaited) {
                    finished.await();
                }
                return false;
            }
            connecting = true;
        } finally {
            lock.unlock();
        }
        try {
            connectAsLeader(retryForever);
            return true;
        } finally {
            lock.lock();
            try {
                connecting = false;
                generation++;
                finished.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void connectAsLeader(boolean retryForever) throws InterruptedException {
        int attempt = 0;
        while (active.getAsBoolean()) {
            metrics.reconnectAttempt();
            try {
                connector.connect();
                return;
            } catch (RuntimeException e) {
                metrics.reconnectFailure();
                if (!retryForever) {
                    throw e;
                }
                Duration delay = retryPolicy.delay(attempt++);
                log.error("Websocket connection failed (attempt {}), retrying in {} ms: {}", attempt, delay.toMillis(), e.getMessage());
                Thread.sleep(delay.toMillis());
            }
        }
        log.info("Reconnect abandoned, BlockSub no longer running");
    }

    public boolean isConnecting() {
        lock.lock();
        try {
            return connecting;
        } finally {
            lock.unlock();
        }
    }
}

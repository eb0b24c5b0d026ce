package com.blocksub.head;

import com.blocksub.domain.BlockHeader;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Consumer handle for new heads. Headers are handed over only to a consumer that is currently waiting in
 * {@link #take()} or {@link #poll(Duration)}; a header published while nobody waits is dropped for this
 * subscription. Receives until {@link #unsubscribe()} is called, its cancel signal completes or BlockSub stops.
 */
public class Subscription {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<BlockHeader> handedOff = new ArrayDeque<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final Consumer<Subscription> onClose;

    private int waiting;
    private boolean closed;

    Subscription(Consumer<Subscription> onClose) {
        this.onClose = onClose;
    }

    /**
     * Non-blocking hand-off. Returns false if no consumer is waiting or the subscription is closed.
     */
    boolean offer(BlockHeader header) {
        lock.lock();
        try {
            if (closed || waiting <= handedOff.size()) {
                return false;
            }
            handedOff.addLast(header);
            available.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next header.
     *
     * @return the header, or null once the subscription is closed
     */
    public BlockHeader take() throws InterruptedException {
        lock.lock();
        try {
            waiting++;
            try {
                while (handedOff.isEmpty() && !closed) {
                    available.await();
                }
            } catch (InterruptedException e) {
                passOnPendingHeader();
                throw e;
            } finally {
                waiting--;
            }
            return handedOff.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits at most {@code timeout} for the next header.
     *
     * @return the header, or null on timeout or once the subscription is closed
     */
    public BlockHeader poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            waiting++;
            try {
                while (handedOff.isEmpty() && !closed && nanos > 0) {
                    nanos = available.awaitNanos(nanos);
                }
            } catch (InterruptedException e) {
                passOnPendingHeader();
                throw e;
            } finally {
                waiting--;
            }
            return handedOff.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock; a header handed to an interrupted waiter goes to the next one
    private void passOnPendingHeader() {
        if (!handedOff.isEmpty()) {
            available.signal();
        }
    }

    /**
     * Stops the subscription and wakes blocked consumers. Safe to call repeatedly and concurrently;
     * only the first call closes.
     */
    public void unsubscribe() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        done.complete(null);
        lock.lock();
        try {
            closed = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }

    /** Completes when the subscription is closed. */
    public CompletionStage<Void> done() {
        return done.minimalCompletionStage();
    }

    public boolean isClosed() {
        return stopped.get();
    }

    /** Unsubscribes as soon as {@code cancelSignal} completes, normally or exceptionally. */
    void bindTo(CompletionStage<?> cancelSignal) {
        cancelSignal.whenComplete((ignored, error) -> unsubscribe());
    }

    static Subscription closedSubscription() {
        Subscription subscription = new Subscription(s -> { });
        subscription.unsubscribe();
        return subscription;
    }
}

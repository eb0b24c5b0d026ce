package com.blocksub.head;

import com.blocksub.domain.BlockHeader;
import com.blocksub.ingestion.adapter.HeadStream;
import com.blocksub.ingestion.adapter.NewHeadsSubscriber;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Owns the current push connection and its receive subscription. Headers go to the merge loop; a stream
 * error or no header within {@code subscriptionTimeout} fires {@code onStreamFailure}; clean completion ends quietly.
 */
@Slf4j
public class NewHeadsReceiver implements AutoCloseable {

    private final NewHeadsSubscriber subscriber;
    private final HeadReconciler reconciler;
    private final Duration subscriptionTimeout;
    private final boolean debugOutput;
    private final Scheduler deliveryScheduler;
    private final Runnable onStreamFailure;

    private volatile BlockHeader latestHeader;
    private volatile boolean closed;
    private HeadStream stream;
    private Disposable receiving;

    public NewHeadsReceiver(NewHeadsSubscriber subscriber, HeadReconciler reconciler, Duration subscriptionTimeout,
                            boolean debugOutput, Scheduler deliveryScheduler, Runnable onStreamFailure) {
        this.subscriber = subscriber;
        this.reconciler = reconciler;
        this.subscriptionTimeout = subscriptionTimeout;
        this.debugOutput = debugOutput;
        this.deliveryScheduler = deliveryScheduler;
        this.onStreamFailure = onStreamFailure;
    }

    /**
     * Closes the current connection, opens a new one and starts receiving on it.
     *
     * @throws com.blocksub.ingestion.adapter.RpcException if the new connection cannot be established
     */
    public void connect() {
        closeCurrent();
        HeadStream next = subscriber.subscribeNewHeads();
        synchronized (this) {
            if (closed) {
                next.close();
                return;
            }
            stream = next;
            latestHeader = null;
            receiving = next.headers()
                    .timeout(subscriptionTimeout)
                    .publishOn(deliveryScheduler)
                    .subscribe(this::onHeader, error -> onStreamError(next, error), () -> log.debug("newHeads stream completed"));
        }
        log.info("newHeads subscription established");
    }

    private void onHeader(BlockHeader header) {
        latestHeader = header;
        if (debugOutput) {
            log.debug("Subscription header number={} hash={}", header.numberAsString(), header.hash());
        }
        try {
            reconciler.submit(header);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Failure of {@code source}; ignored once {@code source} is no longer the current stream. */
    void onStreamError(HeadStream source, Throwable error) {
        synchronized (this) {
            if (closed || stream != source) {
                log.debug("Ignoring failure of a replaced newHeads stream: {}", error.getMessage());
                return;
            }
        }
        if (error instanceof TimeoutException) {
            log.error("No header received within {} ms, reconnecting", subscriptionTimeout.toMillis());
        } else {
            log.error("newHeads subscription failed, reconnecting: {}", error.getMessage());
        }
        onStreamFailure.run();
    }

    synchronized HeadStream currentStream() {
        return stream;
    }

    /** Latest header received on the current connection, or null if none yet. */
    public BlockHeader getLatestHeader() {
        return latestHeader;
    }

    public synchronized boolean isConnected() {
        return stream != null;
    }

    private synchronized void closeCurrent() {
        if (receiving != null) {
            receiving.dispose();
            receiving = null;
        }
        if (stream != null) {
            stream.close();
            stream = null;
        }
    }

    @Override
    public void close() {
        closed = true;
        closeCurrent();
    }
}

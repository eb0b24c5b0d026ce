package com.blocksub.head;

import com.blocksub.domain.BlockHeader;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Merge loop: the single consumer of headers from both sources and the only writer of the current head.
 * A header is accepted iff its number is not below the current one and its hash differs, so a same-height
 * header with a new hash (reorg) passes while an older header from a lagging source is dropped.
 */
@Slf4j
public class HeadReconciler implements Runnable {

    private static final long SUBMIT_RECHECK_MS = 200;

    private final SynchronousQueue<BlockHeader> mergeQueue = new SynchronousQueue<>();
    private final SubscriberRegistry registry;
    private final BlockSubMetrics metrics;
    private final boolean debugOutput;

    private volatile BlockHeader current;
    private volatile boolean closed;

    public HeadReconciler(SubscriberRegistry registry, BlockSubMetrics metrics, boolean debugOutput) {
        this.registry = registry;
        this.metrics = metrics;
        this.debugOutput = debugOutput;
    }

    /**
     * Hands a header to the merge loop, waiting until the loop takes it.
     *
     * @return false if the reconciler was closed before the header was taken
     */
    public boolean submit(BlockHeader header) throws InterruptedException {
        while (!closed) {
            if (mergeQueue.offer(header, SUBMIT_RECHECK_MS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void run() {
        log.debug("Merge loop started");
        try {
            while (!closed) {
                BlockHeader header = mergeQueue.poll(SUBMIT_RECHECK_MS, TimeUnit.MILLISECONDS);
                if (header != null) {
                    reconcile(header);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Merge loop stopped");
    }

    /**
     * Applies the acceptance rule and fans out accepted headers. Called only from the merge loop (and tests).
     *
     * @return true if the header became the current head
     */
    boolean reconcile(BlockHeader header) {
        BlockHeader head = current;
        if (head != null && (!header.isAtOrAbove(head) || header.hash().equals(head.hash()))) {
            return false;
        }
        current = header;
        metrics.recordHead(header.number());
        int delivered = registry.publish(header);
        if (debugOutput) {
            log.debug("New head number={} hash={} delivered={}", header.numberAsString(), header.hash(), delivered);
        }
        return true;
    }

    public Optional<BlockHeader> getCurrent() {
        return Optional.ofNullable(current);
    }

    /** Ends the merge loop and releases producers waiting in {@link #submit(BlockHeader)}. */
    public void close() {
        closed = true;
    }
}

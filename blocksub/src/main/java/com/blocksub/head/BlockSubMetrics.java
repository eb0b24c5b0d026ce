package com.blocksub.head;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for head tracking. Recording never blocks and never throws into the caller.
 */
public class BlockSubMetrics {

    public static final String REASON_LAG = "lag";
    public static final String REASON_STREAM = "stream";

    private final AtomicLong latestBlockNumber = new AtomicLong();
    private final Counter pollFailures;
    private final Counter reconnectAttempts;
    private final Counter reconnectFailures;
    private final Counter forcedByLag;
    private final Counter forcedByStream;

    public BlockSubMetrics(MeterRegistry registry) {
        Gauge.builder("blocksub.latest.block.number", latestBlockNumber, n -> unsignedToDouble(n.get()))
                .description("Number of the latest accepted head")
                .register(registry);
        pollFailures = Counter.builder("blocksub.poll.failures")
                .description("Failed polls of the latest header")
                .register(registry);
        reconnectAttempts = Counter.builder("blocksub.reconnect.attempts")
                .description("Websocket (re)connect attempts")
                .register(registry);
        reconnectFailures = Counter.builder("blocksub.reconnect.failures")
                .description("Failed websocket (re)connect attempts")
                .register(registry);
        forcedByLag = forcedCounter(registry, REASON_LAG);
        forcedByStream = forcedCounter(registry, REASON_STREAM);
    }

    private static Counter forcedCounter(MeterRegistry registry, String reason) {
        return Counter.builder("blocksub.reconnect.forced")
                .description("Reconnects triggered by push lag or by stream failure/timeout")
                .tag("reason", reason)
                .register(registry);
    }

    public void recordHead(long blockNumber) {
        latestBlockNumber.set(blockNumber);
    }

    public void pollFailure() {
        pollFailures.increment();
    }

    public void reconnectAttempt() {
        reconnectAttempts.increment();
    }

    public void reconnectFailure() {
        reconnectFailures.increment();
    }

    public void forcedReconnect(String reason) {
        if (REASON_LAG.equals(reason)) {
            forcedByLag.increment();
        } else {
            forcedByStream.increment();
        }
    }

    /** Block numbers are unsigned 64-bit; values at or above 2^63 are negative as a signed long. */
    static double unsignedToDouble(long value) {
        if (value >= 0) {
            return value;
        }
        return (double) (value >>> 1) * 2.0 + (value & 1);
    }

    public long latestBlockNumber() {
        return latestBlockNumber.get();
    }
}

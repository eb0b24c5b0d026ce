package com.blocksub.head.config;

import com.blocksub.common.RetryPolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Head tracking settings: poll interval, push staleness timeout and lag threshold, reconnect backoff.
 * Documented in application.yml.
 */
@ConfigurationProperties(prefix = "blocksub")
@NoArgsConstructor
@Getter
@Setter
public class BlockSubProperties {

    /** Delay between polls of the latest header. Default 10s (8,640 requests per day). */
    private long pollIntervalMs = 10_000L;

    /** Reconnect the websocket when no header arrives for this long. Default 60s. */
    private long subscriptionTimeoutMs = 60_000L;

    /** Force a websocket reconnect when its latest header is more than this many blocks behind the polled one. */
    private long staleLagBlocks = 2L;

    /** Debug-log every polled, pushed and accepted header. */
    private boolean debugOutput;

    /** Start BlockSub when the application starts. */
    private boolean autostart = true;

    /** Subscribe once on startup and log every new head. */
    private boolean logHeaders = true;

    private Reconnect reconnect = new Reconnect();

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect != null ? reconnect : new Reconnect();
    }

    /**
     * Backoff between websocket reconnect attempts (exponential, capped, ± jitter).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Reconnect {

        private long baseDelayMs = 500L;
        private long maxDelayMs = 30_000L;
        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
        private double jitterFactor = 0.2;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(baseDelayMs, maxDelayMs, jitterFactor);
        }
    }
}

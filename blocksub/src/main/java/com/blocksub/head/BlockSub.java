package com.blocksub.head;

import com.blocksub.domain.BlockHeader;
import com.blocksub.head.config.BlockSubProperties;
import com.blocksub.ingestion.adapter.HeaderFetcher;
import com.blocksub.ingestion.adapter.NewHeadsSubscriber;
import com.blocksub.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks the chain head from a polled HTTP source, a websocket newHeads subscription, or both, and republishes
 * every new head to its subscriptions.
 * <p>
 * Lifecycle: constructed (idle, no threads) → {@link #start()} → {@link #stop()} (terminal). Either source may be
 * null when not configured, but not both. The only error reported to callers is the one thrown by {@code start()};
 * afterwards poll failures and broken subscriptions are logged and recovered internally.
 */
@Slf4j
public class BlockSub {

    private static final int WORKER_THREADS = 4;

    private final HeaderFetcher headerFetcher;
    private final NewHeadsSubscriber newHeadsSubscriber;
    private final BlockSubProperties properties;
    private final BlockSubMetrics metrics;
    private final SubscriberRegistry registry = new SubscriberRegistry();
    private final HeadReconciler reconciler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean reconnectPending = new AtomicBoolean(false);

    private volatile ThreadPoolTaskExecutor workers;
    private volatile ThreadPoolTaskScheduler pollScheduler;
    private volatile Scheduler deliveryScheduler;
    private volatile NewHeadsReceiver receiver;
    private volatile ReconnectGuard reconnectGuard;

    public BlockSub(HeaderFetcher headerFetcher, NewHeadsSubscriber newHeadsSubscriber,
                    BlockSubProperties properties, BlockSubMetrics metrics) {
        this.headerFetcher = headerFetcher;
        this.newHeadsSubscriber = newHeadsSubscriber;
        this.properties = properties;
        this.metrics = metrics;
        this.reconciler = new HeadReconciler(registry, metrics, properties.isDebugOutput());
    }

    /**
     * Starts the merge loop, connects the websocket subscription (if configured) and performs a first poll
     * (if configured) before scheduling periodic polling. On failure everything already started is stopped
     * and the instance cannot be restarted.
     *
     * @throws RpcException          if the subscription cannot be established or the first poll fails
     * @throws IllegalStateException if no source is configured, or BlockSub was already started or stopped
     */
    public void start() {
        if (headerFetcher == null && newHeadsSubscriber == null) {
            throw new IllegalStateException("No header source configured (set blocksub.rpc.http-url and/or blocksub.rpc.ws-url)");
        }
        if (stopped.get()) {
            throw new IllegalStateException("BlockSub is stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("BlockSub already started");
        }
        workers = newWorkers();
        workers.execute(reconciler);
        try {
            if (newHeadsSubscriber != null) {
                startSubscription();
            }
            if (headerFetcher != null) {
                startPolling();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new RpcException("Interrupted while starting BlockSub", e);
        } catch (RuntimeException e) {
            log.error("BlockSub start failed: {}", e.getMessage());
            stop();
            throw e;
        }
        if (stopped.get()) {
            // stop() ran while starting, possibly before every resource was assigned
            release();
            return;
        }
        log.info("BlockSub started (polling={}, subscription={})", headerFetcher != null, newHeadsSubscriber != null);
    }

    private void startSubscription() throws InterruptedException {
        deliveryScheduler = Schedulers.newSingle("blocksub-push", true);
        receiver = new NewHeadsReceiver(
                newHeadsSubscriber,
                reconciler,
                Duration.ofMillis(properties.getSubscriptionTimeoutMs()),
                properties.isDebugOutput(),
                deliveryScheduler,
                () -> triggerReconnect(BlockSubMetrics.REASON_STREAM));
        reconnectGuard = new ReconnectGuard(receiver::connect, properties.getReconnect().toRetryPolicy(), this::isRunning, metrics);
        reconnectGuard.attempt(false);
    }

    private void startPolling() throws InterruptedException {
        BlockHeader first = headerFetcher.fetchLatestHeader();
        log.info("Polling started, latest block {}", first.numberAsString());
        reconciler.submit(first);
        Duration interval = Duration.ofMillis(properties.getPollIntervalMs());
        ThreadPoolTaskScheduler scheduler = newPollScheduler();
        scheduler.scheduleWithFixedDelay(this::pollOnce, Instant.now().plus(interval), interval);
        pollScheduler = scheduler;
    }

    /** One poll cycle: fetch, hand to the merge loop, then check whether the subscription lags behind. */
    void pollOnce() {
        BlockHeader header;
        try {
            header = headerFetcher.fetchLatestHeader();
        } catch (RuntimeException e) {
            metrics.pollFailure();
            log.error("Polling latest block failed: {}", e.getMessage());
            return;
        }
        if (properties.isDebugOutput()) {
            log.debug("Polled header number={} hash={}", header.numberAsString(), header.hash());
        }
        try {
            if (!reconciler.submit(header)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        checkSubscriptionLag(header);
    }

    private void checkSubscriptionLag(BlockHeader polled) {
        NewHeadsReceiver r = receiver;
        if (r == null) {
            return;
        }
        BlockHeader pushed = r.getLatestHeader();
        if (pushed != null && Long.compareUnsigned(pushed.number() + properties.getStaleLagBlocks(), polled.number()) < 0) {
            log.warn("Forcing websocket reconnect from polling: wsBlockNum={} pollBlockNum={}",
                    pushed.numberAsString(), polled.numberAsString());
            triggerReconnect(BlockSubMetrics.REASON_LAG);
        }
    }

    /**
     * Reconnects the subscription on a worker thread. At most one reconnect task is pending at a time; triggers
     * arriving while it is queued or running are folded into it.
     */
    void triggerReconnect(String reason) {
        if (!isRunning() || reconnectGuard == null) {
            return;
        }
        if (!reconnectPending.compareAndSet(false, true)) {
            log.debug("Reconnect ({}) already pending", reason);
            return;
        }
        metrics.forcedReconnect(reason);
        try {
            workers.execute(() -> {
                try {
                    reconnectGuard.attempt(true);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    reconnectPending.set(false);
                }
            });
        } catch (TaskRejectedException e) {
            reconnectPending.set(false);
            log.debug("Reconnect ({}) not scheduled, BlockSub is stopping", reason);
        }
    }

    /** Subscription that lives until {@link Subscription#unsubscribe()} or {@link #stop()}. */
    public Subscription subscribe() {
        return registry.register(null);
    }

    /**
     * Subscription that additionally ends when {@code cancelSignal} completes. After {@link #stop()} the returned
     * subscription is already closed.
     */
    public Subscription subscribe(CompletionStage<?> cancelSignal) {
        return registry.register(Objects.requireNonNull(cancelSignal, "cancelSignal"));
    }

    /**
     * Stops polling and the subscription, closes every live subscription and releases the websocket connection.
     * Idempotent; callable from any thread, including a subscription's cancel callback.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("BlockSub stopping");
        release();
    }

    private void release() {
        reconciler.close();
        if (pollScheduler != null) {
            pollScheduler.shutdown();
        }
        if (receiver != null) {
            receiver.close();
        }
        if (deliveryScheduler != null) {
            deliveryScheduler.dispose();
        }
        if (workers != null) {
            workers.shutdown();
        }
        registry.closeAll();
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public Optional<BlockHeader> getCurrentHeader() {
        return reconciler.getCurrent();
    }

    /** Number of the current head, 0 before the first header. */
    public long getCurrentBlockNumber() {
        return reconciler.getCurrent().map(BlockHeader::number).orElse(0L);
    }

    /** Hash of the current head, empty before the first header. */
    public String getCurrentBlockHash() {
        return reconciler.getCurrent().map(BlockHeader::hash).orElse("");
    }

    int subscriberCount() {
        return registry.size();
    }

    ReconnectGuard reconnectGuard() {
        return reconnectGuard;
    }

    private static ThreadPoolTaskExecutor newWorkers() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(WORKER_THREADS);
        e.setMaxPoolSize(WORKER_THREADS);
        e.setThreadNamePrefix("blocksub-worker-");
        e.setDaemon(true);
        e.initialize();
        return e;
    }

    private static ThreadPoolTaskScheduler newPollScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("blocksub-poll-");
        s.setDaemon(true);
        s.initialize();
        return s;
    }
}

package com.blocksub.head;

import com.blocksub.domain.BlockHeader;
import com.blocksub.ingestion.adapter.HeadStream;
import com.blocksub.ingestion.adapter.RpcException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class NewHeadsReceiverTest {

    private final FakeNewHeadsSubscriber subscriber = new FakeNewHeadsSubscriber();
    private final AtomicInteger failures = new AtomicInteger();
    private HeadReconciler reconciler;
    private ExecutorService mergeLoop;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        reconciler = new HeadReconciler(new SubscriberRegistry(), new BlockSubMetrics(new SimpleMeterRegistry()), true);
        mergeLoop = Executors.newSingleThreadExecutor();
        mergeLoop.execute(reconciler);
        scheduler = Schedulers.newSingle("test-push", true);
    }

    @AfterEach
    void tearDown() {
        reconciler.close();
        mergeLoop.shutdownNow();
        scheduler.dispose();
    }

    private NewHeadsReceiver receiver(Duration timeout) {
        return new NewHeadsReceiver(subscriber, reconciler, timeout, true, scheduler, failures::incrementAndGet);
    }

    @Test
    void connect_pushedHeader_reachesMergeLoop() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofSeconds(30));
        receiver.connect();

        subscriber.current().push(BlockHeader.of(42, "0x42"));

        awaitTrue(() -> reconciler.getCurrent().isPresent());
        assertThat(reconciler.getCurrent()).contains(BlockHeader.of(42, "0x42"));
        assertThat(receiver.getLatestHeader()).isEqualTo(BlockHeader.of(42, "0x42"));
        assertThat(receiver.isConnected()).isTrue();
        receiver.close();
    }

    @Test
    void streamError_firesFailureCallback() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofSeconds(30));
        receiver.connect();

        subscriber.current().fail("websocket closed by peer");

        awaitTrue(() -> failures.get() == 1);
        receiver.close();
    }

    @Test
    void noHeaderWithinTimeout_firesFailureCallback() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofMillis(50));
        receiver.connect();

        awaitTrue(() -> failures.get() >= 1);
        receiver.close();
    }

    @Test
    void cleanCompletion_doesNotReconnect() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofMillis(200));
        receiver.connect();

        subscriber.current().close();
        Thread.sleep(400);

        assertThat(failures.get()).isZero();
        receiver.close();
    }

    @Test
    void connect_again_closesPreviousStreamAndResetsLatest() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofSeconds(30));
        receiver.connect();
        subscriber.current().push(BlockHeader.of(1, "0x01"));
        awaitTrue(() -> receiver.getLatestHeader() != null);
        FakeNewHeadsSubscriber.FakeStream first = subscriber.current();

        receiver.connect();

        assertThat(first.closed).isTrue();
        assertThat(subscriber.connects()).isEqualTo(2);
        assertThat(receiver.getLatestHeader()).isNull();
        assertThat(failures.get()).isZero();
        receiver.close();
    }

    @Test
    void close_thenStreamError_isIgnored() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofSeconds(30));
        receiver.connect();
        FakeNewHeadsSubscriber.FakeStream stream = subscriber.current();

        receiver.close();
        stream.fail("late failure");
        Thread.sleep(100);

        assertThat(stream.closed).isTrue();
        assertThat(receiver.isConnected()).isFalse();
        assertThat(failures.get()).isZero();
    }

    @Test
    void failureOfReplacedStream_isIgnored() throws Exception {
        NewHeadsReceiver receiver = receiver(Duration.ofSeconds(30));
        receiver.connect();
        HeadStream first = receiver.currentStream();
        receiver.connect();

        receiver.onStreamError(first, new RpcException("late failure of the old connection"));
        assertThat(failures.get()).isZero();

        receiver.onStreamError(receiver.currentStream(), new RpcException("current connection failed"));
        assertThat(failures.get()).isEqualTo(1);
        receiver.close();
    }

    static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}

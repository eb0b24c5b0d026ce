package com.blocksub.head;

import com.blocksub.domain.BlockHeader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HeadReconcilerTest {

    private SimpleMeterRegistry meterRegistry;
    private HeadReconciler reconciler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciler = new HeadReconciler(new SubscriberRegistry(), new BlockSubMetrics(meterRegistry), false);
    }

    @Test
    void reconcile_firstHeader_accepted() {
        assertThat(reconciler.getCurrent()).isEmpty();

        assertThat(reconciler.reconcile(BlockHeader.of(0, "0x00"))).isTrue();

        assertThat(reconciler.getCurrent()).contains(BlockHeader.of(0, "0x00"));
    }

    @Test
    void reconcile_higherNumber_acceptedAndGaugeUpdated() {
        reconciler.reconcile(BlockHeader.of(100, "0xa1"));

        assertThat(reconciler.reconcile(BlockHeader.of(101, "0xa2"))).isTrue();

        assertThat(meterRegistry.get("blocksub.latest.block.number").gauge().value()).isEqualTo(101.0);
    }

    @Test
    @DisplayName("same height with a different hash is a reorg and is accepted")
    void reconcile_sameHeightNewHash_accepted() {
        reconciler.reconcile(BlockHeader.of(100, "0xa1"));

        assertThat(reconciler.reconcile(BlockHeader.of(100, "0xb1"))).isTrue();
        assertThat(reconciler.getCurrent().orElseThrow().hash()).isEqualTo("0xb1");
    }

    @Test
    void reconcile_duplicate_rejected() {
        reconciler.reconcile(BlockHeader.of(100, "0xa1"));

        assertThat(reconciler.reconcile(BlockHeader.of(100, "0xA1"))).isFalse();
    }

    @Test
    void reconcile_lowerNumber_rejectedEvenWithNewHash() {
        reconciler.reconcile(BlockHeader.of(100, "0xa1"));
        reconciler.reconcile(BlockHeader.of(100, "0xb1"));

        assertThat(reconciler.reconcile(BlockHeader.of(99, "0xc1"))).isFalse();
        assertThat(reconciler.getCurrent().orElseThrow().number()).isEqualTo(100L);
    }

    @Test
    @DisplayName("after advancing past a height, a new hash at that old height is rejected")
    void reconcile_reorgAtOlderHeightAfterAdvance_rejected() {
        assertThat(reconciler.reconcile(BlockHeader.of(100, "0xaa"))).isTrue();
        assertThat(reconciler.reconcile(BlockHeader.of(101, "0xbb"))).isTrue();

        assertThat(reconciler.reconcile(BlockHeader.of(100, "0xcc"))).isFalse();
        assertThat(reconciler.getCurrent()).contains(BlockHeader.of(101, "0xbb"));
    }

    @Test
    void reconcile_sequence_acceptsOnlyAdvancingOrReorgedHeads() {
        int accepted = 0;
        for (BlockHeader h : new BlockHeader[]{
                BlockHeader.of(5, "0x05"), BlockHeader.of(5, "0x05"), BlockHeader.of(4, "0x04"),
                BlockHeader.of(6, "0x06"), BlockHeader.of(6, "0x6b"), BlockHeader.of(6, "0x6b")}) {
            if (reconciler.reconcile(h)) {
                accepted++;
            }
        }
        assertThat(accepted).isEqualTo(3);
        assertThat(reconciler.getCurrent().orElseThrow().hash()).isEqualTo("0x6b");
    }

    @Test
    void submit_mergeLoopRunning_headerBecomesCurrent() throws Exception {
        ExecutorService loop = Executors.newSingleThreadExecutor();
        try {
            loop.execute(reconciler);
            assertThat(reconciler.submit(BlockHeader.of(3, "0x03"))).isTrue();

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (reconciler.getCurrent().isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertThat(reconciler.getCurrent()).contains(BlockHeader.of(3, "0x03"));
        } finally {
            reconciler.close();
            loop.shutdownNow();
        }
    }

    @Test
    void submit_afterClose_returnsFalseWithoutBlocking() throws Exception {
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> submitted = producer.submit(() -> reconciler.submit(BlockHeader.of(1, "0x01")));
            Thread.sleep(50);
            reconciler.close();

            assertThat(submitted.get(5, TimeUnit.SECONDS)).isFalse();
        } finally {
            producer.shutdownNow();
        }
    }
}

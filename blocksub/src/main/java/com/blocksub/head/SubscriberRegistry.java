package com.blocksub.head;

import com.blocksub.domain.BlockHeader;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live subscriptions and fan-out. Registration and close-all are serialised by a lock; fan-out iterates a
 * copy-on-write snapshot and never blocks on a subscriber.
 */
public class SubscriberRegistry {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();
    private boolean closed;

    /**
     * New subscription, bound to {@code cancelSignal} when given. Returns an already-closed subscription
     * once {@link #closeAll()} has run.
     */
    public Subscription register(CompletionStage<?> cancelSignal) {
        Subscription subscription = new Subscription(this::remove);
        synchronized (lock) {
            if (closed) {
                subscription.unsubscribe();
                return subscription;
            }
            subscriptions.add(subscription);
        }
        if (cancelSignal != null) {
            subscription.bindTo(cancelSignal);
        }
        return subscription;
    }

    /**
     * Hands {@code header} to every subscriber that is waiting for one.
     *
     * @return number of subscribers that received it
     */
    public int publish(BlockHeader header) {
        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            if (subscription.offer(header)) {
                delivered++;
            }
        }
        return delivered;
    }

    /** Closes every live subscription and rejects new ones. */
    public void closeAll() {
        List<Subscription> snapshot;
        synchronized (lock) {
            closed = true;
            snapshot = List.copyOf(subscriptions);
        }
        snapshot.forEach(Subscription::unsubscribe);
    }

    public int size() {
        return subscriptions.size();
    }

    private void remove(Subscription subscription) {
        subscriptions.remove(subscription);
    }
}

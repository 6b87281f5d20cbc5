/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.memory;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.exception.MessageSourceException;
import com.subingest.messaging.core.MessageHandler;
import com.subingest.messaging.core.ReceiveSettings;
import com.subingest.messaging.core.SourceMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process publish/subscribe emulator.
 *
 * <p>Topics fan out to every subscription bound to them. Each subscription is
 * a queue; a nacked delivery goes back to the head of its queue and is
 * redelivered with an incremented attempt count. A delivery that is neither
 * acked nor nacked within the ack deadline expires: it is queued again at the
 * tail and its outstanding slot is freed, and a later ack or nack of the
 * expired delivery is ignored. Receivers honour the
 * parallel pull count and the outstanding-message bound of the
 * {@link ReceiveSettings}. Failures can be injected for existence checks and
 * for receive calls.</p>
 *
 * <p>Named instances are shared process-wide so that a client created from the
 * endpoint {@code memory://<name>} sees what tests publish to
 * {@link #named(String)}.</p>
 */
public class InMemoryMessageSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageSource.class);
    private static final Map<String, InMemoryMessageSource> INSTANCES = new ConcurrentHashMap<>();
    private static final Duration POLL_INTERVAL = Duration.ofMillis(20);
    public static final Duration DEFAULT_ACK_DEADLINE = Duration.ofSeconds(10);

    private final String name;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final Map<String, SubscriptionQueue> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong messageIds = new AtomicLong();
    private final AtomicInteger existsFailures = new AtomicInteger();
    private final AtomicInteger receiveFailures = new AtomicInteger();
    private final AtomicReference<String> activeReceiveFailure = new AtomicReference<>();
    private final AtomicInteger clientsOpened = new AtomicInteger();
    private final AtomicInteger clientsOpen = new AtomicInteger();
    private final AtomicInteger receiveCalls = new AtomicInteger();
    private volatile Duration ackDeadline = DEFAULT_ACK_DEADLINE;

    public InMemoryMessageSource(String name) {
        this.name = name;
    }

    public static InMemoryMessageSource named(String name) {
        return INSTANCES.computeIfAbsent(name, InMemoryMessageSource::new);
    }

    public static void reset(String name) {
        INSTANCES.remove(name);
    }

    public String getName() { return name; }

    public InMemoryMessageSource setAckDeadline(Duration ackDeadline) {
        if (ackDeadline == null || ackDeadline.isNegative() || ackDeadline.isZero()) {
            throw new IllegalArgumentException("ack deadline must be positive");
        }
        this.ackDeadline = ackDeadline;
        return this;
    }

    public Duration getAckDeadline() { return ackDeadline; }

    // ─── Administration ─────────────────────────────────────────────

    public InMemoryMessageSource createTopic(String topic) {
        topics.add(topic);
        return this;
    }

    public boolean topicExists(String topic) {
        return topics.contains(topic);
    }

    public boolean subscriptionExists(String subscription) {
        if (existsFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new MessageSourceException("injected failure checking subscription " + subscription);
        }
        return subscriptions.containsKey(subscription);
    }

    public void createSubscription(String subscription, String topic) {
        if (!topics.contains(topic)) {
            throw new MessageSourceException("topic " + topic + " does not exist");
        }
        if (subscriptions.putIfAbsent(subscription, new SubscriptionQueue(subscription, topic)) != null) {
            throw new MessageSourceException("subscription " + subscription + " already exists");
        }
        log.debug("[{}] Created subscription {} on topic {}", name, subscription, topic);
    }

    // ─── Publishing ─────────────────────────────────────────────────

    public String publish(String topic, String text) {
        return publish(topic, text.getBytes(StandardCharsets.UTF_8), Map.of());
    }

    /**
     * @return the assigned message id
     */
    public String publish(String topic, byte[] data, Map<String, String> attributes) {
        if (!topics.contains(topic)) {
            throw new MessageSourceException("topic " + topic + " does not exist");
        }
        String id = Long.toString(messageIds.incrementAndGet());
        Instant publishTime = Instant.now();
        for (SubscriptionQueue queue : subscriptions.values()) {
            if (queue.topic.equals(topic)) {
                queue.pending.addLast(new Stored(id, data.clone(), attributes, publishTime, 1));
            }
        }
        return id;
    }

    // ─── Fault injection ────────────────────────────────────────────

    public void failNextExistsChecks(int count) {
        existsFailures.set(count);
    }

    /**
     * The next {@code count} receive calls fail immediately.
     */
    public void failNextReceives(int count) {
        receiveFailures.set(count);
    }

    /**
     * Every receive call currently running ends with the given error.
     */
    public void failActiveReceives(String error) {
        activeReceiveFailure.set(error);
    }

    // ─── Receiving ──────────────────────────────────────────────────

    void receive(String subscription, ReceiveSettings settings, CancellationScope scope, MessageHandler handler) {
        receiveCalls.incrementAndGet();
        SubscriptionQueue queue = subscriptions.get(subscription);
        if (queue == null) {
            throw new MessageSourceException("subscription " + subscription + " does not exist");
        }
        if (receiveFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new MessageSourceException("injected receive failure on " + subscription);
        }
        activeReceiveFailure.set(null);
        expireLeases(queue);

        Semaphore outstanding = settings.isOutstandingUnbounded()
                ? null : new Semaphore(settings.maxOutstandingMessages());
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService receivers = Executors.newFixedThreadPool(settings.parallelPullCount(), r -> {
            Thread t = new Thread(r, "memory-receive-" + subscription);
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < settings.parallelPullCount(); i++) {
            receivers.submit(() -> pullLoop(queue, outstanding, running, handler));
        }

        String failure = null;
        try {
            while (!scope.await(POLL_INTERVAL)) {
                expireLeases(queue);
                failure = activeReceiveFailure.get();
                if (failure != null) break;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            receivers.shutdown();
            awaitReceivers(receivers);
        }
        if (failure != null) {
            throw new MessageSourceException(failure);
        }
    }

    private void pullLoop(SubscriptionQueue queue, Semaphore outstanding, AtomicBoolean running,
                          MessageHandler handler) {
        try {
            while (running.get()) {
                if (outstanding != null
                        && !outstanding.tryAcquire(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                Stored stored = queue.pending.pollFirst(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                if (stored == null || !running.get()) {
                    if (stored != null) queue.pending.addFirst(stored);
                    if (outstanding != null) outstanding.release();
                    continue;
                }
                queue.delivered.incrementAndGet();
                Lease lease = new Lease(stored, outstanding, System.nanoTime() + ackDeadline.toNanos());
                queue.leases.add(lease);
                SourceMessage message = new SourceMessage(stored.id, stored.data, stored.attributes,
                        stored.publishTime, stored.attempt, ack -> {
                            if (!lease.settle()) {
                                log.debug("[{}] Ignored {} of expired delivery {} on {}",
                                        name, ack ? "ack" : "nack", stored.id, queue.name);
                                return;
                            }
                            queue.leases.remove(lease);
                            if (ack) {
                                queue.acked.incrementAndGet();
                            } else {
                                queue.nacked.incrementAndGet();
                                queue.pending.addFirst(stored.redelivery());
                            }
                            lease.releaseSlot();
                        });
                try {
                    handler.onMessage(message);
                } catch (RuntimeException e) {
                    log.warn("[{}] Message handler failed for {} on {}: {}",
                            name, stored.id, queue.name, e.getMessage());
                    message.nack();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void expireLeases(SubscriptionQueue queue) {
        long now = System.nanoTime();
        for (Lease lease : queue.leases) {
            if (now - lease.deadline >= 0 && lease.settle()) {
                queue.leases.remove(lease);
                queue.expired.incrementAndGet();
                queue.pending.addLast(lease.stored.redelivery());
                lease.releaseSlot();
                log.debug("[{}] Ack deadline passed for {} on {}, queued for redelivery",
                        name, lease.stored.id, queue.name);
            }
        }
    }

    private void awaitReceivers(ExecutorService receivers) {
        try {
            if (!receivers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[{}] Receivers did not stop within 5s", name);
                receivers.shutdownNow();
            }
        } catch (InterruptedException e) {
            receivers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ─── Client bookkeeping ─────────────────────────────────────────

    void clientOpened() {
        clientsOpened.incrementAndGet();
        clientsOpen.incrementAndGet();
    }

    void clientClosed() {
        clientsOpen.decrementAndGet();
    }

    // ─── Inspection ─────────────────────────────────────────────────

    public int pendingCount(String subscription) { return queue(subscription).pending.size(); }
    public long deliveredCount(String subscription) { return queue(subscription).delivered.get(); }
    public long ackedCount(String subscription) { return queue(subscription).acked.get(); }
    public long nackedCount(String subscription) { return queue(subscription).nacked.get(); }
    public long expiredCount(String subscription) { return queue(subscription).expired.get(); }
    public int outstandingCount(String subscription) { return queue(subscription).leases.size(); }
    public int getClientsOpened() { return clientsOpened.get(); }
    public int getClientsOpen() { return clientsOpen.get(); }
    public int getReceiveCalls() { return receiveCalls.get(); }

    public List<String> subscriptionNames() {
        return new ArrayList<>(subscriptions.keySet());
    }

    private SubscriptionQueue queue(String subscription) {
        SubscriptionQueue queue = subscriptions.get(subscription);
        if (queue == null) throw new IllegalArgumentException("Unknown subscription: " + subscription);
        return queue;
    }

    private static final class SubscriptionQueue {
        final String name;
        final String topic;
        final LinkedBlockingDeque<Stored> pending = new LinkedBlockingDeque<>();
        final AtomicLong delivered = new AtomicLong();
        final AtomicLong acked = new AtomicLong();
        final AtomicLong nacked = new AtomicLong();
        final AtomicLong expired = new AtomicLong();
        final Set<Lease> leases = ConcurrentHashMap.newKeySet();

        SubscriptionQueue(String name, String topic) {
            this.name = name;
            this.topic = topic;
        }
    }

    /** One unsettled delivery. Settled exactly once, by ack, nack or expiry. */
    private static final class Lease {
        final Stored stored;
        final Semaphore outstanding;
        final long deadline;
        private final AtomicBoolean settled = new AtomicBoolean();

        Lease(Stored stored, Semaphore outstanding, long deadline) {
            this.stored = stored;
            this.outstanding = outstanding;
            this.deadline = deadline;
        }

        boolean settle() {
            return settled.compareAndSet(false, true);
        }

        void releaseSlot() {
            if (outstanding != null) outstanding.release();
        }
    }

    private record Stored(String id, byte[] data, Map<String, String> attributes, Instant publishTime, int attempt) {
        Stored redelivery() {
            return new Stored(id, data, attributes, publishTime, attempt + 1);
        }
    }
}

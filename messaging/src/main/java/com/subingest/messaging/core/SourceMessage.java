/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One delivery of a message from the source. The payload is never modified.
 * A delivery is settled at most once: the first {@link #ack()} or
 * {@link #nack()} wins and later calls are ignored.
 */
public final class SourceMessage {

    public enum Outcome { PENDING, ACKED, NACKED }

    private final String id;
    private final byte[] data;
    private final Map<String, String> attributes;
    private final Instant publishTime;
    private final int deliveryAttempt;
    private final AckReply reply;
    private final AtomicReference<Outcome> outcome = new AtomicReference<>(Outcome.PENDING);

    public SourceMessage(String id, byte[] data, Map<String, String> attributes,
                         Instant publishTime, int deliveryAttempt, AckReply reply) {
        this.id = id;
        this.data = data != null ? data : new byte[0];
        this.attributes = attributes != null && !attributes.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
        this.publishTime = publishTime;
        this.deliveryAttempt = deliveryAttempt;
        this.reply = reply;
    }

    /**
     * @return true if this call acknowledged the delivery
     */
    public boolean ack() {
        return settle(Outcome.ACKED);
    }

    /**
     * @return true if this call negatively acknowledged the delivery
     */
    public boolean nack() {
        return settle(Outcome.NACKED);
    }

    private boolean settle(Outcome target) {
        if (!outcome.compareAndSet(Outcome.PENDING, target)) return false;
        reply.reply(target == Outcome.ACKED);
        return true;
    }

    public String getId() { return id; }
    public byte[] getData() { return data.clone(); }
    public int getSize() { return data.length; }
    public Map<String, String> getAttributes() { return attributes; }
    public Instant getPublishTime() { return publishTime; }
    public int getDeliveryAttempt() { return deliveryAttempt; }
    public Outcome getOutcome() { return outcome.get(); }
    public boolean isSettled() { return outcome.get() != Outcome.PENDING; }

    @Override
    public String toString() {
        return "SourceMessage{id=" + id + ", size=" + data.length + ", publishTime=" + publishTime
                + ", outcome=" + outcome.get() + "}";
    }
}

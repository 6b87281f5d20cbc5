/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.memory;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.messaging.core.MessageHandler;
import com.subingest.messaging.core.MessageSourceClient;
import com.subingest.messaging.core.ReceiveSettings;
import com.subingest.messaging.core.Subscription;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client bound to one {@link InMemoryMessageSource}.
 */
public class InMemoryMessageSourceClient implements MessageSourceClient {

    private final InMemoryMessageSource source;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryMessageSourceClient(InMemoryMessageSource source) {
        this.source = source;
        source.clientOpened();
    }

    @Override
    public boolean subscriptionExists(String name) {
        ensureOpen();
        return source.subscriptionExists(name);
    }

    @Override
    public Subscription subscription(String name) {
        ensureOpen();
        return new MemorySubscription(name);
    }

    @Override
    public Subscription createSubscription(String name, String topic) {
        ensureOpen();
        source.createSubscription(name, topic);
        return new MemorySubscription(name);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) source.clientClosed();
    }

    public boolean isClosed() { return closed.get(); }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("client is closed");
    }

    private final class MemorySubscription implements Subscription {
        private final String name;
        private volatile ReceiveSettings settings = ReceiveSettings.DEFAULT;

        MemorySubscription(String name) {
            this.name = name;
        }

        @Override
        public String getName() { return name; }

        @Override
        public ReceiveSettings getReceiveSettings() { return settings; }

        @Override
        public void setReceiveSettings(ReceiveSettings settings) { this.settings = settings; }

        @Override
        public void receive(CancellationScope scope, MessageHandler handler) {
            ensureOpen();
            source.receive(name, settings, scope, handler);
        }
    }
}

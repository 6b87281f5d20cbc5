/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.status;

import com.subingest.common.model.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Current phase of one worker plus a short transition history, kept for the
 * monitoring API. Every update is forwarded to the host's reporter.
 */
public class WorkerStatus implements StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(WorkerStatus.class);
    static final int MAX_HISTORY = 100;

    public record Transition(WorkerState state, String detail, Instant at) {}

    private final StatusReporter delegate;
    private final Deque<Transition> history = new ArrayDeque<>();
    private volatile Transition current;

    public WorkerStatus(StatusReporter delegate) {
        this.delegate = delegate != null ? delegate : NoopStatusReporter.INSTANCE;
    }

    @Override
    public void updateStatus(WorkerState state, String detail) {
        Transition t = new Transition(state, detail, Instant.now());
        synchronized (history) {
            current = t;
            history.addLast(t);
            while (history.size() > MAX_HISTORY) history.removeFirst();
        }
        try {
            delegate.updateStatus(state, detail);
        } catch (RuntimeException e) {
            log.warn("Status reporter rejected {} update: {}", state, e.getMessage());
        }
    }

    public WorkerState getState() {
        Transition t = current;
        return t != null ? t.state() : null;
    }

    public String getDetail() {
        Transition t = current;
        return t != null ? t.detail() : null;
    }

    public Instant getUpdatedAt() {
        Transition t = current;
        return t != null ? t.at() : null;
    }

    public List<Transition> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /**
     * True if the worker has ever reported {@code state}.
     */
    public boolean hasReported(WorkerState state) {
        synchronized (history) {
            return history.stream().anyMatch(t -> t.state() == state);
        }
    }
}

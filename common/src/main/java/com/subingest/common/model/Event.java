/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Internal event handed to the downstream pipeline. Fields are nested maps;
 * {@link #getField(String)} accepts dotted paths such as {@code event.id}.
 * The private reference points back to the originating message and is only
 * read by the acknowledgment path.
 */
public class Event {

    private final String id;
    private final Instant timestamp;
    private final Map<String, Object> fields;
    @JsonIgnore
    private final Object privateRef;

    public Event(String id, Instant timestamp, Map<String, Object> fields, Object privateRef) {
        this.id = id;
        this.timestamp = timestamp;
        this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
        this.privateRef = privateRef;
    }

    /**
     * Resolve a dotted field path against the nested field maps.
     *
     * @return the value, or {@code null} if any segment is missing
     */
    public Object getField(String path) {
        Object current = fields;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) return null;
            current = map.get(segment);
        }
        return current;
    }

    public boolean hasField(String path) { return getField(path) != null; }

    public String getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, Object> getFields() { return Collections.unmodifiableMap(fields); }
    @JsonIgnore
    public Object getPrivateRef() { return privateRef; }

    @Override
    public String toString() {
        return "Event{id=" + id + ", timestamp=" + timestamp + "}";
    }
}

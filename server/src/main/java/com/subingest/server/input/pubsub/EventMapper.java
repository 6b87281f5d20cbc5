/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.model.Event;
import com.subingest.common.util.HashUtil;
import com.subingest.messaging.core.SourceMessage;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a delivered message into a pipeline event.
 *
 * <p>The event id is {@code <topic id>-<message id>} where the topic id is the
 * first {@value #TOPIC_ID_LENGTH} hex characters of SHA-256 over the project
 * id followed by the topic name. Message ids are only unique per topic, the
 * prefix makes the id usable as an idempotency key across topics.</p>
 */
public class EventMapper {

    public static final int TOPIC_ID_LENGTH = 10;

    private final String topicId;
    private final Clock clock;

    public EventMapper(String projectId, String topic) {
        this(projectId, topic, Clock.systemUTC());
    }

    public EventMapper(String projectId, String topic, Clock clock) {
        this.topicId = topicId(projectId, topic);
        this.clock = clock;
    }

    public static String topicId(String projectId, String topic) {
        return HashUtil.sha256Hex(projectId, topic).substring(0, TOPIC_ID_LENGTH);
    }

    public String eventId(String messageId) {
        return topicId + "-" + messageId;
    }

    public Event toEvent(SourceMessage message) {
        String id = eventId(message.getId());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("id", id);
        meta.put("created", clock.instant());

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("event", meta);
        fields.put("message", new String(message.getData(), StandardCharsets.UTF_8));
        if (!message.getAttributes().isEmpty()) {
            fields.put("labels", new LinkedHashMap<>(message.getAttributes()));
        }

        Instant timestamp = message.getPublishTime() != null ? message.getPublishTime() : clock.instant();
        return new Event(id, timestamp, fields, message);
    }

    public String getTopicId() { return topicId; }
}

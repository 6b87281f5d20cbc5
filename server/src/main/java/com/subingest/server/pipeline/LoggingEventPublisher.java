/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

import com.subingest.common.model.Event;
import com.subingest.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes every event as one compact JSON line to the {@code subingest.events} logger.
 */
public class LoggingEventPublisher implements EventPublisher {

    private static final Logger events = LoggerFactory.getLogger("subingest.events");

    @Override
    public void publish(Event event) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("@timestamp", event.getTimestamp());
        doc.putAll(event.getFields());
        events.info(JsonUtil.toCompactJson(doc));
    }
}

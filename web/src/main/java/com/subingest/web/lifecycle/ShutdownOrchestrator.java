/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.lifecycle;

import com.subingest.server.input.InputService;
import com.subingest.server.pipeline.BufferedEventPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Orchestrates the SubIngest shutdown sequence.
 *
 * <pre>
 * Phase 1: Stop inputs (each blocks until its worker has exited)
 * Phase 2: Close the event pipeline
 * FINAL:   Shutdown Complete announcement
 * </pre>
 *
 * Inputs go first so no event is delivered to a closed pipeline.
 */
@Component
public class ShutdownOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ShutdownOrchestrator.class);

    private final InputService inputService;
    private final BufferedEventPipeline eventPipeline;

    @Value("${subingest.app-name:SubIngest}")
    private String appName;

    @Value("${subingest.version:1.0.0}")
    private String version;

    public ShutdownOrchestrator(InputService inputService, BufferedEventPipeline eventPipeline) {
        this.inputService = inputService;
        this.eventPipeline = eventPipeline;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        Instant shutdownStart = Instant.now();
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN INITIATED{}║", StartupOrchestrator.pad("SHUTDOWN INITIATED", 65));
        log.info("║   {} v{}{}║", appName, version, StartupOrchestrator.pad(appName + " v" + version, 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");

        logShutdownPhase(1, "Stop Inputs", "Cancelling input workers and waiting for them to exit...");
        try {
            inputService.stopAll();
            log.info("✓ Phase 1 complete: all inputs stopped");
        } catch (Exception e) {
            log.warn("  ⚠ Input shutdown issue: {}", e.getMessage());
        }

        logShutdownPhase(2, "Close Event Pipeline", "Stopping publishers, queued events are reported as failed...");
        try {
            eventPipeline.close();
            log.info("✓ Phase 2 complete: event pipeline closed");
        } catch (Exception e) {
            log.warn("  ⚠ Pipeline shutdown issue: {}", e.getMessage());
        }

        Duration elapsed = Duration.between(shutdownStart, Instant.now());
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SHUTDOWN COMPLETE{}║", StartupOrchestrator.pad("SHUTDOWN COMPLETE", 65));
        log.info("║   Shutdown Time : {} ms{}║", elapsed.toMillis(),
                StartupOrchestrator.pad("Shutdown Time : " + elapsed.toMillis() + " ms", 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void logShutdownPhase(int number, String title, String description) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, title, StartupOrchestrator.pad("Phase " + number + ": " + title, 66));
        log.info("║  {}{}║", description, StartupOrchestrator.pad(description, 66));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }
}

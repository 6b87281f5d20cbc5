/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.lifecycle;

import com.subingest.messaging.config.MessagingFactory;
import com.subingest.server.input.InputRegistry;
import com.subingest.server.input.InputService;
import com.subingest.server.pipeline.BufferedEventPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates the SubIngest startup sequence with phased initialization.
 *
 * <pre>
 * Phase 1: Event pipeline verification
 * Phase 2: Input types and message source providers
 * Phase 3: Input configuration scanning
 * Phase 4: Input startup
 * FINAL:   System Ready announcement
 * </pre>
 */
@Component
public class StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final BufferedEventPipeline eventPipeline;
    private final InputRegistry inputRegistry;
    private final MessagingFactory messagingFactory;
    private final InputService inputService;

    @Value("${subingest.app-name:SubIngest}")
    private String appName;

    @Value("${subingest.version:1.0.0}")
    private String version;

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${subingest.lifecycle.phase-delay-ms:500}")
    private long phaseDelayMs;

    private final AtomicBoolean startupComplete = new AtomicBoolean(false);

    public StartupOrchestrator(BufferedEventPipeline eventPipeline, InputRegistry inputRegistry,
                               MessagingFactory messagingFactory, InputService inputService) {
        this.eventPipeline = eventPipeline;
        this.inputRegistry = inputRegistry;
        this.messagingFactory = messagingFactory;
        this.inputService = inputService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        Instant startTime = Instant.now();
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   STARTUP INITIATED{}║", pad("STARTUP INITIATED", 65));
        log.info("║   {} v{}{}║", appName, version, pad(appName + " v" + version, 65));
        log.info("║   Timestamp: {}{}║", timestamp(), pad("Timestamp: " + timestamp(), 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");

        int started = 0;
        try {
            logPhase(1, "Event Pipeline", "Verifying the bounded event pipeline...");
            logPhaseComplete(1, "pipeline " + (eventPipeline.isRunning() ? "RUNNING" : "NOT RUNNING"),
                    "queue depth " + eventPipeline.getQueueDepth());
            phaseDelay();

            logPhase(2, "Input Types & Message Sources", "Listing registered input types and providers...");
            logPhaseComplete(2, "input types " + inputRegistry.names(),
                    "message source providers " + messagingFactory.schemes());
            phaseDelay();

            logPhase(3, "Input Configuration Scanning", "Scanning " + inputService.getConfigDir() + "...");
            List<String> ids = inputService.listInputIds();
            logPhaseComplete(3, ids.size() + " input config(s) discovered");
            for (String id : ids) {
                log.info("  → Found input: {}", id);
            }
            phaseDelay();

            logPhase(4, "Input Startup", "Starting every enabled input...");
            started = inputService.startAll();
            logPhaseComplete(4, started + " input(s) started");
        } catch (Exception e) {
            log.error("Error during startup sequence: {}", e.getMessage(), e);
        }

        startupComplete.set(true);
        Duration elapsed = Duration.between(startTime, Instant.now());
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║   SYSTEM READY{}║", pad("SYSTEM READY", 65));
        log.info("║   Inputs running : {}{}║", started, pad("Inputs running : " + started, 65));
        log.info("║   REST API       : http://localhost:{}/api/v1/inputs{}║", serverPort,
                pad("REST API       : http://localhost:" + serverPort + "/api/v1/inputs", 65));
        log.info("║   Metrics        : http://localhost:{}/actuator/prometheus{}║", serverPort,
                pad("Metrics        : http://localhost:" + serverPort + "/actuator/prometheus", 65));
        log.info("║   Startup Time   : {} ms{}║", elapsed.toMillis(),
                pad("Startup Time   : " + elapsed.toMillis() + " ms", 65));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    public boolean isStartupComplete() { return startupComplete.get(); }

    // ─── Logging Helpers ──────────────────────────────────────────────────────

    private void logPhase(int number, String title, String description) {
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Phase {}: {}{}║", number, title, pad("Phase " + number + ": " + title, 66));
        log.info("║  {}{}║", description, pad(description, 66));
        log.info("╚════════════════════════════════════════════════════════════════════╝");
    }

    private void logPhaseComplete(int number, String... details) {
        log.info("✓ Phase {} complete", number);
        for (String detail : details) {
            log.info("  {}", detail);
        }
    }

    private void phaseDelay() {
        if (phaseDelayMs <= 0) return;
        try {
            Thread.sleep(phaseDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String timestamp() {
        return LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
    }

    static String pad(String text, int totalWidth) {
        int remaining = totalWidth - text.length();
        if (remaining <= 0) return " ";
        return " ".repeat(remaining);
    }
}

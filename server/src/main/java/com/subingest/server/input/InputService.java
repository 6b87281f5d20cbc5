/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input;

import com.subingest.common.exception.SubIngestException;
import com.subingest.common.util.ConfigPropertyResolver;
import com.subingest.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Manages all input workers of the process. Each input is described by one
 * JSON file {@code <id>.json} in the config directory; string values may use
 * {@code ${...}} placeholders.
 *
 * <p>Start and stop operations return {@code null} on success or an error
 * message, the way the REST layer reports them.</p>
 */
public class InputService {

    private static final Logger log = LoggerFactory.getLogger(InputService.class);
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final String configDir;
    private final InputRegistry registry;
    private final InputContext context;
    private final ConfigPropertyResolver resolver;
    private final Map<String, Input> inputs = new ConcurrentHashMap<>();

    public InputService(String configDir, InputRegistry registry, InputContext context,
                        ConfigPropertyResolver resolver) {
        this.configDir = configDir;
        this.registry = registry;
        this.context = context;
        this.resolver = resolver;
        ensureDir();
    }

    /**
     * Scan the config directory and start every enabled input.
     *
     * @return number of inputs started
     */
    public int startAll() {
        int started = 0;
        List<String> ids = listInputIds();

        log.info("╔══════════════════════════════════════════════════════════╗");
        log.info("║  INPUT SERVICE: STARTING CONFIGURED INPUTS                ║");
        log.info("║  Config dir: {}", configDir);
        log.info("║  Found {} input config(s): {}", ids.size(), ids);
        log.info("╚══════════════════════════════════════════════════════════╝");

        for (String id : ids) {
            Map<String, Object> config = loadConfig(id);
            if (config == null) {
                log.warn("Input '{}': no readable config file, skipped", id);
                continue;
            }
            if ("false".equalsIgnoreCase(String.valueOf(config.get("enabled")))) {
                log.info("Input '{}': enabled=false, skipped", id);
                continue;
            }
            String result = startInput(id);
            if (result == null) {
                started++;
                log.info("Input '{}': ✓ STARTED", id);
            } else {
                log.error("Input '{}': ✗ start failed: {}", id, result);
            }
        }

        if (started > 0) {
            log.info("InputService: {} input(s) started from {}", started, configDir);
        } else if (!ids.isEmpty()) {
            log.info("InputService: {} config(s) found but 0 inputs started", ids.size());
        } else {
            log.info("InputService: no input configurations found in {}", configDir);
        }
        return started;
    }

    /**
     * Construct and run a single input from {@code <id>.json}.
     *
     * @return null on success, or an error message
     */
    public String startInput(String id) {
        Input existing = inputs.get(id);
        if (existing != null && existing.getState() != null && !existing.getState().isTerminal()) {
            return "Input '" + id + "' is already running";
        }
        Map<String, Object> raw = loadConfig(id);
        if (raw == null) {
            return "Input config '" + id + "' not found";
        }

        Input input;
        try {
            input = registry.create(resolver.resolveTree(raw), context);
        } catch (SubIngestException e) {
            log.error("Input '{}': {} ({})", id, e.getMessage(), e.getErrorCode());
            return e.getMessage();
        } catch (RuntimeException e) {
            log.error("Input '{}': unexpected error during construction", id, e);
            return "Failed to create input '" + id + "': " + e.getMessage();
        }

        input.run();
        inputs.put(id, input);
        log.info("Input '{}' (type={}, worker id={}) started", id, input.getType(), input.getId());
        return null;
    }

    /**
     * Stop a single input, blocking until it has fully stopped.
     *
     * @return null on success, or an error message
     */
    public String stopInput(String id) {
        Input input = inputs.remove(id);
        if (input == null) {
            return "Input '" + id + "' is not running";
        }
        try {
            input.stop();
            log.info("Input '{}' stopped", id);
            return null;
        } catch (RuntimeException e) {
            log.error("Error stopping input '{}': {}", id, e.getMessage(), e);
            return "Error stopping input '" + id + "': " + e.getMessage();
        }
    }

    public void stopAll() {
        for (String id : new ArrayList<>(inputs.keySet())) {
            String result = stopInput(id);
            if (result != null) log.warn(result);
        }
        log.info("InputService: all inputs stopped");
    }

    public List<Input.InputStats> getAllStats() {
        List<Input.InputStats> stats = new ArrayList<>();
        for (String id : new ArrayList<>(inputs.keySet())) {
            Input input = inputs.get(id);
            if (input != null) stats.add(input.getStats());
        }
        return stats;
    }

    public Input.InputStats getStats(String id) {
        Input input = inputs.get(id);
        return input != null ? input.getStats() : null;
    }

    public Input getInput(String id) {
        return inputs.get(id);
    }

    /** Raw config file content, placeholders unresolved. */
    public Map<String, Object> getConfig(String id) {
        return loadConfig(id);
    }

    public int getActiveCount() {
        return (int) inputs.values().stream()
                .filter(i -> i.getState() != null && !i.getState().isTerminal())
                .count();
    }

    /** List all config files (input IDs) in the config directory. */
    public List<String> listInputIds() {
        File dir = new File(configDir);
        if (!dir.isDirectory()) return Collections.emptyList();
        File[] files = dir.listFiles((d, name) -> name.endsWith(".json"));
        if (files == null) return Collections.emptyList();
        List<String> ids = new ArrayList<>();
        for (File f : files) ids.add(f.getName().substring(0, f.getName().length() - ".json".length()));
        Collections.sort(ids);
        return ids;
    }

    public String getConfigDir() { return configDir; }

    // ─── Private ────────────────────────────────────────────────────────

    private Map<String, Object> loadConfig(String id) {
        if (id == null || !VALID_ID.matcher(id).matches() || id.contains("..")) return null;
        File file = new File(configDir, id + ".json");
        if (!file.isFile()) return null;
        try {
            return JsonUtil.mapFromFile(file);
        } catch (IOException e) {
            log.error("Failed to load input config '{}': {}", id, e.getMessage());
            return null;
        }
    }

    private void ensureDir() {
        File dir = new File(configDir);
        if (!dir.exists() && !dir.mkdirs()) {
            log.warn("Could not create input config directory {}", dir.getAbsolutePath());
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.controller;

import com.subingest.server.input.Input;
import com.subingest.server.input.InputService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Monitoring and control API for the input workers.
 */
@RestController
@RequestMapping("/api/v1/inputs")
public class InputController {

    private static final Logger log = LoggerFactory.getLogger(InputController.class);
    private final InputService inputService;

    public InputController(InputService inputService) {
        this.inputService = inputService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listInputs() {
        List<Input.InputStats> stats = inputService.getAllStats();
        return ResponseEntity.ok(Map.of(
                "total", inputService.listInputIds().size(),
                "active", inputService.getActiveCount(),
                "inputs", stats
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> inputStats(@PathVariable String id) {
        Input.InputStats stats = inputService.getStats(id);
        if (stats == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/{id}/config")
    public ResponseEntity<?> inputConfig(@PathVariable String id) {
        Map<String, Object> cfg = inputService.getConfig(id);
        if (cfg == null) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(cfg);
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, Object>> startInput(@PathVariable String id) {
        log.info("Start input request: {}", id);
        String error = inputService.startInput(id);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", error
            ));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "input", id,
                "message", "Input '" + id + "' started successfully"
        ));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, Object>> stopInput(@PathVariable String id) {
        log.info("Stop input request: {}", id);
        String error = inputService.stopInput(id);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", error
            ));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "input", id,
                "message", "Input '" + id + "' stopped successfully"
        ));
    }
}

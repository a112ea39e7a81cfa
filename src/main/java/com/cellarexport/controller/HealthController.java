package com.cellarexport.controller;

import com.cellarexport.queue.ExportJobQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Health check endpoint for monitoring and load balancers
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final ExportJobQueue exportJobQueue;

    public HealthController(ExportJobQueue exportJobQueue) {
        this.exportJobQueue = exportJobQueue;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now().toString());
        health.put("service", "cellar-export-worker");
        health.put("version", "0.0.1-SNAPSHOT");
        health.put("activeExports", exportJobQueue.activeMailboxes());

        return ResponseEntity.ok(health);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }
}

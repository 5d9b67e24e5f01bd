package com.relaygate.api.controller;

import com.relaygate.llm.model.EngineStatus;
import com.relaygate.llm.service.UnifiedLlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Health endpoints for load balancers and monitoring. Reports DEGRADED when no provider is
 * currently eligible.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final UnifiedLlmService llmService;

    private static final Instant START_TIME = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        EngineStatus status = llmService.getStatus();

        Map<String, Object> response = new HashMap<>();
        response.put("status", status.availableProviders() > 0 ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "relaygate");
        response.put("uptime", getUptime());
        response.put("totalProviders", status.totalProviders());
        response.put("availableProviders", status.availableProviders());
        response.put("flaggedProviders", status.flaggedProviders());

        return ResponseEntity.ok(response);
    }

    /**
     * Ping endpoint - minimal response for keep-alive
     */
    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }

    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - START_TIME.getEpochSecond();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm %ds", days, hours, minutes, secs);
        } else if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}

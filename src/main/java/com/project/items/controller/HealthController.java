package com.project.items.controller;

import com.project.items.DTOs.HealthStatus;
import com.project.items.config.AppSettings;
import com.project.items.persistence.SessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Liveness endpoint for container orchestration. Always answers 200; a failed store probe
 * degrades the reported status instead of failing the request.
 */
@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final SessionFactory sessions;
    private final AppSettings settings;

    public HealthController(SessionFactory sessions, AppSettings settings) {
        this.sessions = sessions;
        this.settings = settings;
    }

    @GetMapping("/health")
    public HealthStatus health() {
        boolean connected = probeDatabase();
        return new HealthStatus(
                connected ? "healthy" : "degraded",
                connected ? "connected" : "disconnected",
                settings.environment(),
                Instant.now().toString()
        );
    }

    private boolean probeDatabase() {
        try {
            sessions.inSession(session -> {
                session.ping();
                return Boolean.TRUE;
            });
            return true;
        } catch (RuntimeException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}

package com.project.items.DTOs;

public record HealthStatus(
        String status,      // "healthy" or "degraded"
        String database,    // "connected" or "disconnected"
        String environment,
        String timestamp    // ISO-8601, UTC
) {}

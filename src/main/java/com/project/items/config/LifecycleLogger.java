package com.project.items.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class LifecycleLogger {
    private static final Logger log = LoggerFactory.getLogger(LifecycleLogger.class);

    private final AppSettings settings;

    public LifecycleLogger(AppSettings settings) {
        this.settings = settings;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("Starting API in {} environment", settings.environment());
        // never log credentials
        log.info("Database URL: {}", settings.database().displayLocation());
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        log.info("Shutting down API");
    }
}

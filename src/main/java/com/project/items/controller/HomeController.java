package com.project.items.controller;

import com.project.items.config.OpenApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Service banner. Thin controller: no store access.
 */
@RestController
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    @GetMapping("/")
    public Map<String, String> index() {
        log.debug("Serving banner");
        return Map.of(
                "message", "Item Service API",
                "version", OpenApiConfig.API_VERSION,
                "docs", "/docs",
                "health", "/health",
                "metrics", "/metrics"
        );
    }
}

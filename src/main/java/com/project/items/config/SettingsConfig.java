package com.project.items.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
public class SettingsConfig {
    private static final Logger log = LoggerFactory.getLogger(SettingsConfig.class);

    @Bean
    public AppSettings appSettings(Environment environment, LoggingSystem loggingSystem) {
        AppSettings settings = AppSettings.from(environment);
        loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, settings.logLevel());
        log.debug("Resolved settings: environment={}, database={}, pool={}+{}",
                settings.environment(), settings.database().displayLocation(),
                settings.poolSize(), settings.maxOverflow());
        return settings;
    }
}

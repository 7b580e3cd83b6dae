package com.argus.app.config;

import com.argus.common.config.ArgusConfig;
import com.argus.common.config.ConfigService;
import com.argus.common.logging.LogLevel;
import com.argus.common.logging.SubsystemLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Applies the {@code logging} section of the Argus config on startup:
 * the level of the {@code argus} logger tree and the subsystem filter.
 */
@Slf4j
@Component
public class LoggingBootstrap {

    private final ConfigService configService;
    private final LoggingSystem loggingSystem;

    public LoggingBootstrap(ConfigService configService, LoggingSystem loggingSystem) {
        this.configService = configService;
        this.loggingSystem = loggingSystem;
    }

    @PostConstruct
    public void init() {
        ArgusConfig.LoggingConfig logging = configService.loadConfig().getLogging();
        LogLevel level = LogLevel.normalize(logging.getLevel());
        loggingSystem.setLogLevel("argus",
                org.springframework.boot.logging.LogLevel.valueOf(level.toSlf4jLevel()));
        SubsystemLogger.setSubsystemFilter(logging.getSubsystems().toArray(String[]::new));
        log.info("Logging configured (level={}, subsystems={})", level, logging.getSubsystems());
    }
}

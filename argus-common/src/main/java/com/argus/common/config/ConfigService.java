package com.argus.common.config;

import com.argus.common.logging.LogLevel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the Argus JSON configuration.
 * Missing files and missing sections fall back to defaults.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ArgusConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ArgusConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ArgusConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ArgusConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ArgusConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            ArgusConfig config = objectMapper.readValue(raw, ArgusConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new ArgusConfig());
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ArgusConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill every missing section and field with its default.
     */
    public static ArgusConfig applyDefaults(ArgusConfig config) {
        ArgusConfig.StreamConfig stream = config.getStream();
        if (stream == null) {
            stream = new ArgusConfig.StreamConfig();
            config.setStream(stream);
        }
        if (stream.getBaseDelayMs() == null) stream.setBaseDelayMs(1_000L);
        if (stream.getMultiplier() == null) stream.setMultiplier(2.0);
        if (stream.getMaxDelayMs() == null) stream.setMaxDelayMs(30_000L);
        if (stream.getJitter() == null) stream.setJitter(0.2);
        if (stream.getMaxAttempts() == null) stream.setMaxAttempts(5);
        if (stream.getHeartbeatCheckIntervalMs() == null) stream.setHeartbeatCheckIntervalMs(10_000L);
        if (stream.getHeartbeatStaleMs() == null) stream.setHeartbeatStaleMs(30_000L);
        if (stream.getBackfillOnReconnect() == null) stream.setBackfillOnReconnect(false);

        ArgusConfig.RetentionConfig retention = config.getRetention();
        if (retention == null) {
            retention = new ArgusConfig.RetentionConfig();
            config.setRetention(retention);
        }
        if (retention.getStaleSessionMinutes() == null) retention.setStaleSessionMinutes(10);
        if (retention.getActivityRetentionDays() == null) retention.setActivityRetentionDays(7);
        if (retention.getSweepIntervalMs() == null) retention.setSweepIntervalMs(60_000L);

        ArgusConfig.LoggingConfig logging = config.getLogging();
        if (logging == null) {
            logging = new ArgusConfig.LoggingConfig();
            config.setLogging(logging);
        }
        logging.setLevel(LogLevel.normalize(logging.getLevel()).name().toLowerCase());
        if (logging.getSubsystems() == null) logging.setSubsystems(List.of());

        return config;
    }

    /**
     * Defaults only, without touching the filesystem.
     */
    public static ArgusConfig defaults() {
        return applyDefaults(new ArgusConfig());
    }
}

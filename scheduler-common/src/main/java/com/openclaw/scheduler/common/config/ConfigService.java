package com.openclaw.scheduler.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the scheduler configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, SchedulerConfig> cache;
    private final Path configPath;
    private final Function<String, String> envLookup;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> envLookup) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = ConfigPaths.resolveUserPath(pathStr);
        }
        this.configPath = configPath;
        this.envLookup = envLookup;
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
    public SchedulerConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public SchedulerConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private SchedulerConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new SchedulerConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            SchedulerConfig config = raw.isBlank()
                    ? new SchedulerConfig()
                    : objectMapper.readValue(raw, SchedulerConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new SchedulerConfig());
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
            String value = envLookup.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    SchedulerConfig applyDefaults(SchedulerConfig config) {
        if (config.getCron() == null) {
            config.setCron(new SchedulerConfig.CronConfig());
        }
        if (config.getSession() == null) {
            config.setSession(new SchedulerConfig.SessionConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new SchedulerConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Convenience view for hosts that only pass environment maps around.
     */
    public static ConfigService fromEnv(Map<String, String> env) {
        return new ConfigService(ConfigPaths.resolveConfigPath(env), DEFAULT_CACHE_TTL, env::get);
    }
}

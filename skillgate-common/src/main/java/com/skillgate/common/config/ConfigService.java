package com.skillgate.common.config;

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
 * Loads and caches {@link SkillGateConfig} from a JSON file.
 *
 * <p>
 * {@code ${VAR}} and {@code ${VAR:-default}} references in the raw file are
 * substituted from the environment before parsing. A missing file yields an
 * empty config; an unreadable or malformed file raises {@link ConfigException}.
 * </p>
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, SkillGateConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
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
     * Load config, served from cache within the TTL.
     */
    public SkillGateConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    public SkillGateConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Parse a config document that is already in memory.
     */
    public SkillGateConfig parse(String raw) {
        try {
            return applyDefaults(objectMapper.readValue(substituteEnvVars(raw), SkillGateConfig.class));
        } catch (IOException e) {
            throw new ConfigException("Invalid config: " + e.getMessage(), e);
        }
    }

    private SkillGateConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new SkillGateConfig());
        }
        String raw;
        try {
            raw = Files.readString(configPath);
        } catch (IOException e) {
            log.warn("Failed to read config from {}: {}", configPath, e.getMessage());
            throw new ConfigException("Failed to read config " + configPath, e);
        }
        SkillGateConfig config;
        try {
            config = parse(raw);
        } catch (ConfigException e) {
            log.warn("Failed to parse config {}: {}", configPath, e.getMessage());
            throw e;
        }
        log.info("Config loaded from: {}", configPath);
        return config;
    }

    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                String defaultValue = matcher.group(2);
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    SkillGateConfig applyDefaults(SkillGateConfig config) {
        if (config.getAgents() == null) {
            config.setAgents(new SkillGateConfig.AgentsConfig());
        }
        if (config.getAgents().getDefaults() == null) {
            config.getAgents().setDefaults(new SkillGateConfig.AgentDefaults());
        }
        return config;
    }

    /**
     * Raised when the config file exists but cannot be read or parsed.
     */
    public static class ConfigException extends RuntimeException {
        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Environment lookup backed by a fixed map, for callers that need
     * deterministic substitution.
     */
    public static Function<String, String> envOf(Map<String, String> values) {
        return values::get;
    }
}

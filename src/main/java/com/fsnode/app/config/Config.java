package com.fsnode.app.config;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Environment lookups for Fsnode.
 * Values are searched in system properties, then the process environment, then a local .env file.
 */
public final class Config {

    // Environment variables checked
    static final String ENV_MODE = "FSNODE_MODE";

    // System property overrides (useful for tests/CI)
    static final String PROP_MODE = "fsnode.mode";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private Config() {}

    /**
     * Mode override from the environment, or {@code null} when none is set.
     * An unrecognized value is logged and ignored.
     */
    public static OperationMode resolveModeOverride() {
        String raw = getEnvOrDotenv(ENV_MODE);
        if (raw == null) return null;
        OperationMode mode = OperationMode.parse(raw).orElse(null);
        if (mode == null) {
            logger.warn("Ignoring unknown {} value: {}", ENV_MODE, raw);
        }
        return mode;
    }

    /**
     * Value of an environment variable, falling back to the local .env file.
     */
    static String getEnvOrDotenv(String key) {
        // 0. System properties override (tests/CI)
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        // 1. Process environment
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        // 2. .env file
        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_MODE -> PROP_MODE;
            default -> null;
        };
    }
}

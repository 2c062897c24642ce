package com.fsnode.app.config;

import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Settings threaded into every resolver, cache and node.
 *
 * @param mode            error policy
 * @param statMaxAge      how long a stat result is served without touching the disk
 * @param childrenMaxAge  how long a directory listing is served
 * @param dataMaxAge      how long file contents are served
 */
public record FsOptions(
        OperationMode mode,
        Duration statMaxAge,
        Duration childrenMaxAge,
        Duration dataMaxAge
) {
    private static final Logger logger = LoggerFactory.getLogger(FsOptions.class);

    private static final Duration DEFAULT_MAX_AGE = Duration.ofMillis(100);

    public FsOptions {
        requireNonNull(mode, "mode");
        requireNonNull(statMaxAge, "statMaxAge");
        requireNonNull(childrenMaxAge, "childrenMaxAge");
        requireNonNull(dataMaxAge, "dataMaxAge");
    }

    public static FsOptions defaults() {
        return new FsOptions(OperationMode.NORMAL, DEFAULT_MAX_AGE, DEFAULT_MAX_AGE, DEFAULT_MAX_AGE);
    }

    /**
     * Reads {@code fsnode.*} from application.conf / reference.conf, then applies the
     * FSNODE_MODE override from the environment or .env.
     */
    public static FsOptions load() {
        com.typesafe.config.Config cfg = ConfigFactory.load();

        String rawMode = get(cfg, "fsnode.mode", "normal");
        OperationMode mode = OperationMode.parse(rawMode).orElseGet(() -> {
            logger.warn("Unknown fsnode.mode '{}', using normal", rawMode);
            return OperationMode.NORMAL;
        });
        OperationMode override = Config.resolveModeOverride();
        if (override != null) mode = override;

        var options = new FsOptions(
                mode,
                getDuration(cfg, "fsnode.cache.stat-max-age", DEFAULT_MAX_AGE),
                getDuration(cfg, "fsnode.cache.children-max-age", DEFAULT_MAX_AGE),
                getDuration(cfg, "fsnode.cache.data-max-age", DEFAULT_MAX_AGE)
        );
        logger.debug("Loaded {}", options);
        return options;
    }

    public FsOptions withMode(OperationMode newMode) {
        return new FsOptions(newMode, statMaxAge, childrenMaxAge, dataMaxAge);
    }

    public FsOptions withMaxAge(Duration maxAge) {
        return new FsOptions(mode, maxAge, maxAge, maxAge);
    }

    private static String get(com.typesafe.config.Config cfg, String path, String def) {
        try { return cfg.hasPath(path) ? cfg.getString(path) : def; }
        catch (Exception ignored) { return def; }
    }

    private static Duration getDuration(com.typesafe.config.Config cfg, String path, Duration def) {
        try { return cfg.hasPath(path) ? cfg.getDuration(path) : def; }
        catch (Exception ignored) { return def; }
    }
}

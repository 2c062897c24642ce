package com.fsnode.app.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether bad input and unexpected filesystem shapes raise, warn or are tolerated.
 */
public enum OperationMode {
    /** Any argument problem, shape conflict or surfaced I/O error raises. */
    STRICT,
    /** Argument problems and structural conflicts raise; reads on the wrong kind yield empty results. */
    NORMAL,
    /** Argument problems only warn. Structural conflicts of mutations still raise. */
    FORGIVING;

    public boolean isStrict() {
        return this == STRICT;
    }

    public boolean raisesOnProblems() {
        return this != FORGIVING;
    }

    public static Optional<OperationMode> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> Optional.of(STRICT);
            case "normal", "default" -> Optional.of(NORMAL);
            case "forgiving", "lenient" -> Optional.of(FORGIVING);
            default -> Optional.empty();
        };
    }
}

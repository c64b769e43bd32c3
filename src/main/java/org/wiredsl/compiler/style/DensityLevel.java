package org.wiredsl.compiler.style;

import java.util.Locale;
import java.util.Optional;

/**
 * Global density setting of a project. Scales container spacing and selects
 * the default control height and text metrics.
 */
public enum DensityLevel {
    COMPACT("compact", 0.8, 32),
    NORMAL("normal", 1.0, 40),
    COMFORTABLE("comfortable", 1.25, 48);

    private final String token;
    private final double factor;
    private final int controlHeight;

    DensityLevel(String token, double factor, int controlHeight) {
        this.token = token;
        this.factor = factor;
        this.controlHeight = controlHeight;
    }

    /**
     * @return The token used in the DSL and in the serialized IR.
     */
    public String token() {
        return token;
    }

    /**
     * @return The multiplier applied to density-aware spacing values.
     */
    public double factor() {
        return factor;
    }

    /**
     * @return The flat default height of a generic control at this density.
     */
    public int controlHeight() {
        return controlHeight;
    }

    /**
     * Looks up a density by its DSL token, case-insensitively.
     * @param token The token, e.g. "compact". May be null.
     * @return The density, or empty if the token is unknown.
     */
    public static Optional<DensityLevel> fromToken(String token) {
        if (token == null) return Optional.empty();
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (DensityLevel level : values()) {
            if (level.token.equals(normalized)) return Optional.of(level);
        }
        return Optional.empty();
    }
}

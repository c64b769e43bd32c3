package org.wiredsl.compiler.style;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps semantic spacing tokens to pixel values, optionally scaled by density.
 * <p>
 * Token table: none=0, xs=4, sm=8, md=16, lg=24, xl=32.
 */
public final class SpacingResolver {

    /** The token used when neither the requested nor the fallback token is known. */
    public static final String DEFAULT_TOKEN = "md";

    private static final Map<String, Integer> SPACING_VALUES = new LinkedHashMap<>();

    static {
        SPACING_VALUES.put("none", 0);
        SPACING_VALUES.put("xs", 4);
        SPACING_VALUES.put("sm", 8);
        SPACING_VALUES.put("md", 16);
        SPACING_VALUES.put("lg", 24);
        SPACING_VALUES.put("xl", 32);
    }

    private SpacingResolver() {}

    /**
     * Resolves a spacing token to pixels.
     *
     * @param token        The requested token, may be null or unknown.
     * @param fallback     The token whose value is used when {@code token} is absent or unknown.
     * @param density      The density level of the project.
     * @param densityAware Whether the density factor applies to the base value.
     * @return The resolved pixel value.
     */
    public static int resolve(String token, String fallback, DensityLevel density, boolean densityAware) {
        Integer base = token != null ? SPACING_VALUES.get(token) : null;
        if (base == null) {
            base = SPACING_VALUES.getOrDefault(fallback, SPACING_VALUES.get(DEFAULT_TOKEN));
        }
        if (!densityAware) {
            return base;
        }
        DensityLevel level = density != null ? density : DensityLevel.NORMAL;
        return (int) Math.round(base * level.factor());
    }

    /**
     * @param token A candidate token.
     * @return {@code true} if the token is part of the spacing scale.
     */
    public static boolean isToken(String token) {
        return token != null && SPACING_VALUES.containsKey(token);
    }

    /**
     * @return All spacing tokens in ascending order.
     */
    public static Set<String> tokens() {
        return SPACING_VALUES.keySet();
    }
}

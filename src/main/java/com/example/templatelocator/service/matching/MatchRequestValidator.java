package com.example.templatelocator.service.matching;

import java.util.Locale;

/**
 * Argument checks shared by the matching components. Invalid values are
 * rejected with {@link IllegalArgumentException}, never clamped.
 */
public final class MatchRequestValidator {

    private MatchRequestValidator() {
    }

    public static void requireTemplateSize(int templateWidth, int templateHeight) {
        if (templateWidth <= 0 || templateHeight <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Template dimensions must be positive (got %dx%d)", templateWidth, templateHeight));
        }
    }

    public static void requireAtLeastOne(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Invalid %s (must be >= 1): %d", name, value));
        }
    }

    public static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0d || value > 1d) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Invalid %s (must be within [0,1]): %s", name, value));
        }
    }

    public static void requirePositive(String name, double value) {
        if (Double.isNaN(value) || value <= 0d) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Invalid %s (must be > 0): %s", name, value));
        }
    }
}

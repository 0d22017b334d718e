package com.example.templatelocator.service.matching;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Normalised similarity measures supported by the matcher. Each constant
 * knows whether the best position is the field minimum or maximum, how a
 * raw score maps to a confidence in {@code [0,1]} and which raw value marks
 * a position as permanently excluded.
 */
public enum MatchMethod {

    /** Correlation coefficient, raw scores in {@code [-1,1]}, higher is better. */
    CCOEFF_NORMED("ccoeff_normed") {
        @Override
        public boolean bestIsMinimum() {
            return false;
        }

        @Override
        double rawToConfidence(double raw) {
            return (raw + 1d) / 2d;
        }
    },

    /** Cross correlation, raw scores in {@code [0,1]}, higher is better. */
    CCORR_NORMED("ccorr_normed") {
        @Override
        public boolean bestIsMinimum() {
            return false;
        }

        @Override
        double rawToConfidence(double raw) {
            return raw;
        }
    },

    /** Squared difference, raw scores in {@code [0,1]}, lower is better. */
    SQDIFF_NORMED("sqdiff_normed") {
        @Override
        public boolean bestIsMinimum() {
            return true;
        }

        @Override
        double rawToConfidence(double raw) {
            return 1d - raw;
        }
    };

    private final String externalName;

    MatchMethod(String externalName) {
        this.externalName = externalName;
    }

    public abstract boolean bestIsMinimum();

    abstract double rawToConfidence(double raw);

    public String externalName() {
        return externalName;
    }

    public double confidence(double raw) {
        double confidence = rawToConfidence(raw);
        if (Double.isNaN(confidence)) {
            return 0d;
        }
        return Math.max(0d, Math.min(1d, confidence));
    }

    public float worstSentinel() {
        return bestIsMinimum() ? 1.0f : -1.0f;
    }

    /**
     * @return {@code true} when {@code candidate} is strictly better than
     * {@code current} for this method.
     */
    public boolean isBetter(float candidate, float current) {
        return bestIsMinimum() ? candidate < current : candidate > current;
    }

    public static MatchMethod fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Match method is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MatchMethod method : values()) {
            if (method.externalName.equals(normalized)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unsupported match method '" + name + "' (expected one of "
                + Arrays.stream(values()).map(MatchMethod::externalName).collect(Collectors.joining("|")) + ")");
    }
}

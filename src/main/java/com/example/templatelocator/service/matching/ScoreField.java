package com.example.templatelocator.service.matching;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense row-major grid of similarity scores, one sample per candidate
 * template position. Instances are immutable; consumers that need to
 * modify samples work on {@link #copyValues()}.
 */
public final class ScoreField {

    private final int width;
    private final int height;
    private final float[] values;

    public ScoreField(int width, int height, float[] values) {
        Objects.requireNonNull(values, "Score values must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Score field must not be empty (got " + width + "x" + height + ")");
        }
        if ((long) width * height != values.length) {
            throw new IllegalArgumentException("Score field of " + width + "x" + height
                    + " requires " + ((long) width * height) + " samples, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values.clone();
    }

    /**
     * Creates a field with every sample set to {@code value}.
     */
    public static ScoreField filled(int width, int height, float value) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Score field must not be empty (got " + width + "x" + height + ")");
        }
        float[] values = new float[width * height];
        Arrays.fill(values, value);
        return new ScoreField(width, height, values);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public float get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        return values[y * width + x];
    }

    public float[] copyValues() {
        return values.clone();
    }
}

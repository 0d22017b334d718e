package com.example.templatelocator.service;

import java.util.Locale;

/**
 * What the annotated scene shows for each match.
 */
public enum DrawMode {
    BBOX("bbox", false, false),
    BBOX_LABEL("bbox+label", true, false),
    BBOX_LABEL_SCORE("bbox+label+score", true, true);

    private final String externalName;
    private final boolean label;
    private final boolean score;

    DrawMode(String externalName, boolean label, boolean score) {
        this.externalName = externalName;
        this.label = label;
        this.score = score;
    }

    public String externalName() {
        return externalName;
    }

    public boolean drawsLabel() {
        return label;
    }

    public boolean drawsScore() {
        return score;
    }

    public static DrawMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DrawMode mode : values()) {
                if (mode.externalName.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Invalid draw (must be bbox|bbox+label|bbox+label+score): " + name);
    }
}

package com.example.templatelocator.service;

import java.util.Locale;

/**
 * Pixel representation both images are converted to before scoring.
 */
public enum ColorMode {
    GRAY("gray"),
    COLOR("color");

    private final String externalName;

    ColorMode(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public static ColorMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ColorMode mode : values()) {
                if (mode.externalName.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Invalid mode (must be gray|color): " + name);
    }
}

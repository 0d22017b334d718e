package com.example.templatelocator.service;

import com.example.templatelocator.config.MatchingProperties;
import com.example.templatelocator.model.BoundingBox;
import com.example.templatelocator.service.matching.MatchCriteria;
import com.example.templatelocator.service.matching.MatchMethod;
import com.example.templatelocator.service.matching.MatchRequestValidator;
import org.springframework.stereotype.Component;

/**
 * Merges request options with the configured defaults and rejects anything
 * out of range before the images are touched.
 */
@Component
public class MatchOptionsResolver {

    private final MatchingProperties properties;

    public MatchOptionsResolver(MatchingProperties properties) {
        this.properties = properties;
    }

    public MatchSettings resolve(MatchOptions options) {
        MatchOptions source = options != null ? options : MatchOptions.defaults();

        MatchMethod method = MatchMethod.fromName(orDefault(source.method(), properties.getDefaultMethod()));
        ColorMode mode = ColorMode.fromName(orDefault(source.mode(), properties.getDefaultMode()));
        int maxResults = source.maxResults() != null ? source.maxResults() : properties.getDefaultMaxResults();
        double minScore = source.minScore() != null ? source.minScore() : properties.getDefaultMinScore();
        double nms = source.nms() != null ? source.nms() : properties.getDefaultNmsThreshold();
        MatchCriteria criteria = new MatchCriteria(maxResults, minScore, nms);

        DrawMode draw = DrawMode.fromName(orDefault(source.draw(), properties.getDefaultDraw()));
        int thickness = source.thickness() != null ? source.thickness() : properties.getDefaultThickness();
        MatchRequestValidator.requireAtLeastOne("thickness", thickness);
        double fontScale = source.fontScale() != null ? source.fontScale() : properties.getDefaultFontScale();
        MatchRequestValidator.requirePositive("font-scale", fontScale);

        BoundingBox roi = hasText(source.roi()) ? parseRoi(source.roi()) : null;
        return new MatchSettings(method, mode, criteria, roi, draw, thickness, fontScale,
                source.heatmap(), source.annotate());
    }

    /**
     * Parses a region of interest written as {@code x,y,w,h}.
     */
    public static BoundingBox parseRoi(String value) {
        if (!hasText(value)) {
            throw new IllegalArgumentException("Invalid roi (expected x,y,w,h): " + value);
        }
        String[] parts = value.split(",", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Invalid roi (expected x,y,w,h): " + value);
        }
        int[] numbers = new int[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                numbers[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid roi (expected x,y,w,h): " + value, ex);
            }
        }
        if (numbers[0] < 0 || numbers[1] < 0 || numbers[2] <= 0 || numbers[3] <= 0) {
            throw new IllegalArgumentException("Invalid roi (require x>=0, y>=0, w>0, h>0): " + value);
        }
        return new BoundingBox(numbers[0], numbers[1], numbers[2], numbers[3]);
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package com.example.templatelocator.service;

import com.example.templatelocator.model.BoundingBox;
import com.example.templatelocator.service.matching.MatchCriteria;
import com.example.templatelocator.service.matching.MatchMethod;

/**
 * Fully resolved and validated parameters of one match request.
 *
 * @param roi search region in scene coordinates, {@code null} for the whole scene
 */
public record MatchSettings(
        MatchMethod method,
        ColorMode mode,
        MatchCriteria criteria,
        BoundingBox roi,
        DrawMode draw,
        int thickness,
        double fontScale,
        boolean heatmap,
        boolean annotate) {
}

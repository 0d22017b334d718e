package com.example.templatelocator.service;

/**
 * Caller supplied match parameters. {@code null} values fall back to the
 * configured defaults.
 */
public record MatchOptions(
        String method,
        String mode,
        Integer maxResults,
        Double minScore,
        Double nms,
        String roi,
        String draw,
        Integer thickness,
        Double fontScale,
        boolean heatmap,
        boolean annotate) {

    public static MatchOptions defaults() {
        return new MatchOptions(null, null, null, null, null, null, null, null, null, false, false);
    }
}

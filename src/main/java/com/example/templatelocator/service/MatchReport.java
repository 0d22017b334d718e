package com.example.templatelocator.service;

import com.example.templatelocator.service.matching.MatchCandidate;

import java.util.List;

/**
 * Outcome of one match request. {@code matches} is in scene coordinates and
 * ordered by descending confidence; the PNG payloads are {@code null} unless
 * requested.
 */
public record MatchReport(
        int sceneWidth,
        int sceneHeight,
        int templateWidth,
        int templateHeight,
        MatchSettings settings,
        List<MatchCandidate> matches,
        long elapsedMs,
        byte[] heatmapPng,
        byte[] annotatedPng) {

    public MatchCandidate best() {
        return matches.isEmpty() ? null : matches.get(0);
    }
}

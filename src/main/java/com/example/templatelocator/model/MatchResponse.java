package com.example.templatelocator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Template matching report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchResponse(
        @Schema(example = "match") String command,
        @Schema(description = "Effective request parameters") MatchParameters params,
        @JsonProperty("template_size") ImageSize templateSize,
        @JsonProperty("scene_size") ImageSize sceneSize,
        @Schema(description = "Matches ordered by descending confidence") List<MatchEntry> matches,
        @Schema(description = "Summary counters") MatchStats stats,
        @JsonProperty("heatmap_png")
        @Schema(description = "Base64 encoded PNG heatmap of the score field, when requested") String heatmapPng,
        @JsonProperty("annotated_png")
        @Schema(description = "Base64 encoded PNG of the annotated scene, when requested") String annotatedPng) {

    public record MatchStats(
            @Schema(example = "2") int found,
            @JsonProperty("elapsed_ms") @Schema(example = "12") long elapsedMs) {
    }
}

package com.example.templatelocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Effective parameters after defaults were applied")
public record MatchParameters(
        @Schema(example = "gray") String mode,
        @Schema(example = "ccoeff_normed") String method,
        @JsonProperty("max_results") @Schema(example = "5") int maxResults,
        @JsonProperty("min_score") @Schema(example = "0.8") double minScore,
        @Schema(description = "IoU threshold used for deduplication", example = "0.3") double nms,
        @Schema(example = "bbox+label+score") String draw,
        @Schema(example = "2") int thickness,
        @JsonProperty("font_scale") @Schema(example = "0.5") double fontScale,
        @Schema(description = "Search region, absent when the whole scene was searched") BoundingBox roi) {
}

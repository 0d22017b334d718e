package com.example.templatelocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One reported occurrence of the template")
public record MatchEntry(
        @Schema(description = "Rank of the match, 0 is the most confident", example = "0") int id,
        @Schema(description = "Location in scene coordinates") BoundingBox bbox,
        @JsonProperty("raw_score")
        @Schema(description = "Method native similarity value", example = "0.9731") double rawScore,
        @Schema(description = "Score normalised into [0,1]", example = "0.9865") double confidence) {
}

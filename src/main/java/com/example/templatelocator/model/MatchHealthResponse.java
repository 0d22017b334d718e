package com.example.templatelocator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Template matching service state and default parameters")
public record MatchHealthResponse(
        boolean enabled,
        MatchParameters defaults,
        @JsonProperty("candidate_pool")
        @Schema(description = "Raw candidates extracted for the default result count", example = "50") int candidatePool) {
}

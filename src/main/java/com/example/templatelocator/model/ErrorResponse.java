package com.example.templatelocator.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error payload returned for rejected or failed requests")
public record ErrorResponse(
        @Schema(description = "Time the error was produced") Instant timestamp,
        @Schema(description = "HTTP status code", example = "400") int status,
        @Schema(description = "HTTP reason phrase", example = "Bad Request") String error,
        @Schema(description = "Human readable cause", example = "Invalid nms (must be within [0,1]): 1.5") String message,
        @Schema(description = "Request path", example = "/api/v1/match") String path) {
}

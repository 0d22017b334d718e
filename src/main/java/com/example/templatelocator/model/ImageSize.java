package com.example.templatelocator.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Image dimensions in pixels")
public record ImageSize(
        @Schema(example = "640") int w,
        @Schema(example = "480") int h) {
}

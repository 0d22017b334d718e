package com.example.templatelocator.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned rectangle in scene pixel coordinates with the origin located
 * in the top-left corner. Used both for match locations and for the region
 * of interest a search is restricted to.
 */
@Schema(description = "Axis-aligned rectangle in scene pixel coordinates")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Width in pixels", example = "32") int width,
        @Schema(description = "Height in pixels", example = "32") int height) {

    public BoundingBox {
        if (width <= 0) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
    }

    public long area() {
        return (long) width * height;
    }

    public BoundingBox translate(int dx, int dy) {
        return new BoundingBox(x + dx, y + dy, width, height);
    }

    public boolean contains(BoundingBox other) {
        return other.x >= x
                && other.y >= y
                && (long) other.x + other.width <= (long) x + width
                && (long) other.y + other.height <= (long) y + height;
    }

    /**
     * @return intersection area divided by union area, {@code 0} when the
     * rectangles do not overlap.
     */
    public double intersectionOverUnion(BoundingBox other) {
        long x1 = Math.max(x, other.x);
        long y1 = Math.max(y, other.y);
        long x2 = Math.min((long) x + width, (long) other.x + other.width);
        long y2 = Math.min((long) y + height, (long) other.y + other.height);
        long intersectionArea = Math.max(0L, x2 - x1) * Math.max(0L, y2 - y1);
        if (intersectionArea == 0L) {
            return 0d;
        }
        long union = area() + other.area() - intersectionArea;
        if (union <= 0L) {
            return 0d;
        }
        return intersectionArea / (double) union;
    }
}

package com.example.templatelocator.service.matching;

import com.example.templatelocator.model.BoundingBox;

import java.util.Objects;

public record MatchCandidate(BoundingBox boundingBox, double rawScore, double confidence) {

    public MatchCandidate {
        Objects.requireNonNull(boundingBox, "Bounding box must not be null");
        if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
            throw new IllegalArgumentException("Confidence must be within [0,1], got " + confidence);
        }
    }

    public MatchCandidate translate(int dx, int dy) {
        if (dx == 0 && dy == 0) {
            return this;
        }
        return new MatchCandidate(boundingBox.translate(dx, dy), rawScore, confidence);
    }
}

package com.example.templatelocator.service.matching;

import com.example.templatelocator.model.BoundingBox;

import java.util.Objects;

/**
 * Locates the single best position of a score field without modifying it.
 */
public class BestMatchFinder {

    public MatchCandidate findBest(ScoreField field, MatchMethod method, int templateWidth, int templateHeight) {
        Objects.requireNonNull(field, "Score field must not be null");
        Objects.requireNonNull(method, "Match method must not be null");
        MatchRequestValidator.requireTemplateSize(templateWidth, templateHeight);

        int bestX = -1;
        int bestY = -1;
        float best = Float.NaN;
        for (int y = 0; y < field.height(); y++) {
            for (int x = 0; x < field.width(); x++) {
                float value = field.get(x, y);
                if (Float.isNaN(value)) {
                    continue;
                }
                if (bestX < 0 || method.isBetter(value, best)) {
                    best = value;
                    bestX = x;
                    bestY = y;
                }
            }
        }
        if (bestX < 0) {
            throw new IllegalArgumentException("Score field contains no finite samples");
        }
        return new MatchCandidate(new BoundingBox(bestX, bestY, templateWidth, templateHeight), best,
                method.confidence(best));
    }
}

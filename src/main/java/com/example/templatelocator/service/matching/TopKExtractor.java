package com.example.templatelocator.service.matching;

import com.example.templatelocator.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts up to {@code k} distinct peaks from a score field. After each
 * accepted peak a rectangle around it is overwritten with the method's
 * worst value so the next round finds a different location. The field
 * passed in is never touched; every call allocates its own working buffer.
 */
public class TopKExtractor {

    public static final int DEFAULT_SUPPRESSION_DIVISOR = 4;

    private static final Logger log = LoggerFactory.getLogger(TopKExtractor.class);

    private final int suppressionDivisor;

    public TopKExtractor() {
        this(DEFAULT_SUPPRESSION_DIVISOR);
    }

    public TopKExtractor(int suppressionDivisor) {
        if (suppressionDivisor < 1) {
            throw new IllegalArgumentException("Suppression divisor must be at least 1");
        }
        this.suppressionDivisor = suppressionDivisor;
    }

    public List<MatchCandidate> extract(ScoreField field, MatchMethod method, int templateWidth, int templateHeight,
                                        int k, double minConfidence) {
        Objects.requireNonNull(field, "Score field must not be null");
        Objects.requireNonNull(method, "Match method must not be null");
        MatchRequestValidator.requireTemplateSize(templateWidth, templateHeight);
        MatchRequestValidator.requireAtLeastOne("k", k);
        MatchRequestValidator.requireUnitInterval("min-confidence", minConfidence);

        int width = field.width();
        int height = field.height();
        float[] work = field.copyValues();
        boolean[] suppressed = new boolean[work.length];
        float sentinel = method.worstSentinel();
        int rx = Math.max(1, templateWidth / suppressionDivisor);
        int ry = Math.max(1, templateHeight / suppressionDivisor);

        List<MatchCandidate> hits = new ArrayList<>(Math.min(k, work.length));
        while (hits.size() < k) {
            int index = locateExtremum(work, suppressed, method);
            if (index < 0) {
                log.debug("Score field exhausted after {} candidates", hits.size());
                break;
            }
            float raw = work[index];
            double confidence = method.confidence(raw);
            if (confidence < minConfidence) {
                break;
            }

            int x = index % width;
            int y = index / width;
            hits.add(new MatchCandidate(new BoundingBox(x, y, templateWidth, templateHeight), raw, confidence));

            int left = Math.max(0, x - rx);
            int right = Math.min(width - 1, x + rx);
            int top = Math.max(0, y - ry);
            int bottom = Math.min(height - 1, y + ry);
            for (int row = top; row <= bottom; row++) {
                int offset = row * width;
                for (int col = left; col <= right; col++) {
                    // the mask keeps suppressed samples out of later scans; the sentinel only marks the buffer
                    work[offset + col] = sentinel;
                    suppressed[offset + col] = true;
                }
            }
        }
        return hits;
    }

    private int locateExtremum(float[] work, boolean[] suppressed, MatchMethod method) {
        int bestIndex = -1;
        for (int i = 0; i < work.length; i++) {
            if (suppressed[i] || Float.isNaN(work[i])) {
                continue;
            }
            if (bestIndex < 0 || method.isBetter(work[i], work[bestIndex])) {
                bestIndex = i;
            }
        }
        return bestIndex;
    }
}

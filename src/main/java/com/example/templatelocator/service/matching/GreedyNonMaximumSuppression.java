package com.example.templatelocator.service.matching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Greedy IoU based deduplication. Candidates are visited by descending
 * confidence, equal confidences keeping their original order, and a
 * candidate survives only when it overlaps every survivor by less than the
 * threshold.
 */
public class GreedyNonMaximumSuppression {

    public List<MatchCandidate> deduplicate(List<MatchCandidate> candidates, double iouThreshold, int maxKeep) {
        Objects.requireNonNull(candidates, "Candidates must not be null");
        MatchRequestValidator.requireUnitInterval("nms", iouThreshold);
        MatchRequestValidator.requireAtLeastOne("max-keep", maxKeep);
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Integer> order = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        // List.sort is stable
        order.sort(Comparator.comparingDouble((Integer idx) -> candidates.get(idx).confidence()).reversed());

        List<MatchCandidate> kept = new ArrayList<>(Math.min(maxKeep, candidates.size()));
        for (int idx : order) {
            MatchCandidate current = candidates.get(idx);
            boolean overlaps = false;
            for (MatchCandidate survivor : kept) {
                if (current.boundingBox().intersectionOverUnion(survivor.boundingBox()) >= iouThreshold) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(current);
                if (kept.size() == maxKeep) {
                    break;
                }
            }
        }
        return kept;
    }
}

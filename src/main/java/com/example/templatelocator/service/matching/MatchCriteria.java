package com.example.templatelocator.service.matching;

/**
 * Selection thresholds applied to a score field.
 *
 * @param maxResults    number of matches to report after deduplication
 * @param minConfidence lowest confidence a peak may have to be extracted
 * @param iouThreshold  overlap at or above which the weaker of two matches is dropped
 */
public record MatchCriteria(int maxResults, double minConfidence, double iouThreshold) {

    public MatchCriteria {
        MatchRequestValidator.requireAtLeastOne("max-results", maxResults);
        MatchRequestValidator.requireUnitInterval("min-score", minConfidence);
        MatchRequestValidator.requireUnitInterval("nms", iouThreshold);
    }
}

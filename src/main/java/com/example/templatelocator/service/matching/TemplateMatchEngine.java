package com.example.templatelocator.service.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a score field into the final list of matches: peak extraction over
 * an oversized candidate pool, IoU deduplication and, last, translation of
 * every box from field coordinates into scene coordinates.
 */
public class TemplateMatchEngine {

    public static final int DEFAULT_CANDIDATE_MULTIPLIER = 10;

    private static final Logger log = LoggerFactory.getLogger(TemplateMatchEngine.class);

    private final BestMatchFinder bestMatchFinder;
    private final TopKExtractor extractor;
    private final GreedyNonMaximumSuppression suppression;
    private final int candidateMultiplier;

    public TemplateMatchEngine(BestMatchFinder bestMatchFinder,
                               TopKExtractor extractor,
                               GreedyNonMaximumSuppression suppression,
                               int candidateMultiplier) {
        this.bestMatchFinder = Objects.requireNonNull(bestMatchFinder, "bestMatchFinder");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.suppression = Objects.requireNonNull(suppression, "suppression");
        MatchRequestValidator.requireAtLeastOne("candidate-multiplier", candidateMultiplier);
        this.candidateMultiplier = candidateMultiplier;
    }

    public int candidatePoolSize(int maxResults) {
        MatchRequestValidator.requireAtLeastOne("max-results", maxResults);
        long pool = (long) maxResults * candidateMultiplier;
        return (int) Math.min(Integer.MAX_VALUE, pool);
    }

    /**
     * @param originX x offset of the searched region inside the scene
     * @param originY y offset of the searched region inside the scene
     * @return matches ordered by descending confidence, possibly empty
     */
    public List<MatchCandidate> locate(ScoreField field, MatchMethod method, int templateWidth, int templateHeight,
                                       MatchCriteria criteria, int originX, int originY) {
        Objects.requireNonNull(criteria, "Match criteria must not be null");
        int pool = candidatePoolSize(criteria.maxResults());
        List<MatchCandidate> raw = extractor.extract(field, method, templateWidth, templateHeight,
                pool, criteria.minConfidence());
        List<MatchCandidate> kept = suppression.deduplicate(raw, criteria.iouThreshold(), criteria.maxResults());
        log.debug("Extracted {} raw candidates (pool {}), kept {} after NMS at {}",
                raw.size(), pool, kept.size(), criteria.iouThreshold());

        List<MatchCandidate> translated = new ArrayList<>(kept.size());
        for (MatchCandidate candidate : kept) {
            translated.add(candidate.translate(originX, originY));
        }
        return List.copyOf(translated);
    }

    public MatchCandidate locateBest(ScoreField field, MatchMethod method, int templateWidth, int templateHeight,
                                     int originX, int originY) {
        return bestMatchFinder.findBest(field, method, templateWidth, templateHeight).translate(originX, originY);
    }
}

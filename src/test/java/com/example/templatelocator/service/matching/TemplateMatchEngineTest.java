package com.example.templatelocator.service.matching;

import com.example.templatelocator.model.BoundingBox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateMatchEngineTest {

    private TemplateMatchEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TemplateMatchEngine(new BestMatchFinder(), new TopKExtractor(),
                new GreedyNonMaximumSuppression(), TemplateMatchEngine.DEFAULT_CANDIDATE_MULTIPLIER);
    }

    @Test
    void reportsBothOfTwoSeparatedPeaks() {
        ScoreField field = ScoreFields.withPeaks(90, 40, 0.2f,
                new int[][]{{10, 10}, {60, 10}}, new float[]{0.95f, 0.95f});

        List<MatchCandidate> raw = new TopKExtractor().extract(field, MatchMethod.CCORR_NORMED, 10, 10, 5, 0.0);
        List<MatchCandidate> kept = new GreedyNonMaximumSuppression().deduplicate(raw, 0.3, 5);

        assertThat(raw).hasSize(5);
        assertThat(raw.subList(0, 2)).extracting(MatchCandidate::boundingBox)
                .containsExactly(new BoundingBox(10, 10, 10, 10), new BoundingBox(60, 10, 10, 10));
        assertThat(kept.subList(0, 2)).extracting(MatchCandidate::boundingBox)
                .containsExactly(new BoundingBox(10, 10, 10, 10), new BoundingBox(60, 10, 10, 10));
    }

    @Test
    void collapsesTwoOverlappingPeaks() {
        ScoreField field = ScoreFields.withPeaks(60, 40, 0.1f,
                new int[][]{{20, 10}, {23, 10}}, new float[]{0.95f, 0.90f});

        List<MatchCandidate> matches = engine.locate(field, MatchMethod.CCORR_NORMED, 10, 10,
                new MatchCriteria(5, 0.5, 0.3), 0, 0);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).boundingBox()).isEqualTo(new BoundingBox(20, 10, 10, 10));
    }

    @Test
    void translatesMatchesByRegionOrigin() {
        ScoreField field = ScoreFields.withPeaks(70, 50, 0.1f,
                new int[][]{{5, 8}, {40, 30}}, new float[]{0.97f, 0.92f});
        MatchCriteria criteria = new MatchCriteria(3, 0.8, 0.3);

        List<MatchCandidate> local = engine.locate(field, MatchMethod.CCORR_NORMED, 12, 12, criteria, 0, 0);
        List<MatchCandidate> scene = engine.locate(field, MatchMethod.CCORR_NORMED, 12, 12, criteria, 20, 15);

        assertThat(scene).hasSameSizeAs(local).hasSize(2);
        for (int i = 0; i < local.size(); i++) {
            assertThat(scene.get(i).boundingBox().x()).isEqualTo(local.get(i).boundingBox().x() + 20);
            assertThat(scene.get(i).boundingBox().y()).isEqualTo(local.get(i).boundingBox().y() + 15);
            assertThat(scene.get(i).confidence()).isEqualTo(local.get(i).confidence());
        }
    }

    @Test
    void emptyResultWhenNothingReachesMinScore() {
        ScoreField field = ScoreField.filled(30, 30, 0.1f);

        List<MatchCandidate> matches = engine.locate(field, MatchMethod.CCOEFF_NORMED, 5, 5,
                new MatchCriteria(5, 0.8, 0.3), 0, 0);

        assertThat(matches).isEmpty();
    }

    @Test
    void repeatedRunsAreIdentical() {
        float[] samples = new float[64 * 48];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (float) Math.sin(i * 0.37) * (float) Math.cos(i * 0.011);
        }
        ScoreField field = new ScoreField(64, 48, samples);
        MatchCriteria criteria = new MatchCriteria(6, 0.55, 0.2);

        List<MatchCandidate> first = engine.locate(field, MatchMethod.CCOEFF_NORMED, 8, 6, criteria, 3, 4);
        List<MatchCandidate> second = engine.locate(field, MatchMethod.CCOEFF_NORMED, 8, 6, criteria, 3, 4);

        assertThat(first).isNotEmpty().isEqualTo(second);
    }

    @Test
    void bestMatchIsTranslated() {
        ScoreField field = ScoreFields.withPeaks(30, 30, 0.9f, new int[][]{{7, 3}}, new float[]{0.02f});

        MatchCandidate best = engine.locateBest(field, MatchMethod.SQDIFF_NORMED, 6, 6, 20, 15);

        assertThat(best.boundingBox()).isEqualTo(new BoundingBox(27, 18, 6, 6));
    }

    @Test
    void candidatePoolScalesWithRequestedResults() {
        assertThat(engine.candidatePoolSize(5)).isEqualTo(50);
        assertThat(engine.candidatePoolSize(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
        assertThatThrownBy(() -> engine.candidatePoolSize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void criteriaRejectOutOfRangeValues() {
        assertThatThrownBy(() -> new MatchCriteria(0, 0.5, 0.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MatchCriteria(1, Double.NaN, 0.3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MatchCriteria(1, 0.5, 1.01)).isInstanceOf(IllegalArgumentException.class);
    }
}

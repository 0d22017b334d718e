package com.example.templatelocator.service.matching;

import com.example.templatelocator.model.BoundingBox;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BestMatchFinderTest {

    private final BestMatchFinder finder = new BestMatchFinder();

    @Test
    void findsMaximumForCorrelation() {
        ScoreField field = ScoreFields.withPeaks(40, 30, 0.1f,
                new int[][]{{5, 5}, {31, 22}}, new float[]{0.7f, 0.93f});

        MatchCandidate best = finder.findBest(field, MatchMethod.CCORR_NORMED, 12, 8);

        assertThat(best.boundingBox()).isEqualTo(new BoundingBox(31, 22, 12, 8));
        assertThat(best.rawScore()).isCloseTo(0.93, within(1e-6));
        assertThat(best.confidence()).isCloseTo(0.93, within(1e-6));
    }

    @Test
    void findsMinimumForSquaredDifference() {
        ScoreField field = ScoreFields.withPeaks(20, 20, 0.8f,
                new int[][]{{3, 17}}, new float[]{0.05f});

        MatchCandidate best = finder.findBest(field, MatchMethod.SQDIFF_NORMED, 4, 4);

        assertThat(best.boundingBox().x()).isEqualTo(3);
        assertThat(best.boundingBox().y()).isEqualTo(17);
        assertThat(best.confidence()).isCloseTo(0.95, within(1e-6));
    }

    @Test
    void firstOccurrenceInRowMajorOrderWinsTies() {
        ScoreField field = ScoreFields.withPeaks(10, 10, 0f,
                new int[][]{{8, 1}, {2, 4}, {1, 1}}, new float[]{0.9f, 0.9f, 0.9f});

        MatchCandidate best = finder.findBest(field, MatchMethod.CCOEFF_NORMED, 3, 3);

        assertThat(best.boundingBox().x()).isEqualTo(1);
        assertThat(best.boundingBox().y()).isEqualTo(1);
    }

    @Test
    void ignoresNaNSamples() {
        ScoreField field = ScoreFields.withPeaks(4, 1, 0.2f,
                new int[][]{{0, 0}, {2, 0}}, new float[]{Float.NaN, 0.4f});

        MatchCandidate best = finder.findBest(field, MatchMethod.CCORR_NORMED, 1, 1);

        assertThat(best.boundingBox().x()).isEqualTo(2);
    }

    @Test
    void rejectsInvalidTemplateSize() {
        ScoreField field = ScoreField.filled(5, 5, 0.5f);

        assertThatThrownBy(() -> finder.findBest(field, MatchMethod.CCORR_NORMED, 0, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Template dimensions");
    }

    @Test
    void rejectsEmptyField() {
        assertThatThrownBy(() -> new ScoreField(0, 3, new float[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

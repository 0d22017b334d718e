package com.example.templatelocator.service;

import com.example.templatelocator.config.MatchingProperties;
import com.example.templatelocator.model.BoundingBox;
import com.example.templatelocator.service.matching.MatchMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchOptionsResolverTest {

    private MatchingProperties properties;
    private MatchOptionsResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        resolver = new MatchOptionsResolver(properties);
    }

    @Test
    void fallsBackToConfiguredDefaults() {
        MatchSettings settings = resolver.resolve(null);

        assertThat(settings.method()).isEqualTo(MatchMethod.CCOEFF_NORMED);
        assertThat(settings.mode()).isEqualTo(ColorMode.GRAY);
        assertThat(settings.criteria().maxResults()).isEqualTo(5);
        assertThat(settings.criteria().minConfidence()).isEqualTo(0.80);
        assertThat(settings.criteria().iouThreshold()).isEqualTo(0.30);
        assertThat(settings.draw()).isEqualTo(DrawMode.BBOX_LABEL_SCORE);
        assertThat(settings.thickness()).isEqualTo(2);
        assertThat(settings.fontScale()).isEqualTo(0.5);
        assertThat(settings.roi()).isNull();
        assertThat(settings.heatmap()).isFalse();
    }

    @Test
    void requestValuesOverrideDefaults() {
        properties.setDefaultMethod("ccorr_normed");
        MatchOptions options = new MatchOptions("sqdiff_normed", "color", 3, 0.6, 0.5, "10,20,100,80",
                "bbox", 1, 0.8, true, true);

        MatchSettings settings = resolver.resolve(options);

        assertThat(settings.method()).isEqualTo(MatchMethod.SQDIFF_NORMED);
        assertThat(settings.mode()).isEqualTo(ColorMode.COLOR);
        assertThat(settings.criteria().maxResults()).isEqualTo(3);
        assertThat(settings.roi()).isEqualTo(new BoundingBox(10, 20, 100, 80));
        assertThat(settings.draw()).isEqualTo(DrawMode.BBOX);
        assertThat(settings.heatmap()).isTrue();
        assertThat(settings.annotate()).isTrue();
    }

    @Test
    void rejectsOutOfRangeThresholds() {
        assertThatThrownBy(() -> resolver.resolve(options(null, 1.2, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("min-score");
        assertThatThrownBy(() -> resolver.resolve(options(null, null, -0.1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nms");
        assertThatThrownBy(() -> resolver.resolve(options(0, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-results");
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> resolver.resolve(new MatchOptions("tm_sqdiff", null, null, null, null, null,
                null, null, null, false, false))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(new MatchOptions(null, "hsv", null, null, null, null,
                null, null, null, false, false))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(new MatchOptions(null, null, null, null, null, null,
                "label", null, null, false, false))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(new MatchOptions(null, null, null, null, null, null,
                null, 0, null, false, false))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(new MatchOptions(null, null, null, null, null, null,
                null, null, 0.0, false, false))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesRegionOfInterest() {
        assertThat(MatchOptionsResolver.parseRoi(" 5, 6 ,7,8")).isEqualTo(new BoundingBox(5, 6, 7, 8));
        assertThatThrownBy(() -> MatchOptionsResolver.parseRoi("5,6,7"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchOptionsResolver.parseRoi("a,6,7,8"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchOptionsResolver.parseRoi("-1,6,7,8"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchOptionsResolver.parseRoi("1,6,0,8"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchOptionsResolver.parseRoi("1,2,3,4,"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected x,y,w,h");
    }

    private static MatchOptions options(Integer maxResults, Double minScore, Double nms) {
        return new MatchOptions(null, null, maxResults, minScore, nms, null, null, null, null, false, false);
    }
}

package com.example.templatelocator.service;

import com.example.templatelocator.config.MatchingProperties;
import com.example.templatelocator.model.BoundingBox;
import com.example.templatelocator.service.matching.MatchCandidate;
import com.example.templatelocator.service.matching.ScoreField;
import com.example.templatelocator.service.matching.TemplateMatchEngine;
import com.example.templatelocator.service.opencv.MatchRenderer;
import com.example.templatelocator.service.opencv.OpenCvImages;
import com.example.templatelocator.service.opencv.OpenCvTemplateScorer;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

@Service
public class TemplateMatchingService {

    private static final Logger log = LoggerFactory.getLogger(TemplateMatchingService.class);

    private final MatchingProperties properties;
    private final MatchOptionsResolver resolver;
    private final OpenCvTemplateScorer scorer;
    private final TemplateMatchEngine engine;
    private final MatchRenderer renderer;

    public TemplateMatchingService(MatchingProperties properties,
                                   MatchOptionsResolver resolver,
                                   OpenCvTemplateScorer scorer,
                                   TemplateMatchEngine engine,
                                   MatchRenderer renderer) {
        this.properties = properties;
        this.resolver = resolver;
        this.scorer = scorer;
        this.engine = engine;
        this.renderer = renderer;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public MatchSettings defaultSettings() {
        return resolver.resolve(MatchOptions.defaults());
    }

    public int candidatePoolSize(int maxResults) {
        return engine.candidatePoolSize(maxResults);
    }

    /**
     * Finds up to {@code maxResults} distinct occurrences of the template.
     * An empty match list means nothing reached the minimum score.
     */
    public MatchReport match(BufferedImage scene, BufferedImage template, MatchOptions options) {
        return run(scene, template, options, false);
    }

    /**
     * Reports the single best position regardless of the minimum score.
     */
    public MatchReport matchBest(BufferedImage scene, BufferedImage template, MatchOptions options) {
        return run(scene, template, options, true);
    }

    private MatchReport run(BufferedImage scene, BufferedImage template, MatchOptions options, boolean bestOnly) {
        Objects.requireNonNull(scene, "Scene image must not be null");
        Objects.requireNonNull(template, "Template image must not be null");
        if (!properties.isEnabled()) {
            throw new IllegalStateException("Template matching is disabled via configuration");
        }
        MatchSettings settings = resolver.resolve(options);
        long start = System.nanoTime();

        Mat sceneSource = OpenCvImages.fromBufferedImage(scene);
        Mat templateSource = OpenCvImages.fromBufferedImage(template);
        Mat sceneProcessed = null;
        Mat templateProcessed = null;
        Mat searchArea = null;
        try {
            sceneProcessed = OpenCvImages.convert(sceneSource, settings.mode());
            templateProcessed = OpenCvImages.convert(templateSource, settings.mode());
            int templateWidth = templateProcessed.cols();
            int templateHeight = templateProcessed.rows();
            requireFits(templateWidth, templateHeight, sceneProcessed.cols(), sceneProcessed.rows());

            BoundingBox roi = settings.roi();
            if (roi != null) {
                BoundingBox bounds = new BoundingBox(0, 0, sceneProcessed.cols(), sceneProcessed.rows());
                if (!bounds.contains(roi)) {
                    throw new IllegalArgumentException("roi out of bounds: " + roi
                            + " (scene " + sceneProcessed.cols() + "x" + sceneProcessed.rows() + ")");
                }
                requireFits(templateWidth, templateHeight, roi.width(), roi.height());
                searchArea = new Mat(sceneProcessed, new Rect(roi.x(), roi.y(), roi.width(), roi.height()));
            } else {
                searchArea = sceneProcessed;
            }
            int originX = roi != null ? roi.x() : 0;
            int originY = roi != null ? roi.y() : 0;

            ScoreField field = scorer.score(searchArea, templateProcessed, settings.method());
            List<MatchCandidate> matches = bestOnly
                    ? List.of(engine.locateBest(field, settings.method(), templateWidth, templateHeight, originX, originY))
                    : engine.locate(field, settings.method(), templateWidth, templateHeight,
                    settings.criteria(), originX, originY);

            byte[] heatmap = settings.heatmap() ? renderer.heatmap(field, settings.method()) : null;
            byte[] annotated = settings.annotate()
                    ? renderer.annotate(sceneSource, matches, settings.draw(), settings.thickness(), settings.fontScale())
                    : null;

            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            MatchReport report = new MatchReport(sceneProcessed.cols(), sceneProcessed.rows(), templateWidth,
                    templateHeight, settings, matches, elapsedMs, heatmap, annotated);
            MatchCandidate best = report.best();
            if (best == null) {
                log.debug("No match reached min score {} ({} ms)", settings.criteria().minConfidence(), elapsedMs);
            } else {
                log.debug("Found {} match(es) in {} ms, best conf={} raw={} at x={} y={}", matches.size(), elapsedMs,
                        best.confidence(), best.rawScore(), best.boundingBox().x(), best.boundingBox().y());
            }
            return report;
        } finally {
            if (searchArea != null && searchArea != sceneProcessed) {
                searchArea.release();
            }
            if (sceneProcessed != null) {
                sceneProcessed.release();
            }
            if (templateProcessed != null) {
                templateProcessed.release();
            }
            sceneSource.release();
            templateSource.release();
        }
    }

    private void requireFits(int templateWidth, int templateHeight, int sceneWidth, int sceneHeight) {
        if (templateWidth > sceneWidth || templateHeight > sceneHeight) {
            throw new IllegalArgumentException(String.format(
                    "Template larger than scene (templ: %dx%d, scene: %dx%d)",
                    templateWidth, templateHeight, sceneWidth, sceneHeight));
        }
    }
}

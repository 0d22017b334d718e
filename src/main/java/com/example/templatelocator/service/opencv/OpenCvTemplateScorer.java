package com.example.templatelocator.service.opencv;

import com.example.templatelocator.service.matching.MatchMethod;
import com.example.templatelocator.service.matching.ScoreField;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Produces the score field of a template slid over a scene with
 * {@link Imgproc#matchTemplate}.
 */
@Component
public class OpenCvTemplateScorer {

    static {
        OpenCvImages.ensureLoaded();
    }

    public ScoreField score(Mat scene, Mat template, MatchMethod method) {
        Objects.requireNonNull(scene, "Scene must not be null");
        Objects.requireNonNull(template, "Template must not be null");
        if (scene.empty() || template.empty()) {
            throw new IllegalArgumentException("Scene and template must not be empty");
        }
        if (template.cols() > scene.cols() || template.rows() > scene.rows()) {
            throw new IllegalArgumentException(String.format(
                    "Template larger than scene (templ: %dx%d, scene: %dx%d)",
                    template.cols(), template.rows(), scene.cols(), scene.rows()));
        }
        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(scene, template, result, toOpenCvMethod(method));
            return OpenCvImages.toScoreField(result);
        } finally {
            result.release();
        }
    }

    static int toOpenCvMethod(MatchMethod method) {
        return switch (method) {
            case CCOEFF_NORMED -> Imgproc.TM_CCOEFF_NORMED;
            case CCORR_NORMED -> Imgproc.TM_CCORR_NORMED;
            case SQDIFF_NORMED -> Imgproc.TM_SQDIFF_NORMED;
        };
    }
}

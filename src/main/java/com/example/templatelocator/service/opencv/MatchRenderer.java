package com.example.templatelocator.service.opencv;

import com.example.templatelocator.model.BoundingBox;
import com.example.templatelocator.service.DrawMode;
import com.example.templatelocator.service.matching.MatchCandidate;
import com.example.templatelocator.service.matching.MatchMethod;
import com.example.templatelocator.service.matching.ScoreField;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders match results as PNG images: a JET coloured heatmap of the score
 * field and the scene annotated with the reported boxes.
 */
@Component
public class MatchRenderer {

    static {
        OpenCvImages.ensureLoaded();
    }

    private static final Scalar BOX_COLOR = new Scalar(0, 255, 0);

    /**
     * Hot regions are good matches for every method; squared-difference
     * scores are inverted first.
     */
    public byte[] heatmap(ScoreField field, MatchMethod method) {
        Mat heat = OpenCvImages.toMat(field);
        Mat normalized = new Mat();
        Mat colored = new Mat();
        try {
            if (method.bestIsMinimum()) {
                heat.convertTo(heat, CvType.CV_32F, -1.0, 1.0);
            }
            Core.normalize(heat, normalized, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);
            Imgproc.applyColorMap(normalized, colored, Imgproc.COLORMAP_JET);
            return OpenCvImages.encodePng(colored);
        } finally {
            heat.release();
            normalized.release();
            colored.release();
        }
    }

    public byte[] annotate(Mat scene, List<MatchCandidate> matches, DrawMode draw, int thickness, double fontScale) {
        Mat canvas = OpenCvImages.toBgr(scene);
        try {
            for (int i = 0; i < matches.size(); i++) {
                MatchCandidate match = matches.get(i);
                BoundingBox box = match.boundingBox();
                Imgproc.rectangle(canvas, new Rect(box.x(), box.y(), box.width(), box.height()), BOX_COLOR, thickness);
                if (draw.drawsLabel()) {
                    Point origin = new Point(box.x(), box.y() > 5 ? box.y() - 5 : 0);
                    Imgproc.putText(canvas, label(i, match, draw), origin, Imgproc.FONT_HERSHEY_SIMPLEX,
                            fontScale, BOX_COLOR, 1);
                }
            }
            return OpenCvImages.encodePng(canvas);
        } finally {
            canvas.release();
        }
    }

    static String label(int index, MatchCandidate match, DrawMode draw) {
        if (draw.drawsScore()) {
            return String.format(Locale.ROOT, "#%d conf:%.2f", index, match.confidence());
        }
        return "#" + index;
    }
}

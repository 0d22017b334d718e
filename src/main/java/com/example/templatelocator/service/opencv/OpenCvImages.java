package com.example.templatelocator.service.opencv;

import com.example.templatelocator.service.ColorMode;
import com.example.templatelocator.service.matching.ScoreField;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Objects;

/**
 * Conversions between AWT images, OpenCV matrices and score fields. Loading
 * this class loads the OpenCV native libraries.
 */
public final class OpenCvImages {

    private static final Logger log = LoggerFactory.getLogger(OpenCvImages.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private OpenCvImages() {
    }

    /**
     * Forces the native libraries to be loaded before the first matrix is allocated.
     */
    public static void ensureLoaded() {
        // class initialisation does the work
    }

    /**
     * @return a 3-channel BGR matrix with a copy of the image pixels
     */
    public static Mat fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "BufferedImage must not be null");
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] data = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    public static Mat convert(Mat source, ColorMode mode) {
        return mode == ColorMode.GRAY ? toGray(source) : toBgr(source);
    }

    public static Mat toGray(Mat source) {
        Mat gray = new Mat();
        switch (source.channels()) {
            case 1 -> source.copyTo(gray);
            case 3 -> Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGR2GRAY);
            case 4 -> Imgproc.cvtColor(source, gray, Imgproc.COLOR_BGRA2GRAY);
            default -> {
                gray.release();
                throw new IllegalArgumentException("Can't convert to gray (channels=" + source.channels() + ")");
            }
        }
        return gray;
    }

    public static Mat toBgr(Mat source) {
        Mat bgr = new Mat();
        switch (source.channels()) {
            case 1 -> Imgproc.cvtColor(source, bgr, Imgproc.COLOR_GRAY2BGR);
            case 3 -> source.copyTo(bgr);
            case 4 -> Imgproc.cvtColor(source, bgr, Imgproc.COLOR_BGRA2BGR);
            default -> {
                bgr.release();
                throw new IllegalArgumentException("Unsupported channels: " + source.channels());
            }
        }
        return bgr;
    }

    public static ScoreField toScoreField(Mat result) {
        if (result.empty()) {
            throw new IllegalArgumentException("Score matrix is empty");
        }
        Mat floats = result;
        boolean converted = false;
        if (result.type() != CvType.CV_32FC1) {
            floats = new Mat();
            result.convertTo(floats, CvType.CV_32F);
            converted = true;
        }
        try {
            float[] data = new float[(int) floats.total()];
            floats.get(0, 0, data);
            return new ScoreField(floats.cols(), floats.rows(), data);
        } finally {
            if (converted) {
                floats.release();
            }
        }
    }

    public static Mat toMat(ScoreField field) {
        Mat mat = new Mat(field.height(), field.width(), CvType.CV_32FC1);
        mat.put(0, 0, field.copyValues());
        return mat;
    }

    public static byte[] encodePng(Mat mat) {
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", mat, buffer)) {
                throw new IllegalStateException("Failed to encode image to PNG");
            }
            return buffer.toArray();
        } finally {
            buffer.release();
        }
    }
}

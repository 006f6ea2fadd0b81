package com.example.facelandmarker.engine.onnx;

import com.example.facelandmarker.engine.EngineException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.objdetect.FaceDetectorYN;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds face boxes with OpenCV's YuNet detector and turns them into landmark crop regions.
 * Each YuNet row holds the box, five key points (right eye, left eye, nose, mouth corners) and a
 * score; the eye key points give the region's roll.
 */
final class FaceRegionDetector {

    private static final Logger log = LoggerFactory.getLogger(FaceRegionDetector.class);

    private static final float NMS_THRESHOLD = 0.3f;
    private static final int TOP_K = 5000;
    private static final int ROW_LENGTH = 15;
    private static final float REGION_SCALE = 1.5f;

    private final FaceDetectorYN detector;

    private FaceRegionDetector(FaceDetectorYN detector) {
        this.detector = detector;
    }

    static FaceRegionDetector load(Path model, float scoreThreshold) throws EngineException {
        try {
            FaceDetectorYN detector = FaceDetectorYN.create(model.toString(), "", new Size(320, 320),
                    scoreThreshold, NMS_THRESHOLD, TOP_K);
            log.info("Loaded face detector from {}", model);
            return new FaceRegionDetector(detector);
        } catch (RuntimeException ex) {
            throw new EngineException(EngineException.Stage.LOAD, "Unable to load face detector " + model.getFileName(), ex);
        }
    }

    List<FaceRegion> detect(Mat bgr, int maxFaces) {
        detector.setInputSize(new Size(bgr.cols(), bgr.rows()));
        Mat faces = new Mat();
        try {
            detector.detect(bgr, faces);
            List<FaceRegion> regions = new ArrayList<>(faces.rows());
            float[] row = new float[ROW_LENGTH];
            for (int i = 0; i < faces.rows(); i++) {
                faces.get(i, 0, row);
                regions.add(toRegion(row));
            }
            regions.sort(Comparator.comparingDouble(FaceRegion::score).reversed());
            return regions.size() > maxFaces ? new ArrayList<>(regions.subList(0, maxFaces)) : regions;
        } finally {
            faces.release();
        }
    }

    private static FaceRegion toRegion(float[] row) {
        float x = row[0];
        float y = row[1];
        float width = row[2];
        float height = row[3];
        float rightEyeX = row[4];
        float rightEyeY = row[5];
        float leftEyeX = row[6];
        float leftEyeY = row[7];
        double roll = Math.toDegrees(Math.atan2(leftEyeY - rightEyeY, leftEyeX - rightEyeX));
        return new FaceRegion(x + width / 2f, y + height / 2f, Math.max(width, height) * REGION_SCALE,
                (float) roll, row[ROW_LENGTH - 1]);
    }
}

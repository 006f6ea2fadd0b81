package com.example.facelandmarker.engine.onnx;

import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.components.containers.TransformMatrix;
import com.example.facelandmarker.engine.EngineException;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.MatOfPoint3f;
import org.opencv.core.Point;
import org.opencv.core.Point3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Estimates the pose of the canonical face model from detected landmarks. The camera is a pinhole
 * with a 63 degree vertical field of view centred on the image; the fit is OpenCV's PnP solver.
 * The resulting 4x4 matrix uses the y-up, looking-down -z convention of the canonical model, so a
 * frontal face yields an identity rotation and a negative z translation in centimetres.
 */
final class FaceGeometry {

    private static final Logger log = LoggerFactory.getLogger(FaceGeometry.class);

    private static final double VERTICAL_FOV_DEGREES = 63.0;
    private static final int MIN_VERTICES = 6;

    private final Point3[] canonicalVertices;

    private FaceGeometry(Point3[] canonicalVertices) {
        this.canonicalVertices = canonicalVertices;
    }

    static FaceGeometry load(Path canonicalModel) throws EngineException {
        String content;
        try {
            content = Files.readString(canonicalModel, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new EngineException(EngineException.Stage.LOAD, "Unable to read " + canonicalModel.getFileName(), ex);
        }
        String[] tokens = content.trim().split("[,\\s]+");
        float[] coordinates = new float[tokens.length];
        try {
            for (int i = 0; i < tokens.length; i++) {
                coordinates[i] = Float.parseFloat(tokens[i]);
            }
        } catch (NumberFormatException ex) {
            throw new EngineException(EngineException.Stage.LOAD,
                    "Invalid coordinate in " + canonicalModel.getFileName(), ex);
        }
        FaceGeometry geometry = of(coordinates);
        log.info("Loaded canonical face model with {} vertices", geometry.canonicalVertices.length);
        return geometry;
    }

    static FaceGeometry of(float[] coordinates) throws EngineException {
        if (coordinates.length % 3 != 0 || coordinates.length / 3 < MIN_VERTICES) {
            throw new EngineException(EngineException.Stage.LOAD, "Canonical face model needs at least "
                    + MIN_VERTICES + " x y z vertices, got " + coordinates.length + " values");
        }
        Point3[] vertices = new Point3[coordinates.length / 3];
        for (int i = 0; i < vertices.length; i++) {
            vertices[i] = new Point3(coordinates[i * 3], coordinates[i * 3 + 1], coordinates[i * 3 + 2]);
        }
        return new FaceGeometry(vertices);
    }

    TransformMatrix estimate(List<NormalizedLandmark> landmarks, int width, int height) throws EngineException {
        if (landmarks.size() < canonicalVertices.length) {
            throw new EngineException(EngineException.Stage.RUN, "Canonical face model has "
                    + canonicalVertices.length + " vertices but only " + landmarks.size() + " landmarks were found");
        }
        Point[] imagePoints = new Point[canonicalVertices.length];
        for (int i = 0; i < imagePoints.length; i++) {
            NormalizedLandmark landmark = landmarks.get(i);
            imagePoints[i] = new Point(landmark.x() * width, landmark.y() * height);
        }
        double focalLength = height / (2.0 * Math.tan(Math.toRadians(VERTICAL_FOV_DEGREES / 2.0)));

        MatOfPoint3f objectMat = new MatOfPoint3f(canonicalVertices);
        MatOfPoint2f imageMat = new MatOfPoint2f(imagePoints);
        Mat cameraMatrix = Mat.zeros(3, 3, CvType.CV_64F);
        MatOfDouble distortion = new MatOfDouble(0, 0, 0, 0);
        Mat rvec = new Mat();
        Mat tvec = new Mat();
        Mat rotation = new Mat();
        try {
            cameraMatrix.put(0, 0, focalLength, 0, width / 2.0, 0, focalLength, height / 2.0, 0, 0, 1);
            if (!Calib3d.solvePnP(objectMat, imageMat, cameraMatrix, distortion, rvec, tvec)) {
                throw new EngineException(EngineException.Stage.RUN, "Face pose could not be estimated");
            }
            Calib3d.Rodrigues(rvec, rotation);
            // OpenCV cameras look down +z with y down; flip both axes into the canonical convention.
            float[] matrix = new float[16];
            for (int r = 0; r < 3; r++) {
                double sign = r == 0 ? 1.0 : -1.0;
                for (int c = 0; c < 3; c++) {
                    matrix[r * 4 + c] = (float) (sign * rotation.get(r, c)[0]);
                }
                matrix[r * 4 + 3] = (float) (sign * tvec.get(r, 0)[0]);
            }
            matrix[15] = 1f;
            return new TransformMatrix(4, 4, matrix);
        } finally {
            objectMat.release();
            imageMat.release();
            cameraMatrix.release();
            distortion.release();
            rvec.release();
            tvec.release();
            rotation.release();
        }
    }
}

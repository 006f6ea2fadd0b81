package com.example.facelandmarker.engine.onnx;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

final class RegionCrop implements AutoCloseable {

    private final Mat pixels;
    private final double[] inverse;
    private final float pixelScale;

    private RegionCrop(Mat pixels, double[] inverse, float pixelScale) {
        this.pixels = pixels;
        this.inverse = inverse;
        this.pixelScale = pixelScale;
    }

    static RegionCrop cut(Mat upright, FaceRegion region, int inputSize) {
        double scale = inputSize / (double) region.size();
        Mat transform = Imgproc.getRotationMatrix2D(new Point(region.centerX(), region.centerY()),
                region.angleDegrees(), scale);
        Mat inverted = new Mat();
        try {
            transform.put(0, 2, transform.get(0, 2)[0] + inputSize / 2.0 - region.centerX());
            transform.put(1, 2, transform.get(1, 2)[0] + inputSize / 2.0 - region.centerY());
            Mat crop = new Mat();
            Imgproc.warpAffine(upright, crop, transform, new Size(inputSize, inputSize),
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(0, 0, 0));
            Imgproc.invertAffineTransform(transform, inverted);
            double[] inverse = new double[6];
            for (int r = 0; r < 2; r++) {
                for (int c = 0; c < 3; c++) {
                    inverse[r * 3 + c] = inverted.get(r, c)[0];
                }
            }
            return new RegionCrop(crop, inverse, (float) (region.size() / inputSize));
        } finally {
            transform.release();
            inverted.release();
        }
    }

    Mat pixels() {
        return pixels;
    }

    float[] toImage(float x, float y) {
        return new float[]{
                (float) (inverse[0] * x + inverse[1] * y + inverse[2]),
                (float) (inverse[3] * x + inverse[4] * y + inverse[5])
        };
    }

    float pixelScale() {
        return pixelScale;
    }

    @Override
    public void close() {
        pixels.release();
    }
}

package com.example.facelandmarker.engine.onnx;

import com.example.facelandmarker.engine.EngineException;
import com.example.facelandmarker.vision.core.ImageOrientation;
import com.example.facelandmarker.vision.core.ImageProcessingOptions;
import com.example.facelandmarker.vision.core.PixelFormat;
import com.example.facelandmarker.vision.core.RegionOfInterest;
import com.example.facelandmarker.vision.core.VisionImage;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Turns a {@link VisionImage} into an upright 8-bit BGR {@link Mat}: pixels are unpacked,
 * rotated and mirrored according to the orientation, then cropped to the region of interest.
 */
final class FrameConverter {

    private FrameConverter() {
    }

    static Mat toUprightBgr(VisionImage image, ImageProcessingOptions processingOptions) throws EngineException {
        Mat raw = image.getBitmap().isPresent()
                ? bufferedImageToMat(image.getBitmap().get())
                : pixelBufferToMat(image);
        Mat upright = orient(raw, processingOptions.orientation());
        if (upright != raw) {
            raw.release();
        }
        RegionOfInterest roi = processingOptions.regionOfInterest();
        if (roi.isWholeImage()) {
            return upright;
        }
        Rect rect = toPixelRect(roi, upright.cols(), upright.rows());
        Mat cropped = new Mat(upright, rect).clone();
        upright.release();
        return cropped;
    }

    static Mat orient(Mat source, ImageOrientation orientation) {
        Mat current = source;
        int rotateCode = rotateCode(orientation.rotationDegrees());
        if (rotateCode >= 0) {
            Mat rotated = new Mat();
            Core.rotate(current, rotated, rotateCode);
            current = rotated;
        }
        if (orientation.isMirrored()) {
            Mat flipped = new Mat();
            Core.flip(current, flipped, 1);
            if (current != source) {
                current.release();
            }
            current = flipped;
        }
        return current;
    }

    private static int rotateCode(int rotationDegrees) {
        if (rotationDegrees == 90) {
            return Core.ROTATE_90_CLOCKWISE;
        }
        if (rotationDegrees == 180) {
            return Core.ROTATE_180;
        }
        if (rotationDegrees == 270) {
            return Core.ROTATE_90_COUNTERCLOCKWISE;
        }
        return -1;
    }

    private static Mat bufferedImageToMat(BufferedImage image) {
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

    private static Mat pixelBufferToMat(VisionImage image) throws EngineException {
        PixelFormat format = image.getPixelFormat()
                .orElseThrow(() -> new EngineException(EngineException.Stage.INPUT, "Pixel buffer without pixel format"));
        byte[] pixels = image.getPixels()
                .orElseThrow(() -> new EngineException(EngineException.Stage.INPUT, "Pixel buffer without pixels"));
        int conversion;
        if (format == PixelFormat.BGRA_8888) {
            conversion = Imgproc.COLOR_BGRA2BGR;
        } else if (format == PixelFormat.RGBA_8888) {
            conversion = Imgproc.COLOR_RGBA2BGR;
        } else {
            throw new EngineException(EngineException.Stage.INPUT, "Unsupported pixel format " + format);
        }
        Mat rgba = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC4);
        try {
            int rowBytes = image.getBytesPerRow();
            if (pixels.length == rowBytes * image.getHeight()) {
                rgba.put(0, 0, pixels);
            } else {
                byte[] exact = new byte[rowBytes * image.getHeight()];
                System.arraycopy(pixels, 0, exact, 0, exact.length);
                rgba.put(0, 0, exact);
            }
            Mat bgr = new Mat();
            Imgproc.cvtColor(rgba, bgr, conversion);
            return bgr;
        } finally {
            rgba.release();
        }
    }

    private static Rect toPixelRect(RegionOfInterest roi, int width, int height) {
        int left = Math.min(width - 1, Math.round(roi.left() * width));
        int top = Math.min(height - 1, Math.round(roi.top() * height));
        int right = Math.max(left + 1, Math.round(roi.right() * width));
        int bottom = Math.max(top + 1, Math.round(roi.bottom() * height));
        return new Rect(left, top, Math.min(right, width) - left, Math.min(bottom, height) - top);
    }
}

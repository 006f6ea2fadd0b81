package com.example.facelandmarker.vision.core;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.util.Objects;
import java.util.Optional;

/**
 * Input unit for vision tasks. Wraps either a decoded {@link BufferedImage} or a raw interleaved
 * pixel buffer together with the orientation of the stored pixels.
 *
 * <p>Construction only checks structural consistency (dimensions and buffer length). Whether a
 * task accepts the pixel layout is decided at detection time, see
 * {@link #describeFormatViolation()}.
 */
public final class VisionImage {

    private final ImageSourceType sourceType;
    private final BufferedImage bitmap;
    private final byte[] pixels;
    private final PixelFormat pixelFormat;
    private final int width;
    private final int height;
    private final int bytesPerRow;
    private final ImageOrientation orientation;

    private VisionImage(ImageSourceType sourceType,
                        BufferedImage bitmap,
                        byte[] pixels,
                        PixelFormat pixelFormat,
                        int width,
                        int height,
                        int bytesPerRow,
                        ImageOrientation orientation) {
        this.sourceType = sourceType;
        this.bitmap = bitmap;
        this.pixels = pixels;
        this.pixelFormat = pixelFormat;
        this.width = width;
        this.height = height;
        this.bytesPerRow = bytesPerRow;
        this.orientation = orientation;
    }

    public static VisionImage fromBufferedImage(BufferedImage image) {
        return fromBufferedImage(image, ImageOrientation.UP);
    }

    public static VisionImage fromBufferedImage(BufferedImage image, ImageOrientation orientation) {
        Objects.requireNonNull(image, "BufferedImage must not be null");
        Objects.requireNonNull(orientation, "orientation");
        return new VisionImage(ImageSourceType.IMAGE, image, null, null,
                image.getWidth(), image.getHeight(), 0, orientation);
    }

    public static VisionImage fromPixelBuffer(byte[] pixels, int width, int height, PixelFormat format,
                                              ImageOrientation orientation) {
        return fromBuffer(ImageSourceType.PIXEL_BUFFER, pixels, width, height, format, orientation);
    }

    public static VisionImage fromSampleBuffer(byte[] pixels, int width, int height, PixelFormat format,
                                               ImageOrientation orientation) {
        return fromBuffer(ImageSourceType.SAMPLE_BUFFER, pixels, width, height, format, orientation);
    }

    private static VisionImage fromBuffer(ImageSourceType sourceType, byte[] pixels, int width, int height,
                                          PixelFormat format, ImageOrientation orientation) {
        Objects.requireNonNull(pixels, "pixels");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(orientation, "orientation");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive, got " + width + "x" + height);
        }
        long rowLength = (long) width * format.bytesPerPixel();
        if (rowLength > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image row of " + width + " " + format + " pixels exceeds "
                    + Integer.MAX_VALUE + " bytes");
        }
        int bytesPerRow = (int) rowLength;
        long required = rowLength * height;
        if (pixels.length < required) {
            throw new IllegalArgumentException(
                    "Pixel buffer holds " + pixels.length + " bytes but " + width + "x" + height + " "
                            + format + " needs " + required);
        }
        return new VisionImage(sourceType, null, pixels, format, width, height, bytesPerRow, orientation);
    }

    public Optional<String> describeFormatViolation() {
        if (sourceType == ImageSourceType.IMAGE) {
            ColorModel colorModel = bitmap.getColorModel();
            if (colorModel.getColorSpace().getType() != ColorSpace.TYPE_RGB || !colorModel.hasAlpha()) {
                return Optional.of("Image source must use an RGB color space with an alpha channel.");
            }
            return Optional.empty();
        }
        if (!pixelFormat.isAcceptedForBuffers()) {
            return Optional.of("Unsupported pixel format " + pixelFormat
                    + ". Supported pixel formats are BGRA_8888 and RGBA_8888.");
        }
        return Optional.empty();
    }

    public ImageSourceType getSourceType() {
        return sourceType;
    }

    public Optional<BufferedImage> getBitmap() {
        return Optional.ofNullable(bitmap);
    }

    public Optional<byte[]> getPixels() {
        return Optional.ofNullable(pixels);
    }

    public Optional<PixelFormat> getPixelFormat() {
        return Optional.ofNullable(pixelFormat);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBytesPerRow() {
        return bytesPerRow;
    }

    public ImageOrientation getOrientation() {
        return orientation;
    }

    @Override
    public String toString() {
        return "VisionImage[" + sourceType + " " + width + "x" + height
                + (pixelFormat != null ? " " + pixelFormat : "") + " " + orientation + "]";
    }
}

package com.example.facelandmarker.service;

import com.example.facelandmarker.config.FaceLandmarkerProperties;
import com.example.facelandmarker.engine.InferenceEngineFactory;
import com.example.facelandmarker.tasks.TaskOutcome;
import com.example.facelandmarker.vision.core.VisionImage;
import com.example.facelandmarker.vision.facelandmarker.FaceLandmarker;
import com.example.facelandmarker.vision.facelandmarker.FaceLandmarkerResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.util.Objects;

@Service
public class FaceLandmarkService {

    private static final Logger log = LoggerFactory.getLogger(FaceLandmarkService.class);

    private final FaceLandmarkerProperties properties;
    private final InferenceEngineFactory engineFactory;
    private final Object landmarkerLock = new Object();
    private volatile FaceLandmarker landmarker;

    public FaceLandmarkService(FaceLandmarkerProperties properties, InferenceEngineFactory engineFactory) {
        this.properties = properties;
        this.engineFactory = engineFactory;
    }

    public FaceLandmarkerResult detect(BufferedImage image) {
        Objects.requireNonNull(image, "BufferedImage must not be null");
        if (!properties.isEnabled()) {
            throw new IllegalStateException("Face landmark service is disabled via configuration");
        }
        FaceLandmarker current = ensureLandmarker();
        VisionImage visionImage = VisionImage.fromBufferedImage(withAlphaChannel(image));
        long start = System.nanoTime();
        FaceLandmarkerResult result = current.detect(visionImage).orElseThrow();
        log.debug("Face landmark request produced {} face(s) in {} ms",
                result.faceCount(), (System.nanoTime() - start) / 1_000_000.0);
        return result;
    }

    public boolean isModelLoaded() {
        return landmarker != null;
    }

    private FaceLandmarker ensureLandmarker() {
        FaceLandmarker current = landmarker;
        if (current != null) {
            return current;
        }
        synchronized (landmarkerLock) {
            if (landmarker == null) {
                log.info("Loading face landmark model from {}", properties.getModelPath());
                TaskOutcome<FaceLandmarker> created = FaceLandmarker.create(properties.toOptions(), engineFactory);
                landmarker = created.orElseThrow();
            }
            return landmarker;
        }
    }

    static BufferedImage withAlphaChannel(BufferedImage image) {
        if (image.getColorModel().hasAlpha()
                && image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_RGB) {
            return image;
        }
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.setComposite(AlphaComposite.Src);
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }

    @PreDestroy
    public void close() {
        synchronized (landmarkerLock) {
            if (landmarker != null) {
                landmarker.close();
                landmarker = null;
            }
        }
    }
}

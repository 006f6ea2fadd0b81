package com.example.facelandmarker.engine.onnx;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.facelandmarker.components.containers.Classifications;
import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.components.containers.TransformMatrix;
import com.example.facelandmarker.engine.EngineConfig;
import com.example.facelandmarker.engine.EngineException;
import com.example.facelandmarker.engine.EngineOutput;
import com.example.facelandmarker.engine.EngineRequest;
import com.example.facelandmarker.engine.InferenceEngine;
import com.example.facelandmarker.vision.core.RunningMode;
import nu.pattern.OpenCV;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link InferenceEngine}: OpenCV for pixel handling and face detection, ONNX Runtime for
 * the landmark and blendshape models.
 *
 * <p>In video and live stream mode the landmarks of the previous frame seed the crop regions of
 * the next one; the face detector only runs while fewer than {@code numFaces} faces are tracked.
 * Tracked faces whose presence drops below {@code minTrackingConfidence} are released.
 */
public final class OnnxInferenceEngine implements InferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(OnnxInferenceEngine.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries");
    }

    private static final float REGION_SCALE = 1.5f;
    private static final int RIGHT_EYE_OUTER = 33;
    private static final int LEFT_EYE_OUTER = 263;

    private final EngineConfig config;
    private final ModelAsset asset;
    private final LandmarkModel landmarkModel;
    private final FaceRegionDetector faceDetector;
    private final BlendshapeModel blendshapeModel;
    private final FaceGeometry faceGeometry;
    private final boolean tracking;

    private List<FaceRegion> trackedRegions = List.of();
    private boolean closed;

    private OnnxInferenceEngine(EngineConfig config, ModelAsset asset, LandmarkModel landmarkModel,
                                FaceRegionDetector faceDetector, BlendshapeModel blendshapeModel,
                                FaceGeometry faceGeometry) {
        this.config = config;
        this.asset = asset;
        this.landmarkModel = landmarkModel;
        this.faceDetector = faceDetector;
        this.blendshapeModel = blendshapeModel;
        this.faceGeometry = faceGeometry;
        this.tracking = config.runningMode() != RunningMode.IMAGE;
    }

    public static OnnxInferenceEngine open(EngineConfig config) throws EngineException {
        ModelAsset asset = ModelAsset.resolve(config.modelAssetPath());
        FaceGeometry faceGeometry;
        try {
            requireRequestedOutputs(config, asset);
            faceGeometry = config.outputFacialTransformationMatrixes()
                    ? FaceGeometry.load(asset.canonicalFaceModel().get())
                    : null;
        } catch (EngineException ex) {
            asset.close();
            throw ex;
        }
        LandmarkModel landmarkModel = null;
        try (OrtSession.SessionOptions sessionOptions = new OrtSession.SessionOptions()) {
            sessionOptions.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            if (config.numThreads() > 0) {
                sessionOptions.setIntraOpNumThreads(config.numThreads());
            }
            OrtEnvironment environment = OrtEnvironment.getEnvironment();
            landmarkModel = LandmarkModel.load(environment, asset.landmarkModel(), sessionOptions);

            FaceRegionDetector faceDetector = null;
            if (asset.faceDetectorModel().isPresent()) {
                faceDetector = FaceRegionDetector.load(asset.faceDetectorModel().get(), config.minFaceDetectionConfidence());
            } else if (config.numFaces() > 1) {
                log.warn("Model asset {} has no face detector; at most one face is reported", config.modelAssetPath());
            }

            BlendshapeModel blendshapeModel = null;
            if (config.outputFaceBlendshapes()) {
                blendshapeModel = BlendshapeModel.load(environment, asset.blendshapeModel().get(),
                        asset.blendshapeLandmarkSubset().orElse(null), sessionOptions);
            }
            return new OnnxInferenceEngine(config, asset, landmarkModel, faceDetector, blendshapeModel, faceGeometry);
        } catch (OrtException ex) {
            release(landmarkModel, asset);
            throw new EngineException(EngineException.Stage.LOAD, "Unable to configure ONNX Runtime session", ex);
        } catch (EngineException | RuntimeException ex) {
            release(landmarkModel, asset);
            throw ex;
        }
    }

    private static void requireRequestedOutputs(EngineConfig config, ModelAsset asset) throws EngineException {
        if (config.outputFaceBlendshapes() && asset.blendshapeModel().isEmpty()) {
            throw new EngineException(EngineException.Stage.LOAD, "Face blendshapes were requested but "
                    + config.modelAssetPath().getFileName() + " contains no " + ModelAsset.BLENDSHAPES_ENTRY);
        }
        if (config.outputFacialTransformationMatrixes() && asset.canonicalFaceModel().isEmpty()) {
            throw new EngineException(EngineException.Stage.LOAD, "Facial transformation matrixes were requested but "
                    + config.modelAssetPath().getFileName() + " contains no " + ModelAsset.CANONICAL_FACE_ENTRY);
        }
    }

    @Override
    public EngineOutput process(EngineRequest request) throws EngineException {
        if (closed) {
            throw new EngineException(EngineException.Stage.RUN, "Inference engine has been closed");
        }
        Mat upright = FrameConverter.toUprightBgr(request.image(), request.processingOptions());
        try {
            int width = upright.cols();
            int height = upright.rows();
            List<FaceRegion> tracked = tracking ? trackedRegions : List.of();
            List<FaceRegion> regions = selectRegions(upright, tracked);

            List<List<NormalizedLandmark>> faces = new ArrayList<>(regions.size());
            List<Classifications> blendshapes = new ArrayList<>();
            List<TransformMatrix> matrixes = new ArrayList<>();
            List<FaceRegion> nextTracked = new ArrayList<>(regions.size());
            for (FaceRegion region : regions) {
                float threshold = tracked.contains(region)
                        ? config.minTrackingConfidence()
                        : config.minFacePresenceConfidence();
                try (RegionCrop crop = RegionCrop.cut(upright, region, landmarkModel.inputSize())) {
                    LandmarkModel.LandmarkTensor tensor = landmarkModel.run(crop.pixels());
                    if (tensor.presence() < threshold) {
                        log.debug("Dropped face region with presence {} below {}", tensor.presence(), threshold);
                        continue;
                    }
                    List<NormalizedLandmark> landmarks = toNormalized(tensor, crop, width, height);
                    faces.add(landmarks);
                    if (blendshapeModel != null) {
                        blendshapes.add(blendshapeModel.score(landmarks, width, height));
                    }
                    if (faceGeometry != null) {
                        matrixes.add(faceGeometry.estimate(landmarks, width, height));
                    }
                    nextTracked.add(regionFromLandmarks(landmarks, width, height, tensor.presence()));
                }
            }
            if (tracking) {
                trackedRegions = List.copyOf(nextTracked);
            }
            return new EngineOutput(faces, blendshapes, matrixes);
        } finally {
            upright.release();
        }
    }

    private List<FaceRegion> selectRegions(Mat upright, List<FaceRegion> tracked) {
        if (tracked.size() >= config.numFaces()) {
            return tracked;
        }
        List<FaceRegion> detected = faceDetector != null
                ? faceDetector.detect(upright, config.numFaces())
                : List.of(FaceRegion.wholeImage(upright.cols(), upright.rows()));
        List<FaceRegion> regions = new ArrayList<>(tracked);
        for (FaceRegion candidate : detected) {
            if (regions.size() >= config.numFaces()) {
                break;
            }
            boolean alreadyTracked = regions.stream().anyMatch(existing -> overlaps(existing, candidate));
            if (!alreadyTracked) {
                regions.add(candidate);
            }
        }
        return regions;
    }

    private static boolean overlaps(FaceRegion a, FaceRegion b) {
        double distance = Math.hypot(a.centerX() - b.centerX(), a.centerY() - b.centerY());
        return distance < Math.min(a.size(), b.size()) / 2.0;
    }

    private static List<NormalizedLandmark> toNormalized(LandmarkModel.LandmarkTensor tensor, RegionCrop crop,
                                                         int width, int height) {
        float[] xyz = tensor.xyz();
        List<NormalizedLandmark> landmarks = new ArrayList<>(tensor.count());
        for (int i = 0; i < tensor.count(); i++) {
            float[] point = crop.toImage(xyz[i * 3], xyz[i * 3 + 1]);
            float z = xyz[i * 3 + 2] * crop.pixelScale() / width;
            landmarks.add(new NormalizedLandmark(point[0] / width, point[1] / height, z));
        }
        return landmarks;
    }

    static FaceRegion regionFromLandmarks(List<NormalizedLandmark> landmarks, int width, int height, float score) {
        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;
        for (NormalizedLandmark landmark : landmarks) {
            float x = landmark.x() * width;
            float y = landmark.y() * height;
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
        float angle = 0f;
        if (landmarks.size() > LEFT_EYE_OUTER) {
            NormalizedLandmark right = landmarks.get(RIGHT_EYE_OUTER);
            NormalizedLandmark left = landmarks.get(LEFT_EYE_OUTER);
            angle = (float) Math.toDegrees(Math.atan2((left.y() - right.y()) * height, (left.x() - right.x()) * width));
        }
        float size = Math.max(Math.max(maxX - minX, maxY - minY), 1f) * REGION_SCALE;
        return new FaceRegion((minX + maxX) / 2f, (minY + maxY) / 2f, size, angle, score);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (blendshapeModel != null) {
            blendshapeModel.close();
        }
        release(landmarkModel, asset);
        log.info("Released inference engine for {}", config.modelAssetPath());
    }

    private static void release(LandmarkModel landmarkModel, ModelAsset asset) {
        if (landmarkModel != null) {
            landmarkModel.close();
        }
        asset.close();
    }
}

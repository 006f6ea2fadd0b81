package com.example.facelandmarker.vision.facelandmarker;

import com.example.facelandmarker.tasks.TaskError;
import com.example.facelandmarker.vision.core.RunningMode;
import com.example.facelandmarker.vision.core.VisionImage;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public final class FaceLandmarkerOptions {

    @FunctionalInterface
    public interface ResultListener {
        void onResult(FaceLandmarkerResult result, VisionImage image);
    }

    @FunctionalInterface
    public interface ErrorListener {
        void onError(TaskError error);
    }

    private final BaseOptions baseOptions;
    private final RunningMode runningMode;
    private final int numFaces;
    private final float minFaceDetectionConfidence;
    private final float minFacePresenceConfidence;
    private final float minTrackingConfidence;
    private final boolean outputFaceBlendshapes;
    private final boolean outputFacialTransformationMatrixes;
    private final ResultListener resultListener;
    private final ErrorListener errorListener;

    private FaceLandmarkerOptions(Builder builder) {
        this.baseOptions = builder.baseOptions;
        this.runningMode = builder.runningMode;
        this.numFaces = builder.numFaces;
        this.minFaceDetectionConfidence = builder.minFaceDetectionConfidence;
        this.minFacePresenceConfidence = builder.minFacePresenceConfidence;
        this.minTrackingConfidence = builder.minTrackingConfidence;
        this.outputFaceBlendshapes = builder.outputFaceBlendshapes;
        this.outputFacialTransformationMatrixes = builder.outputFacialTransformationMatrixes;
        this.resultListener = builder.resultListener;
        this.errorListener = builder.errorListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FaceLandmarkerOptions withModelPath(String modelPath) {
        return builder().setBaseOptions(BaseOptions.ofModelAssetPath(modelPath)).build();
    }

    public BaseOptions baseOptions() {
        return baseOptions;
    }

    public RunningMode runningMode() {
        return runningMode;
    }

    public int numFaces() {
        return numFaces;
    }

    public float minFaceDetectionConfidence() {
        return minFaceDetectionConfidence;
    }

    public float minFacePresenceConfidence() {
        return minFacePresenceConfidence;
    }

    public float minTrackingConfidence() {
        return minTrackingConfidence;
    }

    public boolean outputFaceBlendshapes() {
        return outputFaceBlendshapes;
    }

    public boolean outputFacialTransformationMatrixes() {
        return outputFacialTransformationMatrixes;
    }

    public Optional<ResultListener> resultListener() {
        return Optional.ofNullable(resultListener);
    }

    public Optional<ErrorListener> errorListener() {
        return Optional.ofNullable(errorListener);
    }

    @Override
    public String toString() {
        return "FaceLandmarkerOptions[model=" + baseOptions.modelAssetPath()
                + ", runningMode=" + runningMode
                + ", numFaces=" + numFaces
                + ", minFaceDetectionConfidence=" + minFaceDetectionConfidence
                + ", minFacePresenceConfidence=" + minFacePresenceConfidence
                + ", minTrackingConfidence=" + minTrackingConfidence
                + ", outputFaceBlendshapes=" + outputFaceBlendshapes
                + ", outputFacialTransformationMatrixes=" + outputFacialTransformationMatrixes + "]";
    }

    public static final class Builder {

        private BaseOptions baseOptions = BaseOptions.ofModelAssetPath("");
        private RunningMode runningMode = RunningMode.IMAGE;
        private int numFaces = 1;
        private float minFaceDetectionConfidence = 0.5f;
        private float minFacePresenceConfidence = 0.5f;
        private float minTrackingConfidence = 0.5f;
        private boolean outputFaceBlendshapes;
        private boolean outputFacialTransformationMatrixes;
        private ResultListener resultListener;
        private ErrorListener errorListener;

        private Builder() {
        }

        public Builder setBaseOptions(BaseOptions baseOptions) {
            this.baseOptions = Objects.requireNonNull(baseOptions, "baseOptions");
            return this;
        }

        public Builder setModelAssetPath(String modelAssetPath) {
            this.baseOptions = new BaseOptions(modelAssetPath, baseOptions.numThreads());
            return this;
        }

        public Builder setRunningMode(RunningMode runningMode) {
            this.runningMode = Objects.requireNonNull(runningMode, "runningMode");
            return this;
        }

        public Builder setNumFaces(int numFaces) {
            this.numFaces = numFaces;
            return this;
        }

        public Builder setMinFaceDetectionConfidence(float minFaceDetectionConfidence) {
            this.minFaceDetectionConfidence = minFaceDetectionConfidence;
            return this;
        }

        public Builder setMinFacePresenceConfidence(float minFacePresenceConfidence) {
            this.minFacePresenceConfidence = minFacePresenceConfidence;
            return this;
        }

        public Builder setMinTrackingConfidence(float minTrackingConfidence) {
            this.minTrackingConfidence = minTrackingConfidence;
            return this;
        }

        public Builder setOutputFaceBlendshapes(boolean outputFaceBlendshapes) {
            this.outputFaceBlendshapes = outputFaceBlendshapes;
            return this;
        }

        public Builder setOutputFacialTransformationMatrixes(boolean outputFacialTransformationMatrixes) {
            this.outputFacialTransformationMatrixes = outputFacialTransformationMatrixes;
            return this;
        }

        public Builder setResultListener(ResultListener resultListener) {
            this.resultListener = resultListener;
            return this;
        }

        public Builder setErrorListener(ErrorListener errorListener) {
            this.errorListener = errorListener;
            return this;
        }

        public FaceLandmarkerOptions build() {
            if (numFaces < 1) {
                throw new IllegalArgumentException("numFaces must be at least 1, got " + numFaces);
            }
            requireProbability("minFaceDetectionConfidence", minFaceDetectionConfidence);
            requireProbability("minFacePresenceConfidence", minFacePresenceConfidence);
            requireProbability("minTrackingConfidence", minTrackingConfidence);
            if (runningMode == RunningMode.LIVE_STREAM && resultListener == null) {
                throw new IllegalArgumentException(
                        "The face landmarker is in live stream mode, a user-defined result listener must be provided.");
            }
            if (runningMode != RunningMode.LIVE_STREAM && resultListener != null) {
                throw new IllegalArgumentException(
                        "The face landmarker is in " + runningMode.displayName().toLowerCase(Locale.ROOT)
                                + " mode, a user-defined result listener shouldn't be provided.");
            }
            return new FaceLandmarkerOptions(this);
        }

        private static void requireProbability(String name, float value) {
            if (Float.isNaN(value) || value < 0f || value > 1f) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
            }
        }
    }
}

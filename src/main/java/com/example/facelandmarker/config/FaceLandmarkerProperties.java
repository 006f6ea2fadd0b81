package com.example.facelandmarker.config;

import com.example.facelandmarker.vision.facelandmarker.BaseOptions;
import com.example.facelandmarker.vision.facelandmarker.FaceLandmarkerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "landmarker")
public class FaceLandmarkerProperties {

    private boolean enabled = true;
    private String modelPath = "./models/face_landmarker.task";
    private int numFaces = 1;
    private float minFaceDetectionConfidence = 0.5f;
    private float minFacePresenceConfidence = 0.5f;
    private float minTrackingConfidence = 0.5f;
    private boolean outputFaceBlendshapes;
    private boolean outputFacialTransformationMatrixes;
    private int numThreads;

    public FaceLandmarkerOptions toOptions() {
        return FaceLandmarkerOptions.builder()
                .setBaseOptions(new BaseOptions(modelPath, numThreads))
                .setNumFaces(numFaces)
                .setMinFaceDetectionConfidence(minFaceDetectionConfidence)
                .setMinFacePresenceConfidence(minFacePresenceConfidence)
                .setMinTrackingConfidence(minTrackingConfidence)
                .setOutputFaceBlendshapes(outputFaceBlendshapes)
                .setOutputFacialTransformationMatrixes(outputFacialTransformationMatrixes)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public int getNumFaces() {
        return numFaces;
    }

    public void setNumFaces(int numFaces) {
        this.numFaces = numFaces;
    }

    public float getMinFaceDetectionConfidence() {
        return minFaceDetectionConfidence;
    }

    public void setMinFaceDetectionConfidence(float minFaceDetectionConfidence) {
        this.minFaceDetectionConfidence = minFaceDetectionConfidence;
    }

    public float getMinFacePresenceConfidence() {
        return minFacePresenceConfidence;
    }

    public void setMinFacePresenceConfidence(float minFacePresenceConfidence) {
        this.minFacePresenceConfidence = minFacePresenceConfidence;
    }

    public float getMinTrackingConfidence() {
        return minTrackingConfidence;
    }

    public void setMinTrackingConfidence(float minTrackingConfidence) {
        this.minTrackingConfidence = minTrackingConfidence;
    }

    public boolean isOutputFaceBlendshapes() {
        return outputFaceBlendshapes;
    }

    public void setOutputFaceBlendshapes(boolean outputFaceBlendshapes) {
        this.outputFaceBlendshapes = outputFaceBlendshapes;
    }

    public boolean isOutputFacialTransformationMatrixes() {
        return outputFacialTransformationMatrixes;
    }

    public void setOutputFacialTransformationMatrixes(boolean outputFacialTransformationMatrixes) {
        this.outputFacialTransformationMatrixes = outputFacialTransformationMatrixes;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        this.numThreads = numThreads;
    }
}

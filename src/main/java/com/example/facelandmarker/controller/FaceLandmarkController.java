package com.example.facelandmarker.controller;

import com.example.facelandmarker.components.containers.Category;
import com.example.facelandmarker.components.containers.Classifications;
import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.components.containers.TransformMatrix;
import com.example.facelandmarker.config.FaceLandmarkerProperties;
import com.example.facelandmarker.model.Base64ImageRequest;
import com.example.facelandmarker.model.BlendshapeScore;
import com.example.facelandmarker.model.DetectedFace;
import com.example.facelandmarker.model.LandmarkDetectionResponse;
import com.example.facelandmarker.model.LandmarkPoint;
import com.example.facelandmarker.model.LandmarkerHealthResponse;
import com.example.facelandmarker.service.FaceLandmarkService;
import com.example.facelandmarker.util.ImageDecoder;
import com.example.facelandmarker.vision.facelandmarker.FaceLandmarkerResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.SERVICE_UNAVAILABLE;

@RestController
@RequestMapping("/api/v1/face-landmarks")
@Tag(name = "Face landmarks", description = "Face mesh landmark and blendshape detection endpoints")
public class FaceLandmarkController {

    private final FaceLandmarkerProperties properties;
    private final FaceLandmarkService service;

    public FaceLandmarkController(FaceLandmarkerProperties properties, FaceLandmarkService service) {
        this.properties = properties;
        this.service = service;
    }

    @PostMapping(value = "/detect", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Detect face landmarks on an uploaded image",
            description = "Accepts a single image and returns the landmarks of every detected face.")
    public ResponseEntity<LandmarkDetectionResponse> detectFromMultipart(@RequestPart("image") MultipartFile image) {
        return runDetection(ImageDecoder.fromMultipart(image));
    }

    @PostMapping(value = "/detect", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Detect face landmarks on a base64 encoded image",
            description = "Accepts a base64 encoded image and returns the landmarks of every detected face.")
    public ResponseEntity<LandmarkDetectionResponse> detectFromBase64(@Valid @RequestBody Base64ImageRequest request) {
        return runDetection(ImageDecoder.fromBase64(request.image()));
    }

    @GetMapping("/health")
    @Operation(summary = "Retrieve face landmarker service health state")
    public ResponseEntity<LandmarkerHealthResponse> health() {
        return ResponseEntity.ok(new LandmarkerHealthResponse(
                properties.isEnabled(), properties.getModelPath(), service.isModelLoaded()));
    }

    private ResponseEntity<LandmarkDetectionResponse> runDetection(BufferedImage image) {
        if (!properties.isEnabled()) {
            throw new ResponseStatusException(SERVICE_UNAVAILABLE, "Face landmark service is disabled");
        }
        long start = System.nanoTime();
        FaceLandmarkerResult result = service.detect(image);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        return ResponseEntity.ok(new LandmarkDetectionResponse(result.faceCount(), mapFaces(result), elapsedMs));
    }

    private List<DetectedFace> mapFaces(FaceLandmarkerResult result) {
        List<DetectedFace> faces = new ArrayList<>(result.faceCount());
        for (int i = 0; i < result.faceCount(); i++) {
            List<LandmarkPoint> landmarks = result.faceLandmarks().get(i).stream()
                    .map(this::toPoint)
                    .collect(Collectors.toList());
            List<BlendshapeScore> blendshapes = i < result.faceBlendshapes().size()
                    ? toScores(result.faceBlendshapes().get(i))
                    : List.of();
            List<Float> matrix = i < result.facialTransformationMatrixes().size()
                    ? toRowMajor(result.facialTransformationMatrixes().get(i))
                    : List.of();
            faces.add(new DetectedFace(i, landmarks, blendshapes, matrix));
        }
        return faces;
    }

    private LandmarkPoint toPoint(NormalizedLandmark landmark) {
        return new LandmarkPoint(landmark.x(), landmark.y(), landmark.z());
    }

    private List<BlendshapeScore> toScores(Classifications classifications) {
        return classifications.categories().stream()
                .map(this::toScore)
                .collect(Collectors.toList());
    }

    private BlendshapeScore toScore(Category category) {
        return new BlendshapeScore(category.categoryName(), category.score());
    }

    private List<Float> toRowMajor(TransformMatrix matrix) {
        float[] values = matrix.toArray();
        List<Float> rowMajor = new ArrayList<>(values.length);
        for (float value : values) {
            rowMajor.add(value);
        }
        return rowMajor;
    }
}

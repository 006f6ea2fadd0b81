package com.example.facelandmarker.controller;

import com.example.facelandmarker.engine.FakeInferenceEngine;
import com.example.facelandmarker.service.FaceLandmarkService;
import com.example.facelandmarker.tasks.TaskError;
import com.example.facelandmarker.tasks.TaskErrorCode;
import com.example.facelandmarker.vision.facelandmarker.FaceLandmarkerResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.Base64;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FaceLandmarkControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FaceLandmarkService faceLandmarkService;

    @Test
    void detectReturnsFaceMeshForUpload() throws Exception {
        when(faceLandmarkService.detect(any(BufferedImage.class))).thenReturn(new FaceLandmarkerResult(
                FakeInferenceEngine.oneFace().faceLandmarks(), FakeInferenceEngine.oneFace().faceBlendshapes(),
                FakeInferenceEngine.oneFace().facialTransformationMatrixes(), 0));

        MockMultipartFile file = new MockMultipartFile("image", "face.png", MediaType.IMAGE_PNG_VALUE, pngBytes());

        mockMvc.perform(multipart("/api/v1/face-landmarks/detect").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.faceCount").value(1))
                .andExpect(jsonPath("$.faces[0].landmarks.length()").value(FakeInferenceEngine.FACE_MESH_POINTS))
                .andExpect(jsonPath("$.faces[0].blendshapes[1].name").value("jawOpen"))
                .andExpect(jsonPath("$.faces[0].transformationMatrix.length()").value(16))
                .andExpect(jsonPath("$.faces[0].transformationMatrix[11]").value(-42.0));
    }

    @Test
    void facesWithoutMatrixesReportEmptyMatrix() throws Exception {
        when(faceLandmarkService.detect(any(BufferedImage.class))).thenReturn(new FaceLandmarkerResult(
                FakeInferenceEngine.oneFace().faceLandmarks(), List.of(), List.of(), 0));
        MockMultipartFile file = new MockMultipartFile("image", "face.png", MediaType.IMAGE_PNG_VALUE, pngBytes());

        mockMvc.perform(multipart("/api/v1/face-landmarks/detect").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.faces[0].blendshapes").isEmpty())
                .andExpect(jsonPath("$.faces[0].transformationMatrix").isEmpty());
    }

    @Test
    void uploadUnderWrongPartNameIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "face.png", MediaType.IMAGE_PNG_VALUE, pngBytes());

        mockMvc.perform(multipart("/api/v1/face-landmarks/detect").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Required part 'image' is missing"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/face-landmarks/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void unsupportedContentTypeIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/face-landmarks/detect")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.status").value(415));
    }

    @Test
    void detectAcceptsBase64Image() throws Exception {
        when(faceLandmarkService.detect(any(BufferedImage.class)))
                .thenReturn(new FaceLandmarkerResult(List.of(), List.of(), List.of(), 0));
        String body = "{\"image\":\"" + Base64.getEncoder().encodeToString(pngBytes()) + "\"}";

        mockMvc.perform(post("/api/v1/face-landmarks/detect").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.faceCount").value(0))
                .andExpect(jsonPath("$.faces").isEmpty());
    }

    @Test
    void undecodableUploadIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("image", "face.png", MediaType.IMAGE_PNG_VALUE, new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/v1/face-landmarks/detect").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unable to decode provided image"));
    }

    @Test
    void invalidBase64IsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/face-landmarks/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"***\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid Base64 image data"));
    }

    @Test
    void modelInitializationFailureIsServiceUnavailable() throws Exception {
        when(faceLandmarkService.detect(any(BufferedImage.class)))
                .thenThrow(TaskError.of(TaskErrorCode.INITIALIZATION, "Model asset not found: ./models/face_landmarker.task").toException());
        MockMultipartFile file = new MockMultipartFile("image", "face.png", MediaType.IMAGE_PNG_VALUE, pngBytes());

        mockMvc.perform(multipart("/api/v1/face-landmarks/detect").file(file))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("INITIALIZATION"))
                .andExpect(jsonPath("$.message").value("Model asset not found: ./models/face_landmarker.task"));
    }

    @Test
    void healthReportsConfiguration() throws Exception {
        when(faceLandmarkService.isModelLoaded()).thenReturn(false);

        mockMvc.perform(get("/api/v1/face-landmarks/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.modelPath").value("./models/face_landmarker.task"))
                .andExpect(jsonPath("$.modelLoaded").value(false));
    }

    private static byte[] pngBytes() throws Exception {
        BufferedImage image = new BufferedImage(64, 64, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillOval(8, 8, 48, 48);
        } finally {
            graphics.dispose();
        }
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ImageIO.write(image, "png", outputStream);
        return outputStream.toByteArray();
    }
}

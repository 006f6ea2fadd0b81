package com.example.facelandmarker.engine.onnx;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.example.facelandmarker.components.containers.Category;
import com.example.facelandmarker.components.containers.Classifications;
import com.example.facelandmarker.components.containers.NormalizedLandmark;
import com.example.facelandmarker.engine.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

final class BlendshapeModel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlendshapeModel.class);

    static final List<String> BLENDSHAPE_NAMES = List.of(
            "_neutral", "browDownLeft", "browDownRight", "browInnerUp", "browOuterUpLeft",
            "browOuterUpRight", "cheekPuff", "cheekSquintLeft", "cheekSquintRight", "eyeBlinkLeft",
            "eyeBlinkRight", "eyeLookDownLeft", "eyeLookDownRight", "eyeLookInLeft", "eyeLookInRight",
            "eyeLookOutLeft", "eyeLookOutRight", "eyeLookUpLeft", "eyeLookUpRight", "eyeSquintLeft",
            "eyeSquintRight", "eyeWideLeft", "eyeWideRight", "jawForward", "jawLeft",
            "jawOpen", "jawRight", "mouthClose", "mouthDimpleLeft", "mouthDimpleRight",
            "mouthFrownLeft", "mouthFrownRight", "mouthFunnel", "mouthLeft", "mouthLowerDownLeft",
            "mouthLowerDownRight", "mouthPressLeft", "mouthPressRight", "mouthPucker", "mouthRight",
            "mouthRollLower", "mouthRollUpper", "mouthShrugLower", "mouthShrugUpper", "mouthSmileLeft",
            "mouthSmileRight", "mouthStretchLeft", "mouthStretchRight", "mouthUpperUpLeft", "mouthUpperUpRight",
            "noseSneerLeft", "noseSneerRight");

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;
    private final int[] landmarkSubset;

    private BlendshapeModel(OrtEnvironment environment, OrtSession session, String inputName, int[] landmarkSubset) {
        this.environment = environment;
        this.session = session;
        this.inputName = inputName;
        this.landmarkSubset = landmarkSubset;
    }

    static BlendshapeModel load(OrtEnvironment environment, Path model, int[] landmarkSubset,
                                OrtSession.SessionOptions sessionOptions) throws EngineException {
        OrtSession session = null;
        try {
            session = environment.createSession(model.toString(), sessionOptions);
            Map.Entry<String, NodeInfo> input = session.getInputInfo().entrySet().iterator().next();
            long[] shape = ((TensorInfo) input.getValue().getInfo()).getShape();
            if (shape.length != 3 || shape[2] != 2) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Blendshape model input must be [1, K, 2], got " + Arrays.toString(shape));
            }
            if (landmarkSubset != null && shape[1] > 0 && shape[1] != landmarkSubset.length) {
                throw new EngineException(EngineException.Stage.LOAD, "Blendshape model expects " + shape[1]
                        + " landmarks but the subset lists " + landmarkSubset.length);
            }
            log.info("Loaded blendshape model {} (input {})", model.getFileName(), Arrays.toString(shape));
            return new BlendshapeModel(environment, session, input.getKey(), landmarkSubset);
        } catch (OrtException ex) {
            closeQuietly(session);
            throw new EngineException(EngineException.Stage.LOAD, "Unable to load blendshape model " + model.getFileName(), ex);
        } catch (EngineException ex) {
            closeQuietly(session);
            throw ex;
        }
    }

    Classifications score(List<NormalizedLandmark> landmarks, int imageWidth, int imageHeight) throws EngineException {
        int[] indices = landmarkSubset != null ? landmarkSubset : allIndices(landmarks.size());
        float[] positions = new float[indices.length * 2];
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] >= landmarks.size()) {
                throw new EngineException(EngineException.Stage.RUN, "Blendshape landmark index " + indices[i]
                        + " is out of range for " + landmarks.size() + " landmarks");
            }
            NormalizedLandmark landmark = landmarks.get(indices[i]);
            positions[i * 2] = landmark.x() * imageWidth;
            positions[i * 2 + 1] = landmark.y() * imageHeight;
        }
        long[] shape = {1, indices.length, 2};
        try (OnnxTensor tensor = OnnxTensor.createTensor(environment, FloatBuffer.wrap(positions), shape);
             OrtSession.Result output = session.run(Map.of(inputName, tensor))) {
            FloatBuffer scores = ((OnnxTensor) output.get(0)).getFloatBuffer();
            List<Category> categories = new ArrayList<>(scores.remaining());
            for (int i = 0; scores.hasRemaining(); i++) {
                String name = i < BLENDSHAPE_NAMES.size() ? BLENDSHAPE_NAMES.get(i) : "blendshape_" + i;
                categories.add(new Category(i, scores.get(), name, ""));
            }
            return new Classifications(categories, 0, "");
        } catch (OrtException ex) {
            throw new EngineException(EngineException.Stage.RUN, "Blendshape inference failed", ex);
        }
    }

    private static int[] allIndices(int count) {
        int[] indices = new int[count];
        for (int i = 0; i < count; i++) {
            indices[i] = i;
        }
        return indices;
    }

    private static void closeQuietly(OrtSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (OrtException ex) {
            log.warn("Failed to close OrtSession", ex);
        }
    }

    @Override
    public void close() {
        closeQuietly(session);
    }
}

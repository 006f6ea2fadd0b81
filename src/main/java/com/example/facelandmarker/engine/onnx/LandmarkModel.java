package com.example.facelandmarker.engine.onnx;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxJavaType;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.example.facelandmarker.engine.EngineException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

final class LandmarkModel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LandmarkModel.class);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;
    private final int inputSize;
    private final boolean channelsFirst;

    private LandmarkModel(OrtEnvironment environment, OrtSession session, String inputName, int inputSize, boolean channelsFirst) {
        this.environment = environment;
        this.session = session;
        this.inputName = inputName;
        this.inputSize = inputSize;
        this.channelsFirst = channelsFirst;
    }

    static LandmarkModel load(OrtEnvironment environment, Path model, OrtSession.SessionOptions sessionOptions) throws EngineException {
        OrtSession session = null;
        try {
            session = environment.createSession(model.toString(), sessionOptions);
            Map.Entry<String, NodeInfo> input = session.getInputInfo().entrySet().iterator().next();
            long[] shape = ((TensorInfo) input.getValue().getInfo()).getShape();
            if (shape.length != 4) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Landmark model input must be 4-dimensional, got " + Arrays.toString(shape));
            }
            boolean channelsFirst = shape[1] == 3;
            if (!channelsFirst && shape[3] != 3) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Landmark model input must have 3 channels, got " + Arrays.toString(shape));
            }
            long height = channelsFirst ? shape[2] : shape[1];
            long width = channelsFirst ? shape[3] : shape[2];
            if (height <= 0 || height != width) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Landmark model input must be a fixed square, got " + Arrays.toString(shape));
            }
            log.info("Loaded landmark model {} (input {} {}, {})", model.getFileName(), input.getKey(),
                    Arrays.toString(shape), channelsFirst ? "NCHW" : "NHWC");
            return new LandmarkModel(environment, session, input.getKey(), (int) height, channelsFirst);
        } catch (OrtException ex) {
            closeQuietly(session);
            throw new EngineException(EngineException.Stage.LOAD, "Unable to load landmark model " + model.getFileName(), ex);
        } catch (EngineException ex) {
            closeQuietly(session);
            throw ex;
        }
    }

    int inputSize() {
        return inputSize;
    }

    LandmarkTensor run(Mat bgrCrop) throws EngineException {
        FloatBuffer buffer = toInputBuffer(bgrCrop);
        long[] shape = channelsFirst
                ? new long[]{1, 3, inputSize, inputSize}
                : new long[]{1, inputSize, inputSize, 3};
        try (OnnxTensor tensor = OnnxTensor.createTensor(environment, buffer, shape);
             OrtSession.Result output = session.run(Map.of(inputName, tensor))) {
            float[] landmarks = null;
            float presence = Float.NaN;
            for (Map.Entry<String, OnnxValue> entry : output) {
                if (!(entry.getValue() instanceof OnnxTensor)) {
                    continue;
                }
                OnnxTensor result = (OnnxTensor) entry.getValue();
                if (result.getInfo().type != OnnxJavaType.FLOAT) {
                    continue;
                }
                float[] values = readAll(result);
                if (values.length == 1) {
                    presence = sigmoid(values[0]);
                } else if (values.length % 3 == 0 && (landmarks == null || values.length > landmarks.length)) {
                    landmarks = values;
                }
            }
            if (landmarks == null) {
                throw new EngineException(EngineException.Stage.RUN, "Landmark model produced no landmark tensor");
            }
            return new LandmarkTensor(landmarks, Float.isNaN(presence) ? 1f : presence);
        } catch (OrtException ex) {
            throw new EngineException(EngineException.Stage.RUN, "Landmark inference failed", ex);
        }
    }

    private FloatBuffer toInputBuffer(Mat bgrCrop) {
        Mat rgb = new Mat();
        Mat floats = new Mat();
        try {
            Imgproc.cvtColor(bgrCrop, rgb, Imgproc.COLOR_BGR2RGB);
            rgb.convertTo(floats, CvType.CV_32FC3, 1.0 / 255.0);
            float[] interleaved = new float[inputSize * inputSize * 3];
            floats.get(0, 0, interleaved);
            if (!channelsFirst) {
                return FloatBuffer.wrap(interleaved);
            }
            int plane = inputSize * inputSize;
            float[] planar = new float[interleaved.length];
            for (int pixel = 0; pixel < plane; pixel++) {
                for (int c = 0; c < 3; c++) {
                    planar[c * plane + pixel] = interleaved[pixel * 3 + c];
                }
            }
            return FloatBuffer.wrap(planar);
        } finally {
            rgb.release();
            floats.release();
        }
    }

    private static float[] readAll(OnnxTensor tensor) {
        FloatBuffer values = tensor.getFloatBuffer();
        float[] copy = new float[values.remaining()];
        values.get(copy);
        return copy;
    }

    private static float sigmoid(float value) {
        return (float) (1.0 / (1.0 + Math.exp(-value)));
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

    record LandmarkTensor(float[] xyz, float presence) {

        int count() {
            return xyz.length / 3;
        }
    }
}

package com.example.facelandmarker.vision.facelandmarker;

import com.example.facelandmarker.engine.EngineConfig;
import com.example.facelandmarker.engine.EngineException;
import com.example.facelandmarker.engine.EngineOutput;
import com.example.facelandmarker.engine.EngineRequest;
import com.example.facelandmarker.engine.InferenceEngine;
import com.example.facelandmarker.engine.InferenceEngineFactory;
import com.example.facelandmarker.engine.onnx.OnnxInferenceEngine;
import com.example.facelandmarker.tasks.TaskError;
import com.example.facelandmarker.tasks.TaskErrorCode;
import com.example.facelandmarker.tasks.TaskOutcome;
import com.example.facelandmarker.vision.core.ImageProcessingOptions;
import com.example.facelandmarker.vision.core.RunningMode;
import com.example.facelandmarker.vision.core.VisionImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Performs face landmark detection on images, video frames and live stream frames.
 *
 * <p>Each instance owns exactly one {@link InferenceEngine} and is fixed to the
 * {@link RunningMode} it was created with:
 * <ul>
 *   <li>{@link RunningMode#IMAGE}: only {@link #detect(VisionImage)}.</li>
 *   <li>{@link RunningMode#VIDEO}: only {@link #detectForVideo(VisionImage, long)}, with strictly
 *   increasing timestamps.</li>
 *   <li>{@link RunningMode#LIVE_STREAM}: only {@link #detectAsync(VisionImage, long)}, with strictly
 *   increasing timestamps; results go to the configured result listener.</li>
 * </ul>
 *
 * <p>Every operation reports failure through a {@link TaskOutcome} instead of throwing. The whole
 * image is used as region of interest and the image orientation is applied before inference.
 * Input images must be RGBA: buffer sources in {@code BGRA_8888} or {@code RGBA_8888}, bitmaps in
 * an RGB colour space with an alpha channel.
 *
 * <p>Calls on one instance are serialized internally; concurrent callers wait for each other.
 */
public final class FaceLandmarker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FaceLandmarker.class);

    private static final InferenceEngineFactory DEFAULT_ENGINE_FACTORY = config -> OnnxInferenceEngine.open(config);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final FaceLandmarkerOptions options;
    private final InferenceEngine engine;
    private final ExecutorService liveStreamExecutor;
    private final Object callLock = new Object();

    private long lastTimestampMs;
    private boolean timestampSeen;
    private boolean closed;

    private FaceLandmarker(FaceLandmarkerOptions options, InferenceEngine engine) {
        this.options = options;
        this.engine = engine;
        this.liveStreamExecutor = options.runningMode() == RunningMode.LIVE_STREAM
                ? Executors.newSingleThreadExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "face-landmarker-live-stream");
                    thread.setDaemon(true);
                    return thread;
                })
                : null;
    }

    public static TaskOutcome<FaceLandmarker> create(String modelPath) {
        return create(FaceLandmarkerOptions.withModelPath(modelPath));
    }

    public static TaskOutcome<FaceLandmarker> create(FaceLandmarkerOptions options) {
        return create(options, DEFAULT_ENGINE_FACTORY);
    }

    public static TaskOutcome<FaceLandmarker> create(FaceLandmarkerOptions options, InferenceEngineFactory engineFactory) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(engineFactory, "engineFactory");

        Optional<TaskError> pathError = checkModelAssetPath(options.baseOptions().modelAssetPath());
        if (pathError.isPresent()) {
            log.warn("Face landmarker not created: {}", pathError.get().message());
            return TaskOutcome.failure(pathError.get());
        }

        EngineConfig config = toEngineConfig(options);
        long start = System.nanoTime();
        InferenceEngine engine;
        try {
            engine = engineFactory.create(config);
        } catch (EngineException ex) {
            log.error("Failed to create inference engine for {}", config.modelAssetPath(), ex);
            return TaskOutcome.failure(new TaskError(TaskErrorCode.INITIALIZATION, ex.getMessage(), ex));
        } catch (RuntimeException ex) {
            log.error("Inference engine construction failed for {}", config.modelAssetPath(), ex);
            return TaskOutcome.failure(new TaskError(TaskErrorCode.INITIALIZATION,
                    "Unable to create inference engine: " + ex.getMessage(), ex));
        }
        if (engine == null) {
            return TaskOutcome.failure(TaskErrorCode.INITIALIZATION, "Inference engine factory returned no engine");
        }
        log.info("Created face landmarker in {} mode from {} in {} ms",
                options.runningMode(), config.modelAssetPath(), (System.nanoTime() - start) / 1_000_000.0);
        return TaskOutcome.success(new FaceLandmarker(options, engine));
    }

    public TaskOutcome<FaceLandmarkerResult> detect(VisionImage image) {
        Objects.requireNonNull(image, "image");
        synchronized (callLock) {
            Optional<TaskError> rejected = checkUsable(RunningMode.IMAGE);
            if (rejected.isEmpty()) {
                rejected = checkImage(image);
            }
            if (rejected.isPresent()) {
                return TaskOutcome.failure(rejected.get());
            }
            return runInference(image, 0L);
        }
    }

    public TaskOutcome<FaceLandmarkerResult> detectForVideo(VisionImage image, long timestampMs) {
        Objects.requireNonNull(image, "image");
        synchronized (callLock) {
            Optional<TaskError> rejected = checkUsable(RunningMode.VIDEO);
            if (rejected.isEmpty()) {
                rejected = checkImage(image);
            }
            if (rejected.isEmpty()) {
                rejected = acceptTimestamp(timestampMs);
            }
            if (rejected.isPresent()) {
                return TaskOutcome.failure(rejected.get());
            }
            return runInference(image, timestampMs);
        }
    }

    /**
     * Queues one live stream frame. Only valid in {@link RunningMode#LIVE_STREAM}. Mode, input and
     * timestamp problems are reported in the returned outcome; the detection result, or a failure
     * during inference, is delivered later to the configured listeners.
     */
    public TaskOutcome<Void> detectAsync(VisionImage image, long timestampMs) {
        Objects.requireNonNull(image, "image");
        synchronized (callLock) {
            Optional<TaskError> rejected = checkUsable(RunningMode.LIVE_STREAM);
            if (rejected.isEmpty()) {
                rejected = checkImage(image);
            }
            if (rejected.isEmpty()) {
                rejected = acceptTimestamp(timestampMs);
            }
            if (rejected.isPresent()) {
                return TaskOutcome.failure(rejected.get());
            }
            try {
                liveStreamExecutor.execute(() -> deliverLiveStreamResult(image, timestampMs));
            } catch (RejectedExecutionException ex) {
                return TaskOutcome.failure(new TaskError(TaskErrorCode.INITIALIZATION,
                        "FaceLandmarker has been closed", ex));
            }
            return TaskOutcome.done();
        }
    }

    public RunningMode getRunningMode() {
        return options.runningMode();
    }

    /**
     * Releases the engine handle. Queued live stream frames are processed first. Later detection
     * calls fail with {@link TaskErrorCode#INITIALIZATION}.
     */
    @Override
    public void close() {
        synchronized (callLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        if (liveStreamExecutor != null) {
            liveStreamExecutor.shutdown();
            try {
                if (!liveStreamExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Live stream worker did not finish within {} s, interrupting it", SHUTDOWN_TIMEOUT_SECONDS);
                    liveStreamExecutor.shutdownNow();
                }
            } catch (InterruptedException ex) {
                liveStreamExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        synchronized (callLock) {
            engine.close();
        }
        log.info("Closed face landmarker ({} mode)", options.runningMode());
    }

    private void deliverLiveStreamResult(VisionImage image, long timestampMs) {
        TaskOutcome<FaceLandmarkerResult> outcome;
        synchronized (callLock) {
            outcome = runInference(image, timestampMs);
        }
        try {
            if (outcome.isSuccess()) {
                FaceLandmarkerResult result = outcome.orElseThrow();
                options.resultListener().ifPresent(listener -> listener.onResult(result, image));
                return;
            }
            TaskError error = outcome.errorOrThrow();
            Optional<FaceLandmarkerOptions.ErrorListener> errorListener = options.errorListener();
            if (errorListener.isPresent()) {
                errorListener.get().onError(error);
            } else {
                log.error("Live stream detection failed at {} ms: {}", timestampMs, error.message(), error.cause());
            }
        } catch (RuntimeException ex) {
            log.error("Live stream listener failed for the frame at {} ms", timestampMs, ex);
        }
    }

    private TaskOutcome<FaceLandmarkerResult> runInference(VisionImage image, long timestampMs) {
        long start = System.nanoTime();
        EngineRequest request = new EngineRequest(image, ImageProcessingOptions.wholeImage(image.getOrientation()), timestampMs);
        try {
            EngineOutput output = engine.process(request);
            FaceLandmarkerResult result = new FaceLandmarkerResult(
                    output.faceLandmarks(),
                    options.outputFaceBlendshapes() ? output.faceBlendshapes() : List.of(),
                    options.outputFacialTransformationMatrixes() ? output.facialTransformationMatrixes() : List.of(),
                    timestampMs);
            log.debug("Detected {} face(s) on {} in {} ms", result.faceCount(), image, (System.nanoTime() - start) / 1_000_000.0);
            return TaskOutcome.success(result);
        } catch (EngineException ex) {
            TaskErrorCode code = ex.getStage() == EngineException.Stage.INPUT ? TaskErrorCode.INVALID_INPUT : TaskErrorCode.INFERENCE;
            log.warn("Face landmark detection failed on {}: {}", image, ex.getMessage());
            return TaskOutcome.failure(new TaskError(code, ex.getMessage(), ex));
        } catch (RuntimeException ex) {
            log.error("Inference engine failed on {}", image, ex);
            return TaskOutcome.failure(new TaskError(TaskErrorCode.INFERENCE,
                    "Face landmark inference failed: " + ex.getMessage(), ex));
        }
    }

    private Optional<TaskError> checkUsable(RunningMode requiredMode) {
        if (closed) {
            return Optional.of(TaskError.of(TaskErrorCode.INITIALIZATION, "FaceLandmarker has been closed"));
        }
        if (options.runningMode() != requiredMode) {
            return Optional.of(TaskError.of(TaskErrorCode.INVALID_MODE,
                    "The vision task is not initialized with " + requiredMode.displayName().toLowerCase(Locale.ROOT)
                            + " mode. Current Running Mode: " + options.runningMode().displayName()));
        }
        return Optional.empty();
    }

    private static Optional<TaskError> checkImage(VisionImage image) {
        return image.describeFormatViolation()
                .map(message -> TaskError.of(TaskErrorCode.INVALID_INPUT, message));
    }

    private Optional<TaskError> acceptTimestamp(long timestampMs) {
        if (timestampSeen && timestampMs <= lastTimestampMs) {
            return Optional.of(TaskError.of(TaskErrorCode.SEQUENCING,
                    "Input timestamp must be monotonically increasing. Received " + timestampMs
                            + " ms after " + lastTimestampMs + " ms."));
        }
        lastTimestampMs = timestampMs;
        timestampSeen = true;
        return Optional.empty();
    }

    private static Optional<TaskError> checkModelAssetPath(String modelAssetPath) {
        if (modelAssetPath.isBlank()) {
            return Optional.of(TaskError.of(TaskErrorCode.INITIALIZATION, "Model asset path must be specified."));
        }
        Path path;
        try {
            path = Path.of(modelAssetPath);
        } catch (InvalidPathException ex) {
            return Optional.of(new TaskError(TaskErrorCode.INITIALIZATION, "Invalid model asset path: " + modelAssetPath, ex));
        }
        if (!Files.isRegularFile(path)) {
            return Optional.of(TaskError.of(TaskErrorCode.INITIALIZATION, "Model asset not found: " + modelAssetPath));
        }
        if (!Files.isReadable(path)) {
            return Optional.of(TaskError.of(TaskErrorCode.INITIALIZATION, "Model asset is not readable: " + modelAssetPath));
        }
        return Optional.empty();
    }

    private static EngineConfig toEngineConfig(FaceLandmarkerOptions options) {
        return new EngineConfig(
                Path.of(options.baseOptions().modelAssetPath()).toAbsolutePath(),
                options.runningMode(),
                options.numFaces(),
                options.minFaceDetectionConfidence(),
                options.minFacePresenceConfidence(),
                options.minTrackingConfidence(),
                options.outputFaceBlendshapes(),
                options.outputFacialTransformationMatrixes(),
                options.baseOptions().numThreads());
    }
}

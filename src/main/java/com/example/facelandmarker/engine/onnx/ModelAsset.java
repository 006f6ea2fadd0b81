package com.example.facelandmarker.engine.onnx;

import com.example.facelandmarker.engine.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Resolves a model asset path into the individual model files the engine loads.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>a single {@code .onnx} landmark model, run on the whole image as one face region;</li>
 *   <li>a {@code .task} zip bundle containing {@value #LANDMARKS_ENTRY} and, optionally,
 *   {@value #DETECTOR_ENTRY}, {@value #BLENDSHAPES_ENTRY}, {@value #BLENDSHAPES_SUBSET_ENTRY}
 *   (comma or whitespace separated landmark indices fed to the blendshape model) and
 *   {@value #CANONICAL_FACE_ENTRY} (canonical face model vertices, {@code x y z} in centimetres).</li>
 * </ul>
 * Bundle entries are matched by file name, wherever they sit inside the archive, and extracted to
 * a temporary directory that is removed by {@link #close()}.
 */
public final class ModelAsset implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelAsset.class);

    static final String DETECTOR_ENTRY = "face_detector.onnx";
    static final String LANDMARKS_ENTRY = "face_landmarks_detector.onnx";
    static final String BLENDSHAPES_ENTRY = "face_blendshapes.onnx";
    static final String BLENDSHAPES_SUBSET_ENTRY = "face_blendshapes_landmarks.txt";
    static final String CANONICAL_FACE_ENTRY = "canonical_face_model.txt";

    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    private final Path landmarkModel;
    private final Path faceDetectorModel;
    private final Path blendshapeModel;
    private final int[] blendshapeLandmarkSubset;
    private final Path canonicalFaceModel;
    private final Path extractionDirectory;

    private ModelAsset(Path landmarkModel, Path faceDetectorModel, Path blendshapeModel,
                       int[] blendshapeLandmarkSubset, Path canonicalFaceModel, Path extractionDirectory) {
        this.landmarkModel = landmarkModel;
        this.faceDetectorModel = faceDetectorModel;
        this.blendshapeModel = blendshapeModel;
        this.blendshapeLandmarkSubset = blendshapeLandmarkSubset;
        this.canonicalFaceModel = canonicalFaceModel;
        this.extractionDirectory = extractionDirectory;
    }

    public static ModelAsset resolve(Path path) throws EngineException {
        if (!Files.isRegularFile(path)) {
            throw new EngineException(EngineException.Stage.LOAD, "Model asset not found: " + path);
        }
        if (isZip(path)) {
            return extractBundle(path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!fileName.endsWith(".onnx")) {
            throw new EngineException(EngineException.Stage.LOAD,
                    "Unsupported model asset " + path + ". Expected a .onnx model or a .task bundle.");
        }
        log.info("Using single landmark model {}", path);
        return new ModelAsset(path, null, null, null, null, null);
    }

    private static boolean isZip(Path path) throws EngineException {
        try (InputStream input = Files.newInputStream(path)) {
            byte[] header = input.readNBytes(ZIP_MAGIC.length);
            if (header.length < ZIP_MAGIC.length) {
                return false;
            }
            for (int i = 0; i < ZIP_MAGIC.length; i++) {
                if (header[i] != ZIP_MAGIC[i]) {
                    return false;
                }
            }
            return true;
        } catch (IOException ex) {
            throw new EngineException(EngineException.Stage.LOAD, "Unable to read model asset " + path, ex);
        }
    }

    private static ModelAsset extractBundle(Path bundle) throws EngineException {
        Path directory;
        try {
            directory = Files.createTempDirectory("face-landmarker-");
        } catch (IOException ex) {
            throw new EngineException(EngineException.Stage.LOAD, "Unable to create extraction directory for " + bundle, ex);
        }
        try (ZipFile zip = new ZipFile(bundle.toFile())) {
            Path landmarks = extractEntry(zip, LANDMARKS_ENTRY, directory);
            if (landmarks == null) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Model bundle " + bundle + " does not contain " + LANDMARKS_ENTRY);
            }
            Path detector = extractEntry(zip, DETECTOR_ENTRY, directory);
            Path blendshapes = extractEntry(zip, BLENDSHAPES_ENTRY, directory);
            Path subsetFile = extractEntry(zip, BLENDSHAPES_SUBSET_ENTRY, directory);
            Path canonicalFace = extractEntry(zip, CANONICAL_FACE_ENTRY, directory);
            int[] subset = subsetFile != null ? parseIndices(subsetFile) : null;
            log.info("Extracted model bundle {} (detector: {}, blendshapes: {}, face geometry: {})",
                    bundle, detector != null, blendshapes != null, canonicalFace != null);
            return new ModelAsset(landmarks, detector, blendshapes, subset, canonicalFace, directory);
        } catch (IOException ex) {
            deleteRecursively(directory);
            throw new EngineException(EngineException.Stage.LOAD, "Malformed model bundle " + bundle, ex);
        } catch (EngineException ex) {
            deleteRecursively(directory);
            throw ex;
        }
    }

    private static Path extractEntry(ZipFile zip, String name, Path directory) throws IOException {
        ZipEntry match = zip.stream()
                .filter(entry -> !entry.isDirectory())
                .filter(entry -> {
                    String entryName = entry.getName();
                    int slash = Math.max(entryName.lastIndexOf('/'), entryName.lastIndexOf('\\'));
                    return entryName.substring(slash + 1).equals(name);
                })
                .findFirst()
                .orElse(null);
        if (match == null) {
            return null;
        }
        Path target = directory.resolve(name);
        try (InputStream input = zip.getInputStream(match)) {
            Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    static int[] parseIndices(Path file) throws EngineException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new EngineException(EngineException.Stage.LOAD, "Unable to read " + file.getFileName(), ex);
        }
        List<Integer> indices = new ArrayList<>();
        for (String token : content.split("[,\\s]+")) {
            if (token.isBlank()) {
                continue;
            }
            try {
                int index = Integer.parseInt(token.trim());
                if (index < 0) {
                    throw new EngineException(EngineException.Stage.LOAD,
                            "Negative landmark index " + index + " in " + file.getFileName());
                }
                indices.add(index);
            } catch (NumberFormatException ex) {
                throw new EngineException(EngineException.Stage.LOAD,
                        "Invalid landmark index '" + token + "' in " + file.getFileName(), ex);
            }
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    public Path landmarkModel() {
        return landmarkModel;
    }

    public Optional<Path> faceDetectorModel() {
        return Optional.ofNullable(faceDetectorModel);
    }

    public Optional<Path> blendshapeModel() {
        return Optional.ofNullable(blendshapeModel);
    }

    public Optional<int[]> blendshapeLandmarkSubset() {
        return Optional.ofNullable(blendshapeLandmarkSubset).map(int[]::clone);
    }

    public Optional<Path> canonicalFaceModel() {
        return Optional.ofNullable(canonicalFaceModel);
    }

    @Override
    public void close() {
        if (extractionDirectory != null) {
            deleteRecursively(extractionDirectory);
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    log.warn("Failed to delete extracted model file {}", path, ex);
                }
            });
        } catch (IOException ex) {
            log.warn("Failed to clean up extraction directory {}", directory, ex);
        }
    }
}

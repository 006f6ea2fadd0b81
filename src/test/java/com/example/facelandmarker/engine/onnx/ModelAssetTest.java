package com.example.facelandmarker.engine.onnx;

import com.example.facelandmarker.engine.EngineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ModelAssetTest {

    @TempDir
    Path tempDir;

    @Test
    void singleOnnxFileIsUsedDirectly() throws Exception {
        Path model = Files.write(tempDir.resolve("landmarks.onnx"), new byte[]{8, 1, 2});

        try (ModelAsset asset = ModelAsset.resolve(model)) {
            assertThat(asset.landmarkModel()).isEqualTo(model);
            assertThat(asset.faceDetectorModel()).isEmpty();
            assertThat(asset.blendshapeModel()).isEmpty();
            assertThat(asset.canonicalFaceModel()).isEmpty();
        }
        assertThat(model).exists();
    }

    @Test
    void bundleEntriesAreExtractedByFileName() throws Exception {
        Path bundle = writeBundle("face_landmarker.task", Map.of(
                "models/" + ModelAsset.LANDMARKS_ENTRY, "landmarks",
                "models/" + ModelAsset.DETECTOR_ENTRY, "detector",
                ModelAsset.BLENDSHAPES_ENTRY, "blendshapes",
                ModelAsset.BLENDSHAPES_SUBSET_ENTRY, "0, 1\n17 37",
                "geometry/" + ModelAsset.CANONICAL_FACE_ENTRY, "0 1 2\n3 4 5"));

        Path extracted;
        try (ModelAsset asset = ModelAsset.resolve(bundle)) {
            extracted = asset.landmarkModel();
            assertThat(extracted.getFileName().toString()).isEqualTo(ModelAsset.LANDMARKS_ENTRY);
            assertThat(Files.readString(extracted)).isEqualTo("landmarks");
            assertThat(asset.faceDetectorModel()).isPresent();
            assertThat(asset.blendshapeModel()).isPresent();
            assertThat(asset.blendshapeLandmarkSubset()).hasValueSatisfying(
                    subset -> assertThat(subset).containsExactly(0, 1, 17, 37));
            assertThat(asset.canonicalFaceModel()).hasValueSatisfying(
                    path -> assertThat(path.getFileName().toString()).isEqualTo(ModelAsset.CANONICAL_FACE_ENTRY));
        }
        assertThat(extracted).doesNotExist();
    }

    @Test
    void bundleWithoutLandmarkModelIsRejected() throws Exception {
        Path bundle = writeBundle("detector_only.task", Map.of(ModelAsset.DETECTOR_ENTRY, "detector"));

        EngineException ex = catchThrowableOfType(() -> ModelAsset.resolve(bundle), EngineException.class);

        assertThat(ex).hasMessageContaining(ModelAsset.LANDMARKS_ENTRY);
        assertThat(ex.getStage()).isEqualTo(EngineException.Stage.LOAD);
    }

    @Test
    void unknownFileTypeIsRejected() throws Exception {
        Path model = Files.write(tempDir.resolve("landmarks.tflite"), new byte[]{1, 2, 3, 4, 5});

        assertThatThrownBy(() -> ModelAsset.resolve(model))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("Unsupported model asset");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> ModelAsset.resolve(tempDir.resolve("absent.onnx")))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("Model asset not found");
    }

    @Test
    void indicesMustBeNonNegativeIntegers() throws Exception {
        Path invalid = Files.writeString(tempDir.resolve("invalid.txt"), "1, two, 3");
        Path negative = Files.writeString(tempDir.resolve("negative.txt"), "1 -4");

        assertThatThrownBy(() -> ModelAsset.parseIndices(invalid)).hasMessageContaining("'two'");
        assertThatThrownBy(() -> ModelAsset.parseIndices(negative)).hasMessageContaining("Negative landmark index -4");
        assertThat(ModelAsset.parseIndices(Files.writeString(tempDir.resolve("empty.txt"), "  \n"))).isEmpty();
    }

    private Path writeBundle(String name, Map<String, String> entries) throws IOException {
        Path bundle = tempDir.resolve(name);
        try (OutputStream output = Files.newOutputStream(bundle);
             ZipOutputStream zip = new ZipOutputStream(output)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return bundle;
    }
}

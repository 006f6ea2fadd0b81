package com.example.facelandmarker.vision.facelandmarker;

import com.example.facelandmarker.vision.core.RunningMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FaceLandmarkerOptionsTest {

    @Test
    void defaultsMatchSingleFaceImageMode() {
        FaceLandmarkerOptions options = FaceLandmarkerOptions.withModelPath("face_landmarker.task");

        assertThat(options.baseOptions().modelAssetPath()).isEqualTo("face_landmarker.task");
        assertThat(options.runningMode()).isEqualTo(RunningMode.IMAGE);
        assertThat(options.numFaces()).isEqualTo(1);
        assertThat(options.minFaceDetectionConfidence()).isEqualTo(0.5f);
        assertThat(options.minFacePresenceConfidence()).isEqualTo(0.5f);
        assertThat(options.minTrackingConfidence()).isEqualTo(0.5f);
        assertThat(options.outputFaceBlendshapes()).isFalse();
        assertThat(options.outputFacialTransformationMatrixes()).isFalse();
        assertThat(options.resultListener()).isEmpty();
        assertThat(options.errorListener()).isEmpty();
    }

    @Test
    void liveStreamRequiresResultListener() {
        FaceLandmarkerOptions.Builder builder = FaceLandmarkerOptions.builder()
                .setModelAssetPath("face_landmarker.task")
                .setRunningMode(RunningMode.LIVE_STREAM);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("The face landmarker is in live stream mode, a user-defined result listener must be provided.");
    }

    @Test
    void otherModesRejectResultListener() {
        FaceLandmarkerOptions.Builder builder = FaceLandmarkerOptions.builder()
                .setModelAssetPath("face_landmarker.task")
                .setRunningMode(RunningMode.VIDEO)
                .setResultListener((result, image) -> { });

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("The face landmarker is in video mode, a user-defined result listener shouldn't be provided.");
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> FaceLandmarkerOptions.builder().setNumFaces(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numFaces");
        assertThatThrownBy(() -> FaceLandmarkerOptions.builder().setMinFacePresenceConfidence(1.5f).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minFacePresenceConfidence");
        assertThatThrownBy(() -> FaceLandmarkerOptions.builder().setMinTrackingConfidence(Float.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BaseOptions("model.task", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builderCarriesOptionalOutputs() {
        FaceLandmarkerOptions options = FaceLandmarkerOptions.builder()
                .setBaseOptions(new BaseOptions("face_landmarker.task", 4))
                .setRunningMode(RunningMode.VIDEO)
                .setNumFaces(2)
                .setMinFaceDetectionConfidence(0.6f)
                .setOutputFaceBlendshapes(true)
                .setOutputFacialTransformationMatrixes(true)
                .build();

        assertThat(options.baseOptions().numThreads()).isEqualTo(4);
        assertThat(options.runningMode()).isEqualTo(RunningMode.VIDEO);
        assertThat(options.numFaces()).isEqualTo(2);
        assertThat(options.minFaceDetectionConfidence()).isEqualTo(0.6f);
        assertThat(options.outputFaceBlendshapes()).isTrue();
        assertThat(options.outputFacialTransformationMatrixes()).isTrue();
        assertThat(options.toString()).contains("outputFacialTransformationMatrixes=true");
    }

    @Test
    void nullModelPathBecomesEmpty() {
        assertThat(BaseOptions.ofModelAssetPath(null).modelAssetPath()).isEmpty();
    }
}

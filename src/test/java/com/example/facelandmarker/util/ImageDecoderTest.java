package com.example.facelandmarker.util;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.server.ResponseStatusException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ImageDecoderTest {

    @Test
    void decodesUploadedPng() throws Exception {
        MockMultipartFile upload = new MockMultipartFile("image", "face.png", "image/png", pngBytes(20, 10));

        BufferedImage image = ImageDecoder.fromMultipart(upload);

        assertThat(image.getWidth()).isEqualTo(20);
        assertThat(image.getHeight()).isEqualTo(10);
    }

    @Test
    void emptyUploadIsRejected() {
        MockMultipartFile upload = new MockMultipartFile("image", "face.png", "image/png", new byte[0]);

        ResponseStatusException ex = catchThrowableOfType(() -> ImageDecoder.fromMultipart(upload),
                ResponseStatusException.class);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getReason()).isEqualTo("Image file is required");
    }

    @Test
    void decodesBase64WithDataUriPrefix() throws Exception {
        String encoded = "data:image/png;base64," + Base64.getEncoder().encodeToString(pngBytes(8, 6));

        BufferedImage image = ImageDecoder.fromBase64(encoded);

        assertThat(image.getWidth()).isEqualTo(8);
    }

    @Test
    void base64FailuresAreBadRequests() {
        String notAnImage = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3});

        assertThat(catchThrowableOfType(() -> ImageDecoder.fromBase64(" "), ResponseStatusException.class).getReason())
                .isEqualTo("Base64 image data is required");
        assertThat(catchThrowableOfType(() -> ImageDecoder.fromBase64("***"), ResponseStatusException.class).getReason())
                .isEqualTo("Invalid Base64 image data");
        assertThat(catchThrowableOfType(() -> ImageDecoder.fromBase64(notAnImage), ResponseStatusException.class).getReason())
                .isEqualTo("Unable to decode Base64 image data");
    }

    private static byte[] pngBytes(int width, int height) throws Exception {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR), "png", outputStream);
        return outputStream.toByteArray();
    }
}

package com.example.facelandmarker.util;

import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

public final class ImageDecoder {

    private ImageDecoder() {
    }

    public static BufferedImage fromMultipart(MultipartFile upload) {
        if (upload == null || upload.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Image file is required");
        }
        byte[] data;
        try {
            data = upload.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded image", ex);
        }
        return decode(data, "provided image");
    }

    public static BufferedImage fromBase64(String encoded) {
        if (!StringUtils.hasText(encoded)) {
            throw new ResponseStatusException(BAD_REQUEST, "Base64 image data is required");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(stripDataUriPrefix(encoded.trim()));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid Base64 image data", ex);
        }
        return decode(data, "Base64 image data");
    }

    private static String stripDataUriPrefix(String encoded) {
        if (encoded.startsWith("data:")) {
            int comma = encoded.indexOf(',');
            return comma < 0 ? "" : encoded.substring(comma + 1);
        }
        return encoded;
    }

    private static BufferedImage decode(byte[] data, String description) {
        if (data.length == 0) {
            throw new ResponseStatusException(BAD_REQUEST, "Unable to decode " + description);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Unable to decode " + description, ex);
        }
        if (image == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Unable to decode " + description);
        }
        return image;
    }
}

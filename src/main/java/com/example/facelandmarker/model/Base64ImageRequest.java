package com.example.facelandmarker.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Image submitted as base64 encoded bytes")
public record Base64ImageRequest(
        @Schema(description = "Base64 encoded PNG or JPEG image", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String image) {
}

package com.rentnest.tm30.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a passport image, by URL or inline base64
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassportSubmissionRequest {

    @Size(max = 1000, message = "Image URL must not exceed 1000 characters")
    @Pattern(regexp = "^https?://.*", message = "Image URL must be an http(s) URL")
    private String imageUrl;

    private String imageBase64;

    @Pattern(regexp = "^image/[a-zA-Z0-9.+-]+$", message = "MIME type must be an image type")
    private String mimeType;
}

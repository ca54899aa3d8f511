package com.rentnest.tm30.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageUploadRequest {

    /**
     * Base64 encoded file content
     */
    private String file;

    private String fileName;

    private String folder;

    private String mimeType;
}

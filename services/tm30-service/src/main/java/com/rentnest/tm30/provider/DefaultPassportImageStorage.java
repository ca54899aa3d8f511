package com.rentnest.tm30.provider;

import com.rentnest.tm30.client.ImageStorageClient;
import com.rentnest.tm30.client.dto.ImageUploadRequest;
import com.rentnest.tm30.client.dto.ImageUploadResponse;
import com.rentnest.tm30.domain.StoredImage;
import com.rentnest.tm30.exception.ImageStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultPassportImageStorage implements PassportImageStorage {

    private final ImageStorageClient storageClient;

    @Override
    public StoredImage upload(String base64Content, String fileName, String folder, String mimeType) {
        ImageUploadResponse response;
        try {
            response = storageClient.upload(ImageUploadRequest.builder()
                    .file(base64Content)
                    .fileName(fileName)
                    .folder(folder)
                    .mimeType(mimeType)
                    .build());
        } catch (Exception e) {
            log.error("Passport image upload failed for {}/{}: {}", folder, fileName, e.getMessage());
            throw new ImageStorageException("Failed to upload passport image", e);
        }

        if (response == null || response.getUrl() == null || response.getUrl().isBlank()) {
            throw new ImageStorageException("Image storage returned no URL for " + fileName);
        }
        log.info("Passport image stored: {}/{}", folder, fileName);
        return StoredImage.builder()
                .url(response.getUrl())
                .path(response.getFilePath())
                .build();
    }
}

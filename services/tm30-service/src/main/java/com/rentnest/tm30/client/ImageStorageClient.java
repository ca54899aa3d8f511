package com.rentnest.tm30.client;

import com.rentnest.tm30.client.dto.ImageUploadRequest;
import com.rentnest.tm30.client.dto.ImageUploadResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the blob storage that keeps passport images
 */
@FeignClient(
    name = "image-storage",
    url = "${tm30.storage.url:http://localhost:8095}",
    configuration = ImageStorageClientConfig.class
)
public interface ImageStorageClient {

    @PostMapping("/api/v1/files/upload")
    ImageUploadResponse upload(@RequestBody ImageUploadRequest request);
}

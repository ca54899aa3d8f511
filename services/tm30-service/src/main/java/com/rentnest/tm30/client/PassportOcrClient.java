package com.rentnest.tm30.client;

import com.rentnest.tm30.client.dto.OcrScanRequest;
import com.rentnest.tm30.client.dto.OcrScanResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the passport OCR engine
 */
@FeignClient(
    name = "passport-ocr",
    url = "${tm30.ocr.url:http://localhost:8096}",
    configuration = PassportOcrClientConfig.class
)
public interface PassportOcrClient {

    @PostMapping("/api/v1/ocr/passport")
    OcrScanResponse scan(@RequestBody OcrScanRequest request);
}

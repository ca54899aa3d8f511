package com.rentnest.tm30.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrScanRequest {

    private String imageUrl;

    /**
     * Document kind the engine should expect
     */
    @Builder.Default
    private String documentType = "PASSPORT";
}

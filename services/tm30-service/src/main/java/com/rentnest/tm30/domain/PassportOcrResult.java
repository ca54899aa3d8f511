package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Domain object representing the outcome of an OCR scan of a passport image
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassportOcrResult {

    private boolean success;

    /**
     * OCR engine confidence between 0 and 1
     */
    private Double confidence;

    private PassportData data;

    /**
     * Engine response kept verbatim for audit
     */
    private String rawResponse;

    private String error;

    public static PassportOcrResult success(PassportData data, Double confidence, String rawResponse) {
        return PassportOcrResult.builder()
                .success(true)
                .data(data)
                .confidence(confidence)
                .rawResponse(rawResponse)
                .build();
    }

    public static PassportOcrResult failure(String error) {
        return PassportOcrResult.builder()
                .success(false)
                .confidence(0.0)
                .error(error)
                .build();
    }
}

package com.rentnest.tm30.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rentnest.tm30.domain.PassportValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a passport intake: the updated guest plus OCR and validation outcome
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PassportIntakeResponse {

    private boolean success;

    private GuestPassportResponse guest;

    private PassportValidationResult validation;

    private OcrSummary ocrResult;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OcrSummary {
        private boolean success;
        private Double confidence;
        private String error;
    }
}

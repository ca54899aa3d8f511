package com.rentnest.tm30.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the passport OCR engine. Dates arrive as ISO strings
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OcrScanResponse {

    private boolean success;

    private Double confidence;

    private Fields data;

    private JsonNode rawResponse;

    private String error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Fields {
        private String firstName;
        private String lastName;
        private String fullName;
        private String dateOfBirth;
        private String nationality;
        private String gender;
        private String passportNumber;
        private String passportExpiry;
        private String passportIssueDate;
        private String passportCountry;
    }
}

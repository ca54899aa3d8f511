package com.rentnest.tm30.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Status callback sent by the automation executor
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tm30CallbackRequest {

    @NotBlank(message = "Action is required")
    private String action;

    private boolean success;

    private String error;

    @Valid
    private ResultData data;

    private String timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResultData {
        private UUID bookingId;
        private List<GuestResult> results;
        private Integer totalGuests;
        private Integer successCount;
        private String referenceNumber;
        private boolean dryRun;
        private List<AccommodationData> accommodations;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GuestResult {
        private UUID guestId;
        private boolean success;
        private String error;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccommodationData {
        private String id;
        private String name;
        private String address;
        private String status;
    }
}

package com.rentnest.tm30.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Synced TM30 accommodations and the property each one is bound to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccommodationListResponse {

    private int total;

    private int linkedCount;

    /**
     * Most recent sync time across the listed accommodations
     */
    private LocalDateTime lastUpdated;

    private List<AccommodationView> accommodations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccommodationView {
        private UUID id;
        private String tm30Id;
        private String name;
        private String address;
        private String status;
        private boolean linked;
        private UUID linkedPropertyId;
        private String linkedPropertyTitle;
        private LocalDateTime lastSyncedAt;
    }
}

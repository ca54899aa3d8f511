package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Filing result reported back by the automation executor for one booking
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutorReport {

    private UUID bookingId;

    private boolean success;

    private int totalGuests;

    private int successCount;

    private String referenceNumber;

    private String error;

    /**
     * A test filing: nothing was registered with immigration
     */
    private boolean dryRun;

    @Builder.Default
    private List<GuestReport> guests = new ArrayList<>();

    /**
     * Booking counts as filed only when every guest went through.
     */
    public boolean isFullySuccessful() {
        return success && successCount == totalGuests;
    }

    /**
     * Error to record on the booking: the reported one, else the first guest error.
     */
    public String failureReason() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return guests.stream()
                .filter(g -> !g.isSuccess() && g.getError() != null)
                .map(GuestReport::getError)
                .findFirst()
                .orElse(String.format("TM30 submission incomplete: %d of %d guests submitted", successCount, totalGuests));
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GuestReport {
        private UUID guestId;
        private boolean success;
        private String error;
    }
}

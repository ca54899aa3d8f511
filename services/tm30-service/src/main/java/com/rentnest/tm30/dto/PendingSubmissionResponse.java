package com.rentnest.tm30.dto;

import com.rentnest.tm30.entity.BookingTm30Status;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Bookings checking in soon that still need a TM30 filing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingSubmissionResponse {

    private int total;

    private List<PendingBooking> bookings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PendingBooking {
        private UUID bookingId;
        private Instant checkIn;
        private Instant checkOut;
        private String propertyTitle;
        private String accommodationId;
        private BookingTm30Status tm30Status;
        private Integer passportsReceived;
        private long guestsReady;
        private String tm30Error;
    }
}

package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * What the daily job did with one booking
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRunOutcome {

    private UUID bookingId;

    private String property;

    private int guests;

    private Status status;

    private String error;

    public enum Status {
        TRIGGERED,
        MANUAL,
        SKIPPED,
        CONFLICT,
        FAILED
    }
}

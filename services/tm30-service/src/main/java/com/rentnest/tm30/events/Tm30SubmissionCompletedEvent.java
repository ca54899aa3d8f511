package com.rentnest.tm30.events;

import com.rentnest.tm30.entity.BookingTm30Status;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the automation executor reports the outcome of a filing.
 * The notification service uses it to message the guest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tm30SubmissionCompletedEvent {

    private UUID eventId;

    private UUID bookingId;

    private BookingTm30Status tm30Status;

    private String referenceNumber;

    private int successCount;

    private int totalGuests;

    private String error;

    private boolean dryRun;

    /**
     * Contact number for the guest notification, may be null
     */
    private String guestPhone;

    private Instant occurredAt;
}

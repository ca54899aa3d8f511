package com.rentnest.tm30.entity;

import com.rentnest.tm30.exception.InvalidTm30StateException;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Booking-level TM30 status, aggregated from the booking's guests
 */
public enum BookingTm30Status {
    /**
     * Waiting for passports from one or more guests
     */
    PENDING,

    /**
     * Every guest has a passport image and complete passport data
     */
    PASSPORT_RECEIVED,

    /**
     * A filing batch is with the automation executor. Acts as the dispatch lock
     */
    PROCESSING,

    /**
     * The executor confirmed every guest was filed
     */
    SUBMITTED,

    /**
     * The last filing attempt failed. Cleared by an operator retry
     */
    FAILED;

    /**
     * True while guest mutations may move the booking between PENDING and PASSPORT_RECEIVED.
     */
    public boolean isAggregatable() {
        return this == PENDING || this == PASSPORT_RECEIVED;
    }

    public boolean isInFlight() {
        return this == PROCESSING;
    }

    /**
     * Validates a move to {@code next}. SUBMITTED only moves on to PROCESSING
     * (late guests being filed) unless an operator makes the change.
     *
     * @throws InvalidTm30StateException when the move is not allowed
     */
    public BookingTm30Status transitionTo(BookingTm30Status next, boolean administrative) {
        Objects.requireNonNull(next, "next status");
        if (this == next || administrative || allowedTargets().contains(next)) {
            return next;
        }
        throw new InvalidTm30StateException(name(), next.name());
    }

    private Set<BookingTm30Status> allowedTargets() {
        switch (this) {
            case SUBMITTED:
                return EnumSet.of(PROCESSING);
            case PROCESSING:
                return EnumSet.of(PENDING, PASSPORT_RECEIVED, SUBMITTED, FAILED);
            default:
                return EnumSet.complementOf(EnumSet.of(this));
        }
    }
}

package com.rentnest.tm30.entity;

import com.rentnest.tm30.exception.InvalidTm30StateException;

import java.util.Objects;

/**
 * Per-guest TM30 compliance status
 */
public enum GuestTm30Status {
    /**
     * No usable passport data yet (no image, or OCR failed)
     */
    PENDING,

    /**
     * Passport data extracted by OCR
     */
    SCANNED,

    /**
     * Passport data confirmed by a human
     */
    VERIFIED,

    /**
     * Handed to the automation executor, awaiting its result
     */
    SUBMITTING,

    /**
     * Filing confirmed by the executor or recorded by an operator
     */
    SUBMITTED;

    /**
     * True once the guest holds passport data good enough for filing.
     */
    public boolean isPassportComplete() {
        return this != PENDING;
    }

    /**
     * Single authoritative transition rule for guest statuses.
     * A guest never leaves SUBMITTED, and only enters it from SUBMITTING,
     * unless the change is an administrative correction.
     *
     * @param next the requested status
     * @param administrative whether an operator is making the change
     * @return the new status
     * @throws InvalidTm30StateException when the move is not allowed
     */
    public GuestTm30Status transitionTo(GuestTm30Status next, boolean administrative) {
        Objects.requireNonNull(next, "next status");
        if (this == next || administrative) {
            return next;
        }
        if (this == SUBMITTED) {
            throw new InvalidTm30StateException(name(), next.name());
        }
        if (next == SUBMITTED && this != SUBMITTING) {
            throw new InvalidTm30StateException(name(), next.name());
        }
        return next;
    }
}

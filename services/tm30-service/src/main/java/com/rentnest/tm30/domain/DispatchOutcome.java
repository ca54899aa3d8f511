package com.rentnest.tm30.domain;

/**
 * How a dispatch attempt ended
 */
public enum DispatchOutcome {
    /**
     * The executor accepted the batch. Booking stays PROCESSING until the callback
     */
    DISPATCHED,

    /**
     * No automated executor. The payload is returned for filing by hand
     */
    MANUAL_MODE,

    /**
     * No guest with passport data left to file. Nothing was changed
     */
    NOTHING_ELIGIBLE,

    /**
     * Another dispatch holds the PROCESSING lock
     */
    IN_FLIGHT,

    /**
     * The executor rejected the batch or could not be reached. Booking status was restored
     */
    DISPATCH_FAILED
}

package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when a synced TM30 accommodation cannot be found
 * Results in HTTP 404 Not Found
 */
public class AccommodationNotFoundException extends Tm30Exception {

    public AccommodationNotFoundException(UUID accommodationId) {
        super("ACCOMMODATION_NOT_FOUND", "TM30 accommodation not found with ID: " + accommodationId, accommodationId);
    }
}

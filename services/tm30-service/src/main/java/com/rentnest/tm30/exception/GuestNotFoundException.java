package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when a booking guest cannot be found
 * Results in HTTP 404 Not Found
 */
public class GuestNotFoundException extends Tm30Exception {

    public GuestNotFoundException(UUID guestId) {
        super("GUEST_NOT_FOUND", "Guest not found with ID: " + guestId, guestId);
    }
}

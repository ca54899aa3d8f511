package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when a rental booking cannot be found
 * Results in HTTP 404 Not Found
 */
public class BookingNotFoundException extends Tm30Exception {

    public BookingNotFoundException(UUID bookingId) {
        super("BOOKING_NOT_FOUND", "Booking not found with ID: " + bookingId, bookingId);
    }
}

package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when a booking's property has no TM30 accommodation identifier
 * Results in HTTP 422 Unprocessable Entity
 */
public class AccommodationNotConfiguredException extends Tm30Exception {

    public AccommodationNotConfiguredException(UUID propertyId) {
        super("TM30_ACCOMMODATION_NOT_CONFIGURED",
              "Property " + propertyId + " does not have a TM30 accommodation ID configured. Please set it up first.",
              propertyId);
    }
}

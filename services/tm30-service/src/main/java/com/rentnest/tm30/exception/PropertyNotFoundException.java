package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when a rental property cannot be found
 * Results in HTTP 404 Not Found
 */
public class PropertyNotFoundException extends Tm30Exception {

    public PropertyNotFoundException(UUID propertyId) {
        super("PROPERTY_NOT_FOUND", "Property not found with ID: " + propertyId, propertyId);
    }
}

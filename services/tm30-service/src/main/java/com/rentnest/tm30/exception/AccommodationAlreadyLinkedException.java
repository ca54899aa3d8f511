package com.rentnest.tm30.exception;

import java.util.UUID;

/**
 * Exception thrown when an accommodation is already bound to a different property
 * Results in HTTP 409 Conflict
 */
public class AccommodationAlreadyLinkedException extends Tm30Exception {

    public AccommodationAlreadyLinkedException(UUID accommodationId, UUID linkedPropertyId) {
        super("ACCOMMODATION_ALREADY_LINKED",
                "Accommodation " + accommodationId + " is already linked to property " + linkedPropertyId,
                linkedPropertyId);
    }
}

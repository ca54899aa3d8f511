package com.rentnest.tm30.exception;

/**
 * Exception thrown when the caller is neither the booking owner, an operator,
 * nor an internal caller holding the shared service key
 * Results in HTTP 403 Forbidden
 */
public class Tm30AccessDeniedException extends Tm30Exception {

    public Tm30AccessDeniedException(String message) {
        super("TM30_ACCESS_DENIED", message);
    }
}

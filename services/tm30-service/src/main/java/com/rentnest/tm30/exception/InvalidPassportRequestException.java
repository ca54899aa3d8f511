package com.rentnest.tm30.exception;

/**
 * Exception thrown when a passport intake or correction request is malformed
 * Results in HTTP 400 Bad Request
 */
public class InvalidPassportRequestException extends Tm30Exception {

    public InvalidPassportRequestException(String message) {
        super("INVALID_PASSPORT_REQUEST", message);
    }
}

package com.rentnest.tm30.exception;

/**
 * Exception thrown when an executor callback is malformed or names an unknown action
 * Results in HTTP 400 Bad Request
 */
public class InvalidCallbackException extends Tm30Exception {

    public InvalidCallbackException(String message) {
        super("INVALID_TM30_CALLBACK", message);
    }
}

package com.rentnest.tm30.exception;

/**
 * Exception thrown when a TM30 status transition is not permitted
 * For example: a non-operator trying to move a guest out of SUBMITTED
 * Results in HTTP 409 Conflict
 */
public class InvalidTm30StateException extends Tm30Exception {

    public InvalidTm30StateException(String currentState, String requestedState) {
        super("INVALID_TM30_STATE",
              String.format("Cannot move TM30 status from '%s' to '%s'", currentState, requestedState),
              currentState);
    }

    public InvalidTm30StateException(String message) {
        super("INVALID_TM30_STATE", message);
    }
}

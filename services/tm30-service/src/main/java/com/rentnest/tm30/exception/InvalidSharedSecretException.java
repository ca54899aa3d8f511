package com.rentnest.tm30.exception;

/**
 * Exception thrown when a cron trigger or executor callback presents a missing
 * or wrong shared secret
 * Results in HTTP 401 Unauthorized
 */
public class InvalidSharedSecretException extends Tm30Exception {

    public InvalidSharedSecretException(String channel) {
        super("INVALID_SHARED_SECRET", "Invalid or missing secret for " + channel, channel);
    }
}

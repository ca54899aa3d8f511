package com.rentnest.tm30.exception;

/**
 * Base exception for the TM30 pipeline.
 * Every error carries a stable code for API clients and, where there is one,
 * the identifier of the guest, booking or channel it concerns.
 */
public class Tm30Exception extends RuntimeException {

    private final String errorCode;
    private final Object subject;

    public Tm30Exception(String errorCode, String message) {
        this(errorCode, message, (Object) null);
    }

    public Tm30Exception(String errorCode, String message, Object subject) {
        super(message);
        this.errorCode = errorCode;
        this.subject = subject;
    }

    public Tm30Exception(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.subject = null;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Identifier the error is about, or null
     */
    public Object getSubject() {
        return subject;
    }
}

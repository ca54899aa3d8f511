package com.rentnest.tm30.exception;

/**
 * Exception thrown when an inline passport image cannot be uploaded to storage
 * Results in HTTP 502 Bad Gateway
 */
public class ImageStorageException extends Tm30Exception {

    public ImageStorageException(String message) {
        super("IMAGE_STORAGE_ERROR", message);
    }

    public ImageStorageException(String message, Throwable cause) {
        super("IMAGE_STORAGE_ERROR", message, cause);
    }
}

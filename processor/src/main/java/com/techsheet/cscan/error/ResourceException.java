package com.techsheet.cscan.error;

/**
 * Raised when a rendering surface cannot be drawn on. Fatal for the call that hit it.
 */
public class ResourceException extends RuntimeException {

    public ResourceException(String message) {
        super(message);
    }
}

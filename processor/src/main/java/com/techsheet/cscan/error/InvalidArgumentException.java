package com.techsheet.cscan.error;

/**
 * Caller programming error, e.g. detection requested without a threshold.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}

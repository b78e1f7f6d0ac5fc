package com.instaharvest.scraper;

/**
 * Raised when a bounded wait expires before its condition held.
 */
public class DriverTimeoutException extends DriverException {
    public DriverTimeoutException(String message) {
        super(message);
    }

    public DriverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

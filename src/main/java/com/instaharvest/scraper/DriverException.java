package com.instaharvest.scraper;

/**
 * Raised by an {@link AutomationDriver} when a browser interaction fails.
 */
public class DriverException extends RuntimeException {
    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}

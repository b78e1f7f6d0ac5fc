package com.instaharvest.scraper;

/**
 * Raised when a displayed count cannot be turned into a number.
 */
public class CountParseException extends RuntimeException {
    public CountParseException(String message) {
        super(message);
    }

    public CountParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

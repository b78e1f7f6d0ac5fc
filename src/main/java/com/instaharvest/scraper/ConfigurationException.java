package com.instaharvest.scraper;

/**
 * Raised when the selector store is missing, unreadable, or lacks a required key.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.instaharvest.scraper;

/**
 * Creates the single {@link AutomationDriver} a session owns.
 */
@FunctionalInterface
public interface DriverFactory {
    /**
     * @throws DriverException when the browser cannot be started
     */
    AutomationDriver create(SessionOptions options);
}

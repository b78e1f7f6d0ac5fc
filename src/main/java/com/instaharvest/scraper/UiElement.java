package com.instaharvest.scraper;

/**
 * Opaque handle to a rendered UI control or element, produced by an {@link AutomationDriver}.
 * Handles are only meaningful to the driver that created them.
 */
public interface UiElement {
    /**
     * The locator this handle was resolved from, for logging.
     */
    String locator();
}

package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Helper methods shared by the login flow and the list extractor.
 */
public final class DriverUtils {
    private static final Logger logger = LoggerFactory.getLogger(DriverUtils.class);

    private DriverUtils() {}

    /**
     * Reads a setting from the environment, falling back to a system property and then a default.
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    static int intSetting(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value for {}: '{}'", key, raw);
            return defaultVal;
        }
    }

    static Duration millisSetting(String key, Duration defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value for {}: '{}'", key, raw);
            return defaultVal;
        }
    }

    /**
     * Finds elements, retrying while nothing matches or the lookup fails.
     * @param driver automation driver
     * @param locator element locator
     * @param maxRetries number of lookups
     * @param waitTime pause between lookups
     * @return matches of the first non-empty lookup, or an empty list
     */
    public static List<UiElement> findElementsSafe(AutomationDriver driver, String locator, int maxRetries, Duration waitTime) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                List<UiElement> elements = driver.find(locator);
                if (!elements.isEmpty()) return elements;
            } catch (DriverException e) {
                logger.warn("Attempt {}/{} finding '{}' failed: {}", attempt, maxRetries, locator, e.getMessage());
            }
            if (attempt < maxRetries) driver.pause(waitTime);
        }
        return new ArrayList<>();
    }

    /**
     * Reads the text of every element, skipping elements that went stale while reading.
     */
    public static List<String> readTexts(AutomationDriver driver, List<UiElement> elements) {
        List<String> texts = new ArrayList<>();
        for (UiElement element : elements) {
            try {
                String text = driver.readText(element);
                if (!text.isBlank()) texts.add(text.strip());
            } catch (DriverException e) {
                logger.debug("Skipping unreadable element {}: {}", element.locator(), e.getMessage());
            }
        }
        return texts;
    }

    /**
     * Clicks the first element matching a locator if it shows up within the timeout.
     * @return true when a click happened
     */
    public static boolean clickIfPresent(AutomationDriver driver, String locator, Duration timeout, String description) {
        try {
            UiElement element = driver.waitForVisible(locator, timeout);
            driver.click(element);
            logger.debug("Successfully clicked: {}", description);
            return true;
        } catch (DriverTimeoutException e) {
            logger.debug("{} not present within {}ms.", description, timeout.toMillis());
        } catch (DriverException e) {
            logger.warn("Failed to click {}: {}", description, e.getMessage());
        }
        return false;
    }

    /**
     * Retries a driver action with exponential backoff paced by the driver.
     * @param driver driver used to pause between attempts
     * @param action action to run
     * @param maxRetries maximum number of attempts
     * @param initialBackoff pause after the first failure, doubled after each further one
     * @param actionDesc description for logging
     * @return the action's result, or empty if every attempt failed
     */
    public static <T> Optional<T> retryDriverAction(AutomationDriver driver, Supplier<T> action, int maxRetries,
                                                    Duration initialBackoff, String actionDesc) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return Optional.ofNullable(action.get());
            } catch (DriverException e) {
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempt, e.getMessage());
                if (attempt < maxRetries) {
                    driver.pause(backoff);
                    backoff = backoff.multipliedBy(2);
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return Optional.empty();
    }
}

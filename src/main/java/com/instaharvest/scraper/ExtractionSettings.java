package com.instaharvest.scraper;

import java.time.Duration;

/**
 * Immutable tunables of the scroll/convergence loop.
 *
 * @param maxRefreshAttempts       refresh attempts allowed; the list is reopened while fewer have been counted
 * @param waitInterval             pause between settle-phase scrolls
 * @param additionalScrollAttempts extra scroll+read cycles issued before a refresh
 * @param pauseTime                pause after each forward scroll to let rows render
 * @param maxAttempts              consecutive no-growth iterations before the settle phase starts
 * @param scrollDelta              pixels scrolled when no row is visible to scroll into view
 * @param spinnerTimeout           bound on waiting for the loading indicator to disappear
 */
public record ExtractionSettings(
    int maxRefreshAttempts,
    Duration waitInterval,
    int additionalScrollAttempts,
    Duration pauseTime,
    int maxAttempts,
    int scrollDelta,
    Duration spinnerTimeout
) {
    public static final int DEFAULT_MAX_REFRESH_ATTEMPTS = 5;
    public static final Duration DEFAULT_WAIT_INTERVAL = Duration.ofMillis(500);
    public static final int DEFAULT_ADDITIONAL_SCROLL_ATTEMPTS = 1;
    public static final Duration DEFAULT_PAUSE_TIME = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_ATTEMPTS = 2;
    public static final int DEFAULT_SCROLL_DELTA = 1200;
    public static final Duration DEFAULT_SPINNER_TIMEOUT = Duration.ofSeconds(5);

    public ExtractionSettings {
        if (maxRefreshAttempts < 0) throw new IllegalArgumentException("maxRefreshAttempts must be >= 0");
        if (additionalScrollAttempts < 0) throw new IllegalArgumentException("additionalScrollAttempts must be >= 0");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        requireNonNegative(waitInterval, "waitInterval");
        requireNonNegative(pauseTime, "pauseTime");
        requireNonNegative(spinnerTimeout, "spinnerTimeout");
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(DEFAULT_MAX_REFRESH_ATTEMPTS, DEFAULT_WAIT_INTERVAL, DEFAULT_ADDITIONAL_SCROLL_ATTEMPTS,
            DEFAULT_PAUSE_TIME, DEFAULT_MAX_ATTEMPTS, DEFAULT_SCROLL_DELTA, DEFAULT_SPINNER_TIMEOUT);
    }

    /**
     * Defaults overridden by {@code HARVEST_*} environment variables or system properties.
     */
    public static ExtractionSettings fromEnvironment() {
        return new ExtractionSettings(
            DriverUtils.intSetting("HARVEST_MAX_REFRESH_ATTEMPTS", DEFAULT_MAX_REFRESH_ATTEMPTS),
            DriverUtils.millisSetting("HARVEST_WAIT_INTERVAL_MS", DEFAULT_WAIT_INTERVAL),
            DriverUtils.intSetting("HARVEST_ADDITIONAL_SCROLL_ATTEMPTS", DEFAULT_ADDITIONAL_SCROLL_ATTEMPTS),
            DriverUtils.millisSetting("HARVEST_PAUSE_TIME_MS", DEFAULT_PAUSE_TIME),
            DriverUtils.intSetting("HARVEST_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
            DEFAULT_SCROLL_DELTA,
            DEFAULT_SPINNER_TIMEOUT);
    }

    public ExtractionSettings withMaxRefreshAttempts(int value) {
        return new ExtractionSettings(value, waitInterval, additionalScrollAttempts, pauseTime, maxAttempts, scrollDelta, spinnerTimeout);
    }

    public ExtractionSettings withWaitInterval(Duration value) {
        return new ExtractionSettings(maxRefreshAttempts, value, additionalScrollAttempts, pauseTime, maxAttempts, scrollDelta, spinnerTimeout);
    }

    public ExtractionSettings withAdditionalScrollAttempts(int value) {
        return new ExtractionSettings(maxRefreshAttempts, waitInterval, value, pauseTime, maxAttempts, scrollDelta, spinnerTimeout);
    }

    public ExtractionSettings withPauseTime(Duration value) {
        return new ExtractionSettings(maxRefreshAttempts, waitInterval, additionalScrollAttempts, value, maxAttempts, scrollDelta, spinnerTimeout);
    }

    public ExtractionSettings withMaxAttempts(int value) {
        return new ExtractionSettings(maxRefreshAttempts, waitInterval, additionalScrollAttempts, pauseTime, value, scrollDelta, spinnerTimeout);
    }

    public ExtractionSettings withSpinnerTimeout(Duration value) {
        return new ExtractionSettings(maxRefreshAttempts, waitInterval, additionalScrollAttempts, pauseTime, maxAttempts, scrollDelta, value);
    }

    private static void requireNonNegative(Duration d, String name) {
        if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must be a non-negative duration");
    }
}

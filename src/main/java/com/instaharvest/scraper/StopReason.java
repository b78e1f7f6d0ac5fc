package com.instaharvest.scraper;

/**
 * Why an extraction loop ended.
 */
public enum StopReason {
    /** Collected at least as many handles as the list advertises. */
    EXPECTED_COUNT_REACHED,
    /** No growth after settling and the refresh budget is spent. */
    CONVERGED,
    /** The caller's max duration elapsed. */
    DEADLINE_EXCEEDED,
    /** The profile page or the list surface could not be opened. */
    SURFACE_UNAVAILABLE,
    /** The list surface could not be reopened after a refresh. */
    READ_FAILED
}

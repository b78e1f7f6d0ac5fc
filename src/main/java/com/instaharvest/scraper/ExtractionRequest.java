package com.instaharvest.scraper;

import java.time.Duration;
import java.util.Objects;

/**
 * One relationship-list extraction.
 *
 * @param profile       target profile identifier
 * @param kind          which list to read
 * @param maxDuration   soft deadline checked once per scroll iteration, or {@code null} for none
 * @param expectedCount known list size, or {@code null} to read it from the UI when the list opens
 */
public record ExtractionRequest(String profile, ListKind kind, Duration maxDuration, Integer expectedCount) {
    public ExtractionRequest {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(kind, "kind");
        if (maxDuration != null && maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must not be negative");
        }
        if (expectedCount != null && expectedCount < 0) {
            throw new IllegalArgumentException("expectedCount must not be negative");
        }
    }

    public static ExtractionRequest of(String profile, ListKind kind) {
        return new ExtractionRequest(profile, kind, null, null);
    }

    public ExtractionRequest withMaxDuration(Duration maxDuration) {
        return new ExtractionRequest(profile, kind, maxDuration, expectedCount);
    }
}

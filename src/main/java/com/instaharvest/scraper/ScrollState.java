package com.instaharvest.scraper;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Per-extraction scroll bookkeeping. The collected set only grows and keeps first-discovery order.
 */
final class ScrollState {
    private final LinkedHashSet<String> collected = new LinkedHashSet<>();
    private final Instant startedAt;
    private int noGrowthCount;
    private int refreshAttempts;
    private int reopens;
    private int iterations;

    ScrollState(Instant startedAt) {
        this.startedAt = startedAt;
    }

    /**
     * Adds every non-blank handle not collected yet.
     * @return number of handles that were new
     */
    int addAll(Collection<String> handles) {
        int added = 0;
        for (String handle : handles) {
            if (handle == null) continue;
            String trimmed = handle.strip();
            if (!trimmed.isEmpty() && collected.add(trimmed)) added++;
        }
        return added;
    }

    void recordGrowth(int added) {
        if (added > 0) {
            noGrowthCount = 0;
        } else {
            noGrowthCount++;
        }
    }

    void resetNoGrowth() {
        noGrowthCount = 0;
    }

    int recordRefresh() {
        return ++refreshAttempts;
    }

    void recordReopen() {
        reopens++;
    }

    int nextIteration() {
        return ++iterations;
    }

    int size() {
        return collected.size();
    }

    int noGrowthCount() {
        return noGrowthCount;
    }

    int refreshAttempts() {
        return refreshAttempts;
    }

    int reopens() {
        return reopens;
    }

    Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    boolean deadlinePassed(Duration maxDuration, Instant now) {
        return maxDuration != null && elapsed(now).compareTo(maxDuration) > 0;
    }

    List<String> snapshot() {
        return new ArrayList<>(collected);
    }
}

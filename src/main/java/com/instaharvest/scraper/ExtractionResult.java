package com.instaharvest.scraper;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one extraction: the handles in first-discovery order and how the loop ended.
 */
public record ExtractionResult(
    String profile,
    ListKind kind,
    Long expectedCount,
    List<String> handles,
    StopReason stopReason,
    Duration elapsed,
    int refreshes
) {
    public ExtractionResult {
        handles = List.copyOf(handles);
    }

    static ExtractionResult unavailable(ExtractionRequest request, Duration elapsed) {
        return new ExtractionResult(request.profile(), request.kind(), null, List.of(), StopReason.SURFACE_UNAVAILABLE, elapsed, 0);
    }

    public boolean complete() {
        return stopReason == StopReason.EXPECTED_COUNT_REACHED;
    }
}

package com.instaharvest.scraper;

/**
 * Observability sink supplied by the caller. Receives login progress and extraction progress;
 * every method defaults to a no-op. Credentials are never passed to a listener.
 */
public interface HarvestListener {
    HarvestListener NONE = new HarvestListener() {};

    /**
     * Called after each authentication state transition.
     * @param from state that completed
     * @param to state entered
     */
    default void onLoginTransition(LoginState from, LoginState to) {}

    /**
     * Called once per scroll iteration.
     * @param request the running extraction
     * @param collected handles collected so far
     * @param expected advertised total, or {@code null} if unknown
     */
    default void onExtractionProgress(ExtractionRequest request, int collected, Long expected) {}

    /**
     * Called when an extraction ends, including degraded and empty outcomes.
     */
    default void onExtractionFinished(ExtractionResult result) {}
}

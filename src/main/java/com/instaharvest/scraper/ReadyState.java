package com.instaharvest.scraper;

import java.util.Locale;

/**
 * Document readiness as reported by {@code document.readyState}.
 */
public enum ReadyState {
    LOADING,
    INTERACTIVE,
    COMPLETE,
    UNKNOWN;

    public static ReadyState fromDocumentState(Object raw) {
        if (raw == null) return UNKNOWN;
        switch (raw.toString().trim().toLowerCase(Locale.ROOT)) {
            case "loading": return LOADING;
            case "interactive": return INTERACTIVE;
            case "complete": return COMPLETE;
            default: return UNKNOWN;
        }
    }
}

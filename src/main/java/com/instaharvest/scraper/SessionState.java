package com.instaharvest.scraper;

public enum SessionState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    CLOSED
}

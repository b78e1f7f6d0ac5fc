package com.instaharvest.scraper;

/**
 * States of the authentication state machine, in transition order.
 */
public enum LoginState {
    START,
    FORM_LOADED,
    SUBMITTED,
    REDIRECTED,
    POST_LOGIN_CLEANUP,
    READY,
    FAILED;

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}

package com.instaharvest.scraper;

/**
 * Enumerated reasons an authentication attempt can fail.
 */
public enum LoginFailure {
    /** The login page could not be loaded. */
    NAVIGATION_FAILED,
    /** The identifier or secret field never became visible. */
    FORM_NOT_FOUND,
    /** Filling or submitting the form failed. */
    CREDENTIAL_ENTRY_FAILED,
    /** Submit did not redirect and no button matched a login keyword. */
    NO_LOGIN_CONTROL_FOUND,
    /** A login button was clicked but the page still did not leave the login URL. */
    FALLBACK_TIMEOUT,
    /** The browser could not be started. */
    DRIVER_INIT_FAILED,
    /** An account-verification interstitial blocks the session and needs manual action. */
    INTERSTITIAL_BLOCKED
}

package com.instaharvest.scraper;

import java.nio.file.Path;

/**
 * Fatal authentication failure. No usable session exists after this is thrown.
 */
public class LoginException extends RuntimeException {
    private final LoginFailure failure;
    private final String url;
    private final String pageTitle;
    private final Path evidencePath;
    private final Path screenshotPath;

    public LoginException(LoginFailure failure, String message) {
        this(failure, message, null);
    }

    public LoginException(LoginFailure failure, String message, Throwable cause) {
        this(failure, message, cause, null, null, null, null);
    }

    public LoginException(LoginFailure failure, String message, Throwable cause, String url, String pageTitle,
                          Path evidencePath, Path screenshotPath) {
        super("[" + failure + "] " + message, cause);
        this.failure = failure;
        this.url = url;
        this.pageTitle = pageTitle;
        this.evidencePath = evidencePath;
        this.screenshotPath = screenshotPath;
    }

    public LoginFailure failure() {
        return failure;
    }

    /** Page URL when the failure was detected, if captured. */
    public String url() {
        return url;
    }

    public String pageTitle() {
        return pageTitle;
    }

    /** Saved page source, for {@link LoginFailure#INTERSTITIAL_BLOCKED}. */
    public Path evidencePath() {
        return evidencePath;
    }

    public Path screenshotPath() {
        return screenshotPath;
    }
}

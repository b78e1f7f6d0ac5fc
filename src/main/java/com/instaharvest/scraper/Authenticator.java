package com.instaharvest.scraper;

/**
 * Signs a browser session in.
 */
public interface Authenticator {
    /**
     * Runs the login flow to completion.
     * @return {@link LoginState#READY} once the browser holds an authenticated session
     * @throws LoginException on any fatal failure; the caller owns releasing the driver
     */
    LoginState authenticate();
}

package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the login flow as an explicit state machine:
 * <pre>
 * START -> FORM_LOADED -> SUBMITTED -> REDIRECTED -> POST_LOGIN_CLEANUP -> READY
 * </pre>
 * Submitting the form does not navigate in every UI variant, so when the redirect wait in
 * {@code SUBMITTED} expires the machine searches the page for a button whose text matches a
 * login keyword, clicks it and waits again. Each state reports its own {@link LoginFailure};
 * a {@link DriverException} escaping a state is wrapped with that state's failure.
 * <p>
 * Never reports {@link LoginState#READY} while the browser is still on the login page.
 */
public final class AuthenticationStateMachine implements Authenticator {
    private static final Logger logger = LoggerFactory.getLogger(AuthenticationStateMachine.class);
    private static final Duration MIN_WAIT = Duration.ofMillis(1);

    private final AutomationDriver driver;
    private final Credentials credentials;
    private final SessionOptions options;
    private final SelectorConfiguration selectors;
    private final ModalDismisser dismisser;
    private final InterstitialGuard interstitialGuard;
    private final String normalizedLoginUrl;
    private final Clock clock;

    private LoginState state = LoginState.START;
    private UiElement identifierInput;
    private UiElement secretInput;

    public AuthenticationStateMachine(AutomationDriver driver, Credentials credentials, SessionOptions options) {
        this(driver, credentials, options, Clock.systemUTC());
    }

    AuthenticationStateMachine(AutomationDriver driver, Credentials credentials, SessionOptions options, Clock clock) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.options = Objects.requireNonNull(options, "options");
        this.selectors = options.selectors();
        this.dismisser = new ModalDismisser(driver, selectors);
        this.interstitialGuard = new InterstitialGuard(driver, selectors.keywords(), options.artifactsDir(), clock);
        this.normalizedLoginUrl = normalizeUrl(options.loginUrl());
        this.clock = clock;
    }

    public LoginState state() {
        return state;
    }

    @Override
    public LoginState authenticate() {
        if (state == LoginState.FAILED) {
            throw new IllegalStateException("Login already failed; start a new session");
        }
        if (state == LoginState.READY) return state;
        logger.info("Starting login for {}", credentials.identifier());
        while (!state.isTerminal()) {
            LoginState from = state;
            LoginState next;
            try {
                next = step(from);
            } catch (LoginException e) {
                moveTo(LoginState.FAILED);
                logger.error("Login failed in state {}: {}", from, e.getMessage());
                throw e;
            } catch (DriverException e) {
                moveTo(LoginState.FAILED);
                LoginFailure failure = failureFor(from);
                logger.error("Driver failure in state {} ({}): {}", from, failure, e.getMessage());
                throw new LoginException(failure, "Driver failure in state " + from + ": " + e.getMessage(), e);
            }
            moveTo(next);
        }
        logger.info("Login successful!");
        return state;
    }

    private LoginState step(LoginState current) {
        switch (current) {
            case START: return loadForm();
            case FORM_LOADED: return submitCredentials();
            case SUBMITTED: return awaitRedirect();
            case REDIRECTED: return cleanUpPrompts();
            case POST_LOGIN_CLEANUP: return verifyReady();
            default: throw new IllegalStateException("No transition out of " + current);
        }
    }

    private void moveTo(LoginState next) {
        LoginState from = state;
        state = next;
        logger.debug("Login state {} -> {}", from, next);
        options.listener().onLoginTransition(from, next);
    }

    /** START -> FORM_LOADED */
    private LoginState loadForm() {
        logger.info("Navigating to login page");
        try {
            driver.navigate(options.loginUrl());
        } catch (DriverException e) {
            throw new LoginException(LoginFailure.NAVIGATION_FAILED, "Failed to load login page " + options.loginUrl(), e);
        }
        try {
            logger.debug("Waiting for username and password fields to be visible");
            // both fields share one timeout
            Instant deadline = clock.instant().plus(options.timeout());
            identifierInput = driver.waitForVisible(selectors.get(SelectorKey.LOGIN_USERNAME_INPUT), options.timeout());
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(MIN_WAIT) < 0) {
                throw new DriverTimeoutException("Login form timeout spent before the password field was checked");
            }
            secretInput = driver.waitForVisible(selectors.get(SelectorKey.LOGIN_PASSWORD_INPUT), remaining);
        } catch (DriverException e) {
            throw new LoginException(LoginFailure.FORM_NOT_FOUND, "Login form fields not visible within " + options.timeout().toSeconds() + "s", e);
        }
        return LoginState.FORM_LOADED;
    }

    /** FORM_LOADED -> SUBMITTED */
    private LoginState submitCredentials() {
        try {
            logger.info("Entering login credentials");
            driver.clear(identifierInput);
            driver.type(identifierInput, credentials.identifier());
            driver.clear(secretInput);
            driver.type(secretInput, credentials.secret());
            driver.pressEnter(secretInput);
        } catch (DriverException e) {
            throw new LoginException(LoginFailure.CREDENTIAL_ENTRY_FAILED, "Unable to enter credentials", e);
        }
        dismisser.clickIgnoreButtonIfPresent(options.ignoreButtonTimeout(), options.ignoreClickDelay());
        return LoginState.SUBMITTED;
    }

    /** SUBMITTED -> REDIRECTED, directly or through the fallback button search. */
    private LoginState awaitRedirect() {
        try {
            logger.debug("Waiting for login result via redirect");
            waitForLeavingLoginPage(options.timeout());
            return LoginState.REDIRECTED;
        } catch (DriverTimeoutException e) {
            logger.debug("Submit did not redirect, trying fallback button click...");
        }
        clickFallbackLoginButton();
        return LoginState.REDIRECTED;
    }

    private void clickFallbackLoginButton() {
        List<UiElement> candidates;
        try {
            candidates = driver.find(selectors.get(SelectorKey.LOGIN_BUTTON_CANDIDATE));
        } catch (DriverException e) {
            throw new LoginException(LoginFailure.NO_LOGIN_CONTROL_FOUND, "Could not enumerate login button candidates", e);
        }
        logger.debug("Found {} login button candidates", candidates.size());

        UiElement clicked = null;
        for (UiElement candidate : candidates) {
            try {
                String text = driver.readText(candidate);
                Optional<String> keyword = selectors.keywords().matchLogin(text);
                if (keyword.isEmpty()) continue;
                logger.debug("Found login button with text '{}' (keyword '{}'), clicking it.", KeywordSets.normalize(text), keyword.get());
                driver.click(candidate);
                clicked = candidate;
                break;
            } catch (DriverException e) {
                logger.debug("Skipping one candidate button due to error: {}", e.getMessage());
            }
        }
        if (clicked == null) {
            throw new LoginException(LoginFailure.NO_LOGIN_CONTROL_FOUND, "No login button matched expected keywords");
        }

        try {
            waitForLeavingLoginPage(options.timeout());
            driver.waitUntil(d -> d.readyState() == ReadyState.COMPLETE, options.timeout());
        } catch (DriverTimeoutException e) {
            throw new LoginException(LoginFailure.FALLBACK_TIMEOUT,
                "Still on the login page " + options.timeout().toSeconds() + "s after clicking the login button", e);
        }
        driver.pause(options.settleDelay());
    }

    /** REDIRECTED -> POST_LOGIN_CLEANUP */
    private LoginState cleanUpPrompts() {
        dismisser.dismissSaveLoginModal(options.timeout());
        return LoginState.POST_LOGIN_CLEANUP;
    }

    /** POST_LOGIN_CLEANUP -> READY */
    private LoginState verifyReady() {
        if (options.interstitialGuard()) {
            interstitialGuard.check();
        }
        String url = driver.currentUrl();
        if (isLoginPage(url)) {
            throw new LoginException(LoginFailure.FALLBACK_TIMEOUT, "Browser returned to the login page: " + url);
        }
        return LoginState.READY;
    }

    private void waitForLeavingLoginPage(Duration timeout) {
        driver.waitUntil(d -> !isLoginPage(d.currentUrl()), timeout);
    }

    boolean isLoginPage(String url) {
        return url != null && normalizeUrl(url).equals(normalizedLoginUrl);
    }

    static String normalizeUrl(String url) {
        String u = url.strip();
        int cut = u.length();
        int query = u.indexOf('?');
        int fragment = u.indexOf('#');
        if (query >= 0) cut = Math.min(cut, query);
        if (fragment >= 0) cut = Math.min(cut, fragment);
        u = u.substring(0, cut);
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }

    private static LoginFailure failureFor(LoginState state) {
        switch (state) {
            case START: return LoginFailure.NAVIGATION_FAILED;
            case FORM_LOADED: return LoginFailure.CREDENTIAL_ENTRY_FAILED;
            case SUBMITTED: return LoginFailure.FALLBACK_TIMEOUT;
            default: return LoginFailure.NAVIGATION_FAILED;
        }
    }
}

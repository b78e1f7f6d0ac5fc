package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Authenticated browser session exposing follower/following extraction.
 * <p>
 * {@link #open(Credentials, SessionOptions)} acquires one {@link AutomationDriver} and signs in
 * synchronously; if sign-in fails the driver is released before the {@link LoginException}
 * propagates. The tunables ({@code maxRefreshAttempts}, {@code waitInterval},
 * {@code additionalScrollAttempts}, {@code pauseTime}, {@code maxAttempts}) may be changed between
 * calls and apply from the next extraction on.
 * <p>
 * Not thread-safe. Run concurrent extractions in separate sessions.
 *
 * <pre>
 * try (HarvestSession session = HarvestSession.open(credentials, SessionOptions.defaults())) {
 *     session.setMaxRefreshAttempts(10);
 *     List&lt;String&gt; followers = session.getFollowers("target_profile", Duration.ofSeconds(30));
 * }
 * </pre>
 */
public final class HarvestSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HarvestSession.class);

    private final AutomationDriver driver;
    private final ListExtractionEngine engine;
    private ExtractionSettings settings;
    private SessionState state = SessionState.UNAUTHENTICATED;

    private HarvestSession(AutomationDriver driver, SessionOptions options, ListExtractionEngine engine) {
        this.driver = driver;
        this.engine = engine;
        this.settings = options.extractionSettings();
    }

    /**
     * Starts a browser and signs in.
     * @param credentials account to sign in with
     * @param options session options
     * @return an authenticated session
     * @throws LoginException when the browser cannot start or sign-in fails
     */
    public static HarvestSession open(Credentials credentials, SessionOptions options) {
        return open(credentials, options, Clock.systemUTC());
    }

    static HarvestSession open(Credentials credentials, SessionOptions options, Clock clock) {
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(options, "options");
        AutomationDriver driver;
        try {
            driver = options.driverFactory().create(options);
        } catch (DriverException e) {
            throw new LoginException(LoginFailure.DRIVER_INIT_FAILED, "Failed to initialize browser", e);
        }
        if (driver == null) {
            throw new LoginException(LoginFailure.DRIVER_INIT_FAILED, "Driver factory returned no driver");
        }
        HarvestSession session = new HarvestSession(driver, options, new ListExtractionEngine(driver, options, clock));
        try {
            new AuthenticationStateMachine(driver, credentials, options, clock).authenticate();
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        session.state = SessionState.AUTHENTICATED;
        logger.info("Logged in successfully as {}", credentials.identifier());
        return session;
    }

    public List<String> getFollowers(String profile) {
        return getFollowers(profile, null);
    }

    /**
     * @param maxDuration soft deadline, or {@code null} for none
     * @return followers in first-discovery order; empty when the list cannot be opened
     */
    public List<String> getFollowers(String profile, Duration maxDuration) {
        return extract(new ExtractionRequest(profile, ListKind.FOLLOWERS, maxDuration, null)).handles();
    }

    public List<String> getFollowing(String profile) {
        return getFollowing(profile, null);
    }

    /**
     * @param maxDuration soft deadline, or {@code null} for none
     * @return followed accounts in first-discovery order; empty when the list cannot be opened
     */
    public List<String> getFollowing(String profile, Duration maxDuration) {
        return extract(new ExtractionRequest(profile, ListKind.FOLLOWING, maxDuration, null)).handles();
    }

    /**
     * Reads the advertised size of a list without scrolling it.
     * @throws CountParseException when the displayed total is not a number
     */
    public long getTotalCount(String profile, ListKind kind) {
        requireAuthenticated();
        return engine.getTotalCount(profile, kind);
    }

    public ExtractionResult extract(ExtractionRequest request) {
        return extract(request, settings);
    }

    /**
     * Extracts with per-call tunables, leaving the session's settings untouched.
     */
    public ExtractionResult extract(ExtractionRequest request, ExtractionSettings callSettings) {
        requireAuthenticated();
        return engine.extract(Objects.requireNonNull(request, "request"), Objects.requireNonNull(callSettings, "callSettings"));
    }

    public ExtractionSettings getSettings() {
        return settings;
    }

    public void setSettings(ExtractionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public void setMaxRefreshAttempts(int maxRefreshAttempts) {
        settings = settings.withMaxRefreshAttempts(maxRefreshAttempts);
    }

    public void setWaitInterval(Duration waitInterval) {
        settings = settings.withWaitInterval(waitInterval);
    }

    public void setAdditionalScrollAttempts(int additionalScrollAttempts) {
        settings = settings.withAdditionalScrollAttempts(additionalScrollAttempts);
    }

    public void setPauseTime(Duration pauseTime) {
        settings = settings.withPauseTime(pauseTime);
    }

    public void setMaxAttempts(int maxAttempts) {
        settings = settings.withMaxAttempts(maxAttempts);
    }

    public SessionState state() {
        return state;
    }

    /**
     * Releases the browser. Idempotent; safe after a failed or partial operation.
     */
    @Override
    public void close() {
        if (state == SessionState.CLOSED) {
            logger.debug("Session already closed.");
            return;
        }
        state = SessionState.CLOSED;
        logger.info("Quitting browser session.");
        driver.close();
    }

    private void requireAuthenticated() {
        if (state == SessionState.CLOSED) {
            throw new IllegalStateException("Session is closed");
        }
        if (state != SessionState.AUTHENTICATED) {
            throw new IllegalStateException("Session is not authenticated");
        }
    }
}

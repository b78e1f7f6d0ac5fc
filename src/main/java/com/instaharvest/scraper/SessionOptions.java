package com.instaharvest.scraper;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable construction options of a {@link HarvestSession}.
 * Build with {@link #builder()}; {@link #fromEnvironment()} reads {@code HARVEST_*} variables.
 */
public final class SessionOptions {
    public static final String DEFAULT_BASE_URL = "https://www.instagram.com";
    public static final String LOGIN_PATH = "/accounts/login/";

    private final boolean headless;
    private final Duration timeout;
    private final String baseUrl;
    private final String loginUrl;
    private final SelectorConfiguration selectors;
    private final HarvestListener listener;
    private final DriverFactory driverFactory;
    private final ExtractionSettings extractionSettings;
    private final Path artifactsDir;
    private final boolean interstitialGuard;
    private final Duration settleDelay;
    private final Duration ignoreButtonTimeout;
    private final Duration ignoreClickDelay;

    private SessionOptions(Builder b) {
        this.headless = b.headless;
        this.timeout = b.timeout;
        this.baseUrl = stripTrailingSlash(b.baseUrl);
        this.loginUrl = b.loginUrl != null ? b.loginUrl : this.baseUrl + LOGIN_PATH;
        this.selectors = b.selectors != null ? b.selectors : SelectorConfiguration.loadDefault();
        this.listener = b.listener != null ? b.listener : HarvestListener.NONE;
        this.driverFactory = b.driverFactory != null ? b.driverFactory : PlaywrightAutomationDriver::launch;
        this.extractionSettings = b.extractionSettings != null ? b.extractionSettings : ExtractionSettings.defaults();
        this.artifactsDir = b.artifactsDir;
        this.interstitialGuard = b.interstitialGuard;
        this.settleDelay = b.settleDelay;
        this.ignoreButtonTimeout = b.ignoreButtonTimeout;
        this.ignoreClickDelay = b.ignoreClickDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SessionOptions defaults() {
        return builder().build();
    }

    /**
     * Options read from environment variables with system-property fallback.
     * An explicit {@code HARVEST_SELECTORS_FILE} replaces the bundled selector store.
     */
    public static SessionOptions fromEnvironment() {
        Builder b = builder()
            .headless(Boolean.parseBoolean(DriverUtils.envOrProp("HARVEST_HEADLESS", "true")))
            .timeout(Duration.ofSeconds(DriverUtils.intSetting("HARVEST_TIMEOUT_SECONDS", 10)))
            .baseUrl(DriverUtils.envOrProp("HARVEST_BASE_URL", DEFAULT_BASE_URL))
            .artifactsDir(Paths.get(DriverUtils.envOrProp("HARVEST_ARTIFACTS_DIR", "scraped-data/artifacts")))
            .extractionSettings(ExtractionSettings.fromEnvironment());
        String selectorsFile = DriverUtils.envOrProp("HARVEST_SELECTORS_FILE", null);
        if (selectorsFile != null) {
            b.selectors(SelectorConfiguration.load(Paths.get(selectorsFile)));
        }
        return b.build();
    }

    public Builder toBuilder() {
        return new Builder()
            .headless(headless)
            .timeout(timeout)
            .baseUrl(baseUrl)
            .loginUrl(loginUrl)
            .selectors(selectors)
            .listener(listener)
            .driverFactory(driverFactory)
            .extractionSettings(extractionSettings)
            .artifactsDir(artifactsDir)
            .interstitialGuard(interstitialGuard)
            .settleDelay(settleDelay)
            .ignoreButtonTimeout(ignoreButtonTimeout)
            .ignoreClickDelay(ignoreClickDelay);
    }

    public boolean headless() { return headless; }

    /** Bound on every form, redirect and readiness wait. */
    public Duration timeout() { return timeout; }

    public String baseUrl() { return baseUrl; }

    public String loginUrl() { return loginUrl; }

    public SelectorConfiguration selectors() { return selectors; }

    public HarvestListener listener() { return listener; }

    public DriverFactory driverFactory() { return driverFactory; }

    public ExtractionSettings extractionSettings() { return extractionSettings; }

    /** Where interstitial evidence (page source, screenshot) is written. */
    public Path artifactsDir() { return artifactsDir; }

    public boolean interstitialGuard() { return interstitialGuard; }

    /** Fixed delay after a fallback login click once the page reports complete. */
    public Duration settleDelay() { return settleDelay; }

    public Duration ignoreButtonTimeout() { return ignoreButtonTimeout; }

    public Duration ignoreClickDelay() { return ignoreClickDelay; }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private boolean headless = true;
        private Duration timeout = Duration.ofSeconds(10);
        private String baseUrl = DEFAULT_BASE_URL;
        private String loginUrl;
        private SelectorConfiguration selectors;
        private HarvestListener listener;
        private DriverFactory driverFactory;
        private ExtractionSettings extractionSettings;
        private Path artifactsDir = Paths.get("scraped-data", "artifacts");
        private boolean interstitialGuard = true;
        private Duration settleDelay = Duration.ofSeconds(3);
        private Duration ignoreButtonTimeout = Duration.ofSeconds(5);
        private Duration ignoreClickDelay = Duration.ofSeconds(1);

        private Builder() {}

        public Builder headless(boolean headless) {
            this.headless = headless;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = requirePositive(timeout, "timeout");
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder loginUrl(String loginUrl) {
            this.loginUrl = loginUrl;
            return this;
        }

        public Builder selectors(SelectorConfiguration selectors) {
            this.selectors = selectors;
            return this;
        }

        public Builder listener(HarvestListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder driverFactory(DriverFactory driverFactory) {
            this.driverFactory = driverFactory;
            return this;
        }

        public Builder extractionSettings(ExtractionSettings extractionSettings) {
            this.extractionSettings = extractionSettings;
            return this;
        }

        public Builder artifactsDir(Path artifactsDir) {
            this.artifactsDir = Objects.requireNonNull(artifactsDir, "artifactsDir");
            return this;
        }

        public Builder interstitialGuard(boolean interstitialGuard) {
            this.interstitialGuard = interstitialGuard;
            return this;
        }

        public Builder settleDelay(Duration settleDelay) {
            this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay");
            return this;
        }

        public Builder ignoreButtonTimeout(Duration ignoreButtonTimeout) {
            this.ignoreButtonTimeout = requirePositive(ignoreButtonTimeout, "ignoreButtonTimeout");
            return this;
        }

        public Builder ignoreClickDelay(Duration ignoreClickDelay) {
            this.ignoreClickDelay = Objects.requireNonNull(ignoreClickDelay, "ignoreClickDelay");
            return this;
        }

        public SessionOptions build() {
            return new SessionOptions(this);
        }

        private static Duration requirePositive(Duration d, String name) {
            if (d == null || d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be a positive duration");
            }
            return d;
        }
    }
}

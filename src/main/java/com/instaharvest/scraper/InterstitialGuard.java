package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Detects account-verification interstitials that block a freshly signed-in session and
 * records evidence (page source and screenshot) for the operator.
 */
final class InterstitialGuard {
    private static final Logger logger = LoggerFactory.getLogger(InterstitialGuard.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final AutomationDriver driver;
    private final KeywordSets keywords;
    private final Path artifactsDir;
    private final Clock clock;

    InterstitialGuard(AutomationDriver driver, KeywordSets keywords, Path artifactsDir, Clock clock) {
        this.driver = driver;
        this.keywords = keywords;
        this.artifactsDir = artifactsDir;
        this.clock = clock;
    }

    /**
     * @throws LoginException with {@link LoginFailure#INTERSTITIAL_BLOCKED} when a known signature is on the page
     */
    void check() {
        String html = driver.pageSource();
        Optional<String> matched = keywords.matchInterstitial(html);
        if (matched.isEmpty()) return;

        String url = driver.currentUrl();
        String title = safeTitle();
        String stamp = STAMP.format(clock.instant());
        Path evidence = artifactsDir.resolve("interstitial_" + stamp + ".html");
        Path screenshot = artifactsDir.resolve("interstitial_" + stamp + ".png");
        try {
            Files.createDirectories(artifactsDir);
            Files.writeString(evidence, html, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to save page source: {}", e.getMessage());
            evidence = null;
        }
        try {
            driver.screenshot(screenshot);
        } catch (DriverException e) {
            logger.warn("Failed to save screenshot: {}", e.getMessage());
            screenshot = null;
        }
        logger.error("Verification interstitial detected after login. url={} title={} signature='{}' source={} screenshot={}",
            url, title, matched.get(), evidence, screenshot);
        throw new LoginException(LoginFailure.INTERSTITIAL_BLOCKED,
            "Login blocked by an account-verification interstitial; check the registered e-mail for instructions.",
            null, url, title, evidence, screenshot);
    }

    private String safeTitle() {
        try {
            return driver.title();
        } catch (DriverException e) {
            logger.debug("Could not read page title: {}", e.getMessage());
            return "";
        }
    }
}

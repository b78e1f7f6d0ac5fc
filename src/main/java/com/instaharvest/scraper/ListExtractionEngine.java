package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Collects a profile's followers or following from the infinite-scroll list dialog.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the profile page, reads the advertised total from the list entry-point and clicks it.</li>
 *   <li>Reads visible handles, scrolls forward and pauses, until the advertised total is reached,
 *       the list converges or the caller's deadline passes.</li>
 *   <li>Convergence: after {@code maxAttempts} iterations without growth a settle phase issues up to
 *       {@code additionalScrollAttempts} scroll+read cycles, stopping at the first that finds rows. If none
 *       does, a refresh attempt is counted and the list is reopened while that count stays below
 *       {@code maxRefreshAttempts}. Reopening loses the scroll position.</li>
 *   <li>A browser failure while scrolling ends the loop with {@link StopReason#READ_FAILED}, keeping what was read.</li>
 * </ul>
 * Extraction is best-effort: a list that cannot be opened yields an empty result and read failures
 * yield partial results. Nothing here throws for UI unavailability.
 */
public final class ListExtractionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ListExtractionEngine.class);
    private static final int FIND_RETRIES = 2;
    private static final Duration FIND_RETRY_WAIT = Duration.ofMillis(700);
    private static final Duration CLOSE_DIALOG_TIMEOUT = Duration.ofSeconds(3);
    private static final int NAVIGATION_RETRIES = 2;
    private static final Duration NAVIGATION_BACKOFF = Duration.ofSeconds(1);

    private final AutomationDriver driver;
    private final SessionOptions options;
    private final SelectorConfiguration selectors;
    private final Clock clock;

    public ListExtractionEngine(AutomationDriver driver, SessionOptions options) {
        this(driver, options, Clock.systemUTC());
    }

    ListExtractionEngine(AutomationDriver driver, SessionOptions options, Clock clock) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.options = Objects.requireNonNull(options, "options");
        this.selectors = options.selectors();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Extracts one relationship list.
     * @param request target profile, list kind and optional bounds
     * @param settings loop tunables for this call
     * @return handles in first-discovery order with the reason the loop ended; never {@code null}
     */
    public ExtractionResult extract(ExtractionRequest request, ExtractionSettings settings) {
        Instant start = clock.instant();
        logger.info("Extracting {} of '{}' (maxDuration={})", request.kind(), request.profile(), request.maxDuration());

        Opened opened = openListSurface(request.profile(), request.kind(), request.expectedCount() == null);
        if (opened == null) {
            ExtractionResult empty = ExtractionResult.unavailable(request, Duration.between(start, clock.instant()));
            logger.warn("{} list of '{}' could not be opened; returning empty result.", request.kind(), request.profile());
            options.listener().onExtractionFinished(empty);
            return empty;
        }
        Long expected = request.expectedCount() != null ? Long.valueOf(request.expectedCount()) : opened.count;

        ScrollState state = new ScrollState(start);
        StopReason reason = runScrollLoop(request, settings, state, expected);
        Duration elapsed = state.elapsed(clock.instant());
        closeListSurface();

        ExtractionResult result = new ExtractionResult(request.profile(), request.kind(), expected, state.snapshot(),
            reason, elapsed, state.reopens());
        logger.info("Profile extraction completed in {} ms ({}). Total unique profiles: {}",
            elapsed.toMillis(), reason, result.handles().size());
        options.listener().onExtractionFinished(result);
        return result;
    }

    /**
     * Reads the advertised size of a list without scrolling it.
     * @return the parsed total
     * @throws CountParseException when the displayed total is not a number
     * @throws DriverException when the profile page or the entry-point cannot be reached
     */
    public long getTotalCount(String profile, ListKind kind) {
        driver.navigate(profileUrl(profile));
        UiElement link = driver.waitForVisible(selectors.get(kind.entryPoint()), options.timeout());
        long total = CountTextParser.parseLeading(driver.readText(link));
        logger.debug("Parsed total {} of '{}': {}", kind, profile, total);
        driver.click(link);
        closeListSurface();
        return total;
    }

    private StopReason runScrollLoop(ExtractionRequest request, ExtractionSettings settings, ScrollState state, Long expected) {
        try {
            while (true) {
                StopReason reason = runIteration(request, settings, state, expected);
                if (reason != null) return reason;
            }
        } catch (DriverException e) {
            logger.warn("Browser failed while scrolling {} of '{}'; keeping {} profiles: {}",
                request.kind(), request.profile(), state.size(), e.getMessage());
            return StopReason.READ_FAILED;
        }
    }

    /**
     * One read/settle/scroll cycle.
     * @return why the loop ends, or {@code null} to keep scrolling
     */
    private StopReason runIteration(ExtractionRequest request, ExtractionSettings settings, ScrollState state, Long expected) {
        int iteration = state.nextIteration();
        int added = readVisibleProfiles(state, settings);
        state.recordGrowth(added);
        options.listener().onExtractionProgress(request, state.size(), expected);
        logger.debug("Iteration {}: +{} -> {} out of {} expected profiles.", iteration, added, state.size(), expected);

        if (expected != null && state.size() >= expected) {
            logger.info("Expected profile count reached.");
            return StopReason.EXPECTED_COUNT_REACHED;
        }

        boolean reopened = false;
        if (state.noGrowthCount() >= settings.maxAttempts()) {
            int settled = settle(state, settings);
            if (settled > 0) {
                logger.debug("Settle phase found {} late-rendered profiles.", settled);
                state.resetNoGrowth();
            } else {
                int attempts = state.recordRefresh();
                if (attempts >= settings.maxRefreshAttempts()) {
                    logger.info("No new profiles after {} refresh attempts; accepting {} profiles.", attempts, state.size());
                    return StopReason.CONVERGED;
                }
                logger.info("No new profiles after several attempts, reopening list ({}/{}).", attempts, settings.maxRefreshAttempts());
                if (openListSurface(request.profile(), request.kind(), false) == null) {
                    logger.warn("Could not reopen {} list of '{}'; keeping {} profiles.", request.kind(), request.profile(), state.size());
                    return StopReason.READ_FAILED;
                }
                state.recordReopen();
                state.resetNoGrowth();
                reopened = true;
            }
        }

        if (!reopened) {
            scrollForward(settings);
            driver.pause(settings.pauseTime());
        }
        if (state.deadlinePassed(request.maxDuration(), clock.instant())) {
            logger.warn("Max duration ({} ms) exceeded with {} profiles collected.", request.maxDuration().toMillis(), state.size());
            return StopReason.DEADLINE_EXCEEDED;
        }
        return null;
    }

    /**
     * Extra scroll+read cycles, stopping at the first one that finds new rows.
     * @return number of handles added
     */
    private int settle(ScrollState state, ExtractionSettings settings) {
        for (int i = 0; i < settings.additionalScrollAttempts(); i++) {
            scrollForward(settings);
            driver.pause(settings.waitInterval());
            int added = readVisibleProfiles(state, settings);
            if (added > 0) return added;
        }
        return 0;
    }

    private int readVisibleProfiles(ScrollState state, ExtractionSettings settings) {
        try {
            waitForSpinnerToDisappear(settings.spinnerTimeout());
            List<UiElement> elements = DriverUtils.findElementsSafe(driver, selectors.get(SelectorKey.PROFILE_USERNAME_SPAN),
                FIND_RETRIES, FIND_RETRY_WAIT);
            return state.addAll(DriverUtils.readTexts(driver, elements));
        } catch (DriverException e) {
            logger.warn("Failed to read visible profiles: {}", e.getMessage());
            return 0;
        }
    }

    private void waitForSpinnerToDisappear(Duration timeout) {
        try {
            driver.waitForHidden(selectors.get(SelectorKey.LOADING_SPINNER), timeout);
        } catch (DriverTimeoutException e) {
            logger.debug("Loading indicator still present after {} ms. Proceeding anyway.", timeout.toMillis());
        }
    }

    private void scrollForward(ExtractionSettings settings) {
        try {
            List<UiElement> rows = driver.find(selectors.get(SelectorKey.PROFILE_USERNAME_SPAN));
            if (!rows.isEmpty()) {
                driver.scrollIntoView(rows.get(rows.size() - 1));
            } else {
                driver.executeScript("window.scrollBy(0, " + settings.scrollDelta() + ")");
            }
        } catch (DriverException e) {
            logger.debug("Scroll failed: {}", e.getMessage());
        }
    }

    /**
     * Opens the profile page and clicks the list entry-point.
     * @return the opening, with the advertised total if requested and readable; {@code null} on failure
     */
    private Opened openListSurface(String profile, ListKind kind, boolean readCount) {
        if (profile == null || profile.isBlank()) {
            logger.warn("Blank profile identifier; nothing to open.");
            return null;
        }
        String url = profileUrl(profile);
        logger.info("Navigating to profile: {}", url);
        boolean loaded;
        try {
            loaded = DriverUtils.retryDriverAction(driver, () -> {
                driver.navigate(url);
                return Boolean.TRUE;
            }, NAVIGATION_RETRIES, NAVIGATION_BACKOFF, "navigate to " + url).isPresent();
        } catch (DriverException e) {
            logger.warn("Browser failed while navigating to profile {}: {}", url, e.getMessage());
            return null;
        }
        if (!loaded) {
            logger.warn("Error navigating to profile {}", url);
            return null;
        }
        UiElement link;
        try {
            link = driver.waitForVisible(selectors.get(kind.entryPoint()), options.timeout());
        } catch (DriverException e) {
            logger.warn("{} entry-point not found on {}: {}", kind, url, e.getMessage());
            return null;
        }
        Long count = null;
        if (readCount) {
            try {
                count = CountTextParser.parseLeading(driver.readText(link));
                logger.debug("Parsed total {}: {}", kind, count);
            } catch (CountParseException | DriverException e) {
                logger.warn("Could not read total {} of '{}'; continuing without it: {}", kind, profile, e.getMessage());
            }
        }
        try {
            driver.click(link);
            logger.debug("Clicked on the {} link.", kind);
        } catch (DriverException e) {
            logger.warn("Error opening {} list: {}", kind, e.getMessage());
            return null;
        }
        return new Opened(count);
    }

    private void closeListSurface() {
        DriverUtils.clickIfPresent(driver, selectors.get(SelectorKey.CLOSE_MODAL_BUTTON), CLOSE_DIALOG_TIMEOUT, "close list dialog");
    }

    private String profileUrl(String profile) {
        return options.baseUrl() + "/" + profile.strip() + "/";
    }

    private static final class Opened {
        private final Long count;

        private Opened(Long count) {
            this.count = count;
        }
    }
}

package com.instaharvest.scraper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scripted in-memory {@link AutomationDriver}. Waits and pauses advance a {@link FakeClock}
 * instead of sleeping, so timeouts are deterministic.
 */
final class FakeAutomationDriver implements AutomationDriver {
    private static final Duration POLL = Duration.ofMillis(250);

    final FakeClock clock;
    final List<String> navigations = new ArrayList<>();
    final List<String> clicks = new ArrayList<>();
    final Map<String, String> typed = new LinkedHashMap<>();
    final List<Duration> pauses = new ArrayList<>();
    final Set<String> failingUrls = new HashSet<>();
    final Set<String> stuckVisibleLocators = new HashSet<>();
    /** Time a locator takes to become visible once waited on. */
    final Map<String, Duration> visibleAfter = new HashMap<>();
    private final Map<String, Supplier<List<UiElement>>> elements = new HashMap<>();

    String currentUrl = "about:blank";
    String pageSource = "<html><body>home</body></html>";
    String title = "Instagram";
    ReadyState readyState = ReadyState.COMPLETE;
    Runnable onEnter = () -> {};
    Runnable onScroll = () -> {};
    int scrolls;
    int closeCount;
    int navigationBudget = Integer.MAX_VALUE;
    DriverException pauseFailure;

    FakeAutomationDriver(FakeClock clock) {
        this.clock = clock;
    }

    /** Registers the elements a locator resolves to, re-evaluated on every lookup. */
    FakeAutomationDriver on(String locator, Supplier<List<UiElement>> supplier) {
        elements.put(locator, supplier);
        return this;
    }

    FakeAutomationDriver on(String locator, FakeElement... fixed) {
        List<UiElement> list = List.of(fixed);
        return on(locator, () -> list);
    }

    @Override
    public void navigate(String url) {
        if (failingUrls.contains(url) || navigationBudget <= 0) {
            throw new DriverException("net::ERR_CONNECTION_REFUSED at " + url);
        }
        navigationBudget--;
        navigations.add(url);
        currentUrl = url;
    }

    @Override
    public List<UiElement> find(String locator) {
        Supplier<List<UiElement>> supplier = elements.get(locator);
        return supplier == null ? new ArrayList<>() : new ArrayList<>(supplier.get());
    }

    @Override
    public <T> T waitUntil(Function<AutomationDriver, T> condition, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            try {
                T value = condition.apply(this);
                if (value != null && !Boolean.FALSE.equals(value)) return value;
            } catch (DriverException e) {
                // not yet
            }
            if (!clock.instant().isBefore(deadline)) {
                throw new DriverTimeoutException("Condition not met within " + timeout.toMillis() + "ms");
            }
            clock.advance(POLL);
        }
    }

    @Override
    public UiElement waitForVisible(String locator, Duration timeout) {
        List<UiElement> found = find(locator);
        Duration delay = visibleAfter.getOrDefault(locator, Duration.ZERO);
        if (found.isEmpty() || delay.compareTo(timeout) > 0) {
            clock.advance(timeout);
            throw new DriverTimeoutException("No visible element for " + locator);
        }
        clock.advance(delay);
        return found.get(0);
    }

    @Override
    public void waitForHidden(String locator, Duration timeout) {
        if (stuckVisibleLocators.contains(locator)) {
            clock.advance(timeout);
            throw new DriverTimeoutException(locator + " still visible");
        }
    }

    @Override
    public void click(UiElement element) {
        FakeElement fake = (FakeElement) element;
        if (fake.clickFails) throw new DriverException("Element is not clickable: " + fake.text);
        clicks.add(fake.text);
        fake.onClick.run();
    }

    @Override
    public void clear(UiElement element) {
        typed.remove(element.locator());
    }

    @Override
    public void type(UiElement element, String text) {
        typed.put(element.locator(), text);
    }

    @Override
    public void pressEnter(UiElement element) {
        onEnter.run();
    }

    @Override
    public String readText(UiElement element) {
        FakeElement fake = (FakeElement) element;
        if (fake.readFails) throw new DriverException("stale element reference");
        return fake.text.trim();
    }

    @Override
    public void scrollIntoView(UiElement element) {
        scrolls++;
        onScroll.run();
    }

    @Override
    public void scroll(UiElement container, int delta) {
        scrolls++;
        onScroll.run();
    }

    @Override
    public Object executeScript(String source) {
        scrolls++;
        onScroll.run();
        return null;
    }

    @Override
    public String currentUrl() {
        return currentUrl;
    }

    @Override
    public ReadyState readyState() {
        return readyState;
    }

    @Override
    public void pause(Duration duration) {
        if (pauseFailure != null) throw pauseFailure;
        pauses.add(duration);
        clock.advance(duration);
    }

    @Override
    public String pageSource() {
        return pageSource;
    }

    @Override
    public String title() {
        return title;
    }

    @Override
    public void screenshot(Path target) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.write(target, "png".getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DriverException("Cannot write screenshot", e);
        }
    }

    @Override
    public void close() {
        closeCount++;
    }

    static final class FakeElement implements UiElement {
        final String locator;
        final String text;
        Runnable onClick = () -> {};
        boolean readFails;
        boolean clickFails;

        FakeElement(String locator, String text) {
            this.locator = locator;
            this.text = text;
        }

        FakeElement onClick(Runnable action) {
            this.onClick = action;
            return this;
        }

        @Override
        public String locator() {
            return locator;
        }

        @Override
        public String toString() {
            return "FakeElement[" + text + "]";
        }
    }
}

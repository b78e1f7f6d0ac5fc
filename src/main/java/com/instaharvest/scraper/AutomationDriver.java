package com.instaharvest.scraper;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Capability surface of a browser automation session (navigation, element lookup, scripted
 * interaction and bounded waits). Every failure is reported as a {@link DriverException};
 * every wait is bounded and reports expiry as a {@link DriverTimeoutException}.
 */
public interface AutomationDriver extends AutoCloseable {
    /**
     * Navigates the current page to a URL and waits for the load to commit.
     * @param url absolute URL
     */
    void navigate(String url);

    /**
     * Resolves all elements currently matching a locator.
     * @param locator CSS or XPath locator
     * @return matching handles in document order, empty when nothing matches
     */
    List<UiElement> find(String locator);

    /**
     * Polls a condition until it yields a value that is neither {@code null} nor {@code Boolean.FALSE}.
     * A {@link DriverException} thrown by the condition counts as "not yet".
     * @param condition condition evaluated against this driver
     * @param timeout maximum time to wait
     * @param <T> result type
     * @return the first accepted value
     * @throws DriverTimeoutException when the timeout expires first
     */
    <T> T waitUntil(Function<AutomationDriver, T> condition, Duration timeout);

    /**
     * Waits for the first element matching a locator to become visible.
     * @param locator CSS or XPath locator
     * @param timeout maximum time to wait
     * @return handle to the visible element
     * @throws DriverTimeoutException when no visible match appears in time
     */
    UiElement waitForVisible(String locator, Duration timeout);

    /**
     * Waits until no element matching a locator is attached or visible.
     * @param locator CSS or XPath locator
     * @param timeout maximum time to wait
     * @throws DriverTimeoutException when a match is still present at the deadline
     */
    void waitForHidden(String locator, Duration timeout);

    void click(UiElement element);

    void clear(UiElement element);

    void type(UiElement element, String text);

    /**
     * Sends the implicit submit action (Enter) to an input.
     */
    void pressEnter(UiElement element);

    /**
     * Reads the visible text content of an element.
     * @return trimmed text, never {@code null}
     */
    String readText(UiElement element);

    void scrollIntoView(UiElement element);

    /**
     * Scrolls a scrollable container vertically by a pixel delta.
     */
    void scroll(UiElement container, int delta);

    Object executeScript(String source);

    String currentUrl();

    ReadyState readyState();

    /**
     * Blocks for a fixed delay, letting the page render.
     */
    void pause(Duration duration);

    String pageSource();

    String title();

    /**
     * Captures a screenshot of the current viewport.
     * @param target file to write
     */
    void screenshot(Path target);

    /**
     * Releases the browser. Safe to call more than once.
     */
    @Override
    void close();
}

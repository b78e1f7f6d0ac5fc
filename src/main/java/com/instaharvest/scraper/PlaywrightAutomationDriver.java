package com.instaharvest.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link AutomationDriver} backed by a Playwright Chromium page with a mobile profile.
 * Owns the Playwright instance, browser, context and page; {@link #close()} releases all of them once.
 */
public final class PlaywrightAutomationDriver implements AutomationDriver {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightAutomationDriver.class);

    static final String MOBILE_USER_AGENT = "Mozilla/5.0 (Linux; Android 8.0; Nexus 5 Build/OPR6.170623.013) "
        + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/89.0.4389.72 Mobile Safari/537.36";
    private static final int VIEWPORT_WIDTH = 375;
    private static final int VIEWPORT_HEIGHT = 667;
    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private boolean closed;

    PlaywrightAutomationDriver(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    /**
     * Launches Chromium and opens a single page configured from the session options.
     * Partially created resources are released if any step fails.
     * @param options session options (headless flag, timeout)
     * @return a ready driver
     * @throws DriverException when the browser cannot be started
     */
    public static PlaywrightAutomationDriver launch(SessionOptions options) {
        Playwright playwright = null;
        Browser browser = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(options.headless()));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                .setUserAgent(MOBILE_USER_AGENT)
                .setViewportSize(VIEWPORT_WIDTH, VIEWPORT_HEIGHT)
                .setIsMobile(true)
                .setHasTouch(true));
            context.addInitScript("Object.defineProperty(navigator, 'webdriver', {get: () => undefined})");
            Page page = context.newPage();
            page.setDefaultTimeout(options.timeout().toMillis());
            page.setDefaultNavigationTimeout(options.timeout().toMillis());
            logger.info("Launched Chromium (headless={}) with mobile viewport {}x{}", options.headless(), VIEWPORT_WIDTH, VIEWPORT_HEIGHT);
            return new PlaywrightAutomationDriver(playwright, browser, context, page);
        } catch (PlaywrightException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            if (browser != null) {
                try { browser.close(); } catch (PlaywrightException ex) { logger.debug("Browser close after failed launch: {}", ex.getMessage()); }
            }
            if (playwright != null) {
                try { playwright.close(); } catch (PlaywrightException ex) { logger.debug("Playwright close after failed launch: {}", ex.getMessage()); }
            }
            throw new DriverException("Failed to launch browser", e);
        }
    }

    @Override
    public void navigate(String url) {
        run("navigate to " + url, () -> page.navigate(url));
    }

    @Override
    public List<UiElement> find(String locator) {
        return call("find " + locator, () -> {
            List<UiElement> elements = new ArrayList<>();
            for (Locator match : page.locator(locator).all()) {
                elements.add(new PlaywrightElement(locator, match));
            }
            return elements;
        });
    }

    @Override
    public <T> T waitUntil(Function<AutomationDriver, T> condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        DriverException last = null;
        while (true) {
            try {
                T value = condition.apply(this);
                if (value != null && !Boolean.FALSE.equals(value)) return value;
            } catch (DriverException e) {
                last = e;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new DriverTimeoutException("Condition not met within " + timeout.toMillis() + "ms", last);
            }
            pause(Duration.ofNanos(Math.min(remaining, POLL_INTERVAL.toNanos())));
        }
    }

    @Override
    public UiElement waitForVisible(String locator, Duration timeout) {
        return call("wait for visible " + locator, () -> {
            Locator first = page.locator(locator).first();
            first.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(timeout.toMillis()));
            return new PlaywrightElement(locator, first);
        });
    }

    @Override
    public void waitForHidden(String locator, Duration timeout) {
        run("wait for hidden " + locator, () -> page.locator(locator).first()
            .waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.HIDDEN).setTimeout(timeout.toMillis())));
    }

    @Override
    public void click(UiElement element) {
        run("click " + element.locator(), () -> unwrap(element).click());
    }

    @Override
    public void clear(UiElement element) {
        run("clear " + element.locator(), () -> unwrap(element).clear());
    }

    @Override
    public void type(UiElement element, String text) {
        run("type into " + element.locator(), () -> unwrap(element).fill(text));
    }

    @Override
    public void pressEnter(UiElement element) {
        run("press Enter on " + element.locator(), () -> unwrap(element).press("Enter"));
    }

    @Override
    public String readText(UiElement element) {
        return call("read text of " + element.locator(), () -> {
            String text = unwrap(element).innerText();
            return text == null ? "" : text.trim();
        });
    }

    @Override
    public void scrollIntoView(UiElement element) {
        run("scroll into view " + element.locator(), () -> unwrap(element).scrollIntoViewIfNeeded());
    }

    @Override
    public void scroll(UiElement container, int delta) {
        run("scroll " + container.locator(), () -> unwrap(container).evaluate("(el, dy) => el.scrollBy(0, dy)", delta));
    }

    @Override
    public Object executeScript(String source) {
        return call("execute script", () -> page.evaluate(source));
    }

    @Override
    public String currentUrl() {
        return call("read current url", page::url);
    }

    @Override
    public ReadyState readyState() {
        return ReadyState.fromDocumentState(executeScript("document.readyState"));
    }

    @Override
    public void pause(Duration duration) {
        run("pause", () -> page.waitForTimeout(duration.toMillis()));
    }

    @Override
    public String pageSource() {
        return call("read page source", page::content);
    }

    @Override
    public String title() {
        return call("read title", page::title);
    }

    @Override
    public void screenshot(Path target) {
        call("screenshot", () -> {
            try {
                Path parent = target.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
            } catch (java.io.IOException e) {
                throw new DriverException("Cannot create screenshot directory for " + target, e);
            }
            return page.screenshot(new Page.ScreenshotOptions().setPath(target));
        });
    }

    @Override
    public void close() {
        if (closed) {
            logger.debug("Browser already closed.");
            return;
        }
        closed = true;
        try {
            context.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        }
        try {
            browser.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser: {}", e.getMessage());
        }
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            logger.warn("Failed to close Playwright: {}", e.getMessage());
        }
        logger.info("Browser released.");
    }

    private static Locator unwrap(UiElement element) {
        if (element instanceof PlaywrightElement) {
            return ((PlaywrightElement) element).locator;
        }
        throw new IllegalArgumentException("Element was not created by this driver: " + element);
    }

    private void run(String action, Runnable op) {
        call(action, () -> {
            op.run();
            return null;
        });
    }

    private <T> T call(String action, Supplier<T> op) {
        if (closed) {
            throw new DriverException("Cannot " + action + ": browser already closed");
        }
        try {
            return op.get();
        } catch (TimeoutError e) {
            throw new DriverTimeoutException("Timed out trying to " + action, e);
        } catch (PlaywrightException e) {
            throw new DriverException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private static final class PlaywrightElement implements UiElement {
        private final String locatorText;
        private final Locator locator;

        private PlaywrightElement(String locatorText, Locator locator) {
            this.locatorText = locatorText;
            this.locator = locator;
        }

        @Override
        public String locator() {
            return locatorText;
        }

        @Override
        public String toString() {
            return "PlaywrightElement[" + locatorText + "]";
        }
    }
}

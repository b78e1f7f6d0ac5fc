package com.instaharvest.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Idempotent dismissal passes for the prompts that can appear around login. Absence of a
 * prompt is never an error and no method here throws.
 */
final class ModalDismisser {
    private static final Logger logger = LoggerFactory.getLogger(ModalDismisser.class);

    private final AutomationDriver driver;
    private final SelectorConfiguration selectors;

    ModalDismisser(AutomationDriver driver, SelectorConfiguration selectors) {
        this.driver = driver;
        this.selectors = selectors;
    }

    /**
     * Clicks the locale-specific "ignore/skip" button of a post-submit dialog if it shows up.
     * @param timeout how long to look for the button
     * @param waitBeforeClick delay between detection and click
     * @return true if the button was clicked
     */
    boolean clickIgnoreButtonIfPresent(Duration timeout, Duration waitBeforeClick) {
        String locator = selectors.get(SelectorKey.IGNORE_BUTTON);
        UiElement button;
        try {
            button = driver.waitForVisible(locator, timeout);
        } catch (DriverTimeoutException e) {
            logger.info("'Ignore' button not found within {}ms.", timeout.toMillis());
            return false;
        } catch (DriverException e) {
            logger.warn("Could not look for the 'Ignore' button: {}", e.getMessage());
            return false;
        }
        try {
            logger.info("'Ignore' button detected. Waiting {}ms before clicking.", waitBeforeClick.toMillis());
            driver.pause(waitBeforeClick);
            driver.click(button);
            logger.info("Clicked the 'Ignore' button.");
            return true;
        } catch (DriverException e) {
            logger.warn("Failed to click the 'Ignore' button: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Dismisses the "save your login info?" prompt by clicking the first button whose text
     * matches a dismiss keyword, then waits for the dialog to go away.
     * @param timeout bound on detecting the prompt and on its disappearance
     * @return true if the prompt was dismissed
     */
    boolean dismissSaveLoginModal(Duration timeout) {
        String buttonLocator = selectors.get(SelectorKey.SAVE_LOGIN_INFO_BUTTON);
        List<UiElement> buttons;
        try {
            buttons = driver.waitUntil(d -> {
                List<UiElement> found = d.find(buttonLocator);
                return found.isEmpty() ? null : found;
            }, timeout);
        } catch (DriverTimeoutException e) {
            logger.debug("No 'Save login info' prompt detected.");
            return false;
        } catch (DriverException e) {
            logger.warn("Could not detect 'Save login info' prompt: {}", e.getMessage());
            return false;
        }

        for (UiElement button : buttons) {
            try {
                String text = driver.readText(button);
                Optional<String> keyword = selectors.keywords().matchDismiss(text);
                if (keyword.isEmpty()) continue;
                logger.debug("Found dismiss button with text '{}'. Clicking.", text);
                driver.click(button);
                driver.waitForHidden(selectors.get(SelectorKey.SAVE_LOGIN_INFO_DIALOG), timeout);
                logger.debug("'Save login info' prompt dismissed.");
                return true;
            } catch (DriverException e) {
                logger.warn("Error trying to click dismiss button: {}", e.getMessage());
            }
        }
        logger.warn("'Save login info' prompt present but no dismiss button could be clicked; continuing.");
        return false;
    }
}

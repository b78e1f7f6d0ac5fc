package com.instaharvest.scraper;

/**
 * Logical names of every locator the login flow and list extraction depend on.
 * Each constant is a required key of the {@code selectors} object in {@code selectors.json}.
 */
public enum SelectorKey {
    LOGIN_USERNAME_INPUT,
    LOGIN_PASSWORD_INPUT,
    LOGIN_BUTTON_CANDIDATE,
    FOLLOWERS_LINK,
    FOLLOWING_LINK,
    CLOSE_MODAL_BUTTON,
    PROFILE_USERNAME_SPAN,
    IGNORE_BUTTON,
    SAVE_LOGIN_INFO_BUTTON,
    SAVE_LOGIN_INFO_DIALOG,
    LOADING_SPINNER
}

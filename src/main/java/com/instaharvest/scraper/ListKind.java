package com.instaharvest.scraper;

/**
 * The relationship lists a profile exposes.
 */
public enum ListKind {
    FOLLOWERS(SelectorKey.FOLLOWERS_LINK),
    FOLLOWING(SelectorKey.FOLLOWING_LINK);

    private final SelectorKey entryPoint;

    ListKind(SelectorKey entryPoint) {
        this.entryPoint = entryPoint;
    }

    /**
     * Selector of the profile-page link that opens this list.
     */
    public SelectorKey entryPoint() {
        return entryPoint;
    }
}

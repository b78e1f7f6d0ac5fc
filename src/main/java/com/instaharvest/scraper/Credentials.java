package com.instaharvest.scraper;

import java.util.Objects;

/**
 * Account identifier and secret used to sign in. The secret never appears in {@link #toString()}.
 */
public record Credentials(String identifier, String secret) {
    public Credentials {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(secret, "secret");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Credentials[identifier=" + identifier + ", secret=****]";
    }
}

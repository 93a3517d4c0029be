package com.example.authpolicy.policy.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Channel a transaction is initiated through. Used by transaction risk analysis thresholds.
 */
public enum ChannelKind {
    REMOTE_ELECTRONIC,
    CONTACTLESS,
    CARD_PRESENT,
    MOBILE_APP,
    WEB,
    API;

    public static Optional<ChannelKind> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase();
        return Arrays.stream(values())
                .filter(channel -> channel.name().equals(normalized))
                .findFirst();
    }
}

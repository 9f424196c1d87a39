package com.protocolguide.saas.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription status as reported by the billing provider, plus NONE for accounts
 * that never subscribed (or whose upstream customer was deleted).
 */
public enum SubscriptionStatus {
    ACTIVE,
    TRIALING,
    INCOMPLETE,
    INCOMPLETE_EXPIRED,
    PAST_DUE,
    UNPAID,
    PAUSED,
    CANCELED,
    NONE;

    /**
     * Only ACTIVE and TRIALING grant the paid tier.
     */
    public boolean grantsPro() {
        return this == ACTIVE || this == TRIALING;
    }

    public Tier tier() {
        return grantsPro() ? Tier.PRO : Tier.FREE;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a provider status string ("active", "past_due", ...) to the enum.
     * Empty for values we do not know.
     */
    public static Optional<SubscriptionStatus> fromProvider(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (s.equals("CANCELLED")) s = "CANCELED";
        try {
            return Optional.of(SubscriptionStatus.valueOf(s));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

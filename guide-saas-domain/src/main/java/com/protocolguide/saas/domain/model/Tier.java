package com.protocolguide.saas.domain.model;

import java.util.Locale;

/**
 * Feature-access level derived from subscription status.
 */
public enum Tier {
    FREE,
    PRO;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used when reading stored rows. Anything unknown is FREE (fail-closed).
     */
    public static Tier parse(String v) {
        if (v == null) return FREE;
        try {
            return Tier.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}

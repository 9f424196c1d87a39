package com.protocolguide.saas.domain.model;

import java.util.Locale;

public enum BillingInterval {
    MONTHLY,
    ANNUAL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Strict parse for request input: null means MONTHLY, anything unknown is rejected.
     */
    public static BillingInterval parse(String v) {
        if (v == null || v.isBlank()) return MONTHLY;
        try {
            return BillingInterval.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported billing interval: " + v);
        }
    }
}

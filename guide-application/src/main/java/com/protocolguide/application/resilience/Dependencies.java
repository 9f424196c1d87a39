package com.protocolguide.application.resilience;

/**
 * Names of the external dependencies guarded by a breaker.
 */
public final class Dependencies {

    public static final String DATABASE = "database";
    public static final String AI = "ai";
    public static final String BILLING = "billing";

    private Dependencies() {}
}

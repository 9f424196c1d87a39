package com.protocolguide.application.billing;

/**
 * What the synchronizer did with one event.
 */
public enum SyncEffect {
    UPDATED,
    NO_CHANGE,
    ACCOUNT_NOT_FOUND,
    LOGGED_ONLY,
    UNRECOGNIZED
}

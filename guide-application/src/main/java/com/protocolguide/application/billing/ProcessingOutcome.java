package com.protocolguide.application.billing;

/**
 * Acknowledgement for one webhook delivery.
 *
 * @param effect null when the event was skipped
 */
public record ProcessingOutcome(boolean received, boolean skipped, String reason, SyncEffect effect) {

    public static final String ALREADY_PROCESSED = "Already processed";

    public static ProcessingOutcome received(SyncEffect effect) {
        return new ProcessingOutcome(true, false, null, effect);
    }

    public static ProcessingOutcome alreadyProcessed() {
        return new ProcessingOutcome(true, true, ALREADY_PROCESSED, null);
    }
}

package com.signalrelay.webhook;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of a webhook request that passed authentication and validation.
 *
 * <p>All three outcomes are acknowledged to the sender the same way; the distinction is
 * kept for logging, metrics and tests.
 */
@Getter
@RequiredArgsConstructor
public class WebhookAck {

    public enum Outcome {
        /** Admitted and handed to the delivery queue. */
        ACCEPTED,
        /** Seen within the idempotency window, suppressed. */
        DUPLICATE,
        /** Queue saturated under the DROP overflow policy. */
        DROPPED
    }

    private final String correlationId;
    private final Outcome outcome;

    public static WebhookAck accepted(String correlationId) {
        return new WebhookAck(correlationId, Outcome.ACCEPTED);
    }

    public static WebhookAck duplicate(String correlationId) {
        return new WebhookAck(correlationId, Outcome.DUPLICATE);
    }

    public static WebhookAck dropped(String correlationId) {
        return new WebhookAck(correlationId, Outcome.DROPPED);
    }
}

package com.signalrelay.domain.enums;

/**
 * Lifecycle of a delivery task inside the outbound dispatcher.
 *
 * <pre>
 * PENDING -> SENDING -> DELIVERED
 *                    -> RETRYING -> SENDING ...
 *                    -> FAILED
 * </pre>
 */
public enum DeliveryState {

    /** Enqueued, not yet picked up by a worker. */
    PENDING,

    /** A worker is holding a send permit and talking to the messaging API. */
    SENDING,

    /** Last attempt failed with a retryable error; waiting for its backoff to elapse. */
    RETRYING,

    /** Terminal: the messaging API accepted the message. */
    DELIVERED,

    /** Terminal: attempts exhausted or a non-retryable error. */
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }
}

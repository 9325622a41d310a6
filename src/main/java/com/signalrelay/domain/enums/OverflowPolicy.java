package com.signalrelay.domain.enums;

/**
 * What the admission path does when the delivery queue stays full past the enqueue timeout.
 */
public enum OverflowPolicy {

    /** Answer the sender with 503 and release the idempotency admission so a resend is not suppressed. */
    REJECT,

    /** Log and drop the event; the sender still receives an acknowledgement. */
    DROP
}

package com.signalrelay.delivery;

import com.signalrelay.domain.enums.DeliveryState;
import com.signalrelay.domain.model.SignalEvent;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * Unit of work carrying one admitted {@link SignalEvent} through the delivery pipeline.
 *
 * <p>Ownership passes to the dispatcher at enqueue time; from then on only the worker that
 * took the task from the {@link DeliveryQueue} touches it, so the mutable fields need no
 * locking of their own (the queue's lock orders the hand-offs).
 *
 * <p>{@code notBefore} is the visible-after time: the queue will not hand the task out
 * earlier. A fresh task is visible immediately; a retry is visible once its backoff elapses.
 * {@code sequenceNumber} is assigned by the queue on every (re-)enqueue for FIFO tie-breaks.
 */
@Getter
@ToString
public class DeliveryTask {

    private final String correlationId;
    private final SignalEvent event;
    private final Instant enqueuedAt;

    private DeliveryState state = DeliveryState.PENDING;
    private int retryCount;
    private Instant notBefore;
    private long sequenceNumber;
    private String lastError;

    public DeliveryTask(String correlationId, SignalEvent event, Instant enqueuedAt) {
        this.correlationId = correlationId;
        this.event = event;
        this.enqueuedAt = enqueuedAt;
        this.notBefore = enqueuedAt;
    }

    /** Number of the attempt in progress or last made, 1-based. */
    public int getAttempt() {
        return retryCount + 1;
    }

    void markSending() {
        requireState(DeliveryState.PENDING, DeliveryState.RETRYING);
        state = DeliveryState.SENDING;
    }

    void markDelivered() {
        requireState(DeliveryState.SENDING);
        state = DeliveryState.DELIVERED;
    }

    void markRetrying(Instant retryAt, String reason) {
        requireState(DeliveryState.SENDING);
        state = DeliveryState.RETRYING;
        retryCount++;
        notBefore = retryAt;
        lastError = reason;
    }

    void markFailed(String reason) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Task " + correlationId + " is already " + state);
        }
        state = DeliveryState.FAILED;
        lastError = reason;
    }

    void assignSequence(long sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
    }

    private void requireState(DeliveryState... allowed) {
        for (DeliveryState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new IllegalStateException(
                "Illegal transition for task " + correlationId + " from " + state);
    }
}

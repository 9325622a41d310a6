package com.signalrelay.webhook;

import com.signalrelay.delivery.DeliveryConfig;
import com.signalrelay.delivery.DeliveryQueue;
import com.signalrelay.delivery.DeliveryTask;
import com.signalrelay.domain.enums.OverflowPolicy;
import com.signalrelay.domain.model.SignalEvent;
import com.signalrelay.exception.DeliveryQueueFullException;
import com.signalrelay.exception.PayloadValidationException;
import com.signalrelay.exception.SignatureVerificationException;
import com.signalrelay.idempotency.IdempotencyCache;
import com.signalrelay.observability.RelayMetrics;
import com.signalrelay.security.SignatureVerifier;
import com.signalrelay.validation.PayloadValidationResult;
import com.signalrelay.validation.SignalPayloadValidator;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Synchronous admission path for one webhook request:
 * verify signature, validate payload, admit idempotency key, enqueue.
 *
 * <p>Returns as soon as the task is queued; delivery happens on the dispatcher workers and
 * its outcome never reaches the caller. No network I/O happens on this path.
 *
 * <p>Rejections are thrown as {@link com.signalrelay.exception.BaseException} subclasses
 * and turned into responses by the global exception handler. A duplicate is not an error:
 * it is acknowledged like any accepted alert.
 *
 * <p>Elapsed time is recorded for every request. Overrunning the response budget is
 * logged at WARN but does not change the outcome.
 */
@Service
public class WebhookRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(WebhookRequestHandler.class);

    private final SignatureVerifier signatureVerifier;
    private final SignalPayloadValidator payloadValidator;
    private final IdempotencyCache idempotencyCache;
    private final DeliveryQueue deliveryQueue;
    private final WebhookConfig webhookConfig;
    private final DeliveryConfig deliveryConfig;
    private final RelayMetrics relayMetrics;
    private final Clock clock;

    public WebhookRequestHandler(
            SignatureVerifier signatureVerifier,
            SignalPayloadValidator payloadValidator,
            IdempotencyCache idempotencyCache,
            DeliveryQueue deliveryQueue,
            WebhookConfig webhookConfig,
            DeliveryConfig deliveryConfig,
            RelayMetrics relayMetrics,
            Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.payloadValidator = payloadValidator;
        this.idempotencyCache = idempotencyCache;
        this.deliveryQueue = deliveryQueue;
        this.webhookConfig = webhookConfig;
        this.deliveryConfig = deliveryConfig;
        this.relayMetrics = relayMetrics;
        this.clock = clock;
    }

    /**
     * @param body raw request bytes, exactly as received
     * @param signature value of the signature header, may be null
     * @param correlationId request id carried through to the delivery task
     * @throws SignatureVerificationException if the signature is missing or wrong
     * @throws PayloadValidationException if the payload fails validation
     * @throws DeliveryQueueFullException if the queue is saturated under {@link OverflowPolicy#REJECT}
     */
    public WebhookAck handle(byte[] body, String signature, String correlationId) {
        long startNanos = System.nanoTime();
        try {
            return admit(body, signature, correlationId);
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            boolean overBudget = elapsed.compareTo(webhookConfig.getResponseBudget()) > 0;
            if (overBudget) {
                log.warn(
                        "Webhook handling exceeded budget: elapsed={}ms, budget={}ms",
                        elapsed.toMillis(),
                        webhookConfig.getResponseBudget().toMillis());
            }
            relayMetrics.recordLatency(elapsed, overBudget);
        }
    }

    private WebhookAck admit(byte[] body, String signature, String correlationId) {
        if (!signatureVerifier.verify(body, webhookConfig.getSecret(), signature)) {
            relayMetrics.recordOutcome(RelayMetrics.OUTCOME_SIGNATURE_INVALID);
            throw new SignatureVerificationException("Invalid signature");
        }

        PayloadValidationResult validation = payloadValidator.validate(body);
        if (validation.isRejected()) {
            relayMetrics.recordOutcome(RelayMetrics.OUTCOME_VALIDATION_FAILED);
            throw new PayloadValidationException(validation.getErrors());
        }

        SignalEvent event = validation.getEvent();
        String key = idempotencyCache.keyFor(event);
        if (!idempotencyCache.admit(key)) {
            relayMetrics.recordDuplicate();
            log.info(
                    "Duplicate alert suppressed: ticker={}, signal={}, time={}, key={}",
                    event.getTicker(),
                    event.getSignal().getLabel(),
                    event.getTime(),
                    key);
            return WebhookAck.duplicate(correlationId);
        }

        DeliveryTask task = new DeliveryTask(correlationId, event, clock.instant());
        if (!deliveryQueue.enqueue(task)) {
            return onQueueFull(event, key, correlationId);
        }

        relayMetrics.recordOutcome(RelayMetrics.OUTCOME_ACCEPTED);
        log.info(
                "Alert accepted: ticker={}, signal={}, price={}, queueSize={}",
                event.getTicker(),
                event.getSignal().getLabel(),
                event.getPrice().toPlainString(),
                deliveryQueue.size());
        return WebhookAck.accepted(correlationId);
    }

    /**
     * The key is released under either policy: the alert never reached the queue, so a
     * re-send must not be mistaken for a duplicate.
     */
    private WebhookAck onQueueFull(SignalEvent event, String key, String correlationId) {
        idempotencyCache.release(key);
        if (deliveryConfig.getOverflowPolicy() == OverflowPolicy.DROP) {
            relayMetrics.recordOutcome(RelayMetrics.OUTCOME_DROPPED);
            relayMetrics.recordDropped(1);
            log.warn(
                    "Delivery queue full, alert dropped: ticker={}, signal={}, capacity={}",
                    event.getTicker(),
                    event.getSignal().getLabel(),
                    deliveryQueue.getCapacity());
            return WebhookAck.dropped(correlationId);
        }
        relayMetrics.recordOutcome(RelayMetrics.OUTCOME_QUEUE_FULL);
        throw new DeliveryQueueFullException("Delivery queue is full, retry later");
    }
}

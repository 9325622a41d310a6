package com.signalrelay.observability;

import com.signalrelay.delivery.DeliveryQueue;
import com.signalrelay.idempotency.IdempotencyCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the relay.
 *
 * <ul>
 *   <li><b>webhook.requests</b> (counter, tag {@code outcome}): accepted, duplicate,
 *       signature_invalid, validation_failed, queue_full, dropped</li>
 *   <li><b>webhook.duplicates</b> (counter): alerts suppressed by the idempotency cache</li>
 *   <li><b>webhook.latency</b> (timer): synchronous admission time per request</li>
 *   <li><b>webhook.budget.exceeded</b> (counter): requests slower than the response budget</li>
 *   <li><b>delivery.delivered</b>, <b>delivery.failed</b>, <b>delivery.retries</b>,
 *       <b>delivery.dropped</b> (counters)</li>
 *   <li><b>delivery.queue.depth</b>, <b>idempotency.cache.size</b> (gauges)</li>
 * </ul>
 *
 * <p>Created after {@link com.signalrelay.config.MetricsConfig} so every meter carries the
 * common tags.
 */
@Service
@DependsOn("metricsConfig")
public class RelayMetrics {

    public static final String OUTCOME_ACCEPTED = "accepted";
    public static final String OUTCOME_DUPLICATE = "duplicate";
    public static final String OUTCOME_SIGNATURE_INVALID = "signature_invalid";
    public static final String OUTCOME_VALIDATION_FAILED = "validation_failed";
    public static final String OUTCOME_QUEUE_FULL = "queue_full";
    public static final String OUTCOME_DROPPED = "dropped";

    private final MeterRegistry meterRegistry;

    private final Counter duplicatesCounter;
    private final Counter budgetExceededCounter;
    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter retriesCounter;
    private final Counter droppedCounter;
    private final Timer latencyTimer;

    public RelayMetrics(MeterRegistry meterRegistry, DeliveryQueue deliveryQueue, IdempotencyCache idempotencyCache) {
        this.meterRegistry = meterRegistry;

        this.duplicatesCounter = Counter.builder("webhook.duplicates")
                .description("Alerts suppressed as duplicates within the idempotency window")
                .register(meterRegistry);

        this.budgetExceededCounter = Counter.builder("webhook.budget.exceeded")
                .description("Webhook requests that overran the synchronous response budget")
                .register(meterRegistry);

        this.deliveredCounter = Counter.builder("delivery.delivered")
                .description("Messages accepted by Telegram")
                .register(meterRegistry);

        this.failedCounter = Counter.builder("delivery.failed")
                .description("Tasks that reached FAILED")
                .register(meterRegistry);

        this.retriesCounter = Counter.builder("delivery.retries")
                .description("Send attempts rescheduled after a retryable failure")
                .register(meterRegistry);

        this.droppedCounter = Counter.builder("delivery.dropped")
                .description("Admitted alerts discarded by the overflow policy or at shutdown")
                .register(meterRegistry);

        this.latencyTimer = Timer.builder("webhook.latency")
                .description("Time from request receipt to acknowledgement")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        meterRegistry.gauge("delivery.queue.depth", deliveryQueue, DeliveryQueue::size);
        meterRegistry.gauge("idempotency.cache.size", idempotencyCache, IdempotencyCache::size);
    }

    public void recordOutcome(String outcome) {
        Counter.builder("webhook.requests")
                .description("Webhook requests by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordDuplicate() {
        duplicatesCounter.increment();
        recordOutcome(OUTCOME_DUPLICATE);
    }

    public void recordLatency(Duration elapsed, boolean overBudget) {
        latencyTimer.record(elapsed);
        if (overBudget) {
            budgetExceededCounter.increment();
        }
    }

    public void recordDelivered() {
        deliveredCounter.increment();
    }

    public void recordFailed() {
        failedCounter.increment();
    }

    public void recordRetry() {
        retriesCounter.increment();
    }

    public void recordDropped(int count) {
        droppedCounter.increment(count);
    }
}

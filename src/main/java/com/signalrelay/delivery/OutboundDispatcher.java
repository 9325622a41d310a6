package com.signalrelay.delivery;

import com.signalrelay.exception.TelegramApiException;
import com.signalrelay.notification.SignalMessageRenderer;
import com.signalrelay.notification.TelegramClient;
import com.signalrelay.observability.RelayMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Worker pool that drains the {@link DeliveryQueue} and sends each alert to Telegram.
 *
 * <p>Per task: {@code PENDING -> SENDING -> DELIVERED}, or on a retryable failure
 * {@code SENDING -> RETRYING}, after which the task goes back on the queue with a
 * visible-after time of now + backoff and the next {@link DeliveryQueue#take()} that sees
 * it moves it to SENDING again. A fatal failure, or a retryable one on the last allowed
 * attempt, ends in FAILED. Nothing here is reported back to the webhook caller, who was
 * acknowledged at enqueue.
 *
 * <p>All workers share one Resilience4j {@link RateLimiter}. A worker that finds it empty
 * keeps asking for a permit, each request blocking up to the limiter's timeout; the task
 * is never failed for lack of one. The task moves to SENDING only once the permit is held.
 *
 * <p>Workers start and stop with the Spring context. On stop the queue is closed and
 * drained, and every task still in it is failed and logged as dropped. A send still in
 * flight at that point is not retried: if it fails retryably it is dropped the same way.
 */
@Component
public class OutboundDispatcher implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(OutboundDispatcher.class);

    static final String MDC_REQUEST_ID = "requestId";

    private static final long WORKER_JOIN_MILLIS = 2000;

    private final DeliveryQueue deliveryQueue;
    private final SignalMessageRenderer messageRenderer;
    private final TelegramClient telegramClient;
    private final RateLimiter telegramRateLimiter;
    private final IntervalFunction deliveryBackoff;
    private final DeliveryConfig deliveryConfig;
    private final RelayMetrics relayMetrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    public OutboundDispatcher(
            DeliveryQueue deliveryQueue,
            SignalMessageRenderer messageRenderer,
            TelegramClient telegramClient,
            RateLimiter telegramRateLimiter,
            IntervalFunction deliveryBackoff,
            DeliveryConfig deliveryConfig,
            RelayMetrics relayMetrics,
            Clock clock) {
        this.deliveryQueue = deliveryQueue;
        this.messageRenderer = messageRenderer;
        this.telegramClient = telegramClient;
        this.telegramRateLimiter = telegramRateLimiter;
        this.deliveryBackoff = deliveryBackoff;
        this.deliveryConfig = deliveryConfig;
        this.relayMetrics = relayMetrics;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            deliveryQueue.open();
            for (int i = 0; i < deliveryConfig.getWorkers(); i++) {
                Thread worker = new Thread(this::workerLoop, "delivery-worker-" + i);
                worker.setDaemon(true);
                worker.start();
                workers.add(worker);
            }
            log.info(
                    "OutboundDispatcher started: workers={}, maxAttempts={}, rateLimit={}/s",
                    workers.size(),
                    deliveryConfig.getMaxAttempts(),
                    telegramRateLimiter.getRateLimiterConfig().getLimitForPeriod());
        }
    }

    /**
     * Interrupts the workers, gives in-flight sends a moment to finish, then closes and
     * drains the queue. Drained tasks are failed, logged and counted as dropped.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("OutboundDispatcher stopping");
            workers.forEach(Thread::interrupt);
            for (Thread worker : workers) {
                try {
                    worker.join(WORKER_JOIN_MILLIS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            workers.clear();
            deliveryQueue.close();
            dropRemaining();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stops after the web server so no request can enqueue into a drained queue
        return 0;
    }

    public int getWorkerCount() {
        return deliveryConfig.getWorkers();
    }

    /**
     * Runs one attempt for {@code task} on the calling thread: permit, render, send, then
     * the resulting state transition. Never throws.
     */
    public void process(DeliveryTask task) {
        MDC.put(MDC_REQUEST_ID, task.getCorrelationId());
        try {
            if (!acquirePermit(task)) {
                requeueUnsent(task);
                return;
            }
            task.markSending();

            String text = messageRenderer.render(task.getEvent());
            Long messageId = telegramClient.sendMessage(text);

            task.markDelivered();
            relayMetrics.recordDelivered();
            log.info(
                    "Alert delivered: ticker={}, signal={}, attempt={}, messageId={}, latency={}ms",
                    task.getEvent().getTicker(),
                    task.getEvent().getSignal().getLabel(),
                    task.getAttempt(),
                    messageId,
                    Duration.between(task.getEnqueuedAt(), clock.instant()).toMillis());
        } catch (TelegramApiException e) {
            handleFailure(task, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering alert: correlationId={}", task.getCorrelationId(), e);
            if (!task.getState().isTerminal()) {
                fail(task, "Unexpected error: " + e.getMessage());
            }
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void workerLoop() {
        while (running.get()) {
            try {
                process(deliveryQueue.take());
            } catch (InterruptedException e) {
                if (!running.get()) {
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Delivery worker interrupted unexpectedly, resuming");
            }
        }
        log.debug("Delivery worker exiting: {}", Thread.currentThread().getName());
    }

    /**
     * Blocks until the shared limiter grants a permit. Each {@code acquirePermission()} call
     * waits up to the limiter's timeout, so the loop only turns over once per timeout.
     *
     * @return false only if the thread was interrupted while waiting
     */
    private boolean acquirePermit(DeliveryTask task) {
        while (!telegramRateLimiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                return false;
            }
            log.debug("Rate limit reached, still waiting for permit: correlationId={}", task.getCorrelationId());
        }
        return true;
    }

    /** Puts back a task that never reached SENDING, or drops it if the queue is closed. */
    private void requeueUnsent(DeliveryTask task) {
        if (!running.get() || !deliveryQueue.reschedule(task)) {
            drop(task, "Dispatcher stopped before the send was attempted");
        }
    }

    private void handleFailure(DeliveryTask task, TelegramApiException e) {
        if (!e.isRetryable()) {
            fail(task, e.getMessage());
            return;
        }
        if (task.getAttempt() >= deliveryConfig.getMaxAttempts()) {
            fail(task, "Retries exhausted after " + task.getAttempt() + " attempts: " + e.getMessage());
            return;
        }

        if (!running.get()) {
            drop(task, "Dispatcher stopped, retry abandoned: " + e.getMessage());
            return;
        }

        Duration delay = backoffFor(task.getAttempt(), e.getRetryAfter());
        task.markRetrying(clock.instant().plus(delay), e.getMessage());
        if (!deliveryQueue.reschedule(task)) {
            drop(task, "Delivery queue closed, retry abandoned: " + e.getMessage());
            return;
        }
        relayMetrics.recordRetry();
        log.warn(
                "Send failed, retrying: ticker={}, attempt={}/{}, retryIn={}ms, reason={}",
                task.getEvent().getTicker(),
                task.getRetryCount(),
                deliveryConfig.getMaxAttempts(),
                delay.toMillis(),
                e.getMessage());
    }

    /**
     * Exponential delay for the retry that follows attempt {@code attempt}, stretched to
     * Telegram's {@code retry_after} when that is longer.
     */
    Duration backoffFor(int attempt, Duration retryAfter) {
        Duration delay = Duration.ofMillis(deliveryBackoff.apply(attempt));
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter;
        }
        return delay;
    }

    private void fail(DeliveryTask task, String reason) {
        task.markFailed(reason);
        relayMetrics.recordFailed();
        log.error(
                "Alert delivery failed: ticker={}, signal={}, attempts={}, reason={}",
                task.getEvent().getTicker(),
                task.getEvent().getSignal().getLabel(),
                task.getAttempt(),
                reason);
    }

    private void dropRemaining() {
        List<DeliveryTask> remaining = deliveryQueue.drainAll();
        remaining.forEach(task -> drop(task, "Dispatcher stopped before delivery"));
        if (!remaining.isEmpty()) {
            log.warn("Dropped {} undelivered alerts during shutdown", remaining.size());
        }
    }

    /** Ends a task that shutdown cut short: FAILED, logged and counted as dropped. */
    private void drop(DeliveryTask task, String reason) {
        log.warn(
                "Dropping undelivered alert at shutdown: correlationId={}, ticker={}, signal={}, state={}, reason={}",
                task.getCorrelationId(),
                task.getEvent().getTicker(),
                task.getEvent().getSignal().getLabel(),
                task.getState(),
                reason);
        task.markFailed(reason);
        relayMetrics.recordDropped(1);
    }
}

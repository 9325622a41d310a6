package com.signalrelay.api.controller;

import com.signalrelay.api.dto.response.PipelineHealthResponse;
import com.signalrelay.delivery.DeliveryQueue;
import com.signalrelay.delivery.OutboundDispatcher;
import com.signalrelay.idempotency.IdempotencyCache;
import com.signalrelay.notification.TelegramClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints for different consumers.
 *
 * <ul>
 *   <li>GET /health -- shallow probe, 200 whenever the app responds</li>
 *   <li>GET /health/pipeline -- queue, dispatcher and cache state</li>
 *   <li>GET /health/telegram -- live {@code getMe} call against the Bot API</li>
 * </ul>
 *
 * <p>The shallow probe checks nothing downstream, so a Telegram outage never takes the
 * webhook out of the load balancer.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final DeliveryQueue deliveryQueue;
    private final OutboundDispatcher outboundDispatcher;
    private final IdempotencyCache idempotencyCache;
    private final TelegramClient telegramClient;
    private final RateLimiter telegramRateLimiter;

    public HealthController(
            DeliveryQueue deliveryQueue,
            OutboundDispatcher outboundDispatcher,
            IdempotencyCache idempotencyCache,
            TelegramClient telegramClient,
            RateLimiter telegramRateLimiter) {
        this.deliveryQueue = deliveryQueue;
        this.outboundDispatcher = outboundDispatcher;
        this.idempotencyCache = idempotencyCache;
        this.telegramClient = telegramClient;
        this.telegramRateLimiter = telegramRateLimiter;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/pipeline")
    public ResponseEntity<PipelineHealthResponse> pipelineHealth() {
        boolean running = outboundDispatcher.isRunning();
        boolean saturated = deliveryQueue.remainingCapacity() == 0;

        PipelineHealthResponse response = PipelineHealthResponse.builder()
                .status(running && !saturated ? "UP" : "DEGRADED")
                .dispatcherRunning(running)
                .workers(outboundDispatcher.getWorkerCount())
                .queueDepth(deliveryQueue.size())
                .queueCapacity(deliveryQueue.getCapacity())
                .idempotencyCacheSize(idempotencyCache.size())
                .rateLimitPerSecond(telegramRateLimiter.getRateLimiterConfig().getLimitForPeriod())
                .availablePermits(telegramRateLimiter.getMetrics().getAvailablePermissions())
                .build();
        return ResponseEntity.ok(response);
    }

    /** 200 when Telegram accepts the bot token, 503 otherwise. */
    @GetMapping("/telegram")
    public ResponseEntity<Map<String, String>> telegramHealth() {
        boolean connected = telegramClient.testConnection();
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", connected ? "UP" : "DOWN");
        body.put("message", connected ? "Telegram bot reachable" : "Telegram getMe failed");
        return ResponseEntity.status(connected ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
    }
}

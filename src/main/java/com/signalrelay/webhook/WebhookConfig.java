package com.signalrelay.webhook;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Inbound webhook settings.
 *
 * <p>Reads from application.yml:
 * <pre>
 * relay.webhook.secret=${TV_WEBHOOK_SECRET:}
 * relay.webhook.signature-header=X-Signature
 * relay.webhook.response-budget=150ms
 * relay.webhook.idempotency-ttl=5m
 * </pre>
 *
 * <p>{@code relay.webhook.cache-sweep-interval} shares the prefix but is read directly by
 * the {@code @Scheduled} sweep in {@link com.signalrelay.idempotency.IdempotencyCache}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay.webhook")
public class WebhookConfig {

    /** Shared HMAC secret. Blank rejects every request. */
    private String secret;

    private String signatureHeader = "X-Signature";

    /** Synchronous budget for verify + validate + admit + enqueue. Overruns are logged, not failed. */
    private Duration responseBudget = Duration.ofMillis(150);

    private Duration idempotencyTtl = Duration.ofMinutes(5);
}

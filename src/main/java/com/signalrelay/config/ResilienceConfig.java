package com.signalrelay.config;

import com.signalrelay.delivery.DeliveryConfig;
import com.signalrelay.notification.TelegramConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j primitives used by the outbound dispatcher.
 *
 * <p>The rate limiter is process-wide: every dispatcher worker draws from the same
 * bucket of {@code relay.telegram.max-messages-per-second} permits per second. A worker
 * that finds the bucket empty blocks for the permit instead of failing the task.
 *
 * <p>Retries are not driven by a Resilience4j {@code Retry}; the dispatcher re-enqueues the
 * task with a visible-after time and only borrows the exponential {@link IntervalFunction}
 * to compute that delay.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public RateLimiter telegramRateLimiter(TelegramConfig telegramConfig) {
        Duration wait = telegramConfig.getRateLimitWait();
        if (wait == null || wait.isZero() || wait.isNegative()) {
            // Workers loop on acquirePermission(); a zero wait would turn that into a spin
            throw new IllegalArgumentException("relay.telegram.rate-limit-wait must be positive: " + wait);
        }
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(telegramConfig.getMaxMessagesPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(wait)
                .build();
        return RateLimiter.of("telegram", config);
    }

    @Bean
    public IntervalFunction deliveryBackoff(DeliveryConfig deliveryConfig) {
        return IntervalFunction.ofExponentialBackoff(
                deliveryConfig.getInitialBackoff().toMillis(), deliveryConfig.getBackoffMultiplier());
    }
}

package com.signalrelay.delivery;

import com.signalrelay.domain.enums.OverflowPolicy;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Delivery queue and dispatcher settings.
 *
 * <p>{@code maxAttempts} counts every send, the first one included: with the default of 3
 * a task is retried at most twice, after {@code initialBackoff} and then
 * {@code initialBackoff * backoffMultiplier}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay.delivery")
public class DeliveryConfig {

    private int workers = 2;
    private int queueCapacity = 1000;
    private Duration enqueueTimeout = Duration.ofMillis(10);
    private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT;
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
}

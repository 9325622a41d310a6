package com.signalrelay.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with {@code application=<spring.application.name>}.
 *
 * <p>Runs before {@link com.signalrelay.observability.RelayMetrics} registers anything,
 * since common tags only reach meters created after they are set.
 */
@Configuration
public class MetricsConfig {

    static final String APPLICATION_TAG = "application";

    private final MeterRegistry meterRegistry;
    private final String applicationName;

    public MetricsConfig(
            MeterRegistry meterRegistry, @Value("${spring.application.name:signal-relay}") String applicationName) {
        this.meterRegistry = meterRegistry;
        this.applicationName = applicationName;
    }

    @PostConstruct
    public void applyCommonTags() {
        meterRegistry.config().commonTags(APPLICATION_TAG, applicationName);
    }
}

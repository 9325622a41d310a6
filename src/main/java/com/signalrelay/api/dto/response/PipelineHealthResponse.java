package com.signalrelay.api.dto.response;

import lombok.Builder;
import lombok.Getter;

/**
 * Returned by GET /health/pipeline. A snapshot, not a consistent cut: each figure is read
 * independently.
 */
@Getter
@Builder
public class PipelineHealthResponse {

    /** "UP", or "DEGRADED" when the dispatcher is stopped or the queue is full. */
    private final String status;

    private final boolean dispatcherRunning;
    private final int workers;
    private final int queueDepth;
    private final int queueCapacity;
    private final int idempotencyCacheSize;
    private final int rateLimitPerSecond;
    private final int availablePermits;
}

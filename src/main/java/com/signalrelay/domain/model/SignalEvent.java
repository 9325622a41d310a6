package com.signalrelay.domain.model;

import com.signalrelay.domain.enums.TradeSignal;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A validated TradingView alert. Only {@link com.signalrelay.validation.SignalPayloadValidator}
 * builds these, so every instance has passed schema validation.
 *
 * <p>{@code time} is the timestamp text exactly as the sender wrote it (rendered into the
 * chat message); {@code timestamp} is the parsed instant (used for the idempotency key).
 */
@Getter
@Builder
@ToString
public class SignalEvent {

    private final String ticker;
    private final TradeSignal signal;
    private final BigDecimal price;
    private final String time;
    private final Instant timestamp;

    /** Chart timeframe, e.g. "1h". Null when absent. */
    private final String interval;

    /** Chart URL. Null when absent. */
    private final String chart;
}

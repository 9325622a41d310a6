package com.signalrelay.domain.enums;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Direction of an inbound alert.
 *
 * <p>The wire label is matched exactly: "Buy" and "Sell" are the only accepted
 * spellings, other casings are rejected rather than normalized.
 */
@Getter
@RequiredArgsConstructor
public enum TradeSignal {
    BUY("Buy"),
    SELL("Sell");

    private final String label;

    public static Optional<TradeSignal> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(signal -> signal.label.equals(label))
                .findFirst();
    }
}

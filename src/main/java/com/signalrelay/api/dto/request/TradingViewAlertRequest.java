package com.signalrelay.api.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw TradingView alert body, as bound by Jackson before validation.
 *
 * <p>Example:
 * <pre>
 * {"ticker":"BTCUSDT","signal":"Buy","price":45000.0,"time":"2025-08-05T18:30:00Z",
 *  "interval":"1h","chart":"https://www.tradingview.com/chart/?symbol=BTCUSDT"}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TradingViewAlertRequest {

    @NotBlank(message = "Ticker is required")
    @Size(max = 20, message = "Ticker must be 20 characters or less")
    private String ticker;

    @NotNull(message = "Signal is required")
    @Pattern(regexp = "Buy|Sell", message = "Signal must be exactly 'Buy' or 'Sell'")
    private String signal;

    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    private Double price;

    @NotBlank(message = "Time is required")
    private String time;

    private String interval;

    @Pattern(regexp = "https?://\\S+", message = "Chart must be an http(s) URL")
    private String chart;
}

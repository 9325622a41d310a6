package com.signalrelay.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by every Bot API method. Only the fields the relay reads are mapped.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramApiResponse {

    private boolean ok;

    private String description;

    @JsonProperty("error_code")
    private Integer errorCode;

    private Result result;

    private Parameters parameters;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {

        @JsonProperty("message_id")
        private Long messageId;

        /** Set on {@code getMe}. */
        private String username;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Parameters {

        /** Seconds to wait before the next request, sent with 429. */
        @JsonProperty("retry_after")
        private Integer retryAfter;
    }
}

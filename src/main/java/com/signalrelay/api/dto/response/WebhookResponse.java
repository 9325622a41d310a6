package com.signalrelay.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalrelay.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Body of every {@code POST /webhook} response, success or failure.
 *
 * <p>{@code status} is "accepted", "rejected" (4xx) or "error" (5xx). {@code code} and
 * {@code errors} are only present on failures; {@code errors} maps each invalid field to
 * its message.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    public static final String STATUS_ACCEPTED = "accepted";
    public static final String STATUS_REJECTED = "rejected";
    public static final String STATUS_ERROR = "error";

    private final String status;
    private final String code;
    private final String message;
    private final String requestId;
    private final Instant timestamp;
    private final Map<String, Object> errors;

    public static WebhookResponse accepted(String requestId, Instant timestamp) {
        return WebhookResponse.builder()
                .status(STATUS_ACCEPTED)
                .message("Signal accepted")
                .requestId(requestId)
                .timestamp(timestamp)
                .build();
    }

    public static WebhookResponse error(
            ErrorCode errorCode, String message, Map<String, Object> errors, String requestId, Instant timestamp) {
        return WebhookResponse.builder()
                .status(errorCode.getHttpStatus() >= 500 ? STATUS_ERROR : STATUS_REJECTED)
                .code(errorCode.getCode())
                .message(message)
                .requestId(requestId)
                .timestamp(timestamp)
                .errors(errors == null || errors.isEmpty() ? null : errors)
                .build();
    }
}

package com.signalrelay.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    SIGNATURE_INVALID("SIGNATURE_INVALID", 403),
    NOT_FOUND("NOT_FOUND", 404),
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405),
    UNSUPPORTED_MEDIA_TYPE("UNSUPPORTED_MEDIA_TYPE", 415),
    VALIDATION_ERROR("VALIDATION_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    TELEGRAM_ERROR("TELEGRAM_ERROR", 502),
    QUEUE_FULL("QUEUE_FULL", 503);

    private final String code;
    private final int httpStatus;
}

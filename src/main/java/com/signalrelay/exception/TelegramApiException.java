package com.signalrelay.exception;

import java.time.Duration;
import lombok.Getter;

/**
 * A failed send attempt against the Telegram Bot API.
 *
 * <p>{@code retryable} separates transient failures (I/O, timeouts, 5xx, 429) from
 * permanent ones (bad chat id, malformed message, {@code ok:false}). {@code retryAfter}
 * is the minimum wait Telegram asked for on a 429, or null.
 */
@Getter
public class TelegramApiException extends BaseException {

    private final boolean retryable;
    private final Duration retryAfter;

    private TelegramApiException(String message, boolean retryable, Duration retryAfter, Throwable cause) {
        super(ErrorCode.TELEGRAM_ERROR, message, cause);
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public static TelegramApiException retryable(String message, Throwable cause) {
        return new TelegramApiException(message, true, null, cause);
    }

    public static TelegramApiException rateLimited(String message, Duration retryAfter, Throwable cause) {
        return new TelegramApiException(message, true, retryAfter, cause);
    }

    public static TelegramApiException fatal(String message) {
        return new TelegramApiException(message, false, null, null);
    }

    public static TelegramApiException fatal(String message, Throwable cause) {
        return new TelegramApiException(message, false, null, cause);
    }
}

package com.signalrelay.notification;

import com.signalrelay.exception.TelegramApiException;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin client for the Telegram Bot API.
 *
 * <p>Makes exactly one HTTP call per invocation; retry and rate limiting belong to the
 * dispatcher. Every failure surfaces as a {@link TelegramApiException} classified as
 * retryable (I/O error, timeout, 5xx, 429) or fatal (any other 4xx, {@code ok:false},
 * oversized text). The bot token is part of the URL and is never logged.
 */
@Component
public class TelegramClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramClient.class);

    /** Bot API limit for the text of one message. */
    public static final int MAX_MESSAGE_LENGTH = 4096;

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;

    @Autowired
    public TelegramClient(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate(requestFactory(telegramConfig.getTimeout())));
    }

    public TelegramClient(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
    }

    /**
     * Sends {@code text} to the configured chat in HTML parse mode with link previews off.
     *
     * @return the Telegram message id, or null if the response did not carry one
     * @throws TelegramApiException on any failure
     */
    public Long sendMessage(String text) {
        requireConfigured();
        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw TelegramApiException.fatal(
                    "Message length " + text.length() + " exceeds Telegram limit of " + MAX_MESSAGE_LENGTH);
        }

        Map<String, Object> payload = Map.of(
                "chat_id",
                telegramConfig.getChatId(),
                "text",
                text,
                "parse_mode",
                "HTML",
                "disable_web_page_preview",
                true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        TelegramApiResponse response = call(
                () -> restTemplate.postForObject(methodUrl("sendMessage"), request, TelegramApiResponse.class));
        if (response == null || !response.isOk()) {
            String description = response != null ? response.getDescription() : "empty response";
            throw TelegramApiException.fatal("Telegram rejected message: " + description);
        }

        Long messageId = response.getResult() != null ? response.getResult().getMessageId() : null;
        log.debug("Telegram message sent: messageId={}", messageId);
        return messageId;
    }

    /**
     * Probes the bot credentials with {@code getMe}.
     *
     * @return true if Telegram accepted the token
     */
    public boolean testConnection() {
        try {
            requireConfigured();
            TelegramApiResponse response =
                    call(() -> restTemplate.getForObject(methodUrl("getMe"), TelegramApiResponse.class));
            boolean ok = response != null && response.isOk();
            if (ok && response.getResult() != null) {
                log.info("Telegram connection OK: bot=@{}", response.getResult().getUsername());
            }
            return ok;
        } catch (TelegramApiException e) {
            log.warn("Telegram connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private TelegramApiResponse call(TelegramCall call) {
        try {
            return call.execute();
        } catch (HttpClientErrorException.TooManyRequests e) {
            Duration retryAfter = retryAfterOf(e);
            throw TelegramApiException.rateLimited("Telegram rate limit hit, retryAfter=" + retryAfter, retryAfter, e);
        } catch (HttpClientErrorException e) {
            throw TelegramApiException.fatal("Telegram returned " + e.getStatusCode() + ": " + describe(e), e);
        } catch (HttpServerErrorException e) {
            throw TelegramApiException.retryable("Telegram returned " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw TelegramApiException.retryable("Telegram unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw TelegramApiException.fatal("Unreadable Telegram response: " + e.getMessage(), e);
        }
    }

    /** Reads {@code parameters.retry_after} from the body, falling back to the Retry-After header. */
    private Duration retryAfterOf(HttpClientErrorException e) {
        TelegramApiResponse body = readBody(e);
        if (body != null && body.getParameters() != null && body.getParameters().getRetryAfter() != null) {
            return Duration.ofSeconds(body.getParameters().getRetryAfter());
        }
        HttpHeaders headers = e.getResponseHeaders();
        String header = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (header != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(header.trim()));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring non-numeric Retry-After header: {}", header);
            }
        }
        return null;
    }

    private String describe(HttpClientErrorException e) {
        TelegramApiResponse body = readBody(e);
        return body != null && body.getDescription() != null ? body.getDescription() : e.getStatusText();
    }

    private TelegramApiResponse readBody(HttpClientErrorException e) {
        try {
            return e.getResponseBodyAs(TelegramApiResponse.class);
        } catch (RuntimeException ex) {
            log.debug("Could not decode Telegram error body: {}", ex.getMessage());
            return null;
        }
    }

    private void requireConfigured() {
        if (isBlank(telegramConfig.getBotToken()) || isBlank(telegramConfig.getChatId())) {
            throw TelegramApiException.fatal("Telegram bot token or chat id is not configured");
        }
    }

    private String methodUrl(String method) {
        return telegramConfig.getApiBaseUrl() + "/bot" + telegramConfig.getBotToken() + "/" + method;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    @FunctionalInterface
    private interface TelegramCall {
        TelegramApiResponse execute();
    }
}

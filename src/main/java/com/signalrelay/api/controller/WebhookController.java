package com.signalrelay.api.controller;

import com.signalrelay.api.RequestIdFilter;
import com.signalrelay.api.dto.response.WebhookResponse;
import com.signalrelay.webhook.WebhookAck;
import com.signalrelay.webhook.WebhookConfig;
import com.signalrelay.webhook.WebhookRequestHandler;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * TradingView alert endpoint.
 *
 * <p>The body is taken as raw bytes: the HMAC is computed over exactly what was sent, so
 * nothing may parse or re-encode it first. Rejections propagate as exceptions to
 * {@link com.signalrelay.exception.GlobalExceptionHandler}.
 */
@RestController
public class WebhookController {

    private final WebhookRequestHandler webhookRequestHandler;
    private final WebhookConfig webhookConfig;
    private final Clock clock;

    public WebhookController(WebhookRequestHandler webhookRequestHandler, WebhookConfig webhookConfig, Clock clock) {
        this.webhookRequestHandler = webhookRequestHandler;
        this.webhookConfig = webhookConfig;
        this.clock = clock;
    }

    /**
     * Verifies, validates and queues an alert. Answers 202 once queued (duplicates
     * included), before anything is sent to Telegram.
     */
    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> receive(
            @RequestBody(required = false) byte[] body, HttpServletRequest request) {
        String requestId = RequestIdFilter.resolve(request);
        String signature = request.getHeader(webhookConfig.getSignatureHeader());

        WebhookAck ack = webhookRequestHandler.handle(body != null ? body : new byte[0], signature, requestId);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(WebhookResponse.accepted(ack.getCorrelationId(), clock.instant()));
    }
}

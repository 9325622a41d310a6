package com.signalrelay.notification;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the Telegram Bot API integration.
 *
 * <p>Reads from application.yml:
 * <pre>
 * relay.telegram.bot-token=${TG_BOT_TOKEN:}
 * relay.telegram.chat-id=${TG_CHAT_ID:}
 * relay.telegram.timeout=10s
 * relay.telegram.max-messages-per-second=30
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "relay.telegram")
public class TelegramConfig {

    private String botToken;

    /** Numeric chat id or {@code @channelname}. */
    private String chatId;

    private String apiBaseUrl = "https://api.telegram.org";

    /** Connect and read timeout for a single send attempt. */
    private Duration timeout = Duration.ofSeconds(10);

    private int maxMessagesPerSecond = 30;

    /** How long one permit request blocks before the worker logs and asks again. */
    private Duration rateLimitWait = Duration.ofSeconds(5);
}

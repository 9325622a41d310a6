package com.signalrelay.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.signalrelay.exception.TelegramApiException;
import com.signalrelay.notification.TelegramClient;
import com.signalrelay.notification.TelegramConfig;
import java.net.SocketTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TelegramClientTest {

    private static final String BASE = "https://api.telegram.test";
    private static final String SEND_URL = BASE + "/bot123456:TEST-TOKEN/sendMessage";
    private static final String GET_ME_URL = BASE + "/bot123456:TEST-TOKEN/getMe";

    private TelegramConfig telegramConfig;
    private MockRestServiceServer server;
    private TelegramClient client;

    @BeforeEach
    void setUp() {
        telegramConfig = new TelegramConfig();
        telegramConfig.setBotToken("123456:TEST-TOKEN");
        telegramConfig.setChatId("-100200300");
        telegramConfig.setApiBaseUrl(BASE);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new TelegramClient(telegramConfig, restTemplate);
    }

    private TelegramApiException sendExpectingFailure(String text) {
        Throwable thrown = catchThrowable(() -> client.sendMessage(text));
        assertThat(thrown).isInstanceOf(TelegramApiException.class);
        return (TelegramApiException) thrown;
    }

    @Nested
    @DisplayName("sendMessage")
    class SendMessage {

        @Test
        @DisplayName("Posts chat id, HTML parse mode and no preview, returns the message id")
        void success() {
            server.expect(requestTo(SEND_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.chat_id").value("-100200300"))
                    .andExpect(jsonPath("$.text").value("<b>BTCUSDT</b>"))
                    .andExpect(jsonPath("$.parse_mode").value("HTML"))
                    .andExpect(jsonPath("$.disable_web_page_preview").value(true))
                    .andRespond(withSuccess("{\"ok\":true,\"result\":{\"message_id\":42}}", MediaType.APPLICATION_JSON));

            assertThat(client.sendMessage("<b>BTCUSDT</b>")).isEqualTo(42L);
            server.verify();
        }

        @Test
        @DisplayName("429 is retryable and carries retry_after")
        void tooManyRequests() {
            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.RETRY_AFTER, "7");
            server.expect(requestTo(SEND_URL))
                    .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                            .contentType(MediaType.APPLICATION_JSON)
                            .headers(headers)
                            .body("{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 7\","
                                    + "\"parameters\":{\"retry_after\":7}}"));

            TelegramApiException e = sendExpectingFailure("hello");

            assertThat(e.isRetryable()).isTrue();
            assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
        }

        @Test
        @DisplayName("5xx is retryable")
        void serverError() {
            server.expect(requestTo(SEND_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

            TelegramApiException e = sendExpectingFailure("hello");

            assertThat(e.isRetryable()).isTrue();
            assertThat(e.getRetryAfter()).isNull();
        }

        @Test
        @DisplayName("Other 4xx is fatal")
        void clientError() {
            server.expect(requestTo(SEND_URL))
                    .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}"));

            assertThat(sendExpectingFailure("hello").isRetryable()).isFalse();
        }

        @Test
        @DisplayName("Read timeout is retryable")
        void timeout() {
            server.expect(requestTo(SEND_URL)).andRespond(request -> {
                throw new SocketTimeoutException("Read timed out");
            });

            assertThat(sendExpectingFailure("hello").isRetryable()).isTrue();
        }

        @Test
        @DisplayName("ok:false in a 200 response is fatal")
        void okFalse() {
            server.expect(requestTo(SEND_URL))
                    .andRespond(withSuccess("{\"ok\":false,\"description\":\"Forbidden\"}", MediaType.APPLICATION_JSON));

            TelegramApiException e = sendExpectingFailure("hello");

            assertThat(e.isRetryable()).isFalse();
            assertThat(e.getMessage()).contains("Forbidden");
        }

        @Test
        @DisplayName("Text over 4096 characters is refused without a request")
        void oversized() {
            TelegramApiException e = sendExpectingFailure("x".repeat(TelegramClient.MAX_MESSAGE_LENGTH + 1));

            assertThat(e.isRetryable()).isFalse();
            server.verify();
        }

        @Test
        @DisplayName("Missing credentials are fatal")
        void notConfigured() {
            telegramConfig.setBotToken("");

            assertThatThrownBy(() -> client.sendMessage("hello"))
                    .isInstanceOf(TelegramApiException.class)
                    .hasMessageContaining("not configured");
        }
    }

    @Nested
    @DisplayName("testConnection")
    class TestConnection {

        @Test
        @DisplayName("getMe ok:true reports connected")
        void connected() {
            server.expect(requestTo(GET_ME_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess(
                            "{\"ok\":true,\"result\":{\"id\":1,\"is_bot\":true,\"username\":\"relay_bot\"}}",
                            MediaType.APPLICATION_JSON));

            assertThat(client.testConnection()).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("Rejected token reports disconnected")
        void unauthorized() {
            server.expect(requestTo(GET_ME_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

            assertThat(client.testConnection()).isFalse();
        }
    }
}

package com.edgewatch.service.core.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class TelegramNotificationChannelTest {

    private static final String URL = "https://tg.example/botT0KEN/sendMessage";

    private MockRestServiceServer server;
    private TelegramNotificationChannel channel;

    @BeforeEach
    void setUp() {
        RestTemplate rt = new RestTemplate();
        server = MockRestServiceServer.bindTo(rt).build();
        channel = new TelegramNotificationChannel(rt, "https://tg.example/", "T0KEN", "Markdown");
    }

    @Test
    void postsChatTextAndParseMode() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.chat_id").value("-1001"))
                .andExpect(jsonPath("$.text").value("hello"))
                .andExpect(jsonPath("$.parse_mode").value("Markdown"))
                .andRespond(withSuccess("{\"ok\":true,\"result\":{}}", MediaType.APPLICATION_JSON));

        DeliveryResult result = channel.send("-1001", "hello");

        assertThat(result.delivered()).isTrue();
        server.verify();
    }

    @Test
    void apiLevelRejectionIsInvalidTarget() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(
                        "{\"ok\":false,\"description\":\"chat not found\"}", MediaType.APPLICATION_JSON));

        DeliveryResult result = channel.send("-1", "hello");

        assertThat(result.delivered()).isFalse();
        assertThat(result.errorKind()).isEqualTo(DispatchErrorKind.INVALID_TARGET);
        assertThat(result.detail()).isEqualTo("chat not found");
    }

    @Test
    void badRequestIsInvalidTarget() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThat(channel.send("-1", "hello").errorKind()).isEqualTo(DispatchErrorKind.INVALID_TARGET);
    }

    @Test
    void rateLimitIsRetryable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        DeliveryResult result = channel.send("-1", "hello");

        assertThat(result.errorKind()).isEqualTo(DispatchErrorKind.CHANNEL_UNAVAILABLE);
        assertThat(result.errorKind().retryable()).isTrue();
    }

    @Test
    void serverErrorIsChannelUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThat(channel.send("-1", "hello").errorKind()).isEqualTo(DispatchErrorKind.CHANNEL_UNAVAILABLE);
    }
}

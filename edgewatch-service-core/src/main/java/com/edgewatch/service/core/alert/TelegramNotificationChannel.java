package com.edgewatch.service.core.alert;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/** Telegram Bot API sender ({@code sendMessage}). */
@Slf4j
public class TelegramNotificationChannel implements NotificationChannel {

    private final RestTemplate rt;
    private final String endpoint;
    private final String parseMode;

    public TelegramNotificationChannel(RestTemplate rt, String apiBase, String botToken, String parseMode) {
        this.rt = rt;
        this.endpoint = trimTrailingSlash(apiBase) + "/bot" + botToken + "/sendMessage";
        this.parseMode = parseMode;
    }

    @Override
    public DeliveryResult send(String target, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", target);
        body.put("text", message);
        if (parseMode != null && !parseMode.isBlank()) {
            body.put("parse_mode", parseMode);
        }
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<JsonNode> resp =
                    rt.exchange(endpoint, HttpMethod.POST, new HttpEntity<>(body, h), JsonNode.class);
            JsonNode json = resp.getBody();
            if (json != null && json.has("ok") && !json.path("ok").asBoolean()) {
                return DeliveryResult.failed(DispatchErrorKind.INVALID_TARGET, json.path("description").asText());
            }
            log.debug("Telegram message delivered to chat {}", target);
            return DeliveryResult.ok();
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return DeliveryResult.failed(DispatchErrorKind.CHANNEL_UNAVAILABLE, "HTTP 429");
            }
            return DeliveryResult.failed(
                    DispatchErrorKind.INVALID_TARGET, "HTTP " + ex.getStatusCode().value() + " for chat " + target);
        } catch (HttpServerErrorException ex) {
            return DeliveryResult.failed(
                    DispatchErrorKind.CHANNEL_UNAVAILABLE, "HTTP " + ex.getStatusCode().value());
        } catch (RestClientException ex) {
            return DeliveryResult.failed(DispatchErrorKind.CHANNEL_UNAVAILABLE, ex.getMessage());
        }
    }

    @Override
    public String name() {
        return "telegram";
    }

    private static String trimTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}

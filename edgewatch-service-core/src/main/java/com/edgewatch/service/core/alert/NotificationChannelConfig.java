package com.edgewatch.service.core.alert;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class NotificationChannelConfig {

    @Bean
    public NotificationChannel notificationChannel(EdgeWatchProperties properties, RestTemplateBuilder builder) {
        EdgeWatchProperties.Telegram telegram = properties.getAlerts().getTelegram();
        if (telegram.getBotToken() == null || telegram.getBotToken().isBlank()) {
            log.warn("edgewatch.alerts.telegram.bot-token is not set; alerts will only be logged");
            return new LoggingNotificationChannel();
        }
        return new TelegramNotificationChannel(
                builder.setConnectTimeout(telegram.getConnectTimeout())
                        .setReadTimeout(telegram.getReadTimeout())
                        .build(),
                telegram.getApiBase(),
                telegram.getBotToken(),
                telegram.getParseMode());
    }
}

package com.edgewatch.service.core.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edgewatch")
@Getter
@Setter
public class EdgeWatchProperties {
    private Auth auth = new Auth();
    private Ingest ingest = new Ingest();
    private Store store = new Store();
    private Detection detection = new Detection();
    private Alerts alerts = new Alerts();

    @Getter
    @Setter
    public static class Auth {
        /** Shared credential expected in the {@code x-api-key} header. Blank rejects every request. */
        private String apiKey = "";
    }

    @Getter
    @Setter
    public static class Ingest {
        /** Accept-to-respond budget, checked between pipeline stages. */
        private Duration deadline = Duration.ofSeconds(10);

        private long maxDecompressedBytes = 16L * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Store {
        private int maxBatchItems = 25;
        private int maxItemBytes = 400 * 1024;
        private int maxKeyBytes = 1024;
        private int writers = 4;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private int labelHashCacheSize = 50_000;
        private Duration labelHashTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Detection {
        /** Look-back window loaded for each series; matches the collector's scrape range. */
        private Duration window = Duration.ofMinutes(5);

        private int minSamples = 3;
        private double threshold = 3.0;
        private double epsilon = 1e-9;
        private double minDeviation = 1e-9;
        private int workers = 4;
    }

    @Getter
    @Setter
    public static class Alerts {
        private Duration cooldown = Duration.ofMinutes(15);
        private long cooldownCacheSize = 100_000;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(5);
        private Duration channelCacheTtl = Duration.ofMinutes(1);
        private Telegram telegram = new Telegram();
    }

    @Getter
    @Setter
    public static class Telegram {
        private String botToken = "";
        private String apiBase = "https://api.telegram.org";
        private String parseMode = "Markdown";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}

package com.edgewatch.service.core.ingest;

import com.edgewatch.service.core.config.EdgeWatchProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Checks the shared API key. With no key configured every request is rejected. */
@Component
@Slf4j
public class ApiKeyAuthenticator {

    private final byte[] expected;

    public ApiKeyAuthenticator(EdgeWatchProperties properties) {
        String key = properties.getAuth().getApiKey();
        if (key == null || key.isBlank()) {
            log.warn("edgewatch.auth.api-key is not set; all API requests will be rejected");
            this.expected = null;
        } else {
            this.expected = key.getBytes(StandardCharsets.UTF_8);
        }
    }

    public boolean isAuthorized(String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        // constant time for equal-length inputs
        return MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8));
    }
}

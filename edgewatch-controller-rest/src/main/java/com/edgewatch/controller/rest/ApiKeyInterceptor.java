package com.edgewatch.controller.rest;

import com.edgewatch.service.core.ingest.ApiKeyAuthenticator;
import com.edgewatch.service.core.telemetry.IngestTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Rejects API calls without a valid {@code x-api-key} header before any handler runs. */
@Component
@Slf4j
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "x-api-key";

    private final ApiKeyAuthenticator authenticator;
    private final IngestTelemetry telemetry;
    private final ObjectMapper mapper;

    public ApiKeyInterceptor(ApiKeyAuthenticator authenticator, IngestTelemetry telemetry, ObjectMapper mapper) {
        this.authenticator = authenticator;
        this.telemetry = telemetry;
        this.mapper = mapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (authenticator.isAuthorized(request.getHeader(API_KEY_HEADER))) {
            return true;
        }
        telemetry.recordRejectedCredential();
        log.warn(
                "Rejected {} {} from {}: missing or invalid API key",
                request.getMethod(),
                request.getRequestURI(),
                request.getRemoteAddr());
        HttpStatus status = HttpStatus.UNAUTHORIZED;
        ErrorPayload body = ErrorPayload.of(status, "Invalid API Key", request.getRequestURI());
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), body);
        return false;
    }
}

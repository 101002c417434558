package com.edgewatch.controller.rest;

import com.edgewatch.service.core.decode.EnvelopeDecodeException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.OffsetDateTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps rejected envelopes to 400 problem details carrying a stable error code. */
@RestControllerAdvice(assignableTypes = IngestController.class)
@Slf4j
public class IngestExceptionHandler {

    @ExceptionHandler(EnvelopeDecodeException.class)
    public ResponseEntity<ProblemDetail> handleDecode(EnvelopeDecodeException ex, HttpServletRequest request) {
        String detail = (ex.getMessage() == null || ex.getMessage().isBlank())
                ? "Envelope could not be decoded"
                : ex.getMessage();

        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Invalid telemetry envelope");
        problem.setProperty("code", ex.getKind().code());
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", request.getRequestURI());
        problem.setProperty("hint", hintFor(ex.getKind()));
        return ResponseEntity.badRequest().body(problem);
    }

    private static String hintFor(EnvelopeDecodeException.Kind kind) {
        return switch (kind) {
            case COMPRESSION -> "Send the body uncompressed or gzip-compressed and set Content-Encoding to match.";
            case MALFORMED -> "Send a JSON envelope whose sections each carry a type of metrics, logs or traces.";
        };
    }
}

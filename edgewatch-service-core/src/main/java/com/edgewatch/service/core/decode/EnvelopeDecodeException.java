package com.edgewatch.service.core.decode;

import java.util.Locale;

/** The envelope could not be decoded; nothing from it is processed. */
public class EnvelopeDecodeException extends RuntimeException {

    public enum Kind {
        /** Corrupt, truncated or oversized compressed stream, or an unknown content encoding. */
        COMPRESSION,
        /** Structurally invalid payload. */
        MALFORMED;

        public String code() {
            return "ingest." + name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;

    public EnvelopeDecodeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EnvelopeDecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    static EnvelopeDecodeException malformed(String message) {
        return new EnvelopeDecodeException(Kind.MALFORMED, message);
    }
}

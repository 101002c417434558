package com.edgewatch.service.core.decode;

import com.edgewatch.service.core.decode.EnvelopeDecodeException.Kind;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import org.xerial.snappy.Snappy;

/**
 * Undoes the HTTP {@code Content-Encoding} of an envelope body. The result never exceeds {@code maxBytes},
 * whatever the encoding.
 */
final class ContentDecoding {

    private static final int MIN_BUFFER = 512;

    private ContentDecoding() {}

    static byte[] decode(byte[] raw, String contentEncoding, long maxBytes) {
        String encoding = contentEncoding == null ? "" : contentEncoding.trim().toLowerCase(Locale.ROOT);
        return switch (encoding) {
            case "", "identity" -> checkSize(raw, maxBytes);
            case "gzip", "x-gzip" -> gunzip(raw, maxBytes);
            case "snappy" -> unsnappy(raw, maxBytes);
            default -> throw new EnvelopeDecodeException(
                    Kind.COMPRESSION, "Unsupported content encoding: " + contentEncoding);
        };
    }

    private static byte[] checkSize(byte[] body, long maxBytes) {
        if (body.length > maxBytes) {
            throw tooLarge(maxBytes);
        }
        return body;
    }

    private static byte[] gunzip(byte[] raw, long maxBytes) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(initialCapacity(raw.length, maxBytes));
            byte[] buffer = new byte[8192];
            long total = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    throw tooLarge(maxBytes);
                }
                out.write(buffer, 0, read);
            }
            return out.toByteArray();
        } catch (IOException ex) {
            throw new EnvelopeDecodeException(Kind.COMPRESSION, "Invalid gzip stream: " + ex.getMessage(), ex);
        }
    }

    /** Snappy block format, as used by Prometheus remote_write. */
    private static byte[] unsnappy(byte[] raw, long maxBytes) {
        try {
            if (!Snappy.isValidCompressedBuffer(raw)) {
                throw new EnvelopeDecodeException(Kind.COMPRESSION, "Invalid snappy block");
            }
            if (Snappy.uncompressedLength(raw) > maxBytes) {
                throw tooLarge(maxBytes);
            }
            return Snappy.uncompress(raw);
        } catch (IOException ex) {
            throw new EnvelopeDecodeException(Kind.COMPRESSION, "Invalid snappy block: " + ex.getMessage(), ex);
        }
    }

    static int initialCapacity(int compressedLength, long maxBytes) {
        long guess = Math.min((long) compressedLength * 4, maxBytes);
        return (int) Math.max(MIN_BUFFER, Math.min(guess, Integer.MAX_VALUE - 8));
    }

    private static EnvelopeDecodeException tooLarge(long maxBytes) {
        return new EnvelopeDecodeException(Kind.COMPRESSION, "Decompressed envelope exceeds " + maxBytes + " bytes");
    }
}

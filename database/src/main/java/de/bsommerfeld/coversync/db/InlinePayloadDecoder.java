package de.bsommerfeld.coversync.db;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Turns a legacy inline cover column into raw image bytes. Older library
 * versions stored covers as base64 text (optionally as a
 * {@code data:image/...;base64,} URI), newer ones as BLOBs; both are accepted.
 */
public final class InlinePayloadDecoder {

    private static final String DATA_URI_MARKER = ";base64,";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private InlinePayloadDecoder() {
    }

    /**
     * @param raw column value as returned by the driver ({@code byte[]} for
     *            BLOB, {@code String} for TEXT)
     * @return decoded, non-empty image bytes
     * @throws IllegalArgumentException if the value is empty, not valid base64,
     *                                  or of an unexpected type
     */
    public static byte[] decode(Object raw) {
        if (raw instanceof byte[]) {
            byte[] bytes = (byte[]) raw;
            if (bytes.length == 0) {
                throw new IllegalArgumentException("empty payload");
            }
            return bytes;
        }
        if (raw instanceof String) {
            return decodeText((String) raw);
        }
        throw new IllegalArgumentException("unsupported payload type "
                + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    private static byte[] decodeText(String text) {
        String body = text.trim();
        int marker = body.indexOf(DATA_URI_MARKER);
        if (body.startsWith("data:") && marker >= 0) {
            body = body.substring(marker + DATA_URI_MARKER.length());
        }
        if (body.isEmpty()) {
            throw new IllegalArgumentException("empty payload");
        }
        String compact = WHITESPACE.matcher(body).replaceAll("");
        byte[] decoded = Base64.getDecoder().decode(compact.getBytes(StandardCharsets.US_ASCII));
        if (decoded.length == 0) {
            throw new IllegalArgumentException("payload decodes to zero bytes");
        }
        return decoded;
    }
}

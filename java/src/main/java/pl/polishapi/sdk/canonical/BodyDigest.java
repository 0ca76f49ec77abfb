package pl.polishapi.sdk.canonical;

import pl.polishapi.sdk.internal.Codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * {@code Digest} header support (RFC 3230, {@code SHA-256=<base64>}).
 */
public final class BodyDigest {

    public static final String HEADER = "Digest";
    private static final String PREFIX = "SHA-256=";

    private BodyDigest() {
    }

    public static String headerValue(byte[] body) {
        return PREFIX + Base64.getEncoder().encodeToString(Codec.sha256(body));
    }

    /**
     * Checks a received {@code Digest} header value against the body. Only the {@code SHA-256} entry is considered;
     * other algorithms in a comma-separated list are ignored.
     */
    public static boolean matches(String headerValue, byte[] body) {
        if (headerValue == null) {
            return false;
        }
        byte[] expected = Codec.sha256(body);
        for (String part : headerValue.split(",")) {
            String trimmed = part.trim();
            if (trimmed.length() > PREFIX.length()
                && trimmed.substring(0, PREFIX.length()).toUpperCase(Locale.ROOT).equals(PREFIX)) {
                byte[] received;
                try {
                    received = Base64.getDecoder().decode(trimmed.substring(PREFIX.length()).getBytes(StandardCharsets.US_ASCII));
                } catch (IllegalArgumentException ex) {
                    return false;
                }
                return Codec.constantTimeEquals(expected, received);
            }
        }
        return false;
    }
}

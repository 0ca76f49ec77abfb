package pl.polishapi.sdk.internal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Byte-level helpers shared by the canonical builder, signer and verifier.
 */
public final class Codec {

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

    private Codec() {
    }

    public static String base64Url(byte[] data) {
        return URL_ENCODER.encodeToString(data);
    }

    public static String base64Url(String text) {
        return base64Url(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes unpadded base64url. Padding characters, the standard alphabet ({@code +}, {@code /}) and encodings with
     * non-zero unused trailing bits are rejected, so each byte sequence has exactly one accepted text form.
     *
     * @throws IllegalArgumentException when the value is not canonical unpadded base64url.
     */
    public static byte[] fromBase64Url(String value) {
        if (value == null) {
            throw new IllegalArgumentException("base64url value is null");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
            if (!allowed) {
                throw new IllegalArgumentException("illegal base64url character at index " + i);
            }
        }
        if (value.length() % 4 == 1) {
            throw new IllegalArgumentException("truncated base64url value");
        }
        byte[] decoded = URL_DECODER.decode(value);
        // The decoder ignores unused trailing bits; only the one encoding of the bytes is accepted.
        if (!base64Url(decoded).equals(value)) {
            throw new IllegalArgumentException("non-canonical base64url value");
        }
        return decoded;
    }

    /**
     * Writes {@code value} as four big-endian bytes into {@code target} at {@code offset}.
     */
    public static void putUint32(byte[] target, int offset, int value) {
        target[offset] = (byte) (value >>> 24);
        target[offset + 1] = (byte) (value >>> 16);
        target[offset + 2] = (byte) (value >>> 8);
        target[offset + 3] = (byte) value;
    }

    public static byte[] uint32(int value) {
        byte[] out = new byte[4];
        putUint32(out, 0, value);
        return out;
    }

    public static int readUint32(byte[] source, int offset) {
        return ((source[offset] & 0xff) << 24)
            | ((source[offset + 1] & 0xff) << 16)
            | ((source[offset + 2] & 0xff) << 8)
            | (source[offset + 3] & 0xff);
    }

    /**
     * Compares two arrays in time that depends only on their lengths, never on the position of the first difference.
     */
    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        if (a == null || b == null) {
            return a == b;
        }
        int diff = a.length ^ b.length;
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            byte left = i < a.length ? a[i] : 0;
            byte right = i < b.length ? b[i] : 0;
            diff |= left ^ right;
        }
        return diff == 0;
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data == null ? new byte[0] : data);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}

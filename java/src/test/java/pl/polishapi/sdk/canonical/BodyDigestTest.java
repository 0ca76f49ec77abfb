package pl.polishapi.sdk.canonical;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BodyDigestTest {

    @Test
    void computesSha256HeaderValue() {
        assertEquals("SHA-256=47DEQpj8HBSa+/TImW+5JCeuQeRkm5NMpJWZG3hSuFU=", BodyDigest.headerValue(new byte[0]));
        assertEquals(BodyDigest.headerValue(new byte[0]), BodyDigest.headerValue(null));
    }

    @Test
    void matchesOnlyTheDigestedBody() {
        byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        String header = BodyDigest.headerValue(body);

        assertTrue(BodyDigest.matches(header, body));
        assertTrue(BodyDigest.matches("MD5=abc, " + header.replace("SHA-256", "sha-256"), body));
        assertFalse(BodyDigest.matches(header, "{\"a\":2}".getBytes(StandardCharsets.UTF_8)));
        assertFalse(BodyDigest.matches("SHA-256=!!!", body));
        assertFalse(BodyDigest.matches(null, body));
    }
}

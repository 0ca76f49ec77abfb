package pl.polishapi.sdk.signing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import pl.polishapi.sdk.internal.Json;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Protected header of a detached signature: algorithm, key identifier and creation time in epoch seconds (UTC).
 * Serialised as {@code {"alg":..,"kid":..,"iat":..}} in that order.
 */
@JsonPropertyOrder({"alg", "kid", "iat"})
public record ProtectedHeader(
    @JsonProperty("alg") String algorithm,
    @JsonProperty("kid") String keyId,
    @JsonProperty("iat") long issuedAt
) {

    public Instant issuedAtInstant() {
        return Instant.ofEpochSecond(issuedAt);
    }

    byte[] toJson() throws SigningException {
        try {
            return Json.mapper().writeValueAsBytes(this);
        } catch (JsonProcessingException ex) {
            throw new SigningException("encode protected header: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Decodes and structurally checks a protected header. Every field must be present with the expected JSON type
     * and {@code alg} must name a supported algorithm.
     */
    static ProtectedHeader fromJson(byte[] json) throws MalformedArtifactException {
        JsonNode node;
        try {
            node = Json.strictReader().readTree(new String(json, StandardCharsets.UTF_8));
        } catch (JsonProcessingException ex) {
            throw new MalformedArtifactException("protected header is not valid JSON: " + ex.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new MalformedArtifactException("protected header must be a JSON object");
        }
        JsonNode alg = node.get("alg");
        if (alg == null || !alg.isTextual()) {
            throw new MalformedArtifactException("protected header is missing alg");
        }
        if (SignatureAlgorithm.fromTag(alg.asText()).isEmpty()) {
            throw new MalformedArtifactException("unsupported alg " + alg.asText());
        }
        JsonNode kid = node.get("kid");
        if (kid == null || !kid.isTextual() || kid.asText().isBlank()) {
            throw new MalformedArtifactException("protected header is missing kid");
        }
        JsonNode iat = node.get("iat");
        if (iat == null || !iat.isIntegralNumber() || !iat.canConvertToLong() || iat.asLong() < 0) {
            throw new MalformedArtifactException("protected header is missing iat");
        }
        return new ProtectedHeader(alg.asText(), kid.asText(), iat.asLong());
    }
}

package pl.polishapi.sdk.signing;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of {@link Verifier#verify}. Only {@link VerificationStatus#VALID} means the request may be trusted; every
 * other status names the specific reason so callers can log "wrong key" separately from "bad signature".
 *
 * @param status          verification outcome.
 * @param keyId           key identifier from the artifact, {@code null} when the artifact was malformed.
 * @param detail          human-readable reason, {@code null} when valid.
 * @param maxAge          configured maximum age, set only for {@link VerificationStatus#SIGNATURE_EXPIRED}.
 * @param actualAge       observed age, set only for {@link VerificationStatus#SIGNATURE_EXPIRED}; negative when the
 *                        artifact claims a creation time in the future.
 * @param providerFailure {@code true} when the signature could not be checked because the JCA provider rejected the
 *                        key or failed, rather than because the signature did not match.
 */
public record VerificationResult(
    VerificationStatus status,
    String keyId,
    String detail,
    Duration maxAge,
    Duration actualAge,
    boolean providerFailure
) {

    public VerificationResult {
        Objects.requireNonNull(status, "status");
        if (providerFailure && status != VerificationStatus.SIGNATURE_INVALID) {
            throw new IllegalArgumentException("provider failures are reported as SIGNATURE_INVALID");
        }
    }

    public static VerificationResult valid(String keyId) {
        return new VerificationResult(VerificationStatus.VALID, keyId, null, null, null, false);
    }

    public static VerificationResult malformed(String reason) {
        return new VerificationResult(VerificationStatus.MALFORMED_ARTIFACT, null, reason, null, null, false);
    }

    public static VerificationResult keyIdentifierMismatch(String artifactKeyId, String expectedKeyId) {
        return new VerificationResult(VerificationStatus.KEY_IDENTIFIER_MISMATCH, artifactKeyId,
            "artifact key id " + artifactKeyId + " does not match " + expectedKeyId, null, null, false);
    }

    public static VerificationResult invalid(String keyId, String detail) {
        return new VerificationResult(VerificationStatus.SIGNATURE_INVALID, keyId, detail, null, null, false);
    }

    /**
     * The signature was not checked: the provider rejected the verification key or the primitive failed.
     */
    public static VerificationResult providerFailure(String keyId, String detail) {
        return new VerificationResult(VerificationStatus.SIGNATURE_INVALID, keyId, "provider failure: " + detail,
            null, null, true);
    }

    public static VerificationResult expired(String keyId, Duration maxAge, Duration actualAge) {
        String detail = actualAge.isNegative()
            ? "signature issued " + actualAge.negated().getSeconds() + "s in the future, beyond " + maxAge.getSeconds() + "s"
            : "signature age " + actualAge.getSeconds() + "s exceeds " + maxAge.getSeconds() + "s";
        return new VerificationResult(VerificationStatus.SIGNATURE_EXPIRED, keyId, detail, maxAge, actualAge, false);
    }

    public boolean isValid() {
        return status == VerificationStatus.VALID;
    }
}

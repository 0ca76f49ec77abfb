package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.canonical.CanonicalInput;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Signature;
import java.security.SignatureException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks detached signature artifacts against a rebuilt {@link CanonicalInput}.
 *
 * <p>Checks run in a fixed order and stop at the first failure:</p>
 * <ol>
 *   <li>the artifact is decoded and its protected header checked structurally ({@code MALFORMED_ARTIFACT});</li>
 *   <li>the header's key id must equal the verification key's ({@code KEY_IDENTIFIER_MISMATCH});</li>
 *   <li>the header's algorithm must equal the key's, and the signature must verify over
 *       {@code header segment || "." || input} ({@code SIGNATURE_INVALID});</li>
 *   <li>when a maximum age is configured, the creation time must lie within that age of the verifier's clock in
 *       either direction ({@code SIGNATURE_EXPIRED}); the same bound doubles as the allowed clock skew for artifacts
 *       dated in the future.</li>
 * </ol>
 *
 * <p>When the JCA provider rejects the verification key or fails, the outcome is {@code SIGNATURE_INVALID} with
 * {@link VerificationResult#providerFailure()} set, so configuration problems can be told apart from forged
 * signatures.</p>
 *
 * <p>Signature comparison is left to the JCA primitive, which checks the whole value rather than returning at the
 * first differing byte. The verifier is immutable and thread-safe.</p>
 */
public final class Verifier {

    private static final Logger LOGGER = Logger.getLogger(Verifier.class.getName());

    private final Duration maxAge;
    private final Clock clock;

    /**
     * Creates a verifier without an expiry check.
     */
    public Verifier() {
        this(null, Clock.systemUTC());
    }

    /**
     * @param maxAge maximum accepted signature age; {@code null} or zero disables the expiry check.
     * @param clock  time source used for the expiry check.
     */
    public Verifier(Duration maxAge, Clock clock) {
        if (maxAge != null && maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge cannot be negative");
        }
        this.maxAge = maxAge == null || maxAge.isZero() ? null : maxAge;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public VerificationResult verify(VerificationKey key, String artifact, CanonicalInput input) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(input, "input");
        SignatureArtifact parsed;
        try {
            parsed = SignatureArtifact.parse(artifact);
        } catch (MalformedArtifactException ex) {
            LOGGER.fine(() -> "[polishapi-sdk] malformed signature artifact: " + ex.getMessage());
            return VerificationResult.malformed(ex.getMessage());
        }
        return verify(key, parsed, input);
    }

    public VerificationResult verify(VerificationKey key, SignatureArtifact artifact, CanonicalInput input) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(input, "input");
        ProtectedHeader header = artifact.header();

        if (!key.keyId().equals(header.keyId())) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[polishapi-sdk] signature key id mismatch (artifact=%s, expected=%s)", header.keyId(), key.keyId()));
            return VerificationResult.keyIdentifierMismatch(header.keyId(), key.keyId());
        }

        if (!key.algorithm().tag().equals(header.algorithm())) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[polishapi-sdk] signature algorithm mismatch (kid=%s, artifact=%s, expected=%s)",
                header.keyId(), header.algorithm(), key.algorithm().tag()));
            return VerificationResult.invalid(header.keyId(),
                "artifact algorithm " + header.algorithm() + " does not match key algorithm " + key.algorithm().tag());
        }

        boolean verified;
        try {
            Signature signature = key.algorithm().newSignature();
            signature.initVerify(key.publicKey());
            signature.update(SignatureArtifact.signingInput(artifact.headerSegment(), input));
            verified = signature.verify(artifact.signature());
        } catch (SignatureException ex) {
            // Raised for undecodable signature values, e.g. an ES256 signature that is not 64 bytes.
            verified = false;
        } catch (InvalidKeyException ex) {
            LOGGER.log(Level.WARNING, "[polishapi-sdk] verification key rejected by provider", ex);
            return VerificationResult.providerFailure(header.keyId(), "verification key rejected: " + ex.getMessage());
        } catch (GeneralSecurityException ex) {
            LOGGER.log(Level.WARNING, "[polishapi-sdk] signature primitive unavailable", ex);
            return VerificationResult.providerFailure(header.keyId(), "signature primitive failed: " + ex.getMessage());
        }

        if (!verified) {
            LOGGER.warning(() -> "[polishapi-sdk] signature invalid for kid=" + header.keyId());
            return VerificationResult.invalid(header.keyId(), "signature does not match request");
        }

        if (maxAge != null) {
            Duration age = Duration.ofSeconds(clock.instant().getEpochSecond() - header.issuedAt());
            if (age.abs().compareTo(maxAge) > 0) {
                LOGGER.fine(() -> String.format(Locale.ROOT,
                    "[polishapi-sdk] signature expired (kid=%s, age=%ds, max=%ds)",
                    header.keyId(), age.getSeconds(), maxAge.getSeconds()));
                return VerificationResult.expired(header.keyId(), maxAge, age);
            }
        }

        LOGGER.fine(() -> "[polishapi-sdk] signature verified for kid=" + header.keyId());
        return VerificationResult.valid(header.keyId());
    }

    /**
     * Same as {@link #verify(VerificationKey, String, CanonicalInput)} but throws for any non-valid outcome.
     */
    public VerificationResult verifyOrThrow(VerificationKey key, String artifact, CanonicalInput input)
        throws SignatureVerificationException {
        VerificationResult result = verify(key, artifact, input);
        if (!result.isValid()) {
            throw new SignatureVerificationException(result);
        }
        return result;
    }

    public Duration maxAge() {
        return maxAge;
    }
}

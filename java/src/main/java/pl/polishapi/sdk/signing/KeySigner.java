package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.canonical.CanonicalInput;
import pl.polishapi.sdk.internal.Codec;

import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.interfaces.RSAKey;
import java.time.Clock;
import java.util.Objects;

/**
 * Signer implementation that signs locally with a {@link SigningKey}.
 *
 * <p>Every call stamps a fresh creation time into the protected header and signs
 * {@code header segment || "." || canonical input}. Nothing is cached between calls; PS256 and ES256 signatures are
 * randomised, so two artifacts for the same input generally differ. Instances are immutable and thread-safe.</p>
 */
public final class KeySigner implements Signer {

    private final SigningKey key;
    private final Clock clock;

    public KeySigner(SigningKey key) {
        this(key, Clock.systemUTC());
    }

    public KeySigner(SigningKey key, Clock clock) {
        this.key = Objects.requireNonNull(key, "key");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SigningKey key() {
        return key;
    }

    @Override
    public SignatureArtifact sign(CanonicalInput input) throws SigningException {
        Objects.requireNonNull(input, "input");
        SignatureAlgorithm algorithm = key.algorithm();
        if (key.privateKey() instanceof RSAKey rsaKey) {
            int bits = rsaKey.getModulus().bitLength();
            if (bits < SignatureAlgorithm.MIN_RSA_KEY_BITS) {
                throw new SigningException(algorithm + " requires at least " + SignatureAlgorithm.MIN_RSA_KEY_BITS
                    + "-bit RSA keys, key " + key.keyId() + " has " + bits);
            }
        }

        ProtectedHeader header = new ProtectedHeader(algorithm.tag(), key.keyId(), clock.instant().getEpochSecond());
        String headerSegment = Codec.base64Url(header.toJson());
        byte[] signingInput = SignatureArtifact.signingInput(headerSegment, input);

        byte[] value;
        try {
            Signature signature = algorithm.newSignature();
            signature.initSign(key.privateKey());
            signature.update(signingInput);
            value = signature.sign();
        } catch (GeneralSecurityException ex) {
            throw new SigningException(algorithm + " signing failed: " + ex.getMessage(), ex);
        }

        if (algorithm == SignatureAlgorithm.ES256 && value.length != SignatureAlgorithm.ES256_SIGNATURE_LENGTH) {
            throw new SigningException("ES256 signature has unexpected length " + value.length);
        }
        return SignatureArtifact.create(headerSegment, header, value);
    }
}

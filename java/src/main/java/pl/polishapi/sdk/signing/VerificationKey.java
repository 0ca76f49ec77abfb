package pl.polishapi.sdk.signing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.Optional;

/**
 * Public key material used by {@link Verifier}. Loaded from a {@code PUBLIC KEY} block or from a certificate, in which
 * case the certificate stays available for audit purposes. Immutable and safe to share between threads.
 */
public final class VerificationKey {

    private final PublicKey publicKey;
    private final SignatureAlgorithm algorithm;
    private final String keyId;
    private final X509Certificate certificate;

    private VerificationKey(PublicKey publicKey, SignatureAlgorithm algorithm, String keyId, X509Certificate certificate) {
        this.publicKey = publicKey;
        this.algorithm = algorithm;
        this.keyId = keyId;
        this.certificate = certificate;
    }

    public static VerificationKey fromPem(String pem, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        PemKeys.ParsedPublicKey parsed = PemKeys.readPublicKey(pem);
        return create(parsed.key(), algorithm, keyId, parsed.certificate());
    }

    public static VerificationKey fromPemFile(Path path, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        Objects.requireNonNull(path, "path");
        String pem;
        try {
            pem = Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException ex) {
            throw new KeyLoadException("read public key file " + path + ": " + ex.getMessage(), ex);
        }
        return fromPem(pem, algorithm, keyId);
    }

    public static VerificationKey of(PublicKey publicKey, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        return create(publicKey, algorithm, keyId, null);
    }

    private static VerificationKey create(PublicKey publicKey, SignatureAlgorithm algorithm, String keyId,
                                          X509Certificate certificate) throws KeyLoadException {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(algorithm, "algorithm");
        if (keyId == null || keyId.isBlank()) {
            throw new KeyLoadException("key identifier is required");
        }
        algorithm.checkKeyType(publicKey);
        return new VerificationKey(publicKey, algorithm, keyId, certificate);
    }

    public SignatureAlgorithm algorithm() {
        return algorithm;
    }

    public String keyId() {
        return keyId;
    }

    public Optional<X509Certificate> certificate() {
        return Optional.ofNullable(certificate);
    }

    PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public String toString() {
        return "VerificationKey[" + algorithm + ", kid=" + keyId + "]";
    }
}

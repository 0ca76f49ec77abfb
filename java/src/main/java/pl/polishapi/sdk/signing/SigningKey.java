package pl.polishapi.sdk.signing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.util.Objects;

/**
 * Private key material bound to a {@link SignatureAlgorithm} and a provider-assigned key identifier. Immutable;
 * construction fails immediately when the key cannot be parsed or does not match the algorithm.
 */
public final class SigningKey {

    private final PrivateKey privateKey;
    private final SignatureAlgorithm algorithm;
    private final String keyId;

    private SigningKey(PrivateKey privateKey, SignatureAlgorithm algorithm, String keyId) {
        this.privateKey = privateKey;
        this.algorithm = algorithm;
        this.keyId = keyId;
    }

    public static SigningKey fromPem(String pem, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        return of(PemKeys.readPrivateKey(pem), algorithm, keyId);
    }

    public static SigningKey fromPemFile(Path path, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        Objects.requireNonNull(path, "path");
        String pem;
        try {
            pem = Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException ex) {
            throw new KeyLoadException("read private key file " + path + ": " + ex.getMessage(), ex);
        }
        return fromPem(pem, algorithm, keyId);
    }

    public static SigningKey of(PrivateKey privateKey, SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(algorithm, "algorithm");
        if (keyId == null || keyId.isBlank()) {
            throw new KeyLoadException("key identifier is required");
        }
        algorithm.checkKeyType(privateKey);
        return new SigningKey(privateKey, algorithm, keyId);
    }

    public SignatureAlgorithm algorithm() {
        return algorithm;
    }

    public String keyId() {
        return keyId;
    }

    PrivateKey privateKey() {
        return privateKey;
    }

    @Override
    public String toString() {
        return "SigningKey[" + algorithm + ", kid=" + keyId + "]";
    }
}

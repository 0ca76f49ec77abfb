package pl.polishapi.sdk.signing;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.Signature;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Optional;

/**
 * Signature algorithms supported for request signing, identified by their JOSE {@code alg} tag.
 */
public enum SignatureAlgorithm {

    /** RSASSA-PSS with SHA-256, MGF1-SHA-256 and a 32-byte salt. */
    PS256("RSASSA-PSS", "RSA"),
    /** ECDSA on P-256 with SHA-256; signatures are the fixed 64-byte r||s form. */
    ES256("SHA256withECDSAinP1363Format", "EC"),
    /** RSASSA-PKCS1-v1_5 with SHA-256. */
    RS256("SHA256withRSA", "RSA");

    public static final int MIN_RSA_KEY_BITS = 2048;
    static final int ES256_SIGNATURE_LENGTH = 64;

    private static final BigInteger P256_ORDER = new BigInteger(
        "FFFFFFFF00000000FFFFFFFFFFFFFFFFBCE6FAADA7179E84F3B9CAC2FC632551", 16);

    private final String jcaName;
    private final String keyType;

    SignatureAlgorithm(String jcaName, String keyType) {
        this.jcaName = jcaName;
        this.keyType = keyType;
    }

    /**
     * @return the JOSE {@code alg} value written to the protected header.
     */
    public String tag() {
        return name();
    }

    public String keyType() {
        return keyType;
    }

    public static Optional<SignatureAlgorithm> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (SignatureAlgorithm candidate : values()) {
            if (candidate.name().equals(tag)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates a fresh, fully parameterised JCA {@link Signature}. Instances are not thread-safe and are never shared.
     */
    Signature newSignature() throws GeneralSecurityException {
        Signature signature = Signature.getInstance(jcaName);
        if (this == PS256) {
            signature.setParameter(new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1));
        }
        return signature;
    }

    /**
     * Checks that {@code key} has the type this algorithm needs.
     *
     * @throws KeyLoadException when the key type or curve does not match.
     */
    void checkKeyType(Key key) throws KeyLoadException {
        boolean matches = this == ES256 ? key instanceof ECKey : key instanceof RSAKey;
        if (!matches) {
            throw new KeyLoadException(name() + " requires an " + keyType + " key, got " + key.getAlgorithm());
        }
        if (key instanceof ECKey ecKey
            && (ecKey.getParams().getCurve().getField().getFieldSize() != 256
            || !P256_ORDER.equals(ecKey.getParams().getOrder()))) {
            throw new KeyLoadException("ES256 requires a P-256 key");
        }
    }
}

package pl.polishapi.sdk.signing;

import org.bouncycastle.asn1.sec.SECObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.util.io.pem.PemObject;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPrivateKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Key fixtures generated once per test run. RSA generation is slow, so pairs are cached.
 */
public final class TestKeys {

    private static KeyPair rsa2048;
    private static KeyPair otherRsa2048;
    private static KeyPair ecP256;

    private TestKeys() {
    }

    public static synchronized KeyPair rsa() {
        if (rsa2048 == null) {
            rsa2048 = rsa(2048);
        }
        return rsa2048;
    }

    public static synchronized KeyPair otherRsa() {
        if (otherRsa2048 == null) {
            otherRsa2048 = rsa(2048);
        }
        return otherRsa2048;
    }

    public static synchronized KeyPair ec() {
        if (ecP256 == null) {
            ecP256 = ec("secp256r1");
        }
        return ecP256;
    }

    public static KeyPair rsa(int bits) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(bits);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static KeyPair ec(String curve) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(curve));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static KeyPair forAlgorithm(SignatureAlgorithm algorithm) {
        return algorithm == SignatureAlgorithm.ES256 ? ec() : rsa();
    }

    /** PKCS#8 {@code PRIVATE KEY} block. */
    public static String pkcs8Pem(KeyPair pair) {
        return pem(new PemObject("PRIVATE KEY", pair.getPrivate().getEncoded()));
    }

    /** Traditional OpenSSL block: {@code RSA PRIVATE KEY} or {@code EC PRIVATE KEY}. */
    public static String traditionalPem(KeyPair pair) {
        return pem(pair.getPrivate());
    }

    /** SEC1 {@code EC PRIVATE KEY} block carrying only the curve and private scalar, as some HSM exports do. */
    public static String sec1PemWithoutPublicKey(KeyPair pair) {
        ECPrivateKey key = (ECPrivateKey) pair.getPrivate();
        try {
            byte[] der = new org.bouncycastle.asn1.sec.ECPrivateKey(256, key.getS(), SECObjectIdentifiers.secp256r1)
                .getEncoded();
            return pem(new PemObject("EC PRIVATE KEY", der));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String publicKeyPem(KeyPair pair) {
        return pem(new PemObject("PUBLIC KEY", pair.getPublic().getEncoded()));
    }

    public static String certificatePem(KeyPair pair, String subject) {
        Instant now = Instant.now();
        X500Name name = new X500Name("CN=" + subject);
        X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
            name,
            BigInteger.valueOf(now.toEpochMilli()),
            Date.from(now.minus(Duration.ofMinutes(1))),
            Date.from(now.plus(Duration.ofDays(1))),
            name,
            pair.getPublic()
        );
        String signatureAlgorithm = "EC".equals(pair.getPrivate().getAlgorithm()) ? "SHA256withECDSA" : "SHA256withRSA";
        try {
            ContentSigner signer = new JcaContentSignerBuilder(signatureAlgorithm).build(pair.getPrivate());
            X509CertificateHolder holder = builder.build(signer);
            return pem(new PemObject("CERTIFICATE", holder.getEncoded()));
        } catch (Exception ex) {
            throw new IllegalStateException("generate test certificate", ex);
        }
    }

    private static String pem(Object object) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toString();
    }

    public static SigningKey signingKey(SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        return SigningKey.of(forAlgorithm(algorithm).getPrivate(), algorithm, keyId);
    }

    public static VerificationKey verificationKey(SignatureAlgorithm algorithm, String keyId) throws KeyLoadException {
        return VerificationKey.of(forAlgorithm(algorithm).getPublic(), algorithm, keyId);
    }
}

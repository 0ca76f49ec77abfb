package pl.polishapi.sdk.signing;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

import java.io.IOException;
import java.io.StringReader;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * PEM decoding for key provisioning. Accepts PKCS#8 ({@code PRIVATE KEY}), PKCS#1 ({@code RSA PRIVATE KEY}), SEC1
 * ({@code EC PRIVATE KEY}), SPKI ({@code PUBLIC KEY}) and {@code CERTIFICATE} blocks. Encrypted keys are rejected.
 */
final class PemKeys {

    private static final JcaPEMKeyConverter KEY_CONVERTER = new JcaPEMKeyConverter();

    private PemKeys() {
    }

    static PrivateKey readPrivateKey(String pem) throws KeyLoadException {
        boolean sawBlock = false;
        try (PEMParser parser = new PEMParser(new StringReader(requireText(pem)))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                sawBlock = true;
                if (object instanceof PrivateKeyInfo info) {
                    return KEY_CONVERTER.getPrivateKey(info);
                }
                if (object instanceof PEMKeyPair pair) {
                    // SEC1 blocks may omit the public key, so only the private half is converted.
                    return KEY_CONVERTER.getPrivateKey(pair.getPrivateKeyInfo());
                }
                if (object instanceof PEMEncryptedKeyPair || object instanceof PKCS8EncryptedPrivateKeyInfo) {
                    throw new KeyLoadException("encrypted private keys are not supported");
                }
            }
        } catch (IOException ex) {
            throw new KeyLoadException("parse PEM private key: " + ex.getMessage(), ex);
        }
        throw new KeyLoadException(sawBlock ? "PEM input contains no private key" : "no PEM block found");
    }

    static ParsedPublicKey readPublicKey(String pem) throws KeyLoadException {
        boolean sawBlock = false;
        try (PEMParser parser = new PEMParser(new StringReader(requireText(pem)))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                sawBlock = true;
                if (object instanceof SubjectPublicKeyInfo info) {
                    return new ParsedPublicKey(KEY_CONVERTER.getPublicKey(info), null);
                }
                if (object instanceof X509CertificateHolder holder) {
                    X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(holder);
                    return new ParsedPublicKey(certificate.getPublicKey(), certificate);
                }
            }
        } catch (IOException ex) {
            throw new KeyLoadException("parse PEM public key: " + ex.getMessage(), ex);
        } catch (CertificateException ex) {
            throw new KeyLoadException("decode PEM certificate: " + ex.getMessage(), ex);
        }
        throw new KeyLoadException(sawBlock ? "PEM input contains no public key or certificate" : "no PEM block found");
    }

    private static String requireText(String pem) throws KeyLoadException {
        if (pem == null || pem.isBlank()) {
            throw new KeyLoadException("PEM input is empty");
        }
        return pem;
    }

    record ParsedPublicKey(PublicKey key, X509Certificate certificate) {
    }
}

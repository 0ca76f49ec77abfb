package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.canonical.CanonicalInput;
import pl.polishapi.sdk.internal.Codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Detached compact signature: {@code base64url(protected header) "." base64url(signature)}. The payload segment is
 * omitted entirely; the verifier supplies the canonical input it rebuilt from the received request.
 */
public final class SignatureArtifact {

    private final String headerSegment;
    private final String signatureSegment;
    private final ProtectedHeader header;
    private final byte[] signature;

    private SignatureArtifact(String headerSegment, String signatureSegment, ProtectedHeader header, byte[] signature) {
        this.headerSegment = headerSegment;
        this.signatureSegment = signatureSegment;
        this.header = header;
        this.signature = signature;
    }

    static SignatureArtifact create(String headerSegment, ProtectedHeader header, byte[] signature) {
        return new SignatureArtifact(headerSegment, Codec.base64Url(signature), header, signature.clone());
    }

    /**
     * Parses the header value form of an artifact.
     *
     * @throws MalformedArtifactException when the value is not exactly two non-empty base64url segments, or the
     *                                    protected header is not a complete, well-typed JSON object.
     */
    public static SignatureArtifact parse(String compact) throws MalformedArtifactException {
        if (compact == null || compact.isEmpty()) {
            throw new MalformedArtifactException("signature artifact is empty");
        }
        int dot = compact.indexOf('.');
        if (dot < 0 || dot != compact.lastIndexOf('.')) {
            throw new MalformedArtifactException("signature artifact must have exactly two segments");
        }
        String headerSegment = compact.substring(0, dot);
        String signatureSegment = compact.substring(dot + 1);
        if (headerSegment.isEmpty() || signatureSegment.isEmpty()) {
            throw new MalformedArtifactException("signature artifact segments cannot be empty");
        }
        byte[] headerJson;
        byte[] signature;
        try {
            headerJson = Codec.fromBase64Url(headerSegment);
        } catch (IllegalArgumentException ex) {
            throw new MalformedArtifactException("protected header is not base64url: " + ex.getMessage());
        }
        try {
            signature = Codec.fromBase64Url(signatureSegment);
        } catch (IllegalArgumentException ex) {
            throw new MalformedArtifactException("signature is not base64url: " + ex.getMessage());
        }
        if (signature.length == 0) {
            throw new MalformedArtifactException("signature is empty");
        }
        return new SignatureArtifact(headerSegment, signatureSegment, ProtectedHeader.fromJson(headerJson), signature);
    }

    /**
     * Bytes covered by the signature: the ASCII header segment, a period, then the canonical input.
     */
    static byte[] signingInput(String headerSegment, CanonicalInput input) {
        Objects.requireNonNull(input, "input");
        byte[] canonical = input.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream(headerSegment.length() + 1 + canonical.length);
        out.writeBytes(headerSegment.getBytes(StandardCharsets.US_ASCII));
        out.write('.');
        out.writeBytes(canonical);
        return out.toByteArray();
    }

    public ProtectedHeader header() {
        return header;
    }

    public String headerSegment() {
        return headerSegment;
    }

    public String signatureSegment() {
        return signatureSegment;
    }

    public byte[] signature() {
        return signature.clone();
    }

    /**
     * @return the header value form, {@code <header>.<signature>}.
     */
    public String compact() {
        return headerSegment + "." + signatureSegment;
    }

    @Override
    public String toString() {
        return compact();
    }
}

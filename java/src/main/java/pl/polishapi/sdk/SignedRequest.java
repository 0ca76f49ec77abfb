package pl.polishapi.sdk;

import pl.polishapi.sdk.canonical.CanonicalInput;
import pl.polishapi.sdk.signing.SignatureArtifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request ready for the transport: headers include the signature header, {@code body} is the exact byte sequence
 * that was digested.
 *
 * @param method         upper-cased HTTP method.
 * @param path           request target that was signed (path plus optional query).
 * @param headers        outbound headers, in insertion order, including the signature.
 * @param body           request body; empty when the request has none.
 * @param artifact       detached signature attached under the configured header.
 * @param canonicalInput the bytes that were signed, kept for diagnostics.
 */
public record SignedRequest(
    String method,
    String path,
    Map<String, String> headers,
    byte[] body,
    SignatureArtifact artifact,
    CanonicalInput canonicalInput
) {

    public SignedRequest {
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }
}

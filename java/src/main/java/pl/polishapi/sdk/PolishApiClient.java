package pl.polishapi.sdk;

import pl.polishapi.sdk.canonical.BodyDigest;
import pl.polishapi.sdk.canonical.CanonicalInput;
import pl.polishapi.sdk.canonical.CanonicalRequestBuilder;
import pl.polishapi.sdk.canonical.MissingRequiredHeaderException;
import pl.polishapi.sdk.internal.HttpUtil;
import pl.polishapi.sdk.payments.DomesticPaymentRequest;
import pl.polishapi.sdk.payments.EeaPaymentRequest;
import pl.polishapi.sdk.payments.FundsConfirmationRequest;
import pl.polishapi.sdk.payments.NonEeaPaymentRequest;
import pl.polishapi.sdk.payments.PaymentRequest;
import pl.polishapi.sdk.payments.TaxPaymentRequest;
import pl.polishapi.sdk.signing.DisabledSigner;
import pl.polishapi.sdk.signing.KeySigner;
import pl.polishapi.sdk.signing.SignatureArtifact;
import pl.polishapi.sdk.signing.Signer;
import pl.polishapi.sdk.signing.VerificationResult;
import pl.polishapi.sdk.signing.Verifier;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for signing outbound PolishAPI requests and verifying inbound ones. The client holds only
 * immutable state (configuration, key material, the canonical builder) and is safe to share between threads: create a
 * single instance per key and reuse it.
 * </p>
 *
 * <h2>Outbound pipeline</h2>
 * <ol>
 *   <li>Identifiers in the request are validated ({@link #preparePayment}, {@link #prepareFundsConfirmation}).</li>
 *   <li>Missing {@code Date} and {@code Digest} headers are derived from the clock and the body.</li>
 *   <li>The canonical input is built from the method, request target, profile headers and body digest.</li>
 *   <li>The configured key signs it and the artifact is attached under {@link Config#getSignatureHeader()}.</li>
 * </ol>
 * <p>
 * The client never performs network calls; {@link #prepare} returns an {@link HttpRequest} for the caller's transport.
 * </p>
 */
public final class PolishApiClient {

    private static final Logger LOGGER = Logger.getLogger(PolishApiClient.class.getName());

    private final Config config;
    private final Signer signer;
    private final boolean signingEnabled;
    private final CanonicalRequestBuilder canonicalBuilder;
    private final Verifier verifier;

    /**
     * Constructs a client using the supplied configuration.
     *
     * @param config caller-supplied configuration; only {@code baseUrl} is mandatory. Without a signing key every
     *               signing call fails with {@link pl.polishapi.sdk.signing.SigningException}.
     */
    public PolishApiClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.canonicalBuilder = new CanonicalRequestBuilder(this.config.getSigningProfile());
        this.verifier = new Verifier(this.config.getMaxSignatureAge(), this.config.getClock());
        if (this.config.getSigningKey() == null) {
            this.signer = new DisabledSigner();
            this.signingEnabled = false;
        } else {
            this.signer = new KeySigner(this.config.getSigningKey(), this.config.getClock());
            this.signingEnabled = true;
        }
    }

    public Config config() {
        return config;
    }

    public CanonicalRequestBuilder canonicalRequestBuilder() {
        return canonicalBuilder;
    }

    public boolean isSigningEnabled() {
        return signingEnabled;
    }

    /**
     * Signs a request whose headers are already complete.
     *
     * @param method  HTTP method, any case.
     * @param path    request target (path plus optional query) exactly as it will be sent.
     * @param headers outbound headers; must contain every header of the signing profile.
     * @param body    request body, {@code null} or empty when there is none.
     * @return the headers with the signature attached, plus the artifact and the signed canonical input.
     * @throws MissingRequiredHeaderException when a profile header is absent.
     * @throws pl.polishapi.sdk.signing.SigningException when signing is disabled or the primitive fails.
     */
    public SignedRequest sign(String method, String path, Map<String, String> headers, byte[] body) throws PolishApiException {
        Objects.requireNonNull(headers, "headers");
        CanonicalInput input = canonicalBuilder.build(method, path, headers, body);
        SignatureArtifact artifact = signer.sign(input);

        Map<String, String> outbound = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (!name.equalsIgnoreCase(config.getSignatureHeader())) {
                outbound.put(name, value);
            }
        });
        outbound.put(config.getSignatureHeader(), artifact.compact());

        String signedMethod = input.value(CanonicalInput.METHOD).orElseThrow();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[polishapi-sdk] signed %s %s with kid=%s",
            signedMethod, path, artifact.header().keyId()));
        return new SignedRequest(signedMethod, path, outbound, body, artifact, input);
    }

    /**
     * Completes the standard PolishAPI headers, signs, and returns a request ready to be sent.
     *
     * @param method  HTTP method.
     * @param path    path relative to {@link Config#getBaseUrl()}, optionally with a query string.
     * @param headers caller headers; {@code Date} and {@code Digest} are derived when unset.
     * @param body    request body, {@code null} for none.
     * @throws pl.polishapi.sdk.validation.InvalidIdentifierException when the authorization header or request id is
     *                                                                invalid.
     */
    public HttpRequest prepare(String method, String path, RequestHeaders headers, byte[] body) throws PolishApiException {
        Objects.requireNonNull(headers, "headers");
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/'");
        }
        headers.validate().orThrow();

        byte[] payload = body == null ? new byte[0] : body;
        Map<String, String> outbound = new LinkedHashMap<>(headers.toHeaderMap());
        if (headers.getDate() == null) {
            outbound.put(RequestHeaders.DATE, httpDate());
        }
        if (headers.getDigest() == null) {
            outbound.put(BodyDigest.HEADER, BodyDigest.headerValue(payload));
        }
        outbound.putIfAbsent("Accept", "application/json");
        if (payload.length > 0) {
            outbound.putIfAbsent("Content-Type", "application/json");
        }
        outbound.putIfAbsent("User-Agent", config.getUserAgent());

        URI uri = URI.create(config.getBaseUrl() + path);
        SignedRequest signed = sign(method, HttpUtil.requestTarget(uri), outbound, payload);
        return HttpUtil.buildRequest(uri, signed.method(), signed.headers(), payload, config.getHttpTimeout());
    }

    /**
     * Validates and signs a payment initiation, posting it to the endpoint of its type.
     *
     * @throws pl.polishapi.sdk.validation.InvalidIdentifierException for the first identifier that fails validation;
     *                                                                nothing is signed in that case.
     */
    public HttpRequest preparePayment(PaymentRequest request, RequestHeaders headers) throws PolishApiException {
        Objects.requireNonNull(request, "request");
        request.validateForSubmit(config.getAmountPolicy());
        return prepare("POST", request.path(), headers, request.toJson());
    }

    public HttpRequest prepareDomesticPayment(DomesticPaymentRequest request, RequestHeaders headers) throws PolishApiException {
        return preparePayment(request, headers);
    }

    public HttpRequest prepareEeaPayment(EeaPaymentRequest request, RequestHeaders headers) throws PolishApiException {
        return preparePayment(request, headers);
    }

    public HttpRequest prepareNonEeaPayment(NonEeaPaymentRequest request, RequestHeaders headers) throws PolishApiException {
        return preparePayment(request, headers);
    }

    public HttpRequest prepareTaxPayment(TaxPaymentRequest request, RequestHeaders headers) throws PolishApiException {
        return preparePayment(request, headers);
    }

    /**
     * Validates and signs a funds availability check.
     *
     * @throws pl.polishapi.sdk.validation.InvalidIdentifierException when the account or amount is invalid.
     */
    public HttpRequest prepareFundsConfirmation(FundsConfirmationRequest request, RequestHeaders headers)
        throws PolishApiException {
        Objects.requireNonNull(request, "request");
        request.validateForSubmit(config.getAmountPolicy());
        return prepare("POST", FundsConfirmationRequest.PATH, headers, request.toJson());
    }

    /**
     * Verifies a received request or response, reading the artifact from the configured signature header.
     *
     * @param headers received headers, as exposed by the HTTP stack.
     * @throws MissingRequiredHeaderException when the signature header or a profile header is absent.
     * @throws PolishApiException             when no verification key is configured.
     */
    public VerificationResult verify(String method, String path, Map<String, List<String>> headers, byte[] body)
        throws PolishApiException {
        Objects.requireNonNull(headers, "headers");
        String artifact = null;
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            if (header.getKey() != null && header.getKey().equalsIgnoreCase(config.getSignatureHeader())
                && header.getValue() != null && !header.getValue().isEmpty()) {
                artifact = header.getValue().get(0);
            }
        }
        if (artifact == null) {
            throw new MissingRequiredHeaderException(config.getSignatureHeader().toLowerCase(Locale.ROOT));
        }
        return verify(artifact, method, path, headers, body);
    }

    /**
     * Verifies {@code artifact} against a rebuilt canonical input using the configured verification key.
     */
    public VerificationResult verify(String artifact, String method, String path, Map<String, List<String>> headers, byte[] body)
        throws PolishApiException {
        if (config.getVerificationKey() == null) {
            throw new PolishApiException("signature verification disabled: configure a verification key");
        }
        CanonicalInput input = canonicalBuilder.buildFromHeaderLists(method, path, headers, body);
        return verifier.verify(config.getVerificationKey(), artifact, input);
    }

    private String httpDate() {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(config.getClock()).withZoneSameInstant(ZoneOffset.UTC));
    }
}

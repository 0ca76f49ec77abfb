package pl.polishapi.sdk;

import pl.polishapi.sdk.validation.ValidationResult;
import pl.polishapi.sdk.validation.ViolationKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request PolishAPI headers supplied by the caller. {@code Date} and {@code Digest} are optional; the client
 * derives them from its clock and the request body when they are not set here.
 */
public final class RequestHeaders {

    public static final String AUTHORIZATION = "Authorization";
    public static final String ACCEPT_LANGUAGE = "Accept-Language";
    public static final String REQUEST_ID = "X-REQUEST-ID";
    public static final String DATE = "Date";
    public static final String DEFAULT_ACCEPT_LANGUAGE = "en-US";

    private static final UUID NIL_UUID = new UUID(0L, 0L);
    private static final String BEARER_PREFIX = "Bearer ";

    private final String authorization;
    private final String acceptLanguage;
    private final UUID requestId;
    private final String date;
    private final String digest;
    private final Map<String, String> additional;

    private RequestHeaders(Builder builder) {
        this.authorization = builder.authorization;
        this.acceptLanguage = builder.acceptLanguage == null ? DEFAULT_ACCEPT_LANGUAGE : builder.acceptLanguage;
        this.requestId = builder.requestId == null ? UUID.randomUUID() : builder.requestId;
        this.date = builder.date;
        this.digest = builder.digest;
        this.additional = Map.copyOf(builder.additional);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAuthorization() {
        return authorization;
    }

    public String getAcceptLanguage() {
        return acceptLanguage;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public String getDate() {
        return date;
    }

    public String getDigest() {
        return digest;
    }

    public Map<String, String> getAdditional() {
        return additional;
    }

    /**
     * Checks the authorization header (when present) and the request id.
     */
    public ValidationResult validate() {
        if (authorization != null) {
            ValidationResult auth = validateAuthorizationHeader(authorization);
            if (!auth.isValid()) {
                return auth;
            }
        }
        return validateRequestId(requestId);
    }

    /**
     * Returns the headers in insertion order. Optional headers that were not set are omitted.
     */
    public Map<String, String> toHeaderMap() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (authorization != null) {
            headers.put(AUTHORIZATION, authorization);
        }
        headers.put(ACCEPT_LANGUAGE, acceptLanguage);
        headers.put(REQUEST_ID, requestId.toString());
        if (date != null) {
            headers.put(DATE, date);
        }
        if (digest != null) {
            headers.put("Digest", digest);
        }
        additional.forEach(headers::putIfAbsent);
        return headers;
    }

    public static ValidationResult validateAuthorizationHeader(String value) {
        if (value == null || !value.startsWith(BEARER_PREFIX)) {
            return ValidationResult.invalid(AUTHORIZATION, ViolationKind.FORMAT, "Authorization header must start with 'Bearer '");
        }
        if (value.substring(BEARER_PREFIX.length()).isBlank()) {
            return ValidationResult.invalid(AUTHORIZATION, ViolationKind.MISSING, "Authorization token cannot be empty");
        }
        return ValidationResult.valid(AUTHORIZATION);
    }

    public static ValidationResult validateRequestId(UUID requestId) {
        if (requestId == null) {
            return ValidationResult.invalid(REQUEST_ID, ViolationKind.MISSING, "request id is required");
        }
        if (NIL_UUID.equals(requestId)) {
            return ValidationResult.invalid(REQUEST_ID, ViolationKind.FORMAT, "request id cannot be nil");
        }
        return ValidationResult.valid(REQUEST_ID);
    }

    public static final class Builder {
        private String authorization;
        private String acceptLanguage;
        private UUID requestId;
        private String date;
        private String digest;
        private final Map<String, String> additional = new LinkedHashMap<>();

        /**
         * Sets the OAuth2 access token; the header value becomes {@code Bearer <token>}.
         */
        public Builder bearerToken(String token) {
            this.authorization = token == null ? null : BEARER_PREFIX + token;
            return this;
        }

        /**
         * Sets the raw {@code Authorization} header value.
         */
        public Builder authorization(String authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder acceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
            return this;
        }

        public Builder requestId(UUID requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder date(String date) {
            this.date = date;
            return this;
        }

        public Builder digest(String digest) {
            this.digest = digest;
            return this;
        }

        /**
         * Adds a header not modelled above, for example one added to the signing profile.
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            additional.put(name, value);
            return this;
        }

        public RequestHeaders build() {
            return new RequestHeaders(this);
        }
    }
}

package pl.polishapi.sdk;

import pl.polishapi.sdk.canonical.SigningProfile;
import pl.polishapi.sdk.signing.SigningKey;
import pl.polishapi.sdk.signing.VerificationKey;
import pl.polishapi.sdk.validation.AmountPolicy;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link PolishApiClient} instances.
 */
public final class Config {

    public static final String DEFAULT_SIGNATURE_HEADER = "X-JWS-SIGNATURE";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "polishapi-java/0.1.0";

    private final String baseUrl;
    private final SigningKey signingKey;
    private final VerificationKey verificationKey;
    private final String signatureHeader;
    private final List<String> signedHeaders;
    private final Duration maxSignatureAge;
    private final Clock clock;
    private final BigDecimal maxAmount;
    private final Boolean allowNegativeAmounts;
    private final Duration httpTimeout;
    private final String userAgent;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.signingKey = builder.signingKey;
        this.verificationKey = builder.verificationKey;
        this.signatureHeader = builder.signatureHeader;
        this.signedHeaders = builder.signedHeaders == null ? null : List.copyOf(builder.signedHeaders);
        this.maxSignatureAge = builder.maxSignatureAge;
        this.clock = builder.clock;
        this.maxAmount = builder.maxAmount;
        this.allowNegativeAmounts = builder.allowNegativeAmounts;
        this.httpTimeout = builder.httpTimeout;
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        String resolvedHeader = Optional.ofNullable(signatureHeader)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_SIGNATURE_HEADER);
        if (!isToken(resolvedHeader)) {
            throw new IllegalArgumentException("SignatureHeader is not a valid header name: " + resolvedHeader);
        }

        List<String> resolvedSignedHeaders = signedHeaders == null || signedHeaders.isEmpty()
            ? SigningProfile.DEFAULT.headerNames()
            : SigningProfile.of(signedHeaders).headerNames();
        if (resolvedSignedHeaders.contains(resolvedHeader.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("SignedHeaders cannot include the signature header itself");
        }

        Duration resolvedMaxAge = Optional.ofNullable(maxSignatureAge).orElse(Duration.ZERO);
        if (resolvedMaxAge.isNegative()) {
            throw new IllegalArgumentException("MaxSignatureAge cannot be negative");
        }

        if (maxAmount != null && maxAmount.signum() <= 0) {
            throw new IllegalArgumentException("MaxAmount must be positive");
        }

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedUserAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .signingKey(signingKey)
            .verificationKey(verificationKey)
            .signatureHeader(resolvedHeader)
            .signedHeaders(resolvedSignedHeaders)
            .maxSignatureAge(resolvedMaxAge)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .maxAmount(maxAmount)
            .allowNegativeAmounts(allowNegativeAmounts == null || allowNegativeAmounts)
            .httpTimeout(resolvedTimeout)
            .userAgent(resolvedUserAgent)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("BaseURL is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isToken(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return the signing key, or {@code null} when outbound signing is disabled.
     */
    public SigningKey getSigningKey() {
        return signingKey;
    }

    /**
     * @return the key used to verify inbound signatures, or {@code null} when none is configured.
     */
    public VerificationKey getVerificationKey() {
        return verificationKey;
    }

    public String getSignatureHeader() {
        return signatureHeader;
    }

    public List<String> getSignedHeaders() {
        return signedHeaders;
    }

    public SigningProfile getSigningProfile() {
        return SigningProfile.of(signedHeaders);
    }

    /**
     * @return maximum accepted age of inbound signatures; {@link Duration#ZERO} disables the check.
     */
    public Duration getMaxSignatureAge() {
        return maxSignatureAge;
    }

    public Clock getClock() {
        return clock;
    }

    public BigDecimal getMaxAmount() {
        return maxAmount;
    }

    public boolean isAllowNegativeAmounts() {
        return allowNegativeAmounts == null || allowNegativeAmounts;
    }

    public AmountPolicy getAmountPolicy() {
        return new AmountPolicy(maxAmount, isAllowNegativeAmounts());
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public static final class Builder {
        private String baseUrl;
        private SigningKey signingKey;
        private VerificationKey verificationKey;
        private String signatureHeader;
        private List<String> signedHeaders;
        private Duration maxSignatureAge;
        private Clock clock;
        private BigDecimal maxAmount;
        private Boolean allowNegativeAmounts;
        private Duration httpTimeout;
        private String userAgent;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder signingKey(SigningKey signingKey) {
            this.signingKey = signingKey;
            return this;
        }

        public Builder verificationKey(VerificationKey verificationKey) {
            this.verificationKey = verificationKey;
            return this;
        }

        public Builder signatureHeader(String signatureHeader) {
            this.signatureHeader = signatureHeader;
            return this;
        }

        public Builder signedHeaders(List<String> signedHeaders) {
            this.signedHeaders = signedHeaders == null ? null : new ArrayList<>(signedHeaders);
            return this;
        }

        public Builder maxSignatureAge(Duration maxSignatureAge) {
            this.maxSignatureAge = maxSignatureAge;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxAmount(BigDecimal maxAmount) {
            this.maxAmount = maxAmount;
            return this;
        }

        public Builder allowNegativeAmounts(boolean allowNegativeAmounts) {
            this.allowNegativeAmounts = allowNegativeAmounts;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

package pl.polishapi.sdk.canonical;

import pl.polishapi.sdk.internal.Codec;

import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the {@link CanonicalInput} of a request. The builder is immutable and thread-safe; share one instance per
 * {@link SigningProfile}.
 *
 * <p>The method is upper-cased, the path (including any query string) is used exactly as supplied, headers named by
 * the profile are selected case-insensitively in profile order with their values untouched, and the body is
 * represented by its SHA-256 digest. A header that is present with an empty value is covered as the empty string; a
 * header that is absent fails the build.</p>
 */
public final class CanonicalRequestBuilder {

    private final SigningProfile profile;

    public CanonicalRequestBuilder() {
        this(SigningProfile.DEFAULT);
    }

    public CanonicalRequestBuilder(SigningProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public SigningProfile profile() {
        return profile;
    }

    /**
     * Builds the canonical input from single-valued headers.
     *
     * @throws MissingRequiredHeaderException when a profile header is absent from {@code headers}.
     * @throws IllegalArgumentException       when the method or path is malformed, or two header keys differ only in
     *                                        case and carry different values.
     */
    public CanonicalInput build(String method, String path, Map<String, String> headers, byte[] body)
        throws MissingRequiredHeaderException {
        Objects.requireNonNull(headers, "headers");
        Map<String, String> lowered = new HashMap<>();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getKey() == null || header.getValue() == null) {
                continue;
            }
            put(lowered, header.getKey(), header.getValue());
        }
        return assemble(method, path, lowered, body);
    }

    /**
     * Builds the canonical input from multi-valued headers, as exposed by most HTTP stacks. Multiple values of one
     * header are joined with {@code ", "} in their original order.
     */
    public CanonicalInput buildFromHeaderLists(String method, String path, Map<String, List<String>> headers, byte[] body)
        throws MissingRequiredHeaderException {
        Objects.requireNonNull(headers, "headers");
        Map<String, String> lowered = new HashMap<>();
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            if (header.getKey() == null || header.getValue() == null || header.getValue().isEmpty()) {
                continue;
            }
            put(lowered, header.getKey(), String.join(", ", header.getValue()));
        }
        return assemble(method, path, lowered, body);
    }

    public CanonicalInput build(String method, String path, HttpHeaders headers, byte[] body)
        throws MissingRequiredHeaderException {
        Objects.requireNonNull(headers, "headers");
        return buildFromHeaderLists(method, path, headers.map(), body);
    }

    private CanonicalInput assemble(String method, String path, Map<String, String> lowered, byte[] body)
        throws MissingRequiredHeaderException {
        List<CanonicalInput.Entry> entries = new ArrayList<>(profile.headerNames().size() + 3);
        entries.add(new CanonicalInput.Entry(CanonicalInput.METHOD, normalizeMethod(method)));
        entries.add(new CanonicalInput.Entry(CanonicalInput.PATH, checkPath(path)));
        for (String name : profile.headerNames()) {
            String value = lowered.get(name);
            if (value == null) {
                throw new MissingRequiredHeaderException(name);
            }
            entries.add(new CanonicalInput.Entry(name, value));
        }
        entries.add(new CanonicalInput.Entry(CanonicalInput.BODY_DIGEST, Codec.base64Url(Codec.sha256(body))));
        return new CanonicalInput(entries);
    }

    private static void put(Map<String, String> lowered, String name, String value) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        String previous = lowered.putIfAbsent(key, value);
        if (previous != null && !previous.equals(value)) {
            throw new IllegalArgumentException("conflicting values for header " + key);
        }
    }

    private static String normalizeMethod(String method) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        String upper = method.trim().toUpperCase(Locale.ROOT);
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c <= ' ' || c >= 0x7f) {
                throw new IllegalArgumentException("method contains illegal characters: " + method);
            }
        }
        return upper;
    }

    private static String checkPath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path is required");
        }
        if (path.charAt(0) != '/') {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        return path;
    }
}

package pl.polishapi.sdk.canonical;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered allow-list of header names covered by a request signature. The order is part of the signed bytes, so the
 * sending and verifying sides must use the same profile.
 */
public final class SigningProfile {

    /** {@code date}, {@code digest}, {@code x-request-id}. */
    public static final SigningProfile DEFAULT = of("date", "digest", "x-request-id");

    private final List<String> headerNames;

    private SigningProfile(List<String> headerNames) {
        this.headerNames = headerNames;
    }

    public static SigningProfile of(String... headerNames) {
        Objects.requireNonNull(headerNames, "headerNames");
        return of(List.of(headerNames));
    }

    /**
     * Creates a profile from header names. Names are lower-cased; blank, pseudo ({@code @}-prefixed) and duplicate
     * names are rejected.
     */
    public static SigningProfile of(List<String> headerNames) {
        Objects.requireNonNull(headerNames, "headerNames");
        List<String> normalized = new ArrayList<>(headerNames.size());
        Set<String> seen = new HashSet<>();
        for (String name : headerNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("signed header name cannot be blank");
            }
            String lower = name.trim().toLowerCase(Locale.ROOT);
            if (lower.startsWith("@")) {
                throw new IllegalArgumentException("signed header name cannot start with '@': " + name);
            }
            if (!seen.add(lower)) {
                throw new IllegalArgumentException("duplicate signed header name: " + lower);
            }
            normalized.add(lower);
        }
        return new SigningProfile(List.copyOf(normalized));
    }

    public List<String> headerNames() {
        return headerNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SigningProfile other && headerNames.equals(other.headerNames);
    }

    @Override
    public int hashCode() {
        return headerNames.hashCode();
    }

    @Override
    public String toString() {
        return "SigningProfile" + headerNames;
    }
}

package pl.polishapi.sdk.canonical;

import pl.polishapi.sdk.internal.Codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered (name, value) pairs describing the signable surface of one request: method, path, the profile's headers
 * and the body digest. Serialised as {@code uint32_be(len) || name || uint32_be(len) || value} per entry, so two
 * inputs are equal exactly when their serialised bytes are equal.
 *
 * <p>Instances are immutable and built per request by {@link CanonicalRequestBuilder}.</p>
 */
public final class CanonicalInput {

    public static final String METHOD = "@method";
    public static final String PATH = "@path";
    public static final String BODY_DIGEST = "@body-sha256";

    private final List<Entry> entries;
    private final byte[] encoded;

    CanonicalInput(List<Entry> entries) {
        this.entries = List.copyOf(entries);
        this.encoded = encode(this.entries);
    }

    public List<Entry> entries() {
        return entries;
    }

    public Optional<String> value(String name) {
        for (Entry entry : entries) {
            if (entry.name().equals(name)) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    /**
     * @return a copy of the serialised bytes.
     */
    public byte[] toByteArray() {
        return encoded.clone();
    }

    public int length() {
        return encoded.length;
    }

    private static byte[] encode(List<Entry> entries) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Entry entry : entries) {
            writeField(out, entry.name().getBytes(StandardCharsets.UTF_8));
            writeField(out, entry.value().getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    private static void writeField(ByteArrayOutputStream out, byte[] bytes) {
        out.writeBytes(Codec.uint32(bytes.length));
        out.writeBytes(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CanonicalInput other && Arrays.equals(encoded, other.encoded);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return "CanonicalInput" + entries;
    }

    /**
     * One canonical (name, value) pair. Header names are lowercase; pseudo entries start with {@code @}.
     */
    public record Entry(String name, String value) {
        public Entry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }
}

package pl.polishapi.sdk.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a single field. A result is either valid or carries the {@link ViolationKind} and a short
 * human-readable detail suitable for end-user error messages.
 *
 * @param field     name of the validated field as reported to the caller.
 * @param violation violation kind, {@code null} when the value is valid.
 * @param detail    description of the violation, {@code null} when the value is valid.
 */
public record ValidationResult(String field, ViolationKind violation, String detail) {

    public ValidationResult {
        Objects.requireNonNull(field, "field");
        if (violation == null && detail != null) {
            throw new IllegalArgumentException("a valid result carries no detail");
        }
    }

    public static ValidationResult valid(String field) {
        return new ValidationResult(field, null, null);
    }

    public static ValidationResult invalid(String field, ViolationKind violation, String detail) {
        return new ValidationResult(field, Objects.requireNonNull(violation, "violation"), detail);
    }

    public boolean isValid() {
        return violation == null;
    }

    public Optional<ViolationKind> violationKind() {
        return Optional.ofNullable(violation);
    }

    /**
     * Returns this result unchanged when valid.
     *
     * @throws InvalidIdentifierException when the result carries a violation.
     */
    public ValidationResult orThrow() throws InvalidIdentifierException {
        if (violation != null) {
            throw new InvalidIdentifierException(field, violation, detail);
        }
        return this;
    }
}

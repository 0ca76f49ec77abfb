package pl.polishapi.sdk.validation;

import pl.polishapi.sdk.PolishApiException;

import java.util.Locale;

/**
 * Raised when an IBAN, BIC, currency code, amount or other identifier fails validation.
 */
public final class InvalidIdentifierException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final ViolationKind kind;

    public InvalidIdentifierException(String field, ViolationKind kind, String detail) {
        super(field + ": " + (detail == null ? kind.name().toLowerCase(Locale.ROOT) : detail));
        this.field = field;
        this.kind = kind;
    }

    /**
     * @return name of the offending field, as supplied to the validator.
     */
    public String getField() {
        return field;
    }

    public ViolationKind getKind() {
        return kind;
    }
}

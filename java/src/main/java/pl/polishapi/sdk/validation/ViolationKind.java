package pl.polishapi.sdk.validation;

/**
 * Reason an identifier failed validation.
 */
public enum ViolationKind {
    /** Value absent or empty. */
    MISSING,
    /** Value too short, too long, or not the length registered for its country. */
    LENGTH,
    /** Value contains characters outside the allowed alphabet (including lowercase where uppercase is required). */
    CHARSET,
    /** Characters are allowed but not in the required positions or pattern. */
    FORMAT,
    /** Check digits do not match the value. */
    CHECKSUM,
    /** Well-formed code that is not present in the bundled reference table. */
    UNKNOWN_CODE,
    /** Numeric value outside the configured bounds. */
    RANGE
}

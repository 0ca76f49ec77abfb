package pl.polishapi.sdk.signing;

/**
 * Outcome of verifying a signature artifact.
 */
public enum VerificationStatus {
    VALID,
    /** The artifact could not be decoded; no cryptographic check was attempted. */
    MALFORMED_ARTIFACT,
    /** The artifact names a different key than the one supplied for verification. */
    KEY_IDENTIFIER_MISMATCH,
    /** The signature does not match the rebuilt input, or the artifact's algorithm differs from the key's. */
    SIGNATURE_INVALID,
    /** The signature is authentic but older than the configured maximum age. */
    SIGNATURE_EXPIRED
}

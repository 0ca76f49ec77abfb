package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.canonical.CanonicalInput;

/**
 * Signer implementation used when no signing key is configured.
 */
public final class DisabledSigner implements Signer {

    public static final String ERROR_MESSAGE = "request signing disabled: configure a signing key";

    @Override
    public SignatureArtifact sign(CanonicalInput input) throws SigningException {
        throw new SigningException(ERROR_MESSAGE);
    }
}

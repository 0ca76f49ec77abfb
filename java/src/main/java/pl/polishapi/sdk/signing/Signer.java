package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.canonical.CanonicalInput;

public interface Signer {

    SignatureArtifact sign(CanonicalInput input) throws SigningException;
}

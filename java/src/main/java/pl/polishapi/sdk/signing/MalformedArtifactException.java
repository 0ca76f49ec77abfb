package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.PolishApiException;

/**
 * Raised when a signature artifact cannot be decoded structurally.
 */
public final class MalformedArtifactException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    public MalformedArtifactException(String reason) {
        super(reason);
    }
}

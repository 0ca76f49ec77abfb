package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.PolishApiException;

/**
 * Raised when a signature cannot be produced.
 */
public final class SigningException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    public SigningException(String reason) {
        super(reason);
    }

    public SigningException(String reason, Throwable cause) {
        super(reason, cause);
    }
}

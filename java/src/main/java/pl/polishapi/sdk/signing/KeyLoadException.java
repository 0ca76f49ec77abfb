package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.PolishApiException;

/**
 * Raised when key material cannot be parsed or does not fit the requested algorithm. Always raised while constructing
 * a {@link SigningKey} or {@link VerificationKey}, never later.
 */
public final class KeyLoadException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    public KeyLoadException(String reason) {
        super(reason);
    }

    public KeyLoadException(String reason, Throwable cause) {
        super(reason, cause);
    }
}

package pl.polishapi.sdk;

/**
 * Base exception thrown by the PolishAPI Java SDK.
 */
public class PolishApiException extends Exception {

    private static final long serialVersionUID = 1L;

    public PolishApiException(String message) {
        super(message);
    }

    public PolishApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

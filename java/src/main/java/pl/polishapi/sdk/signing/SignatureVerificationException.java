package pl.polishapi.sdk.signing;

import pl.polishapi.sdk.PolishApiException;

/**
 * Thrown by {@link Verifier#verifyOrThrow} for any result other than {@link VerificationStatus#VALID}.
 */
public final class SignatureVerificationException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    private final transient VerificationResult result;

    public SignatureVerificationException(VerificationResult result) {
        super(result.status() + (result.detail() == null ? "" : ": " + result.detail()));
        this.result = result;
    }

    public VerificationResult getResult() {
        return result;
    }

    public VerificationStatus getStatus() {
        return result.status();
    }
}

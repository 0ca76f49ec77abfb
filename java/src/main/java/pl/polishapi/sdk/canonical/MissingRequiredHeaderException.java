package pl.polishapi.sdk.canonical;

import pl.polishapi.sdk.PolishApiException;

/**
 * Raised when a header named by the {@link SigningProfile} is absent from the request being canonicalised.
 */
public final class MissingRequiredHeaderException extends PolishApiException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public MissingRequiredHeaderException(String name) {
        super("missing required header: " + name);
        this.name = name;
    }

    /**
     * @return lowercase name of the missing header.
     */
    public String getName() {
        return name;
    }
}

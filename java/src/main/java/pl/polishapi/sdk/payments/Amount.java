package pl.polishapi.sdk.payments;

/**
 * Amount with currency, both as strings exactly as sent on the wire.
 */
public record Amount(String currency, String amount) {
}

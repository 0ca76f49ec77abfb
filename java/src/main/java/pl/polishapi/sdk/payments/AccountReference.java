package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Debtor or creditor account. PolishAPI identifies domestic accounts by IBAN; {@code bic} is only needed for
 * accounts held outside the sending bank's clearing system.
 */
public record AccountReference(
    @JsonProperty("iban") String iban,
    @JsonProperty("bic") String bic,
    @JsonProperty("currency") String currency
) {

    public static AccountReference ofIban(String iban) {
        return new AccountReference(iban, null, null);
    }
}

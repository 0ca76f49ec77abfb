package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payer identification on a tax transfer, e.g. a NIP or PESEL number with its type code.
 */
public record TaxIdentification(
    @JsonProperty("taxIdentificationNumber") String taxIdentificationNumber,
    @JsonProperty("taxIdentificationType") String taxIdentificationType,
    @JsonProperty("issuer") String issuer
) {
}

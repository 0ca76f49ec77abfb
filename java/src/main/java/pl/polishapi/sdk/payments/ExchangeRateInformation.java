package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Currency conversion terms of a non-EEA transfer. Only {@code unitCurrency} is required.
 */
public record ExchangeRateInformation(
    @JsonProperty("unitCurrency") String unitCurrency,
    @JsonProperty("exchangeRate") String exchangeRate,
    @JsonProperty("rateType") String rateType,
    @JsonProperty("contractIdentification") String contractIdentification
) {

    public static ExchangeRateInformation ofUnitCurrency(String unitCurrency) {
        return new ExchangeRateInformation(unitCurrency, null, null, null);
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.IdentifierValidators;
import pl.polishapi.sdk.validation.ValidationResult;

import java.util.List;

/**
 * Credit transfer to an account held outside the EEA, optionally with agreed exchange rate terms.
 */
@JsonPropertyOrder({"requestId", "instructedAmount", "debtorAccount", "creditorName", "creditorAccount",
    "creditorAgent", "remittanceInformationUnstructured", "requestedExecutionDate", "chargeBearer", "serviceLevel",
    "categoryPurpose", "exchangeRateInformation"})
public final class NonEeaPaymentRequest extends CrossBorderPaymentRequest {

    public static final String PATH = "/v3_0.1/payments/v3_0.1/nonEEA";

    private final ExchangeRateInformation exchangeRateInformation;

    private NonEeaPaymentRequest(Builder builder) {
        super(builder);
        this.exchangeRateInformation = builder.exchangeRateInformation;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String path() {
        return PATH;
    }

    @JsonProperty("exchangeRateInformation")
    public ExchangeRateInformation getExchangeRateInformation() {
        return exchangeRateInformation;
    }

    @Override
    protected void validateAdditional(List<ValidationResult> results, AmountPolicy amountPolicy) {
        if (exchangeRateInformation != null) {
            results.add(IdentifierValidators.validateCurrency("exchangeRateInformation.unitCurrency",
                exchangeRateInformation.unitCurrency()));
        }
    }

    public static final class Builder extends CrossBorderPaymentRequest.Builder<NonEeaPaymentRequest, Builder> {
        private ExchangeRateInformation exchangeRateInformation;

        public Builder exchangeRateInformation(ExchangeRateInformation exchangeRateInformation) {
            this.exchangeRateInformation = exchangeRateInformation;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public NonEeaPaymentRequest build() {
            return new NonEeaPaymentRequest(this);
        }
    }
}

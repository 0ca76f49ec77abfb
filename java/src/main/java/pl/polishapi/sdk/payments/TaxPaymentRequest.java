package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.ValidationResult;
import pl.polishapi.sdk.validation.ViolationKind;

import java.util.List;

/**
 * Transfer to a tax authority account. The payer identification is mandatory.
 */
@JsonPropertyOrder({"requestId", "instructedAmount", "debtorAccount", "creditorName", "creditorAccount",
    "creditorAgent", "taxIdentification", "taxPeriod", "taxType", "requestedExecutionDate"})
public final class TaxPaymentRequest extends PaymentRequest {

    public static final String PATH = "/v3_0.1/payments/v3_0.1/tax";

    private final TaxIdentification taxIdentification;
    private final String taxPeriod;
    private final String taxType;

    private TaxPaymentRequest(Builder builder) {
        super(builder);
        this.taxIdentification = builder.taxIdentification;
        this.taxPeriod = builder.taxPeriod;
        this.taxType = builder.taxType;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String path() {
        return PATH;
    }

    @JsonProperty("taxIdentification")
    public TaxIdentification getTaxIdentification() {
        return taxIdentification;
    }

    @JsonProperty("taxPeriod")
    public String getTaxPeriod() {
        return taxPeriod;
    }

    @JsonProperty("taxType")
    public String getTaxType() {
        return taxType;
    }

    @Override
    protected void validateAdditional(List<ValidationResult> results, AmountPolicy amountPolicy) {
        if (taxIdentification == null) {
            results.add(ValidationResult.invalid("taxIdentification", ViolationKind.MISSING,
                "tax identification is required"));
            return;
        }
        requireText(results, "taxIdentification.taxIdentificationNumber", taxIdentification.taxIdentificationNumber());
        requireText(results, "taxIdentification.taxIdentificationType", taxIdentification.taxIdentificationType());
    }

    private static void requireText(List<ValidationResult> results, String field, String value) {
        if (value == null || value.isBlank()) {
            results.add(ValidationResult.invalid(field, ViolationKind.MISSING, field + " is required"));
        } else {
            results.add(ValidationResult.valid(field));
        }
    }

    public static final class Builder extends PaymentRequest.Builder<TaxPaymentRequest, Builder> {
        private TaxIdentification taxIdentification;
        private String taxPeriod;
        private String taxType;

        public Builder taxIdentification(TaxIdentification taxIdentification) {
            this.taxIdentification = taxIdentification;
            return this;
        }

        /**
         * Sets the settlement period, e.g. {@code 26M10} for October 2026.
         */
        public Builder taxPeriod(String taxPeriod) {
            this.taxPeriod = taxPeriod;
            return this;
        }

        /**
         * Sets the tax form symbol, e.g. {@code VAT-7}.
         */
        public Builder taxType(String taxType) {
            this.taxType = taxType;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public TaxPaymentRequest build() {
            return new TaxPaymentRequest(this);
        }
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Domestic credit transfer initiation request.
 */
@JsonPropertyOrder({"requestId", "instructedAmount", "debtorAccount", "creditorName", "creditorAccount",
    "creditorAgent", "remittanceInformationUnstructured", "requestedExecutionDate"})
public final class DomesticPaymentRequest extends PaymentRequest {

    public static final String PATH = "/v3_0.1/payments/v3_0.1/domestic";

    private final String remittanceInformationUnstructured;

    private DomesticPaymentRequest(Builder builder) {
        super(builder);
        this.remittanceInformationUnstructured = builder.remittanceInformationUnstructured;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String path() {
        return PATH;
    }

    @JsonProperty("remittanceInformationUnstructured")
    public String getRemittanceInformationUnstructured() {
        return remittanceInformationUnstructured;
    }

    public static final class Builder extends PaymentRequest.Builder<DomesticPaymentRequest, Builder> {
        private String remittanceInformationUnstructured;

        public Builder remittanceInformation(String remittanceInformationUnstructured) {
            this.remittanceInformationUnstructured = remittanceInformationUnstructured;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public DomesticPaymentRequest build() {
            return new DomesticPaymentRequest(this);
        }
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Credit transfer to an account held in another EEA country.
 */
@JsonPropertyOrder({"requestId", "instructedAmount", "debtorAccount", "creditorName", "creditorAccount",
    "creditorAgent", "remittanceInformationUnstructured", "requestedExecutionDate", "chargeBearer", "serviceLevel",
    "categoryPurpose"})
public final class EeaPaymentRequest extends CrossBorderPaymentRequest {

    public static final String PATH = "/v3_0.1/payments/v3_0.1/EEA";

    private EeaPaymentRequest(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String path() {
        return PATH;
    }

    public static final class Builder extends CrossBorderPaymentRequest.Builder<EeaPaymentRequest, Builder> {

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public EeaPaymentRequest build() {
            return new EeaPaymentRequest(this);
        }
    }
}

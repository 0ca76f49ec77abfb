package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fields shared by EEA and non-EEA credit transfers: charge bearer, SEPA service level and category purpose.
 * Values are passed through as given; the ASPSP decides which codes it accepts.
 */
public abstract class CrossBorderPaymentRequest extends PaymentRequest {

    private final String remittanceInformationUnstructured;
    private final String chargeBearer;
    private final String serviceLevel;
    private final String categoryPurpose;

    protected CrossBorderPaymentRequest(Builder<?, ?> builder) {
        super(builder);
        this.remittanceInformationUnstructured = builder.remittanceInformationUnstructured;
        this.chargeBearer = builder.chargeBearer;
        this.serviceLevel = builder.serviceLevel;
        this.categoryPurpose = builder.categoryPurpose;
    }

    @JsonProperty("remittanceInformationUnstructured")
    public String getRemittanceInformationUnstructured() {
        return remittanceInformationUnstructured;
    }

    @JsonProperty("chargeBearer")
    public String getChargeBearer() {
        return chargeBearer;
    }

    @JsonProperty("serviceLevel")
    public String getServiceLevel() {
        return serviceLevel;
    }

    @JsonProperty("categoryPurpose")
    public String getCategoryPurpose() {
        return categoryPurpose;
    }

    public abstract static class Builder<T extends CrossBorderPaymentRequest, B extends Builder<T, B>>
        extends PaymentRequest.Builder<T, B> {
        private String remittanceInformationUnstructured;
        private String chargeBearer;
        private String serviceLevel;
        private String categoryPurpose;

        public B remittanceInformation(String remittanceInformationUnstructured) {
            this.remittanceInformationUnstructured = remittanceInformationUnstructured;
            return self();
        }

        /**
         * Sets who bears the transfer charges, e.g. {@code SLEV}, {@code SHAR}, {@code DEBT} or {@code CRED}.
         */
        public B chargeBearer(String chargeBearer) {
            this.chargeBearer = chargeBearer;
            return self();
        }

        public B serviceLevel(String serviceLevel) {
            this.serviceLevel = serviceLevel;
            return self();
        }

        public B categoryPurpose(String categoryPurpose) {
            this.categoryPurpose = categoryPurpose;
            return self();
        }
    }
}

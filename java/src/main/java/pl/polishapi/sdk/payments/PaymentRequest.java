package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import pl.polishapi.sdk.PolishApiException;
import pl.polishapi.sdk.internal.Json;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.IdentifierValidators;
import pl.polishapi.sdk.validation.InvalidIdentifierException;
import pl.polishapi.sdk.validation.ValidationResult;
import pl.polishapi.sdk.validation.ViolationKind;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Fields shared by every credit transfer initiation (domestic, EEA, non-EEA and tax). Subclasses add their own
 * fields, their endpoint path and any extra identifier checks.
 *
 * <p>Instances are immutable. {@link #validate(AmountPolicy)} covers every identifier that ends up in the signed body,
 * so a request that passes {@link #validateForSubmit(AmountPolicy)} never carries an unchecked IBAN, BIC, currency or
 * amount.</p>
 */
public abstract class PaymentRequest {

    private final UUID requestId;
    private final Amount instructedAmount;
    private final AccountReference debtorAccount;
    private final String creditorName;
    private final AccountReference creditorAccount;
    private final String creditorAgent;
    private final LocalDate requestedExecutionDate;

    protected PaymentRequest(Builder<?, ?> builder) {
        this.requestId = builder.requestId == null ? UUID.randomUUID() : builder.requestId;
        this.instructedAmount = builder.instructedAmount;
        this.debtorAccount = builder.debtorAccount;
        this.creditorName = builder.creditorName;
        this.creditorAccount = builder.creditorAccount;
        this.creditorAgent = builder.creditorAgent;
        this.requestedExecutionDate = builder.requestedExecutionDate;
    }

    /**
     * @return endpoint path, relative to the ASPSP base URL.
     */
    public abstract String path();

    @JsonProperty("requestId")
    public UUID getRequestId() {
        return requestId;
    }

    @JsonProperty("instructedAmount")
    public Amount getInstructedAmount() {
        return instructedAmount;
    }

    @JsonProperty("debtorAccount")
    public AccountReference getDebtorAccount() {
        return debtorAccount;
    }

    @JsonProperty("creditorName")
    public String getCreditorName() {
        return creditorName;
    }

    @JsonProperty("creditorAccount")
    public AccountReference getCreditorAccount() {
        return creditorAccount;
    }

    @JsonProperty("creditorAgent")
    public String getCreditorAgent() {
        return creditorAgent;
    }

    @JsonProperty("requestedExecutionDate")
    public LocalDate getRequestedExecutionDate() {
        return requestedExecutionDate;
    }

    /**
     * Runs every identifier validator over the request and returns all results, valid ones included.
     */
    public List<ValidationResult> validate(AmountPolicy amountPolicy) {
        List<ValidationResult> results = new ArrayList<>();
        validateAmount(results, "instructedAmount", instructedAmount, amountPolicy);
        validateAccount(results, "debtorAccount", debtorAccount);
        validateAccount(results, "creditorAccount", creditorAccount);
        if (creditorAgent != null) {
            results.add(IdentifierValidators.validateBic("creditorAgent", creditorAgent));
        }
        if (creditorName == null || creditorName.isBlank()) {
            results.add(ValidationResult.invalid("creditorName", ViolationKind.MISSING, "creditor name is required"));
        }
        validateAdditional(results, amountPolicy);
        return results;
    }

    /**
     * Hook for subclass-specific checks, appended after the common ones.
     */
    protected void validateAdditional(List<ValidationResult> results, AmountPolicy amountPolicy) {
    }

    /**
     * Ensures the request can be signed and sent. Invoked by the client immediately before signing.
     *
     * @throws InvalidIdentifierException for the first field that fails validation.
     */
    public void validateForSubmit(AmountPolicy amountPolicy) throws InvalidIdentifierException {
        for (ValidationResult result : validate(amountPolicy)) {
            result.orThrow();
        }
    }

    /**
     * Serialises the request body exactly as it will be signed and sent.
     */
    public byte[] toJson() throws PolishApiException {
        try {
            return Json.mapper().writeValueAsBytes(this);
        } catch (JsonProcessingException ex) {
            throw new PolishApiException("encode " + getClass().getSimpleName() + ": " + ex.getOriginalMessage(), ex);
        }
    }

    static void validateAmount(List<ValidationResult> results, String field, Amount amount, AmountPolicy policy) {
        if (amount == null) {
            results.add(ValidationResult.invalid(field, ViolationKind.MISSING, field + " is required"));
            return;
        }
        results.add(IdentifierValidators.validateCurrency(field + ".currency", amount.currency()));
        results.add(IdentifierValidators.validateAmount(field + ".amount", amount.amount(), policy));
    }

    /**
     * IBAN is mandatory; BIC and currency are checked when present.
     */
    static void validateAccount(List<ValidationResult> results, String field, AccountReference account) {
        if (account == null) {
            results.add(ValidationResult.invalid(field, ViolationKind.MISSING, field + " is required"));
            return;
        }
        results.add(IdentifierValidators.validateIban(field + ".iban", account.iban()));
        if (account.bic() != null) {
            results.add(IdentifierValidators.validateBic(field + ".bic", account.bic()));
        }
        if (account.currency() != null) {
            results.add(IdentifierValidators.validateCurrency(field + ".currency", account.currency()));
        }
    }

    /**
     * Fluent builder shared by the payment request types. Not thread-safe.
     *
     * @param <T> request type produced.
     * @param <B> concrete builder type, returned from every setter.
     */
    public abstract static class Builder<T extends PaymentRequest, B extends Builder<T, B>> {
        private UUID requestId;
        private Amount instructedAmount;
        private AccountReference debtorAccount;
        private String creditorName;
        private AccountReference creditorAccount;
        private String creditorAgent;
        private LocalDate requestedExecutionDate;

        protected abstract B self();

        public abstract T build();

        /**
         * Overrides the body request id. A random UUID is used when unset.
         */
        public B requestId(UUID requestId) {
            this.requestId = requestId;
            return self();
        }

        public B instructedAmount(String currency, String amount) {
            this.instructedAmount = new Amount(currency, amount);
            return self();
        }

        public B debtorAccount(AccountReference debtorAccount) {
            this.debtorAccount = debtorAccount;
            return self();
        }

        public B creditorName(String creditorName) {
            this.creditorName = creditorName;
            return self();
        }

        public B creditorAccount(AccountReference creditorAccount) {
            this.creditorAccount = creditorAccount;
            return self();
        }

        /**
         * Sets the BIC of the creditor's bank.
         */
        public B creditorAgent(String creditorAgent) {
            this.creditorAgent = creditorAgent;
            return self();
        }

        public B requestedExecutionDate(LocalDate requestedExecutionDate) {
            this.requestedExecutionDate = requestedExecutionDate;
            return self();
        }
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import pl.polishapi.sdk.PolishApiException;
import pl.polishapi.sdk.internal.Json;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.InvalidIdentifierException;
import pl.polishapi.sdk.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Asks the ASPSP whether {@code account} holds at least {@code instructedAmount}.
 */
@JsonPropertyOrder({"requestId", "cardNumber", "account", "payee", "instructedAmount"})
public final class FundsConfirmationRequest {

    public static final String PATH = "/v3_0.1/funds/v3_0.1/confirmation";

    private final UUID requestId;
    private final String cardNumber;
    private final AccountReference account;
    private final String payee;
    private final Amount instructedAmount;

    private FundsConfirmationRequest(Builder builder) {
        this.requestId = builder.requestId == null ? UUID.randomUUID() : builder.requestId;
        this.cardNumber = builder.cardNumber;
        this.account = builder.account;
        this.payee = builder.payee;
        this.instructedAmount = builder.instructedAmount;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("requestId")
    public UUID getRequestId() {
        return requestId;
    }

    @JsonProperty("cardNumber")
    public String getCardNumber() {
        return cardNumber;
    }

    @JsonProperty("account")
    public AccountReference getAccount() {
        return account;
    }

    @JsonProperty("payee")
    public String getPayee() {
        return payee;
    }

    @JsonProperty("instructedAmount")
    public Amount getInstructedAmount() {
        return instructedAmount;
    }

    public List<ValidationResult> validate(AmountPolicy amountPolicy) {
        List<ValidationResult> results = new ArrayList<>();
        PaymentRequest.validateAccount(results, "account", account);
        PaymentRequest.validateAmount(results, "instructedAmount", instructedAmount, amountPolicy);
        return results;
    }

    /**
     * @throws InvalidIdentifierException for the first field that fails validation.
     */
    public void validateForSubmit(AmountPolicy amountPolicy) throws InvalidIdentifierException {
        for (ValidationResult result : validate(amountPolicy)) {
            result.orThrow();
        }
    }

    public byte[] toJson() throws PolishApiException {
        try {
            return Json.mapper().writeValueAsBytes(this);
        } catch (JsonProcessingException ex) {
            throw new PolishApiException("encode funds confirmation: " + ex.getOriginalMessage(), ex);
        }
    }

    public static final class Builder {
        private UUID requestId;
        private String cardNumber;
        private AccountReference account;
        private String payee;
        private Amount instructedAmount;

        public Builder requestId(UUID requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder cardNumber(String cardNumber) {
            this.cardNumber = cardNumber;
            return this;
        }

        public Builder account(AccountReference account) {
            this.account = account;
            return this;
        }

        public Builder payee(String payee) {
            this.payee = payee;
            return this;
        }

        public Builder instructedAmount(String currency, String amount) {
            this.instructedAmount = new Amount(currency, amount);
            return this;
        }

        public FundsConfirmationRequest build() {
            return new FundsConfirmationRequest(this);
        }
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import pl.polishapi.sdk.internal.Json;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.InvalidIdentifierException;
import pl.polishapi.sdk.validation.ValidationResult;
import pl.polishapi.sdk.validation.ViolationKind;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FundsConfirmationRequestTest {

    @Test
    void validRequestSerialisesWireFormat() throws Exception {
        FundsConfirmationRequest request = FundsConfirmationRequest.builder()
            .requestId(UUID.fromString("3f2c8a1e-9d4b-4c7e-a1f0-2b6d8e9c0a11"))
            .account(new AccountReference("PL61109010140000071219812874", null, "PLN"))
            .payee("Sklep Internetowy")
            .instructedAmount("PLN", "49.99")
            .build();

        assertDoesNotThrow(() -> request.validateForSubmit(AmountPolicy.DEFAULT));

        JsonNode json = Json.mapper().readTree(request.toJson());
        assertEquals("3f2c8a1e-9d4b-4c7e-a1f0-2b6d8e9c0a11", json.path("requestId").asText());
        assertEquals("PLN", json.path("account").path("currency").asText());
        assertEquals("Sklep Internetowy", json.path("payee").asText());
        assertEquals("49.99", json.path("instructedAmount").path("amount").asText());
        assertFalse(json.has("cardNumber"));
    }

    @Test
    void reportsAccountAndAmountViolations() {
        FundsConfirmationRequest request = FundsConfirmationRequest.builder()
            .account(new AccountReference("PL61109010140000071219812874", null, "PLZ"))
            .instructedAmount("PLN", "49.9")
            .build();

        List<String> invalidFields = request.validate(AmountPolicy.DEFAULT).stream()
            .filter(result -> !result.isValid())
            .map(ValidationResult::field)
            .toList();

        assertEquals(List.of("account.currency", "instructedAmount.amount"), invalidFields);
    }

    @Test
    void missingAccountAndAmountAreReported() {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
            () -> FundsConfirmationRequest.builder().build().validateForSubmit(AmountPolicy.DEFAULT));

        assertEquals("account", ex.getField());
        assertEquals(ViolationKind.MISSING, ex.getKind());
        assertEquals(2, FundsConfirmationRequest.builder().build().validate(AmountPolicy.DEFAULT).size());
    }
}

package pl.polishapi.sdk.payments;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import pl.polishapi.sdk.internal.Json;
import pl.polishapi.sdk.validation.AmountPolicy;
import pl.polishapi.sdk.validation.InvalidIdentifierException;
import pl.polishapi.sdk.validation.ValidationResult;
import pl.polishapi.sdk.validation.ViolationKind;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaxPaymentRequestTest {

    private static TaxPaymentRequest.Builder taxPayment() {
        return TaxPaymentRequest.builder()
            .instructedAmount("PLN", "1500.00")
            .debtorAccount(AccountReference.ofIban("PL61109010140000071219812874"))
            .creditorName("Urzad Skarbowy Warszawa")
            .creditorAccount(AccountReference.ofIban("PL61109010140000071219812874"))
            .taxPeriod("26M09")
            .taxType("VAT-7")
            .requestedExecutionDate(LocalDate.of(2026, 10, 25));
    }

    @Test
    void completeTaxPaymentIsValid() throws Exception {
        TaxPaymentRequest request = taxPayment()
            .taxIdentification(new TaxIdentification("5260250274", "N", null))
            .build();

        assertEquals(TaxPaymentRequest.PATH, request.path());
        assertTrue(request.validate(AmountPolicy.DEFAULT).stream().allMatch(ValidationResult::isValid));

        JsonNode json = Json.mapper().readTree(request.toJson());
        assertEquals("5260250274", json.path("taxIdentification").path("taxIdentificationNumber").asText());
        assertEquals("N", json.path("taxIdentification").path("taxIdentificationType").asText());
        assertFalse(json.path("taxIdentification").has("issuer"));
        assertEquals("26M09", json.path("taxPeriod").asText());
        assertEquals("VAT-7", json.path("taxType").asText());
        assertEquals("2026-10-25", json.path("requestedExecutionDate").asText());
        assertFalse(json.has("remittanceInformationUnstructured"));
    }

    @Test
    void taxIdentificationIsRequired() {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
            () -> taxPayment().build().validateForSubmit(AmountPolicy.DEFAULT));

        assertEquals("taxIdentification", ex.getField());
        assertEquals(ViolationKind.MISSING, ex.getKind());
    }

    @Test
    void blankIdentificationPartsAreReported() {
        TaxPaymentRequest request = taxPayment()
            .taxIdentification(new TaxIdentification(" ", null, "PL"))
            .build();

        List<String> invalidFields = request.validate(AmountPolicy.DEFAULT).stream()
            .filter(result -> !result.isValid())
            .map(ValidationResult::field)
            .toList();

        assertEquals(List.of("taxIdentification.taxIdentificationNumber", "taxIdentification.taxIdentificationType"),
            invalidFields);
    }
}

package pl.polishapi.sdk.validation;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierValidatorsTest {

    private static final String VALID_PL_IBAN = "PL61109010140000071219812874";

    @Test
    void acceptsValidIbans() {
        assertTrue(IdentifierValidators.validateIban(VALID_PL_IBAN).isValid());
        assertTrue(IdentifierValidators.validateIban("DE89370400440532013000").isValid());
        assertTrue(IdentifierValidators.validateIban("GB82WEST12345698765432").isValid());
    }

    @Test
    void rejectsIbanWithWrongCheckDigits() {
        ValidationResult result = IdentifierValidators.validateIban("PL61109010140000071219812875");
        assertFalse(result.isValid());
        assertEquals(ViolationKind.CHECKSUM, result.violation());
        assertEquals("iban", result.field());
    }

    @Test
    void rejectsIbanOutsideGenericLengthBounds() {
        assertEquals(ViolationKind.LENGTH, IdentifierValidators.validateIban("PL61109010").violation());
        assertEquals(ViolationKind.LENGTH,
            IdentifierValidators.validateIban("PL6110901014000007121981287412345678").violation());
    }

    @Test
    void rejectsIbanWithRegistryLengthMismatch() {
        ValidationResult result = IdentifierValidators.validateIban("DE8937040044053201300");
        assertEquals(ViolationKind.LENGTH, result.violation());
        assertTrue(result.detail().contains("22"));
    }

    @Test
    void unknownCountryFallsBackToGenericRules() {
        assertTrue(IdentifierValidators.validateIban("ZZ591234567890123456").isValid());
    }

    @Test
    void rejectsIbanFormatAndCharset() {
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateIban("pl61109010140000071219812874").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateIban("PLX1109010140000071219812874").violation());
        assertEquals(ViolationKind.CHARSET, IdentifierValidators.validateIban("PL61 109010140000071219812874").violation());
        assertEquals(ViolationKind.MISSING, IdentifierValidators.validateIban("").violation());
        assertEquals(ViolationKind.MISSING, IdentifierValidators.validateIban(null).violation());
    }

    @Test
    void normalizesPrintedIban() {
        String normalized = IdentifierValidators.normalizeIban("pl61 1090 1014 0000 0712 1981 2874");
        assertEquals(VALID_PL_IBAN, normalized);
        assertTrue(IdentifierValidators.validateIban(normalized).isValid());
        assertNull(IdentifierValidators.normalizeIban(null));
    }

    @Test
    void mod97OfValidIbanIsOne() {
        assertEquals(1, IdentifierValidators.mod97(VALID_PL_IBAN));
    }

    @Test
    void validatesBic() {
        assertTrue(IdentifierValidators.validateBic("DEUTDEFF").isValid());
        assertTrue(IdentifierValidators.validateBic("DEUTDEFF500").isValid());
        assertTrue(IdentifierValidators.validateBic("RBKOXKPR").isValid());
        assertEquals(ViolationKind.LENGTH, IdentifierValidators.validateBic("DEUTDE").violation());
        assertEquals(ViolationKind.LENGTH, IdentifierValidators.validateBic("DEUTDEFF5").violation());
        assertEquals(ViolationKind.CHARSET, IdentifierValidators.validateBic("deutdeff").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateBic("DEU1DEFF").violation());
        assertEquals(ViolationKind.UNKNOWN_CODE, IdentifierValidators.validateBic("DEUTZZFF").violation());
    }

    @Test
    void validatesCurrency() {
        assertTrue(IdentifierValidators.validateCurrency("PLN").isValid());
        assertTrue(IdentifierValidators.validateCurrency("EUR").isValid());
        assertEquals(ViolationKind.UNKNOWN_CODE, IdentifierValidators.validateCurrency("XYZ").violation());
        assertEquals(ViolationKind.CHARSET, IdentifierValidators.validateCurrency("pln").violation());
        assertEquals(ViolationKind.LENGTH, IdentifierValidators.validateCurrency("PL").violation());
    }

    @Test
    void validatesAmountFormat() {
        assertTrue(IdentifierValidators.validateAmount("100.00").isValid());
        assertTrue(IdentifierValidators.validateAmount("0").isValid());
        assertTrue(IdentifierValidators.validateAmount("0.50").isValid());
        assertTrue(IdentifierValidators.validateAmount("-5.00").isValid());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateAmount("100.5").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateAmount("01.00").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateAmount("1.").violation());
        assertEquals(ViolationKind.CHARSET, IdentifierValidators.validateAmount("1,00").violation());
        assertEquals(ViolationKind.MISSING, IdentifierValidators.validateAmount("").violation());
    }

    @Test
    void appliesAmountPolicy() {
        ValidationResult negative = IdentifierValidators.validateAmount("amount", "-5.00", AmountPolicy.nonNegative());
        assertEquals(ViolationKind.RANGE, negative.violation());

        AmountPolicy capped = AmountPolicy.DEFAULT.withMaxMagnitude(new BigDecimal("1000.00"));
        assertTrue(IdentifierValidators.validateAmount("amount", "1000.00", capped).isValid());
        assertEquals(ViolationKind.RANGE, IdentifierValidators.validateAmount("amount", "1000.01", capped).violation());
        assertEquals(ViolationKind.RANGE, IdentifierValidators.validateAmount("amount", "-1000.01", capped).violation());
    }

    @Test
    void validatesEmail() {
        assertTrue(IdentifierValidators.validateEmail("jan.kowalski@example.pl").isValid());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateEmail("no-at-sign").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateEmail("a@b@c").violation());
        assertEquals(ViolationKind.FORMAT, IdentifierValidators.validateEmail("@example.pl").violation());
    }

    @Test
    void orThrowReportsFieldAndKind() {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class,
            () -> IdentifierValidators.validateCurrency("instructedAmount.currency", "XYZ").orThrow());
        assertEquals("instructedAmount.currency", ex.getField());
        assertEquals(ViolationKind.UNKNOWN_CODE, ex.getKind());

        ValidationResult valid = IdentifierValidators.validateCurrency("PLN");
        assertDoesNotThrow(() -> valid.orThrow());
    }
}

package pl.polishapi.sdk.validation;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Pure validators for the financial identifiers carried by PolishAPI requests. Every method is side-effect free and
 * safe to call concurrently; none of them touches the network.
 *
 * <p>Each validator returns a {@link ValidationResult} naming the field and the {@link ViolationKind}, so callers can
 * report exactly which input was rejected and why. Use {@link ValidationResult#orThrow()} to turn a violation into an
 * {@link InvalidIdentifierException}.</p>
 */
public final class IdentifierValidators {

    public static final int IBAN_MIN_LENGTH = 15;
    public static final int IBAN_MAX_LENGTH = 34;

    private static final Pattern AMOUNT = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]{2})?");

    private IdentifierValidators() {
    }

    public static ValidationResult validateIban(String iban) {
        return validateIban("iban", iban);
    }

    /**
     * Validates an IBAN in electronic format (no spaces, uppercase) using the ISO 7064 MOD-97-10 check.
     */
    public static ValidationResult validateIban(String field, String iban) {
        if (iban == null || iban.isEmpty()) {
            return ValidationResult.invalid(field, ViolationKind.MISSING, "IBAN is required");
        }
        int length = iban.length();
        if (length < IBAN_MIN_LENGTH || length > IBAN_MAX_LENGTH) {
            return ValidationResult.invalid(field, ViolationKind.LENGTH,
                "IBAN length must be between " + IBAN_MIN_LENGTH + " and " + IBAN_MAX_LENGTH + " characters");
        }
        if (!isUpperLetter(iban.charAt(0)) || !isUpperLetter(iban.charAt(1))) {
            return ValidationResult.invalid(field, ViolationKind.FORMAT, "IBAN country code must be two uppercase letters");
        }
        if (!isDigit(iban.charAt(2)) || !isDigit(iban.charAt(3))) {
            return ValidationResult.invalid(field, ViolationKind.FORMAT, "IBAN check digits must be two digits");
        }
        for (int i = 4; i < length; i++) {
            char c = iban.charAt(i);
            if (!isUpperLetter(c) && !isDigit(c)) {
                return ValidationResult.invalid(field, ViolationKind.CHARSET,
                    "IBAN must contain only uppercase letters and digits");
            }
        }
        OptionalInt registered = ReferenceData.ibanLength(iban.substring(0, 2));
        if (registered.isPresent() && registered.getAsInt() != length) {
            return ValidationResult.invalid(field, ViolationKind.LENGTH,
                "IBAN for " + iban.substring(0, 2) + " must be " + registered.getAsInt() + " characters");
        }
        if (mod97(iban) != 1) {
            return ValidationResult.invalid(field, ViolationKind.CHECKSUM, "IBAN check digits do not match");
        }
        return ValidationResult.valid(field);
    }

    /**
     * Removes spaces from a printed IBAN and upper-cases it. The result still has to pass {@link #validateIban}.
     */
    public static String normalizeIban(String printed) {
        if (printed == null) {
            return null;
        }
        return printed.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    // Rearranged value: BBAN + country + check digits, letters expanded to 10..35, reduced one symbol at a time
    // so the intermediate remainder never exceeds 9699.
    static int mod97(String iban) {
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        int remainder = 0;
        for (int i = 0; i < rearranged.length(); i++) {
            char c = rearranged.charAt(i);
            if (isDigit(c)) {
                remainder = (remainder * 10 + (c - '0')) % 97;
            } else {
                remainder = (remainder * 100 + (c - 'A' + 10)) % 97;
            }
        }
        return remainder;
    }

    public static ValidationResult validateBic(String bic) {
        return validateBic("bic", bic);
    }

    /**
     * Validates a BIC (ISO 9362): 4-letter bank code, ISO 3166 country code, 2-character location code and an optional
     * 3-character branch code.
     */
    public static ValidationResult validateBic(String field, String bic) {
        if (bic == null || bic.isEmpty()) {
            return ValidationResult.invalid(field, ViolationKind.MISSING, "BIC is required");
        }
        if (bic.length() != 8 && bic.length() != 11) {
            return ValidationResult.invalid(field, ViolationKind.LENGTH, "BIC must be 8 or 11 characters long");
        }
        for (int i = 0; i < bic.length(); i++) {
            char c = bic.charAt(i);
            if (!isUpperLetter(c) && !isDigit(c)) {
                return ValidationResult.invalid(field, ViolationKind.CHARSET,
                    "BIC must contain only uppercase letters and digits");
            }
        }
        for (int i = 0; i < 6; i++) {
            if (!isUpperLetter(bic.charAt(i))) {
                return ValidationResult.invalid(field, ViolationKind.FORMAT,
                    i < 4 ? "BIC bank code must be four letters" : "BIC country code must be two letters");
            }
        }
        String country = bic.substring(4, 6);
        if (!ReferenceData.isCountryCode(country)) {
            return ValidationResult.invalid(field, ViolationKind.UNKNOWN_CODE, "BIC country code " + country + " is not assigned");
        }
        return ValidationResult.valid(field);
    }

    public static ValidationResult validateCurrency(String currency) {
        return validateCurrency("currency", currency);
    }

    /**
     * Validates an ISO 4217 alphabetic code against the bundled table. Matching is case-sensitive.
     */
    public static ValidationResult validateCurrency(String field, String currency) {
        if (currency == null || currency.isEmpty()) {
            return ValidationResult.invalid(field, ViolationKind.MISSING, "currency code is required");
        }
        if (currency.length() != 3) {
            return ValidationResult.invalid(field, ViolationKind.LENGTH, "currency code must be exactly 3 characters");
        }
        for (int i = 0; i < 3; i++) {
            if (!isUpperLetter(currency.charAt(i))) {
                return ValidationResult.invalid(field, ViolationKind.CHARSET, "currency code must be uppercase letters");
            }
        }
        if (!ReferenceData.isCurrencyCode(currency)) {
            return ValidationResult.invalid(field, ViolationKind.UNKNOWN_CODE, currency + " is not an ISO 4217 currency code");
        }
        return ValidationResult.valid(field);
    }

    public static ValidationResult validateAmount(String amount) {
        return validateAmount("amount", amount, AmountPolicy.DEFAULT);
    }

    /**
     * Validates a decimal amount string: optional minus sign, integer part without leading zeros, optional two-digit
     * fraction. Bounds come from {@code policy}.
     */
    public static ValidationResult validateAmount(String field, String amount, AmountPolicy policy) {
        AmountPolicy effective = policy == null ? AmountPolicy.DEFAULT : policy;
        if (amount == null || amount.isEmpty()) {
            return ValidationResult.invalid(field, ViolationKind.MISSING, "amount is required");
        }
        for (int i = 0; i < amount.length(); i++) {
            char c = amount.charAt(i);
            if (!isDigit(c) && c != '.' && c != '-') {
                return ValidationResult.invalid(field, ViolationKind.CHARSET, "amount must contain only digits, '.' and '-'");
            }
        }
        if (!AMOUNT.matcher(amount).matches()) {
            return ValidationResult.invalid(field, ViolationKind.FORMAT,
                "amount must be an integer or have exactly two decimal digits, without leading zeros");
        }
        BigDecimal value = new BigDecimal(amount);
        if (!effective.allowNegative() && value.signum() < 0) {
            return ValidationResult.invalid(field, ViolationKind.RANGE, "amount cannot be negative");
        }
        if (effective.maxMagnitude() != null && value.abs().compareTo(effective.maxMagnitude()) > 0) {
            return ValidationResult.invalid(field, ViolationKind.RANGE,
                "amount exceeds maximum of " + effective.maxMagnitude().toPlainString());
        }
        return ValidationResult.valid(field);
    }

    public static ValidationResult validateEmail(String email) {
        return validateEmail("email", email);
    }

    public static ValidationResult validateEmail(String field, String email) {
        if (email == null || email.isEmpty()) {
            return ValidationResult.invalid(field, ViolationKind.MISSING, "email is required");
        }
        int at = email.indexOf('@');
        if (at < 0 || at != email.lastIndexOf('@')) {
            return ValidationResult.invalid(field, ViolationKind.FORMAT, "email must contain exactly one @ symbol");
        }
        if (at == 0 || at == email.length() - 1) {
            return ValidationResult.invalid(field, ViolationKind.FORMAT, "email local and domain parts cannot be empty");
        }
        return ValidationResult.valid(field);
    }

    private static boolean isUpperLetter(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}

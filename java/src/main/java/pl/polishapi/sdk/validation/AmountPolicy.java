package pl.polishapi.sdk.validation;

import java.math.BigDecimal;

/**
 * Bounds applied by {@link IdentifierValidators#validateAmount(String, String, AmountPolicy)}.
 *
 * @param maxMagnitude  largest accepted absolute value, {@code null} for no ceiling.
 * @param allowNegative whether amounts below zero (reversals, corrections) are accepted.
 */
public record AmountPolicy(BigDecimal maxMagnitude, boolean allowNegative) {

    /** No ceiling, negative amounts permitted. */
    public static final AmountPolicy DEFAULT = new AmountPolicy(null, true);

    public AmountPolicy {
        if (maxMagnitude != null && maxMagnitude.signum() < 0) {
            throw new IllegalArgumentException("maxMagnitude cannot be negative");
        }
    }

    public static AmountPolicy nonNegative() {
        return new AmountPolicy(null, false);
    }

    public AmountPolicy withMaxMagnitude(BigDecimal max) {
        return new AmountPolicy(max, allowNegative);
    }
}

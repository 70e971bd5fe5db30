package com.flagship.payments_engine.money;

import com.flagship.payments_engine.exception.AmountOverflowException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fixed-point monetary value with exactly four fractional digits.
 *
 * The representable range is that of a signed 64-bit count of ten-thousandths.
 * Every factory and arithmetic method checks the range and throws
 * {@link AmountOverflowException} instead of wrapping or rounding.
 *
 * Invariant: {@code value.scale() == SCALE} and {@code MIN <= value <= MAX},
 * which keeps {@link #equals(Object)} consistent with numeric equality.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Amount implements Comparable<Amount> {

    public static final int SCALE = 4;

    public static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE, SCALE);
    public static final BigDecimal MIN = BigDecimal.valueOf(Long.MIN_VALUE, SCALE);

    public static final Amount ZERO = new Amount(BigDecimal.ZERO.setScale(SCALE));

    private static final int MAX_INTEGER_DIGITS = MAX.precision() - MAX.scale();

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    BigDecimal value;

    /**
     * Creates an amount from a decimal value.
     *
     * @throws IllegalArgumentException if the value has more than four significant fractional digits
     * @throws AmountOverflowException if the value is outside the representable range
     */
    public static Amount of(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() == 0) {
            return ZERO;
        }
        // bounds the work setScale has to do for values like 1e200000000
        if (value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            throw new AmountOverflowException(
                String.format("Amount %s is outside the range [%s, %s]", value, MIN.toPlainString(), MAX.toPlainString()));
        }
        BigDecimal stripped = value.scale() > SCALE ? value.stripTrailingZeros() : value;
        if (stripped.scale() > SCALE) {
            throw new IllegalArgumentException(
                String.format("Amount %s has more than %d fractional digits", value, SCALE));
        }
        return checked(stripped.setScale(SCALE, RoundingMode.UNNECESSARY));
    }

    /**
     * Parses a plain decimal string such as {@code "1.5"} or {@code "-0.0001"}.
     * Exponent notation is not accepted.
     *
     * @throws NumberFormatException if the text is not a plain decimal number
     */
    public static Amount parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (!PLAIN_DECIMAL.matcher(trimmed).matches()) {
            throw new NumberFormatException("Not a plain decimal amount: " + text);
        }
        return of(new BigDecimal(trimmed));
    }

    /**
     * Creates an amount from a raw count of ten-thousandths. Always in range.
     */
    public static Amount ofUnits(long units) {
        return new Amount(BigDecimal.valueOf(units, SCALE));
    }

    public Amount add(Amount other) {
        return checked(value.add(other.value));
    }

    public Amount subtract(Amount other) {
        return checked(value.subtract(other.value));
    }

    public Amount negate() {
        return checked(value.negate());
    }

    public Amount abs() {
        return isNegative() ? negate() : this;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Amount other) {
        return value.compareTo(other.value);
    }

    /**
     * Plain representation with all four fractional digits, e.g. {@code 1.5000}.
     */
    @Override
    public String toString() {
        return value.toPlainString();
    }

    private static Amount checked(BigDecimal value) {
        if (value.compareTo(MAX) > 0 || value.compareTo(MIN) < 0) {
            throw new AmountOverflowException(
                String.format("Amount %s is outside the range [%s, %s]",
                    value.toPlainString(), MIN.toPlainString(), MAX.toPlainString()));
        }
        return new Amount(value);
    }
}

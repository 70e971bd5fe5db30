package com.flagship.payments_engine.money;

import com.flagship.payments_engine.exception.AmountOverflowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AmountTest {

    @Test
    @DisplayName("Parsed amounts are normalised to four fractional digits")
    void testParseNormalisesScale() {
        assertEquals("1.5000", Amount.parse("1.5").toString());
        assertEquals("10.0000", Amount.parse("10").toString());
        assertEquals("0.0001", Amount.parse(" 0.0001 ").toString());
        assertEquals(Amount.parse("2.50"), Amount.parse("2.5000"));
    }

    @Test
    @DisplayName("Trailing zeros beyond four digits are accepted, significant digits are not")
    void testFractionalDigits() {
        assertEquals(Amount.parse("1.2345"), Amount.parse("1.234500"));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> Amount.parse("1.23456"));
        assertTrue(exception.getMessage().contains("fractional digits"));
    }

    @Test
    @DisplayName("Non-numeric text is rejected")
    void testParseRejectsGarbage() {
        assertThrows(NumberFormatException.class, () -> Amount.parse("ten"));
        assertThrows(NumberFormatException.class, () -> Amount.parse(""));
    }

    @Test
    @DisplayName("Exponent notation is rejected as text")
    void testParseRejectsExponent() {
        assertThrows(NumberFormatException.class, () -> Amount.parse("1e3"));
        assertThrows(NumberFormatException.class, () -> Amount.parse("1E-2"));
        assertEquals("0.5000", Amount.parse(".5").toString());
        assertEquals("-3.0000", Amount.parse("-3.").toString());
    }

    @Test
    @DisplayName("Huge exponents fail fast instead of expanding the value")
    void testHugeExponentFailsFast() {
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertThrows(NumberFormatException.class, () -> Amount.parse("1e200000000"));
            assertThrows(AmountOverflowException.class, () -> Amount.of(new BigDecimal("1e200000000")));
            assertThrows(AmountOverflowException.class, () -> Amount.of(new BigDecimal("-1e200000000")));
            assertThrows(IllegalArgumentException.class, () -> Amount.of(new BigDecimal("1e-200000000")));
            assertEquals(Amount.ZERO, Amount.of(new BigDecimal("0e200000000")));
        });
        assertEquals(Amount.parse("100"), Amount.of(new BigDecimal("1.00000000E+2")));
    }

    @Test
    @DisplayName("Values outside the 64-bit fixed-point range are rejected")
    void testRangeIsEnforcedOnConstruction() {
        assertEquals(Amount.MAX, Amount.ofUnits(Long.MAX_VALUE).getValue());
        assertEquals("922337203685477.5807", Amount.MAX.toPlainString());

        assertThrows(AmountOverflowException.class, () -> Amount.parse("922337203685477.5808"));
        assertThrows(AmountOverflowException.class, () -> Amount.parse("-922337203685477.5809"));
        assertThrows(AmountOverflowException.class, () -> Amount.of(new BigDecimal("1e20")));
    }

    @Test
    @DisplayName("Arithmetic that leaves the range fails instead of wrapping")
    void testArithmeticOverflow() {
        Amount max = Amount.ofUnits(Long.MAX_VALUE);
        Amount min = Amount.ofUnits(Long.MIN_VALUE);
        Amount unit = Amount.ofUnits(1);

        assertThrows(AmountOverflowException.class, () -> max.add(unit));
        assertThrows(AmountOverflowException.class, () -> min.subtract(unit));
        assertThrows(AmountOverflowException.class, min::negate);
        assertEquals(Amount.ofUnits(Long.MAX_VALUE - 1), max.subtract(unit));
    }

    @Test
    @DisplayName("Arithmetic is exact")
    void testExactArithmetic() {
        Amount a = Amount.parse("0.1");
        Amount b = Amount.parse("0.2");

        assertEquals(Amount.parse("0.3"), a.add(b));
        assertEquals(Amount.parse("-0.1"), a.subtract(b));
        assertEquals(Amount.parse("0.1"), a.subtract(b).abs());
        assertEquals(Amount.parse("-0.2"), b.negate());
    }

    @Test
    @DisplayName("Comparison and sign helpers")
    void testComparison() {
        Amount small = Amount.parse("1.0");
        Amount large = Amount.parse("1.0001");

        assertTrue(small.isLessThan(large));
        assertFalse(large.isLessThan(small));
        assertFalse(small.isLessThan(Amount.parse("1")));
        assertTrue(Amount.parse("-3").isNegative());
        assertTrue(Amount.ZERO.isZero());
        assertFalse(Amount.ZERO.isNegative());
    }
}

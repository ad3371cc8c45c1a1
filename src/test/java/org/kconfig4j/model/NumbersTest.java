package org.kconfig4j.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Parsing of decimal and hexadecimal int/hex values.
 */
public class NumbersTest {

    @Test
    @Tag("unit")
    void decimalAcceptsSignWhitespaceAndUnderscores() {
        assertThat(Numbers.parse(" -1_000 ", 10)).contains(BigInteger.valueOf(-1000));
        assertThat(Numbers.parse("+7", 10)).contains(BigInteger.valueOf(7));
        assertThat(Numbers.parse("1__0", 10)).isEmpty();
        assertThat(Numbers.parse("_1", 10)).isEmpty();
        assertThat(Numbers.parse("0x10", 10)).isEmpty();
    }

    @Test
    @Tag("unit")
    void hexPrefixIsOptional() {
        assertThat(Numbers.parse("0x1F", 16)).contains(BigInteger.valueOf(31));
        assertThat(Numbers.parse("1f", 16)).contains(BigInteger.valueOf(31));
        assertThat(Numbers.parse("0x", 16)).isEmpty();
    }

    @Test
    @Tag("unit")
    void baseZeroDetectsPrefixesAndRejectsLeadingZeros() {
        assertThat(Numbers.parse("0x10", 0)).contains(BigInteger.valueOf(16));
        assertThat(Numbers.parse("0o17", 0)).contains(BigInteger.valueOf(15));
        assertThat(Numbers.parse("0b101", 0)).contains(BigInteger.valueOf(5));
        assertThat(Numbers.parse("000", 0)).contains(BigInteger.ZERO);
        assertThat(Numbers.parse("010", 0)).isEmpty();
    }

    @Test
    @Tag("unit")
    void hexFormattingKeepsTheSignInFront() {
        assertThat(Numbers.toHex(BigInteger.valueOf(255))).isEqualTo("0xff");
        assertThat(Numbers.toHex(BigInteger.valueOf(-31))).isEqualTo("-0x1f");
        assertThat(Numbers.format(BigInteger.TEN, SymbolType.INT)).isEqualTo("10");
        assertThat(Numbers.format(BigInteger.TEN, SymbolType.HEX)).isEqualTo("0xa");
    }

    @Test
    @Tag("unit")
    void nullIsNotANumber() {
        assertThat(Numbers.isNumber(null, 10)).isFalse();
    }
}

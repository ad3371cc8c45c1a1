package org.kconfig4j.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Integer parsing with the leniency Kconfig values are written with: optional sign,
 * surrounding whitespace, digit-group underscores, and base prefixes.
 */
public final class Numbers {

    private Numbers() {}

    /**
     * Parses {@code text} in {@code base}.
     *
     * @param text The text.
     * @param base 10, 16 ({@code 0x} prefix optional), or 0 to detect {@code 0x}, {@code 0o} and
     *             {@code 0b} prefixes (a plain decimal may then not have leading zeros).
     * @return The number, or empty if the text is not a number in that base.
     */
    public static Optional<BigInteger> parse(String text, int base) {
        if (text == null) {
            return Optional.empty();
        }
        String s = text.strip();
        boolean negative = false;
        if (s.startsWith("-") || s.startsWith("+")) {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        int radix = base;
        String lower = s.toLowerCase();
        if (base == 16 && lower.startsWith("0x")) {
            s = s.substring(2);
        } else if (base == 0) {
            if (lower.startsWith("0x")) {
                radix = 16;
                s = s.substring(2);
            } else if (lower.startsWith("0o")) {
                radix = 8;
                s = s.substring(2);
            } else if (lower.startsWith("0b")) {
                radix = 2;
                s = s.substring(2);
            } else {
                radix = 10;
                if (s.length() > 1 && s.startsWith("0") && !s.chars().allMatch(c -> c == '0' || c == '_')) {
                    return Optional.empty();
                }
            }
        }
        if (s.isEmpty() || s.startsWith("_") || s.endsWith("_") || s.contains("__")) {
            return Optional.empty();
        }
        String digits = s.replace("_", "");
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), radix) < 0) {
                return Optional.empty();
            }
        }
        BigInteger value = new BigInteger(digits, radix);
        return Optional.of(negative ? value.negate() : value);
    }

    public static boolean isNumber(String text, int base) {
        return parse(text, base).isPresent();
    }

    /**
     * Formats like Python's {@code hex()}: {@code 0x1f}, {@code -0x1f}.
     */
    public static String toHex(BigInteger value) {
        return value.signum() < 0 ? "-0x" + value.negate().toString(16) : "0x" + value.toString(16);
    }

    /**
     * Formats {@code value} the way a symbol of {@code type} writes it.
     */
    public static String format(BigInteger value, SymbolType type) {
        return type == SymbolType.HEX ? toHex(value) : value.toString();
    }
}

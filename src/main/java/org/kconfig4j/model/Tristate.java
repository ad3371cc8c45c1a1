package org.kconfig4j.model;

import java.util.Optional;

/**
 * The three-valued logic of Kconfig, ordered {@code N < M < Y}.
 */
public enum Tristate {
    N("n"),
    M("m"),
    Y("y");

    private final String text;

    Tristate(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public Tristate min(Tristate other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Tristate max(Tristate other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * Logical negation, {@code 2 - v}. {@code !m} is {@code m}.
     */
    public Tristate not() {
        return values()[2 - ordinal()];
    }

    public boolean isOn() {
        return this != N;
    }

    /**
     * @param text {@code "n"}, {@code "m"} or {@code "y"}.
     * @return The value, or empty for any other text.
     */
    public static Optional<Tristate> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        switch (text) {
            case "n":
                return Optional.of(N);
            case "m":
                return Optional.of(M);
            case "y":
                return Optional.of(Y);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return text;
    }
}

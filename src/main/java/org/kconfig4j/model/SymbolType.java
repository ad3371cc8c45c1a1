package org.kconfig4j.model;

/**
 * Declared type of a symbol or choice.
 */
public enum SymbolType {
    UNKNOWN("unknown", 0),
    BOOL("bool", 0),
    TRISTATE("tristate", 0),
    STRING("string", 0),
    INT("int", 10),
    HEX("hex", 16);

    private final String keyword;
    private final int base;

    SymbolType(String keyword, int base) {
        this.keyword = keyword;
        this.base = base;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return The numeric base values of this type are parsed in. {@code 0} means auto-detect from prefix.
     */
    public int base() {
        return base;
    }

    public boolean isBoolOrTristate() {
        return this == BOOL || this == TRISTATE;
    }

    public boolean isIntOrHex() {
        return this == INT || this == HEX;
    }

    @Override
    public String toString() {
        return keyword;
    }
}

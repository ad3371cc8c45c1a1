package org.kconfig4j.frontend.lexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Kinds of tokens on a Kconfig line.
 */
public enum TokenType {
    // keywords
    ALLNOCONFIG_Y("allnoconfig_y"),
    BOOL("bool", true),
    CHOICE("choice", true),
    COMMENT("comment", true),
    CONFIG("config"),
    DEFAULT("default"),
    DEFCONFIG_LIST("defconfig_list"),
    DEF_BOOL("def_bool"),
    DEF_HEX("def_hex"),
    DEF_INT("def_int"),
    DEF_STRING("def_string"),
    DEF_TRISTATE("def_tristate"),
    DEPENDS("depends"),
    ENDCHOICE("endchoice"),
    ENDIF("endif"),
    ENDMENU("endmenu"),
    ENV("env"),
    HELP("help"),
    HEX("hex", true),
    IF("if"),
    IMPLY("imply"),
    INT("int", true),
    MAINMENU("mainmenu", true),
    MENU("menu", true),
    MENUCONFIG("menuconfig"),
    MODULES("modules"),
    ON("on"),
    OPTION("option"),
    OPTIONAL("optional"),
    ORSOURCE("orsource", true),
    OSOURCE("osource", true),
    PROMPT("prompt", true),
    RANGE("range"),
    RSOURCE("rsource", true),
    SELECT("select"),
    SOURCE("source", true),
    STRING("string", true),
    TRANSITIONAL("transitional"),
    TRISTATE("tristate", true),
    VISIBLE("visible"),

    // operators
    AND("&&"),
    OR("||"),
    NOT("!"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    EQUAL("="),
    UNEQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),

    // values
    /** A symbol reference, including constant symbols from quoted strings and n/m/y. */
    SYMBOL(null),
    /** Plain text: a quoted string in a string context, or an unquoted word in one. */
    TEXT(null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.ordinal() <= VISIBLE.ordinal()) {
                KEYWORDS.put(type.text, type);
            }
        }
        KEYWORDS.put("boolean", BOOL);
        KEYWORDS.put("---help---", HELP);
        KEYWORDS.put("gsource", OSOURCE);
        KEYWORDS.put("grsource", ORSOURCE);
    }

    private final String text;
    private final boolean stringLex;

    TokenType(String text) {
        this(text, false);
    }

    TokenType(String text, boolean stringLex) {
        this.text = text;
        this.stringLex = stringLex;
    }

    public String text() {
        return text;
    }

    /**
     * @return Whether a bare word after this token is a string (e.g. an unquoted prompt) rather
     *     than a symbol reference.
     */
    public boolean isStringLex() {
        return stringLex;
    }

    public boolean isSource() {
        return this == SOURCE || this == RSOURCE || this == OSOURCE || this == ORSOURCE;
    }

    public boolean isRelativeSource() {
        return this == RSOURCE || this == ORSOURCE;
    }

    public boolean isObligatorySource() {
        return this == SOURCE || this == RSOURCE;
    }

    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}

package org.kconfig4j.model.expr;

/**
 * Comparison operators.
 */
public enum Relation {
    EQUAL("="),
    UNEQUAL("!="),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">=");

    private final String operator;

    Relation(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }

    /**
     * @param comparison Negative, zero or positive, like {@link Comparable#compareTo}.
     */
    public boolean holds(int comparison) {
        switch (this) {
            case EQUAL:
                return comparison == 0;
            case UNEQUAL:
                return comparison != 0;
            case LESS:
                return comparison < 0;
            case LESS_EQUAL:
                return comparison <= 0;
            case GREATER:
                return comparison > 0;
            default:
                return comparison >= 0;
        }
    }
}

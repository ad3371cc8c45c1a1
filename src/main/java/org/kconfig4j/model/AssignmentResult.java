package org.kconfig4j.model;

/**
 * Outcome of assigning a user value.
 */
public enum AssignmentResult {
    /** The value was stored. */
    ASSIGNED,
    /** The symbol already had this user value. */
    UNCHANGED,
    /** The value does not fit the type; nothing changed. */
    INVALID_VALUE,
    /** An int/hex value outside the active range; the previous user value was kept. */
    OUT_OF_RANGE,
    /** The value was stored, but the symbol has no prompt so it has no effect. */
    NO_PROMPT,
    /** The assignment named a symbol that is not defined. */
    UNDEFINED;

    /**
     * @return Whether the user value now equals the assigned one.
     */
    public boolean isStored() {
        return this == ASSIGNED || this == UNCHANGED || this == NO_PROMPT;
    }
}

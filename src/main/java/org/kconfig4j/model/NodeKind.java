package org.kconfig4j.model;

/**
 * What a {@link MenuNode} stands for.
 */
public enum NodeKind {
    SYMBOL,
    CHOICE,
    MENU,
    COMMENT,
    /** An {@code if} block. Removed from the tree during finalization. */
    IF
}

package org.kconfig4j.model;

import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.model.expr.Expr;

/**
 * A {@code default} (or {@code def_*}) property.
 *
 * @param value     The default value. Must be a single symbol for string/int/hex symbols and choices.
 * @param condition The condition, with inherited dependencies after finalization.
 * @param location  Where the property was written.
 */
public record DefaultProperty(Expr value, Expr condition, SourceLocation location) {

    public DefaultProperty withCondition(Expr newCondition) {
        return new DefaultProperty(value, newCondition, location);
    }
}

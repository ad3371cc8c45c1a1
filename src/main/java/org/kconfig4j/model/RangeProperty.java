package org.kconfig4j.model;

import org.kconfig4j.model.expr.Expr;

/**
 * A {@code range LOW HIGH [if COND]} property of an int or hex symbol.
 */
public record RangeProperty(Symbol low, Symbol high, Expr condition) {

    public RangeProperty withCondition(Expr newCondition) {
        return new RangeProperty(low, high, newCondition);
    }
}

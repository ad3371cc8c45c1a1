package org.kconfig4j.model;

import org.kconfig4j.model.expr.Expr;

/**
 * A {@code select} or {@code imply} property.
 */
public record SelectProperty(Symbol target, Expr condition) {

    public SelectProperty withCondition(Expr newCondition) {
        return new SelectProperty(target, newCondition);
    }
}

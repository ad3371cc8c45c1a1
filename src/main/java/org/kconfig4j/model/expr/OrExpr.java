package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Tristate;

import java.util.Set;

public record OrExpr(Expr left, Expr right) implements Expr {

    @Override
    public Tristate value() {
        Tristate l = left.value();
        if (l == Tristate.Y) {
            return Tristate.Y;
        }
        return l.max(right.value());
    }

    @Override
    public void collectItems(Set<ConfigItem> out) {
        left.collectItems(out);
        right.collectItems(out);
    }

    @Override
    public String toString() {
        return Expressions.format(this);
    }
}

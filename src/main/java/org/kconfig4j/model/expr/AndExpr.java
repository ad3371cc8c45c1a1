package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Tristate;

import java.util.Set;

public record AndExpr(Expr left, Expr right) implements Expr {

    @Override
    public Tristate value() {
        Tristate l = left.value();
        if (l == Tristate.N) {
            return Tristate.N;
        }
        return l.min(right.value());
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

package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Tristate;

import java.util.Set;

public record NotExpr(Expr operand) implements Expr {

    @Override
    public Tristate value() {
        return operand.value().not();
    }

    @Override
    public void collectItems(Set<ConfigItem> out) {
        operand.collectItems(out);
    }

    @Override
    public String toString() {
        return Expressions.format(this);
    }
}

package org.kconfig4j.model.expr;

import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Tristate;

import java.util.Set;

/**
 * A choice used as an expression, evaluating to the choice mode. Appears in the propagated
 * dependencies of choice members.
 */
public record ChoiceExpr(Choice choice) implements Expr {

    @Override
    public Tristate value() {
        return choice.triValue();
    }

    @Override
    public void collectItems(Set<ConfigItem> out) {
        out.add(choice);
    }

    @Override
    public String toString() {
        return Expressions.format(this);
    }
}

package org.kconfig4j.model;

import org.kconfig4j.model.expr.Expr;

/**
 * A prompt and the condition under which it is shown.
 */
public record PromptProperty(String text, Expr condition) {

    public PromptProperty withCondition(Expr newCondition) {
        return new PromptProperty(text, newCondition);
    }
}

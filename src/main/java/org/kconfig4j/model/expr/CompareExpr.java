package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;

/**
 * A comparison between two symbols. Two string symbols compare lexicographically; anything else
 * compares numerically (bool/tristate as 0/1/2) and falls back to lexicographic order when an
 * operand is not a number.
 */
public record CompareExpr(Relation relation, Symbol left, Symbol right) implements Expr {

    @Override
    public Tristate value() {
        int comparison;
        if (left.getOrigType() == SymbolType.STRING && right.getOrigType() == SymbolType.STRING) {
            comparison = left.strValue().compareTo(right.strValue());
        } else {
            Optional<BigInteger> l = left.numericValue();
            Optional<BigInteger> r = right.numericValue();
            if (l.isPresent() && r.isPresent()) {
                comparison = l.get().compareTo(r.get());
            } else {
                comparison = left.strValue().compareTo(right.strValue());
            }
        }
        return relation.holds(comparison) ? Tristate.Y : Tristate.N;
    }

    @Override
    public void collectItems(Set<ConfigItem> out) {
        out.add(left);
        out.add(right);
    }

    @Override
    public String toString() {
        return Expressions.format(this);
    }
}

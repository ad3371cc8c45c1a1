package org.kconfig4j.model;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.model.expr.ChoiceExpr;
import org.kconfig4j.model.expr.Expressions;
import org.kconfig4j.model.expr.SymbolExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code choice} block. Its mode ({@code y}, {@code m} or {@code n}) is its tristate value; in
 * {@code y} mode exactly one member symbol is selected. Named choices may be defined in several places.
 */
public final class Choice extends ConfigItem {

    private final ChoiceExpr expr;
    private final List<Symbol> members = new ArrayList<>();
    private boolean optional;

    private Tristate userValue;
    private Symbol userSelection;

    private Tristate cachedTri;
    private Symbol cachedSelection;
    private boolean selectionCached;

    public Choice(ResolutionContext context, String name) {
        super(context, name);
        this.expr = new ChoiceExpr(this);
    }

    public ChoiceExpr expr() {
        return expr;
    }

    @Override
    public SymbolType type() {
        if (origType == SymbolType.TRISTATE && context.getModules().triValue() == Tristate.N) {
            return SymbolType.BOOL;
        }
        return origType;
    }

    /**
     * @return The choice mode.
     */
    @Override
    public Tristate triValue() {
        if (cachedTri == null) {
            Tristate val = optional ? Tristate.N : Tristate.M;
            if (userValue != null) {
                val = val.max(userValue);
            }
            val = val.min(visibility());
            cachedTri = val == Tristate.M && type() == SymbolType.BOOL ? Tristate.Y : val;
        }
        return cachedTri;
    }

    @Override
    public String strValue() {
        return triValue().text();
    }

    /**
     * @return The selected member, or {@code null} when the choice is not in {@code y} mode or no
     *     member is visible. A visible user selection wins over defaults; without a matching default
     *     the first visible member is selected.
     */
    public Symbol selection() {
        if (!selectionCached) {
            cachedSelection = computeSelection();
            selectionCached = true;
        }
        return cachedSelection;
    }

    private Symbol computeSelection() {
        if (triValue() != Tristate.Y) {
            return null;
        }
        if (userSelection != null && userSelection.visibility() != Tristate.N) {
            return userSelection;
        }
        return selectionFromDefaults();
    }

    /**
     * @return The member the defaults select, ignoring any user selection.
     */
    public Symbol selectionFromDefaults() {
        for (DefaultProperty d : defaults) {
            Symbol sym = defaultTarget(d);
            if (sym != null && d.condition().value() != Tristate.N && sym.visibility() != Tristate.N) {
                return sym;
            }
        }
        for (Symbol sym : members) {
            if (sym.visibility() != Tristate.N) {
                return sym;
            }
        }
        return null;
    }

    SourceLocation selectionDefaultLocation() {
        for (DefaultProperty d : defaults) {
            Symbol sym = defaultTarget(d);
            if (sym != null && d.condition().value() != Tristate.N && sym.visibility() != Tristate.N) {
                return d.location();
            }
        }
        return null;
    }

    private static Symbol defaultTarget(DefaultProperty d) {
        return d.value() instanceof SymbolExpr s ? s.symbol() : null;
    }

    @Override
    protected List<Tristate> computeAssignable() {
        Tristate vis = visibility();
        if (vis == Tristate.N) {
            return List.of();
        }
        boolean bool = type() == SymbolType.BOOL;
        if (vis == Tristate.Y) {
            if (!optional) {
                return bool ? List.of(Tristate.Y) : List.of(Tristate.M, Tristate.Y);
            }
            return bool ? List.of(Tristate.N, Tristate.Y) : List.of(Tristate.N, Tristate.M, Tristate.Y);
        }
        return optional ? List.of(Tristate.N, Tristate.M) : List.of(Tristate.M);
    }

    public AssignmentResult setValue(String value) {
        return Tristate.fromText(value)
                .map(this::setValue)
                .orElseGet(() -> {
                    warnInvalid("'" + value + "'");
                    return AssignmentResult.INVALID_VALUE;
                });
    }

    /**
     * Sets the user mode.
     *
     * @return {@link AssignmentResult#INVALID_VALUE} for {@code m} on a bool choice.
     */
    public AssignmentResult setValue(Tristate value) {
        if (value == userValue) {
            wasSet = true;
            return AssignmentResult.UNCHANGED;
        }
        if (origType == SymbolType.BOOL ? value == Tristate.M : origType != SymbolType.TRISTATE) {
            warnInvalid(value.text());
            return AssignmentResult.INVALID_VALUE;
        }
        userValue = value;
        wasSet = true;
        recursiveInvalidate();
        return AssignmentResult.ASSIGNED;
    }

    private void warnInvalid(String shown) {
        context.getDiagnostics().reportWarning(DiagnosticKind.GENERAL, "the value " + shown + " is invalid for "
                + nameAndLocation() + ", which has type " + origType + " -- assignment ignored");
    }

    /**
     * Removes the user mode and the user selection.
     */
    public void unsetValue() {
        if (userValue != null || userSelection != null) {
            userValue = null;
            userSelection = null;
            recursiveInvalidate();
        }
    }

    @Override
    protected void invalidate() {
        cachedTri = null;
        cachedVisibility = null;
        cachedAssignable = null;
        cachedSelection = null;
        selectionCached = false;
    }

    public List<Symbol> getMembers() {
        return members;
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    public Tristate getUserValue() {
        return userValue;
    }

    public Symbol getUserSelection() {
        return userSelection;
    }

    void setUserSelection(Symbol userSelection) {
        this.userSelection = userSelection;
    }

    @Override
    public String nameAndLocation() {
        return (name != null ? "<choice " + name + ">" : "<choice>") + " " + locations();
    }

    @Override
    public String describe() {
        List<String> fields = new ArrayList<>();
        fields.add(name != null ? "choice " + name : "choice");
        fields.add(type().toString());
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                fields.add("\"" + node.getPrompt().text() + "\"");
            }
        }
        fields.add("mode " + triValue().text());
        if (userValue != null) {
            fields.add("user mode " + userValue.text());
        }
        Symbol selected = selection();
        if (selected != null) {
            fields.add(selected.getName() + " selected");
        }
        if (userSelection != null) {
            String text = userSelection.getName() + " selected by user";
            if (selected != userSelection) {
                text += " (overridden)";
            }
            fields.add(text);
        }
        fields.add("visibility " + visibility().text());
        if (optional) {
            fields.add("optional");
        }
        for (MenuNode node : nodes) {
            fields.add(node.getLocation().toString());
        }
        return "<" + String.join(", ", fields) + ">";
    }

    @Override
    public String toString() {
        return customString(Expressions::standardItemString);
    }
}

package org.kconfig4j.model;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.model.expr.AndExpr;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;
import org.kconfig4j.model.expr.OrExpr;
import org.kconfig4j.model.expr.SymbolExpr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A configuration symbol. Undefined symbols (referenced but never defined) and constant symbols
 * (quoted strings, numbers, {@code n}/{@code m}/{@code y}) are symbols too; undefined and constant
 * non-tristate symbols evaluate to their own name as string value and to {@code n}.
 * <p>
 * Values are computed lazily and cached until an assignment invalidates them.
 */
public final class Symbol extends ConfigItem {

    /**
     * The int/hex range currently in force.
     */
    public record ActiveRange(BigInteger low, BigInteger high) {

        public boolean contains(BigInteger value) {
            return low.compareTo(value) <= 0 && value.compareTo(high) <= 0;
        }
    }

    private final boolean constant;
    private final SymbolExpr expr;

    private Expr revDep;
    private Expr weakRevDep;
    private final List<SelectProperty> selects = new ArrayList<>();
    private final List<SelectProperty> implies = new ArrayList<>();
    private final List<RangeProperty> ranges = new ArrayList<>();

    private String userValue;
    private String userLabel;
    private Choice choice;
    private String envVar;
    private boolean allnoconfigY;
    private boolean transitional;

    private String cachedStr;
    private Tristate cachedTri;
    private ValueOrigin cachedOrigin;
    private boolean writeToConfig;

    public Symbol(ResolutionContext context, String name, boolean constant) {
        super(context, name);
        this.constant = constant;
        this.expr = new SymbolExpr(this);
        this.revDep = context.n();
        this.weakRevDep = context.n();
    }

    /**
     * @return The shared expression leaf for this symbol.
     */
    public SymbolExpr expr() {
        return expr;
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isDefined() {
        return !nodes.isEmpty();
    }

    @Override
    public SymbolType type() {
        if (origType == SymbolType.TRISTATE
                && ((choice != null && choice.triValue() == Tristate.Y)
                || context.getModules().triValue() == Tristate.N)) {
            return SymbolType.BOOL;
        }
        return origType;
    }

    // ---- values ----

    @Override
    public Tristate triValue() {
        if (constant && origType == SymbolType.TRISTATE) {
            return Tristate.fromText(name).orElse(Tristate.N);
        }
        if (cachedTri != null) {
            return cachedTri;
        }
        if (!origType.isBoolOrTristate()) {
            if (origType != SymbolType.UNKNOWN) {
                warn("The " + origType + " symbol " + nameAndLocation()
                        + " is being evaluated in a logical context somewhere. It will always evaluate to n.");
            }
            cachedTri = Tristate.N;
            return cachedTri;
        }

        Tristate vis = visibility();
        writeToConfig = vis != Tristate.N;
        Tristate val = Tristate.N;
        ValueOrigin origin = ValueOrigin.UNSET;

        if (choice == null) {
            if (vis != Tristate.N && userValue != null) {
                val = userTristate().min(vis);
                origin = new ValueOrigin.Assign(userLabel);
            } else {
                for (DefaultProperty d : defaults) {
                    Tristate condVal = d.condition().value();
                    if (condVal != Tristate.N) {
                        val = d.value().value().min(condVal);
                        if (val != Tristate.N) {
                            writeToConfig = true;
                        }
                        origin = new ValueOrigin.Default(d.location());
                        break;
                    }
                }
                // implies only count when the direct dependencies are met
                Tristate weak = weakRevDep.value();
                if (weak != Tristate.N && directDep.value() != Tristate.N) {
                    if (weak.compareTo(val) > 0) {
                        origin = new ValueOrigin.Imply(activeSources(weakRevDep));
                    }
                    val = val.max(weak);
                    writeToConfig = true;
                }
            }

            Tristate rev = revDep.value();
            if (rev != Tristate.N) {
                if (directDep.value().compareTo(rev) < 0) {
                    warnSelectUnsatisfiedDeps();
                }
                if (rev.compareTo(val) > 0) {
                    origin = new ValueOrigin.Select(activeSources(revDep));
                }
                val = val.max(rev);
                writeToConfig = true;
            }

            if (val == Tristate.M && (type() == SymbolType.BOOL || weakRevDep.value() == Tristate.Y)) {
                val = Tristate.Y;
            }
        } else if (vis == Tristate.Y) {
            val = choice.selection() == this ? Tristate.Y : Tristate.N;
            if (val == Tristate.Y) {
                origin = choice.getUserSelection() == this
                        ? new ValueOrigin.Assign(userLabel)
                        : new ValueOrigin.Default(choice.selectionDefaultLocation());
            }
        } else if (vis != Tristate.N && userValue != null && userTristate() != Tristate.N) {
            val = Tristate.M;
            origin = new ValueOrigin.Assign(userLabel);
        }

        cachedTri = val;
        cachedOrigin = origin;
        return val;
    }

    @Override
    public String strValue() {
        if (cachedStr != null) {
            return cachedStr;
        }
        if (origType.isBoolOrTristate()) {
            cachedStr = triValue().text();
            return cachedStr;
        }
        if (origType == SymbolType.UNKNOWN) {
            cachedStr = name;
            return cachedStr;
        }

        String val = "";
        Tristate vis = visibility();
        writeToConfig = vis != Tristate.N;
        ValueOrigin origin = ValueOrigin.UNSET;

        if (origType.isIntOrHex()) {
            int base = origType.base();
            Optional<ActiveRange> range = activeRange();
            boolean useDefaults = true;

            if (vis != Tristate.N && userValue != null) {
                BigInteger user = Numbers.parse(userValue, base).orElse(BigInteger.ZERO);
                if (range.isPresent() && !range.get().contains(user)) {
                    warnOnRange("user value " + userValue + " on the " + origType + " symbol " + nameAndLocation()
                            + " ignored due to being outside the active range (["
                            + Numbers.format(range.get().low(), origType) + ", "
                            + Numbers.format(range.get().high(), origType) + "]) -- falling back on defaults");
                } else {
                    val = userValue;
                    useDefaults = false;
                    origin = new ValueOrigin.Assign(userLabel);
                }
            }

            if (useDefaults) {
                BigInteger number = BigInteger.ZERO;
                boolean hasDefault = false;
                for (DefaultProperty d : defaults) {
                    if (d.condition().value() != Tristate.N) {
                        hasDefault = true;
                        writeToConfig = true;
                        val = defaultText(d);
                        number = Numbers.parse(val, base).orElse(BigInteger.ZERO);
                        origin = new ValueOrigin.Default(d.location());
                        break;
                    }
                }

                // clamping applies even without a default
                if (range.isPresent()) {
                    BigInteger clamp = null;
                    if (number.compareTo(range.get().low()) < 0) {
                        clamp = range.get().low();
                    } else if (number.compareTo(range.get().high()) > 0) {
                        clamp = range.get().high();
                    }
                    if (clamp != null) {
                        val = Numbers.format(clamp, origType);
                        if (hasDefault) {
                            warnOnRange("default value " + number + " on " + nameAndLocation() + " clamped to "
                                    + Numbers.format(clamp, origType) + " due to being outside the active range (["
                                    + Numbers.format(range.get().low(), origType) + ", "
                                    + Numbers.format(range.get().high(), origType) + "])");
                        }
                    }
                }
            }
        } else {
            if (vis != Tristate.N && userValue != null) {
                val = userValue;
                origin = new ValueOrigin.Assign(userLabel);
            } else {
                for (DefaultProperty d : defaults) {
                    if (d.condition().value() != Tristate.N) {
                        val = defaultText(d);
                        writeToConfig = true;
                        origin = new ValueOrigin.Default(d.location());
                        break;
                    }
                }
            }
        }

        if (envVar != null || this == context.getDefconfigList()) {
            writeToConfig = false;
        }
        cachedStr = val;
        cachedOrigin = origin;
        return val;
    }

    private static String defaultText(DefaultProperty d) {
        if (d.value() instanceof SymbolExpr s) {
            return s.symbol().strValue();
        }
        return d.value().value().text();
    }

    /**
     * @return The first range whose condition holds, with non-numeric bounds read as 0.
     */
    public Optional<ActiveRange> activeRange() {
        if (!origType.isIntOrHex()) {
            return Optional.empty();
        }
        int base = origType.base();
        for (RangeProperty r : ranges) {
            if (r.condition().value() != Tristate.N) {
                BigInteger low = Numbers.parse(r.low().strValue(), base).orElse(BigInteger.ZERO);
                BigInteger high = Numbers.parse(r.high().strValue(), base).orElse(BigInteger.ZERO);
                return Optional.of(new ActiveRange(low, high));
            }
        }
        return Optional.empty();
    }

    /**
     * @return The value as a number for comparisons: 0/1/2 for bool/tristate, otherwise the string
     *     value parsed in the type's base. Empty when it does not parse.
     */
    public Optional<BigInteger> numericValue() {
        if (origType.isBoolOrTristate()) {
            return Optional.of(BigInteger.valueOf(triValue().ordinal()));
        }
        return Numbers.parse(strValue(), origType.base());
    }

    /**
     * @return Where the current value comes from.
     */
    public ValueOrigin origin() {
        if (origType.isBoolOrTristate()) {
            triValue();
        } else {
            strValue();
        }
        return cachedOrigin != null ? cachedOrigin : ValueOrigin.UNSET;
    }

    /**
     * @return Whether the symbol is written to configuration files with its current value.
     */
    public boolean isWrittenToConfig() {
        strValue();
        return writeToConfig;
    }

    /**
     * @return The symbol's line in a {@code .config} file, or {@code ""} if it is not written.
     */
    public String configString() {
        String val = strValue();
        if (!writeToConfig) {
            return "";
        }
        String prefix = context.getConfigPrefix();
        if (origType.isBoolOrTristate()) {
            return !val.equals("n")
                    ? prefix + name + "=" + val + "\n"
                    : "# " + prefix + name + " is not set\n";
        }
        if (origType.isIntOrHex()) {
            return prefix + name + "=" + val + "\n";
        }
        return prefix + name + "=\"" + StringEscapes.escape(val) + "\"\n";
    }

    /**
     * @return The value the symbol would get from its defaults, selects and implies alone,
     *     ignoring any user value. Used to decide what a minimal configuration must record.
     */
    public String defaultValueString() {
        if (origType.isBoolOrTristate()) {
            Tristate val = Tristate.N;
            // defaults, selects and implies do not affect choice members
            if (choice == null) {
                for (DefaultProperty d : defaults) {
                    Tristate condVal = d.condition().value();
                    if (condVal != Tristate.N) {
                        val = d.value().value().min(condVal);
                        break;
                    }
                }
                val = val.max(revDep.value()).max(weakRevDep.value());
                if (val == Tristate.M && type() == SymbolType.BOOL) {
                    val = Tristate.Y;
                }
            }
            return val.text();
        }
        if (origType != SymbolType.UNKNOWN) {
            for (DefaultProperty d : defaults) {
                if (d.condition().value() != Tristate.N) {
                    return defaultText(d);
                }
            }
        }
        return "";
    }

    @Override
    protected Tristate restrictVisibility(Tristate vis) {
        if (choice != null) {
            if (choice.getOrigType() == SymbolType.TRISTATE && origType != SymbolType.TRISTATE
                    && choice.triValue() != Tristate.Y) {
                // non-tristate members only show in y mode
                return Tristate.N;
            }
            if (origType == SymbolType.TRISTATE && vis == Tristate.M && choice.triValue() == Tristate.Y) {
                return Tristate.N;
            }
        }
        return vis;
    }

    @Override
    protected List<Tristate> computeAssignable() {
        if (!origType.isBoolOrTristate()) {
            return List.of();
        }
        Tristate vis = visibility();
        if (vis == Tristate.N) {
            return List.of();
        }
        Tristate rev = revDep.value();
        boolean boolLike = type() == SymbolType.BOOL || weakRevDep.value() == Tristate.Y;
        if (vis == Tristate.Y) {
            if (choice != null) {
                return List.of(Tristate.Y);
            }
            if (rev == Tristate.N) {
                return boolLike ? List.of(Tristate.N, Tristate.Y) : List.of(Tristate.N, Tristate.M, Tristate.Y);
            }
            if (rev == Tristate.Y) {
                return List.of(Tristate.Y);
            }
            return boolLike ? List.of(Tristate.Y) : List.of(Tristate.M, Tristate.Y);
        }
        // m visibility, so this is a tristate
        if (rev == Tristate.N) {
            return weakRevDep.value() != Tristate.Y
                    ? List.of(Tristate.N, Tristate.M)
                    : List.of(Tristate.N, Tristate.Y);
        }
        if (rev == Tristate.Y) {
            return List.of(Tristate.Y);
        }
        return List.of(Tristate.M);
    }

    // ---- assignment ----

    public AssignmentResult setValue(String value) {
        return setValue(value, null);
    }

    public AssignmentResult setValue(Tristate value) {
        return setValue(value.text(), null);
    }

    /**
     * Assigns a user value.
     * <p>
     * Bool and tristate symbols take {@code n}/{@code m}/{@code y}; bool rejects {@code m}. Int values
     * must be decimal, hex values hexadecimal and non-negative. An int/hex value outside the range
     * in force is rejected and the previous user value stays. Setting a choice member to {@code y}
     * makes it the choice's user selection.
     *
     * @param value The value.
     * @param label Where the value came from, kept for {@link #origin()}. May be {@code null}.
     * @return The outcome.
     */
    public AssignmentResult setValue(String value, String label) {
        Tristate tri = origType.isBoolOrTristate() ? Tristate.fromText(value).orElse(null) : null;

        // choice members always go through, since y may change the choice selection
        if (Objects.equals(value, userValue) && choice == null) {
            wasSet = true;
            userLabel = label;
            return AssignmentResult.UNCHANGED;
        }

        if (!isValidUserValue(value, tri)) {
            warn("the value " + (tri != null ? tri.text() : "'" + value + "'") + " is invalid for "
                    + nameAndLocation() + ", which has type " + origType + " -- assignment ignored");
            return AssignmentResult.INVALID_VALUE;
        }

        if (origType.isIntOrHex()) {
            BigInteger number = Numbers.parse(value, origType.base()).orElse(BigInteger.ZERO);
            Optional<ActiveRange> range = activeRange();
            if (range.isPresent() && !range.get().contains(number)) {
                context.getDiagnostics().reportError(DiagnosticKind.RANGE, "the value " + value + " is outside the "
                        + "active range ([" + Numbers.format(range.get().low(), origType) + ", "
                        + Numbers.format(range.get().high(), origType) + "]) of " + nameAndLocation()
                        + " -- assignment ignored", null);
                return AssignmentResult.OUT_OF_RANGE;
            }
        }

        userValue = value;
        userLabel = label;
        wasSet = true;

        if (choice != null && tri == Tristate.Y) {
            choice.setUserSelection(this);
            choice.setWasSet(true);
            choice.recursiveInvalidate();
            return AssignmentResult.ASSIGNED;
        }
        return invalidateIfHasPrompt() ? AssignmentResult.ASSIGNED : AssignmentResult.NO_PROMPT;
    }

    private boolean isValidUserValue(String value, Tristate tri) {
        if (value == null) {
            return false;
        }
        switch (origType) {
            case BOOL:
                return tri == Tristate.N || tri == Tristate.Y;
            case TRISTATE:
                return tri != null;
            case STRING:
                return true;
            case INT:
                return Numbers.isNumber(value, 10);
            case HEX:
                return Numbers.parse(value, 16).map(n -> n.signum() >= 0).orElse(false);
            default:
                return false;
        }
    }

    /**
     * Removes the user value.
     */
    public void unsetValue() {
        if (userValue != null) {
            userValue = null;
            userLabel = null;
            invalidateIfHasPrompt();
        }
    }

    private boolean invalidateIfHasPrompt() {
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                recursiveInvalidate();
                return true;
            }
        }
        if (context.isWarnAssignNoPrompt()) {
            warn(nameAndLocation() + " has no prompt, meaning user values have no effect on it");
        }
        return false;
    }

    @Override
    protected void invalidate() {
        cachedStr = null;
        cachedTri = null;
        cachedVisibility = null;
        cachedAssignable = null;
        cachedOrigin = null;
    }

    private Tristate userTristate() {
        return Tristate.fromText(userValue).orElse(Tristate.N);
    }

    // ---- diagnostics ----

    private void warn(String message) {
        context.getDiagnostics().reportWarning(DiagnosticKind.GENERAL, message);
    }

    private void warnOnRange(String message) {
        context.getDiagnostics().reportWarning(DiagnosticKind.RANGE, message);
    }

    private void warnSelectUnsatisfiedDeps() {
        StringBuilder msg = new StringBuilder()
                .append(nameAndLocation()).append(" has direct dependencies ")
                .append(Expressions.format(directDep)).append(" with value ")
                .append(directDep.value().text()).append(", but is currently being ")
                .append(revDep.value().text()).append("-selected by the following symbols:");
        Tristate direct = directDep.value();
        for (Expr select : Expressions.split(revDep, OrExpr.class)) {
            if (select.value().compareTo(direct) <= 0) {
                continue;
            }
            Symbol selector = selectingSymbol(select);
            if (selector == null) {
                continue;
            }
            msg.append("\n - ").append(selector.nameAndLocation())
                    .append(", with value ").append(selector.strValue())
                    .append(", direct dependencies ").append(Expressions.format(selector.getDirectDep()))
                    .append(" (value: ").append(selector.getDirectDep().value().text()).append(")");
            if (select instanceof AndExpr and) {
                msg.append(", and select condition ").append(Expressions.format(and.right()))
                        .append(" (value: ").append(and.right().value().text()).append(")");
            }
        }
        context.getDiagnostics().reportWarning(DiagnosticKind.GENERAL, msg.toString());
    }

    /**
     * Reverse dependencies are ORs of {@code SELECTOR} or {@code SELECTOR && COND} terms.
     */
    private static Symbol selectingSymbol(Expr term) {
        Expr first = term instanceof AndExpr and ? and.left() : term;
        return first instanceof SymbolExpr s ? s.symbol() : null;
    }

    private static List<Symbol> activeSources(Expr reverseDep) {
        List<Symbol> sources = new ArrayList<>();
        for (Expr term : Expressions.split(reverseDep, OrExpr.class)) {
            Symbol s = selectingSymbol(term);
            if (s != null && term.value() != Tristate.N) {
                sources.add(s);
            }
        }
        return sources;
    }

    // ---- accessors ----

    public Expr getRevDep() {
        return revDep;
    }

    public void setRevDep(Expr revDep) {
        this.revDep = revDep;
    }

    public Expr getWeakRevDep() {
        return weakRevDep;
    }

    public void setWeakRevDep(Expr weakRevDep) {
        this.weakRevDep = weakRevDep;
    }

    public List<SelectProperty> getSelects() {
        return selects;
    }

    public List<SelectProperty> getImplies() {
        return implies;
    }

    public List<RangeProperty> getRanges() {
        return ranges;
    }

    /**
     * @return The user value as assigned ({@code "n"}/{@code "m"}/{@code "y"} for bool/tristate), or {@code null}.
     */
    public String getUserValue() {
        return userValue;
    }

    public String getUserLabel() {
        return userLabel;
    }

    public Choice getChoice() {
        return choice;
    }

    public void setChoice(Choice choice) {
        this.choice = choice;
    }

    public String getEnvVar() {
        return envVar;
    }

    public void setEnvVar(String envVar) {
        this.envVar = envVar;
    }

    public boolean isAllnoconfigY() {
        return allnoconfigY;
    }

    public void setAllnoconfigY(boolean allnoconfigY) {
        this.allnoconfigY = allnoconfigY;
    }

    public boolean isTransitional() {
        return transitional;
    }

    public void setTransitional(boolean transitional) {
        this.transitional = transitional;
    }

    // ---- printing ----

    @Override
    public String nameAndLocation() {
        return name + " " + locations();
    }

    @Override
    public String describe() {
        List<String> fields = new ArrayList<>();
        fields.add("symbol " + name);
        fields.add(type().toString());
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                fields.add("\"" + node.getPrompt().text() + "\"");
            }
        }
        boolean quoted = !origType.isBoolOrTristate();
        fields.add("value " + (quoted ? "\"" + strValue() + "\"" : strValue()));
        if (!constant) {
            if (userValue != null) {
                fields.add("user value " + (quoted ? "\"" + userValue + "\"" : userValue));
            }
            fields.add("visibility " + visibility().text());
            if (choice != null) {
                fields.add("choice symbol");
            }
            if (allnoconfigY) {
                fields.add("allnoconfig_y flag");
            }
            if (this == context.getDefconfigList()) {
                fields.add("is the defconfig_list symbol");
            }
            if (envVar != null) {
                fields.add("from environment variable " + envVar);
            }
            if (this == context.getModules()) {
                fields.add("is the modules symbol");
            }
            if (transitional) {
                fields.add("transitional");
            }
            fields.add("direct deps " + directDep.value().text());
        }
        if (!nodes.isEmpty()) {
            for (MenuNode node : nodes) {
                fields.add(node.getLocation().toString());
            }
        } else {
            fields.add(constant ? "constant" : "undefined");
        }
        return "<" + String.join(", ", fields) + ">";
    }

    @Override
    public String toString() {
        return customString(Expressions::standardItemString);
    }
}

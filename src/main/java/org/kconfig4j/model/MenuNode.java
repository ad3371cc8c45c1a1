package org.kconfig4j.model;

import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.model.expr.AndExpr;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * One entry of the menu tree: a symbol or choice definition, a menu, a comment, or (until
 * finalization) an {@code if} block. A symbol defined in two places has two nodes.
 * <p>
 * The tree is linked through {@code parent}, {@code list} (first child) and {@code next} (sibling).
 * Properties are kept per node, with the conditions that include inherited dependencies after
 * finalization; the {@code orig*} accessors give them back without the node's own dependency.
 */
public final class MenuNode {

    private final ResolutionContext context;
    private final NodeKind kind;
    private final ConfigItem item;
    private final SourceLocation location;
    private List<SourceLocation> includePath = List.of();

    private MenuNode parent;
    private MenuNode list;
    private MenuNode next;

    private PromptProperty prompt;
    private String help;
    private Expr dep;
    private Expr visibility;
    private boolean menuconfig;

    private final List<DefaultProperty> defaults = new ArrayList<>();
    private final List<SelectProperty> selects = new ArrayList<>();
    private final List<SelectProperty> implies = new ArrayList<>();
    private final List<RangeProperty> ranges = new ArrayList<>();

    public MenuNode(ResolutionContext context, NodeKind kind, ConfigItem item, SourceLocation location) {
        this.context = context;
        this.kind = kind;
        this.item = item;
        this.location = location;
        this.dep = context.y();
        this.visibility = context.y();
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * @return The symbol or choice, or {@code null} for menus, comments and {@code if} blocks.
     */
    public ConfigItem getItem() {
        return item;
    }

    public Symbol getSymbol() {
        return item instanceof Symbol s ? s : null;
    }

    public Choice getChoice() {
        return item instanceof Choice c ? c : null;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * @return The locations of the {@code source} statements that led to this node's file, outermost first.
     */
    public List<SourceLocation> getIncludePath() {
        return includePath;
    }

    public void setIncludePath(List<SourceLocation> includePath) {
        this.includePath = includePath;
    }

    public MenuNode getParent() {
        return parent;
    }

    public void setParent(MenuNode parent) {
        this.parent = parent;
    }

    public MenuNode getList() {
        return list;
    }

    public void setList(MenuNode list) {
        this.list = list;
    }

    public MenuNode getNext() {
        return next;
    }

    public void setNext(MenuNode next) {
        this.next = next;
    }

    public PromptProperty getPrompt() {
        return prompt;
    }

    public void setPrompt(PromptProperty prompt) {
        this.prompt = prompt;
    }

    public String getHelp() {
        return help;
    }

    public void setHelp(String help) {
        this.help = help;
    }

    /**
     * @return The node's dependencies. Includes those of enclosing menus, ifs and choices after finalization.
     */
    public Expr getDep() {
        return dep;
    }

    public void setDep(Expr dep) {
        this.dep = dep;
    }

    /**
     * @return The {@code visible if} condition of a menu; {@code y} otherwise.
     */
    public Expr getVisibility() {
        return visibility;
    }

    public void setVisibility(Expr visibility) {
        this.visibility = visibility;
    }

    public boolean isMenuconfig() {
        return menuconfig;
    }

    public void setMenuconfig(boolean menuconfig) {
        this.menuconfig = menuconfig;
    }

    public List<DefaultProperty> getDefaults() {
        return defaults;
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

    // ---- properties without the node's own dependency ----

    public PromptProperty getOrigPrompt() {
        return prompt == null ? null : prompt.withCondition(stripDep(prompt.condition()));
    }

    public List<DefaultProperty> getOrigDefaults() {
        List<DefaultProperty> out = new ArrayList<>();
        for (DefaultProperty d : defaults) {
            out.add(d.withCondition(stripDep(d.condition())));
        }
        return out;
    }

    public List<SelectProperty> getOrigSelects() {
        return stripAll(selects);
    }

    public List<SelectProperty> getOrigImplies() {
        return stripAll(implies);
    }

    public List<RangeProperty> getOrigRanges() {
        List<RangeProperty> out = new ArrayList<>();
        for (RangeProperty r : ranges) {
            out.add(r.withCondition(stripDep(r.condition())));
        }
        return out;
    }

    private List<SelectProperty> stripAll(List<SelectProperty> props) {
        List<SelectProperty> out = new ArrayList<>();
        for (SelectProperty p : props) {
            out.add(p.withCondition(stripDep(p.condition())));
        }
        return out;
    }

    /**
     * Undoes {@code and(cond, dep)} by identity.
     */
    private Expr stripDep(Expr expr) {
        if (expr == dep) {
            return context.y();
        }
        if (expr instanceof AndExpr and && and.right() == dep) {
            return and.left();
        }
        return expr;
    }

    /**
     * @return Every symbol and choice this node's properties mention, dependencies included.
     */
    public Set<ConfigItem> referenced() {
        Set<ConfigItem> out = new LinkedHashSet<>();
        if (prompt != null) {
            prompt.condition().collectItems(out);
        }
        if (kind == NodeKind.MENU) {
            visibility.collectItems(out);
        }
        for (DefaultProperty d : defaults) {
            d.value().collectItems(out);
            d.condition().collectItems(out);
        }
        for (SelectProperty s : selects) {
            out.add(s.target());
            s.condition().collectItems(out);
        }
        for (SelectProperty s : implies) {
            out.add(s.target());
            s.condition().collectItems(out);
        }
        for (RangeProperty r : ranges) {
            out.add(r.low());
            out.add(r.high());
            r.condition().collectItems(out);
        }
        dep.collectItems(out);
        return out;
    }

    // ---- printing ----

    /**
     * Prints the node in Kconfig syntax, with conditions as written (inherited dependencies removed
     * where they can be recognised) and leaves printed by {@code itemFormatter}.
     */
    public String customString(Function<ConfigItem, String> itemFormatter) {
        if (kind == NodeKind.MENU || kind == NodeKind.COMMENT) {
            return menuOrCommentString(itemFormatter);
        }
        return symbolOrChoiceString(itemFormatter);
    }

    private String menuOrCommentString(Function<ConfigItem, String> fmt) {
        StringBuilder s = new StringBuilder()
                .append(kind == NodeKind.MENU ? "menu" : "comment")
                .append(" \"").append(prompt != null ? prompt.text() : "").append('"');
        if (dep != context.y()) {
            s.append("\n\tdepends on ").append(Expressions.format(dep, fmt));
        }
        if (kind == NodeKind.MENU && visibility != context.y()) {
            s.append("\n\tvisible if ").append(Expressions.format(visibility, fmt));
        }
        return s.toString();
    }

    private String symbolOrChoiceString(Function<ConfigItem, String> fmt) {
        List<String> lines = new ArrayList<>();
        Symbol sym = getSymbol();
        if (sym != null) {
            lines.add((menuconfig ? "menuconfig " : "config ") + sym.getName());
        } else {
            lines.add(item.getName() != null ? "choice " + item.getName() : "choice");
        }

        SymbolType type = item.getOrigType();
        if (type != SymbolType.UNKNOWN && prompt == null) {
            lines.add("\t" + type.keyword());
        }
        if (prompt != null) {
            String prefix = type != SymbolType.UNKNOWN ? type.keyword() : "prompt";
            addWithCondition(lines, prefix + " \"" + StringEscapes.escape(prompt.text()) + "\"",
                    getOrigPrompt().condition(), fmt);
        }

        if (sym != null) {
            if (sym.isAllnoconfigY()) {
                lines.add("\toption allnoconfig_y");
            }
            if (sym == context.getDefconfigList()) {
                lines.add("\toption defconfig_list");
            }
            if (sym.getEnvVar() != null) {
                lines.add("\toption env=\"" + sym.getEnvVar() + "\"");
            }
            if (sym == context.getModules()) {
                lines.add("\toption modules");
            }
            if (sym.isTransitional()) {
                lines.add("\ttransitional");
            }
            for (RangeProperty r : getOrigRanges()) {
                addWithCondition(lines, "range " + fmt.apply(r.low()) + " " + fmt.apply(r.high()), r.condition(), fmt);
            }
        }

        for (DefaultProperty d : getOrigDefaults()) {
            addWithCondition(lines, "default " + Expressions.format(d.value(), fmt), d.condition(), fmt);
        }

        if (item instanceof Choice choice && choice.isOptional()) {
            lines.add("\toptional");
        }

        if (sym != null) {
            for (SelectProperty s : getOrigSelects()) {
                addWithCondition(lines, "select " + fmt.apply(s.target()), s.condition(), fmt);
            }
            for (SelectProperty s : getOrigImplies()) {
                addWithCondition(lines, "imply " + fmt.apply(s.target()), s.condition(), fmt);
            }
        }

        if (dep != context.y()) {
            lines.add("\tdepends on " + Expressions.format(dep, fmt));
        }

        if (help != null) {
            lines.add("\thelp");
            help.lines().forEach(line -> lines.add("\t  " + line));
        }
        return String.join("\n", lines);
    }

    private void addWithCondition(List<String> lines, String text, Expr condition, Function<ConfigItem, String> fmt) {
        if (condition != context.y()) {
            text += " if " + Expressions.format(condition, fmt);
        }
        lines.add("\t" + text);
    }

    /**
     * @return A one-line summary of the node, e.g. {@code <menu node for symbol FOO, deps y, has next, Kconfig:3>}.
     */
    public String describe() {
        List<String> fields = new ArrayList<>();
        switch (kind) {
            case SYMBOL:
                fields.add("menu node for symbol " + item.getName());
                break;
            case CHOICE:
                fields.add("menu node for choice" + (item.getName() != null ? " " + item.getName() : ""));
                break;
            case MENU:
                fields.add("menu node for menu");
                break;
            case COMMENT:
                fields.add("menu node for comment");
                break;
            default:
                fields.add("menu node for if");
                break;
        }
        if (prompt != null) {
            fields.add("prompt \"" + prompt.text() + "\" (visibility " + prompt.condition().value().text() + ")");
        }
        if (kind == NodeKind.SYMBOL && menuconfig) {
            fields.add("is menuconfig");
        }
        fields.add("deps " + dep.value().text());
        if (kind == NodeKind.MENU) {
            fields.add("'visible if' deps " + visibility.value().text());
        }
        if (item != null && help != null) {
            fields.add("has help");
        }
        if (list != null) {
            fields.add("has child");
        }
        if (next != null) {
            fields.add("has next");
        }
        fields.add(location.toString());
        return "<" + String.join(", ", fields) + ">";
    }

    @Override
    public String toString() {
        return customString(Expressions::standardItemString);
    }
}

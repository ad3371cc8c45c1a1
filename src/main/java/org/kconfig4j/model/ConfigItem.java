package org.kconfig4j.model;

import org.kconfig4j.model.expr.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Common state of {@link Symbol}s and {@link Choice}s: definition locations, defaults,
 * direct dependencies, cached visibility and the reverse dependency edges used for invalidation.
 */
public abstract class ConfigItem {

    protected final ResolutionContext context;
    protected String name;
    protected SymbolType origType = SymbolType.UNKNOWN;
    protected final List<MenuNode> nodes = new ArrayList<>();
    protected final List<DefaultProperty> defaults = new ArrayList<>();
    protected Expr directDep;
    protected final Set<ConfigItem> dependents = new LinkedHashSet<>();

    protected Tristate cachedVisibility;
    protected List<Tristate> cachedAssignable;
    protected boolean wasSet;
    private int visitState;

    protected ConfigItem(ResolutionContext context, String name) {
        this.context = context;
        this.name = name;
        this.directDep = context.n();
    }

    public String getName() {
        return name;
    }

    /**
     * @return The type as declared (or inferred at the end of parsing).
     */
    public SymbolType getOrigType() {
        return origType;
    }

    public void setOrigType(SymbolType origType) {
        this.origType = origType;
    }

    /**
     * @return The effective type. Tristate is demoted to bool when modules are disabled.
     */
    public abstract SymbolType type();

    public List<MenuNode> getNodes() {
        return nodes;
    }

    public List<DefaultProperty> getDefaults() {
        return defaults;
    }

    /**
     * @return The OR of the dependencies of every definition location.
     */
    public Expr getDirectDep() {
        return directDep;
    }

    public void setDirectDep(Expr directDep) {
        this.directDep = directDep;
    }

    /**
     * @return Items whose cached values may change when this item changes.
     */
    public Set<ConfigItem> getDependents() {
        return dependents;
    }

    public abstract Tristate triValue();

    public abstract String strValue();

    /**
     * @return The highest prompt condition over all definitions, adjusted for choice modes and
     *     with {@code m} promoted to {@code y} for non-tristate items.
     */
    public Tristate visibility() {
        if (cachedVisibility == null) {
            cachedVisibility = computeVisibility();
        }
        return cachedVisibility;
    }

    private Tristate computeVisibility() {
        Tristate vis = Tristate.N;
        for (MenuNode node : nodes) {
            if (node.getPrompt() != null) {
                vis = vis.max(node.getPrompt().condition().value());
            }
        }
        vis = restrictVisibility(vis);
        if (vis == Tristate.M && type() != SymbolType.TRISTATE) {
            return Tristate.Y;
        }
        return vis;
    }

    /**
     * Hook for choice members, which are hidden in some choice modes.
     */
    protected Tristate restrictVisibility(Tristate vis) {
        return vis;
    }

    /**
     * @return The values a user assignment would take effect with, ascending.
     */
    public List<Tristate> assignable() {
        if (cachedAssignable == null) {
            cachedAssignable = Collections.unmodifiableList(computeAssignable());
        }
        return cachedAssignable;
    }

    protected abstract List<Tristate> computeAssignable();

    /**
     * Clears this item's cached values.
     */
    protected abstract void invalidate();

    /**
     * Clears this item's cached values and those of every dependent that holds cached values.
     * Dependents without a cached visibility cannot have cached values anywhere downstream,
     * so the walk stops there.
     */
    protected void recursiveInvalidate() {
        if (this == context.getModules()) {
            context.invalidateAll();
            return;
        }
        invalidate();
        for (ConfigItem item : dependents) {
            if (item.cachedVisibility != null) {
                item.recursiveInvalidate();
            }
        }
    }

    /**
     * Clears cached values without touching dependents. Used by whole-tree invalidation.
     */
    public void invalidateCachedValues() {
        invalidate();
    }

    boolean hasCachedValues() {
        return cachedVisibility != null;
    }

    public boolean wasSet() {
        return wasSet;
    }

    public void setWasSet(boolean wasSet) {
        this.wasSet = wasSet;
    }

    /**
     * @return Dependency-loop search state: 0 unvisited, 1 on the current path, 2 known loop-free.
     */
    public int getVisitState() {
        return visitState;
    }

    public void setVisitState(int visitState) {
        this.visitState = visitState;
    }

    public ResolutionContext getContext() {
        return context;
    }

    /**
     * @return E.g. {@code FOO (defined at Kconfig:3, sub/Kconfig:10)} or {@code FOO (undefined)}.
     */
    public abstract String nameAndLocation();

    protected String locations() {
        if (nodes.isEmpty()) {
            return "(undefined)";
        }
        return nodes.stream()
                .map(n -> n.getLocation().toString())
                .collect(Collectors.joining(", ", "(defined at ", ")"));
    }

    /**
     * Prints every definition in Kconfig syntax, with symbols and choices inside expressions
     * printed by {@code itemFormatter}.
     */
    public String customString(Function<ConfigItem, String> itemFormatter) {
        return nodes.stream().map(n -> n.customString(itemFormatter)).collect(Collectors.joining("\n\n"));
    }

    /**
     * @return A one-line summary of the item's state.
     */
    public abstract String describe();
}

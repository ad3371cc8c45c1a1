package org.kconfig4j.frontend.semantics;

import org.kconfig4j.frontend.lexer.SymbolLookup;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.ResolutionContext;
import org.kconfig4j.model.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The tables populated while parsing: every referenced symbol (defined or not), constant symbols,
 * definitions in order of appearance, named choices, and menu and comment nodes.
 * <p>
 * Symbols are created on first reference and never removed, so a name always maps to the same
 * {@link Symbol} instance.
 */
public class SymbolTable implements SymbolLookup {

    private final ResolutionContext context;

    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final Map<String, Symbol> constants = new LinkedHashMap<>();
    private final List<Symbol> definedSymbols = new ArrayList<>();
    private final Map<String, Choice> namedChoices = new LinkedHashMap<>();
    private final List<Choice> choices = new ArrayList<>();
    private final List<MenuNode> menus = new ArrayList<>();
    private final List<MenuNode> comments = new ArrayList<>();

    /**
     * @param context The engine the created symbols resolve against.
     */
    public SymbolTable(ResolutionContext context) {
        this.context = context;
    }

    @Override
    public Symbol lookupSymbol(String name) {
        return symbols.computeIfAbsent(name, n -> new Symbol(context, n, false));
    }

    @Override
    public Symbol lookupConstant(String name) {
        return constants.computeIfAbsent(name, n -> new Symbol(context, n, true));
    }

    /**
     * Registers an already created constant, used for {@code n}, {@code m} and {@code y}.
     */
    public void addConstant(Symbol constant) {
        constants.put(constant.getName(), constant);
    }

    /**
     * @return The non-constant symbol named {@code name}, if it has been referenced anywhere.
     */
    public Optional<Symbol> get(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return All non-constant symbols by name, in first-reference order. Includes undefined ones.
     */
    public Map<String, Symbol> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    public Map<String, Symbol> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    /**
     * Records a {@code config}/{@code menuconfig} definition. A symbol defined twice is recorded twice.
     */
    public void addDefinition(Symbol symbol) {
        definedSymbols.add(symbol);
    }

    /**
     * @return Defined symbols in definition order, with repeats.
     */
    public List<Symbol> getDefinedSymbols() {
        return Collections.unmodifiableList(definedSymbols);
    }

    /**
     * @return Defined symbols in order of their first definition.
     */
    public List<Symbol> getUniqueDefinedSymbols() {
        return new ArrayList<>(new LinkedHashSet<>(definedSymbols));
    }

    /**
     * Returns the choice for a {@code choice} statement. Named choices defined more than once share
     * one instance; anonymous choices are always new.
     *
     * @param name The choice name, or {@code null}.
     */
    public Choice choiceFor(String name) {
        Choice choice;
        if (name == null) {
            choice = new Choice(context, null);
        } else {
            choice = namedChoices.computeIfAbsent(name, n -> new Choice(context, n));
        }
        choices.add(choice);
        return choice;
    }

    public Map<String, Choice> getNamedChoices() {
        return Collections.unmodifiableMap(namedChoices);
    }

    /**
     * @return Choices in order of their first definition.
     */
    public List<Choice> getUniqueChoices() {
        return new ArrayList<>(new LinkedHashSet<>(choices));
    }

    public void addMenu(MenuNode menu) {
        menus.add(menu);
    }

    public List<MenuNode> getMenus() {
        return Collections.unmodifiableList(menus);
    }

    public void addComment(MenuNode comment) {
        comments.add(comment);
    }

    public List<MenuNode> getComments() {
        return Collections.unmodifiableList(comments);
    }
}

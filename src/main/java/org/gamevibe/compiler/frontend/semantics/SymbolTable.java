package org.gamevibe.compiler.frontend.semantics;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.GameNode;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The symbol table of one analysis run. GDL has a single global namespace per declaration kind,
 * so the table holds one insertion-ordered map per {@link Symbol.Type}, plus the game
 * declaration that is in effect.
 */
public class SymbolTable {

    private final Map<Symbol.Type, Map<String, Symbol>> symbols = new EnumMap<>(Symbol.Type.class);
    private final DiagnosticsEngine diagnostics;
    private GameNode game;

    /**
     * Constructs a new symbol table.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        for (Symbol.Type type : Symbol.Type.values()) {
            symbols.put(type, new LinkedHashMap<>());
        }
    }

    /**
     * Defines a new symbol.
     * Reports an error at the new declaration if the name is already defined for its type;
     * the earlier definition is kept.
     * @param symbol The symbol to define.
     * @return true if the symbol was added.
     */
    public boolean define(Symbol symbol) {
        Map<String, Symbol> table = symbols.get(symbol.type());
        if (table.containsKey(symbol.name())) {
            diagnostics.reportError(
                    symbol.type().label() + " '" + symbol.name() + "' is already defined",
                    symbol.declaration().range(),
                    CompilerErrorCode.DUPLICATE_DECLARATION);
            return false;
        }
        table.put(symbol.name(), symbol);
        return true;
    }

    /**
     * Resolves a symbol by name.
     * @param name The name to look up.
     * @param type The kind of declaration expected.
     * @return The symbol, or empty if no declaration of that kind has this name.
     */
    public Optional<Symbol> resolve(String name, Symbol.Type type) {
        return Optional.ofNullable(symbols.get(type).get(name));
    }

    /**
     * Returns the declared names of one kind, in declaration order.
     * @param type The kind of declaration.
     * @return The names.
     */
    public List<String> names(Symbol.Type type) {
        return List.copyOf(symbols.get(type).keySet());
    }

    /**
     * Records the game declaration in effect, unless one is already recorded.
     * @param game The game declaration.
     * @return true if this declaration became the effective one.
     */
    public boolean defineGame(GameNode game) {
        if (this.game != null) {
            return false;
        }
        this.game = game;
        return true;
    }

    /**
     * @return The first game declaration, if any.
     */
    public Optional<GameNode> getGame() {
        return Optional.ofNullable(game);
    }
}

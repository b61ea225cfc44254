package org.gamevibe.compiler.frontend.semantics;

import org.gamevibe.compiler.frontend.parser.ast.Declaration;

/**
 * Represents a single named declaration (an entity, a behavior or a scene)
 * in the symbol table.
 *
 * @param name The declared name.
 * @param type The type of the symbol.
 * @param declaration The declaration that introduced the name.
 */
public record Symbol(String name, Type type, Declaration declaration) {
    /**
     * The type of a symbol in the symbol table.
     */
    public enum Type {
        /** An entity template. */
        ENTITY("Entity"),
        /** A reusable behavior. */
        BEHAVIOR("Behavior"),
        /** A scene. */
        SCENE("Scene");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        /**
         * @return The capitalized name used in diagnostics, e.g. {@code "Entity"}.
         */
        public String label() {
            return label;
        }
    }
}

package org.gamevibe.compiler.api;

/**
 * Defines unique, testable codes for all diagnostics that can occur during compilation.
 * This decouples tooling and tests from the wording of the messages.
 */
public enum CompilerErrorCode {
    // region Parser Errors
    /** The token stream does not match the grammar. */
    SYNTAX_ERROR,
    // endregion

    // region Semantic Analysis Errors
    /** An entity, behavior or scene name was declared more than once. */
    DUPLICATE_DECLARATION,
    /** An entity references a behavior that is not declared. */
    UNDEFINED_BEHAVIOR,
    /** A scene spawns an entity type that is not declared. */
    UNDEFINED_ENTITY,
    /** The game's default scene is not declared. */
    UNDEFINED_SCENE,
    /** An entity's physics mode is not one of the supported modes. */
    INVALID_PHYSICS_MODE,
    /** A size property is not a two-element array. */
    INVALID_SIZE,
    /** The game's scale mode is not one of the supported modes. */
    INVALID_SCALE_MODE,
    /** The game's physics engine is not one of the supported engines. */
    INVALID_PHYSICS_ENGINE,
    /** The game's pixelArt property is not a boolean literal. */
    INVALID_PIXEL_ART,
    // endregion

    // region Semantic Analysis Warnings
    /** More than one game declaration was found. */
    MULTIPLE_GAME_DECLARATIONS,
    /** A behavior was referenced by a string instead of an identifier. */
    STRING_BEHAVIOR_REFERENCE,
    /** Scenes are declared but the game does not name a default scene. */
    MISSING_DEFAULT_SCENE,
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred inside the compiler. */
    UNEXPECTED_ERROR
    // endregion
}

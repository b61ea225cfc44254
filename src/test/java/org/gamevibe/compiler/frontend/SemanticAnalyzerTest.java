package org.gamevibe.compiler.frontend;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.diagnostics.Diagnostic;
import org.gamevibe.compiler.frontend.lexer.Lexer;
import org.gamevibe.compiler.frontend.parser.ParseResult;
import org.gamevibe.compiler.frontend.parser.Parser;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.semantics.AnalysisResult;
import org.gamevibe.compiler.frontend.semantics.SemanticAnalyzer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link SemanticAnalyzer}.
 * These tests verify symbol collection, reference validation and the property schema checks.
 */
public class SemanticAnalyzerTest {

    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();

    private static Program parse(String... lines) {
        ParseResult result = new Parser(new Lexer(String.join("\n", lines)).tokenize()).parse();
        assertThat(result.diagnostics()).as("syntax errors").isEmpty();
        return result.program();
    }

    /**
     * Verifies that a consistent program passes without diagnostics, including forward references.
     */
    @Test
    @Tag("unit")
    void testValidProgramWithForwardReferences() {
        // Arrange
        Program program = parse(
                "game { title: \"Demo\", size: [800, 600], scale: fit, physics: arcade, pixelArt: true, defaultScene: Main }",
                "scene Main { size: [1600, 600], spawn Player at [0, 0] }",
                "entity Player { physics: platformer, size: [32, 48], behaviors: [Jump] }",
                "behavior Jump { properties: { force: 300 } }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    /**
     * Verifies that a duplicate name is reported at the second declaration, and that the same
     * name may be used by declarations of different kinds.
     */
    @Test
    @Tag("unit")
    void testDuplicateDeclarations() {
        // Arrange
        Program program = parse(
                "entity Player { }",
                "entity Player { }",
                "scene Player { }",
                "game { defaultScene: Player }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(Diagnostic::message, Diagnostic::code)
                .containsExactly(tuple("Entity 'Player' is already defined", CompilerErrorCode.DUPLICATE_DECLARATION));
        assertThat(result.errors().get(0).range().start().line()).isEqualTo(2);
    }

    /**
     * Verifies that an undefined behavior is reported at the identifier with a suggestion.
     */
    @Test
    @Tag("unit")
    void testUndefinedBehaviorWithSuggestion() {
        // Arrange
        Program program = parse(
                "behavior Jump { }",
                "entity Player {",
                "  behaviors: [Jmp]",
                "}");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.errors()).hasSize(1);
        Diagnostic error = result.errors().get(0);
        assertThat(error.message()).isEqualTo("Behavior 'Jmp' is not defined");
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNDEFINED_BEHAVIOR);
        assertThat(error.suggestions()).containsExactly("Jump");
        assertThat(error.range().start().line()).isEqualTo(3);
        assertThat(error.range().start().column()).isEqualTo(15);
    }

    /**
     * Verifies that a behavior given as a string is only a warning.
     */
    @Test
    @Tag("unit")
    void testStringBehaviorReferenceIsAWarning() {
        // Arrange
        Program program = parse("entity Player { behaviors: [\"Jump\"] }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::message, Diagnostic::code)
                .containsExactly(tuple("Behavior reference \"Jump\" is a string; use an identifier",
                        CompilerErrorCode.STRING_BEHAVIOR_REFERENCE));
    }

    /**
     * Verifies that spawning an undeclared entity type is an error carrying close names.
     */
    @Test
    @Tag("unit")
    void testUndefinedSpawnedEntity() {
        // Arrange
        Program program = parse(
                "entity Coin { }",
                "entity Coins { }",
                "game { defaultScene: Level }",
                "scene Level { spawn Con at [1, 1] }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).message()).isEqualTo("Entity 'Con' is not defined");
        assertThat(result.errors().get(0).code()).isEqualTo(CompilerErrorCode.UNDEFINED_ENTITY);
        assertThat(result.errors().get(0).suggestions()).containsExactly("Coin", "Coins");
    }

    /**
     * Verifies the default scene checks: an undeclared scene is an error and a missing
     * default scene is a warning when scenes exist.
     */
    @Test
    @Tag("unit")
    void testDefaultScene() {
        // Act
        AnalysisResult undefined = analyzer.analyze(parse("game { defaultScene: Menu }", "scene Main { }"));
        AnalysisResult missing = analyzer.analyze(parse("game { title: \"x\" }", "scene Main { }"));
        AnalysisResult noScenes = analyzer.analyze(parse("game { title: \"x\" }"));

        // Assert
        assertThat(undefined.errors()).extracting(Diagnostic::message, Diagnostic::code)
                .containsExactly(tuple("Default scene 'Menu' is not defined", CompilerErrorCode.UNDEFINED_SCENE));
        assertThat(missing.valid()).isTrue();
        assertThat(missing.warnings()).extracting(Diagnostic::code)
                .containsExactly(CompilerErrorCode.MISSING_DEFAULT_SCENE);
        assertThat(noScenes.warnings()).isEmpty();
    }

    /**
     * Verifies the size schema for games, entities and scenes.
     */
    @Test
    @Tag("unit")
    void testInvalidSizes() {
        // Arrange
        Program program = parse(
                "game { size: [800] }",
                "entity Player { size: \"big\" }",
                "scene Main { size: [1, 2, 3] }",
                "behavior Jump { size: 4 }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.errors())
                .extracting(Diagnostic::message, d -> d.range().start().line())
                .containsExactly(
                        tuple("Size must be an array with 2 elements [width, height]", 1),
                        tuple("Size must be an array with 2 elements [width, height]", 2),
                        tuple("Size must be an array with 2 elements [width, height]", 3));
        assertThat(result.errors()).extracting(Diagnostic::code).containsOnly(CompilerErrorCode.INVALID_SIZE);
        assertThat(result.warnings()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.MISSING_DEFAULT_SCENE);
    }

    /**
     * Verifies the enumerated game and entity properties and their suggestions.
     */
    @Test
    @Tag("unit")
    void testEnumeratedProperties() {
        // Arrange
        Program program = parse(
                "game { scale: stretch, physics: box2d, pixelArt: \"yes\" }",
                "entity Player { physics: platfomer }",
                "entity Bird { physics: flying }",
                "entity Rock { physics: \"static\" }");

        // Act
        AnalysisResult result = analyzer.analyze(program);

        // Assert
        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly(
                CompilerErrorCode.INVALID_SCALE_MODE,
                CompilerErrorCode.INVALID_PHYSICS_ENGINE,
                CompilerErrorCode.INVALID_PIXEL_ART,
                CompilerErrorCode.INVALID_PHYSICS_MODE,
                CompilerErrorCode.INVALID_PHYSICS_MODE);
        assertThat(result.errors().get(0).message())
                .isEqualTo("Invalid scale mode 'stretch'. Expected one of: fit, exact, zoom");
        assertThat(result.errors().get(2).message()).isEqualTo("pixelArt must be a boolean (true or false)");
        assertThat(result.errors().get(3).suggestions()).containsExactly("platformer");
        assertThat(result.errors().get(4).suggestions())
                .containsExactly("static", "dynamic", "kinematic", "platformer", "topdown");
    }

    /**
     * Verifies that only the first game declaration counts and later ones are warned about.
     */
    @Test
    @Tag("unit")
    void testMultipleGameDeclarations() {
        // Act
        AnalysisResult result = analyzer.analyze(parse("game { title: \"a\" }", "game { title: \"b\" }"));

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).extracting(Diagnostic::message)
                .containsExactly("Multiple game declarations; only the first one is used");
        assertThat(result.warnings().get(0).range().start().line()).isEqualTo(2);
    }

    /**
     * Verifies that analyzing one program does not affect the analysis of the next.
     */
    @Test
    @Tag("unit")
    void testAnalyzerIsReusable() {
        // Arrange
        Program first = parse("entity Player { }");

        // Act
        analyzer.analyze(first);
        AnalysisResult second = analyzer.analyze(first);

        // Assert
        assertThat(second.valid()).isTrue();
        assertThat(second.errors()).isEmpty();
    }
}

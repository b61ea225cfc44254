package org.gamevibe.compiler.diagnostics;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.SourcePosition;
import org.gamevibe.compiler.api.SourceRange;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
public class DiagnosticsEngineTest {

    /**
     * Verifies that errors and warnings are separated while keeping the reporting order.
     */
    @Test
    @Tag("unit")
    void testSeparatesErrorsAndWarnings() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();
        SourceRange range = SourceRange.at(new SourcePosition(2, 5, 12));

        // Act
        engine.reportWarning("first warning", range, CompilerErrorCode.MISSING_DEFAULT_SCENE);
        engine.reportError("first error", range, CompilerErrorCode.UNDEFINED_ENTITY, List.of("Player"));
        engine.reportError("second error", null, CompilerErrorCode.UNEXPECTED_ERROR);

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.errors()).extracting(Diagnostic::message).containsExactly("first error", "second error");
        assertThat(engine.warnings()).extracting(Diagnostic::message).containsExactly("first warning");
        assertThat(engine.errors().get(0).suggestions()).containsExactly("Player");
        assertThat(engine.summary()).isEqualTo(String.join("\n",
                "[WARNING] 2:5: first warning",
                "[ERROR] 2:5: first error",
                "[ERROR] ?: second error"));
    }

    /**
     * Verifies that warnings alone do not count as errors and that the view is read-only.
     */
    @Test
    @Tag("unit")
    void testWarningsAreNotErrors() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("only a warning", null, null);

        // Assert
        assertThat(engine.hasErrors()).isFalse();
        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}

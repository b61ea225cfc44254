package org.gamevibe.compiler.frontend.parser;

import org.gamevibe.compiler.diagnostics.Diagnostic;
import org.gamevibe.compiler.frontend.parser.ast.Program;

import java.util.List;

/**
 * The output of {@link Parser#parse()}: the best-effort program and the syntax errors found.
 *
 * @param program The parsed program. Declarations that failed to parse are omitted.
 * @param diagnostics The syntax errors, in source order.
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if parsing reported at least one error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}

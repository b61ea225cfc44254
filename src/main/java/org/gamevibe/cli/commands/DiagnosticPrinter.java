package org.gamevibe.cli.commands;

import org.gamevibe.compiler.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Prints diagnostics in the conventional {@code file:line:column: severity: message} format.
 */
final class DiagnosticPrinter {

    private final PrintWriter err;
    private final String fileName;

    DiagnosticPrinter(PrintWriter err, String fileName) {
        this.err = err;
        this.fileName = fileName;
    }

    void print(List<Diagnostic> diagnostics) {
        diagnostics.forEach(this::print);
        err.flush();
    }

    void print(Diagnostic diagnostic) {
        err.println(format(diagnostic));
        if (!diagnostic.suggestions().isEmpty()) {
            err.println("  did you mean: " + String.join(", ", diagnostic.suggestions()));
        }
    }

    String format(Diagnostic diagnostic) {
        StringBuilder line = new StringBuilder(fileName);
        if (diagnostic.range() != null) {
            line.append(':').append(diagnostic.range().start().line())
                .append(':').append(diagnostic.range().start().column());
        }
        line.append(": ").append(diagnostic.type().name().toLowerCase(Locale.ROOT))
            .append(": ").append(diagnostic.message());
        if (diagnostic.code() != null) {
            line.append(" [").append(diagnostic.code()).append(']');
        }
        return line.toString();
    }
}

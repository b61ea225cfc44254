package org.gamevibe.cli.commands;

import org.gamevibe.cli.CommandLineInterface;
import org.gamevibe.compiler.Compiler;
import org.gamevibe.compiler.api.CompilationException;
import org.gamevibe.compiler.api.ValidationResult;
import org.gamevibe.compiler.diagnostics.Diagnostic;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", description = "Checks the syntax of a GDL source file.")
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<source.gdl>", description = "The GDL source file.")
    private Path source;

    @Option(names = "--format", description = "Output format: text, json (default: text)")
    private String format = "text";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    public record ValidateReport(String file, boolean valid, List<Diagnostic> errors, List<Diagnostic> warnings) {}

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            boolean json = OutputFormats.isJson(format);
            // Loads the configuration so that logging settings apply.
            parent.getConfig();
            ValidationResult result = new Compiler().validate(SourceFiles.read(source));
            if (json) {
                out.println(JsonOutput.write(new ValidateReport(source.toString(), result.valid(), result.errors(), result.warnings())));
            } else {
                new DiagnosticPrinter(err, source.toString()).print(result.errors());
                if (result.valid()) {
                    out.println(source + ": OK");
                }
            }
            out.flush();
            return result.valid() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_DIAGNOSTICS;
        } catch (CompilationException e) {
            err.println("error: " + e.getMessage());
            err.flush();
            return CommandLineInterface.EXIT_FAILURE;
        }
    }
}

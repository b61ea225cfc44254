package org.gamevibe.cli.commands;

import com.typesafe.config.ConfigException;
import org.gamevibe.cli.CommandLineInterface;
import org.gamevibe.compiler.Compiler;
import org.gamevibe.compiler.api.CompilationException;
import org.gamevibe.compiler.api.CompilationMetadata;
import org.gamevibe.compiler.api.CompilationResult;
import org.gamevibe.compiler.api.CompilerOptions;
import org.gamevibe.compiler.api.SourceMapping;
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

@Command(name = "compile", description = "Compiles a GDL source file to a TypeScript module.")
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<source.gdl>", description = "The GDL source file.")
    private Path source;

    @Option(names = {"-o", "--out"}, description = "Output file for the generated code (default: standard output).")
    private Path output;

    @Option(names = "--debug", description = "Annotate the generated code with source positions.")
    private boolean debug;

    @Option(names = "--source-map", description = "Write a source map next to the output file.")
    private boolean sourceMap;

    @Option(names = "--optimize", description = "Accepted for compatibility; has no effect.")
    private boolean optimize;

    @Option(names = "--format", description = "Output format: text, json (default: text)")
    private String format = "text";

    @Option(names = "--metadata", description = "Print the declared names and referenced assets.")
    private boolean metadata;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    /**
     * The machine-readable form of a compilation, printed with {@code --format json}.
     */
    public record CompileReport(
            String file,
            boolean success,
            String code,
            List<Diagnostic> errors,
            List<Diagnostic> warnings,
            CompilationMetadata metadata,
            List<SourceMapping> sourceMap,
            double elapsedMillis
    ) {}

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            boolean json = OutputFormats.isJson(format);
            CompilerOptions options = CompilerOptions.fromConfig(parent.getConfig());
            if (debug) options = options.withDebug(true);
            if (sourceMap) options = options.withSourceMap(true);
            if (optimize) options = options.withOptimize(true);

            CompilationResult result = new Compiler().compile(SourceFiles.read(source), options);

            if (result.success() && output != null) {
                SourceFiles.write(output, result.code());
                if (!result.sourceMap().isEmpty()) {
                    SourceFiles.write(Path.of(output + ".map.json"), JsonOutput.write(result.sourceMap()));
                }
            }

            if (json) {
                out.println(JsonOutput.write(new CompileReport(source.toString(), result.success(), result.code(),
                        result.errors(), result.warnings(), result.metadata(), result.sourceMap(), result.elapsedMillis())));
            } else {
                DiagnosticPrinter printer = new DiagnosticPrinter(err, source.toString());
                printer.print(result.errors());
                printer.print(result.warnings());
                if (result.success() && output == null) {
                    out.print(result.code());
                }
                if (metadata) {
                    printMetadata(output == null ? err : out, result.metadata());
                }
            }
            out.flush();
            return result.success() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_DIAGNOSTICS;
        } catch (CompilationException e) {
            err.println("error: " + e.getMessage());
            err.flush();
            return CommandLineInterface.EXIT_FAILURE;
        } catch (ConfigException e) {
            err.println("error: Invalid compiler configuration: " + e.getMessage());
            err.flush();
            return CommandLineInterface.EXIT_FAILURE;
        }
    }

    private static void printMetadata(PrintWriter target, CompilationMetadata metadata) {
        target.println("entities: " + String.join(", ", metadata.entities()));
        target.println("behaviors: " + String.join(", ", metadata.behaviors()));
        target.println("scenes: " + String.join(", ", metadata.scenes()));
        target.println("assets: " + String.join(", ", metadata.assets()));
        target.flush();
    }
}

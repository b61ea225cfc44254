package org.gamevibe.compiler;

import org.gamevibe.compiler.api.CompilationMetadata;
import org.gamevibe.compiler.api.CompilationResult;
import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.CompilerOptions;
import org.gamevibe.compiler.api.ICompiler;
import org.gamevibe.compiler.api.ValidationResult;
import org.gamevibe.compiler.backend.codegen.CodeGenerator;
import org.gamevibe.compiler.backend.codegen.GeneratedCode;
import org.gamevibe.compiler.diagnostics.Diagnostic;
import org.gamevibe.compiler.frontend.lexer.Lexer;
import org.gamevibe.compiler.frontend.lexer.Token;
import org.gamevibe.compiler.frontend.parser.ParseResult;
import org.gamevibe.compiler.frontend.parser.Parser;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.semantics.AnalysisResult;
import org.gamevibe.compiler.frontend.semantics.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * The main compiler implementation. This class orchestrates the compilation pipeline
 * from GDL source to generated TypeScript: lexer, parser, semantic analyzer, code generator.
 * <p>
 * Every request builds its own pipeline objects, so a single instance may serve concurrent callers.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private static final CompilationMetadata NO_METADATA = new CompilationMetadata(List.of(), List.of(), List.of(), List.of());

    private final Supplier<CodeGenerator> generatorFactory;

    /**
     * Creates a compiler with the standard code generator.
     */
    public Compiler() {
        this(CodeGenerator::new);
    }

    Compiler(Supplier<CodeGenerator> generatorFactory) {
        this.generatorFactory = generatorFactory;
    }

    @Override
    public CompilationResult compile(String source, CompilerOptions options) {
        long started = System.nanoTime();
        Program program = null;
        CompilationMetadata metadata = NO_METADATA;
        try {
            // Phase 1: Lexing
            long phase = System.nanoTime();
            List<Token> tokens = new Lexer(source).tokenize();
            LOG.debug("Lexing produced {} tokens in {} ms", tokens.size(), millisSince(phase));

            // Phase 2: Parsing
            phase = System.nanoTime();
            ParseResult parsed = new Parser(tokens).parse();
            program = parsed.program();
            metadata = MetadataCollector.collect(program, options.assetProperties());
            LOG.debug("Parsing produced {} declarations in {} ms", program.body().size(), millisSince(phase));
            if (parsed.hasErrors()) {
                LOG.info("Compilation failed with {} syntax error(s)", parsed.diagnostics().size());
                return CompilationResult.failure(program, parsed.diagnostics(), List.of(), metadata, millisSince(started));
            }

            // Phase 3: Semantic analysis
            phase = System.nanoTime();
            AnalysisResult analysis = new SemanticAnalyzer().analyze(program);
            LOG.debug("Semantic analysis finished in {} ms ({} errors, {} warnings)",
                    millisSince(phase), analysis.errors().size(), analysis.warnings().size());
            if (!analysis.valid()) {
                LOG.info("Compilation failed with {} semantic error(s)", analysis.errors().size());
                return CompilationResult.failure(program, analysis.errors(), analysis.warnings(), metadata, millisSince(started));
            }

            // Phase 4: Code generation
            phase = System.nanoTime();
            GeneratedCode generated = generatorFactory.get().generate(program, options);
            LOG.debug("Code generation finished in {} ms", millisSince(phase));

            return new CompilationResult(true, generated.code(), program, List.of(), analysis.warnings(),
                    metadata, generated.sourceMap(), millisSince(started));
        } catch (RuntimeException | StackOverflowError e) {
            LOG.error("Unexpected error during compilation", e);
            Diagnostic error = unexpectedError(e);
            return CompilationResult.failure(program, List.of(error), List.of(), metadata, millisSince(started));
        }
    }

    @Override
    public CompletableFuture<CompilationResult> compileAsync(String source, CompilerOptions options) {
        return CompletableFuture.completedFuture(compile(source, options));
    }

    @Override
    public ValidationResult validate(String source) {
        try {
            ParseResult parsed = new Parser(new Lexer(source).tokenize()).parse();
            return new ValidationResult(!parsed.hasErrors(), parsed.diagnostics(), List.of());
        } catch (RuntimeException | StackOverflowError e) {
            LOG.error("Unexpected error during validation", e);
            Diagnostic error = unexpectedError(e);
            return new ValidationResult(false, List.of(error), List.of());
        }
    }

    private static Diagnostic unexpectedError(Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return Diagnostic.error("Compilation error: " + message, null, CompilerErrorCode.UNEXPECTED_ERROR);
    }

    private static double millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}

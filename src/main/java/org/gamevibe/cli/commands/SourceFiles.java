package org.gamevibe.cli.commands;

import org.gamevibe.compiler.api.CompilationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File access for the commands, translating I/O failures into {@link CompilationException}.
 */
final class SourceFiles {

    private SourceFiles() {}

    static String read(Path path) throws CompilationException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException("Cannot read source file: " + path, e);
        }
    }

    static void write(Path path, String content) throws CompilationException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompilationException("Cannot write output file: " + path, e);
        }
    }
}

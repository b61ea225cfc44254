package org.gamevibe.cli.commands;

import org.gamevibe.compiler.api.CompilationException;

/**
 * Parses the {@code --format} option shared by the commands.
 */
final class OutputFormats {

    private OutputFormats() {}

    /**
     * @param format The option value.
     * @return true for {@code json}, false for {@code text}.
     * @throws CompilationException for any other value.
     */
    static boolean isJson(String format) throws CompilationException {
        if ("json".equalsIgnoreCase(format)) return true;
        if ("text".equalsIgnoreCase(format)) return false;
        throw new CompilationException("Unknown output format '" + format + "'. Expected one of: text, json");
    }
}

package org.gamevibe.compiler.api;

/**
 * Maps the first generated line of a declaration block back to the declaration in the source.
 *
 * @param generatedLine The 1-based line in the generated code.
 * @param source The position of the declaration keyword in the source.
 * @param declaration A readable name of the declaration, e.g. {@code entity Player}.
 */
public record SourceMapping(int generatedLine, SourcePosition source, String declaration) {}

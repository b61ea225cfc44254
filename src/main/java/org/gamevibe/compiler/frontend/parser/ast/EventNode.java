package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

/**
 * A scene statement {@code when|on <trigger>: <handler>}.
 * The handler body is not compiled; only its extent is kept.
 *
 * @param keyword Either {@code "when"} or {@code "on"}.
 * @param trigger The trigger tokens joined by single spaces, e.g. {@code "player touches coin"}.
 * @param handlerRange The source range of the skipped handler.
 * @param range The source range of the whole statement.
 */
public record EventNode(String keyword, String trigger, SourceRange handlerRange, SourceRange range) implements AstNode {}

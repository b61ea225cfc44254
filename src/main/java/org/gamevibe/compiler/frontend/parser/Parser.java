package org.gamevibe.compiler.frontend.parser;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.SourcePosition;
import org.gamevibe.compiler.api.SourceRange;
import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.lexer.Token;
import org.gamevibe.compiler.frontend.lexer.TokenType;
import org.gamevibe.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The recursive-descent parser for GDL. It consumes a list of tokens
 * from the {@link org.gamevibe.compiler.frontend.lexer.Lexer} and produces a {@link Program}.
 * <p>
 * Every helper returns a {@link ParseOutcome}. Failures travel up to the declaration loop in
 * {@link #parse()}, which records them and skips to the next plausible declaration, so one
 * malformed declaration does not hide errors in the following ones.
 */
public class Parser {

    private static final Set<String> DECLARATION_KEYWORDS = Set.of("game", "entity", "behavior", "scene");
    private static final Set<String> STATEMENT_KEYWORDS = Set.of("spawn", "when", "on");

    /** The deepest nesting of values and position expressions the parser accepts. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse. A missing end-of-file token is supplied.
     */
    public Parser(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.END_OF_FILE) {
            SourcePosition end = copy.isEmpty() ? SourcePosition.START : copy.get(copy.size() - 1).end();
            copy.add(new Token(TokenType.END_OF_FILE, "", end));
        }
        this.tokens = List.copyOf(copy);
    }

    /**
     * Parses the entire token stream.
     * @return The program and all syntax errors. Never throws for malformed input.
     */
    public ParseResult parse() {
        List<Declaration> body = new ArrayList<>();
        SourcePosition start = peek().position();
        while (!isAtEnd()) {
            ParseOutcome<Declaration> outcome = declaration();
            if (outcome instanceof ParseOutcome.Failure<Declaration> failure) {
                diagnostics.reportError(failure.message(), failure.token().range(), CompilerErrorCode.SYNTAX_ERROR);
                synchronize();
            } else {
                body.add(outcome.value());
            }
        }
        Program program = new Program(body, new SourceRange(start, peek().position()));
        return new ParseResult(program, diagnostics.getDiagnostics());
    }

    private ParseOutcome<Declaration> declaration() {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            switch (token.text()) {
                case "game":
                    return gameDeclaration();
                case "entity":
                    return entityDeclaration();
                case "behavior":
                    return behaviorDeclaration();
                case "scene":
                    return sceneDeclaration();
                default:
                    break;
            }
        }
        return ParseOutcome.failure(
                "Expected declaration keyword, got " + token.type().description() + " '" + token.text() + "'", token);
    }

    private ParseOutcome<Declaration> gameDeclaration() {
        Token keyword = advance();
        ParseOutcome<List<PropertyNode>> body = propertyBlock();
        if (body.failed()) return body.propagate();
        return ParseOutcome.success(new GameNode(body.value(), rangeFrom(keyword)));
    }

    private ParseOutcome<Declaration> entityDeclaration() {
        Token keyword = advance();
        ParseOutcome<Token> name = expectName("entity");
        if (name.failed()) return name.propagate();
        ParseOutcome<List<PropertyNode>> body = propertyBlock();
        if (body.failed()) return body.propagate();
        return ParseOutcome.success(new EntityNode(name.value().text(), body.value(), rangeFrom(keyword)));
    }

    private ParseOutcome<Declaration> behaviorDeclaration() {
        Token keyword = advance();
        ParseOutcome<Token> name = expectName("behavior");
        if (name.failed()) return name.propagate();
        ParseOutcome<List<PropertyNode>> body = propertyBlock();
        if (body.failed()) return body.propagate();
        return ParseOutcome.success(new BehaviorNode(name.value().text(), body.value(), rangeFrom(keyword)));
    }

    private ParseOutcome<Declaration> sceneDeclaration() {
        Token keyword = advance();
        ParseOutcome<Token> name = expectName("scene");
        if (name.failed()) return name.propagate();
        ParseOutcome<Token> open = expectPunctuation("{");
        if (open.failed()) return open.propagate();

        List<PropertyNode> properties = new ArrayList<>();
        List<SpawnNode> spawns = new ArrayList<>();
        List<EventNode> events = new ArrayList<>();
        while (!isAtEnd() && !checkPunctuation("}")) {
            Token token = peek();
            if (token.isKeyword("spawn")) {
                ParseOutcome<SpawnNode> spawn = spawnStatement();
                if (spawn.failed()) return spawn.propagate();
                spawns.add(spawn.value());
            } else if (token.isKeyword("when") || token.isKeyword("on")) {
                ParseOutcome<EventNode> event = eventStatement();
                if (event.failed()) return event.propagate();
                events.add(event.value());
            } else if (isPropertyStart()) {
                ParseOutcome<PropertyNode> property = property();
                if (property.failed()) return property.propagate();
                properties.add(property.value());
            } else if (!matchSeparator()) {
                advance();
                diagnostics.reportError("Unexpected token in scene body: '" + token.text() + "'",
                        token.range(), CompilerErrorCode.SYNTAX_ERROR);
            }
        }
        ParseOutcome<Token> close = expectPunctuation("}");
        if (close.failed()) return close.propagate();
        return ParseOutcome.success(new SceneNode(name.value().text(), properties, spawns, events, rangeFrom(keyword)));
    }

    private ParseOutcome<List<PropertyNode>> propertyBlock() {
        ParseOutcome<Token> open = expectPunctuation("{");
        if (open.failed()) return open.propagate();
        List<PropertyNode> properties = new ArrayList<>();
        while (isPropertyStart()) {
            ParseOutcome<PropertyNode> property = property();
            if (property.failed()) return property.propagate();
            properties.add(property.value());
            matchSeparator();
        }
        ParseOutcome<Token> close = expectPunctuation("}");
        if (close.failed()) return close.propagate();
        return ParseOutcome.success(properties);
    }

    private boolean isPropertyStart() {
        Token token = peek();
        boolean nameToken = token.type() == TokenType.IDENTIFIER
                || (token.type() == TokenType.KEYWORD && !STATEMENT_KEYWORDS.contains(token.text()));
        return nameToken && peek(1).isPunctuation(":");
    }

    private ParseOutcome<PropertyNode> property() {
        Token name = advance();
        advance(); // ':'
        ParseOutcome<ValueNode> value = value();
        if (value.failed()) return value.propagate();
        return ParseOutcome.success(new PropertyNode(name.text(), value.value(), rangeFrom(name)));
    }

    private ParseOutcome<ValueNode> value() {
        Token token = peek();
        switch (token.type()) {
            case STRING:
                advance();
                return ParseOutcome.success(new StringLiteralNode(token.text(), token.range()));
            case NUMBER:
                advance();
                return ParseOutcome.success(number(token));
            case BOOLEAN:
                advance();
                return ParseOutcome.success(new BooleanLiteralNode(Boolean.parseBoolean(token.text()), token.range()));
            case IDENTIFIER:
                advance();
                return ParseOutcome.success(new IdentifierNode(token.text(), token.range()));
            case PUNCTUATION:
                if (token.isPunctuation("[")) return array("]");
                if (token.isPunctuation("(")) return array(")");
                if (token.isPunctuation("{")) return object();
                break;
            default:
                break;
        }
        return ParseOutcome.failure("Expected value, got " + describe(token), token);
    }

    private ParseOutcome<ValueNode> array(String closer) {
        Token open = advance();
        List<ValueNode> elements = new ArrayList<>();
        while (!checkPunctuation(closer)) {
            ParseOutcome<ValueNode> element = nested(this::value);
            if (element.failed()) return element;
            elements.add(element.value());
            if (!matchPunctuation(",")) break;
        }
        ParseOutcome<Token> close = expectPunctuation(closer);
        if (close.failed()) return close.propagate();
        return ParseOutcome.success(new ArrayLiteralNode(elements, rangeFrom(open)));
    }

    private ParseOutcome<ValueNode> object() {
        Token open = advance();
        List<PropertyNode> entries = new ArrayList<>();
        while (!checkPunctuation("}")) {
            Token key = peek();
            if (key.type() != TokenType.IDENTIFIER && key.type() != TokenType.KEYWORD && key.type() != TokenType.STRING) {
                return ParseOutcome.failure("Expected property name, got " + describe(key), key);
            }
            advance();
            ParseOutcome<Token> colon = expectPunctuation(":");
            if (colon.failed()) return colon.propagate();
            ParseOutcome<ValueNode> value = nested(this::value);
            if (value.failed()) return value;
            entries.add(new PropertyNode(key.text(), value.value(), rangeFrom(key)));
            matchSeparator();
        }
        advance(); // '}'
        return ParseOutcome.success(new ObjectLiteralNode(entries, rangeFrom(open)));
    }

    private ParseOutcome<SpawnNode> spawnStatement() {
        Token keyword = advance();
        ParseOutcome<Token> type = expectName("entity type");
        if (type.failed()) return type.propagate();
        if (!peek().isKeyword("at")) {
            return ParseOutcome.failure("Expected 'at' after spawn type, got " + describe(peek()), peek());
        }
        advance();
        ParseOutcome<ExpressionNode> position = expression();
        if (position.failed()) return position.propagate();
        String instanceName = null;
        if (peek().isKeyword("as")) {
            advance();
            ParseOutcome<Token> name = expectName("instance");
            if (name.failed()) return name.propagate();
            instanceName = name.value().text();
        }
        matchPunctuation(";");
        return ParseOutcome.success(new SpawnNode(type.value().text(), position.value(), instanceName, rangeFrom(keyword)));
    }

    private ParseOutcome<EventNode> eventStatement() {
        Token keyword = advance();
        List<String> trigger = new ArrayList<>();
        while (!checkPunctuation(":")) {
            Token token = peek();
            if (isAtEnd() || token.isPunctuation("{") || token.isPunctuation("}")) {
                return ParseOutcome.failure("Expected ':' after event trigger, got " + describe(token), token);
            }
            trigger.add(advance().text());
        }
        if (trigger.isEmpty()) {
            return ParseOutcome.failure("Expected event trigger after '" + keyword.text() + "'", peek());
        }
        advance(); // ':'

        Token handlerStart = peek();
        int consumedBefore = current;
        if (handlerStart.isPunctuation("{")) {
            if (!skipBraces()) {
                return ParseOutcome.failure("Unterminated event handler", handlerStart);
            }
        } else {
            skipHandlerStatement(handlerStart);
        }
        SourceRange handlerRange = current == consumedBefore
                ? SourceRange.at(handlerStart.position())
                : new SourceRange(handlerStart.position(), previous().end());
        return ParseOutcome.success(new EventNode(keyword.text(), String.join(" ", trigger), handlerRange, rangeFrom(keyword)));
    }

    private boolean skipBraces() {
        int open = 0;
        while (!isAtEnd()) {
            Token token = advance();
            if (token.isPunctuation("{")) {
                open++;
            } else if (token.isPunctuation("}")) {
                open--;
                if (open == 0) return true;
            }
        }
        return false;
    }

    private void skipHandlerStatement(Token first) {
        while (!isAtEnd()) {
            Token token = peek();
            if (token.isPunctuation(";")) {
                advance();
                return;
            }
            boolean statementStart = token.type() == TokenType.KEYWORD && STATEMENT_KEYWORDS.contains(token.text());
            if (token.isPunctuation("}") || statementStart || token.line() > first.line()) {
                return;
            }
            advance();
        }
    }

    // Position expressions: additive -> multiplicative -> unary -> postfix -> primary.

    private ParseOutcome<ExpressionNode> expression() {
        ParseOutcome<ExpressionNode> left = multiplicative();
        if (left.failed()) return left;
        ExpressionNode node = left.value();
        while (true) {
            Token token = peek();
            ExpressionNode right;
            String operator;
            if (token.type() == TokenType.OPERATOR && (token.text().equals("+") || token.text().equals("-"))) {
                advance();
                operator = token.text();
                ParseOutcome<ExpressionNode> operand = multiplicative();
                if (operand.failed()) return operand;
                right = operand.value();
            } else if (token.type() == TokenType.NUMBER && token.text().startsWith("-")) {
                // "x -5" lexes the minus into the number literal.
                advance();
                operator = "-";
                SourcePosition afterSign = new SourcePosition(token.line(), token.column() + 1, token.position().offset() + 1);
                String digits = token.text().substring(1);
                right = new NumberLiteralNode(digits, Double.parseDouble(digits), new SourceRange(afterSign, token.end()));
            } else {
                break;
            }
            node = new BinaryExpressionNode(operator, node, right, SourceRange.span(node.range(), right.range()));
        }
        return ParseOutcome.success(node);
    }

    private ParseOutcome<ExpressionNode> multiplicative() {
        ParseOutcome<ExpressionNode> left = unary();
        if (left.failed()) return left;
        ExpressionNode node = left.value();
        while (peek().type() == TokenType.OPERATOR && (peek().text().equals("*") || peek().text().equals("/"))) {
            String operator = advance().text();
            ParseOutcome<ExpressionNode> right = unary();
            if (right.failed()) return right;
            node = new BinaryExpressionNode(operator, node, right.value(), SourceRange.span(node.range(), right.value().range()));
        }
        return ParseOutcome.success(node);
    }

    private ParseOutcome<ExpressionNode> unary() {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && (token.text().equals("-") || token.text().equals("!"))) {
            advance();
            ParseOutcome<ExpressionNode> operand = nested(this::unary);
            if (operand.failed()) return operand;
            return ParseOutcome.success(new UnaryExpressionNode(token.text(), operand.value(), rangeFrom(token)));
        }
        return postfix();
    }

    private ParseOutcome<ExpressionNode> postfix() {
        ParseOutcome<ExpressionNode> primary = primary();
        if (primary.failed()) return primary;
        ExpressionNode node = primary.value();
        while (true) {
            if (checkPunctuation(".") && (peek(1).type() == TokenType.IDENTIFIER || peek(1).type() == TokenType.KEYWORD)) {
                advance();
                Token member = advance();
                node = new MemberExpressionNode(node, member.text(), new SourceRange(node.range().start(), member.end()));
            } else if (checkPunctuation("(") && !(node instanceof NumberLiteralNode)) {
                advance();
                ParseOutcome<List<ExpressionNode>> arguments = arguments(")");
                if (arguments.failed()) return arguments.propagate();
                node = new CallExpressionNode(node, arguments.value(), new SourceRange(node.range().start(), previous().end()));
            } else {
                break;
            }
        }
        return ParseOutcome.success(node);
    }

    private ParseOutcome<ExpressionNode> primary() {
        Token token = peek();
        switch (token.type()) {
            case IDENTIFIER:
                advance();
                return ParseOutcome.success(new IdentifierNode(token.text(), token.range()));
            case NUMBER:
                advance();
                return ParseOutcome.success(number(token));
            case STRING:
                advance();
                return ParseOutcome.success(new StringLiteralNode(token.text(), token.range()));
            case BOOLEAN:
                advance();
                return ParseOutcome.success(new BooleanLiteralNode(Boolean.parseBoolean(token.text()), token.range()));
            case PUNCTUATION:
                if (token.isPunctuation("[")) return vector("]");
                if (token.isPunctuation("(")) return vector(")");
                break;
            default:
                break;
        }
        return ParseOutcome.failure("Expected position expression, got " + describe(token), token);
    }

    private ParseOutcome<ExpressionNode> vector(String closer) {
        Token open = advance();
        ParseOutcome<List<ExpressionNode>> arguments = arguments(closer);
        if (arguments.failed()) return arguments.propagate();
        List<ExpressionNode> values = arguments.value();
        // A parenthesised single expression is a grouping, not a coordinate pair.
        if (closer.equals(")") && values.size() == 1 && !tokens.get(current - 2).isPunctuation(",")) {
            return ParseOutcome.success(values.get(0));
        }
        IdentifierNode callee = new IdentifierNode(CallExpressionNode.VECTOR_CONSTRUCTOR, open.range());
        return ParseOutcome.success(new CallExpressionNode(callee, values, rangeFrom(open)));
    }

    /**
     * Parses a comma-separated expression list after its opening bracket, including the closer.
     */
    private ParseOutcome<List<ExpressionNode>> arguments(String closer) {
        List<ExpressionNode> arguments = new ArrayList<>();
        while (!checkPunctuation(closer)) {
            ParseOutcome<ExpressionNode> argument = nested(this::expression);
            if (argument.failed()) return argument.propagate();
            arguments.add(argument.value());
            if (!matchPunctuation(",")) break;
        }
        ParseOutcome<Token> close = expectPunctuation(closer);
        if (close.failed()) return close.propagate();
        return ParseOutcome.success(arguments);
    }

    /**
     * Runs a rule one nesting level deeper, failing at the current token once
     * {@link #MAX_NESTING_DEPTH} is reached.
     */
    private <T> ParseOutcome<T> nested(Supplier<ParseOutcome<T>> rule) {
        if (depth >= MAX_NESTING_DEPTH) {
            return ParseOutcome.failure("Nesting exceeds the maximum depth of " + MAX_NESTING_DEPTH, peek());
        }
        depth++;
        try {
            return rule.get();
        } finally {
            depth--;
        }
    }

    private NumberLiteralNode number(Token token) {
        return new NumberLiteralNode(token.text(), Double.parseDouble(token.text()), token.range());
    }

    /**
     * Discards tokens until a likely declaration boundary: the offending token is always skipped,
     * then skipping stops after a {@code ;} or {@code }} or before a declaration keyword.
     */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            Token last = previous();
            if (last.isPunctuation(";") || last.isPunctuation("}")) return;
            Token next = peek();
            if (next.type() == TokenType.KEYWORD && DECLARATION_KEYWORDS.contains(next.text())) return;
            advance();
        }
    }

    private ParseOutcome<Token> expectName(String what) {
        if (peek().type() == TokenType.IDENTIFIER) {
            return ParseOutcome.success(advance());
        }
        return ParseOutcome.failure("Expected " + what + " name, got " + describe(peek()), peek());
    }

    private ParseOutcome<Token> expectPunctuation(String text) {
        if (checkPunctuation(text)) {
            return ParseOutcome.success(advance());
        }
        return ParseOutcome.failure("Expected '" + text + "', got " + describe(peek()), peek());
    }

    private boolean matchSeparator() {
        return matchPunctuation(",") || matchPunctuation(";");
    }

    private boolean matchPunctuation(String text) {
        if (checkPunctuation(text)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean checkPunctuation(String text) {
        return peek().isPunctuation(text);
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.END_OF_FILE) return "end of input";
        return "'" + token.text() + "'";
    }

    private SourceRange rangeFrom(Token first) {
        return new SourceRange(first.position(), previous().end());
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }
}

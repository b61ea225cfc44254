package org.gamevibe.compiler.frontend.lexer;

import org.gamevibe.compiler.api.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * GDL source text into a sequence of tokens.
 * <p>
 * The lexer never fails: unrecognized characters become one-character punctuation tokens
 * and unterminated strings are closed at the end of the input. A lexer instance scans its
 * source exactly once.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** The reserved words of GDL. {@code true} and {@code false} are lexed as booleans. */
    public static final Set<String> KEYWORDS = Set.of(
            "game", "entity", "behavior", "scene",
            "sprite", "physics", "body", "animations",
            "properties", "methods", "update",
            "on", "when", "spawn", "at", "as",
            "if", "else", "for", "while",
            "true", "false", "null",
            "grid", "random", "repeat", "within",
            "every", "after", "during"
    );

    private static final String PUNCTUATION = "{}()[],:;";
    private static final String OPERATORS = "+-*/%=<>!&|^~";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private boolean scanned = false;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private SourcePosition tokenStart = SourcePosition.START;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognized tokens, terminated by exactly one {@link TokenType#END_OF_FILE} token.
     * @throws IllegalStateException if this lexer has already been used.
     */
    public List<Token> tokenize() {
        if (scanned) {
            throw new IllegalStateException("Lexer has already tokenized its source; create a new Lexer.");
        }
        scanned = true;
        while (!isAtEnd()) {
            start = current;
            tokenStart = new SourcePosition(line, column, current);
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", here()));
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = peek();
        if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
            advance();
        } else if (c == '/' && peekNext() == '/') {
            while (peek() != '\n' && !isAtEnd()) advance();
        } else if (c == '/' && peekNext() == '*') {
            blockComment();
        } else if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
            number();
        } else if (c == '"' || c == '\'') {
            string();
        } else if (isAlpha(c)) {
            identifier();
        } else if (PUNCTUATION.indexOf(c) >= 0) {
            advance();
            addToken(TokenType.PUNCTUATION);
        } else if (OPERATORS.indexOf(c) >= 0) {
            operator();
        } else {
            advance();
            LOG.debug("Unrecognized character '{}' at {}; emitted as punctuation", c, tokenStart);
            addToken(TokenType.PUNCTUATION);
        }
    }

    private void blockComment() {
        advance();
        advance();
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
        if (!isAtEnd()) {
            advance();
            advance();
        }
    }

    private void number() {
        if (peek() == '-') advance();
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            boolean signed = (next == '+' || next == '-') && isDigit(peekAt(2));
            if (isDigit(next) || signed) {
                advance();
                if (signed) advance();
                while (isDigit(peek())) advance();
            }
        }
        addToken(TokenType.NUMBER);
    }

    private void string() {
        char quote = advance();
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        // Unterminated strings end silently at the end of the input.
        if (!isAtEnd()) advance();
        tokens.add(new Token(TokenType.STRING, value.toString(), tokenStart, here()));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = TokenType.IDENTIFIER;
        if (text.equals("true") || text.equals("false")) {
            type = TokenType.BOOLEAN;
        } else if (KEYWORDS.contains(text)) {
            type = TokenType.KEYWORD;
        }
        addToken(type);
    }

    private void operator() {
        char c = advance();
        char next = peek();
        boolean compound = switch (c) {
            case '=', '!', '<', '>', '+', '-', '*', '/' -> next == '=';
            case '&' -> next == '&';
            case '|' -> next == '|';
            default -> false;
        };
        if (compound) advance();
        addToken(TokenType.OPERATOR);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), tokenStart, here()));
    }

    private SourcePosition here() {
        return new SourcePosition(line, column, current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}

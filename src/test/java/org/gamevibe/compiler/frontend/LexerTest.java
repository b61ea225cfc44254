package org.gamevibe.compiler.frontend;

import org.gamevibe.compiler.api.SourcePosition;
import org.gamevibe.compiler.frontend.lexer.Lexer;
import org.gamevibe.compiler.frontend.lexer.Token;
import org.gamevibe.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that GDL source text is converted into the expected token stream,
 * including literal forms, comments, positions and the lexer's leniency.
 */
public class LexerTest {

    private static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Verifies that a small entity declaration is split into keyword, identifier,
     * punctuation and number tokens, terminated by a single end-of-file token.
     */
    @Test
    @Tag("unit")
    void testDeclarationTokenization() {
        // Arrange
        String source = "entity Player { size: [32, 48] }";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.KEYWORD, "entity"),
                tuple(TokenType.IDENTIFIER, "Player"),
                tuple(TokenType.PUNCTUATION, "{"),
                tuple(TokenType.IDENTIFIER, "size"),
                tuple(TokenType.PUNCTUATION, ":"),
                tuple(TokenType.PUNCTUATION, "["),
                tuple(TokenType.NUMBER, "32"),
                tuple(TokenType.PUNCTUATION, ","),
                tuple(TokenType.NUMBER, "48"),
                tuple(TokenType.PUNCTUATION, "]"),
                tuple(TokenType.PUNCTUATION, "}"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that true and false are booleans even though they are reserved words,
     * while other reserved words such as null stay keywords.
     */
    @Test
    @Tag("unit")
    void testBooleansTakePrecedenceOverKeywords() {
        // Act
        List<Token> tokens = tokenize("true false null");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.BOOLEAN, TokenType.BOOLEAN, TokenType.KEYWORD, TokenType.END_OF_FILE);
    }

    /**
     * Verifies negative, fractional and exponent number forms, and that a dot or exponent marker
     * without following digits is not part of the number.
     */
    @Test
    @Tag("unit")
    void testNumberLiterals() {
        // Act
        List<Token> tokens = tokenize("-2.5 1e3 4E-2 7. 2e");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.NUMBER, "-2.5"),
                tuple(TokenType.NUMBER, "1e3"),
                tuple(TokenType.NUMBER, "4E-2"),
                tuple(TokenType.NUMBER, "7"),
                tuple(TokenType.PUNCTUATION, "."),
                tuple(TokenType.NUMBER, "2"),
                tuple(TokenType.IDENTIFIER, "e"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that string escapes are resolved in the token text for both quote styles.
     */
    @Test
    @Tag("unit")
    void testStringEscapes() {
        // Act
        List<Token> tokens = tokenize("\"a\\\"b\\n\" 'it\\'s' \"x\\qy\"");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.STRING, "a\"b\n"),
                tuple(TokenType.STRING, "it's"),
                tuple(TokenType.STRING, "xqy"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that an unterminated string is closed silently at the end of the input.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringIsClosedAtEndOfInput() {
        // Act
        List<Token> tokens = tokenize("sprite: \"player.png");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "sprite"),
                tuple(TokenType.PUNCTUATION, ":"),
                tuple(TokenType.STRING, "player.png"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that comments produce no tokens and that lines inside block comments are counted.
     */
    @Test
    @Tag("unit")
    void testCommentsAreSkippedAndPositionsTracked() {
        // Arrange
        String source = "// line comment\n/* block\n comment */ game";

        // Act
        List<Token> tokens = tokenize(source);

        // Assert
        assertThat(tokens).hasSize(2);
        Token game = tokens.get(0);
        assertThat(game.isKeyword("game")).isTrue();
        assertThat(game.position()).isEqualTo(new SourcePosition(3, 13, 37));
        assertThat(game.end()).isEqualTo(new SourcePosition(3, 17, 41));
    }

    /**
     * Verifies greedy combination of operator characters.
     */
    @Test
    @Tag("unit")
    void testCompoundOperators() {
        // Act
        List<Token> tokens = tokenize("== != && || >= + - *");

        // Assert
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.OPERATOR)
                .extracting(Token::text)
                .containsExactly("==", "!=", "&&", "||", ">=", "+", "-", "*");
    }

    /**
     * Verifies that unknown characters become one-character punctuation tokens instead of errors.
     */
    @Test
    @Tag("unit")
    void testUnknownCharactersBecomePunctuation() {
        // Act
        List<Token> tokens = tokenize("player.x @");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "player"),
                tuple(TokenType.PUNCTUATION, "."),
                tuple(TokenType.IDENTIFIER, "x"),
                tuple(TokenType.PUNCTUATION, "@"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that the end-of-file token is positioned after the last character.
     */
    @Test
    @Tag("unit")
    void testEndOfFilePosition() {
        // Act
        List<Token> tokens = tokenize("ab\n");

        // Assert
        assertThat(tokens.get(tokens.size() - 1).position()).isEqualTo(new SourcePosition(2, 1, 3));
    }

    /**
     * Verifies that a lexer cannot be used twice.
     */
    @Test
    @Tag("unit")
    void testLexerIsNotRestartable() {
        // Arrange
        Lexer lexer = new Lexer("game {}");
        lexer.tokenize();

        // Act & Assert
        assertThatThrownBy(lexer::tokenize).isInstanceOf(IllegalStateException.class);
    }

    /**
     * Verifies that Unicode space characters such as a no-break space separate tokens like ordinary spaces.
     */
    @Test
    @Tag("unit")
    void testUnicodeSpacesAreWhitespace() {
        // Act
        List<Token> tokens = tokenize("game\u00A0{\u2003}");

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.KEYWORD, "game"),
                tuple(TokenType.PUNCTUATION, "{"),
                tuple(TokenType.PUNCTUATION, "}"),
                tuple(TokenType.END_OF_FILE, ""));
        assertThat(tokens.get(1).position()).isEqualTo(new SourcePosition(1, 6, 5));
    }
}

package snek.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static snek.lang.Token.Type.ASSIGN;
import static snek.lang.Token.Type.EOF;
import static snek.lang.Token.Type.IDENTIFIER;
import static snek.lang.Token.Type.NEW_LINE;
import static snek.lang.Token.Type.NUMBER;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
        assertEquals(expect, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "x = 1\ny\n";
        stream = new TokenStream(Lexer.tokenize(source).tokens());
        expectAtEnd = false;
    }

    @Test
    void advance() {
        assertNextToken(new Token(IDENTIFIER, "x", 0, 1, 1));
        assertNextToken(new Token(ASSIGN, "=", 2, 1, 3));
        assertNextToken(new Token(NUMBER, "1", 4, 1, 5));
        assertNextToken(new Token(NEW_LINE, "\n", 5, 1, 6));
        assertNextToken(new Token(IDENTIFIER, "y", 6, 2, 1));
        assertNextToken(new Token(NEW_LINE, "\n", 7, 2, 2));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 8, 3, 1));
        // the cursor stays on EOF
        assertNextToken(new Token(EOF, "", 8, 3, 1));
    }

    @Test
    void peekNext() {
        assertEquals(new Token(ASSIGN, "=", 2, 1, 3), stream.peekNext());
        assertEquals(new Token(IDENTIFIER, "x", 0, 1, 1), stream.peek());
    }

    @Test
    void resetToCheckpoint() {
        stream.advance();
        stream.advance();
        var checkpoint = stream.mark();
        stream.advance();
        stream.advance();
        stream.advance();

        stream.reset(checkpoint);

        assertEquals(new Token(NUMBER, "1", 4, 1, 5), stream.peek());
        assertEquals(new Token(ASSIGN, "=", 2, 1, 3), stream.previous());
    }

    @Test
    void resetToStart() {
        var checkpoint = stream.mark();
        stream.advance();

        stream.reset(checkpoint);

        assertEquals(new Token(IDENTIFIER, "x", 0, 1, 1), stream.previous());
        assertEquals(new Token(IDENTIFIER, "x", 0, 1, 1), stream.advance());
    }

    @Test
    void resetRejectsPositionsAhead() {
        assertThrows(IllegalArgumentException.class, () -> stream.reset(3));
    }

    @Test
    void appendsMissingEof() {
        stream = new TokenStream(List.of(new Token(IDENTIFIER, "abc", 0, 1, 1)));

        assertNextToken(new Token(IDENTIFIER, "abc", 0, 1, 1));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 3, 1, 4));
    }

    @Test
    void emptyList() {
        stream = new TokenStream(List.of());

        assertTrue(stream.isAtEnd());
        assertEquals(EOF, stream.advance().type());
    }
}

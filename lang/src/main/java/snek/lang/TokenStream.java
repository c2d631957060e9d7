package snek.lang;

import static snek.lang.Token.Type.EOF;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;

/**
 * Forward-only cursor over a token list. The cursor never moves past
 * {@code EOF}; a list that does not end with one gets a synthetic
 * {@code EOF} appended.
 *
 * <p>{@link #mark()} and {@link #reset(int)} give the parser a checkpoint to
 * return to when a tentative alternative does not pan out.
 */
public final class TokenStream {

    private final List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    public TokenStream(@NonNull List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != EOF) {
            var terminated = new ArrayList<>(tokens);
            terminated.add(endOf(tokens));
            tokens = terminated;
        }
        this.tokens = List.copyOf(tokens);
    }

    private static Token endOf(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return new Token(EOF, "", 0, 1, 1);
        }
        var last = tokens.get(tokens.size() - 1);
        var offset = last.offset() + last.lexeme().length();
        return new Token(EOF, "", offset, last.line(), last.column() + last.lexeme().length());
    }

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return peek().type() == EOF;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token peekNext() {
        if (isAtEnd()) {
            return peek();
        }
        return tokens.get(current + 1);
    }

    public Token advance() {
        previous = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        return previous;
    }

    /** Returns a checkpoint for the current position. */
    public int mark() {
        return current;
    }

    /** Moves the cursor back to a checkpoint taken with {@link #mark()}. */
    public void reset(int mark) {
        if (mark < 0 || mark > current) {
            throw new IllegalArgumentException("Not a checkpoint behind the cursor: " + mark);
        }
        current = mark;
        previous = mark > 0 ? tokens.get(mark - 1) : null;
    }
}

package snek.lang;

import lombok.NonNull;

/**
 * A syntax error found by the {@link Parser}. For token mismatches
 * {@code expected} names the token type the grammar required; otherwise it
 * is null.
 */
public record ParseError(
    @NonNull String message,
    Token.Type expected,
    @NonNull Token.Type actual,
    int offset,
    int line,
    int column) {

    static ParseError mismatch(Token.Type expected, Token actual) {
        var message = "expected token to be " + expected + ", got " + actual.type() + " instead";
        return new ParseError(message, expected, actual.type(), actual.offset(), actual.line(), actual.column());
    }

    static ParseError at(Token token, String message) {
        return new ParseError(message, null, token.type(), token.offset(), token.line(), token.column());
    }

    @Override
    public String toString() {
        return message + " [line " + line + ", col " + column + "]";
    }
}

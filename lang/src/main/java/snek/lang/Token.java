package snek.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int offset,
    int line,
    int column) {

    boolean is(Type type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return "(Token " + type + " \"" + escape(lexeme) + "\" " + line + ":" + column + ")";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t");
    }

    public enum Type {
        // literals
        NUMBER,
        STRING,
        IDENTIFIER,

        // keywords
        DEF,
        IF,
        ELIF,
        ELSE,
        FOR,
        IN,
        WHILE,
        PASS,
        BREAK,
        CONTINUE,
        RETURN,
        GLOBAL,
        IMPORT,
        FROM,
        OR,
        AND,
        NOT,

        // operators, one type per precedence class
        COMPARE,
        ASSIGN,
        SUM,
        PRODUCT,
        EXP,

        PAREN_LEFT,
        PAREN_RIGHT,
        BRACKET_LEFT,
        BRACKET_RIGHT,
        BRACE_LEFT,
        BRACE_RIGHT,
        COMMA,
        COLON,
        SEMICOLON,
        DOT,

        // block structure
        NEW_LINE,
        INDENT,
        DEDENT,

        // end-of-file
        EOF,

        UNKNOWN;
    }
}

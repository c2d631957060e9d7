package snek.lang;

import static java.util.Map.entry;
import static snek.lang.Token.Type.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns source text into tokens in a single forward pass.
 *
 * <p>Block structure is derived from the width of each line's leading
 * whitespace: a deeper line opens a block with {@code INDENT}, a shallower
 * one closes blocks with one {@code DEDENT} per level. Blank and
 * comment-only lines never affect the indentation stack.
 *
 * <p>Scanning never fails. Indentation problems are collected as
 * {@link #getErrors() errors}, unrecognized input becomes {@code UNKNOWN}
 * tokens, and the token list always ends with {@code EOF}.
 */
@Slf4j
@RequiredArgsConstructor
public final class Lexer {

    public static record Message(int line, int column, String message) {}

    public static record Result(List<Token> tokens, List<Message> errors, List<Message> warnings) {

        public Result {
            tokens = List.copyOf(tokens);
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("def", DEF),
        entry("if", IF),
        entry("elif", ELIF),
        entry("else", ELSE),
        entry("for", FOR),
        entry("in", IN),
        entry("while", WHILE),
        entry("pass", PASS),
        entry("break", BREAK),
        entry("continue", CONTINUE),
        entry("return", RETURN),
        entry("global", GLOBAL),
        entry("import", IMPORT),
        entry("from", FROM),
        entry("or", OR),
        entry("and", AND),
        entry("not", NOT));

    public static Result tokenize(@NonNull String source) {
        var lexer = new Lexer(source);
        return new Result(lexer.getTokens(), lexer.getErrors(), lexer.getWarnings());
    }

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();

    @Getter
    private final List<Message> errors = new ArrayList<>();

    @Getter
    private final List<Message> warnings = new ArrayList<>();

    // leading whitespace of each open block, innermost first; its length is
    // the block's width and the base level "" is never popped
    private final Deque<String> indents = new ArrayDeque<>(List.of(""));

    private boolean atLineStart = true;
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return Collections.unmodifiableList(tokens);
        }

        while (!isAtEnd()) {
            begin();
            if (atLineStart) {
                indentation();
            } else {
                scanToken();
            }
        }

        begin(); // report the correct EOF column
        if (!tokens.isEmpty() && !checkLast(NEW_LINE)) {
            addToken(NEW_LINE, "");
        }
        while (!indents.peek().isEmpty()) {
            indents.pop();
            addToken(DEDENT, "");
        }
        addToken(EOF, "");

        log.debug("Scanned {} tokens ({} errors, {} warnings)", tokens.size(), errors.size(), warnings.size());
        return Collections.unmodifiableList(tokens);
    }

    private void begin() {
        start = current;
        startLine = line;
        startColumn = 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * Measures the leading whitespace of a line and emits the block
     * structure tokens for it. Blank and comment-only lines are consumed
     * whole and leave the scanner at the start of the next line.
     */
    private void indentation() {
        var spaces = false;
        var tabs = false;
        while (peek() == ' ' || peek() == '\t') {
            if (advance() == ' ') {
                spaces = true;
            } else {
                tabs = true;
            }
        }

        if (isAtEnd() || peek() == '\n' || peek() == '#' || (peek() == '\r' && peekNext() == '\n')) {
            while (peek() != '\n' && !isAtEnd()) {
                advance();
            }
            if (match('\n')) {
                newLine();
            }
            return;
        }

        atLineStart = false;
        var whitespace = source.substring(start, current);
        if ((spaces && tabs) || !consistent(whitespace)) {
            error("inconsistent use of tabs and spaces in indentation");
        }

        var width = whitespace.length();
        if (width > indents.peek().length()) {
            indents.push(whitespace);
            addToken(INDENT);
            return;
        }

        begin();
        while (width < indents.peek().length()) {
            indents.pop();
            addToken(DEDENT, "");
        }
        if (width != indents.peek().length()) {
            error("unindent does not match any outer indentation level");
        }
    }

    /**
     * A line must spell its indentation the same way as the open block it
     * lands on, and a deeper line must start with the enclosing block's.
     */
    private boolean consistent(String whitespace) {
        var top = indents.peek();
        if (whitespace.length() > top.length()) {
            return whitespace.startsWith(top);
        }
        for (var level : indents) {
            if (level.length() == whitespace.length()) {
                return level.equals(whitespace);
            }
        }
        // no open level has this width, reported as a bad unindent
        return true;
    }

    private void scanToken() {
        var c = advance();
        switch (c) {
        case '(':
            addToken(PAREN_LEFT);
            break;
        case ')':
            addToken(PAREN_RIGHT);
            break;
        case '[':
            addToken(BRACKET_LEFT);
            break;
        case ']':
            addToken(BRACKET_RIGHT);
            break;
        case '{':
            addToken(BRACE_LEFT);
            break;
        case '}':
            addToken(BRACE_RIGHT);
            break;
        case ',':
            addToken(COMMA);
            break;
        case ':':
            addToken(COLON);
            break;
        case ';':
            addToken(SEMICOLON);
            break;
        case '.':
            if (isDigit(peek())) {
                number();
            } else {
                addToken(DOT);
            }
            break;
        case '=':
            addToken(match('=') ? COMPARE : ASSIGN);
            break;
        case '!':
            addToken(match('=') ? COMPARE : UNKNOWN);
            break;
        case '<':
        case '>':
            match('=');
            addToken(COMPARE);
            break;
        case '+':
        case '-':
            addToken(match('=') ? ASSIGN : SUM);
            break;
        case '*':
            if (match('*')) {
                addToken(match('=') ? ASSIGN : EXP);
            } else {
                addToken(match('=') ? ASSIGN : PRODUCT);
            }
            break;
        case '/':
            match('/');
            addToken(match('=') ? ASSIGN : PRODUCT);
            break;
        case '%':
            addToken(match('=') ? ASSIGN : PRODUCT);
            break;
        case '#':
            while (peek() != '\n' && !isAtEnd()) {
                advance();
            }
            break;

        // whitespace
        case ' ':
        case '\r':
        case '\t':
        case '\f':
            // completely ignore
            break;

        case '\\':
            // line continuation, the next physical line joins this one
            if (match('\n')) {
                newLine();
            } else if (peek() == '\r' && peekNext() == '\n') {
                advance();
                advance();
                newLine();
            } else {
                addToken(UNKNOWN);
            }
            break;

        case '\n':
            addToken(NEW_LINE);
            newLine();
            atLineStart = true;
            break;

        case '"':
        case '\'':
            string(c);
            break;

        default:
            if (isDigit(c)) {
                number();
            } else if (isAlpha(c)) {
                identifier();
            } else {
                addToken(UNKNOWN);
            }
        }
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        var type = keywords.getOrDefault(text, IDENTIFIER);
        if (type == NOT && notIn()) {
            addToken(IN, "not in");
        } else {
            addToken(type);
        }
    }

    /**
     * Consumes the {@code in} of a {@code not in} operator, if that is what
     * follows. The two words may be separated by blanks and line continuations.
     */
    private boolean notIn() {
        var index = current;
        var lines = 0;
        var nextLineStart = lineStart;
        for (;;) {
            if (index < source.length() && (source.charAt(index) == ' ' || source.charAt(index) == '\t')) {
                index++;
            } else if (source.startsWith("\\\n", index)) {
                index += 2;
                lines++;
                nextLineStart = index;
            } else if (source.startsWith("\\\r\n", index)) {
                index += 3;
                lines++;
                nextLineStart = index;
            } else {
                break;
            }
        }
        if (index == current || !source.startsWith("in", index)) {
            return false;
        }
        var end = index + 2;
        if (end < source.length() && isAlphaNumeric(source.charAt(end))) {
            return false;
        }
        current = end;
        line += lines;
        lineStart = nextLineStart;
        return true;
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }

        // is decimal?
        if (source.charAt(start) != '.' && peek() == '.' && isDigit(peekNext())) {
            // consume the decimal
            advance();

            while (isDigit(peek())) {
                advance();
            }
        }

        if (isAlpha(peek())) {
            // e.g. "12abc" is one bad token, not a number and a name
            while (isAlphaNumeric(peek())) {
                advance();
            }
            addToken(UNKNOWN);
        } else {
            addToken(NUMBER);
        }
    }

    private void string(char quote) {
        while (peek() != quote && peek() != '\n' && !isAtEnd()) {
            if (advance() == '\\' && !isAtEnd()) {
                if (advance() == '\n') {
                    newLine();
                }
            }
        }
        if (!match(quote)) {
            warning("Unterminated string.");
            addToken(UNKNOWN);
            return;
        }
        addToken(STRING);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private boolean checkLast(Token.Type type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == type;
    }

    private void addToken(Token.Type type) {
        addToken(type, source.substring(start, current));
    }

    private void addToken(Token.Type type, String lexeme) {
        tokens.add(new Token(type, lexeme, start, startLine, startColumn));
    }

    private void error(String msg) {
        errors.add(new Message(startLine, startColumn, msg));
    }

    private void warning(String msg) {
        warnings.add(new Message(startLine, startColumn, msg));
    }
}

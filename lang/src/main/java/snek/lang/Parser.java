package snek.lang;

import static snek.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recursive-descent parser for snek. Statements are parsed by dispatching
 * on their leading keyword; expressions by precedence climbing over
 * {@link Precedence}.
 *
 * <p>Grammar rules do not throw. Each one returns a {@link Parsed} holding
 * the node it built and, on failure, the error together with the partial
 * node. Whether parsing goes on after the first error, and how deeply
 * blocks and expressions may nest, is decided by {@link ParserOptions}.
 */
@Slf4j
@RequiredArgsConstructor
public final class Parser {

    public static record Result(Ast.Block root, List<ParseError> errors) {

        public Result {
            errors = List.copyOf(errors);
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    public static Result parse(@NonNull List<Token> tokens) {
        return parse(tokens, ParserOptions.defaults());
    }

    public static Result parse(@NonNull List<Token> tokens, @NonNull ParserOptions options) {
        var parser = new Parser(new TokenStream(tokens), options);
        var root = parser.parse();
        return new Result(root, parser.getErrors());
    }

    private final @NonNull TokenStream tokens;
    private final @NonNull ParserOptions options;

    @Getter
    private final List<ParseError> errors = new ArrayList<>();

    // current depth of the tree under construction, see ParserOptions#maxDepth
    private int depth = 0;

    public Parser(TokenStream tokens) {
        this(tokens, ParserOptions.defaults());
    }

    public Ast.Block parse() {
        return file();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    //// statements ////

    /**
     * <pre>
     * file        :: statement* EOF
     * </pre>
     */
    private Ast.Block file() {
        var statements = new ArrayList<Ast>();
        while (!isAtEnd()) {
            if (check(DEDENT) && hasErrors()) {
                // closes a block whose opening line was skipped during recovery
                advance();
                continue;
            }
            var start = tokens.mark();
            var result = statement();
            collect(statements, result.node());
            if (result.failed()) {
                errors.add(result.error());
                if (!options.recover() || errors.size() >= options.maxErrors()) {
                    break;
                }
                synchronize(start);
            }
        }
        log.debug("Parsed {} top-level statements, {} errors", statements.size(), errors.size());
        return new Ast.Block(statements);
    }

    /**
     * <pre>
     * statement   :: if | while | for | def | simple
     * </pre>
     */
    private Parsed<? extends Ast> statement() {
        trace("statement");
        switch (peek().type()) {
        case IF:
            return ifStatement(false);
        case WHILE:
            return whileStatement();
        case FOR:
            return forStatement();
        case DEF:
            return functionDef();
        case INDENT:
            return Parsed.<Ast>fail(null, ParseError.at(peek(), "unexpected indent"));
        default:
            return simpleStatements();
        }
    }

    /**
     * <pre>
     * block       :: simple
     *              | NEW_LINE INDENT statement+ DEDENT
     * </pre>
     */
    private Parsed<Ast.Block> block() {
        trace("block");
        if (depth >= options.maxDepth()) {
            return Parsed.fail(null, ParseError.at(peek(), "block too deeply nested"));
        }
        depth++;
        var block = blockBody();
        depth--;
        return block;
    }

    private Parsed<Ast.Block> blockBody() {
        if (!check(NEW_LINE)) {
            return simpleStatements();
        }
        advance();

        var statements = new ArrayList<Ast>();
        var error = expect(INDENT);
        if (error != null) {
            return Parsed.fail(new Ast.Block(statements), error);
        }

        while (!check(DEDENT) && !isAtEnd()) {
            var result = statement();
            collect(statements, result.node());
            if (result.failed()) {
                return result.as(new Ast.Block(statements));
            }
        }
        return new Parsed<>(new Ast.Block(statements), expect(DEDENT));
    }

    /**
     * <pre>
     * simple      :: small ( ";" small )* ";"? NEW_LINE
     * </pre>
     */
    private Parsed<Ast.Block> simpleStatements() {
        trace("simpleStatements");
        var statements = new ArrayList<Ast>();
        while (!check(NEW_LINE) && !isAtEnd()) {
            var result = smallStatement();
            if (result.node() != null) {
                statements.add(result.node());
            }
            if (result.failed()) {
                return result.as(new Ast.Block(statements));
            }
            if (!match(SEMICOLON)) {
                break;
            }
        }

        var line = new Ast.Block(statements);
        if (statements.isEmpty()) {
            return Parsed.fail(line, ParseError.at(peek(), "empty simple statements"));
        }
        if (isAtEnd()) {
            return Parsed.ok(line);
        }
        return new Parsed<>(line, expect(NEW_LINE));
    }

    /**
     * <pre>
     * small       :: "pass" | "break" | "continue"
     *              | return | global | import | from
     *              | assignment
     * </pre>
     */
    private Parsed<? extends Ast> smallStatement() {
        switch (peek().type()) {
        case PASS:
        case BREAK:
        case CONTINUE:
            return Parsed.ok(new Ast.Control(advance().lexeme()));
        case RETURN:
            return returnStatement();
        case GLOBAL:
            return globalStatement();
        case IMPORT:
            return importStatement();
        case FROM:
            return fromStatement();
        default:
            return assignment();
        }
    }

    /**
     * <pre>
     * return      :: "return" expressions
     * </pre>
     */
    private Parsed<Ast.Return> returnStatement() {
        advance();
        if (check(NEW_LINE) || check(SEMICOLON) || isAtEnd()) {
            return Parsed.fail(new Ast.Return(null), ParseError.at(peek(), "'return' requires a value"));
        }
        var value = expressions(Precedence.LOWEST);
        return value.as(new Ast.Return(value.node()));
    }

    /**
     * <pre>
     * global      :: "global" IDENTIFIER ( "," IDENTIFIER )*
     * </pre>
     */
    private Parsed<Ast.Global> globalStatement() {
        advance();
        var names = new ArrayList<String>();
        var error = names(names);
        return new Parsed<>(new Ast.Global(names), error);
    }

    /**
     * <pre>
     * import      :: "import" dotted ( "," dotted )*
     * dotted      :: IDENTIFIER ( "." IDENTIFIER )*
     * </pre>
     */
    private Parsed<Ast.Import> importStatement() {
        advance();
        var modules = new ArrayList<String>();
        do {
            var module = dottedName();
            if (module.failed()) {
                return module.as(new Ast.Import(null, modules));
            }
            modules.add(module.node());
        } while (match(COMMA));
        return Parsed.ok(new Ast.Import(null, modules));
    }

    /**
     * <pre>
     * from        :: "from" dotted "import" IDENTIFIER ( "," IDENTIFIER )*
     * </pre>
     */
    private Parsed<Ast.Import> fromStatement() {
        advance();
        var names = new ArrayList<String>();
        var module = dottedName();
        if (module.failed()) {
            return module.as(new Ast.Import(null, names));
        }
        var error = expect(IMPORT);
        if (error == null) {
            error = names(names);
        }
        return new Parsed<>(new Ast.Import(module.node(), names), error);
    }

    /**
     * Tries an assignment first and falls back to a bare expression
     * statement when no assignment operator follows the first expression.
     *
     * <pre>
     * assignment  :: expression ASSIGN expressions
     *              | expressions
     * </pre>
     */
    private Parsed<? extends Ast> assignment() {
        trace("assignment");
        var checkpoint = tokens.mark();
        var target = expression(Precedence.LOWEST);
        if (target.failed()) {
            return target;
        }
        if (!check(ASSIGN)) {
            tokens.reset(checkpoint);
            return expressions(Precedence.LOWEST);
        }

        var operator = advance().lexeme();
        var value = expressions(Precedence.LOWEST);
        return value.as(new Ast.Assignment(target.node(), operator, value.node()));
    }

    /**
     * <pre>
     * if          :: "if" expression ":" block ( elif | else )?
     * elif        :: "elif" expression ":" block ( elif | else )?
     * else        :: "else" ":" block
     * </pre>
     */
    private Parsed<Ast.If> ifStatement(boolean elif) {
        trace(elif ? "elif" : "if");
        var error = expect(elif ? ELIF : IF);
        if (error != null) {
            return Parsed.fail(new Ast.If(null, null, null), error);
        }

        var condition = expression(Precedence.LOWEST);
        if (condition.failed()) {
            return condition.as(new Ast.If(condition.node(), null, null));
        }

        error = expect(COLON);
        if (error != null) {
            return Parsed.fail(new Ast.If(condition.node(), null, null), error);
        }

        var body = block();
        if (body.failed()) {
            return body.as(new Ast.If(condition.node(), body.node(), null));
        }

        if (check(ELIF)) {
            var orElse = ifStatement(true);
            return orElse.as(new Ast.If(condition.node(), body.node(), orElse.node()));
        }
        if (match(ELSE)) {
            var orElse = elseClause();
            return orElse.as(new Ast.If(condition.node(), body.node(), orElse.node()));
        }
        return Parsed.ok(new Ast.If(condition.node(), body.node(), null));
    }

    /**
     * <pre>
     * while       :: "while" expression ":" block else?
     * </pre>
     */
    private Parsed<Ast.While> whileStatement() {
        trace("while");
        advance();

        var condition = expression(Precedence.LOWEST);
        if (condition.failed()) {
            return condition.as(new Ast.While(condition.node(), null, null));
        }

        var error = expect(COLON);
        if (error != null) {
            return Parsed.fail(new Ast.While(condition.node(), null, null), error);
        }

        var body = block();
        if (body.failed() || !match(ELSE)) {
            return body.as(new Ast.While(condition.node(), body.node(), null));
        }

        var orElse = elseClause();
        return orElse.as(new Ast.While(condition.node(), body.node(), orElse.node()));
    }

    /**
     * The target is parsed above comparison strength so that the {@code in}
     * keyword is left for this rule.
     *
     * <pre>
     * for         :: "for" targets "in" expressions ":" block else?
     * </pre>
     */
    private Parsed<Ast.For> forStatement() {
        trace("for");
        advance();

        var target = expressions(Precedence.COMPARE);
        if (target.failed()) {
            return target.as(new Ast.For(target.node(), null, null, null));
        }

        ParseError error = null;
        if (!check(IN)) {
            error = ParseError.mismatch(IN, peek());
        } else if (!"in".equals(peek().lexeme())) {
            error = ParseError.at(peek(), "expected 'in', got '" + peek().lexeme() + "' instead");
        }
        if (error != null) {
            return Parsed.fail(new Ast.For(target.node(), null, null, null), error);
        }
        advance();

        var iterable = expressions(Precedence.LOWEST);
        if (iterable.failed()) {
            return iterable.as(new Ast.For(target.node(), iterable.node(), null, null));
        }

        error = expect(COLON);
        if (error != null) {
            return Parsed.fail(new Ast.For(target.node(), iterable.node(), null, null), error);
        }

        var body = block();
        if (body.failed() || !match(ELSE)) {
            return body.as(new Ast.For(target.node(), iterable.node(), body.node(), null));
        }

        var orElse = elseClause();
        return orElse.as(new Ast.For(target.node(), iterable.node(), body.node(), orElse.node()));
    }

    private Parsed<Ast.Block> elseClause() {
        var error = expect(COLON);
        if (error != null) {
            return Parsed.fail(null, error);
        }
        return block();
    }

    /**
     * <pre>
     * def         :: "def" IDENTIFIER "(" params? ")" ":" block
     * params      :: param ( "," param )* ","?
     * param       :: IDENTIFIER ( "=" expression )?
     * </pre>
     */
    private Parsed<Ast.FunctionDef> functionDef() {
        trace("def");
        advance();

        var params = new ArrayList<Ast.Param>();
        if (!check(IDENTIFIER)) {
            return Parsed.fail(new Ast.FunctionDef(null, params, null), ParseError.mismatch(IDENTIFIER, peek()));
        }
        var name = advance().lexeme();

        var error = expect(PAREN_LEFT);
        if (error == null) {
            error = params(params);
        }
        if (error == null) {
            error = expect(PAREN_RIGHT);
        }
        if (error == null) {
            error = expect(COLON);
        }
        if (error != null) {
            return Parsed.fail(new Ast.FunctionDef(name, params, null), error);
        }

        var body = block();
        return body.as(new Ast.FunctionDef(name, params, body.node()));
    }

    /** Parameters with a default value must all come after those without one. */
    private ParseError params(List<Ast.Param> params) {
        var defaults = false;
        while (check(IDENTIFIER)) {
            var name = advance();
            if (check(ASSIGN) && "=".equals(peek().lexeme())) {
                advance();
                var value = expression(Precedence.LOWEST);
                params.add(new Ast.Param(name.lexeme(), value.node()));
                if (value.failed()) {
                    return value.error();
                }
                defaults = true;
            } else {
                params.add(new Ast.Param(name.lexeme(), null));
                if (defaults) {
                    return ParseError.at(name, "non-default argument follows default argument");
                }
            }

            if (!match(COMMA)) {
                break;
            }
        }
        return null;
    }

    //// expressions ////

    /**
     * A single expression stands for itself; two or more make an
     * {@link Ast.ExpressionList}.
     *
     * <pre>
     * expressions :: expression ( "," expression )*
     * </pre>
     */
    private Parsed<Ast> expressions(Precedence precedence) {
        var first = expression(precedence);
        if (first.failed() || !check(COMMA)) {
            return first;
        }

        var expressions = new ArrayList<Ast>();
        expressions.add(first.node());
        while (match(COMMA)) {
            var next = expression(precedence);
            if (next.node() != null) {
                expressions.add(next.node());
            }
            if (next.failed()) {
                return next.as(new Ast.ExpressionList(expressions));
            }
        }
        return Parsed.ok(new Ast.ExpressionList(expressions));
    }

    /**
     * Parses a prefix expression, then folds in infix operators for as long
     * as they bind tighter than {@code precedence}.
     */
    private Parsed<Ast> expression(Precedence precedence) {
        trace("expression");
        var outer = depth;
        var left = nest(null);
        if (!left.failed()) {
            left = prefix();
        }
        while (!left.failed() && precedence.isWeakerThan(Precedence.of(peek().type()))) {
            left = nest(left.node());
            if (!left.failed()) {
                left = infix(left.node());
            }
        }
        depth = outer;
        return left;
    }

    /** Enters one more level of the expression tree, failing once {@link ParserOptions#maxDepth()} is reached. */
    private Parsed<Ast> nest(Ast node) {
        if (depth >= options.maxDepth()) {
            return Parsed.fail(node, ParseError.at(peek(), "expression too deeply nested"));
        }
        depth++;
        return Parsed.ok(node);
    }

    /**
     * <pre>
     * prefix      :: IDENTIFIER | NUMBER | STRING
     *              | ( "+" | "-" ) expression
     *              | "not" expression
     *              | "(" expression ")"
     * </pre>
     */
    private Parsed<Ast> prefix() {
        var token = peek();
        switch (token.type()) {
        case IDENTIFIER:
            advance();
            return Parsed.ok(new Ast.Identifier(token.lexeme()));
        case NUMBER:
            advance();
            return Parsed.ok(new Ast.Number(token.lexeme()));
        case STRING:
            advance();
            return Parsed.ok(new Ast.StringLiteral(token.lexeme()));
        case SUM:
            advance();
            return unary(token, Precedence.PREFIX);
        case NOT:
            advance();
            return unary(token, Precedence.NOT);
        case PAREN_LEFT:
            return grouping();
        default:
            return Parsed.fail(null, ParseError.at(token, "no prefix parse function for " + token.type()));
        }
    }

    private Parsed<Ast> unary(Token operator, Precedence precedence) {
        var operand = expression(precedence);
        return operand.as(new Ast.Prefix(operator.lexeme(), operand.node()));
    }

    private Parsed<Ast> grouping() {
        advance();
        var expression = expression(Precedence.LOWEST);
        if (expression.failed()) {
            return expression;
        }
        return new Parsed<>(expression.node(), expect(PAREN_RIGHT));
    }

    /**
     * <pre>
     * infix       :: expression OPERATOR expression
     *              | expression "(" ( expression ( "," expression )* ","? )? ")"
     *              | expression "[" expression "]"
     *              | expression "." IDENTIFIER
     * </pre>
     */
    private Parsed<Ast> infix(Ast left) {
        var token = peek();
        switch (token.type()) {
        case OR:
        case AND:
        case COMPARE:
        case IN:
        case SUM:
        case PRODUCT:
            return binary(left, Precedence.of(token.type()));
        case EXP:
            // one step weaker on the right, so a ** b ** c is a ** (b ** c)
            return binary(left, Precedence.EXP.weaker());
        case PAREN_LEFT:
            return call(left);
        case BRACKET_LEFT:
            return subscript(left);
        case DOT:
            return attribute(left);
        default:
            return Parsed.fail(left, ParseError.at(token, "no infix parse function for " + token.type()));
        }
    }

    private Parsed<Ast> binary(Ast left, Precedence precedence) {
        var operator = advance();
        var right = expression(precedence);
        return right.as(new Ast.Infix(left, operator.lexeme(), right.node()));
    }

    private Parsed<Ast> call(Ast callee) {
        advance();
        var arguments = new ArrayList<Ast>();
        while (!check(PAREN_RIGHT)) {
            var argument = expression(Precedence.LOWEST);
            if (argument.node() != null) {
                arguments.add(argument.node());
            }
            if (argument.failed()) {
                return argument.as(new Ast.Call(callee, arguments));
            }
            if (!match(COMMA)) {
                break;
            }
        }
        return new Parsed<>(new Ast.Call(callee, arguments), expect(PAREN_RIGHT));
    }

    private Parsed<Ast> subscript(Ast object) {
        advance();
        var index = expression(Precedence.LOWEST);
        if (index.failed()) {
            return index.as(new Ast.Subscript(object, index.node()));
        }
        return new Parsed<>(new Ast.Subscript(object, index.node()), expect(BRACKET_RIGHT));
    }

    private Parsed<Ast> attribute(Ast object) {
        advance();
        if (!check(IDENTIFIER)) {
            return Parsed.fail(object, ParseError.mismatch(IDENTIFIER, peek()));
        }
        return Parsed.ok(new Ast.Attribute(object, advance().lexeme()));
    }

    //// utility methods ////

    private Parsed<String> dottedName() {
        var name = new StringBuilder();
        do {
            if (!check(IDENTIFIER)) {
                return Parsed.fail(null, ParseError.mismatch(IDENTIFIER, peek()));
            }
            if (name.length() > 0) {
                name.append('.');
            }
            name.append(advance().lexeme());
        } while (match(DOT));
        return Parsed.ok(name.toString());
    }

    private ParseError names(List<String> names) {
        do {
            if (!check(IDENTIFIER)) {
                return ParseError.mismatch(IDENTIFIER, peek());
            }
            names.add(advance().lexeme());
        } while (match(COMMA));
        return null;
    }

    /** Adds a parsed statement to {@code statements}, unpacking a line of simple statements. */
    private static void collect(List<Ast> statements, Ast node) {
        if (node instanceof Ast.Block line) {
            statements.addAll(line.statements());
        } else if (node != null) {
            statements.add(node);
        }
    }

    /**
     * Skips to the start of the next line after a failed statement. A
     * statement that failed right after consuming its line break resumes
     * where it stopped.
     */
    private void synchronize(int statementStart) {
        if (tokens.mark() == statementStart || !previous().is(NEW_LINE)) {
            while (!isAtEnd()) {
                if (advance().is(NEW_LINE)) {
                    break;
                }
            }
        }
        while (check(INDENT) || check(DEDENT)) {
            advance();
        }
    }

    private ParseError expect(Token.Type type) {
        if (check(type)) {
            advance();
            return null;
        }
        return ParseError.mismatch(type, peek());
    }

    private boolean match(Token.Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Token.Type type) {
        return peek().is(type);
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token previous() {
        return tokens.previous();
    }

    private void trace(String rule) {
        log.trace("{} at {}", rule, peek());
    }
}

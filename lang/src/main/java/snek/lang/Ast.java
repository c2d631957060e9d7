package snek.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Syntax tree produced by the {@link Parser}. Nodes are immutable records
 * that own their children; optional children are {@code null} when absent.
 *
 * <p>Every node writes itself back out as source text. Expressions are
 * fully parenthesized, so {@code 1 + 2 * 3} comes back as
 * {@code (1 + (2 * 3))}; parsing the output again yields an equal tree.
 * Writing recurses once per level of the tree. Trees built by the parser
 * stay within {@link ParserOptions#maxDepth()}; hand-built trees are not
 * checked.
 */
public sealed interface Ast {

    <R> R accept(Visitor<R> visitor);

    void write(SourceWriter out);

    default String toSource() {
        var out = new SourceWriter();
        write(out);
        return out.toString();
    }

    //// statements ////

    /** A sequence of statements: a whole file or the body of a compound statement. */
    record Block(List<Ast> statements) implements Ast {

        public Block {
            statements = List.copyOf(statements);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlockAst(this);
        }

        public void write(SourceWriter out) {
            for (var statement : statements) {
                out.write(statement).endLine();
            }
        }
    }

    /** {@code target = value}, or a compound form such as {@code target += value}. */
    record Assignment(Ast target, @NonNull String operator, Ast value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignmentAst(this);
        }

        public void write(SourceWriter out) {
            out.write(target).write(" " + operator + " ").write(value);
        }
    }

    /**
     * An {@code if} statement. An {@code elif} clause is a nested {@code If}
     * in the {@code orElse} slot; an {@code else} clause is a {@link Block}.
     */
    record If(Ast condition, Block body, Ast orElse) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfAst(this);
        }

        public void write(SourceWriter out) {
            write(out, "if");
        }

        private void write(SourceWriter out, String keyword) {
            out.write(keyword + " ").write(condition).body(body);
            if (orElse instanceof If elif) {
                elif.write(out, "elif");
            } else if (orElse != null) {
                out.write("else").body(orElse);
            }
        }
    }

    record While(Ast condition, Block body, Block orElse) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileAst(this);
        }

        public void write(SourceWriter out) {
            out.write("while ").write(condition).body(body);
            if (orElse != null) {
                out.write("else").body(orElse);
            }
        }
    }

    record For(Ast target, Ast iterable, Block body, Block orElse) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForAst(this);
        }

        public void write(SourceWriter out) {
            out.write("for ").write(target).write(" in ").write(iterable).body(body);
            if (orElse != null) {
                out.write("else").body(orElse);
            }
        }
    }

    record FunctionDef(String name, List<Param> params, Block body) implements Ast {

        public FunctionDef {
            params = List.copyOf(params);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDefAst(this);
        }

        public void write(SourceWriter out) {
            out.write("def ").write(name).write("(").separated(params).write(")").body(body);
        }
    }

    /** A function parameter; {@code defaultValue} is null for a positional one. */
    record Param(@NonNull String name, Ast defaultValue) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParamAst(this);
        }

        public void write(SourceWriter out) {
            out.write(name);
            if (defaultValue != null) {
                out.write("=").write(defaultValue);
            }
        }
    }

    record Return(Ast value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturnAst(this);
        }

        public void write(SourceWriter out) {
            out.write("return ").write(value);
        }
    }

    /** {@code pass}, {@code break} or {@code continue}. */
    record Control(@NonNull String keyword) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitControlAst(this);
        }

        public void write(SourceWriter out) {
            out.write(keyword);
        }
    }

    record Global(List<String> names) implements Ast {

        public Global {
            names = List.copyOf(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobalAst(this);
        }

        public void write(SourceWriter out) {
            out.write("global ").write(String.join(", ", names));
        }
    }

    /** {@code import a.b, c} when {@code module} is null, else {@code from module import names}. */
    record Import(String module, List<String> names) implements Ast {

        public Import {
            names = List.copyOf(names);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportAst(this);
        }

        public void write(SourceWriter out) {
            if (module != null) {
                out.write("from " + module + " ");
            }
            out.write("import ").write(String.join(", ", names));
        }
    }

    //// expressions ////

    /** Two or more comma-separated expressions, e.g. {@code a, b} in {@code x = a, b}. */
    record ExpressionList(List<Ast> expressions) implements Ast {

        public ExpressionList {
            expressions = List.copyOf(expressions);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpressionListAst(this);
        }

        public void write(SourceWriter out) {
            out.separated(expressions);
        }
    }

    record Prefix(@NonNull String operator, Ast operand) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrefixAst(this);
        }

        public void write(SourceWriter out) {
            var separator = Character.isLetter(operator.charAt(0)) ? " " : "";
            out.write("(" + operator + separator).write(operand).write(")");
        }
    }

    record Infix(Ast left, @NonNull String operator, Ast right) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInfixAst(this);
        }

        public void write(SourceWriter out) {
            out.write("(").write(left).write(" " + operator + " ").write(right).write(")");
        }
    }

    record Call(Ast callee, List<Ast> arguments) implements Ast {

        public Call {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallAst(this);
        }

        public void write(SourceWriter out) {
            out.write(callee).write("(").separated(arguments).write(")");
        }
    }

    /** {@code object[index]}; slices are not supported. */
    record Subscript(Ast object, Ast index) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscriptAst(this);
        }

        public void write(SourceWriter out) {
            out.write(object).write("[").write(index).write("]");
        }
    }

    record Attribute(Ast object, @NonNull String name) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttributeAst(this);
        }

        public void write(SourceWriter out) {
            out.write(object).write("." + name);
        }
    }

    record Identifier(@NonNull String name) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifierAst(this);
        }

        public void write(SourceWriter out) {
            out.write(name);
        }
    }

    /** A numeric literal, kept as written. */
    record Number(@NonNull String value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberAst(this);
        }

        public void write(SourceWriter out) {
            out.write(value);
        }
    }

    /** A string literal, kept as written including its quotes and escapes. */
    record StringLiteral(@NonNull String lexeme) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteralAst(this);
        }

        public void write(SourceWriter out) {
            out.write(lexeme);
        }
    }

    interface Visitor<R> {
        R visitBlockAst(Block ast);
        R visitAssignmentAst(Assignment ast);
        R visitIfAst(If ast);
        R visitWhileAst(While ast);
        R visitForAst(For ast);
        R visitFunctionDefAst(FunctionDef ast);
        R visitParamAst(Param ast);
        R visitReturnAst(Return ast);
        R visitControlAst(Control ast);
        R visitGlobalAst(Global ast);
        R visitImportAst(Import ast);
        R visitExpressionListAst(ExpressionList ast);
        R visitPrefixAst(Prefix ast);
        R visitInfixAst(Infix ast);
        R visitCallAst(Call ast);
        R visitSubscriptAst(Subscript ast);
        R visitAttributeAst(Attribute ast);
        R visitIdentifierAst(Identifier ast);
        R visitNumberAst(Number ast);
        R visitStringLiteralAst(StringLiteral ast);
    }
}

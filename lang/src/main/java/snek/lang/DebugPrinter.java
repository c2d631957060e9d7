package snek.lang;

import java.util.List;

/**
 * Dumps a syntax tree one labeled line per node, children indented below
 * their parent.
 *
 * <pre>
 * block
 *   assignment =
 *     identifier x
 *     number 1
 * </pre>
 */
public final class DebugPrinter implements Ast.Visitor<Void> {

    private static final String INDENT = "  ";

    public static String print(Ast ast) {
        var printer = new DebugPrinter();
        printer.visit(ast);
        return printer.out.toString();
    }

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private DebugPrinter() {
    }

    private void visit(Ast ast) {
        if (ast == null) {
            line(SourceWriter.NIL);
        } else {
            ast.accept(this);
        }
    }

    private void line(String label) {
        out.append(INDENT.repeat(depth)).append(label).append('\n');
    }

    private Void node(String label, Ast... children) {
        return node(label, List.of(), children);
    }

    private Void node(String label, List<? extends Ast> list, Ast... children) {
        line(label);
        depth++;
        for (var child : children) {
            visit(child);
        }
        for (var child : list) {
            visit(child);
        }
        depth--;
        return null;
    }

    @Override
    public Void visitBlockAst(Ast.Block ast) {
        return node("block", ast.statements());
    }

    @Override
    public Void visitAssignmentAst(Ast.Assignment ast) {
        return node("assignment " + ast.operator(), ast.target(), ast.value());
    }

    @Override
    public Void visitIfAst(Ast.If ast) {
        return node("if", ast.condition(), ast.body(), ast.orElse());
    }

    @Override
    public Void visitWhileAst(Ast.While ast) {
        return node("while", ast.condition(), ast.body(), ast.orElse());
    }

    @Override
    public Void visitForAst(Ast.For ast) {
        return node("for", ast.target(), ast.iterable(), ast.body(), ast.orElse());
    }

    @Override
    public Void visitFunctionDefAst(Ast.FunctionDef ast) {
        line("def " + ast.name());
        depth++;
        node("params", ast.params());
        visit(ast.body());
        depth--;
        return null;
    }

    @Override
    public Void visitParamAst(Ast.Param ast) {
        if (ast.defaultValue() == null) {
            line("param " + ast.name());
            return null;
        }
        return node("param " + ast.name(), ast.defaultValue());
    }

    @Override
    public Void visitReturnAst(Ast.Return ast) {
        return node("return", ast.value());
    }

    @Override
    public Void visitControlAst(Ast.Control ast) {
        line(ast.keyword());
        return null;
    }

    @Override
    public Void visitGlobalAst(Ast.Global ast) {
        line("global " + String.join(", ", ast.names()));
        return null;
    }

    @Override
    public Void visitImportAst(Ast.Import ast) {
        var from = ast.module() != null ? " from " + ast.module() : "";
        line("import " + String.join(", ", ast.names()) + from);
        return null;
    }

    @Override
    public Void visitExpressionListAst(Ast.ExpressionList ast) {
        return node("expressions", ast.expressions());
    }

    @Override
    public Void visitPrefixAst(Ast.Prefix ast) {
        return node("prefix " + ast.operator(), ast.operand());
    }

    @Override
    public Void visitInfixAst(Ast.Infix ast) {
        return node("infix " + ast.operator(), ast.left(), ast.right());
    }

    @Override
    public Void visitCallAst(Ast.Call ast) {
        return node("call", ast.arguments(), ast.callee());
    }

    @Override
    public Void visitSubscriptAst(Ast.Subscript ast) {
        return node("subscript", ast.object(), ast.index());
    }

    @Override
    public Void visitAttributeAst(Ast.Attribute ast) {
        return node("attribute " + ast.name(), ast.object());
    }

    @Override
    public Void visitIdentifierAst(Ast.Identifier ast) {
        line("identifier " + ast.name());
        return null;
    }

    @Override
    public Void visitNumberAst(Ast.Number ast) {
        line("number " + ast.value());
        return null;
    }

    @Override
    public Void visitStringLiteralAst(Ast.StringLiteral ast) {
        line("string " + ast.lexeme());
        return null;
    }
}

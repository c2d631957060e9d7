package snek.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import snek.lang.Ast.Assignment;
import snek.lang.Ast.Block;
import snek.lang.Ast.FunctionDef;
import snek.lang.Ast.Identifier;
import snek.lang.Ast.If;
import snek.lang.Ast.Infix;
import snek.lang.Ast.Param;
import snek.lang.Ast.Prefix;
import snek.lang.Ast.While;

public class AstTest {

    private static final String PROGRAM = String.join("\n",
        "import os.path",
        "from a import b, c",
        "global counter",
        "def f(a, b=1):",
        "    total = 0",
        "    for i, j in pairs:",
        "        total += i * j ** 2",
        "    else:",
        "        pass",
        "    while not done and total < 10:",
        "        total = total + -1",
        "        if total == 3: break",
        "    return total, a.b[0](x, 'y')",
        "if a not in seen:",
        "  x = 1",
        "elif b:",
        "  x = 2",
        "else:",
        "  x = 3",
        "");

    private static Block parse(String source) {
        var result = Parser.parse(Lexer.tokenize(source).tokens());
        assertEquals(List.of(), result.errors());
        return result.root();
    }

    @Test
    void printedSourceParsesToTheSameTree() {
        var tree = parse(PROGRAM);
        var printed = tree.toSource();
        assertEquals(tree, parse(printed));
        assertEquals(printed, parse(printed).toSource());
    }

    @Test
    void reindentsBlocks() {
        var source = "if a:\n  x = 1\nelif b:\n  x = 2\nelse:\n  x = 3\n";
        assertEquals("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n", parse(source).toSource());
    }

    @Test
    void nestedBlocks() {
        var source = "while a:\n  if b:\n   c\n  d\n";
        assertEquals("while a:\n    if b:\n        c\n    d\n", parse(source).toSource());
    }

    @Test
    void singleLineBodiesAreExpanded() {
        assertEquals("def f(a, b=1):\n    return a\n", parse("def f(a, b=1): return a\n").toSource());
        assertEquals("x = 1\ny = 2\n", parse("x = 1; y = 2\n").toSource());
    }

    @Test
    void expressionsAreParenthesized() {
        assertEquals("(1 + (2 * 3))", new Infix(new Ast.Number("1"), "+",
            new Infix(new Ast.Number("2"), "*", new Ast.Number("3"))).toSource());
        assertEquals("(not x)", new Prefix("not", new Identifier("x")).toSource());
        assertEquals("(-x)", new Prefix("-", new Identifier("x")).toSource());
    }

    @Test
    void absentChildrenArePrintedAsNil() {
        assertEquals("x = <nil>", new Assignment(new Identifier("x"), "=", null).toSource());
        assertEquals("(<nil> + 1)", new Infix(null, "+", new Ast.Number("1")).toSource());
        assertEquals("if a:\n    <nil>\n", new If(new Identifier("a"), null, null).toSource());
        assertEquals("def <nil>():\n    <nil>\n", new FunctionDef(null, List.of(), null).toSource());
    }

    @Test
    void elseBlockHoldingAnIfIsNotAnElif() {
        var nested = new If(new Identifier("b"), new Block(List.of(new Identifier("c"))), null);
        var outer = new If(new Identifier("a"), new Block(List.of(new Identifier("d"))), new Block(List.of(nested)));
        assertEquals("if a:\n    d\nelse:\n    if b:\n        c\n", outer.toSource());
    }

    @Test
    void whileElse() {
        var ast = new While(new Identifier("a"), new Block(List.of(new Identifier("b"))),
            new Block(List.of(new Identifier("c"))));
        assertEquals("while a:\n    b\nelse:\n    c\n", ast.toSource());
    }

    @Test
    void parameters() {
        assertEquals("b=(1 + 2)", new Param("b", new Infix(new Ast.Number("1"), "+", new Ast.Number("2"))).toSource());
        assertEquals("a", new Param("a", null).toSource());
    }
}

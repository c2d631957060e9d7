package snek.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class DebugPrinterTest {

    private static String dump(String source) {
        return DebugPrinter.print(Parser.parse(Lexer.tokenize(source).tokens()).root());
    }

    @Test
    void assignment() {
        assertEquals(String.join("\n",
            "block",
            "  assignment =",
            "    identifier x",
            "    infix +",
            "      number 1",
            "      number 2",
            ""), dump("x = 1 + 2\n"));
    }

    @Test
    void absentElse() {
        assertEquals(String.join("\n",
            "block",
            "  if",
            "    identifier a",
            "    block",
            "      pass",
            "    <nil>",
            ""), dump("if a: pass\n"));
    }

    @Test
    void functionDefinition() {
        assertEquals(String.join("\n",
            "block",
            "  def f",
            "    params",
            "      param a",
            "      param b",
            "        number 1",
            "    block",
            "      return",
            "        identifier a",
            ""), dump("def f(a, b=1):\n    return a\n"));
    }

    @Test
    void callsAndImports() {
        assertEquals(String.join("\n",
            "block",
            "  import c, d from a.b",
            "  call",
            "    attribute write",
            "      identifier out",
            "    string \"x\"",
            "    prefix -",
            "      identifier y",
            ""), dump("from a.b import c, d\nout.write(\"x\", -y)\n"));
    }

    @Test
    void nothing() {
        assertEquals("<nil>\n", DebugPrinter.print(null));
    }
}

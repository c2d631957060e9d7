package snek.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SnekTest {

    ByteArrayOutputStream out;
    ByteArrayOutputStream err;
    Snek.Flags flags;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        flags = new Snek.Flags();
    }

    private int run(String source) {
        return Snek.run(source, flags,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsReconstructedSource() {
        flags.printSource = true;
        assertEquals(0, run("a=1+2\n"));
        assertEquals("a = (1 + 2)\n", out.toString(StandardCharsets.UTF_8));
        assertEquals("", err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void printsTokens() {
        flags.printTokens = true;
        assertEquals(0, run("a\n"));
        assertEquals(String.join(System.lineSeparator(),
            "(Token IDENTIFIER \"a\" 1:1)",
            "(Token NEW_LINE \"\\n\" 1:2)",
            "(Token EOF \"\" 2:1)",
            ""), out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void reportsParseErrors() {
        assertEquals(1, run("x = 1 +\n"));
        assertEquals("parser: no prefix parse function for NEW_LINE [line 1, col 8]" + System.lineSeparator(),
            err.toString(StandardCharsets.UTF_8));
    }

    @Test
    void reportsScannerErrors() {
        assertEquals(1, run("if a:\n    x\n  y\n"));
        assertTrue(err.toString(StandardCharsets.UTF_8)
            .startsWith("scanner: unindent does not match any outer indentation level [line 3, col 3]"));
    }

    @Test
    void pendingInput() {
        assertTrue(Snek.isPending(List.of("if a:")));
        assertTrue(Snek.isPending(List.of("def f():", "    return 1")));
        assertTrue(Snek.isPending(List.of("x = 1 + \\")));
        assertFalse(Snek.isPending(List.of("x = 1")));
        assertFalse(Snek.isPending(List.of("x = 1  # note:")));
        assertFalse(Snek.isPending(List.of("x = 'a:'")));
        assertFalse(Snek.isPending(List.of("if a: pass")));
        assertFalse(Snek.isPending(List.of("x = 1 + \\", "    2")));
    }
}

package snek.lang;

/**
 * Accumulates source text line by line, indenting each new line by the
 * current block depth.
 */
public final class SourceWriter {

    static final String NIL = "<nil>";

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;
    private boolean atLineStart = true;

    public SourceWriter write(String text) {
        if (atLineStart) {
            out.append(INDENT.repeat(depth));
            atLineStart = false;
        }
        out.append(text != null ? text : NIL);
        return this;
    }

    public SourceWriter write(Ast node) {
        if (node == null) {
            return write(NIL);
        }
        node.write(this);
        return this;
    }

    public SourceWriter separated(Iterable<? extends Ast> nodes) {
        var first = true;
        for (var node : nodes) {
            if (!first) {
                write(", ");
            }
            write(node);
            first = false;
        }
        return this;
    }

    /** Terminates the current line, unless nothing has been written on it yet. */
    public SourceWriter endLine() {
        if (!atLineStart) {
            out.append('\n');
            atLineStart = true;
        }
        return this;
    }

    /** Writes the colon that opens a block, then the block one level deeper. */
    public SourceWriter body(Ast body) {
        write(":").endLine();
        depth++;
        write(body).endLine();
        depth--;
        return this;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}

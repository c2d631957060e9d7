package snek.lang;

import lombok.Builder;

/**
 * Error handling policy of the {@link Parser}.
 *
 * @param recover   keep parsing after a syntax error, skipping to the next line
 * @param maxErrors stop once this many errors have been recorded
 * @param maxDepth  deepest syntax tree the parser builds; each nested block,
 *                  operand, or chained operator counts one level
 */
@Builder
public record ParserOptions(boolean recover, int maxErrors, int maxDepth) {

    public static ParserOptions defaults() {
        return builder().build();
    }

    public static ParserOptions stopAtFirstError() {
        return builder().recover(false).build();
    }

    public static class ParserOptionsBuilder {
        private boolean recover = true;
        private int maxErrors = 100;
        private int maxDepth = 500;
    }
}

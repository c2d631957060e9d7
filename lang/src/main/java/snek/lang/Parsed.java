package snek.lang;

/**
 * Outcome of one grammar rule: the node it built and, when the rule failed,
 * the error that stopped it. A failed rule still hands back whatever partial
 * node it had put together (possibly null).
 */
record Parsed<T>(T node, ParseError error) {

    static <T> Parsed<T> ok(T node) {
        return new Parsed<>(node, null);
    }

    static <T> Parsed<T> fail(T partial, ParseError error) {
        return new Parsed<>(partial, error);
    }

    boolean failed() {
        return error != null;
    }

    /** Carries this failure over to a rule that produces a different node. */
    <R> Parsed<R> as(R partial) {
        return new Parsed<>(partial, error);
    }
}

package snek.lang;

/**
 * Binding strength of expression operators, weakest first.
 */
enum Precedence {
    LOWEST,
    OR,
    AND,
    NOT,
    COMPARE,
    SUM,
    PRODUCT,
    PREFIX,
    EXP,
    CALL;

    /** The strength with which {@code type} continues an expression; {@code LOWEST} if it cannot. */
    static Precedence of(Token.Type type) {
        switch (type) {
        case OR:
            return OR;
        case AND:
            return AND;
        case COMPARE:
        case IN:
            return COMPARE;
        case SUM:
            return SUM;
        case PRODUCT:
            return PRODUCT;
        case EXP:
            return EXP;
        case PAREN_LEFT:
        case BRACKET_LEFT:
        case DOT:
            return CALL;
        default:
            return LOWEST;
        }
    }

    boolean isWeakerThan(Precedence other) {
        return compareTo(other) < 0;
    }

    Precedence weaker() {
        return values()[ordinal() - 1];
    }
}

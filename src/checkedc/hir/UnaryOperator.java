package checkedc.hir;

import java.io.PrintWriter;

/**
* Operators of a {@link UnaryExpression}. Like the binary operators they are
* unique instances compared with <code>==</code>.
*/
public class UnaryOperator implements Printable {

    public static final UnaryOperator ADDRESS_OF = new UnaryOperator("&", 0);

    public static final UnaryOperator BITWISE_COMPLEMENT =
            new UnaryOperator("~", 1);

    public static final UnaryOperator DEREFERENCE = new UnaryOperator("*", 2);

    public static final UnaryOperator LOGICAL_NEGATION =
            new UnaryOperator("!", 3);

    public static final UnaryOperator MINUS = new UnaryOperator("-", 4);

    public static final UnaryOperator PLUS = new UnaryOperator("+", 5);

    public static final UnaryOperator POST_DECREMENT =
            new UnaryOperator("--", 6);

    public static final UnaryOperator POST_INCREMENT =
            new UnaryOperator("++", 7);

    public static final UnaryOperator PRE_DECREMENT =
            new UnaryOperator("--", 8);

    public static final UnaryOperator PRE_INCREMENT =
            new UnaryOperator("++", 9);

    // Ranks from here on belong to increments and decrements.
    private static final int FIRST_MODIFYING = 6;

    private final String symbol;

    private final int rank;

    private UnaryOperator(String symbol, int rank) {
        this.symbol = symbol;
        this.rank = rank;
    }

    /** Returns the rank used to order unary expressions. */
    public int getValue() {
        return rank;
    }

    /** Increments and decrements, prefix or postfix. */
    public boolean isModifying() {
        return rank >= FIRST_MODIFYING;
    }

    public boolean isPostfix() {
        return this == POST_DECREMENT || this == POST_INCREMENT;
    }

    public void print(PrintWriter o) {
        o.print(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}

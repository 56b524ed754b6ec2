package checkedc.hir;

import java.io.PrintWriter;

/**
* Infix operators of a {@link BinaryExpression}. The instances are unique, so
* operators are compared with <code>==</code>. Each operator carries a rank
* that orders operators of the same class when expressions are sorted.
*/
public class BinaryOperator implements Printable {

    private static final int ARITHMETIC = 0;

    private static final int BITWISE = 1;

    private static final int RELATIONAL = 2;

    private static final int SHORT_CIRCUIT = 3;

    private static final int OTHER = 4;

    public static final BinaryOperator ADD =
            new BinaryOperator("+", 0, ARITHMETIC);

    public static final BinaryOperator BITWISE_AND =
            new BinaryOperator("&", 1, BITWISE);

    public static final BinaryOperator BITWISE_EXCLUSIVE_OR =
            new BinaryOperator("^", 2, BITWISE);

    public static final BinaryOperator BITWISE_INCLUSIVE_OR =
            new BinaryOperator("|", 3, BITWISE);

    public static final BinaryOperator COMPARE_EQ =
            new BinaryOperator("==", 4, RELATIONAL);

    public static final BinaryOperator COMPARE_GE =
            new BinaryOperator(">=", 5, RELATIONAL);

    public static final BinaryOperator COMPARE_GT =
            new BinaryOperator(">", 6, RELATIONAL);

    public static final BinaryOperator COMPARE_LE =
            new BinaryOperator("<=", 7, RELATIONAL);

    public static final BinaryOperator COMPARE_LT =
            new BinaryOperator("<", 8, RELATIONAL);

    public static final BinaryOperator COMPARE_NE =
            new BinaryOperator("!=", 9, RELATIONAL);

    public static final BinaryOperator DIVIDE =
            new BinaryOperator("/", 10, ARITHMETIC);

    public static final BinaryOperator LOGICAL_AND =
            new BinaryOperator("&&", 11, SHORT_CIRCUIT);

    public static final BinaryOperator LOGICAL_OR =
            new BinaryOperator("||", 12, SHORT_CIRCUIT);

    public static final BinaryOperator MODULUS =
            new BinaryOperator("%", 13, ARITHMETIC);

    public static final BinaryOperator MULTIPLY =
            new BinaryOperator("*", 14, ARITHMETIC);

    public static final BinaryOperator SHIFT_LEFT =
            new BinaryOperator("<<", 15, BITWISE);

    public static final BinaryOperator SHIFT_RIGHT =
            new BinaryOperator(">>", 16, BITWISE);

    public static final BinaryOperator SUBTRACT =
            new BinaryOperator("-", 17, ARITHMETIC);

    private final String symbol;

    private final int rank;

    private final int group;

    // Subclasses define operators that are neither relational nor logical.
    protected BinaryOperator(String symbol, int rank) {
        this(symbol, rank, OTHER);
    }

    private BinaryOperator(String symbol, int rank, int group) {
        this.symbol = symbol;
        this.rank = rank;
        this.group = group;
    }

    /**
    * Returns the rank of the operator among the operators of its class.
    */
    public int getValue() {
        return rank;
    }

    /** Checks for the six relational and equality operators. */
    public boolean isCompare() {
        return group == RELATIONAL;
    }

    /** Checks for <code>&amp;&amp;</code> and <code>||</code>. */
    public boolean isLogical() {
        return group == SHORT_CIRCUIT;
    }

    public void print(PrintWriter o) {
        o.print(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}

package checkedc.hir;

/**
* The simple and the compound assignment operators. All of them store into
* the left operand of their {@link AssignmentExpression}.
*/
public class AssignmentOperator extends BinaryOperator {

    public static final AssignmentOperator ADD =
            new AssignmentOperator("+=", 0);

    public static final AssignmentOperator BITWISE_AND =
            new AssignmentOperator("&=", 1);

    public static final AssignmentOperator BITWISE_EXCLUSIVE_OR =
            new AssignmentOperator("^=", 2);

    public static final AssignmentOperator BITWISE_INCLUSIVE_OR =
            new AssignmentOperator("|=", 3);

    public static final AssignmentOperator DIVIDE =
            new AssignmentOperator("/=", 4);

    public static final AssignmentOperator NORMAL =
            new AssignmentOperator("=", 5);

    public static final AssignmentOperator MODULUS =
            new AssignmentOperator("%=", 6);

    public static final AssignmentOperator MULTIPLY =
            new AssignmentOperator("*=", 7);

    public static final AssignmentOperator SHIFT_LEFT =
            new AssignmentOperator("<<=", 8);

    public static final AssignmentOperator SHIFT_RIGHT =
            new AssignmentOperator(">>=", 9);

    public static final AssignmentOperator SUBTRACT =
            new AssignmentOperator("-=", 10);

    private AssignmentOperator(String symbol, int rank) {
        super(symbol, rank);
    }
}

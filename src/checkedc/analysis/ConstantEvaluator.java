package checkedc.analysis;

import checkedc.hir.BinaryExpression;
import checkedc.hir.BinaryOperator;
import checkedc.hir.CharLiteral;
import checkedc.hir.Expression;
import checkedc.hir.ImplicitCastExpression;
import checkedc.hir.IntegerLiteral;
import checkedc.hir.UnaryExpression;
import checkedc.hir.UnaryOperator;

/**
 * Evaluates integer constant expressions with the semantics of a 32-bit
 * signed <code>int</code>. Evaluation fails, rather than wrapping around,
 * when an intermediate value does not fit.
 */
public final class ConstantEvaluator {

    /** Smallest representable value. */
    public static final long MIN_VALUE = Integer.MIN_VALUE;

    /** Largest representable value. */
    public static final long MAX_VALUE = Integer.MAX_VALUE;

    private ConstantEvaluator() {
    }

    /**
     * Checks if the value is representable.
     */
    public static boolean fits(long value) {
        return (value >= MIN_VALUE && value <= MAX_VALUE);
    }

    /**
     * Evaluates the specified expression.
     *
     * @param e the expression.
     * @return the value, or null if <b>e</b> is not an integer constant
     *      expression or if its evaluation overflows.
     */
    public static Long evaluate(Expression e) {
        if (e instanceof IntegerLiteral) {
            long value = ((IntegerLiteral)e).getValue();
            return fits(value) ? Long.valueOf(value) : null;
        } else if (e instanceof CharLiteral) {
            return Long.valueOf(((CharLiteral)e).getValue());
        } else if (e instanceof ImplicitCastExpression) {
            return evaluate(((ImplicitCastExpression)e).getExpression());
        } else if (e instanceof UnaryExpression) {
            return evaluateUnary((UnaryExpression)e);
        } else if (e instanceof BinaryExpression) {
            return evaluateBinary((BinaryExpression)e);
        }
        return null;
    }

    /**
     * Checks if the specified expression is an integer constant expression
     * whose evaluation does not overflow.
     */
    public static boolean isIntegerConstant(Expression e) {
        return (evaluate(e) != null);
    }

    /**
     * Checks if the specified constant expression evaluates to zero, i.e. it
     * is a null value such as <code>0</code> or <code>'\0'</code>.
     */
    public static boolean isZero(Expression e) {
        Long value = evaluate(e);
        return (value != null && value.longValue() == 0);
    }

    /**
     * Adds two values.
     *
     * @return the sum or null on overflow.
     */
    public static Long add(long a, long b) {
        return checked(a + b);
    }

    /**
     * Subtracts two values.
     *
     * @return the difference or null on overflow.
     */
    public static Long subtract(long a, long b) {
        return checked(a - b);
    }

    /**
     * Multiplies two values.
     *
     * @return the product or null on overflow.
     */
    public static Long multiply(long a, long b) {
        // Operands fit in 32 bits so the 64-bit product is exact.
        return checked(a * b);
    }

    private static Long checked(long value) {
        return fits(value) ? Long.valueOf(value) : null;
    }

    private static Long evaluateUnary(UnaryExpression e) {
        UnaryOperator op = e.getOperator();
        Long v = evaluate(e.getExpression());
        if (v == null) {
            return null;
        }
        long value = v.longValue();
        if (op == UnaryOperator.PLUS) {
            return v;
        } else if (op == UnaryOperator.MINUS) {
            return checked(-value);
        } else if (op == UnaryOperator.BITWISE_COMPLEMENT) {
            return Long.valueOf(~value);
        } else if (op == UnaryOperator.LOGICAL_NEGATION) {
            return Long.valueOf(value == 0 ? 1 : 0);
        }
        return null;
    }

    private static Long evaluateBinary(BinaryExpression e) {
        BinaryOperator op = e.getOperator();
        if (op.getClass() != BinaryOperator.class) {
            // assignments and member accesses
            return null;
        }
        Long l = evaluate(e.getLHS());
        if (l == null) {
            return null;
        }
        Long r = evaluate(e.getRHS());
        if (r == null) {
            return null;
        }
        long a = l.longValue(), b = r.longValue();
        if (op == BinaryOperator.ADD) {
            return add(a, b);
        } else if (op == BinaryOperator.SUBTRACT) {
            return subtract(a, b);
        } else if (op == BinaryOperator.MULTIPLY) {
            return multiply(a, b);
        } else if (op == BinaryOperator.DIVIDE || op == BinaryOperator.MODULUS) {
            if (b == 0 || (a == MIN_VALUE && b == -1)) {
                return null;
            }
            return Long.valueOf(op == BinaryOperator.DIVIDE ? a / b : a % b);
        } else if (op == BinaryOperator.SHIFT_LEFT) {
            if (b < 0 || b >= 31 || a < 0) {
                return null;
            }
            return checked(a << b);
        } else if (op == BinaryOperator.SHIFT_RIGHT) {
            if (b < 0 || b >= 32) {
                return null;
            }
            return Long.valueOf(a >> b);
        } else if (op == BinaryOperator.BITWISE_AND) {
            return Long.valueOf(a & b);
        } else if (op == BinaryOperator.BITWISE_INCLUSIVE_OR) {
            return Long.valueOf(a | b);
        } else if (op == BinaryOperator.BITWISE_EXCLUSIVE_OR) {
            return Long.valueOf(a ^ b);
        } else if (op == BinaryOperator.LOGICAL_AND) {
            return Long.valueOf(a != 0 && b != 0 ? 1 : 0);
        } else if (op == BinaryOperator.LOGICAL_OR) {
            return Long.valueOf(a != 0 || b != 0 ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_EQ) {
            return Long.valueOf(a == b ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_NE) {
            return Long.valueOf(a != b ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_LT) {
            return Long.valueOf(a < b ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_LE) {
            return Long.valueOf(a <= b ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_GT) {
            return Long.valueOf(a > b ? 1 : 0);
        } else if (op == BinaryOperator.COMPARE_GE) {
            return Long.valueOf(a >= b ? 1 : 0);
        }
        return null;
    }
}

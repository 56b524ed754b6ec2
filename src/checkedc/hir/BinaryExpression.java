package checkedc.hir;

import java.io.PrintWriter;

/**
* <code>lhs op rhs</code>. Nested binary expressions print in parentheses
* unless {@link #setParens(boolean)} turned them off.
*/
public class BinaryExpression extends Expression {

    protected BinaryOperator op;

    public BinaryExpression(Expression lhs, BinaryOperator op,
                            Expression rhs) {
        super(2);
        if (lhs == null || op == null || rhs == null) {
            throw new IllegalArgumentException("incomplete binary expression");
        }
        this.op = op;
        addChild(lhs);
        addChild(rhs);
    }

    @Override
    public BinaryExpression clone() {
        return (BinaryExpression)super.clone();
    }

    public Expression getLHS() {
        return (Expression)children.get(0);
    }

    public BinaryOperator getOperator() {
        return op;
    }

    public Expression getRHS() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        boolean parens = needs_parens && parent instanceof Expression;
        o.print(parens ? "(" : "");
        getLHS().print(o);
        o.print(" " + op + " ");
        getRHS().print(o);
        o.print(parens ? ")" : "");
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && ((BinaryExpression)o).op == op;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + op.hashCode();
    }
}

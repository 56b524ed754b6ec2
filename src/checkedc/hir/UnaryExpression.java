package checkedc.hir;

import java.io.PrintWriter;

/**
* An operator applied to one operand, prefix or postfix as the operator
* dictates.
*/
public class UnaryExpression extends Expression {

    protected UnaryOperator op;

    public UnaryExpression(UnaryOperator op, Expression expr) {
        super(1);
        if (op == null || expr == null) {
            throw new IllegalArgumentException("incomplete unary expression");
        }
        this.op = op;
        addChild(expr);
    }

    @Override
    public UnaryExpression clone() {
        return (UnaryExpression)super.clone();
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public UnaryOperator getOperator() {
        return op;
    }

    public void print(PrintWriter o) {
        if (op.isPostfix()) {
            getExpression().print(o);
            op.print(o);
        } else {
            op.print(o);
            getExpression().print(o);
        }
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && op == ((UnaryExpression)o).op);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + op.hashCode();
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents the bounds annotation <code>bounds(lower, upper)</code>.
*/
public class RangeBoundsExpression extends BoundsExpression {

    /**
    * Creates a range bounds expression.
    *
    * @param lower the lower bound.
    * @param upper the upper bound.
    */
    public RangeBoundsExpression(Expression lower, Expression upper) {
        super(2);
        if (lower == null || upper == null) {
            throw new IllegalArgumentException();
        }
        addChild(lower);
        addChild(upper);
        lower.setParens(false);
        upper.setParens(false);
    }

    @Override
    public RangeBoundsExpression clone() {
        return (RangeBoundsExpression)super.clone();
    }

    public Expression getLowerExpr() {
        return (Expression)children.get(0);
    }

    public Expression getUpperExpr() {
        return (Expression)children.get(1);
    }

    public RangeBoundsExpression toRange(Symbol symbol) {
        return clone();
    }

    public void print(PrintWriter o) {
        o.print("bounds(");
        getLowerExpr().print(o);
        o.print(", ");
        getUpperExpr().print(o);
        o.print(")");
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents the bounds annotation <code>count(n)</code>, which is a shorthand
* for <code>bounds(p, p + n)</code> on a pointer <code>p</code>.
*/
public class CountBoundsExpression extends BoundsExpression {

    /**
    * Creates a count bounds expression.
    *
    * @param count the element count.
    */
    public CountBoundsExpression(Expression count) {
        super(1);
        if (count == null) {
            throw new IllegalArgumentException();
        }
        addChild(count);
        count.setParens(false);
    }

    @Override
    public CountBoundsExpression clone() {
        return (CountBoundsExpression)super.clone();
    }

    public Expression getCountExpr() {
        return (Expression)children.get(0);
    }

    public RangeBoundsExpression toRange(Symbol symbol) {
        Expression upper = new BinaryExpression(new Identifier(symbol),
                BinaryOperator.ADD, getCountExpr().clone());
        return new RangeBoundsExpression(new Identifier(symbol), upper);
    }

    public void print(PrintWriter o) {
        o.print("count(");
        getCountExpr().print(o);
        o.print(")");
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a conversion inserted by the front end. It prints as its operand.
*/
public class ImplicitCastExpression extends Expression {

    private CastKind kind;

    /**
    * Creates an implicit conversion of the specified kind.
    *
    * @param kind the conversion kind.
    * @param expr the converted expression.
    */
    public ImplicitCastExpression(CastKind kind, Expression expr) {
        super(1);
        if (kind == null || expr == null) {
            throw new IllegalArgumentException();
        }
        this.kind = kind;
        addChild(expr);
    }

    @Override
    public ImplicitCastExpression clone() {
        return (ImplicitCastExpression)super.clone();
    }

    public CastKind getCastKind() {
        return kind;
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        getExpression().print(o);
    }

    @Override
    public boolean equals(Object o) {
        return (super.equals(o) && kind == ((ImplicitCastExpression)o).kind);
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a structure member access <code>base.field</code> or
* <code>base-&gt;field</code>. The left operand is the base expression and
* the right operand is an identifier of the field.
*/
public class AccessExpression extends BinaryExpression {

    /**
    * Creates a member access expression.
    *
    * @param base the accessed structure or pointer.
    * @param op the access operator.
    * @param field the identifier of the member.
    */
    public AccessExpression(Expression base, AccessOperator op,
                            Identifier field) {
        super(base, op, field);
    }

    @Override
    public AccessExpression clone() {
        return (AccessExpression)super.clone();
    }

    @Override
    public AccessOperator getOperator() {
        return (AccessOperator)op;
    }

    /**
    * Returns the base expression of the access.
    */
    public Expression getBase() {
        return getLHS();
    }

    /**
    * Returns the field identifier of the access.
    */
    public Identifier getField() {
        return (Identifier)getRHS();
    }

    /**
    * Checks if the access dereferences the base pointer.
    */
    public boolean isArrow() {
        return (op == AccessOperator.POINTER_ACCESS);
    }

    @Override
    public void print(PrintWriter o) {
        getBase().print(o);
        op.print(o);
        getField().print(o);
    }
}

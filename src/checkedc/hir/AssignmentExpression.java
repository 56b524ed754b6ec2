package checkedc.hir;

/**
* Represents a simple or compound assignment. The left operand is the
* modified location.
*/
public class AssignmentExpression extends BinaryExpression {

    /**
    * Creates an assignment expression.
    *
    * @param lhs The lvalue expression.
    * @param op An assignment operator.
    * @param rhs The value to store.
    */
    public AssignmentExpression(Expression lhs, AssignmentOperator op,
                                Expression rhs) {
        super(lhs, op, rhs);
    }

    @Override
    public AssignmentExpression clone() {
        return (AssignmentExpression)super.clone();
    }

    @Override
    public AssignmentOperator getOperator() {
        return (AssignmentOperator)op;
    }
}

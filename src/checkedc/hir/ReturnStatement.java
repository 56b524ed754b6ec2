package checkedc.hir;

import java.io.PrintWriter;

/**
* <code>return</code>, with or without a value.
*/
public class ReturnStatement extends Statement {

    public ReturnStatement() {
        this(null);
    }

    public ReturnStatement(Expression value) {
        addChild(value);
    }

    /** The returned value, or null for a bare return. */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        Expression value = getExpression();
        o.print((value == null) ? "return" : "return ");
        if (value != null) {
            value.print(o);
        }
        o.print(";");
    }
}

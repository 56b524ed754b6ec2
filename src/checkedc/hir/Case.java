package checkedc.hir;

import java.io.PrintWriter;

/**
* A <code>case</code> label of a switch body. The label is expected to fold
* to an integer constant; labels that do not are ignored by the analyses.
*/
public class Case extends Statement {

    public Case(Expression label) {
        if (label == null) {
            throw new IllegalArgumentException("case label");
        }
        addChild(label);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public void print(PrintWriter o) {
        o.print("case ");
        getExpression().print(o);
        o.print(":");
    }
}

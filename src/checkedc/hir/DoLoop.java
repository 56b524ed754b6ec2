package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a do-while loop.
*/
public class DoLoop extends Statement implements Loop {

    /**
    * Creates a do-while loop.
    *
    * @param body the loop body.
    * @param condition the controlling expression.
    */
    public DoLoop(Statement body, Expression condition) {
        super();
        if (condition == null || body == null) {
            throw new IllegalArgumentException();
        }
        addChild(body);
        addChild(condition);
    }

    public Statement getBody() {
        return (Statement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public void print(PrintWriter o) {
        o.print("do ");
        getBody().print(o);
        o.print(" while (");
        getCondition().print(o);
        o.print(");");
    }
}

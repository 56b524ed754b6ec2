package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a while loop.
*/
public class WhileLoop extends Statement implements Loop {

    /**
    * Creates a while loop.
    *
    * @param condition the controlling expression.
    * @param body the loop body.
    */
    public WhileLoop(Expression condition, Statement body) {
        super();
        if (condition == null || body == null) {
            throw new IllegalArgumentException();
        }
        addChild(condition);
        addChild(body);
    }

    public Expression getCondition() {
        return (Expression)children.get(0);
    }

    public Statement getBody() {
        return (Statement)children.get(1);
    }

    public void print(PrintWriter o) {
        o.print("while (");
        getCondition().print(o);
        o.print(") ");
        getBody().print(o);
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a switch statement. Case and default labels appear as
* statements in the body.
*/
public class SwitchStatement extends Statement {

    /**
    * Creates a switch statement.
    *
    * @param value the switch expression.
    * @param body the body containing the labels.
    */
    public SwitchStatement(Expression value, CompoundStatement body) {
        super();
        if (value == null || body == null) {
            throw new IllegalArgumentException();
        }
        addChild(value);
        addChild(body);
    }

    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(1);
    }

    public void print(PrintWriter o) {
        o.print("switch (");
        getExpression().print(o);
        o.print(") ");
        getBody().print(o);
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* <code>for (init cond; step) body</code>; every part but the body may be
* null. The init part is a statement so that it can be a declaration.
*/
public class ForLoop extends Statement implements Loop {

    public ForLoop(Statement init, Expression condition, Expression step,
                   Statement body) {
        if (body == null) {
            throw new IllegalArgumentException("loop body");
        }
        addChild(init);
        addChild(condition);
        addChild(step);
        addChild(body);
    }

    public Statement getInitialStatement() {
        return (Statement)children.get(0);
    }

    public Expression getCondition() {
        return (Expression)children.get(1);
    }

    public Expression getStep() {
        return (Expression)children.get(2);
    }

    public Statement getBody() {
        return (Statement)children.get(3);
    }

    public void print(PrintWriter o) {
        o.print("for (");
        if (getInitialStatement() != null) {
            getInitialStatement().print(o);
        } else {
            o.print(";");
        }
        o.print(" ");
        if (getCondition() != null) {
            getCondition().print(o);
        }
        o.print("; ");
        if (getStep() != null) {
            getStep().print(o);
        }
        o.print(") ");
        getBody().print(o);
    }
}

package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents an if statement with an optional else clause.
*/
public class IfStatement extends Statement {

    /**
    * Creates an if statement without an else clause.
    */
    public IfStatement(Expression condition, Statement then_stmt) {
        this(condition, then_stmt, null);
    }

    /**
    * Creates an if statement.
    *
    * @param condition the controlling expression.
    * @param then_stmt the statement executed when the condition is true.
    * @param else_stmt the statement executed otherwise, or null.
    */
    public IfStatement(Expression condition, Statement then_stmt,
                       Statement else_stmt) {
        super();
        if (condition == null || then_stmt == null) {
            throw new IllegalArgumentException();
        }
        addChild(condition);
        addChild(then_stmt);
        addChild(else_stmt);
    }

    public Expression getControlExpression() {
        return (Expression)children.get(0);
    }

    public Statement getThenStatement() {
        return (Statement)children.get(1);
    }

    public Statement getElseStatement() {
        return (Statement)children.get(2);
    }

    public void print(PrintWriter o) {
        o.print("if (");
        getControlExpression().print(o);
        o.print(") ");
        getThenStatement().print(o);
        if (getElseStatement() != null) {
            o.print(" else ");
            getElseStatement().print(o);
        }
    }
}

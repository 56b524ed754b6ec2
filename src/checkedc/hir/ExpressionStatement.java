package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents an expression evaluated for its side effects, optionally followed
* by a where clause.
*/
public class ExpressionStatement extends Statement {

    private WhereClause where_clause;

    /**
    * Creates an expression statement.
    *
    * @param expr the evaluated expression.
    */
    public ExpressionStatement(Expression expr) {
        super();
        if (expr == null) {
            throw new IllegalArgumentException();
        }
        addChild(expr);
    }

    /**
    * Returns the expression of the statement.
    */
    public Expression getExpression() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the attached where clause or null.
    */
    public WhereClause getWhereClause() {
        return where_clause;
    }

    public void setWhereClause(WhereClause where_clause) {
        this.where_clause = where_clause;
    }

    public void print(PrintWriter o) {
        getExpression().print(o);
        if (where_clause != null) {
            o.print(" ");
            where_clause.print(o);
        }
        o.print(";");
    }
}

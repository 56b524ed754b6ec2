package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents the empty statement. A null statement may carry a where clause,
* which is how bounds facts are stated without any computation.
*/
public class NullStatement extends Statement {

    private WhereClause where_clause;

    public NullStatement() {
        super();
    }

    public WhereClause getWhereClause() {
        return where_clause;
    }

    public void setWhereClause(WhereClause where_clause) {
        this.where_clause = where_clause;
    }

    public void print(PrintWriter o) {
        if (where_clause != null) {
            where_clause.print(o);
        }
        o.print(";");
    }
}

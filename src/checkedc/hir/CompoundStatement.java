package checkedc.hir;

import java.io.PrintWriter;

/**
* Represents a block of statements enclosed in braces.
*/
public class CompoundStatement extends Statement {

    public CompoundStatement() {
        super();
    }

    /**
    * Appends a statement to the end of the block.
    *
    * @param stmt the statement being added.
    * @return this compound statement, for chaining.
    */
    public CompoundStatement addStatement(Statement stmt) {
        if (stmt == null) {
            throw new IllegalArgumentException();
        }
        addChild(stmt);
        return this;
    }

    public void print(PrintWriter o) {
        o.print("{");
        for (Traversable child : children) {
            o.print(" ");
            child.print(o);
        }
        o.print(" }");
    }
}

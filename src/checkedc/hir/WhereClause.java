package checkedc.hir;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
* Represents the bounds facts of a Checked C where clause, e.g.
* <code>_Where p : bounds(p, p + n)</code>, attached to a statement.
*/
public class WhereClause implements Printable {

    private Map<VariableDeclarator, BoundsExpression> facts;

    public WhereClause() {
        facts = new LinkedHashMap<VariableDeclarator, BoundsExpression>(2);
    }

    /**
    * Adds a bounds fact for the specified variable.
    *
    * @param var the variable.
    * @param bounds the bounds that hold after the statement.
    */
    public void addBoundsFact(VariableDeclarator var, BoundsExpression bounds) {
        facts.put(var, bounds);
    }

    /**
    * Returns the bounds facts in declaration order.
    */
    public Map<VariableDeclarator, BoundsExpression> getBoundsFacts() {
        return Collections.unmodifiableMap(facts);
    }

    public void print(PrintWriter o) {
        o.print("_Where ");
        boolean first = true;
        for (Map.Entry<VariableDeclarator, BoundsExpression> e :
                facts.entrySet()) {
            if (!first) {
                o.print(" _And ");
            }
            o.print(e.getKey().getSymbolName());
            o.print(" : ");
            e.getValue().print(o);
            first = false;
        }
    }
}

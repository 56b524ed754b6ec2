package checkedc.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents the whole program handed to the analysis passes, as a list of
* procedures.
*/
public class Program implements Traversable {

    private List<Traversable> children;

    public Program() {
        children = new ArrayList<Traversable>();
    }

    /**
    * Adds a procedure to the program.
    *
    * @param proc the new procedure.
    * @throws NotAnOrphanException if the procedure belongs to another program.
    */
    public void addProcedure(Procedure proc) {
        if (proc.getParent() != null) {
            throw new NotAnOrphanException(proc.getName());
        }
        children.add(proc);
        proc.setParent(this);
    }

    /**
    * Returns the procedures in the order they were added.
    */
    public List<Procedure> getProcedures() {
        List<Procedure> ret = new ArrayList<Procedure>(children.size());
        for (Traversable t : children) {
            ret.add((Procedure)t);
        }
        return ret;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return null;
    }

    public void setParent(Traversable t) {
        throw new UnsupportedOperationException("a program has no parent");
    }

    public void print(PrintWriter o) {
        for (Traversable t : children) {
            t.print(o);
            o.println();
        }
    }
}

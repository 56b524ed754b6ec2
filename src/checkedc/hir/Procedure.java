package checkedc.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Represents a function definition: its name, parameters and body.
*/
public class Procedure implements Traversable {

    private String name;

    private List<VariableDeclarator> params;

    private Traversable parent;

    private List<Traversable> children;

    /**
    * Creates a procedure.
    *
    * @param name the name of the procedure.
    * @param params the parameter declarators in order.
    * @param body the body of the procedure.
    */
    public Procedure(String name, List<VariableDeclarator> params,
                     CompoundStatement body) {
        if (name == null || body == null) {
            throw new IllegalArgumentException();
        }
        if (body.getParent() != null) {
            throw new NotAnOrphanException();
        }
        this.name = name;
        this.params = new ArrayList<VariableDeclarator>(params);
        this.children = new ArrayList<Traversable>(1);
        children.add(body);
        body.setParent(this);
    }

    public String getName() {
        return name;
    }

    /**
    * Returns the parameters of the procedure.
    */
    public List<VariableDeclarator> getParameters() {
        return Collections.unmodifiableList(params);
    }

    public CompoundStatement getBody() {
        return (CompoundStatement)children.get(0);
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void print(PrintWriter o) {
        o.print("void ");
        o.print(name);
        o.print("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                o.print(", ");
            }
            params.get(i).print(o);
        }
        o.print(") ");
        getBody().print(o);
    }

    @Override
    public String toString() {
        return Tools.toString(this);
    }
}

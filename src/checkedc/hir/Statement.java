package checkedc.hir;

import java.util.ArrayList;
import java.util.List;

/**
* Common base of the statements. Expressions that become direct children of
* a statement print without enclosing parentheses.
*/
public abstract class Statement implements Traversable {

    protected Traversable parent;

    // Null entries are omitted optional parts.
    protected List<Traversable> children;

    protected Statement() {
        parent = null;
        children = new ArrayList<Traversable>(1);
    }

    /**
    * Attaches the next child; null records an omitted part.
    *
    * @throws NotAnOrphanException if <b>t</b> is owned by another object.
    */
    protected void addChild(Traversable t) {
        if (t != null && t.getParent() != null) {
            throw new NotAnOrphanException(t.toString());
        }
        children.add(t);
        if (t == null) {
            return;
        }
        t.setParent(this);
        if (t instanceof Expression) {
            ((Expression)t).setParens(false);
        }
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

    @Override
    public String toString() {
        return Tools.toString(this);
    }
}

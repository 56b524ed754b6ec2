package checkedc.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Base class of all expressions. An expression owns its operands as children;
* a child belongs to exactly one parent, so sharing a subexpression requires
* a {@link #clone()}. Two expressions are equal if they have the same class,
* the same operator or value and equal children, regardless of the
* parentheses they print with.
*/
public abstract class Expression implements Cloneable, Traversable {

    protected Traversable parent;

    /** The operands; leaf expressions share an immutable empty list. */
    protected List<Traversable> children;

    /** Whether the expression prints parentheses when nested. */
    protected boolean needs_parens;

    private static final List<Traversable> no_children =
            Collections.emptyList();

    /**
    * @param size the expected number of operands, or a negative number for a
    *       leaf expression.
    */
    protected Expression(int size) {
        parent = null;
        children = (size < 0) ? no_children :
                                new ArrayList<Traversable>(size);
        needs_parens = true;
    }

    /**
    * Returns a deep copy without parent.
    */
    @Override
    public Expression clone() {
        Expression copy;
        try {
            copy = (Expression)super.clone();
        } catch (CloneNotSupportedException e) {
            throw new InternalError(e);
        }
        copy.parent = null;
        if (children != no_children) {
            copy.children = new ArrayList<Traversable>(children.size());
            for (Traversable child : children) {
                Expression child_copy = ((Expression)child).clone();
                child_copy.setParent(copy);
                copy.children.add(child_copy);
            }
        }
        return copy;
    }

    /**
    * Structural equality. Subclasses with an operator or a value extend this
    * check.
    */
    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return children.equals(((Expression)o).children);
    }

    // Parentheses take no part, as in equals.
    @Override
    public int hashCode() {
        return 31 * getClass().getName().hashCode() + children.hashCode();
    }

    /**
    * Attaches an operand.
    *
    * @throws NotAnOrphanException if <b>t</b> already has a parent.
    */
    protected void addChild(Traversable t) {
        if (t.getParent() != null) {
            throw new NotAnOrphanException(t.toString());
        }
        children.add(t);
        t.setParent(this);
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

    public void setParens(boolean f) {
        needs_parens = f;
    }

    @Override
    public String toString() {
        return Tools.toString(this);
    }
}

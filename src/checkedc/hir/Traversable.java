package checkedc.hir;

import java.util.List;

/**
* A node of the IR tree.
*/
public interface Traversable extends Printable {

    /**
    * Returns the children in source order. An omitted optional part, such as
    * a missing else branch, shows up as a null entry.
    */
    List<Traversable> getChildren();

    /** Returns the enclosing object, or null for a root. */
    Traversable getParent();

    /**
    * Called by the new parent when this object is attached to it.
    */
    void setParent(Traversable t);
}

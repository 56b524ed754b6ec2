package checkedc.hir;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Visits an IR subtree in preorder, parents before children and children left
* to right. The root itself is the first object returned; null children
* (omitted optional parts of a statement) are skipped.
* <p>
* The children of an object whose class was registered with
* {@link #pruneOn(Class)} are not visited, although the object itself is.
*/
public class DepthFirstIterator<E extends Traversable> implements Iterator<E> {

    private final LinkedList<Traversable> pending;

    private final List<Class<? extends Traversable>> pruned;

    public DepthFirstIterator(Traversable root) {
        pending = new LinkedList<Traversable>();
        pending.add(root);
        pruned = new ArrayList<Class<? extends Traversable>>(2);
    }

    public boolean hasNext() {
        return !pending.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (pending.isEmpty()) {
            throw new NoSuchElementException();
        }
        Traversable t = pending.removeFirst();
        List<Traversable> children = t.getChildren();
        if (children != null && !isPruned(t)) {
            // Push in reverse so that the leftmost child comes out first.
            for (int i = children.size() - 1; i >= 0; i--) {
                if (children.get(i) != null) {
                    pending.addFirst(children.get(i));
                }
            }
        }
        return (E)t;
    }

    public void remove() {
        throw new UnsupportedOperationException();
    }

    private boolean isPruned(Traversable t) {
        for (Class<? extends Traversable> c : pruned) {
            if (c.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Stops the descent below objects of the specified class.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        pruned.add(c);
    }

    /**
    * Consumes the rest of the iteration and returns the visited objects of
    * the specified class.
    *
    * @param c the class to collect.
    * @return the matching objects in visiting order.
    */
    public <T extends Traversable> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Traversable t = next();
            if (c.isInstance(t)) {
                ret.add(c.cast(t));
            }
        }
        return ret;
    }
}

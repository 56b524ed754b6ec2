package checkedc.analysis;

import java.util.HashSet;
import java.util.LinkedList;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * A first-in first-out work list that holds each element at most once.
 * Adding an element that is already queued has no effect.
 */
public class QueueSet<T> {

    private final LinkedList<T> queue;

    private final Set<T> members;

    public QueueSet() {
        queue = new LinkedList<T>();
        members = new HashSet<T>();
    }

    /**
     * Appends an element unless it is already queued.
     *
     * @param t the element.
     * @return true if the element was appended.
     */
    public boolean add(T t) {
        if (!members.add(t)) {
            return false;
        }
        queue.addLast(t);
        return true;
    }

    /**
     * Removes and returns the oldest element.
     *
     * @throws NoSuchElementException if the queue is empty.
     */
    public T remove() {
        T ret = queue.removeFirst();
        members.remove(ret);
        return ret;
    }

    public boolean contains(T t) {
        return members.contains(t);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    @Override
    public String toString() {
        return queue.toString();
    }
}

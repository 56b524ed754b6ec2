package checkedc.analysis;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import checkedc.hir.PrintTools;

/**
 * A node of a {@link DFAGraph}. Analyses attach their per-node state as
 * key/value pairs; {@link CFGraph} uses the keys "stmts", "condition",
 * "terminator", "case-label", "block-id" and "tag". Every edge may carry a
 * value as well, stored on both of its ends; for a control flow graph this
 * value is the {@link EdgeKind}.
 */
public class DFANode {

    private final Map<String, Object> data;

    // Neighbors in insertion order, mapped to the edge value.
    private final Map<DFANode, Object> preds;

    private final Map<DFANode, Object> succs;

    public DFANode() {
        data = new HashMap<String, Object>(4);
        preds = new LinkedHashMap<DFANode, Object>(2);
        succs = new LinkedHashMap<DFANode, Object>(2);
    }

    /**
     * Creates a node holding one key/value pair.
     */
    public DFANode(String key, Object value) {
        this();
        data.put(key, value);
    }

    /**
     * Returns the value stored under the key, cast to the type expected by
     * the caller.
     *
     * @param key the key.
     * @return the value, or null if the key is absent.
     */
    @SuppressWarnings("unchecked")
    public <T> T getData(String key) {
        return (T)data.get(key);
    }

    public void putData(String key, Object value) {
        data.put(key, value);
    }

    public void removeData(String key) {
        data.remove(key);
    }

    public Set<DFANode> getSuccs() {
        return succs.keySet();
    }

    public Set<DFANode> getPreds() {
        return preds.keySet();
    }

    /**
     * Returns the value of the edge from this node to <b>succ</b>.
     *
     * @param succ a successor.
     * @return the edge value, or null if there is no such edge or it has no
     *      value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getSuccData(DFANode succ) {
        return (T)succs.get(succ);
    }

    public void putSuccData(DFANode succ, Object value) {
        succs.put(succ, value);
    }

    public void putPredData(DFANode pred, Object value) {
        preds.put(pred, value);
    }

    void addPred(DFANode pred) {
        if (!preds.containsKey(pred)) {
            preds.put(pred, null);
        }
    }

    void addSucc(DFANode succ) {
        if (!succs.containsKey(succ)) {
            succs.put(succ, null);
        }
    }

    void removePred(DFANode pred) {
        preds.remove(pred);
    }

    void removeSucc(DFANode succ) {
        succs.remove(succ);
    }

    /**
     * Dumps the data and the edges of the node, one entry per line.
     */
    @Override
    public String toString() {
        String sep = PrintTools.line_sep;
        StringBuilder sb = new StringBuilder(label(this));
        sb.append(" {").append(sep);
        for (Map.Entry<String, Object> e : data.entrySet()) {
            Object value = e.getValue();
            sb.append("  ").append(e.getKey()).append(" = ");
            sb.append((value instanceof DFANode) ?
                      label((DFANode)value) : String.valueOf(value));
            sb.append(sep);
        }
        appendEdges(sb, "  preds:", preds);
        sb.append(sep);
        appendEdges(sb, "  succs:", succs);
        sb.append(sep).append("}");
        return sb.toString();
    }

    private static void appendEdges(StringBuilder sb, String title,
                                    Map<DFANode, Object> edges) {
        sb.append(title);
        for (Map.Entry<DFANode, Object> e : edges.entrySet()) {
            sb.append(" ").append(label(e.getKey()));
            if (e.getValue() != null) {
                sb.append("/").append(e.getValue());
            }
        }
    }

    private static String label(DFANode node) {
        Object id = node.data.get("block-id");
        return (id == null) ? ("node@" + System.identityHashCode(node)) :
                              ("B" + id);
    }
}

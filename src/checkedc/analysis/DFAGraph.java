package checkedc.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import checkedc.hir.PrintTools;

/**
 * A directed graph of {@link DFANode} objects, the common base of the graphs
 * that data flow analyses iterate over. Besides node and edge bookkeeping it
 * offers reachability and reverse post order numbering.
 */
public class DFAGraph {

    /** The nodes in the order the graph keeps them. */
    protected ArrayList<DFANode> nodes;

    public DFAGraph() {
        nodes = new ArrayList<DFANode>();
    }

    /**
     * Adds a node unless the graph already contains it.
     */
    public void addNode(DFANode node) {
        if (!nodes.contains(node)) {
            nodes.add(node);
        }
    }

    /**
     * Finds the first node whose value under <b>key</b> equals <b>value</b>.
     *
     * @param key the key.
     * @param value the value to look for.
     * @return the node, or null if no node matches.
     */
    public DFANode getNodeWith(String key, Object value) {
        if (key == null || value == null) {
            return null;
        }
        for (DFANode node : nodes) {
            if (value.equals(node.getData(key))) {
                return node;
            }
        }
        return null;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Connects two nodes, adding them to the graph when needed. Adding an
     * existing edge again keeps its value.
     */
    public void addEdge(DFANode from, DFANode to) {
        addNode(from);
        addNode(to);
        from.addSucc(to);
        to.addPred(from);
    }

    /**
     * Removes a node together with all edges touching it.
     */
    public void removeNode(DFANode node) {
        if (!nodes.remove(node)) {
            return;
        }
        for (DFANode pred : node.getPreds()) {
            pred.removeSucc(node);
        }
        for (DFANode succ : node.getSuccs()) {
            succ.removePred(node);
        }
    }

    public void removeNodes(List<DFANode> dead) {
        for (DFANode node : dead) {
            removeNode(node);
        }
    }

    /**
     * Returns the nodes reachable from <b>root</b>, the root included.
     *
     * @param root the start node.
     * @return the reachable nodes in depth-first discovery order.
     */
    public Set<DFANode> getReachableNodes(DFANode root) {
        Set<DFANode> ret = new LinkedHashSet<DFANode>();
        LinkedList<DFANode> work = new LinkedList<DFANode>();
        work.add(root);
        while (!work.isEmpty()) {
            DFANode node = work.removeFirst();
            if (ret.add(node)) {
                work.addAll(0, node.getSuccs());
            }
        }
        return ret;
    }

    /**
     * Numbers the nodes in reverse post order of a depth-first search from
     * <b>root</b> and stores the number under "top-order". The root gets the
     * smallest number and the first node to finish gets
     * <code>size() - 1</code>; nodes the search does not reach get -1.
     *
     * @param root the start node.
     * @return the smallest number given to a reached node.
     */
    public int topologicalSort(DFANode root) {
        int next[] = { nodes.size() - 1 };
        Set<DFANode> visited = new LinkedHashSet<DFANode>();
        postOrder(root, visited, next);
        for (DFANode node : nodes) {
            if (!visited.contains(node)) {
                node.putData("top-order", Integer.valueOf(-1));
            }
        }
        return next[0] + 1;
    }

    private void postOrder(DFANode node, Set<DFANode> visited, int next[]) {
        visited.add(node);
        for (DFANode succ : node.getSuccs()) {
            if (!visited.contains(succ)) {
                postOrder(succ, visited, next);
            }
        }
        node.putData("top-order", Integer.valueOf(next[0]--));
    }

    /**
     * Prints the graph in dot format. Nodes are labelled with their value
     * under <b>key</b> and edges with their edge value.
     *
     * @param key the key of the node labels.
     * @return the dot text.
     */
    public String toDot(String key) {
        String sep = PrintTools.line_sep;
        StringBuilder sb = new StringBuilder("digraph G {").append(sep);
        for (int i = 0; i < nodes.size(); i++) {
            Object value = nodes.get(i).getData(key);
            String label = String.valueOf(value);
            sb.append("  node").append(i).append(" [label=\"");
            sb.append(label.replace("\"", "\\\"")).append("\"]").append(sep);
        }
        for (int i = 0; i < nodes.size(); i++) {
            DFANode from = nodes.get(i);
            for (DFANode to : from.getSuccs()) {
                sb.append("  node").append(i);
                sb.append(" -> node").append(nodes.indexOf(to));
                Object kind = from.getSuccData(to);
                if (kind != null) {
                    sb.append(" [label=\"").append(kind).append("\"]");
                }
                sb.append(";").append(sep);
            }
        }
        return sb.append("}").append(sep).toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (DFANode node : nodes) {
            sb.append(node).append(PrintTools.line_sep);
        }
        return sb.toString();
    }
}

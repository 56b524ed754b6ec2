package checkedc.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;

import checkedc.hir.BinaryExpression;
import checkedc.hir.BinaryOperator;
import checkedc.hir.BreakStatement;
import checkedc.hir.Case;
import checkedc.hir.CompoundStatement;
import checkedc.hir.ContinueStatement;
import checkedc.hir.DeclarationStatement;
import checkedc.hir.Default;
import checkedc.hir.DoLoop;
import checkedc.hir.Expression;
import checkedc.hir.ExpressionStatement;
import checkedc.hir.ForLoop;
import checkedc.hir.IfStatement;
import checkedc.hir.NullStatement;
import checkedc.hir.PrintTools;
import checkedc.hir.Procedure;
import checkedc.hir.ReturnStatement;
import checkedc.hir.Statement;
import checkedc.hir.SwitchStatement;
import checkedc.hir.Traversable;
import checkedc.hir.WhileLoop;

/**
* CFGraph supports creation of basic-block level control flow graphs for a
* procedure. The {@link DFANode} class is used to represent each block in the
* graph, and every edge carries its {@link EdgeKind} as successor and
* predecessor data.
* Following key:data pairs are added to the blocks after calling the
* constructor of CFGraph.
*
* <ul>
* <li> stmts: the list of elements of the block; an element is either a
*      top-level statement or a branch condition expression.
* <li> condition: the branch condition evaluated at the end of the block,
*      which is also the last element.
* <li> terminator: the statement (or the short-circuit expression) that owns
*      the condition.
* <li> case-label: the case or default label that starts the block.
* <li> block-id: the block number; the entry block has the highest number
*      and the exit block is numbered 0.
* <li> tag: "ENTRY" or "EXIT" for the two special blocks.
* </ul>
*
* Blocks unreachable from the entry are removed. The exit block is kept even
* when it is unreachable.
*/
public class CFGraph extends DFAGraph {

    // Data structure for building CFG; each list holds the source blocks of
    // the pending jumps of the innermost enclosing statement.
    protected Stack<List<DFANode>> break_link;
    protected Stack<List<DFANode>> continue_link;
    protected Stack<List<DFANode>> switch_link;

    // Procedure that the CFG is created from.
    protected Procedure procedure;

    protected DFANode entry;

    protected DFANode exit;

    // Element to block mapping.
    private Map<Traversable, DFANode> element_map;

    /**
    * Constructs a CFGraph object for the specified procedure.
    *
    * @param proc the procedure.
    * @throws IllegalArgumentException if the body contains a statement kind
    *       that the builder does not know.
    */
    public CFGraph(Procedure proc) {
        super();
        break_link = new Stack<List<DFANode>>();
        continue_link = new Stack<List<DFANode>>();
        switch_link = new Stack<List<DFANode>>();
        element_map = new IdentityHashMap<Traversable, DFANode>();
        procedure = proc;
        entry = newBlock();
        entry.putData("tag", "ENTRY");
        exit = newBlock();
        exit.putData("tag", "EXIT");
        DFANode first = newBlock();
        addEdge(entry, first, EdgeKind.UNCONDITIONAL);
        DFANode last = buildGraph(proc.getBody(), first);
        if (last != null) {
            addEdge(last, exit, EdgeKind.UNCONDITIONAL);
        }
        reduce();
        number();
    }

    /**
    * Adds an edge of the specified kind.
    *
    * @param from the source block.
    * @param to the target block.
    * @param kind the edge kind.
    */
    public void addEdge(DFANode from, DFANode to, EdgeKind kind) {
        addEdge(from, to);
        from.putSuccData(to, kind);
        to.putPredData(from, kind);
    }

    /**
    * Returns the kind of the edge between two blocks.
    *
    * @return the edge kind, or null if there is no such edge.
    */
    public static EdgeKind getEdgeKind(DFANode from, DFANode to) {
        return from.getSuccData(to);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    public DFANode getEntry() {
        return entry;
    }

    public DFANode getExit() {
        return exit;
    }

    /**
    * Returns the block numbered by <b>id</b>, or null.
    */
    public DFANode getBlock(int id) {
        return getNodeWith("block-id", Integer.valueOf(id));
    }

    /**
    * Returns the block containing the specified element.
    *
    * @param element a statement or a branch condition.
    * @return the block or null if the element is unreachable or unknown.
    */
    public DFANode getBlockOf(Traversable element) {
        return element_map.get(element);
    }

    /**
    * Returns the number of the specified block.
    */
    public static int getBlockId(DFANode block) {
        Integer id = block.getData("block-id");
        return (id == null) ? -1 : id.intValue();
    }

    /**
    * Returns the printed name of the block, e.g. "B3".
    */
    public static String getBlockName(DFANode block) {
        return "B" + getBlockId(block);
    }

    /**
    * Returns the elements of the specified block in execution order.
    */
    public static List<Traversable> getElements(DFANode block) {
        List<Traversable> ret = block.getData("stmts");
        return Collections.unmodifiableList(ret);
    }

    /**
    * Returns the branch condition ending the block, or null.
    */
    public static Expression getCondition(DFANode block) {
        return block.getData("condition");
    }

    /**
    * Returns the statement or short-circuit expression owning the branch
    * condition of the block, or null.
    */
    public static Traversable getTerminator(DFANode block) {
        return block.getData("terminator");
    }

    /**
    * Returns the case or default label that starts the block, or null.
    */
    public static Statement getCaseLabel(DFANode block) {
        return block.getData("case-label");
    }

    /**
    * Returns the nodes ordered by descending block number, entry first.
    */
    public List<DFANode> getOrderedBlocks() {
        return Collections.unmodifiableList(nodes);
    }

    public String toDot() {
        return toDot("block-id");
    }

    private DFANode newBlock() {
        DFANode ret = new DFANode("stmts", new ArrayList<Traversable>(4));
        addNode(ret);
        return ret;
    }

    private void append(DFANode block, Traversable element) {
        List<Traversable> stmts = block.getData("stmts");
        stmts.add(element);
        element_map.put(element, block);
    }

    /**
    * Builds the blocks of a statement starting in the <b>curr</b> block.
    *
    * @param t the statement.
    * @param curr the block receiving the next element, or null if control
    *       cannot reach the statement sequentially.
    * @return the block in which control continues after the statement, or
    *       null if the statement always jumps away.
    */
    protected DFANode buildGraph(Statement t, DFANode curr) {
        if (t instanceof Case || t instanceof Default) {
            return buildCase(t, curr);
        }
        if (curr == null) {
            // Unreachable code still gets a block; it is removed later.
            curr = newBlock();
        }
        if (t instanceof CompoundStatement) {
            return buildCompound((CompoundStatement)t, curr);
        } else if (t instanceof ExpressionStatement ||
                   t instanceof DeclarationStatement) {
            append(curr, t);
            return curr;
        } else if (t instanceof NullStatement) {
            // Only a null statement carrying a where clause has any effect.
            if (((NullStatement)t).getWhereClause() != null) {
                append(curr, t);
            }
            return curr;
        } else if (t instanceof IfStatement) {
            return buildIf((IfStatement)t, curr);
        } else if (t instanceof WhileLoop) {
            return buildWhile((WhileLoop)t, curr);
        } else if (t instanceof DoLoop) {
            return buildDoLoop((DoLoop)t, curr);
        } else if (t instanceof ForLoop) {
            return buildForLoop((ForLoop)t, curr);
        } else if (t instanceof SwitchStatement) {
            return buildSwitch((SwitchStatement)t, curr);
        } else if (t instanceof BreakStatement) {
            return buildBreak(curr);
        } else if (t instanceof ContinueStatement) {
            return buildContinue(curr);
        } else if (t instanceof ReturnStatement) {
            append(curr, t);
            addEdge(curr, exit, EdgeKind.UNCONDITIONAL);
            return null;
        }
        throw new IllegalArgumentException(
                "unsupported statement " + t.getClass().getName());
    }

    // Build the blocks for a compound statement.
    protected DFANode buildCompound(CompoundStatement stmt, DFANode curr) {
        for (Traversable child : stmt.getChildren()) {
            curr = buildGraph((Statement)child, curr);
        }
        return curr;
    }

    /**
    * Places a branch condition at the end of <b>block</b>. Short-circuit
    * operators are split into one block per operand.
    */
    protected void buildCondition(Expression cond, DFANode block,
            DFANode on_true, DFANode on_false, Traversable terminator) {
        if (cond instanceof BinaryExpression &&
            ((BinaryExpression)cond).getOperator().isLogical()) {
            BinaryExpression be = (BinaryExpression)cond;
            DFANode rhs_block = newBlock();
            if (be.getOperator() == BinaryOperator.LOGICAL_AND) {
                buildCondition(be.getLHS(), block, rhs_block, on_false, be);
            } else {
                buildCondition(be.getLHS(), block, on_true, rhs_block, be);
            }
            buildCondition(be.getRHS(), rhs_block, on_true, on_false,
                    terminator);
            return;
        }
        append(block, cond);
        block.putData("condition", cond);
        block.putData("terminator", terminator);
        addEdge(block, on_true, EdgeKind.TRUE);
        addEdge(block, on_false, EdgeKind.FALSE);
    }

    // Build the blocks for an if statement.
    protected DFANode buildIf(IfStatement stmt, DFANode curr) {
        DFANode then_block = newBlock();
        DFANode join = newBlock();
        DFANode else_block = join;
        if (stmt.getElseStatement() != null) {
            else_block = newBlock();
        }
        buildCondition(stmt.getControlExpression(), curr, then_block,
                else_block, stmt);
        DFANode then_last = buildGraph(stmt.getThenStatement(), then_block);
        if (then_last != null) {
            addEdge(then_last, join, EdgeKind.UNCONDITIONAL);
        }
        if (stmt.getElseStatement() != null) {
            DFANode else_last = buildGraph(stmt.getElseStatement(), else_block);
            if (else_last != null) {
                addEdge(else_last, join, EdgeKind.UNCONDITIONAL);
            }
        }
        return join;
    }

    // Build the blocks for a while loop.
    protected DFANode buildWhile(WhileLoop stmt, DFANode curr) {
        DFANode condition = newBlock();
        DFANode body = newBlock();
        DFANode loop_exit = newBlock();
        addEdge(curr, condition, EdgeKind.UNCONDITIONAL);
        buildCondition(stmt.getCondition(), condition, body, loop_exit, stmt);
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFANode body_last = buildGraph(stmt.getBody(), body);
        if (body_last != null) {
            addEdge(body_last, condition, EdgeKind.UNCONDITIONAL);
        }
        finishLinks(break_link.pop(), loop_exit);
        finishLinks(continue_link.pop(), condition);
        return loop_exit;
    }

    // Build the blocks for a do-while loop.
    protected DFANode buildDoLoop(DoLoop stmt, DFANode curr) {
        DFANode body = newBlock();
        DFANode condition = newBlock();
        DFANode loop_exit = newBlock();
        addEdge(curr, body, EdgeKind.UNCONDITIONAL);
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFANode body_last = buildGraph(stmt.getBody(), body);
        if (body_last != null) {
            addEdge(body_last, condition, EdgeKind.UNCONDITIONAL);
        }
        buildCondition(stmt.getCondition(), condition, body, loop_exit, stmt);
        finishLinks(break_link.pop(), loop_exit);
        finishLinks(continue_link.pop(), condition);
        return loop_exit;
    }

    // Build the blocks for a for loop.
    protected DFANode buildForLoop(ForLoop stmt, DFANode curr) {
        if (stmt.getInitialStatement() != null) {
            curr = buildGraph(stmt.getInitialStatement(), curr);
        }
        DFANode condition = newBlock();
        DFANode body = newBlock();
        DFANode step = newBlock();
        DFANode loop_exit = newBlock();
        addEdge(curr, condition, EdgeKind.UNCONDITIONAL);
        if (stmt.getCondition() != null) {
            buildCondition(stmt.getCondition(), condition, body, loop_exit,
                    stmt);
        } else {
            addEdge(condition, body, EdgeKind.UNCONDITIONAL);
        }
        break_link.push(new ArrayList<DFANode>(4));
        continue_link.push(new ArrayList<DFANode>(4));
        DFANode body_last = buildGraph(stmt.getBody(), body);
        if (body_last != null) {
            addEdge(body_last, step, EdgeKind.UNCONDITIONAL);
        }
        if (stmt.getStep() != null) {
            append(step, stmt.getStep());
        }
        addEdge(step, condition, EdgeKind.UNCONDITIONAL);
        finishLinks(break_link.pop(), loop_exit);
        finishLinks(continue_link.pop(), step);
        return loop_exit;
    }

    // Build the blocks for a switch statement.
    protected DFANode buildSwitch(SwitchStatement stmt, DFANode curr) {
        Expression value = stmt.getExpression();
        append(curr, value);
        curr.putData("condition", value);
        curr.putData("terminator", stmt);
        DFANode switch_exit = newBlock();
        break_link.push(new ArrayList<DFANode>(4));
        switch_link.push(new ArrayList<DFANode>(4));
        // Statements before the first label are unreachable.
        DFANode body_last = buildGraph(stmt.getBody(), null);
        if (body_last != null) {
            addEdge(body_last, switch_exit, EdgeKind.UNCONDITIONAL);
        }
        finishLinks(break_link.pop(), switch_exit);
        boolean has_default = false;
        for (DFANode label_block : switch_link.pop()) {
            if (getCaseLabel(label_block) instanceof Default) {
                has_default = true;
                addEdge(curr, label_block, EdgeKind.DEFAULT);
            } else {
                addEdge(curr, label_block, EdgeKind.CASE);
            }
        }
        if (!has_default) {
            addEdge(curr, switch_exit, EdgeKind.DEFAULT);
        }
        return switch_exit;
    }

    // Build a block for a case/default label.
    protected DFANode buildCase(Statement stmt, DFANode curr) {
        DFANode ret = newBlock();
        ret.putData("case-label", stmt);
        if (curr != null) {
            addEdge(curr, ret, EdgeKind.FALLTHROUGH);
        }
        // Empty stack means this label has no enclosing switch statement.
        if (!switch_link.empty()) {
            switch_link.peek().add(ret);
        } else {
            PrintTools.printlnStatus("[WARNING] Orphan switch case pair", 0);
        }
        return ret;
    }

    // Jump to the innermost break target.
    protected DFANode buildBreak(DFANode curr) {
        if (!break_link.empty()) {
            break_link.peek().add(curr);
        } else {
            PrintTools.printlnStatus("[WARNING] Break without target", 0);
        }
        return null;
    }

    // Jump to the innermost continue target.
    protected DFANode buildContinue(DFANode curr) {
        if (!continue_link.empty()) {
            continue_link.peek().add(curr);
        } else {
            PrintTools.printlnStatus("[WARNING] Continue without target", 0);
        }
        return null;
    }

    private void finishLinks(List<DFANode> sources, DFANode target) {
        for (DFANode source : sources) {
            addEdge(source, target, EdgeKind.UNCONDITIONAL);
        }
    }

    /**
    * Removes the blocks that cannot be reached from the entry block, except
    * the exit block.
    */
    protected void reduce() {
        Set<DFANode> reachable = getReachableNodes(entry);
        List<DFANode> dead = new ArrayList<DFANode>();
        for (DFANode node : nodes) {
            if (node != exit && !reachable.contains(node)) {
                dead.add(node);
            }
        }
        for (DFANode node : dead) {
            List<Traversable> stmts = node.getData("stmts");
            for (Traversable element : stmts) {
                element_map.remove(element);
            }
        }
        removeNodes(dead);
        PrintTools.printlnStatus(4, "[CFGraph] removed", dead.size(),
                "unreachable blocks in", procedure.getName());
    }

    /**
    * Numbers the blocks in reverse post order; the entry block gets the
    * highest number and the exit block gets 0. The node list is reordered by
    * descending block number.
    */
    protected void number() {
        topologicalSort(entry);
        List<DFANode> ordered = new ArrayList<DFANode>(nodes);
        ordered.remove(exit);
        Collections.sort(ordered, new Comparator<DFANode>() {
            public int compare(DFANode n1, DFANode n2) {
                Integer o1 = n1.getData("top-order");
                Integer o2 = n2.getData("top-order");
                return o1.compareTo(o2);
            }
        });
        int id = ordered.size();
        for (DFANode node : ordered) {
            node.putData("block-id", Integer.valueOf(id--));
            node.removeData("top-order");
        }
        exit.putData("block-id", Integer.valueOf(0));
        exit.removeData("top-order");
        ordered.add(exit);
        nodes = new ArrayList<DFANode>(ordered);
    }
}

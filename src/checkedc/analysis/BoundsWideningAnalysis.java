package checkedc.analysis;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import checkedc.hir.ArrayAccess;
import checkedc.hir.BinaryExpression;
import checkedc.hir.BinaryOperator;
import checkedc.hir.Case;
import checkedc.hir.DataFlowTools;
import checkedc.hir.DeclarationStatement;
import checkedc.hir.Expression;
import checkedc.hir.ExpressionStatement;
import checkedc.hir.IntegerLiteral;
import checkedc.hir.NullStatement;
import checkedc.hir.PrintTools;
import checkedc.hir.Procedure;
import checkedc.hir.RangeBoundsExpression;
import checkedc.hir.Statement;
import checkedc.hir.SwitchStatement;
import checkedc.hir.Symbol;
import checkedc.hir.Tools;
import checkedc.hir.Traversable;
import checkedc.hir.UnaryExpression;
import checkedc.hir.UnaryOperator;
import checkedc.hir.VariableDeclarator;
import checkedc.hir.WhereClause;

/**
* BoundsWideningAnalysis is a forward, path-sensitive data flow analysis that
* computes the bounds of the null-terminated array pointers of a procedure at
* every statement. Bounds are widened when a branch condition tests that the
* element at the current upper bound is non-null, e.g. after
* <code>if (*(p + i))</code> the bounds <code>bounds(p, p + i)</code> become
* <code>bounds(p, p + i + 1)</code> on the true edge.
* <p>
* The analysis works on a {@link CFGraph}. Each block keeps the In, Out, Gen
* and Kill sets together with per-statement sets:
* <pre>
*   StmtGen(S)    facts established by S
*   StmtKill(S)   pointers whose bounds S invalidates
*   UnionGen(S)   (UnionGen(prev) - StmtKill(S)) U StmtGen(S)
*   UnionKill(S)  (UnionKill(prev) - dom StmtGen(S)) U StmtKill(S)
*   In(B)         intersection of the pruned Out sets of the predecessors
*   Out(B)        (In(B) - Kill(B)) U Gen(B)
* </pre>
* The widening generated by the branch condition of a block depends on the
* facts holding before the condition and is resolved whenever the Out set is
* computed. Widened facts flow only along the edge on which the dereferenced
* element is known to be non-null.
*/
public class BoundsWideningAnalysis {

    private static final String pass_name = "[BoundsWidening]";

    /**
    * Analysis state of a block.
    */
    static class ElevatedBlock {

        final DFANode block;

        Map<Symbol, RangeBoundsExpression> in, out, gen;

        Set<Symbol> kill;

        final Map<Traversable, Map<Symbol, RangeBoundsExpression>> stmt_gen;

        final Map<Traversable, Map<Symbol, RangeBoundsExpression>> union_gen;

        final Map<Traversable, Set<Symbol>> stmt_kill;

        final Map<Traversable, Set<Symbol>> union_kill;

        // Previous element in the block; the first element maps to null.
        final Map<Traversable, Traversable> prev_map;

        Traversable last;

        // Pointer expression dereferenced by the terminating condition.
        Expression term_deref_expr;

        // True if the dereferenced element is non-null when the condition
        // holds.
        boolean term_polarity;

        boolean term_switch;

        Set<VariableDeclarator> term_candidates;

        // Facts widened by the terminating condition against the current In.
        Map<Symbol, RangeBoundsExpression> term_gen;

        ElevatedBlock(DFANode block) {
            this.block = block;
            in = new LinkedHashMap<Symbol, RangeBoundsExpression>();
            out = new LinkedHashMap<Symbol, RangeBoundsExpression>();
            gen = new LinkedHashMap<Symbol, RangeBoundsExpression>();
            kill = new LinkedHashSet<Symbol>();
            stmt_gen = new IdentityHashMap<Traversable,
                    Map<Symbol, RangeBoundsExpression>>();
            union_gen = new IdentityHashMap<Traversable,
                    Map<Symbol, RangeBoundsExpression>>();
            stmt_kill = new IdentityHashMap<Traversable, Set<Symbol>>();
            union_kill = new IdentityHashMap<Traversable, Set<Symbol>>();
            prev_map = new IdentityHashMap<Traversable, Traversable>();
            term_candidates = new LinkedHashSet<VariableDeclarator>();
            term_gen = new LinkedHashMap<Symbol, RangeBoundsExpression>();
        }

        @Override
        public String toString() {
            return CFGraph.getBlockName(block);
        }
    }

    private final CFGraph cfg;

    private final Procedure procedure;

    private final BoundsVars bounds_vars;

    private final Lexicographic lex;

    // Stands for any bounds; identity of the intersection.
    private final RangeBoundsExpression top;

    private final Map<DFANode, ElevatedBlock> block_map;

    /**
    * Creates the analysis for the procedure of the specified graph. The
    * analysis does not run until {@link #widenBounds()} is called.
    *
    * @param cfg the control flow graph.
    */
    public BoundsWideningAnalysis(CFGraph cfg) {
        this.cfg = cfg;
        this.procedure = cfg.getProcedure();
        this.bounds_vars = new BoundsVars(procedure);
        this.lex = new Lexicographic();
        this.top = new RangeBoundsExpression(new IntegerLiteral(0),
                                             new IntegerLiteral(0));
        this.block_map = new LinkedHashMap<DFANode, ElevatedBlock>();
    }

    public CFGraph getCFGraph() {
        return cfg;
    }

    public BoundsVars getBoundsVars() {
        return bounds_vars;
    }

    /**
    * Runs the analysis to its fixed point. Running again recomputes every set
    * from scratch.
    */
    public void widenBounds() {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(1, pass_name, "widening bounds in",
                procedure.getName());
        block_map.clear();
        for (DFANode node : cfg.getOrderedBlocks()) {
            if (node != cfg.getExit()) {
                block_map.put(node, new ElevatedBlock(node));
            }
        }

        for (ElevatedBlock eb : block_map.values()) {
            computeGenKillSets(eb);
            initBlockInOutSets(eb);
        }

        QueueSet<ElevatedBlock> work_list = new QueueSet<ElevatedBlock>();
        for (ElevatedBlock eb : block_map.values()) {
            work_list.add(eb);
        }
        int visits = 0;
        while (!work_list.isEmpty()) {
            ElevatedBlock eb = work_list.remove();
            computeInSet(eb);
            computeOutSet(eb, work_list);
            visits++;
        }
        PrintTools.printlnStatus(2, pass_name, procedure.getName(), ":",
                block_map.size(), "blocks,", visits, "visits,",
                String.format("%.2f seconds", Tools.getTime(timer)));

        if (PrintTools.getVerbosity() >= 4) {
            for (ElevatedBlock eb : block_map.values()) {
                PrintTools.printlnStatus(4, pass_name, eb, "In:",
                        factsToString(eb.in), "Gen:", factsToString(eb.gen),
                        "Kill:", eb.kill, "Out:", factsToString(eb.out));
            }
        }
    }

    private void computeGenKillSets(ElevatedBlock eb) {
        Traversable prev = null;
        for (Traversable element : CFGraph.getElements(eb.block)) {
            eb.prev_map.put(element, prev);
            computeStmtGenKillSets(eb, element);
            computeUnionGenKillSets(eb, element, prev);
            prev = element;
        }
        eb.last = prev;
        computeBlockGenKillSets(eb);
    }

    private void computeStmtGenKillSets(ElevatedBlock eb, Traversable stmt) {
        Map<Symbol, RangeBoundsExpression> gen =
                new LinkedHashMap<Symbol, RangeBoundsExpression>();
        Set<Symbol> kill = new LinkedHashSet<Symbol>();

        if (stmt instanceof DeclarationStatement) {
            VariableDeclarator var = ((DeclarationStatement)stmt).getDeclarator();
            if (bounds_vars.isNtPointer(var)) {
                gen.put(var, bounds_vars.getDeclaredBounds(var));
            }
        }

        WhereClause where = null;
        if (stmt instanceof ExpressionStatement) {
            where = ((ExpressionStatement)stmt).getWhereClause();
        } else if (stmt instanceof NullStatement) {
            where = ((NullStatement)stmt).getWhereClause();
        }
        if (where != null) {
            for (VariableDeclarator var : where.getBoundsFacts().keySet()) {
                if (bounds_vars.isNtPointer(var)) {
                    gen.put(var,
                            where.getBoundsFacts().get(var).toRange(var));
                }
            }
        }

        Set<Symbol> modified = DataFlowTools.getDefSymbol(stmt);
        for (Symbol var : modified) {
            kill.addAll(bounds_vars.getPointersWithBoundsUsing(var));
        }
        // A pointer whose bounds were invalidated holds its declared bounds
        // again after the statement.
        for (Symbol var : kill) {
            if (!gen.containsKey(var)) {
                gen.put(var, bounds_vars.getDeclaredBounds(var));
            }
        }

        if (stmt == CFGraph.getCondition(eb.block)) {
            computeTermCondition(eb, (Expression)stmt, modified);
        }

        eb.stmt_gen.put(stmt, gen);
        eb.stmt_kill.put(stmt, kill);
    }

    // Records the dereference tested by the terminating condition and the
    // pointers it may widen.
    private void computeTermCondition(ElevatedBlock eb, Expression cond,
                                      Set<Symbol> modified) {
        Expression deref = null;
        boolean polarity[] = { true };
        if (CFGraph.getTerminator(eb.block) instanceof SwitchStatement) {
            eb.term_switch = true;
            deref = getPlainDerefExpr(cond);
        } else {
            deref = getDerefExpr(cond, polarity);
        }
        if (deref == null) {
            return;
        }
        eb.term_deref_expr = deref;
        eb.term_polarity = polarity[0];
        for (Symbol var : DataFlowTools.getUseSymbol(deref)) {
            eb.term_candidates.addAll(
                    bounds_vars.getPointersWithLowerBoundUsing(var));
        }
        eb.term_candidates.removeAll(modified);
        PrintTools.printlnStatus(4, pass_name, eb, "dereferences", deref,
                "in", cond, "candidates:", eb.term_candidates);
    }

    /**
    * Returns the pointer expression dereferenced by a branch condition. The
    * recognized forms are <code>*e</code>, <code>e1[e2]</code>, their
    * comparisons with zero through <code>==</code> and <code>!=</code>, and
    * the logical negation of any recognized form. Casts are ignored.
    *
    * @param e the condition.
    * @param polarity receives true if the dereferenced element is non-null
    *       when the condition holds.
    * @return <code>e</code> for <code>*e</code>, <code>e1 + e2</code> for
    *       <code>e1[e2]</code>, or null.
    */
    protected Expression getDerefExpr(Expression e, boolean polarity[]) {
        e = Lexicographic.ignoreCasts(e);
        if (e instanceof UnaryExpression &&
            ((UnaryExpression)e).getOperator() ==
            UnaryOperator.LOGICAL_NEGATION) {
            Expression ret = getDerefExpr(
                    ((UnaryExpression)e).getExpression(), polarity);
            if (ret != null) {
                polarity[0] = !polarity[0];
            }
            return ret;
        }
        if (e instanceof BinaryExpression) {
            BinaryExpression be = (BinaryExpression)e;
            BinaryOperator op = be.getOperator();
            if (op != BinaryOperator.COMPARE_EQ &&
                op != BinaryOperator.COMPARE_NE) {
                return null;
            }
            Expression other = null;
            if (ConstantEvaluator.isZero(be.getRHS())) {
                other = be.getLHS();
            } else if (ConstantEvaluator.isZero(be.getLHS())) {
                other = be.getRHS();
            }
            Expression ret = getPlainDerefExpr(other);
            if (ret != null) {
                polarity[0] = (op == BinaryOperator.COMPARE_NE);
            }
            return ret;
        }
        Expression ret = getPlainDerefExpr(e);
        if (ret != null) {
            polarity[0] = true;
        }
        return ret;
    }

    // Returns e for *e and e1 + e2 for e1[e2].
    private Expression getPlainDerefExpr(Expression e) {
        if (e == null) {
            return null;
        }
        e = Lexicographic.ignoreCasts(e);
        if (e instanceof UnaryExpression &&
            ((UnaryExpression)e).getOperator() == UnaryOperator.DEREFERENCE) {
            return ((UnaryExpression)e).getExpression();
        } else if (e instanceof ArrayAccess) {
            ArrayAccess aa = (ArrayAccess)e;
            return new BinaryExpression(aa.getArrayName().clone(),
                    BinaryOperator.ADD, aa.getIndex().clone());
        }
        return null;
    }

    private void computeUnionGenKillSets(ElevatedBlock eb, Traversable stmt,
                                         Traversable prev) {
        Map<Symbol, RangeBoundsExpression> gen = eb.stmt_gen.get(stmt);
        Set<Symbol> kill = eb.stmt_kill.get(stmt);
        if (prev == null) {
            eb.union_gen.put(stmt,
                    new LinkedHashMap<Symbol, RangeBoundsExpression>(gen));
            eb.union_kill.put(stmt, new LinkedHashSet<Symbol>(kill));
            return;
        }
        Map<Symbol, RangeBoundsExpression> union_gen =
                difference(eb.union_gen.get(prev), kill);
        union_gen.putAll(gen);
        eb.union_gen.put(stmt, union_gen);

        Set<Symbol> union_kill = new LinkedHashSet<Symbol>(
                eb.union_kill.get(prev));
        union_kill.removeAll(gen.keySet());
        union_kill.addAll(kill);
        eb.union_kill.put(stmt, union_kill);
    }

    private void computeBlockGenKillSets(ElevatedBlock eb) {
        if (eb.last == null) {
            return;
        }
        eb.gen = new LinkedHashMap<Symbol, RangeBoundsExpression>(
                eb.union_gen.get(eb.last));
        eb.kill = new LinkedHashSet<Symbol>(eb.union_kill.get(eb.last));
    }

    private void initBlockInOutSets(ElevatedBlock eb) {
        Map<Symbol, RangeBoundsExpression> all_top =
                new LinkedHashMap<Symbol, RangeBoundsExpression>();
        for (VariableDeclarator var : bounds_vars.getNtPointers()) {
            all_top.put(var, top);
        }
        if (eb.block == cfg.getEntry()) {
            eb.in = new LinkedHashMap<Symbol, RangeBoundsExpression>();
            for (VariableDeclarator param : procedure.getParameters()) {
                if (bounds_vars.isNtPointer(param)) {
                    eb.in.put(param, bounds_vars.getDeclaredBounds(param));
                }
            }
        } else {
            eb.in = new LinkedHashMap<Symbol, RangeBoundsExpression>(all_top);
        }
        eb.out = all_top;
    }

    private void computeInSet(ElevatedBlock eb) {
        if (eb.block.getPreds().isEmpty()) {
            return;
        }
        Map<Symbol, RangeBoundsExpression> in = null;
        for (DFANode pred : eb.block.getPreds()) {
            ElevatedBlock pred_eb = block_map.get(pred);
            if (pred_eb == null) {
                continue;
            }
            Map<Symbol, RangeBoundsExpression> pruned = pruneOutSet(pred_eb, eb);
            in = (in == null) ? pruned : intersect(in, pruned);
        }
        if (in != null) {
            eb.in = in;
        }
    }

    private void computeOutSet(ElevatedBlock eb,
                               QueueSet<ElevatedBlock> work_list) {
        eb.term_gen = computeTermGen(eb);
        Map<Symbol, RangeBoundsExpression> gen =
                new LinkedHashMap<Symbol, RangeBoundsExpression>(eb.gen);
        gen.putAll(eb.term_gen);
        Map<Symbol, RangeBoundsExpression> out = difference(eb.in, eb.kill);
        out.putAll(gen);

        if (!isEqual(out, eb.out)) {
            eb.out = out;
            for (DFANode succ : eb.block.getSuccs()) {
                ElevatedBlock succ_eb = block_map.get(succ);
                if (succ_eb != null) {
                    work_list.add(succ_eb);
                }
            }
        }
    }

    // Widens each candidate whose upper bound is exactly the dereferenced
    // element before the terminating condition.
    private Map<Symbol, RangeBoundsExpression> computeTermGen(ElevatedBlock eb) {
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>();
        if (eb.term_deref_expr == null) {
            return ret;
        }
        Map<Symbol, RangeBoundsExpression> stmt_in = stmtIn(eb, eb.last);
        for (VariableDeclarator var : eb.term_candidates) {
            RangeBoundsExpression bounds = stmt_in.get(var);
            if (bounds == null || bounds == top) {
                continue;
            }
            Long offset = getDerefOffset(bounds.getUpperExpr(),
                                         eb.term_deref_expr);
            if (offset != null && offset.longValue() == 0) {
                ret.put(var, new RangeBoundsExpression(
                        bounds.getLowerExpr().clone(),
                        getWidenedExpr(eb.term_deref_expr, 1)));
            }
        }
        return ret;
    }

    private Expression getWidenedExpr(Expression e, int offset) {
        Expression base = e.clone();
        base.setParens(true);
        return new BinaryExpression(base, BinaryOperator.ADD,
                                    new IntegerLiteral(offset));
    }

    /**
    * Returns the Out set of the predecessor as seen along the edge to the
    * current block. Facts widened by the terminating condition of the
    * predecessor survive only on the edge where the dereferenced element is
    * non-null; on the other edges the widened pointers fall back to their
    * bounds before the condition.
    */
    private Map<Symbol, RangeBoundsExpression> pruneOutSet(
            ElevatedBlock pred_eb, ElevatedBlock curr_eb) {
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>(pred_eb.out);
        if (pred_eb.term_gen.isEmpty()) {
            return ret;
        }
        EdgeKind kind = CFGraph.getEdgeKind(pred_eb.block, curr_eb.block);
        boolean non_null;
        if (pred_eb.term_switch) {
            if (kind == EdgeKind.CASE) {
                non_null = caseLabelIsNonNull(curr_eb.block);
            } else if (kind == EdgeKind.DEFAULT) {
                non_null = existsNullCaseLabel(pred_eb.block);
            } else {
                non_null = false;
            }
        } else if (kind == EdgeKind.TRUE) {
            non_null = pred_eb.term_polarity;
        } else if (kind == EdgeKind.FALSE) {
            non_null = !pred_eb.term_polarity;
        } else {
            non_null = false;
        }
        if (non_null) {
            return ret;
        }
        Map<Symbol, RangeBoundsExpression> stmt_in =
                stmtIn(pred_eb, pred_eb.last);
        for (Symbol var : pred_eb.term_gen.keySet()) {
            RangeBoundsExpression bounds = stmt_in.get(var);
            if (bounds == null) {
                ret.remove(var);
            } else {
                ret.put(var, bounds);
            }
        }
        return ret;
    }

    // Checks if the case label starting the block is a non-null constant.
    private boolean caseLabelIsNonNull(DFANode block) {
        Statement label = CFGraph.getCaseLabel(block);
        if (!(label instanceof Case)) {
            return false;
        }
        Long value = ConstantEvaluator.evaluate(((Case)label).getExpression());
        return (value != null && value.longValue() != 0);
    }

    // Checks if a case label of the switch block tests for null.
    private boolean existsNullCaseLabel(DFANode switch_block) {
        for (DFANode succ : switch_block.getSuccs()) {
            if (CFGraph.getEdgeKind(switch_block, succ) != EdgeKind.CASE) {
                continue;
            }
            Statement label = CFGraph.getCaseLabel(succ);
            if (label instanceof Case &&
                ConstantEvaluator.isZero(((Case)label).getExpression())) {
                return true;
            }
        }
        return false;
    }

    private Map<Symbol, RangeBoundsExpression> stmtIn(ElevatedBlock eb,
                                                      Traversable stmt) {
        Traversable prev = eb.prev_map.get(stmt);
        if (prev == null) {
            return new LinkedHashMap<Symbol, RangeBoundsExpression>(eb.in);
        }
        return stmtOut(eb, prev);
    }

    private Map<Symbol, RangeBoundsExpression> stmtOut(ElevatedBlock eb,
                                                       Traversable stmt) {
        Map<Symbol, RangeBoundsExpression> ret =
                difference(eb.in, eb.union_kill.get(stmt));
        ret.putAll(eb.union_gen.get(stmt));
        if (stmt == eb.last) {
            ret.putAll(eb.term_gen);
        }
        return ret;
    }

    private Long getDerefOffset(Expression upper, Expression deref) {
        PreorderAST upper_ast = new PreorderAST(upper, lex);
        PreorderAST deref_ast = new PreorderAST(deref, lex);
        upper_ast.normalize();
        deref_ast.normalize();
        return upper_ast.getDerefOffset(deref_ast);
    }

    private Map<Symbol, RangeBoundsExpression> difference(
            Map<Symbol, RangeBoundsExpression> a, Set<Symbol> b) {
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>(a);
        ret.keySet().removeAll(b);
        return ret;
    }

    /**
    * Intersects two fact sets. A pointer is kept only if both sets have a
    * fact for it. Top yields the other fact, equal facts are kept, and of two
    * facts with the same lower bound the one with the smaller upper bound is
    * kept. Unrelated facts drop the pointer.
    */
    private Map<Symbol, RangeBoundsExpression> intersect(
            Map<Symbol, RangeBoundsExpression> a,
            Map<Symbol, RangeBoundsExpression> b) {
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>();
        for (Map.Entry<Symbol, RangeBoundsExpression> e : a.entrySet()) {
            Symbol var = e.getKey();
            RangeBoundsExpression b1 = e.getValue();
            RangeBoundsExpression b2 = b.get(var);
            if (b2 == null) {
                continue;
            }
            if (b1 == top) {
                ret.put(var, b2);
            } else if (b2 == top) {
                ret.put(var, b1);
            } else if (b1.equals(b2)) {
                ret.put(var, b1);
            } else if (isSameLowerBound(b1, b2)) {
                Long offset = getDerefOffset(b1.getUpperExpr(),
                                             b2.getUpperExpr());
                if (offset != null) {
                    ret.put(var, (offset.longValue() >= 0) ? b1 : b2);
                }
            }
        }
        return ret;
    }

    private boolean isSameLowerBound(RangeBoundsExpression b1,
                                     RangeBoundsExpression b2) {
        PreorderAST l1 = new PreorderAST(b1.getLowerExpr(), lex);
        PreorderAST l2 = new PreorderAST(b2.getLowerExpr(), lex);
        l1.normalize();
        l2.normalize();
        return l1.isEqual(l2);
    }

    private boolean isEqual(Map<Symbol, RangeBoundsExpression> a,
                            Map<Symbol, RangeBoundsExpression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<Symbol, RangeBoundsExpression> e : a.entrySet()) {
            RangeBoundsExpression b1 = e.getValue();
            RangeBoundsExpression b2 = b.get(e.getKey());
            if (b2 == null) {
                return false;
            }
            if (b1 == top || b2 == top) {
                if (b1 != b2) {
                    return false;
                }
            } else if (!b1.equals(b2)) {
                return false;
            }
        }
        return true;
    }

    private Map<Symbol, RangeBoundsExpression> withoutTop(
            Map<Symbol, RangeBoundsExpression> facts) {
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>();
        for (Map.Entry<Symbol, RangeBoundsExpression> e : facts.entrySet()) {
            if (e.getValue() != top) {
                ret.put(e.getKey(), e.getValue());
            }
        }
        return ret;
    }

    private String factsToString(Map<Symbol, RangeBoundsExpression> facts) {
        List<String> items = new ArrayList<String>(facts.size());
        for (Map.Entry<Symbol, RangeBoundsExpression> e : facts.entrySet()) {
            items.add(e.getKey().getSymbolName() + ":" +
                      ((e.getValue() == top) ? "Top" : e.getValue()));
        }
        return "{" + PrintTools.collectionToString(items, ", ") + "}";
    }

    private ElevatedBlock getElevatedBlock(Traversable stmt) {
        DFANode block = cfg.getBlockOf(stmt);
        return (block == null) ? null : block_map.get(block);
    }

    /**
    * Returns the bounds facts holding before the specified statement or
    * branch condition.
    *
    * @param stmt an element of a block of the graph.
    * @return the facts, empty if the element is unknown or unreachable.
    */
    public Map<Symbol, RangeBoundsExpression> getStmtIn(Traversable stmt) {
        ElevatedBlock eb = getElevatedBlock(stmt);
        if (eb == null) {
            return Collections.emptyMap();
        }
        return withoutTop(stmtIn(eb, stmt));
    }

    /**
    * Returns the bounds facts holding after the specified statement or
    * branch condition. The facts after a branch condition include the
    * widened bounds, which hold on the non-null edge only.
    *
    * @param stmt an element of a block of the graph.
    * @return the facts, empty if the element is unknown or unreachable.
    */
    public Map<Symbol, RangeBoundsExpression> getStmtOut(Traversable stmt) {
        ElevatedBlock eb = getElevatedBlock(stmt);
        if (eb == null) {
            return Collections.emptyMap();
        }
        return withoutTop(stmtOut(eb, stmt));
    }

    public Map<Symbol, RangeBoundsExpression> getIn(DFANode block) {
        ElevatedBlock eb = block_map.get(block);
        if (eb == null) {
            return Collections.emptyMap();
        }
        return withoutTop(eb.in);
    }

    public Map<Symbol, RangeBoundsExpression> getOut(DFANode block) {
        ElevatedBlock eb = block_map.get(block);
        if (eb == null) {
            return Collections.emptyMap();
        }
        return withoutTop(eb.out);
    }

    /**
    * Returns the Gen set of the block, including the facts widened by its
    * terminating condition.
    */
    public Map<Symbol, RangeBoundsExpression> getGen(DFANode block) {
        ElevatedBlock eb = block_map.get(block);
        if (eb == null) {
            return Collections.emptyMap();
        }
        Map<Symbol, RangeBoundsExpression> ret =
                new LinkedHashMap<Symbol, RangeBoundsExpression>(eb.gen);
        ret.putAll(eb.term_gen);
        return ret;
    }

    public Set<Symbol> getKill(DFANode block) {
        ElevatedBlock eb = block_map.get(block);
        if (eb == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(eb.kill);
    }

    /**
    * Returns the offset of the upper bound of a pointer after the specified
    * statement from its declared upper bound.
    *
    * @param stmt an element of a block of the graph.
    * @param var the pointer.
    * @return the offset, or null if the pointer has no bounds after the
    *       statement or if the offset cannot be computed.
    */
    public Long getWidenedOffset(Traversable stmt, Symbol var) {
        RangeBoundsExpression declared = bounds_vars.getDeclaredBounds(var);
        RangeBoundsExpression bounds = getStmtOut(stmt).get(var);
        if (declared == null || bounds == null) {
            return null;
        }
        return getDerefOffset(declared.getUpperExpr(), bounds.getUpperExpr());
    }

    /**
    * Prints the widened bounds after every statement of the procedure, block
    * by block in descending block number.
    *
    * @param o the target print writer.
    */
    public void dumpWidenedBounds(PrintWriter o) {
        o.println("--------------------------------------");
        o.println("In function: " + procedure.getName());
        o.println("--------------------------------------");
        for (DFANode node : cfg.getOrderedBlocks()) {
            if (node == cfg.getEntry() || node == cfg.getExit()) {
                continue;
            }
            o.println("Block: " + CFGraph.getBlockName(node) + ", Pred: " +
                      blocksToString(node.getPreds()) + ", Succ: " +
                      blocksToString(node.getSuccs()));
            List<Traversable> elements = CFGraph.getElements(node);
            for (int i = 0; i < elements.size(); i++) {
                Traversable element = elements.get(i);
                o.println("  " + i + ": " + element);
                dumpWidenedVars(o, element);
            }
        }
        o.flush();
    }

    private void dumpWidenedVars(PrintWriter o, Traversable element) {
        Map<Symbol, RangeBoundsExpression> out = getStmtOut(element);
        List<Symbol> vars = new ArrayList<Symbol>(out.keySet());
        Collections.sort(vars, new Comparator<Symbol>() {
            public int compare(Symbol s1, Symbol s2) {
                return lex.compareDecl(s1, s2);
            }
        });
        for (Symbol var : vars) {
            Long offset = getWidenedOffset(element, var);
            if (offset == null) {
                o.println("    upper_bound(" + var.getSymbolName() + ") = " +
                          out.get(var).getUpperExpr());
            } else if (offset.longValue() != 0) {
                o.println("    upper_bound(" + var.getSymbolName() + ") = " +
                          offset);
            }
        }
    }

    private String blocksToString(Set<DFANode> blocks) {
        List<DFANode> sorted = new ArrayList<DFANode>(blocks);
        Collections.sort(sorted, new Comparator<DFANode>() {
            public int compare(DFANode n1, DFANode n2) {
                return CFGraph.getBlockId(n2) - CFGraph.getBlockId(n1);
            }
        });
        List<String> names = new ArrayList<String>(sorted.size());
        for (DFANode node : sorted) {
            names.add(CFGraph.getBlockName(node));
        }
        return PrintTools.collectionToString(names, ", ");
    }
}

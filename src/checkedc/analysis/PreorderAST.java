package checkedc.analysis;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import checkedc.exec.Driver;
import checkedc.hir.AccessExpression;
import checkedc.hir.ArrayAccess;
import checkedc.hir.AssignmentExpression;
import checkedc.hir.BinaryExpression;
import checkedc.hir.BinaryOperator;
import checkedc.hir.CastKind;
import checkedc.hir.Expression;
import checkedc.hir.Identifier;
import checkedc.hir.ImplicitCastExpression;
import checkedc.hir.IntegerLiteral;
import checkedc.hir.PrintTools;
import checkedc.hir.UnaryExpression;
import checkedc.hir.UnaryOperator;

/**
 * PreorderAST is the canonical n-ary form of a pointer arithmetic expression.
 * Two expressions that compute the same value modulo commutativity and
 * associativity of <code>+</code> and <code>*</code> and constant arithmetic
 * normalize to trees that compare equal.
 * <p>
 * The root of a tree is always an addition; an expression without a
 * top-level addition is represented as <code>e + 0</code>. Member accesses
 * through a pointer (<code>a-&gt;f</code>, <code>(*a).f</code>,
 * <code>a[i].f</code>) share one form whose base is <code>a + 0</code> (or
 * <code>a + i + 0</code>), and dereferences <code>*e</code> and subscripts
 * <code>e1[e2]</code> are represented as the dereference of
 * <code>e + 0</code> and <code>e1 + e2 + 0</code>.
 * <p>
 * A tree that violates a structural invariant, or whose constant folding
 * overflows, is in the error state. Such a tree never compares equal to
 * another tree and yields no offset.
 */
public class PreorderAST {

    /** Kinds of nodes, in the order used by the comparison. */
    public enum Kind {
        BINARY_OPERATOR,
        UNARY_OPERATOR,
        MEMBER,
        IMPLICIT_CAST,
        LEAF_EXPR
    }

    /** Base class of the tree nodes. */
    public abstract static class Node {

        protected final Kind kind;

        // Used only to splice a node into its parent while coalescing.
        protected Node parent;

        protected Node(Kind kind, Node parent) {
            this.kind = kind;
            this.parent = parent;
        }

        public Kind getKind() {
            return kind;
        }

        public Node getParent() {
            return parent;
        }
    }

    /** An n-ary operator node. */
    public static class BinaryOperatorNode extends Node {

        protected final BinaryOperator opc;

        protected final List<Node> children;

        public BinaryOperatorNode(BinaryOperator opc, Node parent) {
            super(Kind.BINARY_OPERATOR, parent);
            this.opc = opc;
            this.children = new ArrayList<Node>(4);
        }

        public BinaryOperator getOperator() {
            return opc;
        }

        public List<Node> getChildren() {
            return Collections.unmodifiableList(children);
        }
    }

    /** A unary operator node; dereferences are unary operator nodes. */
    public static class UnaryOperatorNode extends Node {

        protected final UnaryOperator opc;

        protected Node child;

        public UnaryOperatorNode(UnaryOperator opc, Node parent) {
            super(Kind.UNARY_OPERATOR, parent);
            this.opc = opc;
        }

        public UnaryOperator getOperator() {
            return opc;
        }

        public Node getChild() {
            return child;
        }
    }

    /** A member access node. */
    public static class MemberNode extends Node {

        protected final Identifier field;

        protected final boolean is_arrow;

        protected Node base;

        public MemberNode(Identifier field, boolean is_arrow, Node parent) {
            super(Kind.MEMBER, parent);
            this.field = field;
            this.is_arrow = is_arrow;
        }

        public Identifier getField() {
            return field;
        }

        public boolean isArrow() {
            return is_arrow;
        }

        public Node getBase() {
            return base;
        }
    }

    /** A conversion that changes the value or its representation. */
    public static class ImplicitCastNode extends Node {

        protected final CastKind cast_kind;

        protected Node child;

        public ImplicitCastNode(CastKind cast_kind, Node parent) {
            super(Kind.IMPLICIT_CAST, parent);
            this.cast_kind = cast_kind;
        }

        public CastKind getCastKind() {
            return cast_kind;
        }

        public Node getChild() {
            return child;
        }
    }

    /** A leaf holding an expression that is not decomposed any further. */
    public static class LeafExprNode extends Node {

        protected final Expression expr;

        public LeafExprNode(Expression expr, Node parent) {
            super(Kind.LEAF_EXPR, parent);
            this.expr = expr;
        }

        public Expression getExpr() {
            return expr;
        }
    }

    private final Lexicographic lex;

    private final Expression expr;

    private Node root;

    private boolean error;

    // Set by a rewriting pass that changed the tree.
    private boolean changed;

    /**
     * Builds the tree of the specified expression. The tree is not normalized
     * until {@link #normalize()} is called.
     *
     * @param e the expression.
     * @param lex the ordering of leaves.
     */
    public PreorderAST(Expression e, Lexicographic lex) {
        this.lex = lex;
        this.expr = e;
        this.root = null;
        this.error = false;
        create(e, null);
    }

    /**
     * Checks if the operator may be reordered and regrouped. Only addition and
     * multiplication qualify; division and modulus never do.
     */
    public static boolean isOpCommutativeAndAssociative(BinaryOperator opc) {
        return (opc == BinaryOperator.ADD || opc == BinaryOperator.MULTIPLY);
    }

    public Node getRoot() {
        return root;
    }

    /**
     * Checks if the tree is in the error state.
     */
    public boolean getError() {
        return error;
    }

    private void setError(String reason) {
        if (!error) {
            PrintTools.printlnStatus(3, "[PreorderAST]", reason, "in", expr);
        }
        error = true;
    }

    private void create(Expression e, Node parent) {
        if (error) {
            return;
        }
        e = Lexicographic.ignoreValuePreservingCasts(e);

        if (root == null) {
            addZero(e, null);
            return;
        }

        if (e instanceof AccessExpression) {
            createMember((AccessExpression)e, parent);

        } else if (e instanceof BinaryExpression &&
                   !(e instanceof AssignmentExpression)) {
            BinaryExpression be = (BinaryExpression)e;
            BinaryOperator opc = be.getOperator();
            Expression lhs = be.getLHS();
            Expression rhs = be.getRHS();

            // a - c is a + -c unless negating c overflows.
            if (opc == BinaryOperator.SUBTRACT) {
                Long c = ConstantEvaluator.evaluate(rhs);
                Long neg = (c == null) ? null :
                        ConstantEvaluator.subtract(0, c.longValue());
                if (neg != null) {
                    opc = BinaryOperator.ADD;
                    rhs = newConstant(neg.longValue());
                }
            }

            BinaryOperatorNode n = new BinaryOperatorNode(opc, parent);
            attachNode(n, parent);
            create(lhs, n);
            create(rhs, n);

        } else if (e instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)e;
            UnaryOperator opc = ue.getOperator();
            Expression sub = ue.getExpression();

            if (opc == UnaryOperator.DEREFERENCE) {
                UnaryOperatorNode n = new UnaryOperatorNode(opc, parent);
                attachNode(n, parent);
                addZero(sub, n);
            } else if ((opc == UnaryOperator.PLUS ||
                        opc == UnaryOperator.MINUS) &&
                       ConstantEvaluator.isIntegerConstant(sub)) {
                attachNode(new LeafExprNode(e, parent), parent);
            } else {
                UnaryOperatorNode n = new UnaryOperatorNode(opc, parent);
                attachNode(n, parent);
                create(sub, n);
            }

        } else if (e instanceof ArrayAccess) {
            // e1[e2] is *(e1 + e2).
            ArrayAccess aa = (ArrayAccess)e;
            UnaryOperatorNode n =
                    new UnaryOperatorNode(UnaryOperator.DEREFERENCE, parent);
            attachNode(n, parent);
            addZero(new BinaryExpression(aa.getArrayName().clone(),
                    BinaryOperator.ADD, aa.getIndex().clone()), n);

        } else if (e instanceof ImplicitCastExpression) {
            ImplicitCastExpression ice = (ImplicitCastExpression)e;
            ImplicitCastNode n =
                    new ImplicitCastNode(ice.getCastKind(), parent);
            attachNode(n, parent);
            create(ice.getExpression(), n);

        } else {
            attachNode(new LeafExprNode(e, parent), parent);
        }
    }

    private void createMember(AccessExpression ae, Node parent) {
        Expression base = Lexicographic.ignoreValuePreservingCasts(
                ae.getBase());
        Expression arrow_base = null;
        if (ae.isArrow()) {
            arrow_base = base;
        } else if (base instanceof UnaryExpression &&
                   ((UnaryExpression)base).getOperator() ==
                   UnaryOperator.DEREFERENCE) {
            // (*a).f is a->f.
            arrow_base = ((UnaryExpression)base).getExpression();
        } else if (base instanceof ArrayAccess) {
            // a[i].f is (a + i)->f.
            ArrayAccess aa = (ArrayAccess)base;
            arrow_base = new BinaryExpression(aa.getArrayName().clone(),
                    BinaryOperator.ADD, aa.getIndex().clone());
        }

        if (arrow_base != null) {
            MemberNode n = new MemberNode(ae.getField(), true, parent);
            attachNode(n, parent);
            addZero(arrow_base, n);
        } else {
            MemberNode n = new MemberNode(ae.getField(), false, parent);
            attachNode(n, parent);
            create(base, n);
        }
    }

    // Creates e + 0 under the parent.
    private void addZero(Expression e, Node parent) {
        BinaryOperatorNode n = new BinaryOperatorNode(BinaryOperator.ADD,
                parent);
        attachNode(n, parent);
        attachNode(new LeafExprNode(new IntegerLiteral(0), n), n);
        create(e, n);
    }

    private static Expression newConstant(long value) {
        if (value < 0) {
            return new UnaryExpression(UnaryOperator.MINUS,
                    new IntegerLiteral(-value));
        }
        return new IntegerLiteral(value);
    }

    private void attachNode(Node n, Node parent) {
        if (parent == null) {
            if (!(n instanceof BinaryOperatorNode)) {
                setError("root is not an operator node");
            }
            root = n;
            return;
        }
        switch (parent.kind) {
        case BINARY_OPERATOR:
            ((BinaryOperatorNode)parent).children.add(n);
            break;
        case UNARY_OPERATOR:
            ((UnaryOperatorNode)parent).child = n;
            break;
        case MEMBER:
            ((MemberNode)parent).base = n;
            break;
        case IMPLICIT_CAST:
            ((ImplicitCastNode)parent).child = n;
            break;
        default:
            setError("cannot attach a node to a leaf");
        }
    }

    /**
     * Normalizes the tree by coalescing, sorting and constant folding until
     * nothing changes or the tree enters the error state.
     */
    public void normalize() {
        changed = true;
        while (changed && !error) {
            changed = false;
            coalesce(root);
            if (error) {
                break;
            }
            sort(root);
            if (error) {
                break;
            }
            constantFold(root);
        }
        if (!error && !(root instanceof BinaryOperatorNode)) {
            setError("root is not an operator node");
        }
        if (Driver.getOptionValue("dump-preorder-ast") != null) {
            PrintWriter pw = new PrintWriter(System.out);
            prettyPrint(pw);
            pw.flush();
        }
    }

    private void coalesce(Node n) {
        if (error || n == null) {
            return;
        }
        switch (n.kind) {
        case BINARY_OPERATOR:
            BinaryOperatorNode b = (BinaryOperatorNode)n;
            // Children may splice themselves into b while iterating.
            for (Node child : new ArrayList<Node>(b.children)) {
                coalesce(child);
            }
            if (canCoalesce(b)) {
                coalesceNode(b);
            }
            break;
        case UNARY_OPERATOR:
            coalesce(((UnaryOperatorNode)n).child);
            break;
        case MEMBER:
            coalesce(((MemberNode)n).base);
            break;
        case IMPLICIT_CAST:
            coalesce(((ImplicitCastNode)n).child);
            break;
        default:
            break;
        }
    }

    private boolean canCoalesce(BinaryOperatorNode b) {
        if (!(b.parent instanceof BinaryOperatorNode)) {
            return false;
        }
        BinaryOperatorNode p = (BinaryOperatorNode)b.parent;
        if (!isOpCommutativeAndAssociative(b.opc) ||
            !isOpCommutativeAndAssociative(p.opc)) {
            return false;
        }
        return (b.opc == p.opc || b.children.size() == 1);
    }

    // Replaces b by its children in the child list of its parent.
    private void coalesceNode(BinaryOperatorNode b) {
        BinaryOperatorNode p = (BinaryOperatorNode)b.parent;
        int index = -1;
        for (int i = 0; i < p.children.size(); i++) {
            if (p.children.get(i) == b) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            setError("node is not a child of its parent");
            return;
        }
        p.children.remove(index);
        for (Node child : b.children) {
            child.parent = p;
            p.children.add(child);
        }
        b.parent = null;
        changed = true;
    }

    private void sort(Node n) {
        if (error || n == null) {
            return;
        }
        switch (n.kind) {
        case BINARY_OPERATOR:
            BinaryOperatorNode b = (BinaryOperatorNode)n;
            for (Node child : b.children) {
                sort(child);
            }
            if (isOpCommutativeAndAssociative(b.opc)) {
                Collections.sort(b.children, new Comparator<Node>() {
                    public int compare(Node n1, Node n2) {
                        return PreorderAST.this.compare(n1, n2);
                    }
                });
            }
            break;
        case UNARY_OPERATOR:
            sort(((UnaryOperatorNode)n).child);
            break;
        case MEMBER:
            sort(((MemberNode)n).base);
            break;
        case IMPLICIT_CAST:
            sort(((ImplicitCastNode)n).child);
            break;
        default:
            break;
        }
    }

    private void constantFold(Node n) {
        if (error || n == null) {
            return;
        }
        switch (n.kind) {
        case BINARY_OPERATOR:
            BinaryOperatorNode b = (BinaryOperatorNode)n;
            for (Node child : new ArrayList<Node>(b.children)) {
                constantFold(child);
            }
            if (!error && isOpCommutativeAndAssociative(b.opc)) {
                foldNode(b);
            }
            break;
        case UNARY_OPERATOR:
            constantFold(((UnaryOperatorNode)n).child);
            break;
        case MEMBER:
            constantFold(((MemberNode)n).base);
            break;
        case IMPLICIT_CAST:
            constantFold(((ImplicitCastNode)n).child);
            break;
        default:
            break;
        }
    }

    // Combines the integer constant children of b into a single leaf.
    private void foldNode(BinaryOperatorNode b) {
        List<Node> constants = new ArrayList<Node>(2);
        long value = (b.opc == BinaryOperator.ADD) ? 0 : 1;
        for (Node child : b.children) {
            if (child.kind != Kind.LEAF_EXPR) {
                continue;
            }
            Long c = ConstantEvaluator.evaluate(((LeafExprNode)child).expr);
            if (c == null) {
                continue;
            }
            Long folded = (b.opc == BinaryOperator.ADD) ?
                    ConstantEvaluator.add(value, c.longValue()) :
                    ConstantEvaluator.multiply(value, c.longValue());
            if (folded == null) {
                setError("overflow while folding constants");
                return;
            }
            value = folded.longValue();
            constants.add(child);
        }
        if (constants.size() <= 1) {
            return;
        }
        b.children.removeAll(constants);
        b.children.add(new LeafExprNode(newConstant(value), b));
        changed = true;
    }

    /**
     * Compares two nodes. Nodes are ordered by kind, then by operator (or
     * arrow flag and field, or cast kind), then by number of children, and
     * then by children in order. Leaves are ordered by {@link Lexicographic}.
     *
     * @return a negative integer, zero, or a positive integer as <b>n1</b> is
     *      ordered before, equal to, or after <b>n2</b>.
     */
    public int compare(Node n1, Node n2) {
        if (n1 == n2) {
            return 0;
        }
        if (n1.kind != n2.kind) {
            return n1.kind.compareTo(n2.kind);
        }
        int ret;
        switch (n1.kind) {
        case BINARY_OPERATOR:
            BinaryOperatorNode b1 = (BinaryOperatorNode)n1;
            BinaryOperatorNode b2 = (BinaryOperatorNode)n2;
            ret = Integer.compare(b1.opc.getValue(), b2.opc.getValue());
            if (ret != 0) {
                return ret;
            }
            ret = Integer.compare(b1.children.size(), b2.children.size());
            if (ret != 0) {
                return ret;
            }
            for (int i = 0; i < b1.children.size(); i++) {
                ret = compare(b1.children.get(i), b2.children.get(i));
                if (ret != 0) {
                    return ret;
                }
            }
            return 0;
        case UNARY_OPERATOR:
            UnaryOperatorNode u1 = (UnaryOperatorNode)n1;
            UnaryOperatorNode u2 = (UnaryOperatorNode)n2;
            ret = Integer.compare(u1.opc.getValue(), u2.opc.getValue());
            if (ret != 0) {
                return ret;
            }
            return compare(u1.child, u2.child);
        case MEMBER:
            MemberNode m1 = (MemberNode)n1;
            MemberNode m2 = (MemberNode)n2;
            if (m1.is_arrow != m2.is_arrow) {
                return m1.is_arrow ? -1 : 1;
            }
            ret = lex.compareDecl(m1.field.getSymbol(), m2.field.getSymbol());
            if (ret != 0) {
                return ret;
            }
            return compare(m1.base, m2.base);
        case IMPLICIT_CAST:
            ImplicitCastNode c1 = (ImplicitCastNode)n1;
            ImplicitCastNode c2 = (ImplicitCastNode)n2;
            ret = c1.cast_kind.compareTo(c2.cast_kind);
            if (ret != 0) {
                return ret;
            }
            return compare(c1.child, c2.child);
        default:
            return lex.compareExpr(((LeafExprNode)n1).expr,
                                   ((LeafExprNode)n2).expr);
        }
    }

    /**
     * Checks if this tree and the other tree are both valid and equal.
     *
     * @param other the other normalized tree.
     * @return true if the two trees compare equal.
     */
    public boolean isEqual(PreorderAST other) {
        if (error || other.error) {
            return false;
        }
        return (compare(root, other.root) == 0);
    }

    /**
     * Returns the constant offset of a dereferenced pointer expression from
     * this tree, which is an upper bound. The offset exists when both roots
     * have the same operator and the same number of children, and the
     * children are pairwise equal except at most one pair of integer constant
     * leaves under an addition. For example, the offset of
     * <code>p + i + 1</code> from <code>p + i</code> is 1.
     *
     * @param deref the normalized tree of the dereferenced expression.
     * @return <code>deref - this</code>, or null if no offset can be proven.
     */
    public Long getDerefOffset(PreorderAST deref) {
        if (error || deref.error) {
            return null;
        }
        if (!(root instanceof BinaryOperatorNode) ||
            !(deref.root instanceof BinaryOperatorNode)) {
            return null;
        }
        BinaryOperatorNode b1 = (BinaryOperatorNode)root;
        BinaryOperatorNode b2 = (BinaryOperatorNode)deref.root;
        if (b1.opc != b2.opc || b1.children.size() != b2.children.size()) {
            return null;
        }

        boolean found = false;
        long offset = 0;
        for (int i = 0; i < b1.children.size(); i++) {
            Node c1 = b1.children.get(i);
            Node c2 = b2.children.get(i);
            if (compare(c1, c2) == 0) {
                continue;
            }
            // Only one pair of children may differ.
            if (found || b1.opc != BinaryOperator.ADD) {
                return null;
            }
            if (c1.kind != Kind.LEAF_EXPR || c2.kind != Kind.LEAF_EXPR) {
                return null;
            }
            Long v1 = ConstantEvaluator.evaluate(((LeafExprNode)c1).expr);
            Long v2 = ConstantEvaluator.evaluate(((LeafExprNode)c2).expr);
            if (v1 == null || v2 == null) {
                return null;
            }
            Long diff = ConstantEvaluator.subtract(v2.longValue(),
                                                   v1.longValue());
            if (diff == null) {
                return null;
            }
            offset = diff.longValue();
            found = true;
        }
        return Long.valueOf(offset);
    }

    /**
     * Prints the tree with one node per line, indented by depth.
     *
     * @param o the target print writer.
     */
    public void prettyPrint(PrintWriter o) {
        o.println("PreorderAST of " + expr + (error ? " (error)" : ""));
        prettyPrint(o, root, 1);
        o.println("--------------------------------------");
    }

    private void prettyPrint(PrintWriter o, Node n, int depth) {
        if (n == null) {
            return;
        }
        for (int i = 0; i < depth; i++) {
            o.print("  ");
        }
        switch (n.kind) {
        case BINARY_OPERATOR:
            BinaryOperatorNode b = (BinaryOperatorNode)n;
            o.println("BinaryOperator: " + b.opc);
            for (Node child : b.children) {
                prettyPrint(o, child, depth + 1);
            }
            break;
        case UNARY_OPERATOR:
            UnaryOperatorNode u = (UnaryOperatorNode)n;
            o.println("UnaryOperator: " + u.opc);
            prettyPrint(o, u.child, depth + 1);
            break;
        case MEMBER:
            MemberNode m = (MemberNode)n;
            o.println("Member: " + (m.is_arrow ? "->" : ".") + m.field);
            prettyPrint(o, m.base, depth + 1);
            break;
        case IMPLICIT_CAST:
            ImplicitCastNode c = (ImplicitCastNode)n;
            o.println("ImplicitCast: " + c.cast_kind);
            prettyPrint(o, c.child, depth + 1);
            break;
        default:
            o.println("Leaf: " + ((LeafExprNode)n).expr);
        }
    }
}

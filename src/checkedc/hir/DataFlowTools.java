package checkedc.hir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
* Def/use collection over IR subtrees. A variable counts as written when it
* is assigned, incremented or decremented, declared, or has its address
* taken; after <code>&amp;x</code> any store may go to <code>x</code>.
*/
public final class DataFlowTools {

    private DataFlowTools() {
    }

    /**
    * Collects the lvalues written inside <b>t</b>, in preorder.
    */
    public static List<Expression> getDefList(Traversable t) {
        List<Expression> lvalues = new ArrayList<Expression>();
        if (t == null) {
            return lvalues;
        }
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        while (iter.hasNext()) {
            Expression written = writtenOperand(iter.next());
            if (written != null) {
                lvalues.add(written);
            }
        }
        return lvalues;
    }

    private static Expression writtenOperand(Traversable t) {
        if (t instanceof AssignmentExpression) {
            return ((AssignmentExpression)t).getLHS();
        }
        if (t instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)t;
            UnaryOperator op = ue.getOperator();
            if (op.isModifying() || op == UnaryOperator.ADDRESS_OF) {
                return ue.getExpression();
            }
        }
        return null;
    }

    /**
    * Collects the variables written inside <b>t</b>. A declaration statement
    * writes its declarator even without an initializer.
    */
    public static Set<Symbol> getDefSymbol(Traversable t) {
        Set<Symbol> defs = new LinkedHashSet<Symbol>();
        if (t instanceof DeclarationStatement) {
            defs.add(((DeclarationStatement)t).getDeclarator());
        }
        for (Expression lvalue : getDefList(t)) {
            Symbol var = getSymbolOf(lvalue);
            if (var != null) {
                defs.add(var);
            }
        }
        return defs;
    }

    /**
    * Collects every variable named inside <b>t</b>, written or not. The
    * member name on the right of <code>.</code> or <code>-&gt;</code> is
    * not a variable.
    */
    public static Set<Symbol> getUseSymbol(Traversable t) {
        Set<Symbol> uses = new LinkedHashSet<Symbol>();
        if (t == null) {
            return uses;
        }
        List<Identifier> ids =
                new DepthFirstIterator<Traversable>(t).getList(Identifier.class);
        for (Identifier id : ids) {
            if (!isFieldName(id)) {
                uses.add(id.getSymbol());
            }
        }
        return uses;
    }

    /**
    * Maps an lvalue to the variable whose storage it names: the identifier
    * itself, through implicit casts, or the base of a <code>.</code> access.
    * Stores through a pointer name no variable and give null.
    */
    public static Symbol getSymbolOf(Expression e) {
        if (e instanceof Identifier) {
            return ((Identifier)e).getSymbol();
        }
        if (e instanceof ImplicitCastExpression) {
            return getSymbolOf(((ImplicitCastExpression)e).getExpression());
        }
        if (e instanceof AccessExpression && !((AccessExpression)e).isArrow()) {
            return getSymbolOf(((AccessExpression)e).getBase());
        }
        return null;
    }

    private static boolean isFieldName(Identifier id) {
        Traversable parent = id.getParent();
        return (parent instanceof AccessExpression &&
                ((AccessExpression)parent).getRHS() == id);
    }
}

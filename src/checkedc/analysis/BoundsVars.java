package checkedc.analysis;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import checkedc.hir.BoundsExpression;
import checkedc.hir.CountBoundsExpression;
import checkedc.hir.DataFlowTools;
import checkedc.hir.DeclarationStatement;
import checkedc.hir.DepthFirstIterator;
import checkedc.hir.ExpressionStatement;
import checkedc.hir.IntegerLiteral;
import checkedc.hir.NullStatement;
import checkedc.hir.PrintTools;
import checkedc.hir.Procedure;
import checkedc.hir.RangeBoundsExpression;
import checkedc.hir.Symbol;
import checkedc.hir.Traversable;
import checkedc.hir.VariableDeclarator;
import checkedc.hir.WhereClause;

/**
* BoundsVars collects, for a procedure, the null-terminated array pointers and
* the variables occurring in their bounds. Bounds come from declarations and
* from where clauses. The maps answer two questions:
* <ul>
* <li> which pointers lose their bounds facts when a variable is modified;
* <li> which pointers may be widened by a dereference that mentions a
*      variable, i.e. the variable occurs in their lower bound.
* </ul>
* Every pointer is associated with itself in both maps.
*/
public class BoundsVars {

    private final Procedure procedure;

    // All null-terminated array pointers in declaration order.
    private final Set<VariableDeclarator> nt_ptrs;

    private final Map<Symbol, RangeBoundsExpression> declared;

    // variable -> pointers with the variable in any of their bounds
    private final Map<Symbol, Set<VariableDeclarator>> bounds_vars;

    // variable -> pointers with the variable in their lower bound
    private final Map<Symbol, Set<VariableDeclarator>> bounds_vars_lower;

    /**
    * Collects the pointers and bounds variables of the specified procedure.
    *
    * @param proc the procedure.
    */
    public BoundsVars(Procedure proc) {
        procedure = proc;
        nt_ptrs = new LinkedHashSet<VariableDeclarator>();
        declared = new HashMap<Symbol, RangeBoundsExpression>();
        bounds_vars = new HashMap<Symbol, Set<VariableDeclarator>>();
        bounds_vars_lower = new HashMap<Symbol, Set<VariableDeclarator>>();

        for (VariableDeclarator param : proc.getParameters()) {
            addPointer(param);
        }
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(proc.getBody());
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof DeclarationStatement) {
                addPointer(((DeclarationStatement)t).getDeclarator());
            } else if (t instanceof ExpressionStatement) {
                addWhereClause(((ExpressionStatement)t).getWhereClause());
            } else if (t instanceof NullStatement) {
                addWhereClause(((NullStatement)t).getWhereClause());
            }
        }
        PrintTools.printlnStatus(4, "[BoundsVars]", proc.getName(), ":",
                nt_ptrs.size(), "null-terminated pointers");
    }

    /**
    * Returns the declared bounds of a null-terminated array pointer in range
    * form. A pointer without bounds annotation has the bounds
    * <code>count(0)</code>.
    *
    * @param var the pointer.
    * @return the newly created range bounds.
    */
    public static RangeBoundsExpression getDeclaredRange(VariableDeclarator var) {
        BoundsExpression bounds = var.getBounds();
        if (bounds == null) {
            bounds = new CountBoundsExpression(new IntegerLiteral(0));
        }
        return bounds.toRange(var);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    /**
    * Returns all null-terminated array pointers of the procedure, parameters
    * first.
    */
    public Set<VariableDeclarator> getNtPointers() {
        return Collections.unmodifiableSet(nt_ptrs);
    }

    /**
    * Checks if the symbol is a null-terminated array pointer of the procedure.
    */
    public boolean isNtPointer(Symbol symbol) {
        return nt_ptrs.contains(symbol);
    }

    /**
    * Returns the declared range bounds of the pointer, or null if the symbol
    * is not a null-terminated array pointer of the procedure. The returned
    * expression is shared and must not be modified.
    */
    public RangeBoundsExpression getDeclaredBounds(Symbol symbol) {
        return declared.get(symbol);
    }

    /**
    * Returns the pointers whose declared or where-clause bounds mention the
    * specified variable, or the pointer itself.
    */
    public Set<VariableDeclarator> getPointersWithBoundsUsing(Symbol var) {
        Set<VariableDeclarator> ret = bounds_vars.get(var);
        if (ret == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(ret);
    }

    /**
    * Returns the pointers whose lower bounds mention the specified variable,
    * or the pointer itself.
    */
    public Set<VariableDeclarator> getPointersWithLowerBoundUsing(Symbol var) {
        Set<VariableDeclarator> ret = bounds_vars_lower.get(var);
        if (ret == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(ret);
    }

    private void addPointer(VariableDeclarator var) {
        if (!var.getTypeKind().isNtArray() || nt_ptrs.contains(var)) {
            return;
        }
        nt_ptrs.add(var);
        RangeBoundsExpression range = getDeclaredRange(var);
        declared.put(var, range);
        associate(bounds_vars, var, var);
        associate(bounds_vars_lower, var, var);
        addBounds(var, range);
    }

    private void addWhereClause(WhereClause where) {
        if (where == null) {
            return;
        }
        for (Map.Entry<VariableDeclarator, BoundsExpression> e :
                where.getBoundsFacts().entrySet()) {
            VariableDeclarator var = e.getKey();
            if (var.getTypeKind().isNtArray()) {
                addBounds(var, e.getValue().toRange(var));
            }
        }
    }

    private void addBounds(VariableDeclarator var, RangeBoundsExpression range) {
        for (Symbol lower : DataFlowTools.getUseSymbol(range.getLowerExpr())) {
            associate(bounds_vars, lower, var);
            associate(bounds_vars_lower, lower, var);
        }
        for (Symbol upper : DataFlowTools.getUseSymbol(range.getUpperExpr())) {
            associate(bounds_vars, upper, var);
        }
    }

    private static void associate(Map<Symbol, Set<VariableDeclarator>> map,
            Symbol var, VariableDeclarator ptr) {
        Set<VariableDeclarator> ptrs = map.get(var);
        if (ptrs == null) {
            ptrs = new LinkedHashSet<VariableDeclarator>(2);
            map.put(var, ptrs);
        }
        ptrs.add(ptr);
    }
}

package checkedc.analysis;

import java.util.List;

import checkedc.hir.BinaryExpression;
import checkedc.hir.Expression;
import checkedc.hir.Identifier;
import checkedc.hir.ImplicitCastExpression;
import checkedc.hir.Symbol;
import checkedc.hir.Traversable;
import checkedc.hir.UnaryExpression;

/**
 * Lexicographic defines a total order over expressions and declarations. The
 * order is used to sort the operands of commutative operators so that
 * equivalent expressions end up in the same canonical form.
 * <p>
 * Integer constant expressions come first, ordered by value. Variables are
 * ordered by declaration (name, then declaration sequence number), and other
 * expressions structurally.
 */
public class Lexicographic {

    public Lexicographic() {
    }

    /**
     * Strips the conversions that do not change the value of an expression.
     *
     * @param e the expression.
     * @return the innermost expression that is not a value-preserving cast.
     */
    public static Expression ignoreValuePreservingCasts(Expression e) {
        while (e instanceof ImplicitCastExpression &&
               ((ImplicitCastExpression)e).getCastKind().isValuePreserving()) {
            e = ((ImplicitCastExpression)e).getExpression();
        }
        return e;
    }

    /**
     * Strips all implicit conversions of an expression.
     *
     * @param e the expression.
     * @return the innermost expression that is not an implicit cast.
     */
    public static Expression ignoreCasts(Expression e) {
        while (e instanceof ImplicitCastExpression) {
            e = ((ImplicitCastExpression)e).getExpression();
        }
        return e;
    }

    /**
     * Compares two declarations.
     *
     * @return a negative integer, zero, or a positive integer as <b>d1</b> is
     *      ordered before, equal to, or after <b>d2</b>.
     */
    public int compareDecl(Symbol d1, Symbol d2) {
        if (d1 == d2) {
            return 0;
        }
        int ret = d1.getSymbolName().compareTo(d2.getSymbolName());
        if (ret != 0) {
            return ret;
        }
        return Integer.compare(d1.getDeclarationId(), d2.getDeclarationId());
    }

    /**
     * Compares two expressions.
     *
     * @return a negative integer, zero, or a positive integer as <b>e1</b> is
     *      ordered before, equal to, or after <b>e2</b>.
     */
    public int compareExpr(Expression e1, Expression e2) {
        e1 = ignoreValuePreservingCasts(e1);
        e2 = ignoreValuePreservingCasts(e2);
        if (e1 == e2) {
            return 0;
        }

        Long c1 = ConstantEvaluator.evaluate(e1);
        Long c2 = ConstantEvaluator.evaluate(e2);
        if (c1 != null && c2 != null) {
            return c1.compareTo(c2);
        } else if (c1 != null) {
            return -1;
        } else if (c2 != null) {
            return 1;
        }

        if (e1.getClass() != e2.getClass()) {
            return e1.getClass().getSimpleName().compareTo(
                    e2.getClass().getSimpleName());
        }

        int ret = 0;
        if (e1 instanceof Identifier) {
            return compareDecl(((Identifier)e1).getSymbol(),
                               ((Identifier)e2).getSymbol());
        } else if (e1 instanceof BinaryExpression) {
            BinaryExpression b1 = (BinaryExpression)e1;
            BinaryExpression b2 = (BinaryExpression)e2;
            ret = Integer.compare(b1.getOperator().getValue(),
                                  b2.getOperator().getValue());
        } else if (e1 instanceof UnaryExpression) {
            ret = Integer.compare(
                    ((UnaryExpression)e1).getOperator().getValue(),
                    ((UnaryExpression)e2).getOperator().getValue());
        } else if (e1 instanceof ImplicitCastExpression) {
            ret = ((ImplicitCastExpression)e1).getCastKind().compareTo(
                    ((ImplicitCastExpression)e2).getCastKind());
        }
        if (ret != 0) {
            return ret;
        }

        List<Traversable> children1 = e1.getChildren();
        List<Traversable> children2 = e2.getChildren();
        ret = Integer.compare(children1.size(), children2.size());
        if (ret != 0) {
            return ret;
        }
        for (int i = 0; i < children1.size(); i++) {
            ret = compareExpr((Expression)children1.get(i),
                              (Expression)children2.get(i));
            if (ret != 0) {
                return ret;
            }
        }
        // Literals and other leaves without children.
        return e1.toString().compareTo(e2.toString());
    }
}

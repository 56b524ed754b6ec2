package checkedc.analysis;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import org.junit.Test;

import checkedc.hir.ExpressionStatement;
import checkedc.hir.IntegerLiteral;
import checkedc.hir.RangeBoundsExpression;
import checkedc.hir.VariableDeclarator;
import checkedc.hir.WhereClause;

public class BoundsVarsTest {

  @Test
  public void testCollectsPointersAndBoundsVariables() {
    VariableDeclarator n = intVar("n");
    VariableDeclarator lo = intVar("lo");
    VariableDeclarator p = withCount(ntPtr("p"), id(n));
    VariableDeclarator q = ntPtr("q");
    withBounds(q, add(id(q), id(lo)), add(id(p), id(n)));
    VariableDeclarator i = intVar("i");
    BoundsVars bv = new BoundsVars(proc("f", block(decl(q), decl(i)), p, n));

    assertEquals(2, bv.getNtPointers().size());
    assertEquals(p, bv.getNtPointers().iterator().next());
    assertTrue(bv.isNtPointer(q));
    assertFalse(bv.isNtPointer(n));
    assertFalse(bv.isNtPointer(i));

    assertTrue(bv.getPointersWithBoundsUsing(n).contains(p));
    assertTrue(bv.getPointersWithBoundsUsing(n).contains(q));
    assertTrue(bv.getPointersWithBoundsUsing(p).contains(q));
    assertTrue(bv.getPointersWithBoundsUsing(p).contains(p));
    assertTrue(bv.getPointersWithBoundsUsing(i).isEmpty());

    // Only the lower bound decides which pointers a dereference may widen.
    assertTrue(bv.getPointersWithLowerBoundUsing(lo).contains(q));
    assertFalse(bv.getPointersWithLowerBoundUsing(n).contains(q));
    assertTrue(bv.getPointersWithLowerBoundUsing(q).contains(q));
  }

  @Test
  public void testDeclaredRange() {
    VariableDeclarator p = ntPtr("p");
    RangeBoundsExpression range = BoundsVars.getDeclaredRange(p);
    assertEquals(id(p), range.getLowerExpr());
    assertEquals(add(id(p), new IntegerLiteral(0)), range.getUpperExpr());

    VariableDeclarator n = intVar("n");
    withCount(p, id(n));
    BoundsVars bv = new BoundsVars(proc("f", block(), p, n));
    assertEquals(new RangeBoundsExpression(id(p), add(id(p), id(n))),
                 bv.getDeclaredBounds(p));
    assertNull(bv.getDeclaredBounds(n));
  }

  @Test
  public void testWhereClauseVariables() {
    VariableDeclarator p = ntPtr("p");
    VariableDeclarator x = intVar("x");
    ExpressionStatement s = stmt(assign(id(x), lit(1)));
    WhereClause where = new WhereClause();
    where.addBoundsFact(p, new RangeBoundsExpression(id(p), add(id(p), id(x))));
    s.setWhereClause(where);
    BoundsVars bv = new BoundsVars(proc("f", block(s), p));

    assertTrue(bv.getPointersWithBoundsUsing(x).contains(p));
    // The declared bounds stay count(0).
    assertEquals(add(id(p), lit(0)), bv.getDeclaredBounds(p).getUpperExpr());
  }
}

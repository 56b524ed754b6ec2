package checkedc.analysis;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import checkedc.hir.BreakStatement;
import checkedc.hir.Case;
import checkedc.hir.DeclarationStatement;
import checkedc.hir.Default;
import checkedc.hir.Expression;
import checkedc.hir.ExpressionStatement;
import checkedc.hir.IfStatement;
import checkedc.hir.Procedure;
import checkedc.hir.RangeBoundsExpression;
import checkedc.hir.StringLiteral;
import checkedc.hir.SwitchStatement;
import checkedc.hir.Symbol;
import checkedc.hir.VariableDeclarator;
import checkedc.hir.WhereClause;
import checkedc.hir.WhileLoop;

public class BoundsWideningAnalysisTest {

  private VariableDeclarator p, a, i, n, x;

  @Before
  public void setUp() {
    p = ntPtr("p");
    a = intVar("a");
    i = intVar("i");
    n = intVar("n");
    x = intVar("x");
  }

  private static BoundsWideningAnalysis analyze(Procedure proc) {
    BoundsWideningAnalysis ret = new BoundsWideningAnalysis(new CFGraph(proc));
    ret.widenBounds();
    return ret;
  }

  // _Nt_array_ptr<char> p : bounds(p, p + i) = "a";
  private DeclarationStatement declP() {
    return decl(withBounds(p, id(p), add(id(p), id(i))), new StringLiteral("a"));
  }

  private ExpressionStatement setA(int value) {
    return stmt(assign(id(a), lit(value)));
  }

  private static Long offset(Expression upper, Expression other) {
    Lexicographic lex = new Lexicographic();
    PreorderAST upper_ast = new PreorderAST(upper, lex);
    PreorderAST other_ast = new PreorderAST(other, lex);
    upper_ast.normalize();
    other_ast.normalize();
    return upper_ast.getDerefOffset(other_ast);
  }

  @Test
  public void testWideningOnTrueBranch() {
    DeclarationStatement d = declP();
    Expression cond = deref(add(id(i), id(p)));
    ExpressionStatement inside = setA(1);
    ExpressionStatement after = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f1",
        block(d, new IfStatement(cond, block(inside)), after), i));

    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(d, p));
    assertEquals(add(id(p), id(i)), bwa.getStmtIn(cond).get(p).getUpperExpr());
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(cond, p));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(inside, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(after, p));
    // The lower bound is kept.
    assertEquals(id(p), bwa.getStmtIn(inside).get(p).getLowerExpr());
  }

  @Test
  public void testNoWideningOnFalseBranch() {
    ExpressionStatement on_true = setA(1);
    ExpressionStatement on_false = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(deref(add(id(p), id(i))), block(on_true), block(on_false))), i));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_true, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_false, p));
  }

  @Test
  public void testComparisonWithZero() {
    ExpressionStatement on_true = setA(1);
    ExpressionStatement on_false = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(eq(deref(add(id(p), id(i))), lit(0)),
                        block(on_true), block(on_false))), i));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_true, p));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_false, p));

    setUp();
    on_true = setA(1);
    bwa = analyze(proc("f", block(declP(),
        new IfStatement(ne(lit(0), index(id(p), id(i))), block(on_true))), i));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_true, p));

    setUp();
    on_true = setA(1);
    bwa = analyze(proc("f", block(declP(),
        new IfStatement(ne(rvalue(deref(add(id(p), id(i)))), chr('\0')),
                        block(on_true))), i));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_true, p));
  }

  @Test
  public void testLogicalNegation() {
    ExpressionStatement on_true = setA(1);
    ExpressionStatement on_false = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(not(index(id(p), id(i))), block(on_true), block(on_false))), i));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_true, p));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_false, p));

    setUp();
    on_true = setA(1);
    bwa = analyze(proc("f", block(declP(),
        new IfStatement(not(not(deref(add(id(p), id(i))))), block(on_true))), i));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_true, p));
  }

  @Test
  public void testDerefBelowUpperBoundDoesNotWiden() {
    ExpressionStatement inside = setA(1);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(deref(id(p)), block(inside))), i));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(inside, p));
  }

  @Test
  public void testNestedConditionsWidenTwice() {
    ExpressionStatement inner = setA(1);
    Expression outer_cond = deref(add(id(p), id(i)));
    Expression inner_cond = deref(add(add(id(p), id(i)), lit(1)));
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(outer_cond,
            block(new IfStatement(inner_cond, block(inner))))), i));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(outer_cond, p));
    assertEquals(Long.valueOf(1), offset(add(id(p), id(i)),
                 bwa.getStmtIn(inner_cond).get(p).getUpperExpr()));
    assertEquals(Long.valueOf(2), bwa.getWidenedOffset(inner, p));
  }

  @Test
  public void testModifiedBoundsVariableKillsWidening() {
    Expression cond = deref(add(id(p), id(i)));
    ExpressionStatement kill = stmt(assign(id(i), lit(0)));
    ExpressionStatement after_kill = setA(1);
    ExpressionStatement after_if = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(cond, block(kill, after_kill)), after_if), i));

    assertEquals(bwa.getStmtOut(cond).get(p), bwa.getStmtIn(kill).get(p));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(cond, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(kill, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(after_kill, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(after_if, p));
    assertTrue(bwa.getKill(bwa.getCFGraph().getBlockOf(kill)).contains(p));
  }

  @Test
  public void testLoopReachesFixedPoint() {
    Expression cond = deref(add(id(p), id(i)));
    ExpressionStatement body = setA(1);
    ExpressionStatement after = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new WhileLoop(cond, block(body)), after), i));

    assertEquals(add(id(p), id(i)), bwa.getStmtIn(cond).get(p).getUpperExpr());
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(body, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(after, p));
  }

  @Test
  public void testLoopAdvancingIndex() {
    Expression cond = deref(add(id(p), id(i)));
    ExpressionStatement check = setA(1);
    ExpressionStatement step = stmt(postInc(id(i)));
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new WhileLoop(cond, block(check, step))), i));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(check, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(step, p));
  }

  @Test
  public void testOutIsInMinusKillPlusGen() {
    Expression cond = deref(add(id(p), id(i)));
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(cond, block(stmt(assign(id(i), lit(0)))), block(setA(1))),
        new WhileLoop(index(id(p), id(i)), block(setA(2))),
        setA(3)), i));

    CFGraph cfg = bwa.getCFGraph();
    for (DFANode node : cfg.getOrderedBlocks()) {
      if (node == cfg.getExit()) {
        continue;
      }
      Map<Symbol, RangeBoundsExpression> expected =
          new LinkedHashMap<Symbol, RangeBoundsExpression>(bwa.getIn(node));
      expected.keySet().removeAll(bwa.getKill(node));
      expected.putAll(bwa.getGen(node));
      assertEquals(CFGraph.getBlockName(node), expected, bwa.getOut(node));
    }
  }

  @Test
  public void testSwitchWithNullCase() {
    Expression cond = deref(id(p));
    ExpressionStatement on_a = setA(1);
    ExpressionStatement on_null = setA(2);
    ExpressionStatement on_default = setA(3);
    ExpressionStatement after = setA(4);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(
        new SwitchStatement(cond, block(
            new Case(chr('a')), on_a, new BreakStatement(),
            new Case(chr('\0')), on_null, new BreakStatement(),
            new Default(), on_default)),
        after), p));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_a, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_null, p));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_default, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(after, p));
  }

  @Test
  public void testSwitchWithoutNullCase() {
    ExpressionStatement on_a = setA(1);
    ExpressionStatement on_default = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(
        new SwitchStatement(deref(id(p)), block(
            new Case(chr('a')), on_a, new BreakStatement(),
            new Default(), on_default))), p));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_a, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_default, p));
  }

  @Test
  public void testFallthroughIntoNullCase() {
    ExpressionStatement on_a = setA(1);
    ExpressionStatement on_null = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(
        new SwitchStatement(deref(id(p)), block(
            new Case(chr('a')), on_a,
            new Case(chr('\0')), on_null, new BreakStatement()))), p));

    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(on_a, p));
    // Reached from the null label, so the widening from 'a' does not survive the join.
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_null, p));
  }

  @Test
  public void testLogicalAndWidensThroughBothOperands() {
    ExpressionStatement on_true = setA(1);
    ExpressionStatement on_false = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(
        new IfStatement(and(deref(id(p)), deref(add(id(p), lit(1)))),
                        block(on_true), block(on_false))), p));

    assertEquals(Long.valueOf(2), bwa.getWidenedOffset(on_true, p));
    assertEquals(Long.valueOf(0), bwa.getWidenedOffset(on_false, p));
  }

  @Test
  public void testWhereClauseRedefinesBounds() {
    // x = strlen(p) _Where p : bounds(p, p + x);
    ExpressionStatement where_stmt = stmt(assign(id(x), call(intVar("strlen"), id(p))));
    WhereClause where = new WhereClause();
    where.addBoundsFact(p, new RangeBoundsExpression(id(p), add(id(p), id(x))));
    where_stmt.setWhereClause(where);
    ExpressionStatement inside = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(where_stmt,
        new IfStatement(deref(add(id(p), id(x))), block(inside))), p, x));

    assertEquals(add(id(p), id(x)), bwa.getStmtOut(where_stmt).get(p).getUpperExpr());
    // The where-clause bounds are not comparable to the declared count(0).
    assertNull(bwa.getWidenedOffset(where_stmt, p));
    assertEquals(Long.valueOf(1), offset(add(id(p), id(x)),
                 bwa.getStmtIn(inside).get(p).getUpperExpr()));
  }

  @Test
  public void testParametersAreSeededWithDeclaredBounds() {
    withCount(p, id(n));
    ExpressionStatement first = setA(1);
    ExpressionStatement inside = setA(2);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(first,
        new IfStatement(deref(add(id(p), id(n))), block(inside))), p, n));

    assertEquals(new RangeBoundsExpression(id(p), add(id(p), id(n))),
                 bwa.getStmtIn(first).get(p));
    assertEquals(bwa.getStmtIn(first), bwa.getIn(bwa.getCFGraph().getEntry()));
    assertEquals(Long.valueOf(1), bwa.getWidenedOffset(inside, p));
  }

  @Test
  public void testPointerBeforeDeclarationHasNoFacts() {
    ExpressionStatement before = setA(1);
    DeclarationStatement d = declP();
    BoundsWideningAnalysis bwa = analyze(proc("f", block(before, d), i));
    assertFalse(bwa.getStmtIn(before).containsKey(p));
    assertTrue(bwa.getStmtOut(d).containsKey(p));
  }

  @Test
  public void testUnknownStatementHasNoFacts() {
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP()), i));
    assertTrue(bwa.getStmtIn(setA(1)).isEmpty());
    assertTrue(bwa.getStmtOut(setA(1)).isEmpty());
    assertNull(bwa.getWidenedOffset(setA(1), p));
  }

  @Test
  public void testRerunGivesSameResult() {
    ExpressionStatement inside = setA(1);
    BoundsWideningAnalysis bwa = analyze(proc("f", block(declP(),
        new IfStatement(deref(add(id(p), id(i))), block(inside))), i));
    Map<Symbol, RangeBoundsExpression> first = bwa.getStmtOut(inside);
    bwa.widenBounds();
    assertEquals(first, bwa.getStmtOut(inside));
  }
}

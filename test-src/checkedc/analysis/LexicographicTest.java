package checkedc.analysis;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import org.junit.Test;

import checkedc.hir.CastKind;
import checkedc.hir.Expression;
import checkedc.hir.Identifier;
import checkedc.hir.ImplicitCastExpression;
import checkedc.hir.VariableDeclarator;

public class LexicographicTest {

  private final Lexicographic lex = new Lexicographic();

  @Test
  public void testConstantsComeFirst() {
    VariableDeclarator a = intVar("a");
    assertTrue(lex.compareExpr(lit(100), id(a)) < 0);
    assertTrue(lex.compareExpr(id(a), lit(-5)) > 0);
    assertTrue(lex.compareExpr(lit(1), lit(2)) < 0);
    assertEquals(0, lex.compareExpr(lit(97), chr('a')));
  }

  @Test
  public void testDeclarations() {
    VariableDeclarator a = intVar("a");
    VariableDeclarator b = intVar("b");
    VariableDeclarator other_a = intVar("a");
    assertTrue(lex.compareDecl(a, b) < 0);
    assertTrue(lex.compareDecl(b, a) > 0);
    assertEquals(0, lex.compareDecl(a, a));
    // Same name, declared later.
    assertTrue(lex.compareDecl(a, other_a) < 0);
    assertEquals(0, lex.compareExpr(id(a), id(a)));
  }

  @Test
  public void testStructuralComparison() {
    VariableDeclarator a = intVar("a");
    VariableDeclarator b = intVar("b");
    assertEquals(0, lex.compareExpr(add(id(a), id(b)), add(id(a), id(b))));
    assertTrue(lex.compareExpr(add(id(a), id(b)), add(id(b), id(a))) < 0);
    assertTrue(lex.compareExpr(add(id(a), id(b)), mul(id(a), id(b))) != 0);
  }

  @Test
  public void testValuePreservingCasts() {
    VariableDeclarator a = intVar("a");
    Expression e = id(a);
    assertSame(e, Lexicographic.ignoreValuePreservingCasts(rvalue(e)));
    Expression widened = new ImplicitCastExpression(CastKind.INTEGRAL_CAST,
                                                    rvalue(id(a)));
    assertSame(widened, Lexicographic.ignoreValuePreservingCasts(widened));
    assertTrue(Lexicographic.ignoreCasts(widened) instanceof Identifier);
    assertEquals(0, lex.compareExpr(rvalue(id(a)), id(a)));
  }
}

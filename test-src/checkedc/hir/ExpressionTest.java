package checkedc.hir;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

public class ExpressionTest {

  private final VariableDeclarator p = ntPtr("p");
  private final VariableDeclarator i = intVar("i");

  @Test
  public void testParenthesesDoNotAffectEqualityOrHash() {
    BinaryExpression inner = add(id(p), id(i));
    Expression plain = add(inner, lit(1));
    Expression bare = plain.clone();
    ((BinaryExpression)bare).getLHS().setParens(false);

    assertFalse(plain.toString().equals(bare.toString()));
    assertEquals(plain, bare);
    assertEquals(plain.hashCode(), bare.hashCode());

    Set<Expression> seen = new HashSet<Expression>();
    seen.add(plain);
    assertTrue(seen.contains(bare));
  }

  @Test
  public void testOperatorTakesPartInEquality() {
    assertFalse(add(id(p), id(i)).equals(sub(id(p), id(i))));
    assertFalse(deref(id(p)).equals(not(id(p))));
    assertEquals(deref(id(p)).hashCode(), deref(id(p)).hashCode());
  }

  @Test
  public void testCloneHasNoParent() {
    Expression e = add(id(p), lit(2));
    Expression sum = add(e, lit(1));
    Expression copy = e.clone();
    assertSame(sum, e.getParent());
    assertNull(copy.getParent());
    assertEquals(e, copy);
  }
}

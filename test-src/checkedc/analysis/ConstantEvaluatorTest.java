package checkedc.analysis;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import org.junit.Test;

import checkedc.hir.BinaryExpression;
import checkedc.hir.BinaryOperator;
import checkedc.hir.CastKind;
import checkedc.hir.ImplicitCastExpression;
import checkedc.hir.VariableDeclarator;

public class ConstantEvaluatorTest {

  @Test
  public void testArithmetic() {
    assertEquals(Long.valueOf(5), ConstantEvaluator.evaluate(add(lit(2), lit(3))));
    assertEquals(Long.valueOf(-1), ConstantEvaluator.evaluate(sub(lit(2), lit(3))));
    assertEquals(Long.valueOf(42), ConstantEvaluator.evaluate(mul(lit(6), lit(7))));
    assertEquals(Long.valueOf(3), ConstantEvaluator.evaluate(div(lit(7), lit(2))));
    assertEquals(Long.valueOf(-4), ConstantEvaluator.evaluate(neg(lit(4))));
  }

  @Test
  public void testOverflowIsNotConstant() {
    assertNull(ConstantEvaluator.evaluate(add(lit(Integer.MAX_VALUE), lit(1))));
    assertNull(ConstantEvaluator.evaluate(sub(lit(Integer.MIN_VALUE), lit(1))));
    assertNull(ConstantEvaluator.evaluate(mul(lit(65536), lit(65536))));
    assertNull(ConstantEvaluator.evaluate(neg(lit(Integer.MIN_VALUE))));
    assertNull(ConstantEvaluator.evaluate(lit(1L << 40)));
  }

  @Test
  public void testDivisionByZero() {
    assertNull(ConstantEvaluator.evaluate(div(lit(1), lit(0))));
    assertNull(ConstantEvaluator.evaluate(div(lit(Integer.MIN_VALUE), lit(-1))));
    assertNull(ConstantEvaluator.evaluate(
        new BinaryExpression(lit(5), BinaryOperator.MODULUS, lit(0))));
  }

  @Test
  public void testCharactersAndCasts() {
    assertEquals(Long.valueOf('a'), ConstantEvaluator.evaluate(chr('a')));
    assertTrue(ConstantEvaluator.isZero(chr('\0')));
    assertTrue(ConstantEvaluator.isZero(
        new ImplicitCastExpression(CastKind.INTEGRAL_CAST, lit(0))));
    assertFalse(ConstantEvaluator.isZero(lit(1)));
  }

  @Test
  public void testVariablesAreNotConstant() {
    VariableDeclarator x = intVar("x");
    assertNull(ConstantEvaluator.evaluate(id(x)));
    assertNull(ConstantEvaluator.evaluate(add(id(x), lit(1))));
    assertFalse(ConstantEvaluator.isIntegerConstant(assign(id(x), lit(1))));
  }

  @Test
  public void testCheckedOperations() {
    assertEquals(Long.valueOf(3), ConstantEvaluator.add(1, 2));
    assertNull(ConstantEvaluator.add(Integer.MAX_VALUE, 1));
    assertNull(ConstantEvaluator.subtract(0, Integer.MIN_VALUE));
    assertNull(ConstantEvaluator.multiply(Integer.MIN_VALUE, -1));
    assertTrue(ConstantEvaluator.fits(Integer.MIN_VALUE));
    assertFalse(ConstantEvaluator.fits(Integer.MAX_VALUE + 1L));
  }
}

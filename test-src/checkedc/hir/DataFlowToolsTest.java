package checkedc.hir;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import java.util.Set;

import org.junit.Test;

public class DataFlowToolsTest {

  private final VariableDeclarator p = ntPtr("p");
  private final VariableDeclarator i = intVar("i");
  private final VariableDeclarator j = intVar("j");
  private final VariableDeclarator s = intVar("s");
  private final VariableDeclarator f = intVar("f");

  @Test
  public void testAssignmentDefinesTarget() {
    Statement stmt = stmt(assign(id(i), add(id(j), lit(1))));
    Set<Symbol> defs = DataFlowTools.getDefSymbol(stmt);
    assertEquals(1, defs.size());
    assertTrue(defs.contains(i));
    assertTrue(DataFlowTools.getUseSymbol(stmt).contains(j));
  }

  @Test
  public void testIncrementAndAddressOfDefine() {
    assertTrue(DataFlowTools.getDefSymbol(stmt(postInc(id(i)))).contains(i));
    Set<Symbol> defs = DataFlowTools.getDefSymbol(stmt(assign(id(j), addressOf(id(i)))));
    assertTrue(defs.contains(i));
    assertTrue(defs.contains(j));
  }

  @Test
  public void testDeclarationDefinesVariable() {
    DeclarationStatement d = decl(withBounds(p, id(p), add(id(p), id(i))));
    assertEquals(1, DataFlowTools.getDefSymbol(d).size());
    assertTrue(DataFlowTools.getDefSymbol(d).contains(p));
  }

  @Test
  public void testWritesThroughPointersDefineNothing() {
    assertTrue(DataFlowTools.getDefSymbol(stmt(assign(deref(id(p)), lit(0)))).isEmpty());
    assertTrue(DataFlowTools.getDefSymbol(stmt(assign(arrow(id(p), f), lit(0)))).isEmpty());
    assertTrue(DataFlowTools.getDefSymbol(stmt(assign(dot(id(s), f), lit(0)))).contains(s));
    assertNull(DataFlowTools.getSymbolOf(index(id(p), id(i))));
    assertSame(i, DataFlowTools.getSymbolOf(rvalue(id(i))));
  }

  @Test
  public void testFieldNamesAreNotUses() {
    Set<Symbol> uses = DataFlowTools.getUseSymbol(stmt(assign(id(i), dot(id(s), f))));
    assertTrue(uses.contains(i));
    assertTrue(uses.contains(s));
    assertFalse(uses.contains(f));
  }

  @Test
  public void testNullInput() {
    assertTrue(DataFlowTools.getDefList(null).isEmpty());
    assertTrue(DataFlowTools.getDefSymbol(null).isEmpty());
    assertTrue(DataFlowTools.getUseSymbol(null).isEmpty());
  }
}

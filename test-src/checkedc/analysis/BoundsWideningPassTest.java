package checkedc.analysis;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import checkedc.exec.Driver;
import checkedc.hir.IfStatement;
import checkedc.hir.Procedure;
import checkedc.hir.Program;
import checkedc.hir.StringLiteral;
import checkedc.hir.VariableDeclarator;

public class BoundsWideningPassTest {

  private PrintStream saved_out;
  private ByteArrayOutputStream captured;

  @Before
  public void setUp() {
    Driver.registerOptions();
    saved_out = System.out;
    captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true));
  }

  @After
  public void tearDown() {
    System.setOut(saved_out);
    Driver.registerOptions();
  }

  // void f1(int i) {
  //   _Nt_array_ptr<char> p : bounds(p, p + i) = "a";
  //   if (*(i + p)) { a = 1; }
  // }
  private static Procedure f1() {
    VariableDeclarator i = intVar("i");
    VariableDeclarator p = ntPtr("p");
    VariableDeclarator a = intVar("a");
    return proc("f1", block(
        decl(withBounds(p, id(p), add(id(p), id(i))), new StringLiteral("a")),
        new IfStatement(deref(add(id(i), id(p))),
                        block(stmt(assign(id(a), lit(1)))))), i);
  }

  private static Procedure empty(String name) {
    return proc(name, block(stmt(assign(id(intVar("x")), lit(0)))));
  }

  private String[] lines() {
    return captured.toString().split("\\r?\\n");
  }

  private static int indexOf(String[] lines, String line) {
    for (int k = 0; k < lines.length; k++) {
      if (lines[k].equals(line)) {
        return k;
      }
    }
    return -1;
  }

  @Test
  public void testAnalyzesEveryProcedure() {
    Program program = new Program();
    Procedure first = f1();
    Procedure second = empty("g");
    program.addProcedure(first);
    program.addProcedure(second);

    BoundsWideningPass pass = new BoundsWideningPass(program);
    AnalysisPass.run(pass);

    assertEquals(2, pass.getAnalyses().size());
    assertNotNull(pass.getAnalysis(first));
    assertNotNull(pass.getAnalysis(second));
    assertSame(first, pass.getAnalyses().keySet().iterator().next());
    assertEquals("[BoundsWideningPass]", pass.getPassName());
    // Nothing is dumped without the option.
    assertEquals(-1, indexOf(lines(), "In function: f1"));
    assertEquals(0, indexOf(lines(), "[BoundsWideningPass] begin"));
  }

  @Test
  public void testSkippedProcedures() {
    Driver.setOptionValue("skip-procedures", "f1,h");
    Program program = new Program();
    Procedure first = f1();
    Procedure second = empty("g");
    program.addProcedure(first);
    program.addProcedure(second);

    BoundsWideningPass pass = new BoundsWideningPass(program);
    pass.start();
    assertNull(pass.getAnalysis(first));
    assertNotNull(pass.getAnalysis(second));
  }

  @Test
  public void testDumpOption() {
    Driver.setOptionValue("dump-widened-bounds", "1");
    Program program = new Program();
    program.addProcedure(f1());
    new BoundsWideningPass(program).start();

    String[] out = lines();
    int header = indexOf(out, "In function: f1");
    assertTrue(header > 0);
    assertEquals("--------------------------------------", out[header - 1]);
    int b3 = indexOf(out, "Block: B3, Pred: B4, Succ: B2, B1");
    assertTrue(b3 > header);
    assertEquals("  0: _Nt_array_ptr<char> p : bounds(p, p + i) = \"a\";", out[b3 + 1]);
    assertEquals("  1: *(i + p)", out[b3 + 2]);
    assertEquals("    upper_bound(p) = 1", out[b3 + 3]);
    int b2 = indexOf(out, "Block: B2, Pred: B3, Succ: B1");
    assertTrue(b2 > b3);
    assertEquals("  0: a = 1;", out[b2 + 1]);
    assertEquals("    upper_bound(p) = 1", out[b2 + 2]);
    int b1 = indexOf(out, "Block: B1, Pred: B3, B2, Succ: B0");
    assertTrue(b1 > b2);
    // Neither the entry nor the exit block is printed.
    assertEquals(-1, indexOf(out, "Block: B4, Pred: , Succ: B3"));
    assertEquals(b1, out.length - 1);
  }

  @Test
  public void testDumpToWriter() {
    Program program = new Program();
    Procedure proc = f1();
    program.addProcedure(proc);
    BoundsWideningPass pass = new BoundsWideningPass(program);
    pass.start();

    StringWriter sw = new StringWriter();
    pass.getAnalysis(proc).dumpWidenedBounds(new PrintWriter(sw));
    String text = sw.toString();
    assertTrue(text.contains("In function: f1"));
    assertTrue(text.contains("upper_bound(p) = 1"));
    assertFalse(text.contains("upper_bound(p) = 0"));
  }
}

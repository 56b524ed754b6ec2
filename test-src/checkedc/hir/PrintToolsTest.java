package checkedc.hir;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import checkedc.exec.Driver;

public class PrintToolsTest {

  private PrintStream saved_err;
  private ByteArrayOutputStream captured;

  @Before
  public void setUp() {
    Driver.registerOptions();
    saved_err = System.err;
    captured = new ByteArrayOutputStream();
    System.setErr(new PrintStream(captured, true));
  }

  @After
  public void tearDown() {
    System.setErr(saved_err);
    Driver.registerOptions();
  }

  @Test
  public void testStatusIsGatedByVerbosity() {
    Driver.setOptionValue("verbosity", "2");
    assertEquals(2, PrintTools.getVerbosity());
    PrintTools.printlnStatus("shown", 2);
    PrintTools.printlnStatus("hidden", 3);
    PrintTools.printlnStatus(1, "joined", Integer.valueOf(7));
    String out = captured.toString();
    assertTrue(out.contains("shown"));
    assertFalse(out.contains("hidden"));
    assertTrue(out.contains("joined 7"));
  }

  @Test
  public void testMalformedVerbosityCountsAsZero() {
    Driver.setOptionValue("verbosity", "loud");
    assertEquals(0, PrintTools.getVerbosity());
    PrintTools.printlnStatus("warning", 0);
    PrintTools.printlnStatus("detail", 1);
    String out = captured.toString();
    assertTrue(out.contains("warning"));
    assertFalse(out.contains("detail"));
  }

  @Test
  public void testCollectionToString() {
    assertEquals("a, b", PrintTools.collectionToString(Arrays.asList("a", "b"), ", "));
    assertEquals("", PrintTools.collectionToString(null, ", "));
  }
}

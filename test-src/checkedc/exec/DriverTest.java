package checkedc.exec;

import static checkedc.hir.IRBuilder.*;
import static org.junit.Assert.*;

import java.util.Set;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import checkedc.hir.Procedure;
import checkedc.hir.Program;

public class DriverTest {

  @Before
  public void setUp() {
    Driver.registerOptions();
  }

  @After
  public void tearDown() {
    Driver.registerOptions();
  }

  private static Program program(String... names) {
    Program ret = new Program();
    for (String name : names) {
      ret.addProcedure(proc(name, block(stmt(assign(id(intVar("x")), lit(0))))));
    }
    return ret;
  }

  @Test
  public void testDefaults() {
    assertEquals("0", Driver.getOptionValue("verbosity"));
    assertNull(Driver.getOptionValue("dump-widened-bounds"));
    assertNull(Driver.getOptionValue("no-such-option"));
    assertTrue(Driver.getSkipProcedureSet().isEmpty());
  }

  @Test
  public void testParseFlagsAndValues() {
    Driver driver = new Driver();
    driver.parseCommandLine(new String[] {
        "-dump-preorder-ast", "-verbosity=2", "-skip-procedures=f,g", "-bogus", "stray"});
    assertEquals("1", Driver.getOptionValue("dump-preorder-ast"));
    assertEquals("2", Driver.getOptionValue("verbosity"));
    assertNull(Driver.getOptionValue("bogus"));
    Set<String> skip = Driver.getSkipProcedureSet();
    assertEquals(2, skip.size());
    assertTrue(skip.contains("f"));
    assertTrue(skip.contains("g"));
  }

  @Test
  public void testRegisterRestoresDefaults() {
    Driver.setOptionValue("verbosity", "3");
    Driver.setOptionValue("dump-widened-bounds", "1");
    Driver.registerOptions();
    assertEquals("0", Driver.getOptionValue("verbosity"));
    assertNull(Driver.getOptionValue("dump-widened-bounds"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVerbosityMustBeNumber() {
    new Driver().parseCommandLine(new String[] {"-verbosity=loud"});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVerbosityRange() {
    new Driver().parseCommandLine(new String[] {"-verbosity=5"});
  }

  @Test
  public void testRunAnalyzesProgram() {
    Program program = program("f", "g");
    Driver driver = new Driver();
    assertNull(driver.getWideningPass());
    driver.run(new String[] {"-skip-procedures=g"}, program);

    assertNotNull(driver.getWideningPass());
    Procedure f = program.getProcedures().get(0);
    Procedure g = program.getProcedures().get(1);
    assertNotNull(driver.getWideningPass().getAnalysis(f));
    assertNull(driver.getWideningPass().getAnalysis(g));
  }

  @Test
  public void testHelpRunsNoPass() {
    Driver driver = new Driver();
    driver.run(new String[] {"-help"}, program("f"));
    assertNull(driver.getWideningPass());
    assertTrue(Driver.getUsage().contains("dump-widened-bounds"));
  }
}

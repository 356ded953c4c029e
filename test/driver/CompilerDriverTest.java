package driver;

import static org.junit.Assert.*;

import exception.CompileException;
import ir.IRModule;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import pass.PassManager;

public class CompilerDriverTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Before
  public void setUp() {
    Config.reset();
    IRModule.reset();
    PassManager.resetInstance();
    CompilerDriver.resetInstance();
  }

  @After
  public void tearDown() {
    Config.reset();
    PassManager.resetInstance();
  }

  private File fixture(String name) throws Exception {
    File file = tmp.newFile(name);
    try (InputStream in = getClass().getClassLoader().getResourceAsStream("ir/" + name)) {
      assertNotNull(name, in);
      Files.write(file.toPath(), in.readAllBytes());
    }
    return file;
  }

  @Test
  public void testFlagsSetConfig() {
    CompilerDriver driver = CompilerDriver.getInstance();
    driver.parseArgs(new String[] {"in.ll", "-o", "out.ll", "-declare-primitives", "-dump-regions", "-verify"});

    assertEquals("in.ll", driver.getSource());
    assertEquals("out.ll", driver.getTarget());
    Config config = Config.getInstance();
    assertTrue(config.declarePrimitives);
    assertTrue(config.dumpRegions);
    assertTrue(config.verifyAfterPasses);
  }

  @Test
  public void testDefaultsWithoutFlags() {
    CompilerDriver driver = CompilerDriver.getInstance();
    driver.parseArgs(new String[] {"in.ll"});

    assertNull(driver.getTarget());
    assertFalse(Config.getInstance().declarePrimitives);
    assertFalse(Config.getInstance().dumpRegions);
  }

  @Test(expected = CompileException.class)
  public void testNoArgs() {
    CompilerDriver.getInstance().parseArgs(new String[0]);
  }

  @Test(expected = CompileException.class)
  public void testMissingOutputName() {
    CompilerDriver.getInstance().parseArgs(new String[] {"in.ll", "-o"});
  }

  @Test(expected = CompileException.class)
  public void testUnknownOption() {
    CompilerDriver.getInstance().parseArgs(new String[] {"in.ll", "-O2"});
  }

  @Test(expected = CompileException.class)
  public void testSecondSourceRejected() {
    CompilerDriver.getInstance().parseArgs(new String[] {"a.ll", "b.ll"});
  }

  @Test(expected = CompileException.class)
  public void testNoSource() {
    CompilerDriver.getInstance().parseArgs(new String[] {"-verify"});
  }

  @Test
  public void testRunWritesOutput() throws Exception {
    File in = fixture("diamond_merge.ll");
    File out = new File(tmp.getRoot(), "out.ll");
    CompilerDriver driver = CompilerDriver.getInstance();
    driver.parseArgs(new String[] {in.getPath(), "-o", out.getPath(), "-verify"});
    driver.run();

    assertTrue(out.exists());
    String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
    assertTrue(text, text.contains("define i16 @d0(i8* %in, i8* %out)"));
    assertTrue(text, text.contains("@invoke_remote"));
  }

  @Test
  public void testRunReportsParseFailure() throws Exception {
    File in = tmp.newFile("broken.ll");
    Files.write(in.toPath(), "define void @f() {\n".getBytes(StandardCharsets.UTF_8));
    CompilerDriver driver = CompilerDriver.getInstance();
    driver.parseArgs(new String[] {in.getPath()});
    try {
      driver.run();
      fail("expected a parse failure");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("failed to parse"));
    }
  }

  @Test(expected = CompileException.class)
  public void testRunMissingFile() {
    CompilerDriver driver = CompilerDriver.getInstance();
    driver.parseArgs(new String[] {new File(tmp.getRoot(), "absent.ll").getPath()});
    driver.run();
  }
}

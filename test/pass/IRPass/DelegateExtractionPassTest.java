package pass.IRPass;

import static ir.IRTestUtils.function;
import static ir.IRTestUtils.inst;
import static ir.IRTestUtils.instructions;
import static org.junit.Assert.*;

import driver.Config;
import exception.CompileException;
import ir.IRModule;
import ir.RemotePrimitive;
import ir.value.Function;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import pass.IRPass.delegate.ExtractionContext;
import pass.PassManager;
import util.llvm.IRLoader;

public class DelegateExtractionPassTest {

  private final PrintStream originalOut = System.out;

  @Before
  public void setUp() {
    Config.reset();
    IRModule.reset();
    PassManager.resetInstance();
  }

  @After
  public void tearDown() {
    System.setOut(originalOut);
    Config.reset();
  }

  private DelegateExtractionPass run(String resource) throws Exception {
    IRLoader.loadFromResource("ir/" + resource);
    DelegateExtractionPass pass = new DelegateExtractionPass();
    pass.run();
    return pass;
  }

  private static int countLoads(Function f) {
    int n = 0;
    for (Instruction inst : instructions(f)) {
      if (inst instanceof LoadInst) {
        n++;
      }
    }
    return n;
  }

  @Test
  public void testSingleRemoteLoad() throws Exception {
    DelegateExtractionPass pass = run("single_remote_load.ll");

    assertEquals(1, pass.getContext().getRegions().size());
    assertNotNull(IRModule.getModule().getFunction("d0"));
    assertEquals(0, countLoads(function("task")));
    new VerifyIRPass().run();
  }

  @Test
  public void testDiamondGivesTwoDelegates() throws Exception {
    run("diamond_merge.ll");

    IRModule module = IRModule.getModule();
    assertNotNull(module.getFunction("d0"));
    assertNotNull(module.getFunction("d1"));
    assertNull(module.getFunction("d2"));
    new VerifyIRPass().run();
  }

  @Test
  public void testTwoTargetsExtractedIndependently() throws Exception {
    DelegateExtractionPass pass = run("two_targets.ll");

    ExtractionContext ctx = pass.getContext();
    assertEquals(2, ctx.getRegions().size());
    assertSame(IRModule.getModule().getGlobalVariable("a"), ctx.getRegions().get(0).getTarget());
    assertSame(IRModule.getModule().getGlobalVariable("b"), ctx.getRegions().get(1).getTarget());
    assertNotNull(IRModule.getModule().getFunction("d1"));
    new VerifyIRPass().run();
  }

  @Test
  public void testLoopRegion() throws Exception {
    run("loop_region.ll");

    assertNotNull(IRModule.getModule().getFunction("d0"));
    // 调用块里只剩两个输出的回读
    assertEquals(2, countLoads(function("task")));
    new VerifyIRPass().run();
  }

  @Test
  public void testCalleesOfTasksAreProcessed() throws Exception {
    DelegateExtractionPass pass = run("call_graph.ll");

    assertEquals(1, pass.getContext().getRegions().size());
    assertEquals(0, countLoads(function("helper")));
    // 没有被任务函数调用到的函数保持原样
    assertEquals(1, countLoads(function("unused")));
    new VerifyIRPass().run();
  }

  @Test
  public void testCalleeInsideExtractedRegionIsProcessed() throws Exception {
    DelegateExtractionPass pass = run("callee_in_region.ll");

    ExtractionContext ctx = pass.getContext();
    assertEquals(2, ctx.getRegions().size());
    assertSame(IRModule.getModule().getGlobalVariable("other"), ctx.getRegions().get(1).getTarget());
    // 调用 @helper 已经搬进 d0
    assertTrue(IRModule.getModule().getFunction("d0").getCallees().contains(function("helper")));
    assertEquals(0, countLoads(function("helper")));
    new VerifyIRPass().run();
  }

  @Test
  public void testMissingPrimitivesDisableExtraction() throws Exception {
    DelegateExtractionPass pass = run("no_primitives.ll");

    assertEquals(1, pass.getContext().getRegions().size());
    assertNull(IRModule.getModule().getFunction("d0"));
    assertFalse(IRModule.getModule().hasPrimitive(RemotePrimitive.INVOKE_REMOTE));
    assertEquals(1, countLoads(function("task")));
  }

  @Test
  public void testDeclarePrimitivesEnablesExtraction() throws Exception {
    Config.getInstance().declarePrimitives = true;
    run("no_primitives.ll");

    IRModule module = IRModule.getModule();
    assertTrue(module.hasPrimitive(RemotePrimitive.RESOLVE_LOCATION));
    assertTrue(module.hasPrimitive(RemotePrimitive.INVOKE_REMOTE));
    assertNotNull(module.getFunction("d0"));
    new VerifyIRPass().run();
  }

  @Test
  public void testAnalysisOnlyKeepsModuleUnchanged() throws Exception {
    Config.getInstance().extractEnabled = false;
    DelegateExtractionPass pass = run("diamond_merge.ll");

    assertEquals(2, pass.getContext().getRegions().size());
    assertNull(IRModule.getModule().getFunction("d0"));
    assertEquals(2, countLoads(function("task")));
  }

  @Test
  public void testStackAnchorsAreReservedOnly() throws Exception {
    DelegateExtractionPass pass = run("provenance.ll");

    ExtractionContext ctx = pass.getContext();
    Function walk = function("walk");
    assertEquals(2, ctx.getStackAnchors().size());
    assertSame(inst(walk, "v5"), ctx.getStackAnchors().get(0));
    assertEquals(3, ctx.getRegions().size());
  }

  @Test
  public void testDumpRegionsPrintsHeaders() throws Exception {
    Config.getInstance().dumpRegions = true;
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    run("diamond_merge.ll");
    System.setOut(originalOut);

    String dump = captured.toString(StandardCharsets.UTF_8);
    assertTrue(dump, dump.contains("Candidate 0:"));
    assertTrue(dump, dump.contains("Candidate 1:"));
    assertTrue(dump, dump.contains("blocks: entry, left"));
  }

  @Test(expected = CompileException.class)
  public void testAmbiguousMergeAbortsPass() throws Exception {
    run("ambiguous_merge.ll");
  }

  @Test
  public void testExtractedModuleReloads() throws Exception {
    run("diamond_merge.ll");
    String printed = IRModule.getModule().toIR();

    IRModule reloaded = IRLoader.loadFromString(printed, "reloaded");
    assertNotNull(reloaded.getFunction("d0"));
    assertNotNull(reloaded.getFunction("d1"));
    new VerifyIRPass().run();
    assertEquals(printed.substring(printed.indexOf('\n')), reloaded.toIR().substring(reloaded.toIR().indexOf('\n')));
  }
}

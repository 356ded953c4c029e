package pass.IRPass.delegate;

import static ir.IRTestUtils.block;
import static ir.IRTestUtils.blockNames;
import static ir.IRTestUtils.function;
import static ir.IRTestUtils.inst;
import static ir.IRTestUtils.instructions;
import static org.junit.Assert.*;

import driver.Config;
import exception.CompileException;
import ir.IRModule;
import ir.RemotePrimitive;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.constants.ConstantInt;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.Phi;
import ir.value.instructions.StoreInst;
import ir.value.instructions.SwitchInst;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import pass.IRPass.VerifyIRPass;
import pass.IRPass.analysis.CFGAnalysisPass;
import util.llvm.IRLoader;

public class DelegateExtractorTest {

  private ExtractionContext ctx;

  @Before
  public void setUp() {
    Config.reset();
    IRModule.reset();
    ctx = new ExtractionContext();
  }

  private Function load(String resource) throws Exception {
    IRLoader.loadFromResource("ir/" + resource);
    Function task = function("task");
    new CFGAnalysisPass().runOnFunction(task);
    return task;
  }

  private CandidateRegion grow(Instruction anchor) {
    CandidateRegion region = ctx.newRegion(anchor, ctx.getProvenance().getProvenance(anchor));
    RegionBuilder builder = new RegionBuilder(ctx, region);
    builder.expand();
    builder.checkVisit();
    return region;
  }

  private static boolean hasStore(BasicBlock bb) {
    for (var node : bb.getInstructions()) {
      if (node.getVal() instanceof StoreInst) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testSingleLoadBecomesOneBlockDelegate() throws Exception {
    Function task = load("single_remote_load.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "v"))).extract();

    assertEquals("d0", d0.getName());
    assertEquals(RemotePrimitive.delegateType(), d0.getFunctionType());
    assertEquals(List.of("d0.entry", "entry", "d0.exit0", "d0.ret"), blockNames(d0));
    // 没有输入时入口块只有两次缓冲区转换和跳转
    assertEquals(3, block(d0, "d0.entry").getInstructions().getNumNode());

    assertEquals(List.of("d0.call", "d0.exit"), blockNames(task));
    SwitchInst sw = (SwitchInst) block(task, "d0.call").getTerminatorInst();
    assertEquals(1, sw.getNumCases());
    assertEquals(0, sw.getCaseValue(0).getValue());
    assertSame(block(task, "d0.exit"), sw.getCaseBlock(0));
    assertSame(block(task, "d0.exit"), sw.getDefaultBlock());

    for (Instruction inst : instructions(task)) {
      assertFalse(inst.toIR(), inst instanceof LoadInst);
    }
    new VerifyIRPass().run();
  }

  @Test
  public void testInvokeCarriesDelegateAndBufferSizes() throws Exception {
    Function task = load("diamond_merge.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "a"))).extract();

    CallInst invoke = (CallInst) inst(task, "d0.code");
    assertSame(IRModule.getModule().getPrimitive(RemotePrimitive.INVOKE_REMOTE), invoke.getCalledFunction());
    assertSame(inst(task, "d0.loc"), invoke.getArg(0));
    assertSame(d0, invoke.getArg(1));
    // in = { i1 %c }, out = { i32 %b }
    assertEquals(1, ((ConstantInt) invoke.getArg(3)).getValue());
    assertEquals(4, ((ConstantInt) invoke.getArg(5)).getValue());

    CallInst resolve = (CallInst) inst(task, "d0.loc");
    assertSame(IRModule.getModule().getPrimitive(RemotePrimitive.RESOLVE_LOCATION), resolve.getCalledFunction());
  }

  @Test
  public void testExitCodesMatchSwitchCases() throws Exception {
    Function task = load("diamond_merge.ll");
    BasicBlock right = block(task, "right");
    BasicBlock merge = block(task, "merge");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "a"))).extract();

    SwitchInst sw = (SwitchInst) block(task, "d0.call").getTerminatorInst();
    assertEquals(2, sw.getNumCases());
    assertSame(right, sw.getCaseBlock(0));
    assertSame(merge, sw.getCaseBlock(1));

    Phi code = (Phi) inst(block(d0, "d0.ret"), 0);
    assertEquals(2, code.getNumIncoming());
    for (int k = 0; k < 2; k++) {
      assertEquals(k, ((ConstantInt) code.getIncomingValue(k)).getValue());
      assertEquals("d0.exit" + k, code.getIncomingBlock(k).getName());
    }
  }

  @Test
  public void testOutputWrittenOnlyWhereItDominates() throws Exception {
    Function task = load("diamond_merge.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "a"))).extract();

    // %b 定义在 left，只能经 left 到达出口 1
    assertFalse(hasStore(block(d0, "d0.exit0")));
    assertTrue(hasStore(block(d0, "d0.exit1")));

    Phi r = (Phi) inst(block(task, "merge"), 0);
    for (int i = 0; i < r.getNumIncoming(); i++) {
      if (r.getIncomingBlock(i) == block(task, "d0.call")) {
        Instruction value = (Instruction) r.getIncomingValue(i);
        assertTrue(value instanceof LoadInst);
        assertSame(block(task, "d0.call"), value.getParent());
        return;
      }
    }
    fail("merge phi has no incoming from the call block");
  }

  @Test
  public void testInputsLoadedInDelegateEntry() throws Exception {
    Function task = load("diamond_merge.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "a"))).extract();

    BasicBlock entry = block(d0, "d0.entry");
    // inbuf, outbuf, in.0, %c, br
    assertEquals(5, entry.getInstructions().getNumNode());
    Instruction c = inst(entry, 3);
    assertTrue(c instanceof LoadInst);
    assertEquals("c", c.getName());
    // 条件分支用的是载入的输入，不是调用者的形参
    Instruction br = block(d0, "entry").getTerminatorInst();
    assertSame(c, br.getOperand(0));
  }

  @Test
  public void testSecondRegionRewiresFirstDispatch() throws Exception {
    Function task = load("diamond_merge.ll");
    CandidateRegion first = grow(inst(task, "a"));
    CandidateRegion second = grow(inst(task, "o"));
    new DelegateExtractor(ctx, first).extract();
    Function d1 = new DelegateExtractor(ctx, second).extract();

    assertEquals("d1", d1.getName());
    SwitchInst sw = (SwitchInst) block(task, "d0.call").getTerminatorInst();
    assertSame(block(task, "d1.call"), sw.getDefaultBlock());
    assertEquals(List.of("d0.call", "d1.call", "merge"), blockNames(task));
    new VerifyIRPass().run();
  }

  @Test
  public void testRegionWithLoopKeepsBackEdgeInside() throws Exception {
    Function task = load("spin_loop.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "v"))).extract();

    Instruction br = block(d0, "spin").getTerminatorInst();
    assertSame(block(d0, "spin"), br.getOperand(1));
    assertSame(block(task, "d0.call"), block(task, "entry").getTerminatorInst().getOperand(0));
    new VerifyIRPass().run();
  }

  @Test
  public void testLoopBodyExtractedWithInputsAndOutputs() throws Exception {
    Function task = load("loop_region.ll");
    Function d0 = new DelegateExtractor(ctx, grow(inst(task, "v"))).extract();

    // 输入 %i、%n，输出 %w、%next
    assertEquals(7, block(d0, "d0.entry").getInstructions().getNumNode());
    assertTrue(hasStore(block(d0, "d0.exit0")));
    assertTrue(hasStore(block(d0, "d0.exit1")));

    Phi i = (Phi) inst(task, "i");
    assertTrue(i.getParent().getPredecessors().contains(block(task, "d0.call")));
    new VerifyIRPass().run();
  }

  @Test
  public void testIntegrityRejectsOperandFromCaller() throws Exception {
    Function task = load("single_remote_load.ll");
    DelegateExtractor extractor = new DelegateExtractor(ctx, grow(inst(task, "v")));
    Function d0 = extractor.outline();

    Instruction load = inst(block(d0, "entry"), 0);
    assertTrue(load instanceof LoadInst);
    load.setOperand(0, inst(task, "d0.loc"));
    try {
      extractor.checkIntegrity(d0);
      fail("expected an escaped use");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Escaped use"));
    }
  }

  @Test
  public void testIntegrityRejectsBranchIntoCaller() throws Exception {
    Function task = load("single_remote_load.ll");
    DelegateExtractor extractor = new DelegateExtractor(ctx, grow(inst(task, "v")));
    Function d0 = extractor.outline();

    block(d0, "d0.exit0").getTerminatorInst().setOperand(0, block(task, "d0.exit"));
    try {
      extractor.checkIntegrity(d0);
      fail("expected an escaped block");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Escaped block"));
    }
  }

  @Test
  public void testExtractedInstructionsReleased() throws Exception {
    Function task = load("single_remote_load.ll");
    Instruction v = inst(task, "v");
    new DelegateExtractor(ctx, grow(v)).extract();

    assertFalse(ctx.isOwned(v));
  }
}

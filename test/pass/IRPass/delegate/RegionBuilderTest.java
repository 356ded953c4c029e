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
import ir.value.Function;
import ir.value.Value;
import ir.value.instructions.Instruction;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import pass.IRPass.analysis.CFGAnalysisPass;
import pass.IRPass.analysis.ProvenanceAnalysis;
import util.llvm.IRLoader;

public class RegionBuilderTest {

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

  private List<Instruction> owned(Function f, CandidateRegion region) {
    List<Instruction> result = new ArrayList<>();
    for (Instruction inst : instructions(f)) {
      if (ctx.getOwner(inst) == region) {
        result.add(inst);
      }
    }
    return result;
  }

  @Test
  public void testSingleLoadStopsBeforeRet() throws Exception {
    Function task = load("single_remote_load.ll");
    Instruction v = inst(task, "v");
    CandidateRegion region = grow(v);

    Instruction ret = task.getEntryBlock().getTerminatorInst();
    assertEquals(1, region.getExits().size());
    assertSame(v, region.getExits().get(ret));
    assertEquals(List.of("entry"), blockNames(region.getBlocks()));
    assertEquals(List.of(v), owned(task, region));
    assertFalse(ctx.isOwned(ret));
  }

  @Test
  public void testForeignArmIsExcludedAndMergeStaysPending() throws Exception {
    Function task = load("diamond_merge.ll");
    CandidateRegion region = grow(inst(task, "a"));

    Instruction o = inst(task, "o");
    Instruction r = inst(task, "r");
    assertEquals(List.of(o, r), new ArrayList<>(region.getExits().keySet()));
    assertSame(task.getEntryBlock().getTerminatorInst(), region.getExits().get(o));
    assertSame(block(task, "left").getTerminatorInst(), region.getExits().get(r));
    assertEquals(List.of("entry", "left"), blockNames(region.getBlocks()));
    assertFalse(ctx.isOwned(o));
    assertFalse(ctx.isOwned(r));
  }

  @Test
  public void testSecondRegionStartsAtForeignAnchor() throws Exception {
    Function task = load("diamond_merge.ll");
    CandidateRegion first = grow(inst(task, "a"));
    CandidateRegion second = grow(inst(task, "o"));

    assertSame(task.getParam(1), second.getTarget());
    assertEquals(List.of("right"), blockNames(second.getBlocks()));
    assertSame(block(task, "right").getTerminatorInst(), second.getExits().get(inst(task, "r")));
    // 已被第一个区域认领的指令对第二个区域不合法
    assertFalse(new RegionBuilder(ctx, second).isValid(inst(task, "a")));
    assertTrue(new RegionBuilder(ctx, first).isValid(inst(task, "b")));
  }

  @Test
  public void testMergeAbsorbedOnceAllArmsSealed() throws Exception {
    Function task = load("diamond_absorbed.ll");
    CandidateRegion region = grow(inst(task, "a"));

    assertEquals(List.of("entry", "left", "right", "merge"), blockNames(region.getBlocks()));
    assertEquals(1, region.getExits().size());
    Instruction ret = block(task, "merge").getTerminatorInst();
    assertTrue(region.getExits().containsKey(ret));
    assertTrue(ctx.isOwned(inst(task, "r")));
  }

  @Test
  public void testConflictingPendingExitsForgivenAfterAbsorb() throws Exception {
    Function task = load("three_way_merge.ll");
    CandidateRegion region = grow(inst(task, "a"));

    assertEquals(List.of("entry", "left", "mid", "right", "merge"), blockNames(region.getBlocks()));
    assertEquals(1, region.getExits().size());
  }

  @Test
  public void testAmbiguousMergeIsFatal() throws Exception {
    Function task = load("ambiguous_merge.ll");
    try {
      grow(inst(task, "a"));
      fail("expected an ambiguous merge");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Ambiguous merge"));
    }
  }

  @Test
  public void testDifferentTargetsGiveDisjointRegions() throws Exception {
    Function task = load("two_targets.ll");
    CandidateRegion first = grow(inst(task, "x"));
    CandidateRegion second = grow(inst(task, "y"));

    assertEquals(List.of(inst(task, "x")), owned(task, first));
    assertSame(inst(task, "x"), first.getExits().get(inst(task, "y")));

    List<Instruction> secondOwned = owned(task, second);
    assertEquals(3, secondOwned.size());
    assertTrue(secondOwned.contains(inst(task, "z")));
    for (Instruction inst : secondOwned) {
      assertFalse(owned(task, first).contains(inst));
    }
  }

  @Test
  public void testLoopHeaderPhiStaysPendingExit() throws Exception {
    Function task = load("loop_region.ll");
    CandidateRegion region = grow(inst(task, "v"));

    Instruction phi = inst(task, "i");
    Instruction ret = block(task, "exit").getTerminatorInst();
    assertEquals(2, region.getExits().size());
    assertTrue(region.getExits().containsKey(phi));
    assertTrue(region.getExits().containsKey(ret));
    assertFalse(ctx.isOwned(phi));
    assertTrue(ctx.isOwned(inst(task, "next")));
  }

  @Test
  public void testUnboundCallJoinsRegion() throws Exception {
    IRLoader.loadFromResource("ir/call_graph.ll");
    Function helper = function("helper");
    new CFGAnalysisPass().runOnFunction(helper);
    CandidateRegion region = grow(inst(helper, "v"));

    assertTrue(ctx.isOwned(inst(helper, "h")));
    assertEquals(1, region.getExits().size());
  }

  @Test
  public void testReadnoneCallJoinsRegionButPlainCallStops() throws Exception {
    Function task = load("readnone_call.ll");
    CandidateRegion region = grow(inst(task, "v"));

    assertTrue(ctx.isOwned(inst(task, "m")));
    Instruction store = inst(task.getEntryBlock(), 2);
    Instruction trace = inst(task.getEntryBlock(), 3);
    assertTrue(ctx.isOwned(store));
    assertFalse(ctx.isOwned(trace));
    assertEquals(1, region.getExits().size());
    assertSame(store, region.getExits().get(trace));
  }

  @Test
  public void testNonZeroOffsetAddressBecomesTarget() throws Exception {
    IRLoader.loadFromResource("ir/provenance.ll");
    Function walk = function("walk");
    new CFGAnalysisPass().runOnFunction(walk);
    CandidateRegion region = grow(inst(walk, "v1"));

    Instruction off = inst(walk, "off");
    assertSame(off, region.getTarget());
    assertTrue(region.getValidPtrs().contains(off));
    assertFalse(ctx.isOwned(off));
    // %p 上的访存不属于 %off 的区域
    Instruction v2 = inst(walk, "v2");
    assertFalse(ctx.isOwned(v2));
    assertSame(inst(walk, "zero"), region.getExits().get(v2));
  }

  @Test
  public void testSecondOwnerIsRejected() throws Exception {
    Function task = load("single_remote_load.ll");
    Instruction v = inst(task, "v");
    CandidateRegion region = grow(v);
    CandidateRegion other = ctx.newRegion(v, region.getTarget());

    ctx.claim(v, region);
    try {
      ctx.claim(v, other);
      fail("expected a double owner");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Double owner"));
    }
    assertSame(region, ctx.getOwner(v));
  }

  @Test
  public void testOwnedMemoryAccessesStayOnTarget() throws Exception {
    Function task = load("diamond_merge.ll");
    CandidateRegion region = grow(inst(task, "a"));

    for (Instruction inst : owned(task, region)) {
      Value base = ctx.getProvenance().getProvenance(inst);
      if (base != null) {
        assertTrue(inst.toIR(), region.getValidPtrs().contains(base)
            || ProvenanceAnalysis.classify(base).isLocationAgnostic());
      }
    }
  }

  @Test
  public void testVisitRejectsInstructionOwnedElsewhere() throws Exception {
    Function task = load("single_remote_load.ll");
    Instruction v = inst(task, "v");
    CandidateRegion region = grow(v);
    CandidateRegion other = ctx.newRegion(v, region.getTarget());
    ctx.release(v);
    ctx.claim(v, other);

    try {
      new RegionBuilder(ctx, region).checkVisit();
      fail("expected a bad visit");
    } catch (CompileException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Bad visit"));
    }
  }
}

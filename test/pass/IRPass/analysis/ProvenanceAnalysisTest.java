package pass.IRPass.analysis;

import static ir.IRTestUtils.block;
import static ir.IRTestUtils.function;
import static ir.IRTestUtils.inst;
import static org.junit.Assert.*;

import driver.Config;
import ir.IRModule;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.UndefValue;
import ir.value.Value;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantNull;
import ir.value.instructions.Instruction;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import pass.IRPass.delegate.ProvenanceKind;
import util.llvm.IRLoader;

public class ProvenanceAnalysisTest {

  private Function walk;
  private ProvenanceAnalysis provenance;

  @Before
  public void setUp() throws Exception {
    Config.reset();
    IRModule.reset();
    IRLoader.loadFromResource("ir/provenance.ll");
    walk = function("walk");
    provenance = new ProvenanceAnalysis();
  }

  @Test
  public void testNonZeroOffsetIntoRemoteIsFreshRoot() {
    Value base = provenance.getProvenance(inst(walk, "v1"));
    assertSame(inst(walk, "off"), base);
    assertEquals(ProvenanceKind.GLOBAL_REMOTE, ProvenanceAnalysis.classify(base));
  }

  @Test
  public void testZeroOffsetIntoRemoteIsTransparent() {
    assertSame(walk.getParam(0), provenance.getProvenance(inst(walk, "v2")));
  }

  @Test
  public void testConstantGEPIntoRemoteGlobal() {
    Value base = provenance.getProvenance(inst(walk, "v3"));
    assertSame(IRModule.getModule().getGlobalVariable("remote"), base);
    assertEquals(ProvenanceKind.GLOBAL_REMOTE, ProvenanceAnalysis.classify(base));
  }

  @Test
  public void testNonInboundsGEPStops() {
    Value base = provenance.getProvenance(inst(walk, "v4"));
    assertSame(inst(walk, "loose"), base);
    assertEquals(ProvenanceKind.UNKNOWN, ProvenanceAnalysis.classify(base));
  }

  @Test
  public void testIndexlessGEPIntoRemoteIsTransparent() {
    GlobalVariable remote = IRModule.getModule().getGlobalVariable("remote");
    ConstantExpr inBounds = ConstantExpr.getGEP(remote, List.of(), true);
    assertSame(remote, ProvenanceAnalysis.search(inBounds));

    ConstantExpr loose = ConstantExpr.getGEP(remote, List.of(), false);
    assertSame(loose, ProvenanceAnalysis.search(loose));
  }

  @Test
  public void testPointerCastsAreTransparent() {
    Value base = provenance.getProvenance(inst(walk, "v5"));
    assertSame(walk.getParam(1), base);
    assertEquals(ProvenanceKind.STACK, ProvenanceAnalysis.classify(base));
  }

  @Test
  public void testStoreUsesItsPointerOperand() {
    Instruction store = inst(block(walk, "entry"), 11);
    assertEquals("store", store.opCode().getKeyword());
    assertSame(inst(walk, "slot"), provenance.getProvenance(store));
  }

  @Test
  public void testClassificationOrder() {
    IRModule module = IRModule.getModule();
    // addrspace(100) 的全局量先按远程判定，不算静态
    assertEquals(ProvenanceKind.GLOBAL_REMOTE, ProvenanceAnalysis.classify(module.getGlobalVariable("remote")));
    assertEquals(ProvenanceKind.SYMMETRIC, ProvenanceAnalysis.classify(module.getGlobalVariable("sym")));
    assertEquals(ProvenanceKind.STATIC, ProvenanceAnalysis.classify(module.getGlobalVariable("local")));
    assertEquals(ProvenanceKind.STACK, ProvenanceAnalysis.classify(inst(walk, "slot")));
    assertEquals(ProvenanceKind.UNKNOWN, ProvenanceAnalysis.classify(inst(walk, "h")));
    assertEquals(ProvenanceKind.CONSTANT,
        ProvenanceAnalysis.classify(new ConstantNull(PointerType.get(IntegerType.getI32()))));
    assertEquals(ProvenanceKind.CONSTANT,
        ProvenanceAnalysis.classify(UndefValue.get(PointerType.get(IntegerType.getI32()))));
  }

  @Test
  public void testNonMemoryInstructionHasNoProvenance() {
    assertNull(provenance.getProvenance(inst(walk, "off")));
    assertFalse(provenance.hasProvenance(inst(walk, "raw")));
  }

  @Test
  public void testAnchorsInInstructionOrder() {
    List<Instruction> anchors = provenance.analyze(walk);
    Instruction store = inst(block(walk, "entry"), 11);
    assertEquals(List.of(inst(walk, "v1"), inst(walk, "v2"), inst(walk, "v3"), inst(walk, "v5"), store),
        anchors);
  }

  @Test
  public void testAnalysisIsIdempotent() {
    List<Instruction> first = provenance.analyze(walk);
    int cached = provenance.size();
    Value base = provenance.getProvenance(inst(walk, "v1"));

    assertEquals(first, provenance.analyze(walk));
    assertEquals(cached, provenance.size());
    assertSame(base, provenance.getProvenance(inst(walk, "v1")));
  }
}

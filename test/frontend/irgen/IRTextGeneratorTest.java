package frontend.irgen;

import static ir.IRTestUtils.block;
import static ir.IRTestUtils.function;
import static ir.IRTestUtils.inst;
import static org.junit.Assert.*;

import driver.Config;
import ir.IRModule;
import ir.type.PointerType;
import ir.value.Function;
import ir.value.FunctionAttribute;
import ir.value.GlobalVariable;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import org.junit.Before;
import org.junit.Test;
import pass.IRPass.VerifyIRPass;
import util.llvm.IRLoader;
import util.llvm.IRParseException;

public class IRTextGeneratorTest {

  private static final String HEADER =
      "@counter = addrspace(100) global i32 0, align 4\n"
          + "declare i32 @hash(i32) unbound readnone\n";

  @Before
  public void setUp() {
    Config.reset();
    IRModule.reset();
  }

  private static IRParseException parseError(String text) {
    try {
      IRLoader.loadFromString(text, "bad");
    } catch (IRParseException e) {
      return e;
    }
    throw new AssertionError("expected a parse error for:\n" + text);
  }

  @Test
  public void testGlobalsAndAttributes() throws Exception {
    IRLoader.loadFromResource("ir/call_graph.ll");
    IRModule module = IRModule.getModule();

    GlobalVariable counter = module.getGlobalVariable("counter");
    assertEquals(PointerType.GLOBAL_SPACE, counter.getType().getAddressSpace());
    assertTrue(function("task").hasAttribute(FunctionAttribute.ASYNC));
    assertTrue(function("hash").hasAttribute(FunctionAttribute.UNBOUND));
    assertTrue(function("hash").isDeclaration());
    assertFalse(function("helper").hasAttribute(FunctionAttribute.ASYNC));
    assertEquals("call_graph", module.getName());
  }

  @Test
  public void testForwardReferencesResolved() throws Exception {
    IRLoader.loadFromResource("ir/loop_region.ll");
    Function task = function("task");

    Phi i = (Phi) inst(task, "i");
    assertSame(inst(task, "next"), i.getIncomingValue(1));
    assertSame(block(task, "loop"), i.getIncomingBlock(1));
    assertTrue(block(task, "loop").getPredecessors().contains(block(task, "entry")));
    new VerifyIRPass().run();
  }

  @Test
  public void testPrintedModuleReparsesToSameText() throws Exception {
    IRLoader.loadFromResource("ir/provenance.ll");
    String first = IRModule.getModule().toIR();

    String second = IRLoader.loadFromString(first, "provenance").toIR();
    assertEquals(first, second);
  }

  @Test
  public void testCallsToLaterFunctions() throws Exception {
    IRLoader.loadFromString(HEADER
        + "define void @first() {\n"
        + "  call void @second()\n"
        + "  ret void\n"
        + "}\n"
        + "define void @second() {\n"
        + "  %v = load i32, i32 addrspace(100)* @counter\n"
        + "  %h = call i32 @hash(i32 %v)\n"
        + "  ret void\n"
        + "}\n", "calls");

    Function first = function("first");
    assertEquals("entry", first.getEntryBlock().getName());
    assertTrue(first.getCallees().contains(function("second")));
    Instruction h = inst(function("second"), "h");
    assertFalse(h.mayTouchMemory());
  }

  @Test
  public void testSyntaxErrorReportsPosition() {
    IRParseException e = parseError("define void @f() {\n  ret void\n");
    assertFalse(e.getErrors().isEmpty());
    assertEquals(3, e.getErrors().get(0).getLine());
  }

  @Test
  public void testUndefinedValue() {
    IRParseException e = parseError("define i32 @f() {\n"
        + "entry:\n"
        + "  %y = add i32 %x, 1\n"
        + "  ret i32 %y\n"
        + "}\n");
    assertTrue(e.getMessage(), e.getMessage().contains("%x"));
    assertEquals(3, e.getErrors().get(0).getLine());
  }

  @Test
  public void testUnknownFunction() {
    IRParseException e = parseError("define void @f() {\n  call void @nowhere()\n  ret void\n}\n");
    assertTrue(e.getMessage(), e.getMessage().contains("@nowhere"));
  }

  @Test
  public void testLoadTypeMismatch() {
    IRParseException e = parseError(HEADER
        + "define void @f() {\n"
        + "  %v = load i64, i32 addrspace(100)* @counter\n"
        + "  ret void\n"
        + "}\n");
    assertEquals(4, e.getErrors().get(0).getLine());
  }

  @Test
  public void testBlockWithoutTerminator() {
    IRParseException e = parseError(HEADER
        + "define void @f() {\n"
        + "entry:\n"
        + "  %v = load i32, i32 addrspace(100)* @counter\n"
        + "}\n");
    assertTrue(e.getMessage(), e.getMessage().contains("no terminator"));
  }

  @Test
  public void testRedefinedValue() {
    IRParseException e = parseError("define i32 @f(i32 %a) {\n"
        + "  %b = add i32 %a, 1\n"
        + "  %b = add i32 %a, 2\n"
        + "  ret i32 %b\n"
        + "}\n");
    assertTrue(e.getMessage(), e.getMessage().contains("redefinition of %b"));
  }

  @Test
  public void testPhiAfterNonPhiRejected() {
    IRParseException e = parseError("define i32 @f(i32 %a) {\n"
        + "entry:\n"
        + "  br label %next\n"
        + "next:\n"
        + "  %b = add i32 %a, 1\n"
        + "  %p = phi i32 [ %a, %entry ]\n"
        + "  ret i32 %p\n"
        + "}\n");
    assertEquals(6, e.getErrors().get(0).getLine());
  }
}

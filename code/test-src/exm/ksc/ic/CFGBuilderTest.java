package exm.ksc.ic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.KernelLexer;
import exm.ksc.ast.KernelParser;
import exm.ksc.ast.NodeKind;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.KSCRuntimeError;
import exm.ksc.common.exceptions.UserException;

public class CFGBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/CFGBuilderTest.ksc.log", true);
  }

  private static FunctionDecl function(String src) throws UserException {
    KernelAST decl = new KernelParser(KernelLexer.lex(src)).parse()
                                            .getDeclarations().get(0);
    return (FunctionDecl)decl;
  }

  private static BasicBlock findBlock(List<BasicBlock> blocks, String label) {
    for (BasicBlock b: blocks) {
      if (b.getLabel().equals(label)) {
        return b;
      }
    }
    return null;
  }

  @Test
  public void testStraightLine() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(
        function("void f() { int a = 1; a = a + 1; }").getBody());
    assertEquals("entry", entry.getLabel());
    assertEquals(2, entry.getStatements().size());
    assertTrue(entry.successors().isEmpty());
    assertEquals(1, builder.getBlocks().size());
  }

  @Test
  public void testIfElse() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "int f(int x) { int y = 0; if (x) { y = 1; } else { y = 2; } " +
        "y = y + 1; return y; }").getBody());

    BasicBlock cond = entry.getNext();
    assertEquals("cond", cond.getLabel());
    assertTrue(cond.isConditional());
    assertEquals(NodeKind.VARIABLE, cond.getCondition().kind());
    assertEquals(1, cond.getTrueBranch().getStatements().size());

    // Code after the if continues in the else branch
    BasicBlock elseBlock = cond.getFalseBranch();
    assertEquals(2, elseBlock.getStatements().size());
    assertNull(findBlock(builder.getBlocks(), "merge"));
  }

  @Test
  public void testIfWithoutElse() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "int f(int x) { if (x) { x = 1; } return x; }").getBody());

    BasicBlock cond = entry.getNext();
    BasicBlock merge = cond.getFalseBranch();
    assertEquals("merge", merge.getLabel());
    assertTrue(merge.getStatements().isEmpty());
    assertSame(merge, cond.getTrueBranch().getNext());

    BasicBlock ret = merge.getNext();
    assertTrue(ret.isExit());
    assertEquals(NodeKind.RETURN, ret.getStatements().get(0).kind());
  }

  @Test
  public void testWhileLoop() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "void f(int n) { int b = 0; while (n) { n = n - 1; } b = 1; }")
        .getBody());

    BasicBlock header = entry.getNext();
    assertEquals("loop_header", header.getLabel());
    assertTrue(header.isLoopHeader());
    assertTrue(header.isConditional());

    BasicBlock body = header.getTrueBranch();
    assertSame("Back edge", header, body.getNext());

    BasicBlock exit = header.getFalseBranch();
    assertEquals("loop_exit", exit.getLabel());
    assertEquals(1, exit.getStatements().size());
    assertEquals(NodeKind.EXPRESSION_STMT,
                 exit.getStatements().get(0).kind());
  }

  @Test
  public void testForLoop() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "void f() { int s = 0; for (int i = 0; i < 3; i++) { s += i; } }")
        .getBody());

    // Declaration and loop init both stay in the entry block
    assertEquals(2, entry.getStatements().size());
    BasicBlock header = entry.getNext();
    assertTrue(header.isLoopHeader());
    assertEquals(NodeKind.BINARY_OP, header.getCondition().kind());

    BasicBlock body = header.getTrueBranch();
    List<KernelAST> stmts = body.getStatements();
    assertEquals(2, stmts.size());
    assertEquals(NodeKind.UNARY_OP, stmts.get(1).kind());
    assertSame(header, body.getNext());
  }

  @Test
  public void testDoWhile() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "void f(int n) { do { n--; } while (n > 0); }").getBody());

    BasicBlock body = entry.getNext();
    assertEquals(1, body.getStatements().size());
    BasicBlock header = body.getNext();
    assertTrue(header.isLoopHeader());
    assertSame(body, header.getTrueBranch());
    assertEquals("loop_exit", header.getFalseBranch().getLabel());
  }

  @Test
  public void testReturnStartsUnreachableBlock() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function(
        "int f() { return 1; int dead = 2; }").getBody());

    BasicBlock ret = entry.getNext();
    assertEquals("return", ret.getLabel());
    assertTrue(ret.isExit());
    assertTrue(ret.successors().isEmpty());

    BasicBlock unreachable = findBlock(builder.getBlocks(), "unreachable");
    assertEquals(1, unreachable.getStatements().size());
    for (BasicBlock b: builder.getBlocks()) {
      assertFalse(b.successors().contains(unreachable));
    }
  }

  @Test
  public void testFunctionEntry() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    BasicBlock entry = builder.build(function("int g() { return 0; }"));
    assertEquals("func_g", entry.getLabel());
    assertEquals("entry", entry.getNext().getLabel());
    assertEquals("func_g#0", entry.toString());
  }

  @Test
  public void testBlocksResetPerBuild() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    builder.build(function("int g(int x) { while (x) { x--; } return x; }"));
    int first = builder.getBlocks().size();
    builder.build(function("void h() { }").getBody());
    assertTrue(first > 1);
    assertEquals(1, builder.getBlocks().size());
  }

  @Test
  public void testRejectsDeclaration() throws UserException {
    KernelAST decl = new KernelParser(KernelLexer.lex("int x = 1;"))
                                .parse().getDeclarations().get(0);
    exception.expect(KSCRuntimeError.class);
    new CFGBuilder().build(decl);
  }

  @Test
  public void testRejectsPrototype() throws UserException {
    FunctionDecl proto = function("int f(int a);");
    exception.expect(KSCRuntimeError.class);
    new CFGBuilder().build(proto);
  }

  @Test
  public void testPrinter() throws UserException {
    CFGBuilder builder = new CFGBuilder();
    builder.build(function("void f(int n) { while (n) { n--; } }"));
    String text = CFGPrinter.render(builder.getBlocks());
    assertTrue(text, text.contains("loop_header"));
    assertTrue(text, text.contains("[loop header]"));
    assertTrue(text, text.contains("condition:"));
    assertTrue(text, text.contains("true -> "));
  }
}

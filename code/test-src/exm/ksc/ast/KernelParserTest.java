package exm.ksc.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.math.BigInteger;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ksc.ast.tree.Declarations.ArrayDeclaration;
import exm.ksc.ast.tree.Declarations.Define;
import exm.ksc.ast.tree.Declarations.EnumDecl;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.ast.tree.Declarations.Include;
import exm.ksc.ast.tree.Declarations.StructDecl;
import exm.ksc.ast.tree.Declarations.Typedef;
import exm.ksc.ast.tree.Declarations.UnionDecl;
import exm.ksc.ast.tree.Declarations.VariableDecl;
import exm.ksc.ast.tree.Expressions.ArrayAccess;
import exm.ksc.ast.tree.Expressions.Assignment;
import exm.ksc.ast.tree.Expressions.BinaryOp;
import exm.ksc.ast.tree.Expressions.MemberAccess;
import exm.ksc.ast.tree.Expressions.SizeOf;
import exm.ksc.ast.tree.Expressions.Ternary;
import exm.ksc.ast.tree.Expressions.UnaryOp;
import exm.ksc.ast.tree.Expressions.Variable;
import exm.ksc.ast.tree.Literals.NullLiteral;
import exm.ksc.ast.tree.Literals.NumberLiteral;
import exm.ksc.ast.tree.Program;
import exm.ksc.ast.tree.Statements.Block;
import exm.ksc.ast.tree.Statements.ExpressionStatement;
import exm.ksc.ast.tree.Statements.For;
import exm.ksc.ast.tree.Statements.If;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.InvalidSyntaxException;
import exm.ksc.common.exceptions.LexerException;

public class KernelParserTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/KernelParserTest.ksc.log", true);
  }

  private static KernelParser parser(String src) throws LexerException {
    return new KernelParser(KernelLexer.lex(src));
  }

  private static Program parse(String src) throws LexerException {
    return parser(src).parse();
  }

  private static KernelAST firstExpr(String src) throws LexerException {
    Program prog = parse(src);
    assertEquals(1, prog.getDeclarations().size());
    return ((ExpressionStatement)prog.getDeclarations().get(0))
                                                          .getExpression();
  }

  @Test
  public void testPrecedence() throws LexerException {
    KernelAST expr = firstExpr("1 + 2 * 3;");
    BinaryOp plus = (BinaryOp)expr;
    assertEquals("+", plus.getOp());
    assertEquals(1L, ((NumberLiteral)plus.getLeft()).getValue());
    BinaryOp times = (BinaryOp)plus.getRight();
    assertEquals("*", times.getOp());
    assertEquals(2L, ((NumberLiteral)times.getLeft()).getValue());
    assertEquals(3L, ((NumberLiteral)times.getRight()).getValue());
  }

  @Test
  public void testLeftAssociative() throws LexerException {
    BinaryOp minus = (BinaryOp)firstExpr("a - b - c;");
    assertEquals("-", minus.getOp());
    assertTrue(minus.getLeft() instanceof BinaryOp);
    assertEquals("c", ((Variable)minus.getRight()).getName());
  }

  @Test
  public void testAssignmentRightAssociative() throws LexerException {
    Assignment outer = (Assignment)firstExpr("a = b = 1;");
    assertEquals("a", ((Variable)outer.getLeft()).getName());
    assertEquals("=", outer.getOp());
    Assignment inner = (Assignment)outer.getRight();
    assertEquals("b", ((Variable)inner.getLeft()).getName());
    assertEquals(1L, ((NumberLiteral)inner.getRight()).getValue());
  }

  @Test
  public void testCompoundAssignment() throws LexerException {
    Assignment assign = (Assignment)firstExpr("x <<= 2;");
    assertEquals("<<=", assign.getOp());
    assertTrue(assign.isCompound());
  }

  @Test
  public void testTernaryRightAssociative() throws LexerException {
    Assignment assign = (Assignment)firstExpr("x = a ? b : c ? d : e;");
    Ternary t = (Ternary)assign.getRight();
    assertEquals("a", ((Variable)t.getCondition()).getName());
    assertTrue(t.getFalseExpr() instanceof Ternary);
  }

  @Test
  public void testPostfixChain() throws LexerException {
    UnaryOp inc = (UnaryOp)firstExpr("p->next.value[2]++;");
    assertTrue(inc.isPostfix());
    assertEquals("++", inc.getOp());
    ArrayAccess index = (ArrayAccess)inc.getOperand();
    MemberAccess value = (MemberAccess)index.getArray();
    assertFalse(value.isArrow());
    assertEquals("value", value.getMember());
    MemberAccess next = (MemberAccess)value.getObject();
    assertTrue(next.isArrow());
    assertEquals("p", ((Variable)next.getObject()).getName());
  }

  @Test
  public void testUnaryOperators() throws LexerException {
    UnaryOp neg = (UnaryOp)firstExpr("-*p;");
    assertEquals("-", neg.getOp());
    assertFalse(neg.isPostfix());
    assertEquals("*", ((UnaryOp)neg.getOperand()).getOp());
  }

  @Test
  public void testSizeOf() throws LexerException {
    SizeOf ofType = (SizeOf)firstExpr("sizeof(unsigned long*);");
    assertTrue(ofType.isType());
    assertEquals("unsigned long*", ofType.getType().toString());

    SizeOf ofExpr = (SizeOf)firstExpr("sizeof(a + 1);");
    assertFalse(ofExpr.isType());
    assertTrue(ofExpr.getExpression() instanceof BinaryOp);

    SizeOf bare = (SizeOf)firstExpr("sizeof a;");
    assertEquals("a", ((Variable)bare.getExpression()).getName());
  }

  @Test
  public void testTopLevelCount() throws LexerException {
    Program prog = parse(
        "#include <stdio.h>\n" +
        "#define MAX 10\n" +
        "#pragma once\n" +
        "int g = 1;\n" +
        "int add(int a, int b) { return a + b; }\n" +
        "struct P { int x; int y; };\n" +
        "enum C { R, G = 5, B };\n" +
        "typedef int myint;\n" +
        "add(1, 2);\n");
    List<KernelAST> decls = prog.getDeclarations();
    assertEquals(8, decls.size());

    Include inc = (Include)decls.get(0);
    assertEquals("stdio.h", inc.getFilename());
    assertTrue(inc.isSystem());

    Define def = (Define)decls.get(1);
    assertEquals("MAX", def.getName());
    assertEquals(10L, ((NumberLiteral)def.getValue()).getValue());

    assertTrue(decls.get(2) instanceof VariableDecl);
    assertTrue(decls.get(3) instanceof FunctionDecl);
    assertTrue(decls.get(4) instanceof StructDecl);
    assertTrue(decls.get(5) instanceof EnumDecl);
    assertTrue(decls.get(6) instanceof Typedef);
    assertTrue(decls.get(7) instanceof ExpressionStatement);
  }

  @Test
  public void testDefineWithoutValue() throws LexerException {
    Program prog = parse("#define DEBUG\n#include \"local.h\"\n");
    Define def = (Define)prog.getDeclarations().get(0);
    assertNull(def.getValue());
    Include inc = (Include)prog.getDeclarations().get(1);
    assertEquals("local.h", inc.getFilename());
    assertFalse(inc.isSystem());
  }

  @Test
  public void testFunctionForms() throws LexerException {
    Program prog = parse("int f(void);\nvoid g();\n" +
                         "static char *h(int, char **argv) { return 0; }");
    FunctionDecl f = (FunctionDecl)prog.getDeclarations().get(0);
    assertTrue(f.isPrototype());
    assertEquals(0, f.getParams().size());

    FunctionDecl g = (FunctionDecl)prog.getDeclarations().get(1);
    assertTrue(g.getReturnType().isVoid());
    assertEquals(0, g.getParams().size());

    FunctionDecl h = (FunctionDecl)prog.getDeclarations().get(2);
    assertEquals("char*", h.getReturnType().toString());
    assertTrue(h.getModifiers().contains("static"));
    assertEquals(2, h.getParams().size());
    assertNull(h.getParams().get(0).getName());
    assertEquals("argv", h.getParams().get(1).getName());
    assertEquals(2, h.getParams().get(1).getType().pointerDepth());
    assertEquals(1, h.getBody().getStatements().size());
  }

  @Test
  public void testArrayDeclaration() throws LexerException {
    Program prog = parse("int arr[3] = {1, 2, 3,};\nchar buf[];");
    ArrayDeclaration arr = (ArrayDeclaration)prog.getDeclarations().get(0);
    assertEquals("arr", arr.getName());
    assertEquals(3L, ((NumberLiteral)arr.getSize()).getValue());
    assertTrue(arr.hasInitializer());
    assertEquals(3, arr.getInitializers().size());

    ArrayDeclaration buf = (ArrayDeclaration)prog.getDeclarations().get(1);
    assertNull(buf.getSize());
    assertFalse(buf.hasInitializer());
  }

  @Test
  public void testConstAndNull() throws LexerException {
    Program prog = parse("const int K = 3;\nint *p = NULL;");
    VariableDecl k = (VariableDecl)prog.getDeclarations().get(0);
    assertTrue(k.isConst());
    VariableDecl p = (VariableDecl)prog.getDeclarations().get(1);
    assertEquals(1, p.getType().pointerDepth());
    assertTrue(p.getValue() instanceof NullLiteral);
  }

  @Test
  public void testEnumValues() throws LexerException {
    EnumDecl colors = (EnumDecl)parse("enum C { R, G = 5, B, };")
                                          .getDeclarations().get(0);
    assertEquals("C", colors.getName());
    assertEquals(Long.valueOf(0), colors.getValues().get("R"));
    assertEquals(Long.valueOf(5), colors.getValues().get("G"));
    assertEquals(Long.valueOf(6), colors.getValues().get("B"));
  }

  @Test
  public void testEnumFloatingInitializer() throws LexerException {
    EnumDecl e = (EnumDecl)parse("enum F { A = 1.5, B, C = 7, D };")
                                          .getDeclarations().get(0);
    assertEquals(Double.valueOf(1.5), e.getValues().get("A"));
    assertEquals(Double.valueOf(2.5), e.getValues().get("B"));
    assertEquals(Long.valueOf(7), e.getValues().get("C"));
    assertEquals(Long.valueOf(8), e.getValues().get("D"));
  }

  @Test
  public void testEnumBeyondLongRange() throws LexerException {
    EnumDecl e = (EnumDecl)parse(
        "enum { MAX = 9223372036854775807, OVER };").getDeclarations().get(0);
    assertEquals(Long.valueOf(Long.MAX_VALUE), e.getValues().get("MAX"));
    assertEquals(new BigInteger("9223372036854775808"),
                 e.getValues().get("OVER"));
  }

  @Test
  public void testEnumNonLiteralInitializer() throws LexerException {
    EnumDecl e = (EnumDecl)parse("enum { A = 2, B = A + 1, C };")
                                          .getDeclarations().get(0);
    assertEquals("", e.getName());
    assertEquals(Long.valueOf(2), e.getValues().get("A"));
    // Not evaluated: counting continues from A
    assertEquals(Long.valueOf(3), e.getValues().get("B"));
    assertEquals(Long.valueOf(4), e.getValues().get("C"));
    assertTrue(e.getInitializer("B") instanceof BinaryOp);
    assertNull(e.getInitializer("C"));
  }

  @Test
  public void testTypedefKeepsFirstAlias() throws LexerException {
    Typedef td = (Typedef)parse("typedef int *IntPtr, Arr[4];")
                                          .getDeclarations().get(0);
    assertEquals("IntPtr", td.getAlias());
    assertEquals("int*", td.getType().toString());
  }

  @Test
  public void testStructAndUnionFields() throws LexerException {
    Program prog = parse("struct Node { int value; Node *next; char tag[8]; };" +
                         "union U { int i; float f; };");
    StructDecl node = (StructDecl)prog.getDeclarations().get(0);
    assertEquals(3, node.getFields().size());
    assertTrue(node.getFields().get(2) instanceof ArrayDeclaration);
    UnionDecl u = (UnionDecl)prog.getDeclarations().get(1);
    assertTrue(u.isUnion());
    assertEquals(2, u.getFields().size());
  }

  @Test
  public void testStatements() throws LexerException {
    FunctionDecl f = (FunctionDecl)parse(
        "void f(int n) {\n" +
        "  for (int i = 0; i < n; i++) { }\n" +
        "  while (n) n--;\n" +
        "  do { n++; } while (n < 3);\n" +
        "  if (n) { ; } else return;\n" +
        "  { int inner; }\n" +
        "  break; continue;\n" +
        "}").getDeclarations().get(0);
    List<KernelAST> stmts = f.getBody().getStatements();
    assertEquals(7, stmts.size());

    For loop = (For)stmts.get(0);
    assertTrue(loop.getInit() instanceof VariableDecl);
    assertEquals("<", ((BinaryOp)loop.getCondition()).getOp());
    assertTrue(((UnaryOp)loop.getIncrement()).isPostfix());

    assertEquals(NodeKind.WHILE, stmts.get(1).kind());
    assertEquals(NodeKind.DO_WHILE, stmts.get(2).kind());
    If ifStmt = (If)stmts.get(3);
    assertTrue(ifStmt.hasElse());
    assertEquals(NodeKind.RETURN, ifStmt.getElse().kind());
    assertTrue(stmts.get(4) instanceof Block);
    assertEquals(NodeKind.BREAK, stmts.get(5).kind());
    assertEquals(NodeKind.CONTINUE, stmts.get(6).kind());
  }

  @Test
  public void testForWithExpressionInit() throws LexerException {
    FunctionDecl f = (FunctionDecl)parse(
        "void f() { for (i = 0; ; ) i++; }").getDeclarations().get(0);
    For loop = (For)f.getBody().getStatements().get(0);
    assertTrue(loop.getInit() instanceof Assignment);
    assertNull(loop.getCondition());
    assertNull(loop.getIncrement());
  }

  @Test
  public void testRecoverySkipsBadDeclaration() throws LexerException {
    KernelParser parser = parser("int x = ;\nint y;");
    Program prog = parser.parse();
    assertEquals(1, prog.getDeclarations().size());
    assertEquals("y", ((VariableDecl)prog.getDeclarations().get(0)).getName());
    assertFalse(parser.getRecoveredErrors().isEmpty());
  }

  @Test
  public void testDebugPrintsRecoveredErrors()
      throws LexerException, UnsupportedEncodingException {
    String src = "int x = ;\nint y;\n) int z;";
    KernelParser quiet = parser(src);
    Program expected = quiet.parse();

    KernelParser noisy = parser(src);
    noisy.setDebug(true);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream oldErr = System.err;
    System.setErr(new PrintStream(bytes, true, "UTF-8"));
    Program prog;
    try {
      prog = noisy.parse();
    } finally {
      System.setErr(oldErr);
    }

    assertEquals(expected.getDeclarations().size(),
                 prog.getDeclarations().size());
    assertEquals(expected.printTree(), prog.printTree());
    List<InvalidSyntaxException> errors = noisy.getRecoveredErrors();
    assertEquals(quiet.getRecoveredErrors().size(), errors.size());
    assertTrue(errors.size() >= 2);

    int printed = 0;
    for (String line: new String(bytes.toByteArray(), "UTF-8").split("\\R")) {
      if (line.startsWith("ParseError: ")) {
        assertEquals("ParseError: " + errors.get(printed).getMessage(), line);
        printed++;
      }
    }
    assertEquals(errors.size(), printed);
  }

  @Test
  public void testEndOfInput() throws LexerException {
    KernelParser parser = parser("int main() { return 0;");
    Program prog = parser.parse();
    InvalidSyntaxException first = parser.getRecoveredErrors().get(0);
    assertTrue(first.isAtEndOfInput());
    assertTrue(first.getDiagnostic().startsWith("Unexpected end of input"));
    assertEquals(1, first.getLine());
    assertEquals(23, first.getColumn());
    assertFalse(prog.getDeclarations().get(0) instanceof FunctionDecl);
  }

  @Test
  public void testNestedFunctionRejected() throws LexerException {
    KernelParser parser = parser("void f() { int g() { return 1; } }");
    parser.parse();
    InvalidSyntaxException first = parser.getRecoveredErrors().get(0);
    assertEquals("Function definitions are only allowed at top level",
                 first.getDiagnostic());
    assertEquals(12, first.getColumn());
  }

  @Test
  public void testPrintTree() throws LexerException {
    String[] lines = parse("int x = 1 + 2;").printTree().split("\\R");
    assertEquals(5, lines.length);
    assertEquals("PROGRAM (1 declarations)", lines[0]);
    assertEquals("  VARIABLE_DECL int x", lines[1]);
    assertEquals("    BINARY_OP +", lines[2]);
    assertEquals("      NUMBER 1", lines[3]);
    assertEquals("      NUMBER 2", lines[4]);
  }
}

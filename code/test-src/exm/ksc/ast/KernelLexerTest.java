package exm.ksc.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.ksc.ast.Token.Kind;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.DiagnosticKind;
import exm.ksc.common.exceptions.LexerException;

public class KernelLexerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/KernelLexerTest.ksc.log", true);
  }

  @Test
  public void testKeywordsCaseFolded() throws LexerException {
    List<Token> toks = KernelLexer.lex("INT Foo While");
    assertEquals(3, toks.size());
    assertTrue(toks.get(0).is(Kind.KEYWORD, "int"));
    assertEquals("INT", toks.get(0).text());
    assertTrue("Identifiers keep their case", toks.get(1).is(Kind.ID, "Foo"));
    assertTrue(toks.get(2).is(Kind.KEYWORD, "while"));
  }

  @Test
  public void testNullIsKeyword() throws LexerException {
    Token tok = KernelLexer.lex("NULL").get(0);
    assertTrue(tok.is(Kind.KEYWORD, "null"));
  }

  @Test
  public void testNumbers() throws LexerException {
    List<Token> toks = KernelLexer.lex("0x1F 017 3.5 42 .5 0");
    assertEquals(Long.valueOf(31), toks.get(0).numberValue());
    assertEquals(Long.valueOf(15), toks.get(1).numberValue());
    assertEquals(Double.valueOf(3.5), toks.get(2).numberValue());
    assertEquals(Long.valueOf(42), toks.get(3).numberValue());
    assertEquals(Double.valueOf(0.5), toks.get(4).numberValue());
    assertEquals(Long.valueOf(0), toks.get(5).numberValue());
    for (Token tok: toks) {
      assertTrue(tok.is(Kind.NUMBER));
    }
  }

  @Test
  public void testIntegersBeyondLong() throws LexerException {
    List<Token> toks = KernelLexer.lex(
        "18446744073709551615 0xFFFFFFFFFFFFFFFFFF 9223372036854775807");
    assertEquals(new BigInteger("18446744073709551615"),
                 toks.get(0).numberValue());
    assertEquals(new BigInteger("FFFFFFFFFFFFFFFFFF", 16),
                 toks.get(1).numberValue());
    assertEquals(Long.valueOf(Long.MAX_VALUE), toks.get(2).numberValue());
  }

  @Test
  public void testMaximalMunch() throws LexerException {
    List<Token> toks = KernelLexer.lex("a <<= b >> c->d++");
    assertEquals(Arrays.asList("a", "<<=", "b", ">>", "c", "->", "d", "++"),
                 texts(toks));
    assertTrue(toks.get(1).is(Kind.OPERATOR));
    assertTrue(toks.get(5).is(Kind.OPERATOR));
  }

  @Test
  public void testCommentsDropped() throws LexerException {
    List<Token> toks = KernelLexer.lex("a // one\n/* two\nlines */ b / c");
    assertEquals(Arrays.asList("a", "b", "/", "c"), texts(toks));
    Token b = toks.get(1);
    assertEquals(3, b.line());
    assertEquals(10, b.column());
  }

  @Test
  public void testUnterminatedComment() throws LexerException {
    List<Token> toks = KernelLexer.lex("a /* never closed\n b c");
    assertEquals(1, toks.size());
  }

  @Test
  public void testPositions() throws LexerException {
    List<Token> toks = KernelLexer.lex("int x;\n  y = 2;");
    Token y = toks.get(3);
    assertEquals("y", y.text());
    assertEquals(2, y.line());
    assertEquals(3, y.column());
  }

  @Test
  public void testPreprocessorTokens() throws LexerException {
    List<Token> toks = KernelLexer.lex("#include <stdio.h>");
    assertTrue(toks.get(0).is(Kind.PREPROC, "#include"));
    assertEquals(Arrays.asList("#include", "<", "stdio", ".", "h", ">"),
                 texts(toks));
  }

  @Test
  public void testStringEscapes() throws LexerException {
    Token tok = KernelLexer.lex("\"a\\tb\\qc\\\"\"").get(0);
    assertTrue(tok.is(Kind.STRING));
    assertEquals("Unknown escapes are kept", "a\tb\\qc\"",
                 tok.stringValue());
  }

  @Test
  public void testCharEscapes() throws LexerException {
    assertEquals("\0", KernelLexer.lex("'\\0'").get(0).stringValue());
    assertEquals("\n", KernelLexer.lex("'\\n'").get(0).stringValue());
    assertEquals("'", KernelLexer.lex("'\\''").get(0).stringValue());
  }

  @Test
  public void testEscapeRoundTrip() throws LexerException {
    List<String> values = Arrays.asList("plain", "tab\there", "quote\"d",
        "back\\slash", "new\nline", "odd \\q escape", "it's", "nul\0");
    for (String value: values) {
      Token tok = KernelLexer.lex(Escapes.quoteString(value)).get(0);
      assertEquals(value, tok.stringValue());
    }

    List<String> chars = Arrays.asList("a", "\n", "\t", "'", "\"", "\\",
                                       "\0");
    for (String value: chars) {
      Token tok = KernelLexer.lex(Escapes.quoteChar(value)).get(0);
      assertTrue(tok.is(Kind.CHAR));
      assertEquals(value, tok.stringValue());
    }
  }

  @Test
  public void testUnrecognizedCharacter() {
    try {
      KernelLexer.lex("int x;\nint @y;", "test.ks");
      fail("Expected lexer error");
    } catch (LexerException e) {
      assertEquals('@', e.getOffendingChar());
      assertEquals(2, e.getLine());
      assertEquals(5, e.getColumn());
      assertEquals("test.ks", e.getFile());
      assertEquals(DiagnosticKind.LEX, e.kind());
    }
  }

  private static List<String> texts(List<Token> toks) {
    String[] result = new String[toks.size()];
    for (int i = 0; i < toks.size(); i++) {
      result[i] = toks.get(i).text();
    }
    return Arrays.asList(result);
  }
}

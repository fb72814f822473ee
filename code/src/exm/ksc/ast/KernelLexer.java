/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ksc.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.LexerException;

/**
 * Converts KernelScript source text to tokens.
 *
 * At each position the first alternative of {@link #TOKEN_PATTERN} that
 * matches wins.  Whitespace, newlines and comments are dropped.
 */
public class KernelLexer {

  public static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
      "int", "float", "double", "char", "void", "bool",
      "struct", "union", "enum", "typedef",
      "if", "else", "while", "for", "do", "switch", "case", "default",
      "break", "continue", "return", "goto",
      "const", "static", "extern", "register", "volatile",
      "sizeof", "typeof", "alignof",
      "true", "false", "null",
      "signed", "unsigned", "short", "long");

  private static final Pattern TOKEN_PATTERN = Pattern.compile(
      "(?<PREPROC>#[a-zA-Z_][a-zA-Z0-9_]*)" +
      "|(?<HEX>0[xX][0-9a-fA-F]+)" +
      "|(?<OCT>0[0-7]+)" +
      "|(?<FLOAT>\\d+\\.\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?)" +
      "|(?<INTEGER>\\d+)" +
      "|(?<STRING>\"(?:[^\"\\\\]|\\\\.)*\")" +
      "|(?<CHAR>'[^'\\\\]*(?:\\\\.[^'\\\\]*)*')" +
      "|(?<ID>[a-zA-Z_][a-zA-Z0-9_]*)" +
      // Comments must be tried before '/' is taken as an operator
      "|(?<COMMENT>//[^\\n]*|/\\*.*?\\*/|/\\*.*)" +
      "|(?<OPERATOR><<=|>>=|->|\\+\\+|--|<<|>>|<=|>=|==|!=|&&|\\|\\|" +
          "|\\+=|-=|\\*=|/=|%=|&=|\\|=|\\^=" +
          "|[-+*/%=&|^~!<>?:.,;()\\[\\]{}])" +
      "|(?<WHITESPACE>[ \\t\\r\\f]+)" +
      "|(?<NEWLINE>\\n)" +
      "|(?<MISMATCH>.)",
      Pattern.DOTALL);

  private static final Logger logger = Logging.getKSCLogger();

  /**
   * Tokenize a complete source text
   * @param text source
   * @param filename used only in diagnostics, may be null
   * @return all tokens in source order, without an EOF marker
   * @throws LexerException on the first unrecognized character
   */
  public static List<Token> lex(String text, String filename)
      throws LexerException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Matcher m = TOKEN_PATTERN.matcher(text);
    int pos = 0;
    int line = 1;
    int lineStart = 0;
    int count = 0;

    while (pos < text.length()) {
      m.region(pos, text.length());
      if (!m.lookingAt()) {
        // MISMATCH matches any single character
        throw new LexerException(filename, line, pos - lineStart + 1,
                                 text.charAt(pos));
      }
      String lexeme = m.group();
      int column = pos - lineStart + 1;

      Token tok = makeToken(m, lexeme, filename, line, column);
      if (tok != null) {
        tokens.add(tok);
        count++;
      }

      int lastNewline = lexeme.lastIndexOf('\n');
      if (lastNewline >= 0) {
        for (int i = 0; i < lexeme.length(); i++) {
          if (lexeme.charAt(i) == '\n') {
            line++;
          }
        }
        lineStart = pos + lastNewline + 1;
      }
      pos = m.end();
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Lexed " + count + " tokens from " +
                   (filename == null ? "<input>" : filename));
    }
    return tokens.build();
  }

  public static List<Token> lex(String text) throws LexerException {
    return lex(text, null);
  }

  /**
   * @return token for the matched alternative, or null if it is dropped
   */
  private static Token makeToken(Matcher m, String lexeme, String filename,
      int line, int column) throws LexerException {
    if (m.group("PREPROC") != null) {
      return new Token(Token.Kind.PREPROC, lexeme, lexeme, line, column);
    } else if (m.group("HEX") != null) {
      return number(parseInteger(lexeme.substring(2), 16), lexeme,
                    line, column);
    } else if (m.group("OCT") != null) {
      return number(parseInteger(lexeme.substring(1), 8), lexeme,
                    line, column);
    } else if (m.group("FLOAT") != null) {
      return number(Double.valueOf(lexeme), lexeme, line, column);
    } else if (m.group("INTEGER") != null) {
      return number(parseInteger(lexeme, 10),
                    lexeme, line, column);
    } else if (m.group("STRING") != null) {
      String body = lexeme.substring(1, lexeme.length() - 1);
      return new Token(Token.Kind.STRING, Escapes.decodeString(body), lexeme,
                       line, column);
    } else if (m.group("CHAR") != null) {
      String body = lexeme.substring(1, lexeme.length() - 1);
      return new Token(Token.Kind.CHAR, Escapes.decodeChar(body), lexeme,
                       line, column);
    } else if (m.group("ID") != null) {
      String folded = lexeme.toLowerCase(Locale.ROOT);
      if (KEYWORDS.contains(folded)) {
        return new Token(Token.Kind.KEYWORD, folded, lexeme, line, column);
      }
      return new Token(Token.Kind.ID, lexeme, lexeme, line, column);
    } else if (m.group("OPERATOR") != null) {
      return new Token(Token.Kind.OPERATOR, lexeme, lexeme, line, column);
    } else if (m.group("MISMATCH") != null) {
      throw new LexerException(filename, line, column, lexeme.charAt(0));
    }
    // Whitespace, newline or comment
    return null;
  }

  private static Token number(Number value, String lexeme, int line,
                              int column) {
    return new Token(Token.Kind.NUMBER, value, lexeme, line, column);
  }

  /**
   * @return Long, or BigInteger if the value does not fit in a long
   */
  private static Number parseInteger(String digits, int radix) {
    BigInteger val = new BigInteger(digits, radix);
    if (val.bitLength() > 63) {
      return val;
    }
    return val.longValue();
  }
}

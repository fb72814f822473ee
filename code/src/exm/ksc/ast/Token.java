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

/**
 * Immutable lexical token.
 *
 * The value is already converted: a Long or Double for NUMBER tokens,
 * the decoded text for STRING and CHAR tokens, the lowercase spelling
 * for KEYWORD tokens and the source spelling otherwise.  The original
 * lexeme is kept in text.
 */
public class Token {

  public static enum Kind {
    PREPROC,
    NUMBER,
    STRING,
    CHAR,
    ID,
    KEYWORD,
    OPERATOR,
    EOF,
  }

  private final Kind kind;
  private final Object value;
  private final String text;
  private final int line;
  private final int column;

  public Token(Kind kind, Object value, String text, int line, int column) {
    this.kind = kind;
    this.value = value;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  /**
   * End of input marker, synthesized by consumers past the last token
   */
  public static Token eof(int line, int column) {
    return new Token(Kind.EOF, "", "", line, column);
  }

  public Kind kind() {
    return kind;
  }

  public Object value() {
    return value;
  }

  /**
   * @return value as a string: spelling, decoded literal text, or the
   *        printed form of a number
   */
  public String stringValue() {
    return String.valueOf(value);
  }

  public Number numberValue() {
    assert(kind == Kind.NUMBER) : this;
    return (Number)value;
  }

  public String text() {
    return text;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  public boolean is(Kind kind, String val) {
    return this.kind == kind && value.equals(val);
  }

  @Override
  public String toString() {
    return kind + " '" + text + "' @" + line + ":" + column;
  }
}

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

package exm.ksc.common.exceptions;

/**
 * Source text contained a character that starts no token.
 */
public class LexerException extends UserException {

  private final char offending;

  public LexerException(String file, int line, int col, char offending) {
    super(file, line, col, "Unrecognized character " + describe(offending));
    this.offending = offending;
  }

  public char getOffendingChar() {
    return offending;
  }

  @Override
  public DiagnosticKind kind() {
    return DiagnosticKind.LEX;
  }

  private static String describe(char c) {
    if (Character.isISOControl(c)) {
      return String.format("'\\u%04x'", (int)c);
    }
    return "'" + c + "'";
  }

  private static final long serialVersionUID = 1L;
}

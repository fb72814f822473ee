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
 * Token sequence does not match the grammar.
 */
public class InvalidSyntaxException extends UserException {

  private final boolean atEndOfInput;

  public InvalidSyntaxException(int line, int col, String message) {
    this(line, col, message, false);
  }

  public InvalidSyntaxException(int line, int col, String message,
                                boolean atEndOfInput) {
    super(line, col, message);
    this.atEndOfInput = atEndOfInput;
  }

  /**
   * @return true if the input ran out in the middle of a construct
   */
  public boolean isAtEndOfInput() {
    return atEndOfInput;
  }

  @Override
  public DiagnosticKind kind() {
    return DiagnosticKind.PARSE;
  }

  private static final long serialVersionUID = 1L;
}

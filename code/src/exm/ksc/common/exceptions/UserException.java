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
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public abstract class UserException
extends Exception
{
  private final String diagnostic;
  private final String file;
  private final int line;
  private final int col;

  public UserException(String file, int line, int col, String message) {
    super(buildMessage(file, line, col, message));
    this.diagnostic = message;
    this.file = file;
    this.line = line;
    this.col = col;
  }

  public UserException(int line, int col, String message) {
    this(null, line, col, message);
  }

  public UserException(String message) {
    this(null, 0, 0, message);
  }

  /**
   * @return which stage of the front end rejected the input
   */
  public abstract DiagnosticKind kind();

  /**
   * @return the message without location information
   */
  public String getDiagnostic() {
    return diagnostic;
  }

  /**
   * @return source file name, or null if unknown
   */
  public String getFile() {
    return file;
  }

  /**
   * @return 1-based line, 0 if unknown
   */
  public int getLine() {
    return line;
  }

  /**
   * @return 1-based column, 0 if unknown
   */
  public int getColumn() {
    return col;
  }

  public boolean hasLocation() {
    return line > 0;
  }

  private static String buildMessage(String file, int line, int col,
                                     String message) {
    if (line <= 0) {
      return file == null ? message : file + ": " + message;
    }
    String loc = (file == null ? "line " : file + ":") + line +
                 (col > 0 ? ":" + col : "");
    return loc + ": " + message;
  }

  private static final long serialVersionUID = 1L;
}

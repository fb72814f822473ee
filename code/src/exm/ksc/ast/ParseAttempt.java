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

import exm.ksc.common.exceptions.InvalidSyntaxException;

/**
 * Outcome of one speculative application of a grammar rule: either the
 * parsed result or the syntax error that stopped it.
 *
 * @param <T> result type of the rule
 */
public class ParseAttempt<T> {

  /**
   * A grammar rule that can be attempted.  Failures are raised as
   * exceptions and converted to a failed attempt by the caller.
   */
  public static interface Rule<T> {
    public T parse() throws InvalidSyntaxException;
  }

  private final T result;
  private final InvalidSyntaxException error;

  private ParseAttempt(T result, InvalidSyntaxException error) {
    this.result = result;
    this.error = error;
  }

  public static <T> ParseAttempt<T> success(T result) {
    return new ParseAttempt<T>(result, null);
  }

  public static <T> ParseAttempt<T> failure(InvalidSyntaxException error) {
    assert(error != null);
    return new ParseAttempt<T>(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @return result of a successful attempt, may be null if the rule
   *         produced no node
   */
  public T get() {
    assert(isSuccess()) : error;
    return result;
  }

  public InvalidSyntaxException getError() {
    return error;
  }

  /**
   * @return whichever failure occurred later in the source, since it is
   *        usually the most informative
   */
  public static InvalidSyntaxException furthest(InvalidSyntaxException a,
                                                InvalidSyntaxException b) {
    if (a == null) {
      return b;
    } else if (b == null) {
      return a;
    }
    if (b.getLine() > a.getLine() ||
        (b.getLine() == a.getLine() && b.getColumn() > a.getColumn())) {
      return b;
    }
    return a;
  }
}
